package notifier;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NotificationEventTest {

  private static final Instant CHECKED = Instant.parse("2026-10-19T11:30:00Z");

  @Test
  void acceptsMissingLastAvailableDate() {
    NotificationEvent event = new NotificationEvent(
        "active", "Berlin", "tr", "de", "tourism", "short-stay", null, 4, CHECKED);

    assertNull(event.lastAvailableDate());
    assertFalse(event.hasLastAvailableDate());
  }

  @Test
  void emptyLastAvailableDateIsNormalizedToAbsent() {
    NotificationEvent event = new NotificationEvent(
        "active", "Berlin", "tr", "de", "tourism", "short-stay", "", 4, CHECKED);

    assertNull(event.lastAvailableDate());
  }

  @Test
  void keepsLastAvailableDateVerbatim() {
    NotificationEvent event = new NotificationEvent(
        "active", "Berlin", "tr", "de", "tourism", "short-stay", "2026-11-02", 4, CHECKED);

    assertTrue(event.hasLastAvailableDate());
    assertEquals("2026-11-02", event.lastAvailableDate());
  }

  @Test
  void rejectsMissingRequiredFields() {
    NullPointerException ex = assertThrows(NullPointerException.class, () ->
        new NotificationEvent(null, "Berlin", "tr", "de", "tourism", "short-stay", null, 4, CHECKED));
    assertEquals("status", ex.getMessage());

    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", null, "tr", "de", "tourism", "short-stay", null, 4, CHECKED));
    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", "Berlin", null, "de", "tourism", "short-stay", null, 4, CHECKED));
    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", "Berlin", "tr", null, "tourism", "short-stay", null, 4, CHECKED));
    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", "Berlin", "tr", "de", null, "short-stay", null, 4, CHECKED));
    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", "Berlin", "tr", "de", "tourism", null, null, 4, CHECKED));
    assertThrows(NullPointerException.class, () ->
        new NotificationEvent("active", "Berlin", "tr", "de", "tourism", "short-stay", null, 4, null));
  }

  @Test
  void rejectsNegativeTrackingCount() {
    assertThrows(IllegalArgumentException.class, () ->
        new NotificationEvent("active", "Berlin", "tr", "de", "tourism", "short-stay", null, -1, CHECKED));
  }
}
