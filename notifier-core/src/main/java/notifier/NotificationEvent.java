package notifier;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only appointment availability record handed to the dispatcher by the upstream
 * producer.
 *
 * <p>All text fields are untrusted and are escaped before they reach the rendered
 * message. {@code lastAvailableDate} is the only optional field; an empty string is
 * normalized to {@code null}.
 *
 * @param status            appointment status label
 * @param center            application center (location) label
 * @param countryCode       applicant country code
 * @param missionCode       destination mission code
 * @param visaCategory      visa category label
 * @param visaType          visa type label
 * @param lastAvailableDate last known available date, verbatim, or {@code null}
 * @param trackingCount     how many times the slot has been observed (&ge; 0)
 * @param lastCheckedAt     when the slot was last checked
 */
public record NotificationEvent(
    String status,
    String center,
    String countryCode,
    String missionCode,
    String visaCategory,
    String visaType,
    String lastAvailableDate,
    int trackingCount,
    Instant lastCheckedAt
) {

  public NotificationEvent {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(center, "center");
    Objects.requireNonNull(countryCode, "countryCode");
    Objects.requireNonNull(missionCode, "missionCode");
    Objects.requireNonNull(visaCategory, "visaCategory");
    Objects.requireNonNull(visaType, "visaType");
    Objects.requireNonNull(lastCheckedAt, "lastCheckedAt");
    if (trackingCount < 0) {
      throw new IllegalArgumentException("trackingCount must be >= 0, got: " + trackingCount);
    }
    if (lastAvailableDate != null && lastAvailableDate.isEmpty()) {
      lastAvailableDate = null;
    }
  }

  /**
   * Returns {@code true} if the event carries a last available date.
   */
  public boolean hasLastAvailableDate() {
    return lastAvailableDate != null;
  }
}
