package notifier.render;

import java.util.Objects;

/**
 * Field labels and the missing-value placeholder used by {@link HtmlMessageRenderer}.
 *
 * <p>Labels are trusted constants and are emitted without escaping.
 */
public record MessageLabels(
    String title,
    String status,
    String center,
    String countryMission,
    String category,
    String type,
    String lastAvailableDate,
    String trackingCount,
    String lastChecked,
    String noInformation
) {

  /** Labels of the default deployment. */
  public static final MessageLabels TURKISH = new MessageLabels(
      "YENİ RANDEVU",
      "Durum",
      "Merkez",
      "Ülke/Misyon",
      "Kategori",
      "Tip",
      "Son Müsait Tarih",
      "Takip Sayısı",
      "Son Kontrol",
      "Bilgi Yok");

  public static final MessageLabels ENGLISH = new MessageLabels(
      "NEW APPOINTMENT",
      "Status",
      "Center",
      "Country/Mission",
      "Category",
      "Type",
      "Last Available Date",
      "Tracking Count",
      "Last Checked",
      "No Information");

  public MessageLabels {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(center, "center");
    Objects.requireNonNull(countryMission, "countryMission");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(lastAvailableDate, "lastAvailableDate");
    Objects.requireNonNull(trackingCount, "trackingCount");
    Objects.requireNonNull(lastChecked, "lastChecked");
    Objects.requireNonNull(noInformation, "noInformation");
    if (noInformation.isEmpty()) {
      throw new IllegalArgumentException("noInformation placeholder cannot be empty");
    }
  }
}
