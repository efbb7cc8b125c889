package notifier.render;

import notifier.NotificationEvent;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders an event as a fixed multi-line message with bold field labels.
 *
 * <p>Every interpolated text field is passed through {@link HtmlEscaper}; country and
 * mission codes are upper-cased first. A missing last available date is replaced by
 * {@link MessageLabels#noInformation()}. The last-checked instant is formatted as a
 * medium date and time in the configured zone and locale.
 *
 * <p>Create instances via {@link #builder()}. Instances are immutable and thread-safe.
 */
public final class HtmlMessageRenderer implements MessageRenderer {

  /** Zone of the default deployment. */
  public static final ZoneId DEFAULT_ZONE = ZoneId.of("Europe/Istanbul");

  /** Locale of the default deployment. */
  public static final Locale DEFAULT_LOCALE = Locale.forLanguageTag("tr-TR");

  private final MessageLabels labels;
  private final DateTimeFormatter lastCheckedFormatter;

  private HtmlMessageRenderer(Builder builder) {
    this.labels = builder.labels != null ? builder.labels : MessageLabels.TURKISH;
    ZoneId zoneId = builder.zoneId != null ? builder.zoneId : DEFAULT_ZONE;
    Locale locale = builder.locale != null ? builder.locale : DEFAULT_LOCALE;
    this.lastCheckedFormatter = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
        .withLocale(locale)
        .withZone(zoneId);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String render(NotificationEvent event) {
    Objects.requireNonNull(event, "event");
    String availableDate = event.hasLastAvailableDate()
        ? HtmlEscaper.escape(event.lastAvailableDate())
        : labels.noInformation();

    return String.join("\n",
        bold(labels.title()),
        "",
        line(labels.status(), HtmlEscaper.escape(event.status())),
        line(labels.center(), HtmlEscaper.escape(event.center())),
        line(labels.countryMission(), code(event.countryCode()) + " -> " + code(event.missionCode())),
        line(labels.category(), HtmlEscaper.escape(event.visaCategory())),
        line(labels.type(), HtmlEscaper.escape(event.visaType())),
        line(labels.lastAvailableDate(), availableDate),
        line(labels.trackingCount(), Integer.toString(event.trackingCount())),
        line(labels.lastChecked(), HtmlEscaper.escape(lastCheckedFormatter.format(event.lastCheckedAt()))));
  }

  // Locale.ROOT so "in" stays "IN" under a Turkish default locale
  private static String code(String value) {
    return HtmlEscaper.escape(value.toUpperCase(Locale.ROOT));
  }

  private static String line(String label, String value) {
    return bold(label + ":") + " " + value;
  }

  private static String bold(String text) {
    return "<b>" + text + "</b>";
  }

  /** Builder for {@link HtmlMessageRenderer}. */
  public static final class Builder {
    private ZoneId zoneId;
    private Locale locale;
    private MessageLabels labels;

    private Builder() {}

    /**
     * Sets the zone used to format the last-checked instant.
     *
     * <p>Optional. Defaults to {@link #DEFAULT_ZONE}.
     *
     * @param zoneId the time zone
     * @return this builder
     */
    public Builder zoneId(ZoneId zoneId) {
      this.zoneId = zoneId;
      return this;
    }

    /**
     * Sets the locale used to format the last-checked instant.
     *
     * <p>Optional. Defaults to {@link #DEFAULT_LOCALE}.
     *
     * @param locale the formatting locale
     * @return this builder
     */
    public Builder locale(Locale locale) {
      this.locale = locale;
      return this;
    }

    /**
     * Sets the field labels and placeholder.
     *
     * <p>Optional. Defaults to {@link MessageLabels#TURKISH}.
     *
     * @param labels the label set
     * @return this builder
     */
    public Builder labels(MessageLabels labels) {
      this.labels = labels;
      return this;
    }

    public HtmlMessageRenderer build() {
      return new HtmlMessageRenderer(this);
    }
  }
}
