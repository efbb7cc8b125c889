package notifier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the notifier.
 *
 * @see NotifierAutoConfiguration
 */
@ConfigurationProperties(prefix = "notifier")
public class NotifierProperties {

    /**
     * Destination channel or chat identifier. Required.
     */
    private String channelId;

    /**
     * Maximum sends per window.
     */
    private int rateLimit = 20;

    /**
     * Length of the rate-limit window.
     */
    private Duration window = Duration.ofMinutes(1);

    /**
     * Time zone used to format the last-checked timestamp.
     */
    private String timeZone = "Europe/Istanbul";

    /**
     * BCP 47 language tag used to format the last-checked timestamp.
     */
    private String locale = "tr-TR";

    /**
     * Label set used by the message template.
     */
    private Labels labels = Labels.TURKISH;

    /**
     * Throttled re-sends allowed per message before giving up.
     */
    private int maxThrottleRetries = 5;

    private final Metrics metrics = new Metrics();

    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    public int getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(int rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public Labels getLabels() {
        return labels;
    }

    public void setLabels(Labels labels) {
        this.labels = labels;
    }

    public int getMaxThrottleRetries() {
        return maxThrottleRetries;
    }

    public void setMaxThrottleRetries(int maxThrottleRetries) {
        this.maxThrottleRetries = maxThrottleRetries;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Labels {
        TURKISH,
        ENGLISH
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "notifier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
