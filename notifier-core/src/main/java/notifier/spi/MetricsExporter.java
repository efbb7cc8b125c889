package notifier.spi;

/**
 * Observability hook for exporting dispatcher counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages accepted by the transport.
     */
    void incrementDelivered();

    /**
     * Increments the count of messages that failed with a non-throttling error.
     */
    void incrementFailed();

    /**
     * Increments the count of throttling signals received from the endpoint.
     */
    void incrementThrottled();

    /**
     * Increments the count of messages abandoned after exhausting throttle retries.
     */
    default void incrementThrottleExhausted() {
    }

    /**
     * Records how long a caller waited for local rate-limit quota.
     *
     * @param waitMs wait in milliseconds (always non-negative)
     */
    default void recordRateLimitWaitMs(long waitMs) {
    }

    /**
     * Records the duration of a single transport call.
     *
     * @param durationMs transport call time in milliseconds (always non-negative)
     */
    default void recordSendDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementThrottled() {
        }
    }
}
