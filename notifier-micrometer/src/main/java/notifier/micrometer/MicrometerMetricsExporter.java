package notifier.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import notifier.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code notifier.delivered} — messages accepted by the transport</li>
 *   <li>{@code notifier.failed} — messages that failed with a non-throttling error</li>
 *   <li>{@code notifier.throttled} — throttling signals received from the endpoint</li>
 *   <li>{@code notifier.throttle.exhausted} — messages abandoned after throttle retries</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code notifier.ratelimit.wait} — time spent waiting for local quota</li>
 *   <li>{@code notifier.send.duration} — duration of each transport call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter delivered;
  private final Counter failed;
  private final Counter throttled;
  private final Counter throttleExhausted;
  private final Timer rateLimitWait;
  private final Timer sendDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "notifier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "notifier");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "visa.notifier"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.delivered = Counter.builder(namePrefix + ".delivered")
        .description("Messages accepted by the transport")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".failed")
        .description("Messages failed with a non-throttling error")
        .register(registry);
    this.throttled = Counter.builder(namePrefix + ".throttled")
        .description("Throttling signals received from the endpoint")
        .register(registry);
    this.throttleExhausted = Counter.builder(namePrefix + ".throttle.exhausted")
        .description("Messages abandoned after exhausting throttle retries")
        .register(registry);
    this.rateLimitWait = Timer.builder(namePrefix + ".ratelimit.wait")
        .description("Time spent waiting for local send quota")
        .register(registry);
    this.sendDuration = Timer.builder(namePrefix + ".send.duration")
        .description("Duration of transport send calls")
        .register(registry);
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementThrottled() {
    if (closed) return;
    throttled.increment();
  }

  @Override
  public void incrementThrottleExhausted() {
    if (closed) return;
    throttleExhausted.increment();
  }

  @Override
  public void recordRateLimitWaitMs(long waitMs) {
    if (closed) return;
    rateLimitWait.record(waitMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordSendDurationMs(long durationMs) {
    if (closed) return;
    sendDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(delivered, failed, throttled, throttleExhausted,
        rateLimitWait, sendDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
