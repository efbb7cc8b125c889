package notifier.dispatch;

import notifier.NotificationEvent;
import notifier.ThrottledException;
import notifier.ratelimit.RateLimiter;
import notifier.render.HtmlMessageRenderer;
import notifier.render.MessageRenderer;
import notifier.spi.MessageTransport;
import notifier.spi.MetricsExporter;
import notifier.spi.SendOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers rendered notifications to a single destination channel.
 *
 * <p>For each call the dispatcher renders the event, takes one permit from the
 * {@link RateLimiter}, and sends the text with {@link SendOptions#HTML_WITHOUT_PREVIEW}.
 * A {@link ThrottledException} from the transport makes the dispatcher sleep for the
 * server-specified delay and re-send the same text without taking another permit. After
 * {@code maxThrottleRetries} throttled re-sends the call gives up with
 * {@link DeliveryResult#THROTTLE_EXHAUSTED}. Any other transport error is logged and
 * reported as {@link DeliveryResult#FAILED}; it is never thrown to the caller.
 *
 * <p>Rendering errors and invalid events are programming errors and propagate.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; concurrent calls
 * share the rate limiter and reach the transport in the order they pass the rate gate.
 * Building the dispatcher starts the rate limiter; {@link #shutdown()} stops its background tick but does not cancel calls
 * already in flight; drain them first if clean termination is required.
 *
 * @see NotificationDispatcher.Builder
 */
public final class NotificationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

  private final MessageTransport transport;
  private final String destination;
  private final RateLimiter rateLimiter;
  private final MessageRenderer renderer;
  private final int maxThrottleRetries;
  private final MetricsExporter metrics;
  private final AtomicBoolean running = new AtomicBoolean(true);

  private NotificationDispatcher(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.destination = Objects.requireNonNull(builder.destination, "destination");
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    if (destination.isBlank()) {
      throw new IllegalArgumentException("destination cannot be blank");
    }
    if (builder.maxThrottleRetries < 0) {
      throw new IllegalArgumentException("maxThrottleRetries must be >= 0");
    }
    this.renderer = builder.renderer != null ? builder.renderer : HtmlMessageRenderer.builder().build();
    this.maxThrottleRetries = builder.maxThrottleRetries;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    rateLimiter.start();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers the event and reports whether the transport accepted it.
   *
   * @param event the event to announce
   * @return {@code true} if delivered, {@code false} on any non-recoverable failure
   * @see #dispatch(NotificationEvent)
   */
  public boolean notify(NotificationEvent event) {
    return dispatch(event).isDelivered();
  }

  /**
   * Delivers the event and returns the detailed outcome.
   *
   * @param event the event to announce
   * @return the terminal outcome of this call
   * @throws NullPointerException  if {@code event} is null
   * @throws IllegalStateException if the dispatcher has been shut down
   */
  public DeliveryResult dispatch(NotificationEvent event) {
    Objects.requireNonNull(event, "event");
    if (!running.get()) {
      throw new IllegalStateException("NotificationDispatcher has been shut down");
    }
    String text = renderer.render(event);

    try {
      Duration waited = rateLimiter.acquire();
      metrics.recordRateLimitWaitMs(waited.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while waiting for rate limit; message not sent");
      metrics.incrementFailed();
      return DeliveryResult.FAILED;
    }

    return sendWithThrottleRetry(text);
  }

  private DeliveryResult sendWithThrottleRetry(String text) {
    int throttleRetries = 0;
    while (true) {
      long sendStart = System.nanoTime();
      try {
        transport.send(destination, text, SendOptions.HTML_WITHOUT_PREVIEW);
        metrics.recordSendDurationMs(elapsedMs(sendStart));
        metrics.incrementDelivered();
        return DeliveryResult.DELIVERED;
      } catch (ThrottledException e) {
        metrics.recordSendDurationMs(elapsedMs(sendStart));
        metrics.incrementThrottled();
        if (throttleRetries >= maxThrottleRetries) {
          logger.log(Level.SEVERE, "Giving up on " + destination + " after "
              + throttleRetries + " throttled re-sends", e);
          metrics.incrementThrottleExhausted();
          return DeliveryResult.THROTTLE_EXHAUSTED;
        }
        throttleRetries++;
        Duration retryAfter = e.retryAfter();
        logger.log(Level.WARNING, "Throttled by endpoint, retrying in {0}s (re-send {1} of {2})",
            new Object[]{retryAfter.toSeconds(), throttleRetries, maxThrottleRetries});
        if (!sleep(retryAfter)) {
          metrics.incrementFailed();
          return DeliveryResult.FAILED;
        }
      } catch (Exception e) {
        metrics.recordSendDurationMs(elapsedMs(sendStart));
        metrics.incrementFailed();
        logger.log(Level.SEVERE, "Failed to send message to " + destination, e);
        return DeliveryResult.FAILED;
      }
    }
  }

  private static boolean sleep(Duration delay) {
    try {
      TimeUnit.MILLISECONDS.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted during throttle back-off; message not sent");
      return false;
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  public String destination() {
    return destination;
  }

  /**
   * Stops accepting calls and shuts down the rate limiter's background tick.
   * In-flight calls are not cancelled. Idempotent.
   */
  public void shutdown() {
    if (running.compareAndSet(true, false)) {
      rateLimiter.shutdown();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  /** Builder for {@link NotificationDispatcher}. */
  public static final class Builder {
    private MessageTransport transport;
    private String destination;
    private RateLimiter rateLimiter;
    private MessageRenderer renderer;
    private int maxThrottleRetries = 5;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the transport that performs the network call.
     *
     * <p><b>Required.</b>
     *
     * @param transport the messaging transport
     * @return this builder
     */
    public Builder transport(MessageTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the destination channel identifier.
     *
     * <p><b>Required.</b> Must not be blank.
     *
     * @param destination channel or chat id
     * @return this builder
     */
    public Builder destination(String destination) {
      this.destination = destination;
      return this;
    }

    /**
     * Sets the local send quota gate. The dispatcher owns its lifecycle: {@link #build()}
     * starts it and {@link NotificationDispatcher#shutdown()} shuts it down.
     *
     * <p><b>Required.</b>
     *
     * @param rateLimiter the rate limiter
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets the message renderer.
     *
     * <p>Optional. Defaults to {@link HtmlMessageRenderer} with its default zone and labels.
     *
     * @param renderer the renderer
     * @return this builder
     */
    public Builder renderer(MessageRenderer renderer) {
      this.renderer = renderer;
      return this;
    }

    /**
     * Sets how many times a throttled message is re-sent before giving up.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 0; {@code 0} disables re-sending.
     *
     * @param maxThrottleRetries maximum throttled re-sends per call
     * @return this builder
     */
    public Builder maxThrottleRetries(int maxThrottleRetries) {
      this.maxThrottleRetries = maxThrottleRetries;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link NotificationDispatcher}
     * @throws NullPointerException     if {@code transport}, {@code destination} or
     *     {@code rateLimiter} is null
     * @throws IllegalArgumentException if {@code destination} is blank or
     *     {@code maxThrottleRetries < 0}
     * @throws IllegalStateException    if the rate limiter has already been shut down
     */
    public NotificationDispatcher build() {
      return new NotificationDispatcher(this);
    }
  }
}
