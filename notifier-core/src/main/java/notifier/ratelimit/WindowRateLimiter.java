package notifier.ratelimit;

import notifier.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rolling-window rate limiter: at most {@code quota} permits per {@code window}
 * (60 seconds by default).
 *
 * <p>The window is re-anchored in two ways, whichever happens first:
 * <ul>
 *   <li>a caller finds the quota used up and the window already expired, or wakes after
 *       waiting out the remainder of the window;</li>
 *   <li>the background tick fires at the end of the window (started by {@link #start()}).</li>
 * </ul>
 * Both paths run under the same lock and only reset a window that has actually expired,
 * so a reset is never applied twice to the same window and waits are never negative.
 *
 * <p>Callers that find the quota exhausted wait on a condition that every reset signals.
 * A woken caller re-checks the quota; when more callers were waiting than the new window
 * admits, the surplus waits for the following window. The permit count never exceeds the
 * quota.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}; {@link #close()} is equivalent to {@link #shutdown()}.
 */
public final class WindowRateLimiter implements RateLimiter, AutoCloseable {
  private static final Logger logger = Logger.getLogger(WindowRateLimiter.class.getName());

  private final int quota;
  private final long windowNanos;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition windowReset = lock.newCondition();

  // guarded by lock
  private int count;
  private long windowStartNanos;
  private Instant windowStart;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private WindowRateLimiter(Builder builder) {
    if (builder.quota <= 0) {
      throw new IllegalArgumentException("quota must be > 0, got: " + builder.quota);
    }
    if (builder.window == null || builder.window.isZero() || builder.window.isNegative()) {
      throw new IllegalArgumentException("window must be positive, got: " + builder.window);
    }
    this.quota = builder.quota;
    this.windowNanos = builder.window.toNanos();
    this.windowStartNanos = System.nanoTime();
    this.windowStart = Instant.now();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background window reset tick. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the limiter has been shut down
   */
  @Override
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WindowRateLimiter has been shut down");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("notifier-rate-window-"));
    lock.lock();
    try {
      scheduleTick(remainingNanos(System.nanoTime()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Duration acquire() throws InterruptedException {
    long startedAt = System.nanoTime();
    boolean waited = false;
    lock.lockInterruptibly();
    try {
      while (true) {
        if (count < quota) {
          count++;
          return waited ? Duration.ofNanos(System.nanoTime() - startedAt) : Duration.ZERO;
        }
        long now = System.nanoTime();
        long remaining = remainingNanos(now);
        if (remaining <= 0) {
          resetWindow(now);
          continue;
        }
        if (!waited) {
          logger.log(Level.INFO, "Rate limit of {0} per window reached, waiting {1}s",
              new Object[]{quota, TimeUnit.NANOSECONDS.toSeconds(remaining + 999_999_999L)});
          waited = true;
        }
        windowReset.awaitNanos(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the current permit count and window anchor.
   */
  public RateWindow snapshot() {
    lock.lock();
    try {
      return new RateWindow(count, windowStart);
    } finally {
      lock.unlock();
    }
  }

  public int quota() {
    return quota;
  }

  public Duration window() {
    return Duration.ofNanos(windowNanos);
  }

  private void tick() {
    if (closed) {
      return;
    }
    lock.lock();
    try {
      long now = System.nanoTime();
      long remaining = remainingNanos(now);
      if (remaining <= 0) {
        if (count > 0) {
          logger.log(Level.INFO, "Rate window reset, previous count: {0}", count);
        }
        resetWindow(now);
        remaining = windowNanos;
      }
      scheduleTick(remaining);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Rate window tick failed", t);
    } finally {
      lock.unlock();
    }
  }

  // caller holds lock
  private void scheduleTick(long delayNanos) {
    if (closed) {
      return;
    }
    try {
      tickTask = scheduler.schedule(this::tick, Math.max(0L, delayNanos), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Rate window tick not rescheduled; limiter is shutting down", e);
    }
  }

  // caller holds lock
  private void resetWindow(long now) {
    count = 0;
    windowStartNanos = now;
    windowStart = Instant.now();
    windowReset.signalAll();
  }

  // caller holds lock
  private long remainingNanos(long now) {
    return windowStartNanos + windowNanos - now;
  }

  /** Cancels the reset tick and stops the scheduler thread. Idempotent. */
  @Override
  public synchronized void shutdown() {
    closed = true;
    ScheduledFuture<?> task = tickTask;
    if (task != null) {
      task.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  /** Builder for {@link WindowRateLimiter}. */
  public static final class Builder {
    private int quota;
    private Duration window = Duration.ofMinutes(1);

    private Builder() {}

    /**
     * Sets the number of permits per window.
     *
     * <p><b>Required.</b> Must be &gt; 0.
     *
     * @param quota permits per window
     * @return this builder
     */
    public Builder quota(int quota) {
      this.quota = quota;
      return this;
    }

    /**
     * Sets the window length.
     *
     * <p>Optional. Defaults to one minute. Must be positive.
     *
     * @param window the window duration
     * @return this builder
     */
    public Builder window(Duration window) {
      this.window = window;
      return this;
    }

    /**
     * Builds the limiter. Call {@link WindowRateLimiter#start()} to enable the reset tick, or hand it to a
     * dispatcher, which starts it.
     *
     * @return a new {@link WindowRateLimiter}
     * @throws IllegalArgumentException if {@code quota <= 0} or {@code window} is not positive
     */
    public WindowRateLimiter build() {
      return new WindowRateLimiter(this);
    }
  }
}
