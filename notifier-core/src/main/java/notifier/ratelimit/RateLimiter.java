package notifier.ratelimit;

import java.time.Duration;

/**
 * Gate that admits a bounded number of sends per time window.
 *
 * @see WindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Takes one permit, suspending the calling thread until one is available.
     *
     * @return how long the caller was suspended ({@link Duration#ZERO} if admitted immediately)
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Duration acquire() throws InterruptedException;

    /**
     * Starts any background work the limiter needs, such as a periodic window reset.
     * Must be idempotent. The default does nothing.
     */
    default void start() {
    }

    /**
     * Releases background resources. Callers must not {@link #acquire()} afterwards.
     */
    void shutdown();
}
