package notifier;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link notifier.spi.MessageTransport} when the messaging endpoint rejects a
 * send because the caller exceeded its allowed rate.
 *
 * <p>The dispatcher waits {@link #retryAfter()} and re-sends the same message. Throttled
 * re-sends do not consume local rate-limit quota: the remote side has already stated the
 * authoritative constraint.
 *
 * <p>Typical sources:
 * <ul>
 *   <li>Bot API error 429 with {@code parameters.retry_after}</li>
 *   <li>HTTP 429 with a {@code Retry-After} header</li>
 * </ul>
 *
 * @see notifier.dispatch.NotificationDispatcher
 */
public class ThrottledException extends Exception {

    private final Duration retryAfter;

    /**
     * Creates a new instance with the specified retry delay.
     *
     * @param retryAfter how long the remote side asked us to wait
     * @throws NullPointerException     if {@code retryAfter} is null
     * @throws IllegalArgumentException if {@code retryAfter} is negative
     */
    public ThrottledException(Duration retryAfter) {
        super("Throttled, retry after " + validate(retryAfter).toSeconds() + "s");
        this.retryAfter = retryAfter;
    }

    /**
     * Creates a new instance with the specified retry delay and cause.
     *
     * @param retryAfter how long the remote side asked us to wait
     * @param cause      the transport-level error that carried the signal
     * @throws NullPointerException     if {@code retryAfter} is null
     * @throws IllegalArgumentException if {@code retryAfter} is negative
     */
    public ThrottledException(Duration retryAfter, Throwable cause) {
        super("Throttled, retry after " + validate(retryAfter).toSeconds() + "s", cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Creates an instance from the whole number of seconds reported by the remote side.
     *
     * @param retryAfterSeconds delay in seconds (&ge; 0)
     * @return a new exception
     */
    public static ThrottledException ofSeconds(long retryAfterSeconds) {
        return new ThrottledException(Duration.ofSeconds(retryAfterSeconds));
    }

    /**
     * Returns the server-requested delay before the next attempt.
     *
     * @return the retry delay (never null, never negative)
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    private static Duration validate(Duration retryAfter) {
        Objects.requireNonNull(retryAfter, "retryAfter must not be null");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        return retryAfter;
    }
}
