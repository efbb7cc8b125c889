/**
 * Local send quota enforcement.
 *
 * <p>{@link notifier.ratelimit.WindowRateLimiter} admits at most {@code quota} sends per
 * window and suspends further callers until the window rolls over. A background tick
 * re-anchors the window even when nobody is sending, so the counter never goes stale.
 *
 * @see notifier.ratelimit.RateLimiter
 * @see notifier.ratelimit.RateWindow
 */
package notifier.ratelimit;
