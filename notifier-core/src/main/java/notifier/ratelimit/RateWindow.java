package notifier.ratelimit;

import java.time.Instant;

/**
 * Point-in-time view of a limiter's current window.
 *
 * @param count       permits taken in the current window (&ge; 0, &le; quota)
 * @param windowStart when the current window was anchored
 */
public record RateWindow(int count, Instant windowStart) {}
