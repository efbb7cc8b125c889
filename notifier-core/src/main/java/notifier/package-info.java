/**
 * Root API for the notifier: a rate-limited, throttle-aware dispatcher that renders
 * appointment events and posts them to a single messaging channel.
 *
 * <h2>Core Design</h2>
 * <p>A {@link notifier.NotificationEvent} is turned into an HTML-subset message by a
 * {@linkplain notifier.render.MessageRenderer renderer}, gated by a
 * {@linkplain notifier.ratelimit.RateLimiter per-window send quota}, and handed to a
 * {@linkplain notifier.spi.MessageTransport transport}. When the remote side throttles
 * a send with {@link notifier.ThrottledException}, the
 * {@linkplain notifier.dispatch.NotificationDispatcher dispatcher} waits the requested
 * delay and re-sends the same text without spending local quota.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>notifier-core</b> — event model, renderer, rate limiter, dispatcher (zero external deps)</li>
 *   <li><b>notifier-micrometer</b> — Micrometer bridge for {@link notifier.spi.MetricsExporter}</li>
 *   <li><b>notifier-spring-boot-starter</b> — property binding and auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * WindowRateLimiter limiter = WindowRateLimiter.builder()
 *     .quota(20)
 *     .build();
 *
 * try (NotificationDispatcher dispatcher = NotificationDispatcher.builder()
 *     .transport(botTransport)
 *     .destination("@appointments")
 *     .rateLimiter(limiter)
 *     .build()) {
 *
 *     boolean delivered = dispatcher.notify(event);
 * }
 * }</pre>
 *
 * @see notifier.NotificationEvent
 * @see notifier.ThrottledException
 * @see notifier.dispatch.NotificationDispatcher
 */
package notifier;
