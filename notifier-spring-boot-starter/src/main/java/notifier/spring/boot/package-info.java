/**
 * Spring Boot auto-configuration for the notifier.
 *
 * <p>Binds {@code notifier.*} properties and, once the application provides a
 * {@link notifier.spi.MessageTransport} bean, wires a renderer, a started
 * {@link notifier.ratelimit.WindowRateLimiter} and a
 * {@link notifier.dispatch.NotificationDispatcher}.
 *
 * @see notifier.spring.boot.NotifierProperties
 * @see notifier.spring.boot.NotifierAutoConfiguration
 */
package notifier.spring.boot;
