/**
 * Notification dispatch: render, rate-gate, send, and recover from remote throttling.
 *
 * <p>{@link notifier.dispatch.NotificationDispatcher} runs one notification through
 * {@code Rendering -> RateGating -> Sending} and ends in one of the
 * {@link notifier.dispatch.DeliveryResult} outcomes. Throttled sends loop back into
 * {@code Sending} after the server-specified delay, up to a bounded number of times.
 *
 * @see notifier.dispatch.NotificationDispatcher
 * @see notifier.dispatch.DeliveryResult
 */
package notifier.dispatch;
