/**
 * Pure rendering of {@link notifier.NotificationEvent}s into the HTML subset accepted by
 * the messaging endpoint (bold tags only).
 *
 * @see notifier.render.HtmlMessageRenderer
 * @see notifier.render.MessageLabels
 */
package notifier.render;
