package notifier.render;

import notifier.NotificationEvent;

/**
 * Turns an event into display text. Implementations must be side-effect free.
 *
 * @see HtmlMessageRenderer
 */
@FunctionalInterface
public interface MessageRenderer {

    /**
     * Renders the event.
     *
     * @param event the event to render
     * @return the message text, safe to send in the transport's rich-text mode
     */
    String render(NotificationEvent event);
}
