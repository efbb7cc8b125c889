package notifier.dispatch;

/**
 * Terminal outcome of a single {@link NotificationDispatcher#dispatch} call.
 */
public enum DeliveryResult {
    /** The transport accepted the message. */
    DELIVERED,
    /** The transport failed with a non-throttling error; no automatic retry was made. */
    FAILED,
    /** Every attempt, including the allowed re-sends, was throttled by the endpoint. */
    THROTTLE_EXHAUSTED;

    public boolean isDelivered() {
        return this == DELIVERED;
    }
}
