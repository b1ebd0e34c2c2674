package com.deploybot.orchestrator.notify;

/**
 * A chat message could not be delivered. Callers log it; nothing retries.
 */
public class NotifyDeliveryException extends RuntimeException {

    public NotifyDeliveryException(String message) {
        super(message);
    }

    public NotifyDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
