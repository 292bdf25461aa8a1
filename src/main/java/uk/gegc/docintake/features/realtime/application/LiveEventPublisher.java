package uk.gegc.docintake.features.realtime.application;

/**
 * Server side of the live notification channel. Delivery is best effort and at most once:
 * a subscriber that fails to receive a message is dropped, and the failure never reaches the caller.
 */
public interface LiveEventPublisher {

    /**
     * Sends {@code {type, payload}} to every currently connected subscriber.
     */
    void publish(String type, Object payload);

    int subscriberCount();
}
