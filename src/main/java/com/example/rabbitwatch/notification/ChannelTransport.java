package com.example.rabbitwatch.notification;

/**
 * One kind of notification channel. The set is closed: email, Slack and
 * generic webhooks.
 *
 * @param <P> the channel's payload type
 */
public interface ChannelTransport<P> {

    ChannelType type();

    /** Format a non-empty batch for this channel. Pure. */
    P buildPayload(ChannelTarget target, AlertBatch batch);

    /**
     * One delivery attempt, bounded by the transport's timeout.
     *
     * @return the HTTP status code, or null for transports without one
     */
    Integer send(ChannelTarget target, P payload) throws TransientDeliveryException, TerminalDeliveryException;
}
