package com.meltwater.rabbitdriver;

/**
 * Converts between the domain {@link Message} and what travels on the wire.
 */
public interface MessageCodec {

    WireMessage encode(Message message, boolean persistent);

    /**
     * @param queue the queue the message was consumed from
     */
    MessageDelivery decode(WireMessage message, String queue);
}
