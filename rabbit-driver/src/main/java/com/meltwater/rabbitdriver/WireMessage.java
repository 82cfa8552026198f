package com.meltwater.rabbitdriver;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.util.Arrays;
import java.util.Objects;

/**
 * This class wraps the data that travels on the wire for a single message: the AMQP basic properties and the body.
 *
 * Messages received from the broker also carry the {@link Envelope} with the delivery tag, the redelivered flag and
 * the exchange and routing key the message was published with. Outgoing messages have no envelope.
 *
 * @see MessageCodec
 */
public class WireMessage {

    /**
     * The message properties. For example messageId, content type, delivery mode and custom headers.
     */
    public final AMQP.BasicProperties properties;

    /**
     * The envelope of a received message, null for messages that are about to be published.
     */
    public final Envelope envelope;

    /**
     * The message body
     */
    public final byte[] body;

    public WireMessage(AMQP.BasicProperties properties, byte[] body) {
        this(null, properties, body);
    }

    public WireMessage(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        this.envelope = envelope;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.body = body == null ? new byte[0] : body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WireMessage that = (WireMessage) o;
        return Objects.equals(envelope, that.envelope)
                && properties.equals(that.properties)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        int result = properties.hashCode();
        result = 31 * result + (envelope != null ? envelope.hashCode() : 0);
        result = 31 * result + Arrays.hashCode(body);
        return result;
    }

    @Override
    public String toString() {
        return "{" +
                "deliveryTag=" + (envelope == null ? "none" : envelope.getDeliveryTag()) +
                ", bodySize=" + body.length +
                ", properties=" + properties +
                '}';
    }
}
