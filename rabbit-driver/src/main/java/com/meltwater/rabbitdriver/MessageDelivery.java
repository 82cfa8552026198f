package com.meltwater.rabbitdriver;

import java.util.Objects;

/**
 * A message received from a queue.
 *
 * NOTE:
 * The delivery tag is only valid on the channel that received the message. Ack or reject the delivery through
 * {@link AmqpDriver#ack(MessageDelivery)} or {@link AmqpDriver#reject(MessageDelivery)} from inside the
 * consume call that produced it. Deliveries that are never acked are redelivered by the broker once the channel closes.
 */
public class MessageDelivery {

    private final Message message;
    private final long tag;
    private final String queue;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;

    public MessageDelivery(Message message, long tag, String queue) {
        this(message, tag, queue, false, "", "");
    }

    public MessageDelivery(Message message, long tag, String queue, boolean redelivered, String exchange, String routingKey) {
        this.message = Objects.requireNonNull(message, "message");
        this.tag = tag;
        this.queue = queue;
        this.redelivered = redelivered;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public Message getMessage() {
        return message;
    }

    /**
     * @return the broker assigned delivery tag
     */
    public long getTag() {
        return tag;
    }

    /**
     * @return the queue the message was consumed from
     */
    public String getQueue() {
        return queue;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageDelivery that = (MessageDelivery) o;
        return tag == that.tag
                && redelivered == that.redelivered
                && message.equals(that.message)
                && Objects.equals(queue, that.queue)
                && Objects.equals(exchange, that.exchange)
                && Objects.equals(routingKey, that.routingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, tag, queue, redelivered, exchange, routingKey);
    }

    @Override
    public String toString() {
        return "{" +
                "tag=" + tag +
                ", queue='" + queue + '\'' +
                ", redelivered=" + redelivered +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", message=" + message +
                '}';
    }
}
