package com.meltwater.rabbitdriver;

/**
 * The broker operations the event bus needs: publish, consume, acknowledge and topology management.
 *
 * Every operation translates transport failures into a {@link DriverException} with the original cause attached.
 * A driver instance works on a single channel and is not thread safe, the only operation that may be called
 * while another thread is inside {@link #consume(String, DeliveryHandler, long, long)} is {@link Stoppable#stop()}.
 *
 * @see com.meltwater.rabbitdriver.impl.RabbitDriver
 */
public interface AmqpDriver extends Stoppable {

    /**
     * Timeout value meaning "no total timeout" for {@link #consume(String, DeliveryHandler, long, long)}.
     */
    long NO_TIMEOUT = 0;

    /**
     * @throws DriverException of kind {@link DriverException.Kind#PUBLISH_FAILED}
     */
    void publish(MessagePublication publication, String exchange, String routingKey);

    default void publish(MessagePublication publication, String exchange) {
        publish(publication, exchange, "");
    }

    /**
     * Consume from a queue until the handler returns false, {@link #stop()} is called, the total timeout elapses or
     * nothing arrives within the idle timeout. The consumer is cancelled and the channel closed when the call returns.
     *
     * @param queue the queue to consume from
     * @param handler invoked on the calling thread for every delivery
     * @param idleTimeoutMillis max time to wait for the next delivery, 0 to wait forever
     * @param timeoutMillis max duration of the whole call, {@link #NO_TIMEOUT} for none
     * @throws DriverException of kind {@link DriverException.Kind#CONSUME_FAILED}
     */
    void consume(String queue, DeliveryHandler handler, long idleTimeoutMillis, long timeoutMillis);

    default void consume(String queue, DeliveryHandler handler, long idleTimeoutMillis) {
        consume(queue, handler, idleTimeoutMillis, NO_TIMEOUT);
    }

    /**
     * @throws DriverException of kind {@link DriverException.Kind#ACK_FAILED}
     */
    void ack(MessageDelivery delivery);

    /**
     * Reject and requeue.
     *
     * @throws DriverException of kind {@link DriverException.Kind#REJECT_FAILED}
     */
    default void reject(MessageDelivery delivery) {
        reject(delivery, true);
    }

    void reject(MessageDelivery delivery, boolean requeue);

    void declareExchange(ExchangeDefinition exchange);

    /**
     * Bind the target exchange to the source exchange.
     */
    void bindExchange(String target, String source, String routingKey);

    default void bindExchange(String target, String source) {
        bindExchange(target, source, "");
    }

    void declareQueue(QueueDefinition queue);

    void bindQueue(String queue, String exchange, String routingKey);

    default void bindQueue(String queue, String exchange) {
        bindQueue(queue, exchange, "");
    }

    void deleteExchange(ExchangeDefinition exchange, boolean ifUnused, boolean noWait);

    default void deleteExchange(ExchangeDefinition exchange) {
        deleteExchange(exchange, false, false);
    }

    void deleteQueue(QueueDefinition queue, boolean ifUnused, boolean ifEmpty, boolean noWait);

    default void deleteQueue(QueueDefinition queue) {
        deleteQueue(queue, false, false, false);
    }
}
