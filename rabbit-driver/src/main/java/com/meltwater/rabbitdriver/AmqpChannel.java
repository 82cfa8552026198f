package com.meltwater.rabbitdriver;

import java.io.IOException;
import java.util.Map;

/**
 * A protocol channel, the unit every AMQP operation is issued on.
 *
 * Each method issues exactly one protocol call. A closed channel must not be used again.
 *
 * @see AmqpConnection#openChannel()
 */
public interface AmqpChannel {

    /**
     * @see com.rabbitmq.client.Channel#basicPublish(String, String, boolean, boolean, com.rabbitmq.client.AMQP.BasicProperties, byte[])
     */
    void publish(WireMessage message, String exchange, String routingKey, boolean mandatory, boolean immediate) throws IOException;

    /**
     * Start a non-exclusive consumer with explicit acknowledgements and a broker generated consumer tag.
     *
     * The callback is not invoked on the client's delivery threads. Deliveries are queued on the connection
     * and handed to the callback by {@link #processOneWaitCycle()} on the caller's thread.
     *
     * @return the broker assigned consumer tag
     */
    String registerConsumer(String queue, DeliveryCallback callback) throws IOException;

    /**
     * Hand the oldest delivery pending for this channel to its consumer callback, on the calling thread.
     * Does nothing if no delivery is pending.
     */
    void processOneWaitCycle() throws IOException;

    /**
     * Cancel a consumer.
     *
     * @param noWait true to send the cancel without waiting for the broker to confirm it, a thread waiting in
     *               {@link AmqpConnection#waitForActivity(long)} is woken up since no confirmation will arrive
     */
    void cancelConsumer(String consumerTag, boolean noWait) throws IOException;

    /**
     * @see com.rabbitmq.client.Channel#basicQos(int)
     */
    void qos(int prefetchCount) throws IOException;

    void ack(long deliveryTag) throws IOException;

    void reject(long deliveryTag, boolean requeue) throws IOException;

    void declareExchange(String exchange, String type, boolean durable, boolean autoDelete, boolean internal,
                         Map<String, Object> arguments) throws IOException;

    void bindExchange(String destination, String source, String routingKey) throws IOException;

    void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete,
                      Map<String, Object> arguments) throws IOException;

    void bindQueue(String queue, String exchange, String routingKey) throws IOException;

    void deleteExchange(String exchange, boolean ifUnused, boolean noWait) throws IOException;

    void deleteQueue(String queue, boolean ifUnused, boolean ifEmpty, boolean noWait) throws IOException;

    /**
     * Determine whether the channel is currently open.
     *
     * Checking this method should be only for information, because of the race conditions - state can change after the call.
     */
    boolean isOpen();

    /**
     * Close the channel. Closing a channel that is already closed does nothing.
     */
    void close() throws IOException;
}
