package com.meltwater.rabbitdriver.impl;

import com.meltwater.rabbitdriver.AmqpChannel;
import com.meltwater.rabbitdriver.DeliveryCallback;
import com.meltwater.rabbitdriver.WaitFailure;
import com.meltwater.rabbitdriver.WireMessage;
import com.meltwater.rabbitdriver.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link AmqpChannel} wrapping an amqp-client {@link Channel}.
 *
 * Consumers registered here never run the caller's callback on the client's dispatch threads. Deliveries are parked
 * in the connection's {@link InboundDeliveries} and run by {@link #processOneWaitCycle()}.
 */
public class RabbitChannel implements AmqpChannel {

    private static final Logger log = new Logger(RabbitChannel.class);

    private final Channel delegate;
    private final InboundDeliveries inbound;

    RabbitChannel(Channel delegate, InboundDeliveries inbound) {
        this.delegate = delegate;
        this.inbound = inbound;
        inbound.open(this);
    }

    @Override
    public void publish(WireMessage message, String exchange, String routingKey, boolean mandatory, boolean immediate) throws IOException {
        delegate.basicPublish(exchange, routingKey, mandatory, immediate, message.properties, message.body);
    }

    @Override
    public String registerConsumer(String queue, DeliveryCallback callback) throws IOException {
        return delegate.basicConsume(queue, false, "", false, false, null, new InternalConsumer(queue, callback));
    }

    @Override
    public void processOneWaitCycle() {
        Runnable delivery = inbound.next(this);
        if (delivery != null) {
            delivery.run();
        }
    }

    @Override
    public void cancelConsumer(String consumerTag, boolean noWait) throws IOException {
        if (noWait) {
            delegate.asyncRpc(new AMQP.Basic.Cancel.Builder()
                    .consumerTag(consumerTag)
                    .nowait(true)
                    .build());
            // no cancel-ok will arrive to wake up a waiting consume loop
            inbound.wakeup(this);
        } else {
            delegate.basicCancel(consumerTag);
        }
    }

    @Override
    public void qos(int prefetchCount) throws IOException {
        delegate.basicQos(prefetchCount);
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        delegate.basicAck(deliveryTag, false);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
        delegate.basicReject(deliveryTag, requeue);
    }

    @Override
    public void declareExchange(String exchange, String type, boolean durable, boolean autoDelete, boolean internal, Map<String, Object> arguments) throws IOException {
        delegate.exchangeDeclare(exchange, type, durable, autoDelete, internal, arguments);
    }

    @Override
    public void bindExchange(String destination, String source, String routingKey) throws IOException {
        delegate.exchangeBind(destination, source, routingKey);
    }

    @Override
    public void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete, Map<String, Object> arguments) throws IOException {
        delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        delegate.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void deleteExchange(String exchange, boolean ifUnused, boolean noWait) throws IOException {
        if (noWait) {
            delegate.exchangeDeleteNoWait(exchange, ifUnused);
        } else {
            delegate.exchangeDelete(exchange, ifUnused);
        }
    }

    @Override
    public void deleteQueue(String queue, boolean ifUnused, boolean ifEmpty, boolean noWait) throws IOException {
        if (noWait) {
            delegate.queueDeleteNoWait(queue, ifUnused, ifEmpty);
        } else {
            delegate.queueDelete(queue, ifUnused, ifEmpty);
        }
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen() && delegate.getConnection().isOpen();
    }

    @Override
    public void close() throws IOException {
        int dropped = inbound.discard(this);
        if (dropped > 0) {
            log.infoWithParams("Dropped undispatched deliveries, they will be redelivered by the broker.",
                    "channelNr", delegate.getChannelNumber(),
                    "deliveries", dropped);
        }
        if (!delegate.isOpen()) {
            return;
        }
        try {
            delegate.close();
        } catch (AlreadyClosedException e) {
            log.debugWithParams("Channel was closed concurrently.", "channelNr", delegate.getChannelNumber());
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing channel " + delegate.getChannelNumber(), e);
        }
    }

    @Override
    public String toString() {
        return "{" +
                "channelNo=" + delegate.getChannelNumber() +
                '}';
    }

    class InternalConsumer extends DefaultConsumer {

        private final String queue;
        private final DeliveryCallback callback;

        InternalConsumer(String queue, DeliveryCallback callback) {
            super(delegate);
            this.queue = queue;
            this.callback = callback;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            final WireMessage message = new WireMessage(envelope, properties, body);
            if (!inbound.add(RabbitChannel.this, () -> callback.onDelivery(message))) {
                log.debugWithParams("Dropped delivery for a closed channel.",
                        "queue", queue,
                        "deliveryTag", envelope.getDeliveryTag());
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Consumer was cancelled by the broker.",
                    "queue", queue,
                    "consumerTag", consumerTag);
            inbound.fail(RabbitChannel.this, new WaitFailure("Consumer " + consumerTag + " on queue '" + queue + "' was cancelled by the broker", null));
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (sig.isInitiatedByApplication()) {
                return;
            }
            inbound.fail(RabbitChannel.this, new WaitFailure("Channel shut down while consuming from '" + queue + "': " + sig.getMessage(), sig));
        }
    }
}
