package com.meltwater.rabbitdriver.impl;

import com.google.common.base.Ticker;
import com.meltwater.rabbitdriver.AmqpChannel;
import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.AmqpDriver;
import com.meltwater.rabbitdriver.ConnectionProvider;
import com.meltwater.rabbitdriver.DefaultMessageCodec;
import com.meltwater.rabbitdriver.DeliveryHandler;
import com.meltwater.rabbitdriver.DriverException;
import com.meltwater.rabbitdriver.DriverSettings;
import com.meltwater.rabbitdriver.ExchangeDefinition;
import com.meltwater.rabbitdriver.InterruptionPolicy;
import com.meltwater.rabbitdriver.MessageCodec;
import com.meltwater.rabbitdriver.MessageDelivery;
import com.meltwater.rabbitdriver.MessagePublication;
import com.meltwater.rabbitdriver.QueueDefinition;
import com.meltwater.rabbitdriver.ReadinessResult;
import com.meltwater.rabbitdriver.WaitFailure;
import com.meltwater.rabbitdriver.WireMessage;
import com.meltwater.rabbitdriver.util.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.meltwater.rabbitdriver.DriverException.Kind.ACK_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.CONSUME_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.EXCHANGE_BIND_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.EXCHANGE_DECLARE_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.EXCHANGE_DELETE_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.PUBLISH_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.QUEUE_BIND_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.QUEUE_DECLARE_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.QUEUE_DELETE_FAILED;
import static com.meltwater.rabbitdriver.DriverException.Kind.REJECT_FAILED;

/**
 * An {@link AmqpDriver} working on one lazily opened channel.
 *
 * The connection is taken from the {@link ConnectionProvider} on first use and kept for the lifetime of the driver,
 * it is never closed here. The channel is opened on demand, reused by every operation and closed when a consume
 * call ends, so the next operation starts on a fresh channel.
 *
 * Consuming is a polling loop on the calling thread: wait for inbound activity for at most the idle timeout (bounded
 * by what is left of the total timeout), dispatch one delivery to the handler, repeat. The loop ends when the handler
 * returns false, {@link #stop()} was called, the total timeout elapsed, nothing arrived within the idle timeout or
 * the wait was interrupted. The consumer is cancelled and the channel closed on every exit.
 */
public class RabbitDriver implements AmqpDriver {

    private static final Logger log = new Logger(RabbitDriver.class);

    private enum ExitReason {
        HANDLER_DONE,
        STOPPED,
        TIMEOUT,
        IDLE,
        WAKEUP,
        INTERRUPTED
    }

    private final ConnectionProvider connectionProvider;
    private final MessageCodec codec;
    private final InterruptionPolicy interruptionPolicy;
    private final int preFetchCount;
    private final Ticker ticker;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private AmqpConnection connection;
    // read by stop() from other threads
    private volatile AmqpChannel channel;
    private volatile String currentTag;

    public RabbitDriver(ConnectionProvider connectionProvider) {
        this(connectionProvider, DriverSettings.defaults());
    }

    public RabbitDriver(ConnectionProvider connectionProvider, DriverSettings settings) {
        this(connectionProvider, settings, new DefaultMessageCodec(), InterruptionPolicy.DEFAULT);
    }

    public RabbitDriver(ConnectionProvider connectionProvider,
                        DriverSettings settings,
                        MessageCodec codec,
                        InterruptionPolicy interruptionPolicy) {
        this(connectionProvider, codec, interruptionPolicy, settings.pre_fetch_count, Ticker.systemTicker());
    }

    RabbitDriver(ConnectionProvider connectionProvider,
                 MessageCodec codec,
                 InterruptionPolicy interruptionPolicy,
                 int preFetchCount,
                 Ticker ticker) {
        this.connectionProvider = connectionProvider;
        this.codec = codec;
        this.interruptionPolicy = interruptionPolicy;
        this.preFetchCount = preFetchCount;
        this.ticker = ticker;
    }

    protected AmqpConnection getConnection() throws IOException {
        if (connection == null) {
            connection = connectionProvider.getConnection();
        }
        return connection;
    }

    protected AmqpChannel getChannel() throws IOException {
        AmqpChannel current = channel;
        if (current != null && !current.isOpen()) {
            log.warnWithParams("Discarding channel closed by the broker.", "channel", current);
            channel = null;
            try {
                current.close();
            } catch (IOException | RuntimeException e) {
                log.warnWithParams("Unexpected error when disposing closed channel.", e, "channel", current);
            }
            current = null;
        }
        if (current == null) {
            current = getConnection().openChannel();
            channel = current;
        }
        return current;
    }

    protected void closeChannel() throws IOException {
        AmqpChannel current = channel;
        channel = null;
        if (current != null) {
            current.close();
            log.infoWithParams("Closed and disposed channel.", "channel", current);
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void publish(MessagePublication publication, String exchange, String routingKey) {
        try {
            WireMessage message = codec.encode(publication.getMessage(), publication.isPersistent());
            getChannel().publish(message, exchange, routingKey, publication.isMandatory(), publication.isImmediate());
        } catch (IOException | RuntimeException e) {
            throw new DriverException(PUBLISH_FAILED, "Basic publish error", e);
        }
    }

    @Override
    public void consume(final String queue, final DeliveryHandler handler, long idleTimeoutMillis, long timeoutMillis) {
        if (stopped.get()) {
            log.infoWithParams("Driver is stopped, not consuming.", "queue", queue);
            return;
        }
        // no idle cutoff, a zero wait would return immediately instead
        final long idleTimeout = idleTimeoutMillis <= 0 ? AmqpConnection.WAIT_FOREVER : idleTimeoutMillis;

        AmqpChannel consumeChannel;
        ExitReason reason;
        try {
            consumeChannel = getChannel();
            if (preFetchCount > 0) {
                consumeChannel.qos(preFetchCount);
            }
            final AtomicBoolean active = new AtomicBoolean(true);
            currentTag = consumeChannel.registerConsumer(queue, message -> {
                MessageDelivery delivery = codec.decode(message, queue);
                log.debugWithParams("Dispatching delivery.",
                        "queue", queue,
                        "deliveryTag", delivery.getTag(),
                        "redelivered", delivery.isRedelivered());
                if (!handler.handle(delivery)) {
                    active.set(false);
                }
            });
            log.infoWithParams("Consumer registered.",
                    "queue", queue,
                    "consumerTag", currentTag,
                    "idleTimeoutMillis", idleTimeoutMillis,
                    "timeoutMillis", timeoutMillis);
            reason = runLoop(consumeChannel, active, idleTimeout, timeoutMillis);
        } catch (WaitFailure e) {
            log.errorWithParams("Error while waiting for deliveries.", e, "queue", queue);
            throw abortConsume(new DriverException(CONSUME_FAILED, "Error while waiting on channel activity", e));
        } catch (DriverException e) {
            throw abortConsume(e);
        } catch (IOException | RuntimeException e) {
            throw abortConsume(new DriverException(CONSUME_FAILED, "Basic consume error", e));
        }

        try {
            cancelAndClose(consumeChannel);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(CONSUME_FAILED, "Basic consume error", e);
        } finally {
            if (reason == ExitReason.INTERRUPTED) {
                Thread.currentThread().interrupt();
            }
        }
        log.infoWithParams("Consumer stopped.",
                "queue", queue,
                "reason", reason);
    }

    private ExitReason runLoop(AmqpChannel consumeChannel,
                               AtomicBoolean active,
                               long idleTimeout,
                               long timeoutMillis) throws IOException, WaitFailure {
        final long deadline = ticker.read() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (active.get()) {
            if (stopped.get()) {
                return ExitReason.STOPPED;
            }
            long wait = idleTimeout;
            if (timeoutMillis > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - ticker.read());
                wait = idleTimeout == AmqpConnection.WAIT_FOREVER ? remaining : Math.min(remaining, idleTimeout);
                if (wait <= 0) {
                    return ExitReason.TIMEOUT;
                }
            }

            ReadinessResult result = getConnection().waitForActivity(wait);
            if (result.isFailure()) {
                WaitFailure failure = result.getFailure();
                if (!interruptionPolicy.isBenign(failure)) {
                    throw failure;
                }
                log.warnWithParams("Waiting for deliveries was interrupted, leaving the consume loop.",
                        "reason", failure.getMessage());
                return failure.isInterrupted() ? ExitReason.INTERRUPTED : ExitReason.WAKEUP;
            }
            if (stopped.get()) {
                return ExitReason.STOPPED;
            }
            if (!result.isReady()) {
                return ExitReason.IDLE;
            }
            consumeChannel.processOneWaitCycle();
        }
        return ExitReason.HANDLER_DONE;
    }

    private void cancelAndClose(AmqpChannel consumeChannel) throws IOException {
        String tag = currentTag;
        currentTag = null;
        try {
            consumeChannel.cancelConsumer(tag, false);
            log.infoWithParams("Consumer cancelled.", "consumerTag", tag);
        } finally {
            closeChannel();
        }
    }

    /**
     * Best effort cleanup before a consume failure is thrown, cleanup errors are attached to it as suppressed.
     */
    private DriverException abortConsume(DriverException primary) {
        String tag = currentTag;
        currentTag = null;
        AmqpChannel current = channel;
        if (tag != null && current != null && current.isOpen()) {
            try {
                current.cancelConsumer(tag, false);
            } catch (IOException | RuntimeException e) {
                log.warnWithParams("Unexpected error when cancelling consumer.", e, "consumerTag", tag);
                primary.addSuppressed(e);
            }
        }
        try {
            closeChannel();
        } catch (IOException | RuntimeException e) {
            log.warnWithParams("Unexpected error when closing channel.", e, "channel", current);
            primary.addSuppressed(e);
        }
        return primary;
    }

    @Override
    public void ack(MessageDelivery delivery) {
        try {
            getChannel().ack(delivery.getTag());
        } catch (IOException | RuntimeException e) {
            throw new DriverException(ACK_FAILED, "Basic ack error", e);
        }
    }

    @Override
    public void reject(MessageDelivery delivery, boolean requeue) {
        try {
            getChannel().reject(delivery.getTag(), requeue);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(REJECT_FAILED, "Basic reject error", e);
        }
    }

    @Override
    public void declareExchange(ExchangeDefinition exchange) {
        try {
            getChannel().declareExchange(
                    exchange.getName(),
                    exchange.getType().name(),
                    exchange.isDurable(),
                    exchange.isAutoDeleted(),
                    exchange.isInternal(),
                    exchange.getArguments());
        } catch (IOException | RuntimeException e) {
            throw new DriverException(EXCHANGE_DECLARE_FAILED,
                    String.format("Exchange declare error \"%s\"", exchange.getName()), e);
        }
    }

    @Override
    public void bindExchange(String target, String source, String routingKey) {
        try {
            getChannel().bindExchange(target, source, routingKey);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(EXCHANGE_BIND_FAILED,
                    String.format("Exchange bind error \"%s\":\"%s\"->\"%s\"", source, routingKey, target), e);
        }
    }

    @Override
    public void declareQueue(QueueDefinition queue) {
        try {
            getChannel().declareQueue(
                    queue.getName(),
                    queue.isDurable(),
                    queue.isExclusive(),
                    queue.isAutoDeleted(),
                    queue.getArguments());
        } catch (IOException | RuntimeException e) {
            throw new DriverException(QUEUE_DECLARE_FAILED,
                    String.format("Queue declare error \"%s\"", queue.getName()), e);
        }
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        try {
            getChannel().bindQueue(queue, exchange, routingKey);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(QUEUE_BIND_FAILED,
                    String.format("Queue bind error \"%s\":\"%s\"->\"%s\"", exchange, routingKey, queue), e);
        }
    }

    @Override
    public void deleteExchange(ExchangeDefinition exchange, boolean ifUnused, boolean noWait) {
        try {
            getChannel().deleteExchange(exchange.getName(), ifUnused, noWait);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(EXCHANGE_DELETE_FAILED,
                    String.format("Exchange delete error \"%s\"", exchange.getName()), e);
        }
    }

    @Override
    public void deleteQueue(QueueDefinition queue, boolean ifUnused, boolean ifEmpty, boolean noWait) {
        try {
            getChannel().deleteQueue(queue.getName(), ifUnused, ifEmpty, noWait);
        } catch (IOException | RuntimeException e) {
            throw new DriverException(QUEUE_DELETE_FAILED,
                    String.format("Queue delete error \"%s\"", queue.getName()), e);
        }
    }

    /**
     * Safe to call from any thread. Sends a no-wait cancel for the active consumer, if any, and makes the
     * consume loop exit at its next iteration.
     */
    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.infoWithParams("Stop requested.", "consumerTag", currentTag);
        }
        String tag = currentTag;
        AmqpChannel current = channel;
        if (tag == null || current == null) {
            return;
        }
        try {
            current.cancelConsumer(tag, true);
        } catch (IOException | RuntimeException e) {
            log.warnWithParams("Could not send consumer cancel, the consume loop cancels on exit.", e,
                    "consumerTag", tag);
        }
    }
}
