package com.meltwater.rabbitdriver.impl;

import com.meltwater.rabbitdriver.DriverException;
import com.meltwater.rabbitdriver.MessageDelivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Consume sessions on the amqp-client adapters, one channel per session on the same connection.
 */
public class RabbitDriverChannelTurnoverTest {

    @Rule
    public Timeout globalTimeout = new Timeout(10, TimeUnit.SECONDS);

    private Connection amqpConnection;
    private Channel first;
    private Channel second;
    private RabbitDriver driver;

    private final List<String> handled = new CopyOnWriteArrayList<>();

    @Before
    public void setup() throws Exception {
        amqpConnection = mock(Connection.class);
        when(amqpConnection.isOpen()).thenReturn(true);
        first = openChannel();
        second = openChannel();
        when(amqpConnection.createChannel()).thenReturn(first, second);
        RabbitConnection connection = new RabbitConnection(amqpConnection, "turnover-driver");
        driver = new RabbitDriver(() -> connection);
    }

    @Test
    public void late_delivery_of_the_previous_channel_does_not_keep_the_next_consume_busy() throws Exception {
        AtomicReference<Consumer> firstConsumer = deliverOnConsume(first, "tag-1", "a");
        doAnswer(invocation -> {
            firstConsumer.get().handleDelivery("tag-1", new Envelope(2L, false, "events", "order.created"), null, "late".getBytes());
            return null;
        }).when(first).close();
        deliverNothingOnConsume(second, "tag-2");

        driver.consume("orders", this::handleOne, 200, 3000);
        long start = System.nanoTime();
        driver.consume("orders", this::handleAll, 200, 3000);
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // ended on the idle timeout, not the total one
        assertThat(tookMillis, lessThan(2000L));
        assertThat(handled, contains("a"));
    }

    @Test
    public void failure_of_the_previous_channel_does_not_fail_the_next_consume() throws Exception {
        AtomicReference<Consumer> firstConsumer = deliverOnConsume(first, "tag-1", "a");
        ShutdownSignalException sig = new ShutdownSignalException(false, false, null, first);
        doAnswer(invocation -> {
            firstConsumer.get().handleShutdownSignal("tag-1", sig);
            throw new AlreadyClosedException(sig);
        }).when(first).basicCancel("tag-1");
        deliverOnConsume(second, "tag-2", "b");

        try {
            driver.consume("orders", this::handleOne, 200, 3000);
            fail("Expected DriverException");
        } catch (DriverException e) {
            assertThat(e.getKind(), is(DriverException.Kind.CONSUME_FAILED));
        }
        driver.consume("orders", this::handleOne, 200, 3000);

        assertThat(handled, contains("a", "b"));
    }

    private boolean handleOne(MessageDelivery delivery) {
        handled.add(new String(delivery.getMessage().getBody()));
        return false;
    }

    private boolean handleAll(MessageDelivery delivery) {
        handled.add(new String(delivery.getMessage().getBody()));
        return true;
    }

    private Channel openChannel() {
        Channel channel = mock(Channel.class);
        when(channel.isOpen()).thenReturn(true);
        when(channel.getConnection()).thenReturn(amqpConnection);
        return channel;
    }

    private static AtomicReference<Consumer> deliverOnConsume(Channel channel, String tag, String body) throws Exception {
        AtomicReference<Consumer> consumer = new AtomicReference<>();
        when(channel.basicConsume(eq("orders"), eq(false), eq(""), eq(false), eq(false), isNull(), any(Consumer.class)))
                .thenAnswer(invocation -> {
                    consumer.set(invocation.getArgument(6));
                    consumer.get().handleDelivery(tag, new Envelope(1L, false, "events", "order.created"),
                            new AMQP.BasicProperties(), body.getBytes());
                    return tag;
                });
        return consumer;
    }

    private static void deliverNothingOnConsume(Channel channel, String tag) throws Exception {
        when(channel.basicConsume(eq("orders"), eq(false), eq(""), eq(false), eq(false), isNull(), any(Consumer.class)))
                .thenReturn(tag);
    }
}
