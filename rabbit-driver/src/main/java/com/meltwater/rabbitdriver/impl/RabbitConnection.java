package com.meltwater.rabbitdriver.impl;

import com.meltwater.rabbitdriver.AmqpChannel;
import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.ReadinessResult;
import com.meltwater.rabbitdriver.util.Logger;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.io.IOException;

/**
 * {@link AmqpConnection} on top of an amqp-client {@link Connection}.
 *
 * Deliveries of every channel opened here share one readiness signal, so a connection should back a single driver.
 */
public class RabbitConnection implements AmqpConnection {

    private static final Logger log = new Logger(RabbitConnection.class);

    private final Connection delegate;
    private final String name;
    private final InboundDeliveries inbound;

    public RabbitConnection(Connection delegate, String name) {
        this(delegate, name, new InboundDeliveries());
    }

    RabbitConnection(Connection delegate, String name, InboundDeliveries inbound) {
        this.delegate = delegate;
        this.name = name;
        this.inbound = inbound;
    }

    @Override
    public AmqpChannel openChannel() throws IOException {
        Channel channel = delegate.createChannel();
        if (channel == null) {
            throw new IOException("No channel available on connection '" + name + "', channel_max reached");
        }
        RabbitChannel wrapper = new RabbitChannel(channel, inbound);
        log.infoWithParams("Successfully created channel.",
                "channel", wrapper,
                "connectionName", name);
        return wrapper;
    }

    @Override
    public ReadinessResult waitForActivity(long timeoutMillis) {
        return inbound.await(timeoutMillis);
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        boolean wasOpen = delegate.isOpen();
        if (wasOpen) {
            delegate.close();
        }
        log.infoWithParams("Closed and disposed connection.",
                "name", name,
                "wasOpen", wasOpen);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "{" +
                "name='" + name + '\'' +
                ", address=" + delegate.getAddress() +
                ", port=" + delegate.getPort() +
                '}';
    }
}
