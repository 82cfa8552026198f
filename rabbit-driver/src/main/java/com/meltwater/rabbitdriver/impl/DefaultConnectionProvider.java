package com.meltwater.rabbitdriver.impl;

import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.BrokerAddress;
import com.meltwater.rabbitdriver.ConnectionProvider;
import com.meltwater.rabbitdriver.DriverSettings;
import com.meltwater.rabbitdriver.util.Logger;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Connects to a single broker on first use and hands out the same connection until it closes.
 *
 * A closed connection is replaced on the next {@link #getConnection()}, the provider never retries on its own.
 * Automatic recovery of the amqp-client is disabled, a dropped connection surfaces as a consume failure.
 */
public class DefaultConnectionProvider implements ConnectionProvider, Closeable {

    private static final Logger log = new Logger(DefaultConnectionProvider.class);

    static final String CONNECTION_TYPE = "driver";

    private final BrokerAddress address;
    private final DriverSettings settings;

    private RabbitConnection connection;

    public DefaultConnectionProvider(BrokerAddress address, DriverSettings settings) {
        this.address = address;
        this.settings = settings;
    }

    @Override
    public synchronized AmqpConnection getConnection() throws IOException {
        if (connection != null) {
            if (connection.isOpen()) {
                return connection;
            }
            log.warnWithParams("Cached connection is closed, creating a new one.", "name", connection.getName());
            connection = null;
        }
        String connectionName = settings.app_id + "-" + CONNECTION_TYPE;
        DateTime startTime = new DateTime(DateTimeZone.UTC);
        ConnectionFactory cf = createConnectionFactory(connectionName, startTime);
        try {
            Connection amqpConnection = cf.newConnection(connectionName);
            connection = new RabbitConnection(amqpConnection, connectionName);
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + address, e);
        }
        log.infoWithParams("Successfully created connection to broker.",
                "address", address,
                "name", connectionName,
                "connectTime", startTime,
                "settings", settings);
        return connection;
    }

    ConnectionFactory createConnectionFactory(String connectionName, DateTime startTime) {
        ConnectionFactory cf = new ConnectionFactory();
        // added to the client defaults, replacing them would drop the advertised capabilities
        Map<String, Object> clientProperties = cf.getClientProperties();
        clientProperties.put("app_id", settings.app_id);
        clientProperties.put("name", connectionName);
        clientProperties.put("connect_time", startTime.toString());
        clientProperties.put("connection_type", CONNECTION_TYPE);

        address.applyTo(cf);
        cf.setRequestedHeartbeat(settings.heartbeat);
        cf.setConnectionTimeout(settings.connection_timeout_millis);
        cf.setShutdownTimeout(settings.shutdown_timeout_millis);
        cf.setRequestedFrameMax(settings.frame_max);
        cf.setHandshakeTimeout(settings.handshake_timeout_millis);
        cf.setRequestedChannelMax(0);
        cf.setAutomaticRecoveryEnabled(false);
        cf.setTopologyRecoveryEnabled(false);
        return cf;
    }

    /**
     * Close the connection handed out by this provider, if any.
     */
    @Override
    public synchronized void close() throws IOException {
        if (connection != null) {
            try {
                connection.close();
            } finally {
                connection = null;
            }
        }
    }
}
