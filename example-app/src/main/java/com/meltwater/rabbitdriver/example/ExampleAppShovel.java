package com.meltwater.rabbitdriver.example;

import com.meltwater.rabbitdriver.AmqpDriver;
import com.meltwater.rabbitdriver.BrokerAddress;
import com.meltwater.rabbitdriver.DriverException;
import com.meltwater.rabbitdriver.DriverSettings;
import com.meltwater.rabbitdriver.ExchangeDefinition;
import com.meltwater.rabbitdriver.MessageDelivery;
import com.meltwater.rabbitdriver.MessagePublication;
import com.meltwater.rabbitdriver.QueueDefinition;
import com.meltwater.rabbitdriver.impl.DefaultConnectionProvider;
import com.meltwater.rabbitdriver.impl.RabbitDriver;
import com.meltwater.rabbitdriver.util.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * An example app which moves every message of a queue to an exchange, keeping its routing key.
 */
public class ExampleAppShovel {

    private static final Logger log = new Logger(ExampleAppShovel.class);

    public static void main(String[] args) throws IOException, InterruptedException {
        Properties prop = new Properties();
        try (InputStream in = ExampleAppShovel.class.getResourceAsStream("/example_app.properties")) {
            prop.load(in);
        }
        prop.putAll(System.getProperties());

        DriverSettings settings = DriverSettings.fromJson(prop.getProperty("rabbit.driver.settings", "{}"));
        final DefaultConnectionProvider connectionProvider = new DefaultConnectionProvider(
                BrokerAddress.fromUri(prop.getProperty("rabbit.broker.uri")), settings);
        final ExampleAppShovel exampleAppShovel = new ExampleAppShovel(
                new RabbitDriver(connectionProvider, settings),
                prop.getProperty("rabbit.input.queue"),
                prop.getProperty("rabbit.output.exchange"),
                Long.parseLong(prop.getProperty("rabbit.idle.timeout.millis", "0")));

        exampleAppShovel.start();

        //On shutdown call stop
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            exampleAppShovel.stop();
            try {
                exampleAppShovel.awaitTermination(10_000);
                connectionProvider.close();
            } catch (InterruptedException | IOException e) {
                log.warnWithParams("Unclean shutdown.", e);
            }
        }));

        exampleAppShovel.awaitTermination(0);
        if (exampleAppShovel.hasFailed()) {
            log.errorWithParams("Fatal error encountered. Closing down application.");
            System.exit(1);
        }
    }

    private final AmqpDriver driver;
    private final String inputQueue;
    private final String outputExchange;
    private final long idleTimeoutMillis;

    private volatile boolean running = false;
    private volatile boolean failed = false;
    private Thread consumerThread;

    public ExampleAppShovel(AmqpDriver driver, String inputQueue, String outputExchange, long idleTimeoutMillis) {
        this.driver = driver;
        this.inputQueue = inputQueue;
        this.outputExchange = outputExchange;
        this.idleTimeoutMillis = idleTimeoutMillis;
    }

    synchronized void start() {
        if (consumerThread != null) {
            return;
        }
        driver.declareExchange(ExchangeDefinition.builder(outputExchange).build());
        driver.declareQueue(QueueDefinition.builder(inputQueue).build());
        running = true;
        consumerThread = new Thread(this::consumeUntilStopped, "shovel-" + inputQueue);
        consumerThread.start();
        log.infoWithParams("Shovel started.",
                "inputQueue", inputQueue,
                "outputExchange", outputExchange);
    }

    private void consumeUntilStopped() {
        try {
            // an idle timeout ends one consume call, keep going until told to stop
            while (running) {
                driver.consume(inputQueue, this::handleMessage, idleTimeoutMillis, AmqpDriver.NO_TIMEOUT);
            }
        } catch (DriverException e) {
            log.errorWithParams("Consuming failed.", e, "inputQueue", inputQueue, "kind", e.getKind());
            failed = true;
        } finally {
            running = false;
        }
    }

    boolean handleMessage(MessageDelivery delivery) {
        //change in logback.xml to DEBUG level to see every message payload logged
        log.debugWithParams("Received message.",
                "payload", new String(delivery.getMessage().getBody()),
                "routingKey", delivery.getRoutingKey());
        try {
            driver.publish(MessagePublication.persistent(delivery.getMessage()), outputExchange, delivery.getRoutingKey());
        } catch (DriverException e) {
            log.warnWithParams("Could not forward message, requeueing it.", e, "deliveryTag", delivery.getTag());
            driver.reject(delivery, true);
            return running;
        }
        driver.ack(delivery);
        return running;
    }

    void stop() {
        running = false;
        driver.stop();
    }

    /**
     * @param millis max time to wait, 0 to wait forever
     */
    void awaitTermination(long millis) throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = consumerThread;
        }
        if (thread != null) {
            thread.join(millis);
        }
    }

    boolean isRunning() {
        return running;
    }

    boolean hasFailed() {
        return failed;
    }
}
