package com.meltwater.rabbitdriver.fakes;

import com.meltwater.rabbitdriver.AmqpChannel;
import com.meltwater.rabbitdriver.DeliveryCallback;
import com.meltwater.rabbitdriver.WireMessage;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In memory channel recording every protocol call as a list of the operation name followed by its arguments.
 */
public class FakeChannel implements AmqpChannel {

    private final FakeConnection connection;
    private final int number;

    private final List<List<Object>> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, RuntimeException> runtimeFailures = new HashMap<>();
    private final Map<String, IOException> ioFailures = new HashMap<>();
    private final Deque<WireMessage> pending = new ArrayDeque<>();

    private DeliveryCallback callback;
    private volatile boolean open = true;
    private volatile boolean closed = false;
    private int consumerCount = 0;

    FakeChannel(FakeConnection connection, int number) {
        this.connection = connection;
        this.number = number;
    }

    public FakeChannel failOn(String operation, IOException e) {
        ioFailures.put(operation, e);
        return this;
    }

    public FakeChannel failOn(String operation, RuntimeException e) {
        runtimeFailures.put(operation, e);
        return this;
    }

    /**
     * Simulate the broker closing the channel.
     */
    public void breakChannel() {
        open = false;
    }

    public List<List<Object>> getCalls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public List<List<Object>> getCalls(String operation) {
        List<List<Object>> out = new ArrayList<>();
        for (List<Object> call : getCalls()) {
            if (call.get(0).equals(operation)) {
                out.add(call);
            }
        }
        return out;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getNumber() {
        return number;
    }

    synchronized int push(List<WireMessage> messages) {
        pending.addAll(messages);
        return pending.size();
    }

    private void record(String operation, Object... args) throws IOException {
        List<Object> call = new ArrayList<>();
        call.add(operation);
        call.addAll(Arrays.asList(args));
        calls.add(call);
        if (ioFailures.containsKey(operation)) {
            throw ioFailures.get(operation);
        }
        if (runtimeFailures.containsKey(operation)) {
            throw runtimeFailures.get(operation);
        }
    }

    @Override
    public void publish(WireMessage message, String exchange, String routingKey, boolean mandatory, boolean immediate) throws IOException {
        record("publish", message, exchange, routingKey, mandatory, immediate);
    }

    @Override
    public synchronized String registerConsumer(String queue, DeliveryCallback callback) throws IOException {
        String tag = "ctag-" + number + "." + (++consumerCount);
        record("registerConsumer", queue, tag);
        this.callback = callback;
        return tag;
    }

    @Override
    public void processOneWaitCycle() throws IOException {
        record("processOneWaitCycle");
        WireMessage next;
        DeliveryCallback current;
        synchronized (this) {
            next = pending.poll();
            current = callback;
        }
        if (next != null && current != null) {
            current.onDelivery(next);
        }
    }

    @Override
    public void cancelConsumer(String consumerTag, boolean noWait) throws IOException {
        record("cancelConsumer", consumerTag, noWait);
        if (noWait) {
            connection.wakeup();
        }
    }

    @Override
    public void qos(int prefetchCount) throws IOException {
        record("qos", prefetchCount);
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        record("ack", deliveryTag);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
        record("reject", deliveryTag, requeue);
    }

    @Override
    public void declareExchange(String exchange, String type, boolean durable, boolean autoDelete, boolean internal, Map<String, Object> arguments) throws IOException {
        record("declareExchange", exchange, type, durable, autoDelete, internal, arguments);
    }

    @Override
    public void bindExchange(String destination, String source, String routingKey) throws IOException {
        record("bindExchange", destination, source, routingKey);
    }

    @Override
    public void declareQueue(String queue, boolean durable, boolean exclusive, boolean autoDelete, Map<String, Object> arguments) throws IOException {
        record("declareQueue", queue, durable, exclusive, autoDelete, arguments);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        record("bindQueue", queue, exchange, routingKey);
    }

    @Override
    public void deleteExchange(String exchange, boolean ifUnused, boolean noWait) throws IOException {
        record("deleteExchange", exchange, ifUnused, noWait);
    }

    @Override
    public void deleteQueue(String queue, boolean ifUnused, boolean ifEmpty, boolean noWait) throws IOException {
        record("deleteQueue", queue, ifUnused, ifEmpty, noWait);
    }

    @Override
    public boolean isOpen() {
        return open && !closed;
    }

    @Override
    public void close() throws IOException {
        record("close");
        closed = true;
    }

    @Override
    public String toString() {
        return "FakeChannel{" + number + "}";
    }
}
