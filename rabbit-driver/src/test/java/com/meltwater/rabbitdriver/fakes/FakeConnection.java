package com.meltwater.rabbitdriver.fakes;

import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.ReadinessResult;
import com.meltwater.rabbitdriver.WaitFailure;
import com.meltwater.rabbitdriver.WireMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In memory connection whose {@link #waitForActivity(long)} answers follow a script.
 *
 * When the script is exhausted a wait blocks until {@link #wakeup()} is called (as a no-wait cancel does) or the
 * wait times out.
 */
public class FakeConnection implements AmqpConnection {

    /**
     * One scripted answer to a wait.
     */
    public interface Step {
        ReadinessResult answer(long timeoutMillis);
    }

    private final Queue<Step> script = new ConcurrentLinkedQueue<>();
    private final BlockingQueue<ReadinessResult> signals = new LinkedBlockingQueue<>();
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final List<Long> waitTimeouts = new CopyOnWriteArrayList<>();
    private final AtomicLong deliveryTags = new AtomicLong();

    private IOException openFailure;
    private volatile boolean open = true;

    public FakeConnection thenDeliver(String... bodies) {
        script.add(timeout -> {
            List<WireMessage> messages = new ArrayList<>();
            for (String body : bodies) {
                messages.add(wireMessage(body));
            }
            return ReadinessResult.ready(lastChannel().push(messages));
        });
        return this;
    }

    public FakeConnection thenIdle() {
        script.add(timeout -> ReadinessResult.zero());
        return this;
    }

    public FakeConnection thenFail(WaitFailure failure) {
        script.add(timeout -> ReadinessResult.failure(failure));
        return this;
    }

    public FakeConnection then(Step step) {
        script.add(step);
        return this;
    }

    public FakeConnection failOpenWith(IOException e) {
        this.openFailure = e;
        return this;
    }

    public void wakeup() {
        signals.add(ReadinessResult.zero());
    }

    public void close() {
        open = false;
    }

    public List<FakeChannel> getChannels() {
        return channels;
    }

    public FakeChannel lastChannel() {
        if (channels.isEmpty()) {
            throw new IllegalStateException("No channel opened yet");
        }
        return channels.get(channels.size() - 1);
    }

    public List<Long> getWaitTimeouts() {
        return waitTimeouts;
    }

    @Override
    public FakeChannel openChannel() throws IOException {
        if (openFailure != null) {
            throw openFailure;
        }
        FakeChannel channel = new FakeChannel(this, channels.size() + 1);
        channels.add(channel);
        return channel;
    }

    @Override
    public ReadinessResult waitForActivity(long timeoutMillis) {
        waitTimeouts.add(timeoutMillis);
        Step step = script.poll();
        if (step != null) {
            return step.answer(timeoutMillis);
        }
        try {
            ReadinessResult signal = timeoutMillis == WAIT_FOREVER
                    ? signals.take()
                    : signals.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            return signal == null ? ReadinessResult.zero() : signal;
        } catch (InterruptedException e) {
            return ReadinessResult.failure(WaitFailure.interrupted(e));
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    private WireMessage wireMessage(String body) {
        Envelope envelope = new Envelope(deliveryTags.incrementAndGet(), false, "source-exchange", "source.key");
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType("text/plain")
                .deliveryMode(2)
                .build();
        return new WireMessage(envelope, properties, body.getBytes());
    }

    @Override
    public String toString() {
        return "FakeConnection" + Arrays.toString(channels.toArray());
    }
}
