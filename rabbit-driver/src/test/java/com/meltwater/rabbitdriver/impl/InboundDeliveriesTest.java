package com.meltwater.rabbitdriver.impl;

import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.ReadinessResult;
import com.meltwater.rabbitdriver.WaitFailure;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InboundDeliveriesTest {

    @Rule
    public Timeout globalTimeout = new Timeout(10, TimeUnit.SECONDS);

    private final InboundDeliveries inbound = new InboundDeliveries();
    private final Object owner = new Object();
    private final List<String> ran = new ArrayList<>();

    @Before
    public void setup() {
        inbound.open(owner);
    }

    @Test
    public void poll_without_activity_returns_zero() {
        ReadinessResult result = inbound.await(0);

        assertFalse(result.isReady());
        assertFalse(result.isFailure());
    }

    @Test
    public void timed_wait_returns_zero_after_the_timeout() {
        long start = System.nanoTime();

        ReadinessResult result = inbound.await(50);

        assertFalse(result.isReady());
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), greaterThanOrEqualTo(45L));
    }

    @Test
    public void work_is_handed_out_in_order_per_owner() {
        Object other = new Object();
        inbound.open(other);
        inbound.add(owner, () -> ran.add("first"));
        inbound.add(other, () -> ran.add("other"));
        inbound.add(owner, () -> ran.add("second"));

        assertThat(inbound.await(0).getReadyCount(), is(3));
        inbound.next(owner).run();
        inbound.next(owner).run();

        assertThat(ran, contains("first", "second"));
        assertThat(inbound.next(owner), nullValue());
        assertThat(inbound.size(), is(1));
    }

    @Test
    public void failure_is_reported_once_and_before_pending_work() {
        WaitFailure first = new WaitFailure("first", null);
        inbound.add(owner, () -> ran.add("a"));
        inbound.fail(owner, first);
        inbound.fail(owner, new WaitFailure("second", null));

        ReadinessResult result = inbound.await(0);
        assertTrue(result.isFailure());
        assertThat(result.getFailure(), sameInstance(first));

        assertThat(inbound.await(0).getReadyCount(), is(1));
    }

    @Test
    public void wakeup_ends_an_unbounded_wait() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ReadinessResult> waiting = executor.submit(() -> inbound.await(AmqpConnection.WAIT_FOREVER));

            inbound.wakeup(owner);

            ReadinessResult result = waiting.get(5, SECONDS);
            assertFalse(result.isReady());
            assertFalse(result.isFailure());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void wakeup_is_consumed_by_one_wait() {
        inbound.wakeup(owner);

        assertFalse(inbound.await(0).isReady());
        // the flag is reset, this poll sees the pending work
        inbound.add(owner, () -> ran.add("a"));
        assertThat(inbound.await(0).getReadyCount(), is(1));
    }

    @Test
    public void delivery_from_another_thread_ends_the_wait() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ReadinessResult> waiting = executor.submit(() -> inbound.await(AmqpConnection.WAIT_FOREVER));

            inbound.add(owner, () -> ran.add("a"));

            assertThat(waiting.get(5, SECONDS).getReadyCount(), is(1));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void interrupt_ends_the_wait_with_an_interrupted_failure() throws Exception {
        AtomicReference<ReadinessResult> result = new AtomicReference<>();
        Thread waiter = new Thread(() -> result.set(inbound.await(AmqpConnection.WAIT_FOREVER)));
        waiter.start();
        await().atMost(5, SECONDS).until(() -> waiter.getState() == Thread.State.WAITING);

        waiter.interrupt();
        waiter.join(5000);

        assertTrue(result.get().isFailure());
        assertTrue(result.get().getFailure().isInterrupted());
        assertThat(result.get().getFailure().getMessage(), is("Interrupted system call"));
    }

    @Test
    public void discard_drops_only_the_owners_work() {
        Object other = new Object();
        inbound.open(other);
        inbound.add(owner, () -> ran.add("a"));
        inbound.add(owner, () -> ran.add("b"));
        inbound.add(other, () -> ran.add("c"));

        assertThat(inbound.discard(owner), is(2));
        assertThat(inbound.size(), is(1));
        assertThat(inbound.discard(owner), is(0));
    }

    @Test
    public void work_of_a_discarded_owner_is_dropped() {
        inbound.discard(owner);

        assertFalse(inbound.add(owner, () -> ran.add("late")));
        assertThat(inbound.size(), is(0));
        assertFalse(inbound.await(0).isReady());
    }

    @Test
    public void work_of_an_owner_never_opened_is_dropped() {
        assertFalse(inbound.add(new Object(), () -> ran.add("stray")));

        assertFalse(inbound.await(0).isReady());
    }

    @Test
    public void failure_of_a_discarded_owner_is_not_reported() {
        inbound.fail(owner, new WaitFailure("closed under us", null));
        inbound.discard(owner);
        inbound.fail(owner, new WaitFailure("after close", null));

        ReadinessResult result = inbound.await(0);

        assertFalse(result.isFailure());
        assertFalse(result.isReady());
    }

    @Test
    public void discard_keeps_the_failure_of_another_owner() {
        Object other = new Object();
        inbound.open(other);
        WaitFailure failure = new WaitFailure("other channel", null);
        inbound.fail(other, failure);

        inbound.discard(owner);

        assertThat(inbound.await(0).getFailure(), sameInstance(failure));
    }

    @Test
    public void wakeup_of_a_discarded_owner_is_forgotten() {
        inbound.wakeup(owner);
        inbound.discard(owner);
        Object next = new Object();
        inbound.open(next);

        long start = System.nanoTime();
        ReadinessResult result = inbound.await(50);

        assertFalse(result.isReady());
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), greaterThanOrEqualTo(45L));
    }
}
