package com.meltwater.rabbitdriver.impl;

import com.google.common.collect.Sets;
import com.meltwater.rabbitdriver.AmqpConnection;
import com.meltwater.rabbitdriver.ReadinessResult;
import com.meltwater.rabbitdriver.WaitFailure;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hand-over point between the amqp-client dispatch threads and the thread running a consume loop.
 *
 * The client threads {@link #add} pending work and report transport failures with {@link #fail}.
 * The consuming thread blocks in {@link #await} and runs the work it takes with {@link #next} on its own stack.
 *
 * Everything is kept per owner, a channel. Only owners between {@link #open} and {@link #discard} are heard,
 * so whatever the client still hands over for a closed channel never reaches a later consume.
 */
class InboundDeliveries {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition activity = lock.newCondition();

    private final Set<Object> openOwners = Sets.newIdentityHashSet();
    private final Deque<Pending> pending = new ArrayDeque<>();
    private Object failureOwner;
    private WaitFailure failure;
    private Object wakeupOwner;

    void open(Object owner) {
        lock.lock();
        try {
            openOwners.add(owner);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if the owner is not open and the work was dropped
     */
    boolean add(Object owner, Runnable dispatch) {
        lock.lock();
        try {
            if (!openOwners.contains(owner)) {
                return false;
            }
            pending.addLast(new Pending(owner, dispatch));
            activity.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a failure for the next {@link #await}. Only the first failure is kept until it has been reported
     * or its owner is discarded.
     */
    void fail(Object owner, WaitFailure waitFailure) {
        lock.lock();
        try {
            if (failure == null && openOwners.contains(owner)) {
                failureOwner = owner;
                failure = waitFailure;
                activity.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make a waiting (or the next) {@link #await} return even if nothing is pending.
     */
    void wakeup(Object owner) {
        lock.lock();
        try {
            if (openOwners.contains(owner)) {
                wakeupOwner = owner;
                activity.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * A recorded failure is reported once, before any pending work. A wakeup with nothing pending returns zero.
     *
     * @param timeoutMillis 0 to poll, {@link AmqpConnection#WAIT_FOREVER} to wait without limit
     */
    ReadinessResult await(long timeoutMillis) {
        lock.lock();
        try {
            long nanos = TimeUnit.MILLISECONDS.toNanos(Math.max(timeoutMillis, 0));
            while (pending.isEmpty() && failure == null && wakeupOwner == null) {
                if (timeoutMillis == AmqpConnection.WAIT_FOREVER) {
                    activity.await();
                } else if (nanos <= 0) {
                    return ReadinessResult.zero();
                } else {
                    nanos = activity.awaitNanos(nanos);
                }
            }
            if (failure != null) {
                WaitFailure reported = failure;
                failure = null;
                failureOwner = null;
                return ReadinessResult.failure(reported);
            }
            wakeupOwner = null;
            // pending only ever holds work of open owners
            return pending.isEmpty() ? ReadinessResult.zero() : ReadinessResult.ready(pending.size());
        } catch (InterruptedException e) {
            return ReadinessResult.failure(WaitFailure.interrupted(e));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the oldest pending work of one owner.
     *
     * @return the work or null if the owner has nothing pending
     */
    Runnable next(Object owner) {
        lock.lock();
        try {
            Iterator<Pending> it = pending.iterator();
            while (it.hasNext()) {
                Pending p = it.next();
                if (p.owner == owner) {
                    it.remove();
                    return p.dispatch;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget an owner that is going away together with its pending work, its unreported failure and its wakeup.
     * Later work and failures of the owner are dropped. The broker redelivers unacked messages.
     *
     * @return the number of discarded deliveries
     */
    int discard(Object owner) {
        lock.lock();
        try {
            openOwners.remove(owner);
            if (failureOwner == owner) {
                failure = null;
                failureOwner = null;
            }
            if (wakeupOwner == owner) {
                wakeupOwner = null;
            }
            int before = pending.size();
            pending.removeIf(p -> p.owner == owner);
            return before - pending.size();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class Pending {
        final Object owner;
        final Runnable dispatch;

        Pending(Object owner, Runnable dispatch) {
            this.owner = owner;
            this.dispatch = dispatch;
        }
    }
}
