package com.meltwater.rabbitdriver;

import java.io.IOException;

/**
 * A broker session that channels are multiplexed on.
 *
 * Inbound deliveries for every channel opened on the connection are signalled through
 * {@link #waitForActivity(long)} and dispatched by {@link AmqpChannel#processOneWaitCycle()}.
 */
public interface AmqpConnection {

    /**
     * Passed to {@link #waitForActivity(long)} to wait until something is ready or the wait fails.
     * A timeout of 0 means return immediately.
     */
    long WAIT_FOREVER = -1;

    AmqpChannel openChannel() throws IOException;

    /**
     * Block until inbound activity is pending, the timeout elapses or the wait fails.
     *
     * @param timeoutMillis max time to wait, 0 to poll, {@link #WAIT_FOREVER} for no limit
     * @return ready with the number of pending deliveries, zero on timeout, or the failure
     */
    ReadinessResult waitForActivity(long timeoutMillis);

    boolean isOpen();

    /**
     * Close the connection and every channel on it. Only the owner of the connection should call this.
     */
    void close() throws IOException;
}
