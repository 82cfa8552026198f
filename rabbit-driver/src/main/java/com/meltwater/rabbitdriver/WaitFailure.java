package com.meltwater.rabbitdriver;

/**
 * Reported by {@link AmqpConnection#waitForActivity(long)} when waiting for inbound activity failed.
 *
 * Whether a failure ends the consume loop quietly or surfaces as a {@link DriverException}
 * is decided by the {@link InterruptionPolicy}.
 */
public class WaitFailure extends Exception {

    private final boolean interrupted;

    public WaitFailure(String message, Throwable cause) {
        this(message, cause, false);
    }

    private WaitFailure(String message, Throwable cause, boolean interrupted) {
        super(message, cause);
        this.interrupted = interrupted;
    }

    /**
     * @return a failure carrying neither a message nor a cause
     */
    public static WaitFailure withoutDetail() {
        return new WaitFailure(null, null, false);
    }

    /**
     * @return a failure recording that the waiting thread was interrupted
     */
    public static WaitFailure interrupted(InterruptedException cause) {
        return new WaitFailure("Interrupted system call", cause, true);
    }

    /**
     * @return true if the waiting thread was interrupted, the interrupt status has been cleared by the wait
     */
    public boolean isInterrupted() {
        return interrupted;
    }

    public boolean hasDetail() {
        String message = getMessage();
        return (message != null && !message.isEmpty()) || getCause() != null;
    }
}
