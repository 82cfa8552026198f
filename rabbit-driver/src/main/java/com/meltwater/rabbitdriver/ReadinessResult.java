package com.meltwater.rabbitdriver;

/**
 * Outcome of one bounded wait for inbound activity on a connection.
 *
 * @see AmqpConnection#waitForActivity(long)
 */
public final class ReadinessResult {

    private static final ReadinessResult ZERO = new ReadinessResult(0, null);

    private final int readyCount;
    private final WaitFailure failure;

    private ReadinessResult(int readyCount, WaitFailure failure) {
        this.readyCount = readyCount;
        this.failure = failure;
    }

    /**
     * @return the result of a wait that timed out with nothing ready
     */
    public static ReadinessResult zero() {
        return ZERO;
    }

    public static ReadinessResult ready(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("ready count must be positive, was " + count);
        }
        return new ReadinessResult(count, null);
    }

    public static ReadinessResult failure(WaitFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new ReadinessResult(0, failure);
    }

    public boolean isFailure() {
        return failure != null;
    }

    public boolean isReady() {
        return readyCount > 0;
    }

    public int getReadyCount() {
        return readyCount;
    }

    public WaitFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        if (failure != null) {
            return "failure(" + failure.getMessage() + ")";
        }
        return readyCount > 0 ? "ready(" + readyCount + ")" : "zero";
    }
}
