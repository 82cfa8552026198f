package com.meltwater.rabbitdriver;

/**
 * A transport whose consuming can be stopped from another thread, for example a JVM shutdown hook.
 */
public interface Stoppable {

    /**
     * Stop the active consume loop at its next iteration. Once stopped the transport never consumes again.
     * Does not block.
     */
    void stop();
}
