package com.meltwater.rabbitdriver;

/**
 * Caller supplied handler for {@link AmqpDriver#consume(String, DeliveryHandler, long, long)}.
 *
 * Runs on the consuming thread and blocks the consume loop while it runs, so it must not block indefinitely.
 */
@FunctionalInterface
public interface DeliveryHandler {

    /**
     * @return true to keep consuming, false to stop after this delivery
     */
    boolean handle(MessageDelivery delivery);
}
