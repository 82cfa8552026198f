package com.meltwater.rabbitdriver;

/**
 * Receives the raw messages of a consumer registered with {@link AmqpChannel#registerConsumer(String, DeliveryCallback)}.
 */
@FunctionalInterface
public interface DeliveryCallback {

    void onDelivery(WireMessage message);
}
