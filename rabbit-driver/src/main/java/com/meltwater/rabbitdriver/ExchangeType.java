package com.meltwater.rabbitdriver;

/**
 * The exchange types a broker speaking AMQP 0-9-1 is required to support.
 *
 * The enum constant names are the wire names used in exchange.declare.
 */
public enum ExchangeType {
    direct,
    fanout,
    topic,
    headers
}
