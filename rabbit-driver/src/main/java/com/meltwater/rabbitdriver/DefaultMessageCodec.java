package com.meltwater.rabbitdriver;

import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps every {@link Message} field onto the AMQP basic property of the same name.
 *
 * Header values the client decodes as {@link LongString} are turned back into {@link String}s, also inside
 * nested tables and arrays. Header entries with a void value are dropped on decode, the message headers are
 * immutable and hold no nulls. Apart from that a message survives a publish / consume round trip unchanged.
 */
public class DefaultMessageCodec implements MessageCodec {

    @Override
    public WireMessage encode(Message message, boolean persistent) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(message.getContentType())
                .contentEncoding(message.getContentEncoding())
                .headers(message.getHeaders().isEmpty() ? null : message.getHeaders())
                .deliveryMode(DeliveryMode.of(persistent).code)
                .priority(message.getPriority())
                .correlationId(message.getCorrelationId())
                .replyTo(message.getReplyTo())
                .expiration(message.getExpiration())
                .messageId(message.getMessageId())
                .timestamp(message.getTimestamp())
                .type(message.getType())
                .userId(message.getUserId())
                .appId(message.getAppId())
                .clusterId(message.getClusterId())
                .build();
        return new WireMessage(properties, message.getBody());
    }

    @Override
    public MessageDelivery decode(WireMessage wire, String queue) {
        AMQP.BasicProperties p = wire.properties;
        Message message = Message.builder(wire.body)
                .withContentType(p.getContentType())
                .withContentEncoding(p.getContentEncoding())
                .withHeaders(decodeTable(p.getHeaders()))
                .withPriority(p.getPriority())
                .withCorrelationId(p.getCorrelationId())
                .withReplyTo(p.getReplyTo())
                .withExpiration(p.getExpiration())
                .withMessageId(p.getMessageId())
                .withTimestamp(p.getTimestamp())
                .withType(p.getType())
                .withUserId(p.getUserId())
                .withAppId(p.getAppId())
                .withClusterId(p.getClusterId())
                .build();

        Envelope envelope = wire.envelope;
        if (envelope == null) {
            throw new IllegalArgumentException("Can not create a delivery from a message without envelope");
        }
        return new MessageDelivery(message,
                envelope.getDeliveryTag(),
                queue,
                envelope.isRedeliver(),
                envelope.getExchange(),
                envelope.getRoutingKey());
    }

    private static Map<String, Object> decodeTable(Map<?, ?> table) {
        if (table == null) {
            return ImmutableMap.of();
        }
        ImmutableMap.Builder<String, Object> out = ImmutableMap.builder();
        for (Map.Entry<?, ?> e : table.entrySet()) {
            // void values can not be represented in an immutable map
            if (e.getValue() != null) {
                out.put(String.valueOf(e.getKey()), decodeValue(e.getValue()));
            }
        }
        return out.build();
    }

    private static Object decodeValue(Object value) {
        if (value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof Map) {
            return decodeTable((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object o : (List<?>) value) {
                out.add(o == null ? null : decodeValue(o));
            }
            return out;
        }
        return value;
    }
}
