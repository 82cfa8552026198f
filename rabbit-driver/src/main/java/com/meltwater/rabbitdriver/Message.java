package com.meltwater.rabbitdriver;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Date;
import java.util.Map;
import java.util.Objects;

/**
 * The domain representation of a message body together with the AMQP basic properties the driver carries
 * across the wire. Instances are immutable, use {@link Message.Builder} to create them.
 *
 * The delivery mode is not part of the message, it is a property of the {@link MessagePublication}.
 */
public class Message {

    private final byte[] body;
    private final String contentType;
    private final String contentEncoding;
    private final ImmutableMap<String, Object> headers;
    private final String messageId;
    private final String correlationId;
    private final String replyTo;
    private final String expiration;
    private final Integer priority;
    private final Date timestamp;
    private final String type;
    private final String userId;
    private final String appId;
    private final String clusterId;

    private Message(Builder b) {
        this.body = b.body;
        this.contentType = b.contentType;
        this.contentEncoding = b.contentEncoding;
        this.headers = ImmutableMap.copyOf(b.headers);
        this.messageId = b.messageId;
        this.correlationId = b.correlationId;
        this.replyTo = b.replyTo;
        this.expiration = b.expiration;
        this.priority = b.priority;
        this.timestamp = b.timestamp;
        this.type = b.type;
        this.userId = b.userId;
        this.appId = b.appId;
        this.clusterId = b.clusterId;
    }

    public static Builder builder(byte[] body) {
        return new Builder(body);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public ImmutableMap<String, Object> getHeaders() {
        return headers;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public String getExpiration() {
        return expiration;
    }

    public Integer getPriority() {
        return priority;
    }

    public Date getTimestamp() {
        return timestamp == null ? null : new Date(timestamp.getTime());
    }

    public String getType() {
        return type;
    }

    public String getUserId() {
        return userId;
    }

    public String getAppId() {
        return appId;
    }

    public String getClusterId() {
        return clusterId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message that = (Message) o;
        return Arrays.equals(body, that.body)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(contentEncoding, that.contentEncoding)
                && headers.equals(that.headers)
                && Objects.equals(messageId, that.messageId)
                && Objects.equals(correlationId, that.correlationId)
                && Objects.equals(replyTo, that.replyTo)
                && Objects.equals(expiration, that.expiration)
                && Objects.equals(priority, that.priority)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(type, that.type)
                && Objects.equals(userId, that.userId)
                && Objects.equals(appId, that.appId)
                && Objects.equals(clusterId, that.clusterId);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(body);
        result = 31 * result + Objects.hash(contentType, contentEncoding, headers, messageId, correlationId,
                replyTo, expiration, priority, timestamp, type, userId, appId, clusterId);
        return result;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("bodySize", body.length)
                .add("contentType", contentType)
                .add("messageId", messageId)
                .add("correlationId", correlationId)
                .add("type", type)
                .add("headers", headers.isEmpty() ? null : headers)
                .toString();
    }

    public static class Builder {

        private final byte[] body;
        private String contentType;
        private String contentEncoding;
        private Map<String, Object> headers = ImmutableMap.of();
        private String messageId;
        private String correlationId;
        private String replyTo;
        private String expiration;
        private Integer priority;
        private Date timestamp;
        private String type;
        private String userId;
        private String appId;
        private String clusterId;

        private Builder(byte[] body) {
            this.body = Objects.requireNonNull(body, "body").clone();
        }

        public Builder withContentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder withContentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder withHeaders(Map<String, Object> headers) {
            this.headers = headers == null ? ImmutableMap.of() : headers;
            return this;
        }

        public Builder withMessageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder withCorrelationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder withReplyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder withExpiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder withPriority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder withTimestamp(Date timestamp) {
            this.timestamp = timestamp == null ? null : new Date(timestamp.getTime());
            return this;
        }

        public Builder withType(String type) {
            this.type = type;
            return this;
        }

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder withClusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
