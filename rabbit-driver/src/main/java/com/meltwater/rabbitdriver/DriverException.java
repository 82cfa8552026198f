package com.meltwater.rabbitdriver;

/**
 * Thrown by every {@link AmqpDriver} operation when the underlying transport fails.
 *
 * The {@link Kind} tells which driver operation failed, the cause is the original transport error.
 * The driver never retries, retry policy belongs to the caller.
 */
public class DriverException extends RuntimeException {

    public enum Kind {
        PUBLISH_FAILED,
        CONSUME_FAILED,
        ACK_FAILED,
        REJECT_FAILED,
        EXCHANGE_DECLARE_FAILED,
        EXCHANGE_BIND_FAILED,
        EXCHANGE_DELETE_FAILED,
        QUEUE_DECLARE_FAILED,
        QUEUE_BIND_FAILED,
        QUEUE_DELETE_FAILED
    }

    private final Kind kind;

    public DriverException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{kind=" + kind + ", message=" + getMessage() + "}";
    }
}
