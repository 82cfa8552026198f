package com.meltwater.rabbitdriver;

import java.util.Locale;

/**
 * Decides whether a failed wait inside the consume loop is a harmless wakeup or a transport failure.
 *
 * A benign failure ends the consume call normally (the consumer is cancelled and the channel closed) and the caller
 * may simply call consume again. Any other failure is surfaced as {@link DriverException.Kind#CONSUME_FAILED}.
 */
@FunctionalInterface
public interface InterruptionPolicy {

    String INTERRUPTED_SIGNATURE = "interrupted system call";

    /**
     * Benign when the failure has no detail at all, when the waiting thread was interrupted,
     * or when the message contains {@value #INTERRUPTED_SIGNATURE}. Everything else is fatal.
     */
    InterruptionPolicy DEFAULT = failure -> {
        if (!failure.hasDetail() || failure.isInterrupted()) {
            return true;
        }
        String message = failure.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(INTERRUPTED_SIGNATURE);
    };

    boolean isBenign(WaitFailure failure);
}
