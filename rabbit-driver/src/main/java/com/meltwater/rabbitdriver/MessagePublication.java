package com.meltwater.rabbitdriver;

import java.util.Objects;

/**
 * A message together with the flags it should be published with.
 *
 * The destination (exchange and routing key) is given to {@link AmqpDriver#publish(MessagePublication, String, String)}.
 */
public class MessagePublication {

    private final Message message;
    private final boolean persistent;
    private final boolean mandatory;
    private final boolean immediate;

    public MessagePublication(Message message, boolean persistent, boolean mandatory, boolean immediate) {
        this.message = Objects.requireNonNull(message, "message");
        this.persistent = persistent;
        this.mandatory = mandatory;
        this.immediate = immediate;
    }

    /**
     * @return a persistent publication that is neither mandatory nor immediate
     */
    public static MessagePublication persistent(Message message) {
        return new MessagePublication(message, true, false, false);
    }

    /**
     * @return a transient publication that is neither mandatory nor immediate
     */
    public static MessagePublication transientMessage(Message message) {
        return new MessagePublication(message, false, false, false);
    }

    public Message getMessage() {
        return message;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public boolean isImmediate() {
        return immediate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessagePublication that = (MessagePublication) o;
        return persistent == that.persistent
                && mandatory == that.mandatory
                && immediate == that.immediate
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, persistent, mandatory, immediate);
    }

    @Override
    public String toString() {
        return "{" +
                "message=" + message +
                ", persistent=" + persistent +
                ", mandatory=" + mandatory +
                ", immediate=" + immediate +
                '}';
    }
}
