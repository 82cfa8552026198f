package com.meltwater.rabbitdriver;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Declarative description of a queue.
 *
 * @see AmqpDriver#declareQueue(QueueDefinition)
 * @see AmqpDriver#deleteQueue(QueueDefinition, boolean, boolean, boolean)
 */
public class QueueDefinition {

    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDeleted;
    private final ImmutableMap<String, Object> arguments;

    private QueueDefinition(String name, boolean durable, boolean exclusive, boolean autoDeleted, Map<String, Object> arguments) {
        this.name = name;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDeleted = autoDeleted;
        this.arguments = ImmutableMap.copyOf(arguments);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isAutoDeleted() {
        return autoDeleted;
    }

    public ImmutableMap<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueDefinition that = (QueueDefinition) o;
        return durable == that.durable
                && exclusive == that.exclusive
                && autoDeleted == that.autoDeleted
                && name.equals(that.name)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, durable, exclusive, autoDeleted, arguments);
    }

    @Override
    public String toString() {
        return "{" +
                "name:'" + name + '\'' +
                ", durable:" + durable +
                ", exclusive:" + exclusive +
                ", auto_deleted:" + autoDeleted +
                ", arguments:" + arguments +
                '}';
    }

    public static class Builder {

        private final String name;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDeleted = false;
        private Map<String, Object> arguments = ImmutableMap.of();

        private Builder(String name) {
            this.name = checkNotNull(name, "queue name");
        }

        public Builder withDurable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder withExclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder withAutoDeleted(boolean autoDeleted) {
            this.autoDeleted = autoDeleted;
            return this;
        }

        public Builder withArguments(Map<String, Object> arguments) {
            this.arguments = checkNotNull(arguments);
            return this;
        }

        public QueueDefinition build() {
            return new QueueDefinition(name, durable, exclusive, autoDeleted, arguments);
        }
    }
}
