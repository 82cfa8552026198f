package com.meltwater.rabbitdriver;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Declarative description of an exchange.
 *
 * @see AmqpDriver#declareExchange(ExchangeDefinition)
 * @see AmqpDriver#deleteExchange(ExchangeDefinition, boolean, boolean)
 */
public class ExchangeDefinition {

    private final String name;
    private final ExchangeType type;
    private final boolean durable;
    private final boolean autoDeleted;
    private final boolean internal;
    private final ImmutableMap<String, Object> arguments;

    private ExchangeDefinition(String name, ExchangeType type, boolean durable, boolean autoDeleted, boolean internal, Map<String, Object> arguments) {
        this.name = name;
        this.type = type;
        this.durable = durable;
        this.autoDeleted = autoDeleted;
        this.internal = internal;
        this.arguments = ImmutableMap.copyOf(arguments);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public ExchangeType getType() {
        return type;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDeleted() {
        return autoDeleted;
    }

    public boolean isInternal() {
        return internal;
    }

    public ImmutableMap<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeDefinition that = (ExchangeDefinition) o;
        return durable == that.durable
                && autoDeleted == that.autoDeleted
                && internal == that.internal
                && name.equals(that.name)
                && type == that.type
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, durable, autoDeleted, internal, arguments);
    }

    @Override
    public String toString() {
        return "{" +
                "name:'" + name + '\'' +
                ", type:" + type +
                ", durable:" + durable +
                ", auto_deleted:" + autoDeleted +
                ", internal:" + internal +
                ", arguments:" + arguments +
                '}';
    }

    public static class Builder {

        private final String name;
        private ExchangeType type = ExchangeType.topic;
        private boolean durable = true;
        private boolean autoDeleted = false;
        private boolean internal = false;
        private Map<String, Object> arguments = ImmutableMap.of();

        private Builder(String name) {
            checkNotNull(name, "exchange name");
            checkArgument(!name.isEmpty(), "the default exchange can not be declared");
            this.name = name;
        }

        public Builder withType(ExchangeType type) {
            this.type = checkNotNull(type);
            return this;
        }

        public Builder withDurable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder withAutoDeleted(boolean autoDeleted) {
            this.autoDeleted = autoDeleted;
            return this;
        }

        public Builder withInternal(boolean internal) {
            this.internal = internal;
            return this;
        }

        public Builder withArguments(Map<String, Object> arguments) {
            this.arguments = checkNotNull(arguments);
            return this;
        }

        public ExchangeDefinition build() {
            return new ExchangeDefinition(name, type, durable, autoDeleted, internal, arguments);
        }
    }
}
