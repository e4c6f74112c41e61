package io.agentnode.server.inbound;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one inbound exchange, unique for the lifetime of the process.
 */
public record ExchangeId(String value) {

    public ExchangeId {
        Objects.requireNonNull(value, "value");
    }

    public static ExchangeId random() {
        return new ExchangeId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
