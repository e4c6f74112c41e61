package io.agentnode.server.messaging;

import java.util.Objects;

/**
 * An inbound message after authentication and decoding.
 *
 * @param payload the decoded message as JSON text
 * @param receipt delivery metadata, including the requested return route
 */
public record ParsedMessage(String payload, MessageReceipt receipt) {

    public ParsedMessage {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receipt, "receipt");
    }
}
