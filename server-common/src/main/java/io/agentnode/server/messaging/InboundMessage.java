package io.agentnode.server.messaging;

import java.util.Objects;

import io.agentnode.server.context.ProcessContext;
import io.agentnode.server.inbound.ExchangeId;

/**
 * A parsed message handed to the {@link MessageDispatcher}.
 *
 * @param exchangeId the exchange that carried the message; used to return a direct response
 * @param message the parsed message
 * @param context the context bound to the exchange, tenant-scoped when routing applied
 * @param canRespond whether a direct response can still be returned on the exchange
 */
public record InboundMessage(ExchangeId exchangeId, ParsedMessage message, ProcessContext context,
                             boolean canRespond) {

    public InboundMessage {
        Objects.requireNonNull(exchangeId, "exchangeId");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
    }
}
