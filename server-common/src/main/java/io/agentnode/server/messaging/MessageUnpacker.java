package io.agentnode.server.messaging;

import io.agentnode.server.context.ProcessContext;

/**
 * Turns the raw body of an inbound exchange into a {@link ParsedMessage}.
 * <p>
 * Implementations decrypt and verify with the keys reachable from the supplied context, which is
 * the tenant-scoped context when tenant routing selected one. Resources that must live exactly
 * as long as the exchange (for example an open crypto session) are not held here; they are
 * registered on the exchange by the caller.
 */
public interface MessageUnpacker {

    /**
     * @param body the body exactly as received
     * @param context the context bound to the exchange
     * @return the parsed message
     * @throws MessageParseException if the body cannot be authenticated or decoded
     */
    ParsedMessage unpack(Payload body, ProcessContext context) throws MessageParseException;
}
