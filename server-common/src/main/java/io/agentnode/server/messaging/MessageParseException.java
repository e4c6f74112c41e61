package io.agentnode.server.messaging;

import io.agentnode.server.AgentNodeException;

/**
 * Raised when inbound bytes cannot be authenticated or decoded.
 * <p>
 * This is a client fault: the transport answers it with a bad-request status and the exchange
 * still closes normally.
 */
public class MessageParseException extends AgentNodeException {

    public MessageParseException(final String msg) {
        super(msg);
    }

    public MessageParseException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
