package io.agentnode.server;

/**
 * Raised when an inbound transport cannot start, typically because its port cannot be bound.
 * <p>
 * This failure is fatal for the listener and is never retried; it is not tied to any exchange.
 */
public class TransportSetupException extends AgentNodeException {

    public TransportSetupException(final String msg) {
        super(msg);
    }

    public TransportSetupException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
