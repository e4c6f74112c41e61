package io.agentnode.server;

/**
 * Root of the exceptions raised by the inbound path of an agent node.
 * <p>
 * Subclasses classify a failure by who can act on it:
 * <ul>
 *   <li>{@link TransportSetupException} - the listener could not start (operator)</li>
 *   <li>{@link io.agentnode.server.messaging.MessageParseException} - the sender supplied bytes
 *       that cannot be decoded or authenticated (client fault)</li>
 *   <li>{@link io.agentnode.server.tenant.TenantResolutionException} - the node could not bind the
 *       exchange to a tenant (server fault)</li>
 * </ul>
 * Exchange-level failures abort only the exchange that raised them.
 */
public class AgentNodeException extends RuntimeException {

    public AgentNodeException() {
        super();
    }

    public AgentNodeException(final String msg) {
        super(msg);
    }

    public AgentNodeException(final Throwable cause) {
        super(cause);
    }

    public AgentNodeException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
