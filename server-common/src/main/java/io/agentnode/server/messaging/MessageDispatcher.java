package io.agentnode.server.messaging;

/**
 * Downstream processing of inbound messages.
 * <p>
 * {@link #dispatch(InboundMessage)} must not block on message handling; the dispatcher runs the
 * work on its own threads. When the message asked for a direct response, the dispatcher returns
 * the reply through {@link io.agentnode.server.inbound.ResponseNotifier#notifyResponseReady}.
 * The reply may never come; the exchange then times out without a fault.
 */
public interface MessageDispatcher {

    void dispatch(InboundMessage message);
}
