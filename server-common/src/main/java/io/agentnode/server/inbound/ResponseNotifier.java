package io.agentnode.server.inbound;

import io.agentnode.server.messaging.Payload;

/**
 * Dispatcher-facing side of the response correlation: returns a reply to the exchange that
 * carried the request.
 */
@FunctionalInterface
public interface ResponseNotifier {

    /**
     * Hands a direct response to the waiting exchange. Never blocks.
     *
     * @param exchangeId the exchange the request arrived on
     * @param payload the reply
     * @return true if the exchange took the reply; false if it was dropped because the exchange
     *         is not waiting, already has a reply, timed out or closed
     */
    boolean notifyResponseReady(ExchangeId exchangeId, Payload payload);
}
