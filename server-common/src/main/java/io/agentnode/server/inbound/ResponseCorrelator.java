package io.agentnode.server.inbound;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.agentnode.server.messaging.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs direct responses produced by the dispatcher with the exchanges waiting for them.
 * <p>
 * An exchange that expects a direct response {@linkplain #open(ExchangeId) opens} a
 * {@link ResponseSlot} before its message is dispatched, so a reply produced before the exchange
 * starts waiting is kept. The slot is removed when the exchange stops waiting or closes; a reply
 * arriving after that is dropped and {@link #deliver} returns false. The producer is never
 * blocked and nothing is retained for exchanges that are gone.
 */
@ApplicationScoped
public class ResponseCorrelator implements ResponseNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCorrelator.class);

    private final ConcurrentMap<ExchangeId, ResponseSlot> slots = new ConcurrentHashMap<>();

    /**
     * Opens the response slot of an exchange.
     *
     * @throws IllegalStateException if the exchange already has an open slot
     */
    public ResponseSlot open(ExchangeId exchangeId) {
        ResponseSlot slot = new ResponseSlot(exchangeId, this);
        ResponseSlot existing = slots.putIfAbsent(exchangeId, slot);
        if (existing != null) {
            throw new IllegalStateException("A response is already pending for exchange " + exchangeId);
        }
        LOGGER.debug("Opened response slot for exchange {}", exchangeId);
        return slot;
    }

    /**
     * Delivers a direct response.
     *
     * @return true iff an open slot accepted the payload
     */
    public boolean deliver(ExchangeId exchangeId, Payload payload) {
        ResponseSlot slot = slots.get(exchangeId);
        if (slot == null) {
            LOGGER.debug("Dropping response for exchange {}: not waiting for a response", exchangeId);
            return false;
        }
        if (!slot.offer(payload)) {
            LOGGER.debug("Dropping response for exchange {}: already answered, timed out or cancelled", exchangeId);
            return false;
        }
        LOGGER.debug("Delivered {} to exchange {}", payload, exchangeId);
        return true;
    }

    @Override
    public boolean notifyResponseReady(ExchangeId exchangeId, Payload payload) {
        return deliver(exchangeId, payload);
    }

    void release(ResponseSlot slot) {
        if (slots.remove(slot.exchangeId(), slot)) {
            LOGGER.debug("Released response slot of exchange {}", slot.exchangeId());
        }
    }

    /**
     * @return the number of exchanges currently holding a response slot
     */
    public int pendingCount() {
        return slots.size();
    }
}
