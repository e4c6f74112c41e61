package io.agentnode.server.inbound;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.agentnode.server.messaging.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-use handoff of one direct response to one waiting exchange.
 * <p>
 * The producer completes the slot's future; the consumer waits on it with a bound. Whoever loses
 * a race between delivery and timeout is decided by the future: a timed-out waiter cancels the
 * future, and a delivery is accepted only if the future is still incomplete. A payload is
 * therefore either returned by {@link #await(Duration)} or reported as dropped to the producer,
 * never both.
 */
public final class ResponseSlot implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseSlot.class);

    private final ExchangeId exchangeId;
    private final ResponseCorrelator owner;
    private final CompletableFuture<Payload> response = new CompletableFuture<>();
    private final AtomicBoolean awaited = new AtomicBoolean(false);

    ResponseSlot(ExchangeId exchangeId, ResponseCorrelator owner) {
        this.exchangeId = exchangeId;
        this.owner = owner;
    }

    public ExchangeId exchangeId() {
        return exchangeId;
    }

    boolean offer(Payload payload) {
        return response.complete(payload);
    }

    /**
     * Waits for the response.
     *
     * @param timeout the upper bound of the wait, must be positive
     * @return the response, or empty if none arrived in time or the slot was cancelled
     * @throws InterruptedException if the waiting thread is interrupted before a response arrived
     * @throws IllegalStateException if the slot has already been waited on
     */
    public Optional<Payload> await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Response wait must be bounded by a positive timeout");
        }
        if (!awaited.compareAndSet(false, true)) {
            throw new IllegalStateException("Exchange " + exchangeId + " already has a response waiter");
        }
        try {
            return Optional.of(response.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            if (response.cancel(false)) {
                LOGGER.debug("No response for exchange {} within {}", exchangeId, timeout);
                return Optional.empty();
            }
            // Delivered or cancelled while the wait was timing out
            return completedResponse();
        } catch (CancellationException e) {
            LOGGER.debug("Response wait for exchange {} was cancelled", exchangeId);
            return Optional.empty();
        } catch (ExecutionException e) {
            // The future is only ever completed normally or cancelled
            throw new IllegalStateException("Unexpected response failure for exchange " + exchangeId, e.getCause());
        } catch (InterruptedException e) {
            if (response.cancel(false)) {
                throw e;
            }
            Thread.currentThread().interrupt();
            return completedResponse();
        }
    }

    private Optional<Payload> completedResponse() {
        return response.isCancelled() ? Optional.empty() : Optional.of(response.join());
    }

    /**
     * Wakes a pending waiter with an empty result and drops any later delivery.
     */
    public void cancel() {
        if (response.cancel(false)) {
            LOGGER.debug("Cancelled response slot of exchange {}", exchangeId);
        }
    }

    public boolean isDone() {
        return response.isDone();
    }

    /**
     * Cancels the slot and removes it from its correlator.
     */
    @Override
    public void close() {
        cancel();
        owner.release(this);
    }
}
