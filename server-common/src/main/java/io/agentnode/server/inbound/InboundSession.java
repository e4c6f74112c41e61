package io.agentnode.server.inbound;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.agentnode.server.context.ProcessContext;
import io.agentnode.server.messaging.InboundMessage;
import io.agentnode.server.messaging.MessageDispatcher;
import io.agentnode.server.messaging.MessageParseException;
import io.agentnode.server.messaging.MessageUnpacker;
import io.agentnode.server.messaging.ParsedMessage;
import io.agentnode.server.messaging.Payload;
import io.agentnode.server.tenant.ContextSwitcher;
import io.agentnode.server.tenant.TenantId;
import io.agentnode.server.tenant.TenantResolutionException;
import io.agentnode.server.tenant.TenantResolver;
import io.agentnode.server.tenant.TenantSelectionPolicy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of one inbound exchange: tenant routing, receipt, an optional wait for a direct
 * response, and teardown.
 * <p>
 * Sessions are created by {@link InboundSessionFactory#open} and must be used in a
 * try-with-resources block so that {@link #close()} runs on every exit path:
 * <pre>{@code
 * try (InboundSession session = sessionFactory.open(peer, true, true)) {
 *     session.resolveTenant(body);
 *     ParsedMessage message = session.receive(body);
 *     if (message.receipt().directResponseRequested()) {
 *         Optional<Payload> reply = session.awaitResponse(timeout);
 *         ...
 *     }
 * }
 * }</pre>
 * The operations must be called in that order; calling one out of order raises
 * {@link IllegalStateException}. Only {@link #cancel()} and {@link #close()} may be called from
 * another thread, for instance when the transport connection drops.
 *
 * @see ExchangeState
 */
public class InboundSession implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundSession.class);

    private final InboundExchange exchange;
    private final TenantResolver tenantResolver;
    private final TenantSelectionPolicy selectionPolicy;
    private final ContextSwitcher contextSwitcher;
    private final MessageUnpacker unpacker;
    private final MessageDispatcher dispatcher;
    private final ResponseCorrelator correlator;

    private final AtomicReference<ExchangeState> state = new AtomicReference<>(ExchangeState.OPEN);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile @Nullable ParsedMessage received;
    private volatile @Nullable ResponseSlot responseSlot;

    InboundSession(InboundExchange exchange, TenantResolver tenantResolver, TenantSelectionPolicy selectionPolicy,
                   ContextSwitcher contextSwitcher, MessageUnpacker unpacker, MessageDispatcher dispatcher,
                   ResponseCorrelator correlator) {
        this.exchange = exchange;
        this.tenantResolver = tenantResolver;
        this.selectionPolicy = selectionPolicy;
        this.contextSwitcher = contextSwitcher;
        this.unpacker = unpacker;
        this.dispatcher = dispatcher;
        this.correlator = correlator;
    }

    public InboundExchange exchange() {
        return exchange;
    }

    public ExchangeId id() {
        return exchange.id();
    }

    public ProcessContext context() {
        return exchange.context();
    }

    public ExchangeState state() {
        return state.get();
    }

    public boolean canRespond() {
        return exchange.canRespond();
    }

    /**
     * Binds the exchange to the tenant the body is addressed to.
     * <p>
     * Does nothing when tenant routing is disabled: the exchange keeps the very same default
     * context. Otherwise the resolver's candidates go through the selection policy and the
     * selected tenant's context replaces the default one. Without candidates the default
     * context is kept. The tenant store is only opened once a tenant has been selected.
     *
     * @param body the body exactly as received
     * @return the context bound to the exchange
     * @throws TenantResolutionException if the tenant cannot be determined or opened
     */
    public ProcessContext resolveTenant(Payload body) throws TenantResolutionException {
        expectState(ExchangeState.OPEN, "resolveTenant");
        ProcessContext base = exchange.context();
        if (!base.settings().tenantRoutingEnabled()) {
            LOGGER.debug("Tenant routing disabled, exchange {} uses the default context", exchange.id());
        } else {
            List<TenantId> candidates = tenantResolver.resolve(body);
            Optional<TenantId> selected = selectionPolicy.select(candidates);
            if (selected.isPresent()) {
                exchange.bindContext(contextSwitcher.switchTo(base, selected.get()));
                LOGGER.debug("Exchange {} routed to tenant {} (candidates {})", exchange.id(), selected.get(), candidates);
            } else {
                LOGGER.debug("No tenant found for exchange {}, keeping the default context", exchange.id());
            }
        }
        advance(ExchangeState.CONTEXT_RESOLVED);
        return exchange.context();
    }

    /**
     * Unpacks the body with the bound context and hands the message to the dispatcher.
     * <p>
     * When the message requests a direct response and the exchange can respond, the response
     * slot is opened before dispatching so that an early reply is not lost.
     *
     * @param body the body exactly as received
     * @return the parsed message
     * @throws MessageParseException if the body cannot be authenticated or decoded
     */
    public ParsedMessage receive(Payload body) throws MessageParseException {
        expectState(ExchangeState.CONTEXT_RESOLVED, "receive");
        advance(ExchangeState.RECEIVING);
        ParsedMessage message = unpacker.unpack(body, exchange.context());
        received = message;

        boolean direct = message.receipt().directResponseRequested() && exchange.canRespond();
        if (direct) {
            ResponseSlot slot = correlator.open(exchange.id());
            responseSlot = slot;
            // cancel() may have run before the slot was visible
            if (cancelled.get()) {
                slot.cancel();
            }
        }
        dispatcher.dispatch(new InboundMessage(exchange.id(), message, exchange.context(), direct));
        if (!direct) {
            advance(ExchangeState.NO_RESPONSE);
        }
        LOGGER.debug("Exchange {} received message (direct response: {})", exchange.id(), direct);
        return message;
    }

    /**
     * Waits for the direct response of the received message.
     * <p>
     * Afterwards the exchange no longer accepts responses, whether one arrived or not.
     *
     * @param timeout the upper bound of the wait, must be positive
     * @return the response, or empty on timeout or cancellation
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws IllegalStateException if no message requesting a direct response has been received
     */
    public Optional<Payload> awaitResponse(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        ParsedMessage message = received;
        if (message == null || !message.receipt().directResponseRequested()) {
            throw new IllegalStateException("Exchange " + exchange.id()
                    + " has not received a message requesting a direct response");
        }
        ResponseSlot slot = responseSlot;
        if (slot == null) {
            // Opened without the ability to respond
            return Optional.empty();
        }
        expectState(ExchangeState.RECEIVING, "awaitResponse");
        advance(ExchangeState.AWAITING_RESPONSE);
        Optional<Payload> response = Optional.empty();
        try {
            response = slot.await(timeout);
            return response;
        } finally {
            slot.close();
            exchange.disableResponses();
            advance(response.isPresent() ? ExchangeState.RESPONDED : ExchangeState.NO_RESPONSE);
            LOGGER.debug("Exchange {} finished waiting, response: {}", exchange.id(), response.isPresent());
        }
    }

    /**
     * Registers a resource to be closed with the exchange, for example an open crypto session.
     *
     * @throws IllegalStateException if the session is already closed; the resource is closed
     */
    public void registerResource(AutoCloseable resource) {
        Objects.requireNonNull(resource, "resource");
        exchange.addResource(resource);
        if (closed.get()) {
            exchange.releaseResources();
            throw new IllegalStateException("Exchange " + exchange.id() + " is closed");
        }
    }

    /**
     * Cancels a pending or upcoming response wait; used when the peer went away. A reply
     * produced later is dropped and the dispatcher is not interrupted. May be called at any
     * point of the exchange, including before {@link #receive(Payload)}.
     */
    public void cancel() {
        cancelled.set(true);
        ResponseSlot slot = responseSlot;
        if (slot != null) {
            slot.cancel();
        }
        LOGGER.debug("Exchange {} cancelled in state {}", exchange.id(), state.get());
    }

    /**
     * Releases everything held by the exchange. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ExchangeState last = state.getAndSet(ExchangeState.CLOSED);
        ResponseSlot slot = responseSlot;
        if (slot != null) {
            slot.close();
        }
        exchange.disableResponses();
        exchange.releaseResources();
        LOGGER.debug("Closed exchange {} from state {}", exchange.id(), last);
    }

    private void expectState(ExchangeState expected, String operation) {
        ExchangeState current = state.get();
        if (current != expected) {
            throw new IllegalStateException("Cannot " + operation + " exchange " + exchange.id()
                    + " in state " + current + ", expected " + expected);
        }
    }

    private void advance(ExchangeState next) {
        state.getAndUpdate(current -> current == ExchangeState.CLOSED ? current : next);
    }
}
