package io.agentnode.server.inbound;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentnode.server.context.ProcessContext;
import io.agentnode.server.messaging.MessageDispatcher;
import io.agentnode.server.messaging.MessageUnpacker;
import io.agentnode.server.tenant.ContextSwitcher;
import io.agentnode.server.tenant.TenantResolver;
import io.agentnode.server.tenant.TenantSelectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link InboundSession}s bound to the process-wide default context.
 * <p>
 * All collaborators are supplied once at construction; sessions never look them up at request
 * time.
 */
@ApplicationScoped
public class InboundSessionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundSessionFactory.class);

    private final ProcessContext defaultContext;
    private final TenantResolver tenantResolver;
    private final TenantSelectionPolicy selectionPolicy;
    private final ContextSwitcher contextSwitcher;
    private final MessageUnpacker unpacker;
    private final MessageDispatcher dispatcher;
    private final ResponseCorrelator correlator;
    private final Duration responseTimeout;

    @Inject
    public InboundSessionFactory(ProcessContext defaultContext, TenantResolver tenantResolver,
                                 ContextSwitcher contextSwitcher, MessageUnpacker unpacker,
                                 MessageDispatcher dispatcher, ResponseCorrelator correlator) {
        this(defaultContext, tenantResolver, TenantSelectionPolicy.fromSettings(defaultContext.settings()),
                contextSwitcher, unpacker, dispatcher, correlator);
    }

    public InboundSessionFactory(ProcessContext defaultContext, TenantResolver tenantResolver,
                                 TenantSelectionPolicy selectionPolicy, ContextSwitcher contextSwitcher,
                                 MessageUnpacker unpacker, MessageDispatcher dispatcher,
                                 ResponseCorrelator correlator) {
        this.defaultContext = defaultContext;
        this.tenantResolver = tenantResolver;
        this.selectionPolicy = selectionPolicy;
        this.contextSwitcher = contextSwitcher;
        this.unpacker = unpacker;
        this.dispatcher = dispatcher;
        this.correlator = correlator;
        this.responseTimeout = defaultContext.settings().responseTimeout();
    }

    /**
     * Opens a session for a new exchange.
     *
     * @param peerInfo what the transport knows about the peer
     * @param acceptUndelivered whether the exchange tolerates no reply being produced
     * @param canRespond whether the transport can carry a direct response
     * @return the session, to be closed by the caller
     */
    public InboundSession open(PeerInfo peerInfo, boolean acceptUndelivered, boolean canRespond) {
        InboundExchange exchange = new InboundExchange(ExchangeId.random(), peerInfo, defaultContext,
                acceptUndelivered, canRespond);
        LOGGER.debug("Opened exchange {} from {}", exchange.id(), peerInfo);
        return new InboundSession(exchange, tenantResolver, selectionPolicy, contextSwitcher, unpacker,
                dispatcher, correlator);
    }

    public ProcessContext defaultContext() {
        return defaultContext;
    }

    /**
     * The configured bound of a direct response wait, checked to be positive at construction.
     */
    public Duration responseTimeout() {
        return responseTimeout;
    }

    public ResponseCorrelator correlator() {
        return correlator;
    }
}
