package io.agentnode.server.inbound;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import io.agentnode.server.context.ProcessContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one inbound request/response cycle.
 * <p>
 * An exchange is owned by the task that handles it and is never shared; the only fields touched
 * from other threads are the atomic {@code canRespond} flag and the context reference, which is
 * replaced by a new value and never mutated.
 */
public final class InboundExchange {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundExchange.class);

    private final ExchangeId id;
    private final PeerInfo peerInfo;
    private final boolean acceptUndelivered;
    private final AtomicBoolean canRespond;
    private final Deque<AutoCloseable> resources = new ArrayDeque<>();
    private volatile ProcessContext context;

    InboundExchange(ExchangeId id, PeerInfo peerInfo, ProcessContext context,
                    boolean acceptUndelivered, boolean canRespond) {
        this.id = Objects.requireNonNull(id, "id");
        this.peerInfo = Objects.requireNonNull(peerInfo, "peerInfo");
        this.context = Objects.requireNonNull(context, "context");
        this.acceptUndelivered = acceptUndelivered;
        this.canRespond = new AtomicBoolean(canRespond);
    }

    public ExchangeId id() {
        return id;
    }

    public PeerInfo peerInfo() {
        return peerInfo;
    }

    public ProcessContext context() {
        return context;
    }

    public boolean acceptUndelivered() {
        return acceptUndelivered;
    }

    public boolean canRespond() {
        return canRespond.get();
    }

    void bindContext(ProcessContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * @return true if this call switched responses off
     */
    boolean disableResponses() {
        return canRespond.compareAndSet(true, false);
    }

    synchronized void addResource(AutoCloseable resource) {
        resources.push(resource);
    }

    /**
     * Closes registered resources, most recent first. A failing resource does not prevent the
     * others from being closed.
     */
    synchronized void releaseResources() {
        while (!resources.isEmpty()) {
            AutoCloseable resource = resources.pop();
            try {
                resource.close();
            } catch (Exception e) {
                LOGGER.warn("Failed to release resource {} of exchange {}", resource, id, e);
            }
        }
    }

    @Override
    public String toString() {
        return "InboundExchange[" + id + ", peer=" + peerInfo + ", " + context + "]";
    }
}
