package io.agentnode.server.tenant;

import io.agentnode.server.AgentNodeException;
import org.jspecify.annotations.Nullable;

/**
 * Raised when an inbound exchange cannot be bound to a tenant context.
 * <p>
 * This is a server fault: the sender cannot correct it. The exchange closes without attempting
 * to unpack the message, and no other exchange or cached tenant is affected.
 */
public class TenantResolutionException extends AgentNodeException {

    private final @Nullable TenantId tenantId;

    public TenantResolutionException(final String msg) {
        super(msg);
        this.tenantId = null;
    }

    public TenantResolutionException(@Nullable final TenantId tenantId, final String msg) {
        super(msg);
        this.tenantId = tenantId;
    }

    public TenantResolutionException(@Nullable final TenantId tenantId, final String msg, final Throwable cause) {
        super(msg, cause);
        this.tenantId = tenantId;
    }

    /**
     * @return the tenant that failed, or null if the failure happened before a tenant was selected
     */
    public @Nullable TenantId getTenantId() {
        return tenantId;
    }
}
