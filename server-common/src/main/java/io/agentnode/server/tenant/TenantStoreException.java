package io.agentnode.server.tenant;

import io.agentnode.server.AgentNodeException;
import org.jspecify.annotations.Nullable;

/**
 * Failure of the wallet subsystem to open or close a tenant store.
 * <p>
 * {@link #isUnknownTenant()} distinguishes a tenant that does not exist from a store that exists
 * but cannot be opened (locked, missing credentials, I/O failure).
 *
 * @see ContextSwitcher which wraps this exception into {@link TenantResolutionException}
 */
public class TenantStoreException extends AgentNodeException {

    private final @Nullable TenantId tenantId;
    private final boolean unknownTenant;

    public TenantStoreException(@Nullable final TenantId tenantId, final String msg) {
        this(tenantId, msg, false);
    }

    public TenantStoreException(@Nullable final TenantId tenantId, final String msg, final boolean unknownTenant) {
        super(msg);
        this.tenantId = tenantId;
        this.unknownTenant = unknownTenant;
    }

    public TenantStoreException(@Nullable final TenantId tenantId, final String msg, final Throwable cause) {
        super(msg, cause);
        this.tenantId = tenantId;
        this.unknownTenant = false;
    }

    public static TenantStoreException unknownTenant(TenantId tenantId) {
        return new TenantStoreException(tenantId, "Unknown tenant: " + tenantId, true);
    }

    public @Nullable TenantId getTenantId() {
        return tenantId;
    }

    public boolean isUnknownTenant() {
        return unknownTenant;
    }
}
