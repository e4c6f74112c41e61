package io.agentnode.server.tenant;

import java.util.Map;

/**
 * An opened tenant store: the key material and tenant-specific configuration of one tenant.
 * <p>
 * Stores are opened by a {@link TenantStoreProvider} and owned by the {@link TenantContextCache};
 * exchanges borrow them for their own lifetime only and never close them.
 */
public interface TenantStore extends AutoCloseable {

    TenantId tenantId();

    /**
     * Settings that override the process-wide ones for this tenant, for example a tenant label
     * or endpoint. May be empty.
     */
    default Map<String, String> settingsOverrides() {
        return Map.of();
    }

    /**
     * Closes the store. Called by the cache owner when the tenant is evicted or the node stops.
     */
    @Override
    void close() throws TenantStoreException;
}
