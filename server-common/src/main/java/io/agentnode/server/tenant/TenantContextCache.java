package io.agentnode.server.tenant;

import java.util.Optional;

import io.agentnode.server.config.Settings;

/**
 * Long-lived cache of opened tenant contexts.
 * <p>
 * This is the only shared mutable resource of the inbound path. Implementations must be safe for
 * concurrent use and must open each tenant at most once: when several exchanges race to open
 * the same tenant, the first opener wins and the others receive the same {@link TenantContext}.
 * A failed open must leave the cache unchanged.
 */
public interface TenantContextCache {

    /**
     * Returns the cached context of a tenant, opening its store on first use.
     *
     * @param tenantId the tenant
     * @param baseSettings the process settings the tenant's overrides are applied to
     * @return the tenant context
     * @throws TenantStoreException if the tenant is unknown or its store cannot be opened
     */
    TenantContext getOrOpen(TenantId tenantId, Settings baseSettings) throws TenantStoreException;

    Optional<TenantContext> get(TenantId tenantId);

    /**
     * Removes a tenant and closes its store.
     *
     * @return true if the tenant was cached
     */
    boolean evict(TenantId tenantId);

    int size();
}
