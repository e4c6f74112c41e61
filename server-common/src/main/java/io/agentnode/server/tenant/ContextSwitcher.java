package io.agentnode.server.tenant;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentnode.server.context.ProcessContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a base {@link ProcessContext} and a tenant to a tenant-scoped context.
 * <p>
 * The base context is never modified; the result is a new value referencing the tenant's cached
 * {@link TenantContext}. Opening the tenant store is the only side effect and goes through the
 * {@link TenantContextCache}, so it happens once per tenant.
 */
@ApplicationScoped
public class ContextSwitcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextSwitcher.class);

    private final TenantContextCache cache;

    @Inject
    public ContextSwitcher(TenantContextCache cache) {
        this.cache = cache;
    }

    /**
     * @param base the context to derive from
     * @param tenantId the tenant to scope to
     * @return a tenant-scoped copy of {@code base}
     * @throws TenantResolutionException if the tenant is unknown or its store cannot be opened
     */
    public ProcessContext switchTo(ProcessContext base, TenantId tenantId) throws TenantResolutionException {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(tenantId, "tenantId");
        TenantContext tenant;
        try {
            tenant = cache.getOrOpen(tenantId, base.settings());
        } catch (TenantStoreException e) {
            String reason = e.isUnknownTenant() ? "Unknown tenant " : "Cannot open store of tenant ";
            throw new TenantResolutionException(tenantId, reason + tenantId, e);
        }
        LOGGER.debug("Switched context to tenant {}", tenantId);
        return base.withTenant(tenant);
    }
}
