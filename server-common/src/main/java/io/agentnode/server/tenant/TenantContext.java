package io.agentnode.server.tenant;

import java.util.Objects;

import io.agentnode.server.config.Settings;

/**
 * Configuration and keys scoped to one tenant.
 * <p>
 * Instances are created once per tenant by the {@link TenantContextCache} and shared by every
 * exchange routed to that tenant.
 *
 * @param tenantId the tenant
 * @param settings the process settings overlaid with the tenant's overrides
 * @param store the opened tenant store
 */
public record TenantContext(TenantId tenantId, Settings settings, TenantStore store) {

    public TenantContext {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(store, "store");
    }
}
