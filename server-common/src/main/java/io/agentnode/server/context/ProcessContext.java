package io.agentnode.server.context;

import java.util.Objects;
import java.util.Optional;

import io.agentnode.server.config.Settings;
import io.agentnode.server.tenant.TenantContext;
import org.jspecify.annotations.Nullable;

/**
 * The context an inbound exchange is processed with.
 * <p>
 * One process-wide default instance is created at startup and passed to every exchange. Tenant
 * routing never changes an instance; {@link #withTenant(TenantContext)} returns a new one, so
 * concurrent exchanges can share the default without coordination.
 */
public final class ProcessContext {

    private final Settings settings;
    private final @Nullable TenantContext tenant;

    private ProcessContext(Settings settings, @Nullable TenantContext tenant) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tenant = tenant;
    }

    public static ProcessContext create(Settings settings) {
        return new ProcessContext(settings, null);
    }

    /**
     * Returns a copy of this context scoped to the given tenant. The settings of the copy are the
     * tenant's settings.
     */
    public ProcessContext withTenant(TenantContext tenant) {
        Objects.requireNonNull(tenant, "tenant");
        return new ProcessContext(tenant.settings(), tenant);
    }

    public Settings settings() {
        return settings;
    }

    public Optional<TenantContext> tenant() {
        return Optional.ofNullable(tenant);
    }

    public boolean isTenantScoped() {
        return tenant != null;
    }

    @Override
    public String toString() {
        return tenant == null ? "ProcessContext[default]" : "ProcessContext[tenant=" + tenant.tenantId() + "]";
    }
}
