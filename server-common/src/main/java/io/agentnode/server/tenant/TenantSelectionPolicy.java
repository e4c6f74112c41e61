package io.agentnode.server.tenant;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import io.agentnode.server.config.Settings;

/**
 * Picks the tenant of an exchange among the candidates returned by a {@link TenantResolver}.
 *
 * @see StandardTenantSelectionPolicy
 */
@FunctionalInterface
public interface TenantSelectionPolicy {

    /**
     * @param candidates the candidates in resolver order
     * @return the selected tenant, or empty to keep the default context
     * @throws TenantResolutionException if the candidates are not acceptable
     */
    Optional<TenantId> select(List<TenantId> candidates) throws TenantResolutionException;

    /**
     * Returns the standard policy named by {@value Settings#TENANT_ROUTING_SELECTION}.
     */
    static TenantSelectionPolicy fromSettings(Settings settings) {
        String name = settings.getString(Settings.TENANT_ROUTING_SELECTION, "first");
        try {
            return StandardTenantSelectionPolicy.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tenant selection policy: " + name, e);
        }
    }
}
