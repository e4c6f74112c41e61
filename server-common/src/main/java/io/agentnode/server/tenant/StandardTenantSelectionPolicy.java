package io.agentnode.server.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Built-in tenant selection policies.
 */
public enum StandardTenantSelectionPolicy implements TenantSelectionPolicy {

    /** Selects the first candidate in resolver order. */
    FIRST {
        @Override
        public Optional<TenantId> select(List<TenantId> candidates) {
            return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
        }
    },

    /** Accepts a single candidate only; a message addressed to several tenants is rejected. */
    SOLE {
        @Override
        public Optional<TenantId> select(List<TenantId> candidates) throws TenantResolutionException {
            if (candidates.size() > 1) {
                throw new TenantResolutionException("Message is addressed to " + candidates.size()
                        + " tenants " + candidates + ", expected one");
            }
            return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
        }
    }
}
