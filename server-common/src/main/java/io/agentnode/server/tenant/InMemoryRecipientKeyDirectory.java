package io.agentnode.server.tenant;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecipientKeyDirectory} kept in a {@link ConcurrentHashMap}. Keys are registered when a
 * tenant creates a connection key and removed when the key is retired.
 */
@ApplicationScoped
public class InMemoryRecipientKeyDirectory implements RecipientKeyDirectory {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRecipientKeyDirectory.class);

    private final ConcurrentMap<String, TenantId> owners = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the key already belongs to another tenant
     */
    public void register(String recipientKey, TenantId tenantId) {
        Objects.requireNonNull(recipientKey, "recipientKey");
        Objects.requireNonNull(tenantId, "tenantId");
        TenantId existing = owners.putIfAbsent(recipientKey, tenantId);
        if (existing != null && !existing.equals(tenantId)) {
            throw new IllegalStateException("Recipient key " + recipientKey + " already belongs to tenant " + existing);
        }
        LOGGER.debug("Registered recipient key {} for tenant {}", recipientKey, tenantId);
    }

    public boolean unregister(String recipientKey) {
        return owners.remove(recipientKey) != null;
    }

    @Override
    public Optional<TenantId> lookup(String recipientKey) {
        return Optional.ofNullable(owners.get(recipientKey));
    }
}
