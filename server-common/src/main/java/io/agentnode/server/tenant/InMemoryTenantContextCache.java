package io.agentnode.server.tenant;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentnode.server.config.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link TenantContextCache}.
 * <p>
 * Each tenant maps to a future of its context. The first caller for a tenant installs the future
 * with {@code putIfAbsent} and performs the open; concurrent callers find the future and wait
 * for it, so {@link TenantStoreProvider#open(TenantId)} runs once per tenant. Opens of different
 * tenants proceed in parallel. When an open fails its future is removed, so a later exchange
 * retries the open instead of inheriting the failure. A tenant evicted while it is being opened
 * is opened again, so callers never receive a store closed by the eviction.
 */
@ApplicationScoped
public class InMemoryTenantContextCache implements TenantContextCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTenantContextCache.class);

    private final ConcurrentMap<TenantId, CompletableFuture<TenantContext>> contexts = new ConcurrentHashMap<>();
    private final TenantStoreProvider storeProvider;

    @Inject
    public InMemoryTenantContextCache(TenantStoreProvider storeProvider) {
        this.storeProvider = storeProvider;
    }

    @Override
    public TenantContext getOrOpen(TenantId tenantId, Settings baseSettings) throws TenantStoreException {
        while (true) {
            CompletableFuture<TenantContext> future = contexts.get(tenantId);
            TenantContext context;
            if (future == null) {
                CompletableFuture<TenantContext> opening = new CompletableFuture<>();
                // Make sure another exchange has not started opening the tenant in the meantime
                future = contexts.putIfAbsent(tenantId, opening);
                if (future == null) {
                    future = opening;
                    context = open(tenantId, baseSettings, opening);
                } else {
                    context = awaitOpen(tenantId, future);
                }
            } else {
                LOGGER.debug("Reusing context of tenant {}", tenantId);
                context = awaitOpen(tenantId, future);
            }
            // An evict() during the open has closed this store
            if (contexts.get(tenantId) == future) {
                return context;
            }
            LOGGER.debug("Tenant {} was evicted while opening, opening again", tenantId);
        }
    }

    private TenantContext open(TenantId tenantId, Settings baseSettings, CompletableFuture<TenantContext> opening) {
        LOGGER.debug("Opening store of tenant {}", tenantId);
        try {
            TenantStore store = storeProvider.open(tenantId);
            TenantContext context = new TenantContext(tenantId, baseSettings.withOverrides(store.settingsOverrides()), store);
            opening.complete(context);
            LOGGER.info("Opened tenant {}", tenantId);
            return context;
        } catch (TenantStoreException e) {
            abandon(tenantId, opening, e);
            throw e;
        } catch (RuntimeException e) {
            TenantStoreException failure = new TenantStoreException(tenantId, "Failed to open store of tenant " + tenantId, e);
            abandon(tenantId, opening, failure);
            throw failure;
        }
    }

    private void abandon(TenantId tenantId, CompletableFuture<TenantContext> opening, TenantStoreException failure) {
        contexts.remove(tenantId, opening);
        opening.completeExceptionally(failure);
        LOGGER.warn("Could not open tenant {}: {}", tenantId, failure.getMessage());
    }

    private TenantContext awaitOpen(TenantId tenantId, CompletableFuture<TenantContext> opening) {
        try {
            return opening.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TenantStoreException storeException) {
                throw new TenantStoreException(tenantId, storeException.getMessage(), storeException);
            }
            throw new TenantStoreException(tenantId, "Failed to open store of tenant " + tenantId, cause);
        }
    }

    @Override
    public Optional<TenantContext> get(TenantId tenantId) {
        CompletableFuture<TenantContext> future = contexts.get(tenantId);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    @Override
    public boolean evict(TenantId tenantId) {
        CompletableFuture<TenantContext> removed = contexts.remove(tenantId);
        if (removed == null) {
            return false;
        }
        removed.thenAccept(context -> {
            try {
                context.store().close();
                LOGGER.info("Closed tenant {}", tenantId);
            } catch (Exception e) {
                LOGGER.warn("Error closing store of tenant {}", tenantId, e);
            }
        });
        return true;
    }

    @Override
    public int size() {
        return contexts.size();
    }
}
