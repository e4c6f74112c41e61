package io.agentnode.server.tenant;

/**
 * Opens tenant stores. Provided by the wallet subsystem of the node.
 */
public interface TenantStoreProvider {

    /**
     * Opens the store of a tenant. Implementations may be slow (key derivation, disk access);
     * callers go through {@link TenantContextCache} so each tenant is opened once.
     *
     * @param tenantId the tenant to open
     * @return the opened store
     * @throws TenantStoreException if the tenant is unknown or its store cannot be opened
     */
    TenantStore open(TenantId tenantId) throws TenantStoreException;
}
