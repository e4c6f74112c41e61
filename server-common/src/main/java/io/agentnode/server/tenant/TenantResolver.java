package io.agentnode.server.tenant;

import java.util.List;

import io.agentnode.server.messaging.Payload;

/**
 * Finds the tenants an inbound message may be addressed to, before the message is unpacked.
 */
public interface TenantResolver {

    /**
     * @param body the body exactly as received
     * @return the candidate tenants, possibly empty, in the resolver's preference order
     * @throws TenantResolutionException if the lookup itself fails
     */
    List<TenantId> resolve(Payload body) throws TenantResolutionException;
}
