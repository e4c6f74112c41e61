package io.agentnode.server.tenant;

import java.util.Optional;

/**
 * Index from recipient verification keys to the tenants that own them.
 */
public interface RecipientKeyDirectory {

    Optional<TenantId> lookup(String recipientKey);
}
