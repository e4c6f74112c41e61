package io.agentnode.server.tenant;

import java.util.Objects;

/**
 * Identifier of a tenant (wallet) hosted by the node.
 * <p>
 * Values are trimmed and must not be blank; otherwise they are opaque to this module.
 */
public record TenantId(String value) implements Comparable<TenantId> {

    public TenantId {
        Objects.requireNonNull(value, "tenantId must not be null");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    public static TenantId of(String raw) {
        return new TenantId(raw);
    }

    @Override
    public int compareTo(TenantId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
