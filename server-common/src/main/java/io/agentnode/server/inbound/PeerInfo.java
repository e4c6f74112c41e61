package io.agentnode.server.inbound;

import org.jspecify.annotations.Nullable;

/**
 * What the transport knows about the peer of an exchange. Both values are opaque strings.
 *
 * @param host the host the peer addressed (for HTTP, the {@code Host} header)
 * @param remote the peer's remote address
 */
public record PeerInfo(@Nullable String host, @Nullable String remote) {

    public static final PeerInfo UNKNOWN = new PeerInfo(null, null);
}
