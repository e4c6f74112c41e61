package io.agentnode.transport.http.handler;

import java.util.Objects;

import io.agentnode.server.inbound.PeerInfo;
import org.jspecify.annotations.Nullable;

/**
 * A {@code POST} to the inbound endpoint, as seen by {@link InboundHttpHandler}.
 *
 * @param peer the remote end of the connection
 * @param contentType the raw {@code Content-Type} header, if any
 * @param body the request body
 * @param connection notified when the peer goes away
 */
public record InboundHttpRequest(PeerInfo peer, @Nullable String contentType, byte[] body,
                                 ConnectionWatcher connection) {

    public InboundHttpRequest {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(connection, "connection");
    }

    public InboundHttpRequest(PeerInfo peer, @Nullable String contentType, byte[] body) {
        this(peer, contentType, body, ConnectionWatcher.NONE);
    }
}
