/**
 * Transport-neutral HTTP semantics of the inbound endpoint. Listener implementations translate
 * their native request into an {@link io.agentnode.transport.http.handler.InboundHttpRequest}
 * and write back the returned {@link io.agentnode.transport.http.handler.InboundHttpResponse}.
 */
@NullMarked
package io.agentnode.transport.http.handler;

import org.jspecify.annotations.NullMarked;
