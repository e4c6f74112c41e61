/**
 * Inbound ingress of a multi-tenant agent-to-agent messaging node.
 *
 * <h2>Architecture</h2>
 * <pre>
 * Transport adapter (HTTP listener)
 *     ↓
 * InboundSessionFactory.open(peer)
 *     ↓
 * InboundSession.resolveTenant(body)  → ContextSwitcher → TenantContextCache
 *     ↓
 * InboundSession.receive(body)        → MessageUnpacker → MessageDispatcher
 *     ↓
 * InboundSession.awaitResponse(...)   ← ResponseCorrelator ← dispatcher reply
 *     ↓
 * InboundSession.close()
 * </pre>
 *
 * @see io.agentnode.server.inbound
 * @see io.agentnode.server.tenant
 */
@NullMarked
package io.agentnode.server;

import org.jspecify.annotations.NullMarked;
