/**
 * Tenant (wallet) routing of inbound exchanges.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.agentnode.server.tenant.TenantResolver} - finds candidate tenants from the raw body</li>
 *   <li>{@link io.agentnode.server.tenant.TenantSelectionPolicy} - picks one candidate</li>
 *   <li>{@link io.agentnode.server.tenant.ContextSwitcher} - derives the tenant-scoped context</li>
 *   <li>{@link io.agentnode.server.tenant.TenantContextCache} - opens each tenant store once</li>
 * </ul>
 */
@NullMarked
package io.agentnode.server.tenant;

import org.jspecify.annotations.NullMarked;
