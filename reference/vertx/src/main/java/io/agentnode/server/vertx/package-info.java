/**
 * Vert.x listener serving the inbound HTTP endpoint.
 */
@NullMarked
package io.agentnode.server.vertx;

import org.jspecify.annotations.NullMarked;
