/**
 * Immutable configuration of an agent node, loaded from {@code agentnode.properties}.
 */
@NullMarked
package io.agentnode.server.config;

import org.jspecify.annotations.NullMarked;
