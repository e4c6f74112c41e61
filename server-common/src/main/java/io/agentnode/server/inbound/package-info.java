/**
 * Inbound exchange sessions and direct response correlation.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.agentnode.server.inbound.InboundSessionFactory} - opens a session per exchange</li>
 *   <li>{@link io.agentnode.server.inbound.InboundSession} - the per-exchange state machine</li>
 *   <li>{@link io.agentnode.server.inbound.ResponseCorrelator} - hands a dispatcher reply to the
 *       waiting exchange</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Each exchange runs on its own worker thread and blocks only in
 * {@link io.agentnode.server.inbound.InboundSession#awaitResponse}. The correlator is the only
 * state shared between exchanges and dispatcher threads.
 */
@NullMarked
package io.agentnode.server.inbound;

import org.jspecify.annotations.NullMarked;
