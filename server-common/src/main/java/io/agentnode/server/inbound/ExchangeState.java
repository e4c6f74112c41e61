package io.agentnode.server.inbound;

/**
 * Lifecycle states of an {@link InboundSession}.
 * <pre>
 * OPEN → CONTEXT_RESOLVED → RECEIVING → AWAITING_RESPONSE → RESPONDED   → CLOSED
 *                                     ↘                    ↘
 *                                       NO_RESPONSE ───────── NO_RESPONSE → CLOSED
 * </pre>
 * Every state can move to {@link #CLOSED}, including after a failure.
 */
public enum ExchangeState {
    /** Created by the transport, bound to the default context. */
    OPEN,

    /** Tenant routing done (or skipped); the bound context is final. */
    CONTEXT_RESOLVED,

    /** The body has been handed to the unpacking engine. */
    RECEIVING,

    /** Waiting for the dispatcher to produce a direct response. */
    AWAITING_RESPONSE,

    /** A direct response was delivered. */
    RESPONDED,

    /** No direct response was requested, or none arrived in time. */
    NO_RESPONSE,

    /** Resources released. Terminal. */
    CLOSED
}
