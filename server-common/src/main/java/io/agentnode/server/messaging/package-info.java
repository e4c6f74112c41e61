/**
 * Message types exchanged between the inbound session, the unpacking engine and the dispatcher.
 */
@NullMarked
package io.agentnode.server.messaging;

import org.jspecify.annotations.NullMarked;
