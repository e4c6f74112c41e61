package io.agentnode.transport.http.handler;

/**
 * Lets the handler react to the peer closing its connection.
 */
@FunctionalInterface
public interface ConnectionWatcher {

    ConnectionWatcher NONE = action -> { };

    /**
     * Registers an action to run, on any thread, once the connection is closed.
     */
    void onClose(Runnable action);
}
