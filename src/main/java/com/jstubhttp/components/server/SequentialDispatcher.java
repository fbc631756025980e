package com.jstubhttp.components.server;

import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.services.ConnectionHandler;

/**
 * Handles the connection on the accepting thread. The next accept waits for the close.
 */
public class SequentialDispatcher implements DispatchStrategy {

    private final ConnectionHandler connectionHandler;

    public SequentialDispatcher(ConnectionHandler connectionHandler) {
        this.connectionHandler = connectionHandler;
    }

    @Override
    public void dispatch(Connection connection) {
        connectionHandler.handle(connection);
    }
}
