package com.jstubhttp.components.server;

import com.jstubhttp.components.exceptions.AcceptException;
import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.infra.ServerConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * The accept loop. Runs on the calling thread until {@link #stop()} closes the listener.
 */
@Slf4j
@Component
public class HttpStubServer {

    private final DispatchStrategy dispatchStrategy;
    private final ServerConfig serverConfig;

    @Getter
    private volatile ServerState state = ServerState.IDLE;
    private volatile ConnectionAcceptor acceptor;
    private volatile boolean stopRequested;

    public HttpStubServer(DispatchStrategy dispatchStrategy, ServerConfig serverConfig) {
        this.dispatchStrategy = dispatchStrategy;
        this.serverConfig = serverConfig;
    }

    /** Binds the configured port and serves until stopped. */
    public void startServer() {
        startServer(serverConfig.getPort());
    }

    /**
     * Binds {@code port} and serves until stopped.
     *
     * @throws com.jstubhttp.components.exceptions.ServerSetupException if the port cannot be bound
     */
    public void startServer(int port) {
        ConnectionAcceptor connectionAcceptor;
        try {
            connectionAcceptor = ConnectionAcceptor.bind(port, serverConfig.getBacklog());
        } catch (RuntimeException e) {
            state = ServerState.STOPPED;
            dispatchStrategy.shutdown();
            throw e;
        }
        serve(connectionAcceptor);
    }

    public void serve(ConnectionAcceptor connectionAcceptor) {
        this.acceptor = connectionAcceptor;
        log.info("Server listening on port {}", connectionAcceptor.getLocalPort());
        try {
            while (!stopRequested) {
                state = ServerState.ACCEPTING;
                Connection connection;
                try {
                    connection = connectionAcceptor.accept();
                } catch (AcceptException e) {
                    if (stopRequested || connectionAcceptor.isClosed()) {
                        break;
                    }
                    log.error(e.getMessage());
                    continue;
                }

                log.info("New client connected : {}", connection.remoteAddress());
                state = ServerState.DISPATCHING;
                dispatchStrategy.dispatch(connection);
            }
        } finally {
            state = ServerState.STOPPED;
            closeAcceptor(connectionAcceptor);
            dispatchStrategy.shutdown();
            log.info("Server stopped");
        }
    }

    public void stop() {
        stopRequested = true;
        ConnectionAcceptor current = acceptor;
        if (current != null) {
            closeAcceptor(current);
        }
    }

    /**
     * Port the listener is bound to, or -1 before the loop has started.
     */
    public int getLocalPort() {
        ConnectionAcceptor current = acceptor;
        return current == null ? -1 : current.getLocalPort();
    }

    private void closeAcceptor(ConnectionAcceptor connectionAcceptor) {
        try {
            connectionAcceptor.close();
        } catch (IOException e) {
            log.error("Error closing server socket: {}", e.getMessage());
        }
    }
}
