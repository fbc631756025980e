package com.jstubhttp.components.server;

import com.jstubhttp.components.exceptions.AcceptException;
import com.jstubhttp.components.exceptions.ServerSetupException;
import com.jstubhttp.components.infra.Connection;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Listening socket that hands out {@link Connection}s.
 */
public class ConnectionAcceptor implements Closeable {

    private final ServerSocket serverSocket;

    protected ConnectionAcceptor(ServerSocket serverSocket) {
        this.serverSocket = serverSocket;
    }

    /**
     * Binds all interfaces on {@code port} with address reuse enabled.
     *
     * @throws ServerSetupException if the socket cannot be created or bound
     */
    public static ConnectionAcceptor bind(int port, int backlog) {
        ServerSocket serverSocket = null;
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(port), backlog);
            return new ConnectionAcceptor(serverSocket);
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            if (serverSocket != null) {
                try {
                    serverSocket.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new ServerSetupException("Could not listen on port " + port + ": " + e.getMessage(), e);
        }
    }

    /**
     * Blocks until a client connects.
     */
    public Connection accept() throws AcceptException {
        Socket socket;
        try {
            socket = serverSocket.accept();
        } catch (IOException e) {
            throw new AcceptException("Error accepting connection: " + e.getMessage(), e);
        }
        try {
            return new Connection(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw new AcceptException("Error opening streams for accepted connection: " + e.getMessage(), e);
        }
    }

    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    public boolean isClosed() {
        return serverSocket.isClosed();
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
    }
}
