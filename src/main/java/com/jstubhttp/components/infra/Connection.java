package com.jstubhttp.components.infra;

import lombok.Getter;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.UUID;

/**
 * One accepted client socket. Owned by a single handler from accept until close.
 */
@Getter
public class Connection implements Closeable {
    private final String id;
    private final Socket socket;
    private final InputStream inputStream;
    private final OutputStream outputStream;

    public Connection(Socket socket) throws IOException {
        this(socket, socket.getInputStream(), socket.getOutputStream());
    }

    public Connection(Socket socket, InputStream inputStream, OutputStream outputStream) {
        this.id = UUID.randomUUID().toString();
        this.socket = socket;
        this.inputStream = inputStream;
        this.outputStream = outputStream;
    }

    public String remoteAddress() {
        if (socket == null || socket.getInetAddress() == null) {
            return "unknown";
        }
        return socket.getInetAddress().getHostAddress();
    }

    @Override
    public void close() throws IOException {
        if (socket != null) {
            socket.close();
        }
    }
}
