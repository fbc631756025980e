package com.jstubhttp.components.services;

import com.jstubhttp.components.exceptions.ReadException;
import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.infra.ServerConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RequestReader {

    private final int bufferSize;

    @Autowired
    public RequestReader(ServerConfig serverConfig) {
        this(serverConfig.getReadBufferSize());
    }

    public RequestReader(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Read buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Performs one bounded read. End of stream gives an empty request rather than an error.
     */
    public RawRequest read(Connection connection) throws ReadException {
        byte[] buffer = new byte[bufferSize];
        try {
            int bytesRead = connection.getInputStream().read(buffer);
            return RawRequest.of(buffer, bytesRead);
        } catch (IOException e) {
            throw new ReadException(connection.getId(), e);
        }
    }
}
