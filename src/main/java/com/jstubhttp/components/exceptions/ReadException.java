package com.jstubhttp.components.exceptions;

import java.io.IOException;

public class ReadException extends IOException {

    public ReadException(String connectionId, Throwable cause) {
        super("Error reading from connection " + connectionId + ": " + cause.getMessage(), cause);
    }
}
