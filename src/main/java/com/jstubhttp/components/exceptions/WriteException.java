package com.jstubhttp.components.exceptions;

import java.io.IOException;

public class WriteException extends IOException {

    public WriteException(String connectionId, Throwable cause) {
        super("Error writing to connection " + connectionId + ": " + cause.getMessage(), cause);
    }
}
