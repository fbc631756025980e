package com.jstubhttp.components.exceptions;

/**
 * Socket creation, bind or listen failed. Nothing has been accepted yet and the process
 * cannot serve, so this is fatal.
 */
public class ServerSetupException extends RuntimeException {

    public ServerSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
