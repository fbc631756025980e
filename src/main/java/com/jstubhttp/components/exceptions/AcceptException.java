package com.jstubhttp.components.exceptions;

import java.io.IOException;

public class AcceptException extends IOException {

    public AcceptException(String message, Throwable cause) {
        super(message, cause);
    }
}
