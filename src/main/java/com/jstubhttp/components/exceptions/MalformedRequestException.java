package com.jstubhttp.components.exceptions;

/**
 * The first line of a non-empty request is not {@code METHOD SP TARGET SP HTTP/x.y}.
 */
public class MalformedRequestException extends Exception {

    public MalformedRequestException(String message) {
        super(message);
    }
}
