package com.jstubhttp.components.services;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The tokenized request line. Headers and body are never looked at.
 */
@Getter
@ToString
@AllArgsConstructor
public final class HttpRequest {
    public static final HttpRequest EMPTY = new HttpRequest("", "", "", "");

    private final String method;
    private final String target;
    private final String path;
    private final String version;

    public boolean isEmpty() {
        return this == EMPTY;
    }
}
