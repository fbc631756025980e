package com.jstubhttp.components.repository;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class Route {
    public static final String TEXT_PLAIN = "text/plain";
    public static final String APPLICATION_JSON = "application/json";

    private final String pattern;
    private final int status;
    private final String contentType;
    private final String body;

    public boolean matches(String path) {
        return pattern.equals(path);
    }
}
