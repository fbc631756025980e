package com.jstubhttp.components.infra;

import java.util.Locale;

/**
 * What to do when the first read of a connection returns no bytes.
 */
public enum EmptyRequestPolicy {
    NOT_FOUND,
    CLOSE;

    public static EmptyRequestPolicy fromProperty(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
