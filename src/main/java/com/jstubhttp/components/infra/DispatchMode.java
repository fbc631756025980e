package com.jstubhttp.components.infra;

import java.util.Locale;

public enum DispatchMode {
    SEQUENTIAL,
    CONCURRENT;

    public static DispatchMode fromProperty(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
