package com.jstubhttp.components.infra;

import java.util.Locale;

public enum RouteTableVariant {
    TEXT,
    JSON;

    public static RouteTableVariant fromProperty(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
