package com.jstubhttp.components.repository;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable list of routes with a fallback used when nothing matches.
 * Safe to share between worker threads without locking.
 */
public final class RouteTable {
    private final List<Route> routes;
    @Getter
    private final Route notFound;

    private RouteTable(List<Route> routes, Route notFound) {
        this.routes = Collections.unmodifiableList(new ArrayList<>(routes));
        this.notFound = Objects.requireNonNull(notFound, "notFound");
    }

    public static RouteTable of(List<Route> routes, Route notFound) {
        return new RouteTable(routes, notFound);
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public Optional<Route> find(String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (Route route : routes) {
            if (route.matches(path)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return routes.size();
    }
}
