package com.jstubhttp.components.services;

import com.jstubhttp.components.repository.Route;
import com.jstubhttp.components.repository.RouteTable;
import org.springframework.stereotype.Component;

/**
 * Exact-match routing, first route in table order wins.
 */
@Component
public class Router {

    private final RouteTable routeTable;

    public Router(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    public Route route(String path) {
        return routeTable.find(path).orElse(routeTable.getNotFound());
    }
}
