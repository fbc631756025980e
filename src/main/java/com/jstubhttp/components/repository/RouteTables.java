package com.jstubhttp.components.repository;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.jstubhttp.components.infra.RouteTableVariant;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The canned tables the server can be started with.
 */
public final class RouteTables {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private RouteTables() {}

    public static RouteTable forVariant(RouteTableVariant variant) {
        return switch (variant) {
            case TEXT -> text();
            case JSON -> json();
        };
    }

    public static RouteTable text() {
        return RouteTable.of(
                List.of(new Route("/health", 200, Route.TEXT_PLAIN, "OK")),
                new Route("*", 404, Route.TEXT_PLAIN, "Not Found"));
    }

    public static RouteTable json() {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("message", "Java API Server");
        index.put("version", "1.0.0");
        index.put("endpoints", List.of("/", "/health", "/users"));

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("uptime", 12345);

        Map<String, Object> users = new LinkedHashMap<>();
        users.put("users", List.of(
                new User(1, "Alice", "alice@example.com"),
                new User(2, "Bob", "bob@example.com")));

        return RouteTable.of(
                List.of(
                        new Route("/", 200, Route.APPLICATION_JSON, gson.toJson(index)),
                        new Route("/health", 200, Route.APPLICATION_JSON, gson.toJson(health)),
                        new Route("/users", 200, Route.APPLICATION_JSON, gson.toJson(users))),
                new Route("*", 404, Route.APPLICATION_JSON, gson.toJson(Map.of("error", "Not found"))));
    }

    // field order is the JSON key order
    private static final class User {
        private final int id;
        private final String name;
        private final String email;

        private User(int id, String name, String email) {
            this.id = id;
            this.name = name;
            this.email = email;
        }
    }
}
