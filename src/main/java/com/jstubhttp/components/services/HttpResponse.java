package com.jstubhttp.components.services;

import com.jstubhttp.components.repository.Route;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class HttpResponse {
    private final int status;
    private final String reason;
    private final Map<String, String> headers;
    private final String body;

    public HttpResponse(int status, String contentType, String body) {
        this.status = status;
        this.reason = reasonPhrase(status);
        this.body = body == null ? "" : body;

        Map<String, String> h = new LinkedHashMap<>();
        h.put("Content-Type", contentType);
        h.put("Content-Length", String.valueOf(this.body.getBytes(StandardCharsets.UTF_8).length));
        h.put("Connection", "close");
        this.headers = Collections.unmodifiableMap(h);
    }

    public static HttpResponse fromRoute(Route route) {
        return new HttpResponse(route.getStatus(), route.getContentType(), route.getBody());
    }

    public static HttpResponse plain(int status, String body) {
        return new HttpResponse(status, Route.TEXT_PLAIN, body);
    }

    public byte[] bodyBytes() {
        return body.getBytes(StandardCharsets.UTF_8);
    }

    public static String reasonPhrase(int status) {
        return switch (status) {
            case 200 -> "OK";
            case 201 -> "Created";
            case 204 -> "No Content";
            case 400 -> "Bad Request";
            case 404 -> "Not Found";
            case 500 -> "Internal Server Error";
            default -> "Unknown";
        };
    }
}
