package com.jstubhttp.components.services;

import com.jstubhttp.components.exceptions.MalformedRequestException;
import com.jstubhttp.components.exceptions.ReadException;
import com.jstubhttp.components.exceptions.WriteException;
import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.infra.EmptyRequestPolicy;
import com.jstubhttp.components.infra.ServerConfig;
import com.jstubhttp.components.repository.Route;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/**
 * Read, route, respond and close for a single connection. Never throws: whatever
 * happens here stays with this connection.
 */
@Slf4j
@Component
public class ConnectionHandler {

    private final RequestReader requestReader;
    private final RequestLineTokenizer tokenizer;
    private final Router router;
    private final ResponseWriter responseWriter;
    private final EmptyRequestPolicy emptyRequestPolicy;

    @Autowired
    public ConnectionHandler(RequestReader requestReader, RequestLineTokenizer tokenizer, Router router,
                             ResponseWriter responseWriter, ServerConfig serverConfig) {
        this(requestReader, tokenizer, router, responseWriter, serverConfig.getEmptyRequestPolicy());
    }

    public ConnectionHandler(RequestReader requestReader, RequestLineTokenizer tokenizer, Router router,
                             ResponseWriter responseWriter, EmptyRequestPolicy emptyRequestPolicy) {
        this.requestReader = requestReader;
        this.tokenizer = tokenizer;
        this.router = router;
        this.responseWriter = responseWriter;
        this.emptyRequestPolicy = emptyRequestPolicy;
    }

    public void handle(Connection connection) {
        try (connection) {
            HttpResponse response = respond(connection);
            if (response != null) {
                responseWriter.write(connection, response);
            }
        } catch (WriteException e) {
            logIoFailure(connection, e);
        } catch (IOException e) {
            log.error("Error closing connection {}: {}", connection.getId(), e.getMessage());
        }
    }

    /**
     * Builds the response for one connection, or null when it should be closed without one.
     */
    private HttpResponse respond(Connection connection) {
        try {
            RawRequest rawRequest = requestReader.read(connection);
            HttpRequest request = tokenizer.tokenize(rawRequest);
            if (request.isEmpty()) {
                if (emptyRequestPolicy == EmptyRequestPolicy.CLOSE) {
                    log.debug("Empty request on connection {}, closing", connection.getId());
                    return null;
                }
                log.debug("Empty request on connection {}, routing as not found", connection.getId());
            }

            Route route = router.route(request.getPath());
            log.info("{} {} -> {} ({})", request.getMethod(), request.getTarget(), route.getStatus(), connection.getId());
            return HttpResponse.fromRoute(route);
        } catch (ReadException e) {
            logIoFailure(connection, e);
            return null;
        } catch (MalformedRequestException e) {
            log.warn("Bad request on connection {}: {}", connection.getId(), e.getMessage());
            return HttpResponse.plain(400, "Bad Request");
        } catch (RuntimeException e) {
            log.error("Unexpected error handling connection {}", connection.getId(), e);
            return HttpResponse.plain(500, "Internal Server Error");
        }
    }

    private void logIoFailure(Connection connection, IOException e) {
        if (isPeerGone(e)) {
            log.debug("Client {} went away: {}", connection.getId(), e.getMessage());
        } else {
            log.error(e.getMessage());
        }
    }

    private static boolean isPeerGone(IOException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String msg = String.valueOf(cause.getMessage()).toLowerCase(Locale.ROOT);
        return msg.contains("connection reset") || msg.contains("broken pipe");
    }
}
