package com.jstubhttp.components.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Function;

@Slf4j
@Component
public class PortResolver {
    public static final String PORT_VARIABLE = "PORT";
    public static final int DEFAULT_PORT = 8080;

    private final Function<String, String> environment;

    public PortResolver() {
        this(System::getenv);
    }

    public PortResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    public int resolvePort() {
        String raw = environment.apply(PORT_VARIABLE);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port >= 1 && port <= 65535) {
                return port;
            }
            log.warn("{}={} is out of range. Using default port {}.", PORT_VARIABLE, raw, DEFAULT_PORT);
        } catch (NumberFormatException e) {
            log.warn("Invalid port number provided in {}={}. Using default port {}.", PORT_VARIABLE, raw, DEFAULT_PORT);
        }
        return DEFAULT_PORT;
    }
}
