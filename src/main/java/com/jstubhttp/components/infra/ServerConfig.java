package com.jstubhttp.components.infra;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Setter
@NoArgsConstructor
@Component
public class ServerConfig {
    private int port = PortResolver.DEFAULT_PORT;
    private DispatchMode dispatchMode = DispatchMode.SEQUENTIAL;
    private RouteTableVariant routeTable = RouteTableVariant.TEXT;
    private EmptyRequestPolicy emptyRequestPolicy = EmptyRequestPolicy.NOT_FOUND;

    @Value("${stub.server.backlog:3}")
    private int backlog = 3;

    @Value("${stub.server.read-buffer-size:1024}")
    private int readBufferSize = 1024;

    @Value("${stub.server.worker-threads:16}")
    private int workerThreads = 16;

    @Value("${stub.server.worker-queue-capacity:64}")
    private int workerQueueCapacity = 64;

    @Value("${stub.server.dispatch:sequential}")
    void dispatch(String value) {
        this.dispatchMode = DispatchMode.fromProperty(value);
    }

    @Value("${stub.server.routes:text}")
    void routes(String value) {
        this.routeTable = RouteTableVariant.fromProperty(value);
    }

    @Value("${stub.server.empty-request:not-found}")
    void emptyRequest(String value) {
        this.emptyRequestPolicy = EmptyRequestPolicy.fromProperty(value);
    }
}
