package com.jstubhttp;

import com.jstubhttp.components.exceptions.ServerSetupException;
import com.jstubhttp.components.infra.DispatchMode;
import com.jstubhttp.components.infra.PortResolver;
import com.jstubhttp.components.infra.ServerConfig;
import com.jstubhttp.components.repository.RouteTable;
import com.jstubhttp.components.repository.RouteTables;
import com.jstubhttp.components.server.ConcurrentDispatcher;
import com.jstubhttp.components.server.DispatchStrategy;
import com.jstubhttp.components.server.HttpStubServer;
import com.jstubhttp.components.server.SequentialDispatcher;
import com.jstubhttp.components.services.ConnectionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

@Slf4j
@SpringBootApplication
public class Main {

    public static void main(String[] args) {
        try {
            SpringApplication.run(Main.class, args);
        } catch (Exception e) {
            log.error("Server failed to start: {}", rootMessage(e));
            System.exit(1);
        }
    }

    @Bean
    RouteTable routeTable(ServerConfig serverConfig) {
        RouteTable routeTable = RouteTables.forVariant(serverConfig.getRouteTable());
        log.info("Loaded {} route table with {} routes", serverConfig.getRouteTable(), routeTable.size());
        return routeTable;
    }

    @Bean
    DispatchStrategy dispatchStrategy(ServerConfig serverConfig, ConnectionHandler connectionHandler) {
        if (serverConfig.getDispatchMode() == DispatchMode.CONCURRENT) {
            log.info("Dispatching connections to {} workers", serverConfig.getWorkerThreads());
            return new ConcurrentDispatcher(connectionHandler, serverConfig.getWorkerThreads(),
                    serverConfig.getWorkerQueueCapacity());
        }
        return new SequentialDispatcher(connectionHandler);
    }

    @Bean
    CommandLineRunner commandLineRunner(ApplicationContext context) {
        return args -> {
            HttpStubServer httpStubServer = context.getBean(HttpStubServer.class);
            ServerConfig serverConfig = context.getBean(ServerConfig.class);
            PortResolver portResolver = context.getBean(PortResolver.class);

            serverConfig.setPort(portResolver.resolvePort());

            httpStubServer.startServer();
        };
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            if (root instanceof ServerSetupException) {
                break;
            }
            root = root.getCause();
        }
        return root.getMessage();
    }
}
