package com.jstubhttp.components.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    public void testDefaults() {
        ServerConfig config = new ServerConfig();

        assertEquals(8080, config.getPort());
        assertEquals(DispatchMode.SEQUENTIAL, config.getDispatchMode());
        assertEquals(RouteTableVariant.TEXT, config.getRouteTable());
        assertEquals(EmptyRequestPolicy.NOT_FOUND, config.getEmptyRequestPolicy());
        assertEquals(1024, config.getReadBufferSize());
        assertEquals(3, config.getBacklog());
    }

    @Test
    public void testPropertyValuesAreCaseInsensitive() {
        ServerConfig config = new ServerConfig();
        config.dispatch("Concurrent");
        config.routes(" json ");
        config.emptyRequest("close");

        assertEquals(DispatchMode.CONCURRENT, config.getDispatchMode());
        assertEquals(RouteTableVariant.JSON, config.getRouteTable());
        assertEquals(EmptyRequestPolicy.CLOSE, config.getEmptyRequestPolicy());
    }

    @Test
    public void testEmptyRequestPolicyAcceptsDashedName() {
        assertEquals(EmptyRequestPolicy.NOT_FOUND, EmptyRequestPolicy.fromProperty("not-found"));
    }

    @Test
    public void testUnknownDispatchModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DispatchMode.fromProperty("pooled"));
    }
}
