package com.jstubhttp.components.server;

public enum ServerState {
    IDLE,
    ACCEPTING,
    DISPATCHING,
    STOPPED
}
