package com.jstubhttp.components.server;

import com.jstubhttp.components.infra.Connection;

/**
 * Decides where an accepted connection gets handled. Ownership of the connection passes
 * to the strategy on the call.
 */
public interface DispatchStrategy {

    void dispatch(Connection connection);

    default void shutdown() {
    }
}
