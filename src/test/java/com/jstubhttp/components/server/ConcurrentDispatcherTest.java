package com.jstubhttp.components.server;

import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.infra.EmptyRequestPolicy;
import com.jstubhttp.components.repository.RouteTables;
import com.jstubhttp.components.services.ConnectionHandler;
import com.jstubhttp.components.services.RequestLineTokenizer;
import com.jstubhttp.components.services.RequestReader;
import com.jstubhttp.components.services.ResponseWriter;
import com.jstubhttp.components.services.Router;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentDispatcherTest {
    private final ConnectionHandler connectionHandler = new ConnectionHandler(new RequestReader(1024),
            new RequestLineTokenizer(), new Router(RouteTables.text()), new ResponseWriter(), EmptyRequestPolicy.NOT_FOUND);

    private static class LatchedConnection extends Connection {
        final CountDownLatch closed = new CountDownLatch(1);
        final AtomicReference<String> closedOn = new AtomicReference<>();

        LatchedConnection(String request, ByteArrayOutputStream out) {
            this(new ByteArrayInputStream(request.getBytes(StandardCharsets.US_ASCII)), out);
        }

        LatchedConnection(InputStream in, ByteArrayOutputStream out) {
            super(null, in, out);
        }

        @Override
        public void close() {
            closedOn.set(Thread.currentThread().getName());
            closed.countDown();
        }
    }

    @Test
    public void testConnectionIsHandledOnWorker() throws InterruptedException {
        ConcurrentDispatcher dispatcher = new ConcurrentDispatcher(connectionHandler, 2, 4);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LatchedConnection connection = new LatchedConnection("GET /health HTTP/1.1\r\n\r\n", out);

        dispatcher.dispatch(connection);

        assertTrue(connection.closed.await(5, TimeUnit.SECONDS));
        assertTrue(connection.closedOn.get().startsWith("stub-worker-"));
        assertTrue(out.toString(StandardCharsets.UTF_8).endsWith("\r\n\r\nOK"));

        dispatcher.shutdown();
        assertTrue(dispatcher.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    public void testDispatchAfterShutdownClosesConnection() throws InterruptedException {
        ConcurrentDispatcher dispatcher = new ConcurrentDispatcher(connectionHandler, 1, 1);
        dispatcher.shutdown();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LatchedConnection connection = new LatchedConnection("GET /health HTTP/1.1\r\n\r\n", out);

        dispatcher.dispatch(connection);

        assertTrue(connection.closed.await(1, TimeUnit.SECONDS));
        assertEquals(0, out.size());
    }

    @Test
    public void testSaturatedPoolRunsConnectionOnCaller() throws InterruptedException {
        ConcurrentDispatcher dispatcher = new ConcurrentDispatcher(connectionHandler, 1, 1);
        CountDownLatch release = new CountDownLatch(1);
        InputStream held = new ByteArrayInputStream("GET /health HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.US_ASCII)) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.read(b, off, len);
            }
        };
        LatchedConnection busy = new LatchedConnection(held, new ByteArrayOutputStream());
        LatchedConnection queued = new LatchedConnection("GET /health HTTP/1.1\r\n\r\n", new ByteArrayOutputStream());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LatchedConnection overflow = new LatchedConnection("GET /health HTTP/1.1\r\n\r\n", out);

        dispatcher.dispatch(busy);
        dispatcher.dispatch(queued);
        dispatcher.dispatch(overflow);

        assertEquals(Thread.currentThread().getName(), overflow.closedOn.get());
        assertTrue(out.toString(StandardCharsets.UTF_8).endsWith("\r\n\r\nOK"));

        release.countDown();
        assertTrue(busy.closed.await(5, TimeUnit.SECONDS));
        assertTrue(queued.closed.await(5, TimeUnit.SECONDS));
        dispatcher.shutdown();
        assertTrue(dispatcher.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    public void testWorkerCountIsBounded() {
        ConcurrentDispatcher dispatcher = new ConcurrentDispatcher(connectionHandler, 3, 5);

        assertEquals(3, dispatcher.getMaximumWorkers());
        assertThrows(IllegalArgumentException.class, () -> new ConcurrentDispatcher(connectionHandler, 0, 5));
        dispatcher.shutdown();
    }
}
