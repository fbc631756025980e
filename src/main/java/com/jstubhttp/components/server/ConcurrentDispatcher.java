package com.jstubhttp.components.server;

import com.jstubhttp.components.infra.Connection;
import com.jstubhttp.components.services.ConnectionHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands each connection to a fixed pool of workers and returns to accepting straight away.
 * The future is not kept. When every worker is busy and the queue is full the accepting
 * thread runs the connection itself, which holds back further accepts. Once the pool is
 * shut down the connection is refused and closed.
 */
@Slf4j
public class ConcurrentDispatcher implements DispatchStrategy {

    private final ConnectionHandler connectionHandler;
    private final ThreadPoolExecutor executor;

    public ConcurrentDispatcher(ConnectionHandler connectionHandler, int workerThreads, int queueCapacity) {
        if (workerThreads <= 0 || queueCapacity <= 0) {
            throw new IllegalArgumentException("Worker threads and queue capacity must be positive");
        }
        this.connectionHandler = connectionHandler;
        this.executor = new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), new WorkerThreadFactory(),
                ConcurrentDispatcher::runOnCallerUnlessShutdown);
    }

    @Override
    public void dispatch(Connection connection) {
        try {
            CompletableFuture.runAsync(() -> connectionHandler.handle(connection), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Could not dispatch connection {}: {}", connection.getId(), e.getMessage());
            closeQuietly(connection);
        }
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    public int getMaximumWorkers() {
        return executor.getMaximumPoolSize();
    }

    private static void runOnCallerUnlessShutdown(Runnable task, ThreadPoolExecutor pool) {
        if (pool.isShutdown()) {
            throw new RejectedExecutionException("Dispatcher is shut down");
        }
        task.run();
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (IOException e) {
            log.error("Error closing connection {}: {}", connection.getId(), e.getMessage());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stub-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
