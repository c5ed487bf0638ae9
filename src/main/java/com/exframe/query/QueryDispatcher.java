package com.exframe.query;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each query as its own task on a fixed worker pool. Cancelling the
 * returned future interrupts the worker, which abandons library reads at the
 * next file boundary.
 */
public class QueryDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

    private final QueryProcessor processor;
    private final ExecutorService executor;

    public QueryDispatcher(QueryProcessor processor, int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        this.processor = processor;
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
    }

    public Future<QueryResult> submit(QueryRequest request) {
        return executor.submit(() -> processor.process(request));
    }

    /**
     * Waits for the query up to {@code timeout}; on expiry the task is cancelled
     * and its partial progress dropped.
     */
    public QueryResult execute(QueryRequest request, Duration timeout)
            throws ExecutionException, InterruptedException, TimeoutException {
        Future<QueryResult> future = submit(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("query.abandoned domain={} afterMs={}", request.domainId(), timeout.toMillis());
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "query-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
