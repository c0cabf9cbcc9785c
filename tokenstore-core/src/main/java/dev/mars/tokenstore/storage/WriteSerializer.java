/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tokenstore.storage;

import dev.mars.tokenstore.storage.FileTokenStore.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO pipeline that runs store mutations one at a time.
 * <p>
 * Producers submit tasks from any thread; a single consumer thread runs each
 * task to completion before taking the next one from the queue.
 * <p>
 * <b>INVARIANT:</b> at most one task body runs at any moment, and bodies run in
 * submission order. <b>DO NOT</b> increase the pool size or add parallel write
 * paths.
 * <p>
 * A failing task completes only its own future exceptionally; the consumer
 * thread survives and later tasks still run.
 */
final class WriteSerializer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WriteSerializer.class);

    private static final long DRAIN_TIMEOUT_SECONDS = 10;

    /**
     * A unit of work run on the pipeline thread.
     */
    @FunctionalInterface
    interface Task<T> {
        T run() throws IOException;
    }

    private final ExecutorService executor;
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    WriteSerializer(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues a task behind every task submitted before it.
     *
     * @param operation name used in log messages
     * @param task      the body to run
     * @return a future completed with the task's result, or exceptionally
     *         with a {@link StorageException} if it failed
     */
    <T> CompletableFuture<T> submit(String operation, Task<T> task) {
        long seq = submitted.incrementAndGet();
        LOG.trace("Queued {} #{}", operation, seq);
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    T result = task.run();
                    LOG.trace("Completed {} #{}", operation, seq);
                    return result;
                } catch (IOException e) {
                    failed.incrementAndGet();
                    LOG.error("{} #{} failed: {}", operation, seq, e.getMessage(), e);
                    throw new StorageException(operation + " failed", e);
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    LOG.error("{} #{} failed: {}", operation, seq, e.getMessage(), e);
                    throw e;
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Rejected {} #{}: write pipeline is closed", operation, seq);
            return CompletableFuture.failedFuture(new StorageException("Store is closed", e));
        }
    }

    /** Number of tasks submitted so far. */
    long submittedCount() {
        return submitted.get();
    }

    /** Number of tasks that failed so far. */
    long failedCount() {
        return failed.get();
    }

    /**
     * Stops accepting tasks and waits for queued ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Write pipeline did not drain within {} s, abandoning queued writes", DRAIN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while draining write pipeline");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
