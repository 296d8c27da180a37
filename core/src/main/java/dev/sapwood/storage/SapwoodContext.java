/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.sapwood.types.ChunkID;

/**
 * Context object that manages the shared resources of an engine instance.
 * <p>
 * Holds the table registry and the thread pool used for compressing chunks in parallel.
 * Create one at startup and close it at shutdown.
 * </p>
 */
public final class SapwoodContext implements AutoCloseable {

    private static final String COMPRESSION_THREADS_PROPERTY = "sapwood.compression.threads";

    private static final System.Logger LOG = System.getLogger(SapwoodContext.class.getName());

    private final ExecutorService executor;
    private final StorageManager storageManager;

    private SapwoodContext(ExecutorService executor, StorageManager storageManager) {
        this.executor = executor;
        this.storageManager = storageManager;
    }

    /**
     * Create a new context with a thread pool sized by the {@code sapwood.compression.threads}
     * system property, defaulting to the number of available processors.
     */
    public static SapwoodContext create() {
        int threads = Integer.getInteger(COMPRESSION_THREADS_PROPERTY, Runtime.getRuntime().availableProcessors());
        return create(threads);
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static SapwoodContext create(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "sapwood-compression-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} compression threads", threads);
        return new SapwoodContext(executor, new StorageManager());
    }

    public StorageManager storageManager() {
        return storageManager;
    }

    public ExecutorService executor() {
        return executor;
    }

    /**
     * Compresses all finished chunks of the given table in parallel and waits until all of
     * them are done. The last chunk is the append target and is left alone, as are empty
     * chunks and chunks that have been compressed before.
     *
     * @return the number of chunks that were submitted for compression
     */
    public int compressChunks(Table table) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < table.chunkCount() - 1; i++) {
            ChunkID chunkId = new ChunkID(i);
            Chunk chunk = table.getChunk(chunkId);
            if (chunk.size() == 0 || !chunk.isMutable() || table.isChunkCompressed(chunkId)) {
                continue;
            }
            futures.add(CompletableFuture.runAsync(() -> table.compressChunk(chunkId), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        LOG.log(System.Logger.Level.DEBUG, "Compressed {0} of {1} chunks", futures.size(), table.chunkCount());
        return futures.size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        storageManager.reset();
        LOG.log(System.Logger.Level.DEBUG, "Closed context");
    }
}
