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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * File-based implementation of {@link TokenStore}.
 * <p>
 * <b>File:</b>
 * <pre>
 * data/
 *  └─ accounts.json   // {"salt": "...", "tokens": [...]} (atomic replace)
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All writes and merges are serialized through a single-threaded pipeline
 * ({@link WriteSerializer}). Merges read and write inside the same pipeline
 * task, so no other mutation can slip in between. Cache misses are served on
 * a separate reader thread and never wait for the pipeline.
 * <p>
 * <b>Durability:</b> every write goes through {@link AtomicFileWriter}
 * (write temp → fsync → rename → fsync dir).
 * <p>
 * <b>Availability:</b> disk read failures never fail {@link #readAll()}; the
 * last good records are served instead and {@link #isHealthy()} turns false
 * until the next successful read or write.
 * <p>
 * No file locks are taken. Two processes writing the same file cannot corrupt
 * it, but one may overwrite the other's update.
 *
 * @see TokenStore
 */
public final class FileTokenStore implements TokenStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileTokenStore.class);

    // ========================================================================
    // State
    // ========================================================================

    private final TokenStoreConfig config;
    private final Path storeFile;
    private final StoreDocumentCodec codec;
    private final StoreBootstrap bootstrap;
    private final ReadCache cache;
    private final AtomicFileWriter fileWriter;
    private final WriteSerializer pipeline;
    private final ExecutorService readExecutor;

    private volatile boolean lastReadOk = true;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see TokenStoreConfig
     */
    public FileTokenStore() {
        this(TokenStoreConfig.load());
    }

    /**
     * Creates a store with the specified configuration.
     *
     * @param config the store configuration
     */
    public FileTokenStore(TokenStoreConfig config) {
        this(config, new SecureRandomSaltGenerator());
    }

    /**
     * Creates a store with the specified configuration and salt source.
     *
     * @param config        the store configuration
     * @param saltGenerator source of new salts for created or migrated files
     */
    public FileTokenStore(TokenStoreConfig config, SaltGenerator saltGenerator) {
        this(config, saltGenerator, Clock.systemUTC(), new AtomicFileWriter(config.syncEnabled()));
    }

    FileTokenStore(TokenStoreConfig config, SaltGenerator saltGenerator, Clock clock, AtomicFileWriter fileWriter) {
        this.config = config;
        this.storeFile = config.storeFile();
        this.codec = new StoreDocumentCodec();
        this.fileWriter = fileWriter;
        this.bootstrap = new StoreBootstrap(storeFile, codec, saltGenerator, fileWriter);
        this.cache = new ReadCache(clock, config.cacheTtlMs());
        this.pipeline = new WriteSerializer("tokenstore-writer");
        this.readExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tokenstore-reader");
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileTokenStore initialized: file={}, cacheTtl={}, syncEnabled={}",
                storeFile, config.cacheTtl(), config.syncEnabled());

        if (!config.syncEnabled()) {
            LOG.warn("FileTokenStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Returns the configuration used by this store.
     */
    public TokenStoreConfig config() {
        return config;
    }

    @Override
    public Path filePath() {
        return storeFile;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public CompletableFuture<String> getSalt() {
        if (closed) {
            return closedFuture();
        }
        if (bootstrap.saltResolved()) {
            return CompletableFuture.completedFuture(bootstrap.resolveSalt());
        }
        return onReader(bootstrap::resolveSalt);
    }

    @Override
    public CompletableFuture<List<TokenRecord>> readAll() {
        if (closed) {
            return closedFuture();
        }
        Optional<List<TokenRecord>> fresh = cache.fresh();
        if (fresh.isPresent()) {
            LOG.trace("readAll served from cache ({} records)", fresh.get().size());
            return CompletableFuture.completedFuture(fresh.get());
        }
        return onReader(() -> loadRecords().records());
    }

    @Override
    public boolean isHealthy() {
        return lastReadOk;
    }

    /**
     * Result of one lookup.
     *
     * @param records the records served
     * @param ok      false if they are a fallback for a failed disk read
     */
    record Load(List<TokenRecord> records, boolean ok) {
    }

    /**
     * Returns the records from cache or disk, applying the stale-but-available
     * fallback. Never throws.
     */
    Load loadRecords() {
        Optional<ReadCache.Snapshot> fresh = cache.freshSnapshot();
        if (fresh.isPresent()) {
            return new Load(fresh.get().records(), fresh.get().verified());
        }

        long generation = cache.generation();
        try {
            bootstrap.ensureExists();
            StoreDocument document = codec.decode(Files.readAllBytes(storeFile));
            Optional<List<TokenRecord>> records = document.records();
            if (records.isPresent()) {
                lastReadOk = true;
                List<TokenRecord> installed = cache.offer(records.get(), generation);
                LOG.debug("Loaded {} records from {}", installed.size(), storeFile);
                return new Load(installed, true);
            }
            LOG.warn("Store file {} has an unexpected format ({}), keeping cached records",
                    storeFile, document.getClass().getSimpleName());
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to read store file {}: {}", storeFile, e.getMessage(), e);
        }

        lastReadOk = false;
        Optional<List<TokenRecord>> stale = cache.restamp();
        if (stale.isPresent()) {
            LOG.debug("Serving {} stale records after failed read", stale.get().size());
            return new Load(stale.get(), false);
        }
        return new Load(List.of(), false);
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public CompletableFuture<Void> writeAll(List<TokenRecord> tokens) {
        if (closed) {
            return closedFuture();
        }
        // Snapshot now; the caller may keep mutating its list
        List<TokenRecord> snapshot = tokens == null ? List.of() : new ArrayList<>(tokens);
        return pipeline.submit("writeAll", () -> {
            List<TokenRecord> written = persist(snapshot);
            LOG.info("Saved {} records to {}", written.size(), storeFile);
            return null;
        });
    }

    @Override
    public CompletableFuture<MergePlan.Outcome> merge(List<TokenRecord> activeTokens, TokenRecord tokenToUpdate) {
        if (closed) {
            return closedFuture();
        }
        List<TokenRecord> snapshot = activeTokens == null ? null : new ArrayList<>(activeTokens);
        return pipeline.submit("merge", () -> {
            // Health comes from this read only; the reader thread may flip lastReadOk meanwhile
            Load onDisk = loadRecords();
            MergePlan plan = MergePlan.from(onDisk.records(), onDisk.ok(), snapshot, tokenToUpdate);

            if (!plan.requiresPersistence()) {
                LOG.warn("Store file {} could not be read, skipping merge to avoid overwriting it", storeFile);
                return plan.outcome();
            }
            if (plan.unmatched() > 0) {
                LOG.debug("Merge ignored {} records with no stored match", plan.unmatched());
            }

            List<TokenRecord> written = persist(plan.tokensToPersist());
            LOG.debug("Merge {}: {} matched, {} records saved", plan.outcome(), plan.matched(), written.size());
            return plan.outcome();
        });
    }

    /**
     * Writes a full record set. Must be called from the pipeline thread.
     *
     * @return the records as written
     */
    private List<TokenRecord> persist(List<TokenRecord> tokens) throws IOException {
        List<TokenRecord> normalized = normalize(tokens);
        bootstrap.ensureExists();
        String salt = bootstrap.resolveSalt();

        fileWriter.write(storeFile, codec.encode(salt, normalized));

        cache.written(normalized);
        lastReadOk = true;
        return normalized;
    }

    /**
     * Strips session fields and collapses duplicate keys. A duplicate keeps
     * the position of the first occurrence and the value of the last.
     */
    static List<TokenRecord> normalize(List<TokenRecord> tokens) {
        List<TokenRecord> result = new ArrayList<>(tokens.size());
        Map<String, Integer> positions = new HashMap<>();
        int duplicates = 0;
        int nulls = 0;

        for (TokenRecord token : tokens) {
            if (token == null) {
                nulls++;
                continue;
            }
            TokenRecord plain = token.withoutSession();
            String key = plain.refreshToken();
            Integer pos = key == null ? null : positions.get(key);
            if (pos != null) {
                result.set(pos, plain);
                duplicates++;
            } else {
                if (key != null) {
                    positions.put(key, result.size());
                }
                result.add(plain);
            }
        }

        if (duplicates > 0) {
            LOG.warn("Collapsed {} records with duplicate {}", duplicates, TokenRecord.KEY_FIELD);
        }
        if (nulls > 0) {
            LOG.warn("Dropped {} null records", nulls);
        }
        return result;
    }

    // ========================================================================
    // Close
    // ========================================================================

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing token store at: {}", storeFile);

        pipeline.close();
        readExecutor.shutdown();

        LOG.info("Token store closed ({} writes submitted, {} failed)",
                pipeline.submittedCount(), pipeline.failedCount());
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private <T> CompletableFuture<T> onReader(Supplier<T> read) {
        try {
            return CompletableFuture.supplyAsync(read, readExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed", e));
        }
    }

    private static <T> CompletableFuture<T> closedFuture() {
        return CompletableFuture.failedFuture(new StorageException("Store is closed"));
    }

    // ========================================================================
    // Exception
    // ========================================================================

    /**
     * Exception thrown when store operations fail.
     */
    public static class StorageException extends RuntimeException {
        public StorageException(String message) {
            super(message);
        }

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
