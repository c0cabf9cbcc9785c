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
package dev.mars.tokenstore.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tokenstore.storage.FileTokenStore;
import dev.mars.tokenstore.storage.MergePlan;
import dev.mars.tokenstore.storage.TokenRecord;
import dev.mars.tokenstore.storage.TokenStoreConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chaos testing for the token store.
 * <p>
 * Throws hostile scenarios at a live store and checks it stays consistent:
 * <ul>
 *   <li>Concurrent writer and merge storms</li>
 *   <li>Corruption of the store file while reads are in flight</li>
 *   <li>Legacy and half-formed files on disk</li>
 *   <li>Leftover temp files after failures</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Run all chaos tests
 * java ... dev.mars.tokenstore.demo.TokenStoreChaos
 *
 * # Run one group
 * java ... dev.mars.tokenstore.demo.TokenStoreChaos concurrent
 * java ... dev.mars.tokenstore.demo.TokenStoreChaos corruption
 * java ... dev.mars.tokenstore.demo.TokenStoreChaos boundary
 * </pre>
 *
 * @see FileTokenStore
 */
public class TokenStoreChaos {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public TokenStoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------------------------------+");
        System.out.println("|              TOKEN STORE CHAOS TESTING SUITE                  |");
        System.out.println("+---------------------------------------------------------------+");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("tokenstore-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());

        TokenStoreChaos chaos = new TokenStoreChaos(chaosDir);
        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "boundary" -> chaos.runBoundaryTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCorruptionTests();
                    chaos.runBoundaryTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, corruption, boundary, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("+---------------------------------------------------------------+");
            System.out.printf("|  RESULTS: %d passed, %d failed%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("+---------------------------------------------------------------+");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY
    // =========================================================================

    void runConcurrencyTests() {
        printSection("CONCURRENCY");

        chaosTest("Writer storm: 8 threads x 50 writeAll", () -> {
            Path dir = createTestDir("writer-storm");
            try (FileTokenStore store = openStore(dir)) {
                int threads = 8;
                int perThread = 50;
                ExecutorService pool = Executors.newFixedThreadPool(threads);
                CountDownLatch start = new CountDownLatch(1);
                List<CompletableFuture<Void>> writes = new ArrayList<>();
                Object submitLock = new Object();
                for (int t = 0; t < threads; t++) {
                    int thread = t;
                    pool.execute(() -> {
                        try {
                            start.await();
                            for (int i = 0; i < perThread; i++) {
                                List<TokenRecord> batch = List.of(token("t" + thread + "-" + i, i));
                                synchronized (submitLock) {
                                    writes.add(store.writeAll(batch));
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    });
                }
                start.countDown();
                pool.shutdown();
                check(pool.awaitTermination(30, TimeUnit.SECONDS), "submitters finished");
                CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);

                JsonNode root = MAPPER.readTree(store.filePath().toFile());
                check(root.path("tokens").size() == 1, "exactly one record survives a full replace");
                check(countTempFiles(dir) == 0, "no temp files left behind");
            }
        });

        chaosTest("Merge storm keeps every record and the last value", () -> {
            Path dir = createTestDir("merge-storm");
            try (FileTokenStore store = openStore(dir)) {
                List<TokenRecord> initial = new ArrayList<>();
                for (int i = 0; i < 20; i++) {
                    initial.add(token("rt-" + i, 0));
                }
                store.writeAll(initial).get(10, TimeUnit.SECONDS);

                List<CompletableFuture<MergePlan.Outcome>> merges = new ArrayList<>();
                for (int round = 1; round <= 100; round++) {
                    TokenRecord update = TokenRecord.of(Map.of(
                            TokenRecord.KEY_FIELD, "rt-" + (round % 20),
                            "counter", round,
                            TokenRecord.SESSION_FIELD, "session-" + round));
                    merges.add(store.merge(null, update));
                }
                CompletableFuture.allOf(merges.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);

                JsonNode tokens = MAPPER.readTree(store.filePath().toFile()).path("tokens");
                check(tokens.size() == 20, "record count unchanged");
                check(tokens.get(0).path("counter").asInt() == 100, "rt-0 holds its last update");
                check(tokens.get(5).path("counter").asInt() == 85, "rt-5 holds its last update");
                check(!tokens.toString().contains(TokenRecord.SESSION_FIELD), "session ids never persisted");
            }
        });

        chaosTest("Reads during writes never see a torn file", () -> {
            Path dir = createTestDir("read-during-write");
            try (FileTokenStore store = openStore(dir)) {
                AtomicBoolean running = new AtomicBoolean(true);
                AtomicInteger torn = new AtomicInteger();
                Thread reader = new Thread(() -> {
                    while (running.get()) {
                        try {
                            byte[] raw = Files.readAllBytes(store.filePath());
                            if (raw.length > 0) {
                                MAPPER.readTree(raw);
                            }
                        } catch (IOException e) {
                            torn.incrementAndGet();
                        }
                    }
                });
                store.getSalt().get(10, TimeUnit.SECONDS);
                reader.start();
                for (int i = 0; i < 200; i++) {
                    store.writeAll(List.of(token("rt", i), token("big-" + i, i))).get(10, TimeUnit.SECONDS);
                }
                running.set(false);
                reader.join(5000);
                check(torn.get() == 0, "reader saw " + torn.get() + " unparseable snapshots");
            }
        });
    }

    // =========================================================================
    // CORRUPTION
    // =========================================================================

    void runCorruptionTests() {
        printSection("CORRUPTION");

        chaosTest("Garbage file serves the cached records", () -> {
            Path dir = createTestDir("garbage");
            try (FileTokenStore store = openStore(dir)) {
                store.writeAll(List.of(token("a", 1), token("b", 2))).get(10, TimeUnit.SECONDS);
                check(store.readAll().get(10, TimeUnit.SECONDS).size() == 2, "initial read");

                Files.writeString(store.filePath(), "{\"salt\": \"x\", \"tokens\": [", StandardCharsets.UTF_8);
                List<TokenRecord> afterCorruption = store.readAll().get(10, TimeUnit.SECONDS);
                check(afterCorruption.size() == 2, "stale records served");
                check(!store.isHealthy(), "store reports unhealthy");

                store.writeAll(afterCorruption).get(10, TimeUnit.SECONDS);
                check(store.isHealthy(), "write restores health");
                check(MAPPER.readTree(store.filePath().toFile()).path("tokens").size() == 2, "file repaired");
            }
        });

        chaosTest("Unreadable file is not overwritten by a merge", () -> {
            Path dir = createTestDir("unreadable-merge");
            Files.writeString(dir.resolve("accounts.json"), "not json at all", StandardCharsets.UTF_8);
            try (FileTokenStore store = openStore(dir)) {
                MergePlan.Outcome outcome = store.merge(List.of(token("a", 1))).get(10, TimeUnit.SECONDS);
                check(outcome == MergePlan.Outcome.SKIPPED_UNREADABLE, "merge skipped, got " + outcome);
                check(Files.readString(dir.resolve("accounts.json")).equals("not json at all"), "file untouched");
            }
        });

        chaosTest("Store file replaced by a directory", () -> {
            Path dir = createTestDir("file-is-dir");
            Files.createDirectories(dir.resolve("accounts.json"));
            try (FileTokenStore store = openStore(dir)) {
                check(store.readAll().get(10, TimeUnit.SECONDS).isEmpty(), "read degrades to empty");
                boolean failed = false;
                try {
                    store.writeAll(List.of(token("a", 1))).get(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    failed = true;
                }
                check(failed, "write reports failure");
                check(store.merge(List.of(token("a", 1))).get(10, TimeUnit.SECONDS)
                        == MergePlan.Outcome.SKIPPED_UNREADABLE, "pipeline still alive after failure");
            }
        });
    }

    // =========================================================================
    // BOUNDARY
    // =========================================================================

    void runBoundaryTests() {
        printSection("BOUNDARY");

        chaosTest("Legacy array file is migrated", () -> {
            Path dir = createTestDir("legacy");
            Files.writeString(dir.resolve("accounts.json"),
                    "[{\"refresh_token\":\"a\",\"enable\":true},{\"refresh_token\":\"b\",\"enable\":false}]",
                    StandardCharsets.UTF_8);
            try (FileTokenStore store = openStore(dir)) {
                String salt = store.getSalt().get(10, TimeUnit.SECONDS);
                JsonNode root = MAPPER.readTree(dir.resolve("accounts.json").toFile());
                check(salt.equals(root.path("salt").asText()), "salt persisted");
                check(root.path("tokens").size() == 2, "records preserved");
            }
        });

        chaosTest("Zero-byte file gains a salt and empty tokens", () -> {
            Path dir = createTestDir("zero-byte");
            Files.createFile(dir.resolve("accounts.json"));
            try (FileTokenStore store = openStore(dir)) {
                String salt = store.getSalt().get(10, TimeUnit.SECONDS);
                check(!salt.isBlank(), "salt generated");
                check(store.readAll().get(10, TimeUnit.SECONDS).isEmpty(), "no records");
            }
        });

        chaosTest("Temp file left by a crashed writer is ignored", () -> {
            Path dir = createTestDir("crashed-writer");
            Path orphan = dir.resolve(".accounts.json.1.0.orphan.tmp");
            Files.writeString(orphan, "{\"salt\":\"half-writ", StandardCharsets.UTF_8);
            try (FileTokenStore store = openStore(dir)) {
                store.writeAll(List.of(token("a", 1))).get(10, TimeUnit.SECONDS);
                List<TokenRecord> read = store.readAll().get(10, TimeUnit.SECONDS);
                check(read.size() == 1 && store.isHealthy(), "store unaffected by orphan");
                check(Files.exists(orphan), "orphan left for the operator");
                check(countTempFiles(dir) == 1, "no new temp files");
            }
        });

        chaosTest("Large record with unicode survives round trip", () -> {
            Path dir = createTestDir("large");
            try (FileTokenStore store = openStore(dir)) {
                String payload = "账号-🔑-".repeat(20_000);
                store.writeAll(List.of(token("big", 1).with("note", payload))).get(10, TimeUnit.SECONDS);
                List<TokenRecord> read = store.readAll().get(10, TimeUnit.SECONDS);
                check(payload.equals(read.get(0).text("note")), "payload intact");
            }
        });
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private FileTokenStore openStore(Path dir) {
        return new FileTokenStore(TokenStoreConfig.builder()
                .dataDir(dir)
                .cacheTtlMs(0)
                .syncEnabled(false)
                .build());
    }

    private static TokenRecord token(String key, int counter) {
        return TokenRecord.of(Map.of(
                TokenRecord.KEY_FIELD, key,
                "access_token", "at-" + counter,
                "counter", counter,
                "enable", true));
    }

    private static long countTempFiles(Path dir) throws IOException {
        try (var stream = Files.list(dir)) {
            return stream.filter(p -> p.getFileName().toString().endsWith(".tmp")).count();
        }
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new AssertionError(message);
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("+---------------------------------------------------------------+");
        System.out.printf("|  %-61s|%n", name);
        System.out.println("+---------------------------------------------------------------+");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-55s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(TokenStoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not delete " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }
}
