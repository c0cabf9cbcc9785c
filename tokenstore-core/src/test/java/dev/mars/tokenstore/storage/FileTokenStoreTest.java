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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tokenstore.storage.FileTokenStore.StorageException;
import dev.mars.tokenstore.storage.MergePlan.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileTokenStore}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Bootstrap and salt persistence</li>
 *   <li>Write/read round trip and caching</li>
 *   <li>Merge semantics (overlay, no insert, initialization)</li>
 *   <li>Session field stripping</li>
 *   <li>Close behaviour</li>
 * </ul>
 */
class FileTokenStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TTL = Duration.ofSeconds(60);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileTokenStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = openStore();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private FileTokenStore openStore() {
        TokenStoreConfig config = TokenStoreConfig.builder()
                .dataDir(tempDir.resolve("data"))
                .cacheTtlMs(TTL.toMillis())
                .syncEnabled(false)
                .build();
        return new FileTokenStore(config, new SecureRandomSaltGenerator(), clock, new AtomicFileWriter(false));
    }

    private void expireCache() {
        clock.advance(TTL);
    }

    private JsonNode readFile() throws Exception {
        return MAPPER.readTree(store.filePath().toFile());
    }

    private static TokenRecord token(String key, String accessToken) {
        return TokenRecord.of(Map.of("refresh_token", key, "access_token", accessToken, "enable", true));
    }

    // ========================================================================
    // Bootstrap & Salt
    // ========================================================================

    @Test
    void testGetSalt_CreatesStoreFile() throws Exception {
        String salt = store.getSalt().get(5, TimeUnit.SECONDS);

        assertFalse(salt.isBlank());
        JsonNode root = readFile();
        assertEquals(salt, root.get("salt").asText());
        assertEquals(0, root.get("tokens").size());
    }

    @Test
    void testGetSalt_StableAcrossRestart() throws Exception {
        String salt = store.getSalt().get(5, TimeUnit.SECONDS);
        store.writeAll(List.of(token("a", "x"))).get(5, TimeUnit.SECONDS);
        store.close();

        store = openStore();

        assertEquals(salt, store.getSalt().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testReadAll_AbsentFileIsEmpty() throws Exception {
        assertTrue(store.readAll().get(5, TimeUnit.SECONDS).isEmpty());
        assertTrue(Files.exists(store.filePath()));
        assertTrue(store.isHealthy());
    }

    @Test
    void testReadAll_LegacyFileReadWithoutMigration() throws Exception {
        Files.createDirectories(store.filePath().getParent());
        String legacy = "[{\"refresh_token\":\"a\"},{\"refresh_token\":\"b\"}]";
        Files.writeString(store.filePath(), legacy, StandardCharsets.UTF_8);

        List<TokenRecord> records = store.readAll().get(5, TimeUnit.SECONDS);

        assertEquals(2, records.size());
        assertEquals(legacy, Files.readString(store.filePath()));
    }

    @Test
    void testWriteAll_MigratesLegacyFileFirst() throws Exception {
        Files.createDirectories(store.filePath().getParent());
        Files.writeString(store.filePath(), "[{\"refresh_token\":\"a\"}]", StandardCharsets.UTF_8);

        store.writeAll(List.of(token("b", "x"))).get(5, TimeUnit.SECONDS);

        JsonNode root = readFile();
        assertFalse(root.get("salt").asText().isBlank());
        assertEquals(1, root.get("tokens").size());
        assertEquals("b", root.get("tokens").get(0).get("refresh_token").asText());
    }

    // ========================================================================
    // Write / Read
    // ========================================================================

    @Test
    void testWriteAll_RoundTripPreservesOrder() throws Exception {
        List<TokenRecord> tokens = List.of(token("c", "3"), token("a", "1"), token("b", "2"));

        store.writeAll(tokens).get(5, TimeUnit.SECONDS);
        expireCache();

        assertEquals(tokens, store.readAll().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testWriteAll_SurvivesRestart() throws Exception {
        List<TokenRecord> tokens = List.of(token("a", "1"), token("b", "2"));
        store.writeAll(tokens).get(5, TimeUnit.SECONDS);
        store.close();

        store = openStore();

        assertEquals(tokens, store.readAll().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testWriteAll_NullIsEmpty() throws Exception {
        store.writeAll(List.of(token("a", "1"))).get(5, TimeUnit.SECONDS);

        store.writeAll(null).get(5, TimeUnit.SECONDS);

        assertEquals(0, readFile().get("tokens").size());
        assertTrue(store.readAll().get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testWriteAll_StripsSessionField() throws Exception {
        store.writeAll(List.of(token("a", "1").with("sessionId", "s-1"))).get(5, TimeUnit.SECONDS);

        assertFalse(readFile().get("tokens").get(0).has("sessionId"));
        assertFalse(store.readAll().get(5, TimeUnit.SECONDS).get(0).has("sessionId"));
    }

    @Test
    void testWriteAll_CollapsesDuplicateKeys() throws Exception {
        store.writeAll(List.of(token("a", "first"), token("b", "x"), token("a", "last")))
                .get(5, TimeUnit.SECONDS);

        JsonNode tokens = readFile().get("tokens");
        assertEquals(2, tokens.size());
        assertEquals("a", tokens.get(0).get("refresh_token").asText());
        assertEquals("last", tokens.get(0).get("access_token").asText());
        assertEquals("b", tokens.get(1).get("refresh_token").asText());
    }

    @Test
    void testWriteAll_CallerMutationAfterSubmitIgnored() throws Exception {
        List<TokenRecord> tokens = new ArrayList<>(List.of(token("a", "1")));

        var pending = store.writeAll(tokens);
        tokens.add(token("b", "2"));
        pending.get(5, TimeUnit.SECONDS);

        assertEquals(1, readFile().get("tokens").size());
    }

    @Test
    void testReadAll_FreshCacheSkipsDisk() throws Exception {
        store.writeAll(List.of(token("a", "1"))).get(5, TimeUnit.SECONDS);
        String salt = store.getSalt().get(5, TimeUnit.SECONDS);
        Files.writeString(store.filePath(),
                "{\"salt\":\"" + salt + "\",\"tokens\":[{\"refresh_token\":\"external\"}]}",
                StandardCharsets.UTF_8);

        assertEquals("a", store.readAll().get(5, TimeUnit.SECONDS).get(0).refreshToken());

        expireCache();
        assertEquals("external", store.readAll().get(5, TimeUnit.SECONDS).get(0).refreshToken());
    }

    @Test
    void testReadAll_ReturnsImmutableList() throws Exception {
        store.writeAll(List.of(token("a", "1"))).get(5, TimeUnit.SECONDS);

        List<TokenRecord> records = store.readAll().get(5, TimeUnit.SECONDS);

        assertThrows(UnsupportedOperationException.class, () -> records.add(token("b", "2")));
    }

    // ========================================================================
    // Merge
    // ========================================================================

    @Test
    void testMerge_OverlaysMatchedFieldsOnly() throws Exception {
        TokenRecord stored = TokenRecord.of(Map.of(
                "refresh_token", "a", "access_token", "old", "projectId", "p-1", "enable", true));
        store.writeAll(List.of(stored)).get(5, TimeUnit.SECONDS);

        TokenRecord active = TokenRecord.of(Map.of(
                "refresh_token", "a", "access_token", "new", "expires_in", 3599, "sessionId", "s-1"));
        Outcome outcome = store.merge(List.of(active), null).get(5, TimeUnit.SECONDS);

        assertEquals(Outcome.UPDATED, outcome);
        JsonNode merged = readFile().get("tokens").get(0);
        assertEquals("new", merged.get("access_token").asText());
        assertEquals(3599, merged.get("expires_in").asInt());
        assertEquals("p-1", merged.get("projectId").asText());
        assertTrue(merged.get("enable").asBoolean());
        assertFalse(merged.has("sessionId"));
    }

    @Test
    void testMerge_KeepsRecordsAbsentFromActiveView() throws Exception {
        TokenRecord disabled = token("disabled", "d").with("enable", false);
        store.writeAll(List.of(token("a", "1"), disabled)).get(5, TimeUnit.SECONDS);

        store.merge(List.of(token("a", "2"))).get(5, TimeUnit.SECONDS);

        JsonNode tokens = readFile().get("tokens");
        assertEquals(2, tokens.size());
        assertEquals("disabled", tokens.get(1).get("refresh_token").asText());
        assertFalse(tokens.get(1).get("enable").asBoolean());
    }

    @Test
    void testMerge_UnmatchedRecordNotInserted() throws Exception {
        store.writeAll(List.of(token("a", "1"), token("b", "2"))).get(5, TimeUnit.SECONDS);

        store.merge(List.of(token("new-key", "x"))).get(5, TimeUnit.SECONDS);

        assertEquals(2, readFile().get("tokens").size());
        expireCache();
        assertEquals(2, store.readAll().get(5, TimeUnit.SECONDS).size());
    }

    @Test
    void testMerge_EmptyStoreInitializedFromMemory() throws Exception {
        List<TokenRecord> active = List.of(
                token("a", "1").with("sessionId", "s-1"),
                token("b", "2").with("sessionId", "s-2"));

        Outcome outcome = store.merge(active).get(5, TimeUnit.SECONDS);

        assertEquals(Outcome.INITIALIZED_FROM_MEMORY, outcome);
        JsonNode tokens = readFile().get("tokens");
        assertEquals(2, tokens.size());
        assertFalse(tokens.toString().contains("sessionId"));
    }

    @Test
    void testMerge_SingleRecordUpdate() throws Exception {
        store.writeAll(List.of(token("a", "1"), token("b", "1"))).get(5, TimeUnit.SECONDS);

        store.merge(List.of(token("a", "ignored"), token("b", "ignored")), token("b", "2"))
                .get(5, TimeUnit.SECONDS);

        JsonNode tokens = readFile().get("tokens");
        assertEquals("1", tokens.get(0).get("access_token").asText());
        assertEquals("2", tokens.get(1).get("access_token").asText());
    }

    @Test
    void testMerge_IdenticalResubmissionIsIdempotent() throws Exception {
        store.writeAll(List.of(token("a", "1"), token("b", "1"))).get(5, TimeUnit.SECONDS);
        List<TokenRecord> active = List.of(token("a", "2"));

        store.merge(active).get(5, TimeUnit.SECONDS);
        String first = Files.readString(store.filePath());
        store.merge(active).get(5, TimeUnit.SECONDS);

        assertEquals(first, Files.readString(store.filePath()));
    }

    @Test
    void testMerge_SeesPreviousWriteThroughCache() throws Exception {
        store.writeAll(List.of(token("a", "1"))).get(5, TimeUnit.SECONDS);
        store.writeAll(List.of(token("a", "1"), token("b", "1"))).get(5, TimeUnit.SECONDS);

        store.merge(List.of(token("b", "2"))).get(5, TimeUnit.SECONDS);

        JsonNode tokens = readFile().get("tokens");
        assertEquals(2, tokens.size());
        assertEquals("2", tokens.get(1).get("access_token").asText());
    }

    // ========================================================================
    // Close
    // ========================================================================

    @Test
    void testClose_OperationsFailAfterwards() {
        store.close();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> store.writeAll(List.of()).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
        assertThrows(ExecutionException.class, () -> store.readAll().get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> store.merge(List.of()).get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> store.getSalt().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testClose_DrainsQueuedWrites() throws Exception {
        for (int i = 0; i < 20; i++) {
            store.writeAll(List.of(token("a", String.valueOf(i))));
        }

        store.close();

        assertEquals("19", readFile().get("tokens").get(0).get("access_token").asText());
    }

    @Test
    void testClose_Idempotent() {
        store.close();
        assertDoesNotThrow(() -> store.close());
    }
}
