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

import dev.mars.tokenstore.storage.MergePlan.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MergePlan}.
 */
class MergePlanTest {

    private static TokenRecord stored(String key, String accessToken, boolean enable) {
        return TokenRecord.of(Map.of("refresh_token", key, "access_token", accessToken, "enable", enable));
    }

    private static TokenRecord active(String key, String accessToken, String sessionId) {
        return TokenRecord.of(Map.of("refresh_token", key, "access_token", accessToken, "sessionId", sessionId));
    }

    // ========================================================================
    // Skip / Initialize
    // ========================================================================

    @Nested
    @DisplayName("Guard branches")
    class GuardBranches {

        @Test
        @DisplayName("Failed read with nothing on disk skips the merge")
        void failedReadEmptyDiskSkips() {
            MergePlan plan = MergePlan.from(List.of(), false, List.of(active("a", "x", "s")), null);

            assertEquals(Outcome.SKIPPED_UNREADABLE, plan.outcome());
            assertFalse(plan.requiresPersistence());
            assertTrue(plan.tokensToPersist().isEmpty());
        }

        @Test
        @DisplayName("Failed read with stale records on disk still merges")
        void failedReadWithRecordsMerges() {
            MergePlan plan = MergePlan.from(List.of(stored("a", "old", true)), false,
                    List.of(active("a", "new", "s")), null);

            assertEquals(Outcome.UPDATED, plan.outcome());
            assertEquals("new", plan.tokensToPersist().get(0).text("access_token"));
        }

        @Test
        @DisplayName("Empty store is initialized from the active view without session ids")
        void emptyStoreInitializedFromMemory() {
            MergePlan plan = MergePlan.from(List.of(), true,
                    List.of(active("a", "x", "s1"), active("b", "y", "s2")), null);

            assertEquals(Outcome.INITIALIZED_FROM_MEMORY, plan.outcome());
            assertEquals(2, plan.tokensToPersist().size());
            plan.tokensToPersist().forEach(t -> assertFalse(t.has("sessionId")));
        }

        @Test
        @DisplayName("Empty store and empty view persists an empty set")
        void emptyStoreEmptyView() {
            MergePlan plan = MergePlan.from(List.of(), true, List.of(), null);

            assertEquals(Outcome.UPDATED, plan.outcome());
            assertTrue(plan.requiresPersistence());
            assertTrue(plan.tokensToPersist().isEmpty());
        }

        @Test
        @DisplayName("Null inputs are tolerated")
        void nullInputs() {
            MergePlan plan = MergePlan.from(null, true, null, null);

            assertEquals(Outcome.UPDATED, plan.outcome());
            assertTrue(plan.tokensToPersist().isEmpty());
        }
    }

    // ========================================================================
    // Overlay
    // ========================================================================

    @Nested
    @DisplayName("Overlay by key")
    class Overlay {

        @Test
        @DisplayName("Matched record is overlaid, unmentioned records survive")
        void matchedOverlaidOthersKept() {
            List<TokenRecord> onDisk = List.of(
                    stored("a", "a-old", true),
                    stored("disabled", "d-old", false),
                    stored("c", "c-old", true));

            MergePlan plan = MergePlan.from(onDisk, true,
                    List.of(active("a", "a-new", "s1"), active("c", "c-new", "s3")), null);

            List<TokenRecord> result = plan.tokensToPersist();
            assertEquals(3, result.size());
            assertEquals("a-new", result.get(0).text("access_token"));
            assertEquals("true", result.get(0).text("enable"));
            assertEquals(onDisk.get(1), result.get(1));
            assertEquals("c-new", result.get(2).text("access_token"));
            assertEquals(2, plan.matched());
            assertEquals(0, plan.unmatched());
        }

        @Test
        @DisplayName("Unmatched active record is not inserted")
        void unmatchedNotInserted() {
            List<TokenRecord> onDisk = List.of(stored("a", "x", true));

            MergePlan plan = MergePlan.from(onDisk, true, List.of(active("zzz", "y", "s")), null);

            assertEquals(1, plan.tokensToPersist().size());
            assertEquals(onDisk, plan.tokensToPersist());
            assertEquals(1, plan.unmatched());
        }

        @Test
        @DisplayName("Single record takes precedence over the active view")
        void singleRecordOnly() {
            List<TokenRecord> onDisk = List.of(stored("a", "a-old", true), stored("b", "b-old", true));

            MergePlan plan = MergePlan.from(onDisk, true,
                    List.of(active("a", "a-new", "s1")), active("b", "b-new", "s2"));

            assertEquals("a-old", plan.tokensToPersist().get(0).text("access_token"));
            assertEquals("b-new", plan.tokensToPersist().get(1).text("access_token"));
            assertFalse(plan.tokensToPersist().get(1).has("sessionId"));
        }

        @Test
        @DisplayName("Keyless active record matches nothing")
        void keylessActiveRecord() {
            TokenRecord keyless = TokenRecord.of(Map.of("access_token", "x"));
            List<TokenRecord> onDisk = List.of(TokenRecord.of(Map.of("access_token", "y")));

            MergePlan plan = MergePlan.from(onDisk, true, List.of(keyless), null);

            assertEquals(onDisk, plan.tokensToPersist());
            assertEquals(1, plan.unmatched());
        }

        @Test
        @DisplayName("Null entries in the active view are ignored")
        void nullEntriesIgnored() {
            List<TokenRecord> onDisk = List.of(stored("a", "old", true));
            List<TokenRecord> view = Arrays.asList(null, active("a", "new", "s"));

            MergePlan plan = MergePlan.from(onDisk, true, view, null);

            assertEquals("new", plan.tokensToPersist().get(0).text("access_token"));
        }

        @Test
        @DisplayName("Input list is not mutated")
        void inputNotMutated() {
            List<TokenRecord> onDisk = new ArrayList<>(List.of(stored("a", "old", true)));
            List<TokenRecord> copy = List.copyOf(onDisk);

            MergePlan.from(onDisk, true, List.of(active("a", "new", "s")), null);

            assertEquals(copy, onDisk);
        }

        @Test
        @DisplayName("Plan list is immutable")
        void planListImmutable() {
            MergePlan plan = MergePlan.from(List.of(stored("a", "x", true)), true, Collections.emptyList(), null);

            assertThrows(UnsupportedOperationException.class, () -> plan.tokensToPersist().add(stored("b", "y", true)));
        }
    }
}
