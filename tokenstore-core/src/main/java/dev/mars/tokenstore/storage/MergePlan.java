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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculates the record sequence a merge should persist.
 * <p>
 * Callers keep a partial, in-memory view of the records (typically only the
 * enabled ones, each possibly carrying a {@value TokenRecord#SESSION_FIELD}).
 * A merge folds that view back into the full on-disk sequence:
 * <ul>
 *   <li>Records are matched by {@value TokenRecord#KEY_FIELD}</li>
 *   <li>Matched records are overlaid field by field; on-disk fields the
 *       active record does not mention survive</li>
 *   <li>On-disk records the view does not mention are kept unchanged</li>
 *   <li>Active records with no on-disk match are NOT inserted</li>
 * </ul>
 * <p>
 * <b>Usage Pattern (Read → Plan → Persist):</b>
 * <pre>{@code
 * Load onDisk = loadRecords();
 * MergePlan plan = MergePlan.from(onDisk.records(), onDisk.ok(), activeTokens, null);
 * if (plan.requiresPersistence()) {
 *     persist(plan.tokensToPersist());
 * }
 * }</pre>
 *
 * @param outcome         which branch of the merge applied
 * @param tokensToPersist the full sequence to write (empty when skipped)
 * @param matched         number of active records that found an on-disk match
 * @param unmatched       number of active records that did not
 */
public record MergePlan(
        Outcome outcome,
        List<TokenRecord> tokensToPersist,
        int matched,
        int unmatched
) {

    /**
     * Result of a merge, as reported to the caller.
     */
    public enum Outcome {
        /** The last disk read failed and nothing is cached; nothing was written. */
        SKIPPED_UNREADABLE,
        /** The store was empty; the active view became the persisted set. */
        INITIALIZED_FROM_MEMORY,
        /** Matching on-disk records were updated in place. */
        UPDATED
    }

    public MergePlan {
        tokensToPersist = tokensToPersist == null
                ? Collections.emptyList()
                : List.copyOf(tokensToPersist);
    }

    /**
     * A plan that writes nothing.
     */
    public static MergePlan skipped() {
        return new MergePlan(Outcome.SKIPPED_UNREADABLE, Collections.emptyList(), 0, 0);
    }

    /**
     * Calculates the merge.
     * <p>
     * Algorithm:
     * <ol>
     *   <li>If the last read failed and the on-disk sequence is empty, skip;
     *       an unreadable file must not be replaced by an empty set</li>
     *   <li>If the on-disk sequence is empty and the view is not, the view
     *       (session fields stripped) becomes the persisted set</li>
     *   <li>Otherwise overlay {@code single} if given, else every active
     *       record, onto the on-disk record with the same key</li>
     * </ol>
     *
     * @param onDisk     the full sequence as last read
     * @param lastReadOk whether that same read succeeded
     * @param active     the caller's in-memory view, may be null
     * @param single     one record to update instead of the whole view, may be null
     * @return the calculated plan
     */
    public static MergePlan from(List<TokenRecord> onDisk,
                                 boolean lastReadOk,
                                 List<TokenRecord> active,
                                 TokenRecord single) {
        List<TokenRecord> current = onDisk == null ? Collections.emptyList() : onDisk;
        boolean hasActive = active != null && !active.isEmpty();

        if (!lastReadOk && current.isEmpty()) {
            return skipped();
        }

        if (current.isEmpty() && hasActive) {
            List<TokenRecord> initial = new ArrayList<>(active.size());
            for (TokenRecord token : active) {
                if (token != null) {
                    initial.add(token.withoutSession());
                }
            }
            return new MergePlan(Outcome.INITIALIZED_FROM_MEMORY, initial, 0, 0);
        }

        List<TokenRecord> merged = new ArrayList<>(current);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < merged.size(); i++) {
            String key = merged.get(i).refreshToken();
            if (key != null) {
                positions.putIfAbsent(key, i);
            }
        }

        List<TokenRecord> updates = single != null
                ? List.of(single)
                : (hasActive ? active : Collections.emptyList());

        int matched = 0;
        int unmatched = 0;
        for (TokenRecord update : updates) {
            if (update == null) {
                continue;
            }
            String key = update.refreshToken();
            Integer pos = key == null ? null : positions.get(key);
            if (pos == null) {
                unmatched++;
                continue;
            }
            merged.set(pos, merged.get(pos).overlay(update));
            matched++;
        }

        return new MergePlan(Outcome.UPDATED, merged, matched, unmatched);
    }

    /**
     * @return true if this plan should be written to disk
     */
    public boolean requiresPersistence() {
        return outcome != Outcome.SKIPPED_UNREADABLE;
    }
}
