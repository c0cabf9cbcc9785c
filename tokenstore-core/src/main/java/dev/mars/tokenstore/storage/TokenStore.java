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

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent set of token records backed by a single JSON file.
 * <p>
 * <b>Operations:</b>
 * <ul>
 *   <li>{@link #readAll()} - snapshot of every record, possibly served from cache</li>
 *   <li>{@link #writeAll(List)} - replaces the whole record set</li>
 *   <li>{@link #merge(List, TokenRecord)} - folds a partial in-memory view back into the set</li>
 * </ul>
 * <p>
 * <b>Critical Contract:</b> writes and merges are applied one at a time, in the
 * order they were submitted. The future returned for operation N completes
 * only after operations 1..N have been applied. A failed operation fails its
 * own future and nothing else.
 * <p>
 * Reads are not ordered against in-flight writes and may be stale by up to the
 * configured cache TTL.
 *
 * @see FileTokenStore
 */
public interface TokenStore extends Closeable {

    /**
     * Returns the store's salt, creating or migrating the store file on first use.
     * <p>
     * The salt is generated once per store and never changes while the file stays
     * readable. If the file cannot be read, a process-local salt is returned.
     *
     * @return a future holding the salt
     */
    CompletableFuture<String> getSalt();

    /**
     * Returns every record, including disabled ones.
     * <p>
     * If the file is unreadable or malformed, the last successfully read records
     * are returned instead (or an empty list if there are none). This future does
     * not fail because of disk problems.
     *
     * @return a future holding an immutable list of records
     */
    CompletableFuture<List<TokenRecord>> readAll();

    /**
     * Replaces the entire record set.
     * <p>
     * A null list is treated as empty. The {@value TokenRecord#SESSION_FIELD}
     * field is stripped and duplicate keys are collapsed before writing.
     *
     * @param tokens the new record set
     * @return a future that completes when the file has been replaced
     */
    CompletableFuture<Void> writeAll(List<TokenRecord> tokens);

    /**
     * Folds a partial in-memory view back into the persisted record set.
     * <p>
     * Records are matched by {@value TokenRecord#KEY_FIELD} and overlaid field by
     * field. Records the view does not mention are kept; records with no stored
     * match are not added.
     *
     * @param activeTokens  the in-memory view, may be null
     * @param tokenToUpdate if non-null, only this record is merged
     * @return a future holding what the merge did
     * @see MergePlan
     */
    CompletableFuture<MergePlan.Outcome> merge(List<TokenRecord> activeTokens, TokenRecord tokenToUpdate);

    /**
     * Merges the whole active view. Same as {@code merge(activeTokens, null)}.
     */
    default CompletableFuture<MergePlan.Outcome> merge(List<TokenRecord> activeTokens) {
        return merge(activeTokens, null);
    }

    /**
     * @return false if the most recent disk read failed and no write has succeeded since
     */
    boolean isHealthy();

    /**
     * @return the path of the backing file
     */
    Path filePath();

    /**
     * Waits for queued writes to finish, then releases all resources.
     * <p>
     * After close, every operation fails.
     */
    @Override
    void close();
}
