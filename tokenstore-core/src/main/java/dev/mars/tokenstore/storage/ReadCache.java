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

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * In-memory copy of the last record sequence read from or written to disk.
 * <p>
 * A value is <i>fresh</i> while it is younger than the configured TTL. Stale
 * values are still kept: they are served when a disk read fails.
 * <p>
 * <b>INVARIANT:</b> a value read from disk never replaces a value installed by
 * a later write. Disk reads run outside the write pipeline, so a slow read may
 * finish after a write has landed. Every write bumps a generation counter and
 * {@link #offer(List, long)} rejects results read under an older generation.
 */
final class ReadCache {

    /**
     * @param verified false once the value has been re-stamped after a failed read
     */
    record Snapshot(List<TokenRecord> records, long stampedAt, boolean verified) {
    }

    private final Clock clock;
    private final long ttlMillis;

    private Snapshot snapshot;
    private long generation;

    ReadCache(Clock clock, long ttlMillis) {
        this.clock = clock;
        this.ttlMillis = ttlMillis;
    }

    /**
     * @return the cached records if younger than the TTL
     */
    Optional<List<TokenRecord>> fresh() {
        return freshSnapshot().map(Snapshot::records);
    }

    /**
     * @return the cached snapshot if younger than the TTL
     */
    synchronized Optional<Snapshot> freshSnapshot() {
        if (snapshot == null) {
            return Optional.empty();
        }
        long age = clock.millis() - snapshot.stampedAt();
        return age < ttlMillis ? Optional.of(snapshot) : Optional.empty();
    }

    /**
     * Re-stamps the cached value (if any) and returns it, regardless of age.
     * Used for the stale-but-available fallback; the value is marked unverified
     * until the next successful read or write.
     */
    synchronized Optional<List<TokenRecord>> restamp() {
        if (snapshot == null) {
            return Optional.empty();
        }
        snapshot = new Snapshot(snapshot.records(), clock.millis(), false);
        return Optional.of(snapshot.records());
    }

    /**
     * @return the write generation to pass to {@link #offer(List, long)}
     */
    synchronized long generation() {
        return generation;
    }

    /**
     * Installs records read from disk, unless a write landed since
     * {@code readGeneration} was taken.
     *
     * @return the records now cached (the offered ones, or the newer written ones)
     */
    synchronized List<TokenRecord> offer(List<TokenRecord> records, long readGeneration) {
        if (readGeneration != generation && snapshot != null) {
            return snapshot.records();
        }
        snapshot = new Snapshot(List.copyOf(records), clock.millis(), true);
        return snapshot.records();
    }

    /**
     * Installs records that were just written to disk.
     */
    synchronized void written(List<TokenRecord> records) {
        generation++;
        snapshot = new Snapshot(List.copyOf(records), clock.millis(), true);
    }
}
