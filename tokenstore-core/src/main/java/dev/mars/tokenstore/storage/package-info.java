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
/**
 * Token Store - crash-consistent JSON record store.
 * <p>
 * This package provides persistence for token (account) records:
 * <ul>
 *   <li>{@link dev.mars.tokenstore.storage.TokenStore} - The store interface</li>
 *   <li>{@link dev.mars.tokenstore.storage.FileTokenStore} - Single-file JSON implementation</li>
 *   <li>{@link dev.mars.tokenstore.storage.MergePlan} - Merge planner</li>
 *   <li>{@link dev.mars.tokenstore.storage.AtomicFileWriter} - Atomic file replacement</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Serialized mutation:</b> writes and merges run one at a time, in submission order</li>
 *   <li><b>Crash safety:</b> the file is replaced by rename, never rewritten in place</li>
 *   <li><b>Stale-but-available:</b> a broken file never fails a read while a cached copy exists</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  └─ accounts.json   // {"salt": "...", "tokens": [...]}
 * </pre>
 *
 * @see dev.mars.tokenstore.storage.TokenStore
 */
package dev.mars.tokenstore.storage;
