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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Decoded shape of the store file.
 * <p>
 * The file format carries no version field; the shape is detected
 * structurally when decoding:
 * <ul>
 *   <li>{@link Wrapped} - current format: {@code {"salt": "...", "tokens": [...]}}</li>
 *   <li>{@link Legacy} - bare array of records with no salt</li>
 *   <li>{@link Unrecognized} - any other JSON value</li>
 * </ul>
 * Every consumer works from {@link #records()} and {@link #salt()}, so the
 * legacy shape never leaks past the decode step.
 *
 * @see StoreDocumentCodec
 */
public sealed interface StoreDocument
        permits StoreDocument.Wrapped, StoreDocument.Legacy, StoreDocument.Unrecognized {

    /**
     * @return the record sequence, if this shape carries a readable one
     */
    Optional<List<TokenRecord>> records();

    /**
     * @return the persisted salt, if present and non-blank
     */
    Optional<String> salt();

    /**
     * Current format.
     *
     * @param raw    the whole top-level object as read (kept so a salt can be
     *               injected without dropping unknown fields)
     * @param rawSalt the salt, null when missing or blank
     * @param tokens the records, null when {@code tokens} is missing or is not
     *               an array of objects
     */
    record Wrapped(ObjectNode raw, String rawSalt, List<TokenRecord> tokens) implements StoreDocument {
        public Wrapped {
            tokens = tokens == null ? null : List.copyOf(tokens);
        }

        @Override
        public Optional<List<TokenRecord>> records() {
            return Optional.ofNullable(tokens);
        }

        @Override
        public Optional<String> salt() {
            return Optional.ofNullable(rawSalt);
        }
    }

    /**
     * Legacy format: the records array written directly at top level.
     *
     * @param raw    the array as read
     * @param tokens the records, null if an element is not a JSON object
     */
    record Legacy(ArrayNode raw, List<TokenRecord> tokens) implements StoreDocument {
        public Legacy {
            tokens = tokens == null ? null : List.copyOf(tokens);
        }

        @Override
        public Optional<List<TokenRecord>> records() {
            return Optional.ofNullable(tokens);
        }

        @Override
        public Optional<String> salt() {
            return Optional.empty();
        }
    }

    /**
     * Valid JSON of a shape the store does not understand.
     *
     * @param nodeType the JSON node type found at top level
     */
    record Unrecognized(String nodeType) implements StoreDocument {
        @Override
        public Optional<List<TokenRecord>> records() {
            return Optional.empty();
        }

        @Override
        public Optional<String> salt() {
            return Optional.empty();
        }
    }
}
