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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Makes sure a readable store file exists and owns the store's salt.
 * <p>
 * <b>Bootstrap:</b> creates the data directory and, when the store file is
 * absent, an empty document with a fresh salt.
 * <p>
 * <b>Migration:</b> on the first salt lookup, upgrades older on-disk shapes:
 * <ul>
 *   <li>bare array (legacy) → {@code {"salt": new, "tokens": <array>}}</li>
 *   <li>object without salt → same object with a new salt injected</li>
 * </ul>
 * Migration replaces the file through {@link AtomicFileWriter}, so a reader
 * running at the same time sees either the old shape or the new one.
 * <p>
 * <b>Salt lifetime:</b> once resolved the salt is cached for the life of this
 * instance and never re-read. If the file cannot be read or decoded, a
 * process-local salt is generated instead and NOT persisted.
 */
final class StoreBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(StoreBootstrap.class);

    private final Path storeFile;
    private final StoreDocumentCodec codec;
    private final SaltGenerator saltGenerator;
    private final AtomicFileWriter fileWriter;

    private volatile String salt;

    StoreBootstrap(Path storeFile, StoreDocumentCodec codec, SaltGenerator saltGenerator,
                   AtomicFileWriter fileWriter) {
        this.storeFile = storeFile;
        this.codec = codec;
        this.saltGenerator = saltGenerator;
        this.fileWriter = fileWriter;
    }

    /**
     * Creates the data directory and an empty store file if needed. Idempotent.
     *
     * @throws IOException if the store file is absent and cannot be created
     */
    synchronized void ensureExists() throws IOException {
        Path dir = storeFile.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            // Surfaces again below if the file really cannot be created
            LOG.debug("Could not create data directory {}: {}", dir, e.getMessage());
        }

        if (Files.exists(storeFile)) {
            return;
        }

        String freshSalt = saltGenerator.generateSalt();
        try {
            Files.write(storeFile, codec.encode(freshSalt, List.of()),
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE);
            LOG.info("Created store file with new salt: {}", storeFile);
        } catch (FileAlreadyExistsException e) {
            LOG.debug("Store file appeared concurrently, keeping it: {}", storeFile);
        }
    }

    /**
     * Returns the store's salt, resolving (and if needed migrating) it on first call.
     * Never throws.
     */
    String resolveSalt() {
        String cached = salt;
        if (cached != null) {
            return cached;
        }

        synchronized (this) {
            if (salt != null) {
                return salt;
            }
            try {
                ensureExists();
                StoreDocument document = codec.decode(Files.readAllBytes(storeFile));
                salt = upgrade(document);
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to read salt from {}: {}. Using a temporary salt for this process",
                        storeFile, e.getMessage(), e);
                salt = saltGenerator.generateSalt();
            }
            return salt;
        }
    }

    /**
     * @return true once {@link #resolveSalt()} has produced a value
     */
    boolean saltResolved() {
        return salt != null;
    }

    /**
     * Brings a decoded document to the current format, returning its salt.
     */
    private String upgrade(StoreDocument document) throws IOException {
        if (document instanceof StoreDocument.Legacy legacy) {
            String freshSalt = saltGenerator.generateSalt();
            ObjectNode root = JsonNodeFactory.instance.objectNode();
            root.put(StoreDocumentCodec.SALT_FIELD, freshSalt);
            root.set(StoreDocumentCodec.TOKENS_FIELD, legacy.raw());
            fileWriter.write(storeFile, codec.encode(root));
            LOG.info("Migrated legacy store file to current format: {} ({} records)",
                    storeFile, legacy.raw().size());
            return freshSalt;
        }

        if (document instanceof StoreDocument.Wrapped wrapped) {
            if (wrapped.salt().isPresent()) {
                return wrapped.salt().get();
            }
            String freshSalt = saltGenerator.generateSalt();
            ObjectNode root = wrapped.raw().deepCopy();
            root.put(StoreDocumentCodec.SALT_FIELD, freshSalt);
            if (!root.hasNonNull(StoreDocumentCodec.TOKENS_FIELD)) {
                root.putArray(StoreDocumentCodec.TOKENS_FIELD);
            }
            fileWriter.write(storeFile, codec.encode(root));
            LOG.info("Added salt to store file: {}", storeFile);
            return freshSalt;
        }

        StoreDocument.Unrecognized unrecognized = (StoreDocument.Unrecognized) document;
        throw new IOException("Unrecognized store file format: top-level " + unrecognized.nodeType());
    }
}
