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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Replaces a file's contents atomically.
 * <p>
 * Protocol: write temp sibling → fsync → close → rename onto target → fsync dir.
 * A reader of the target sees either the old content or the new content,
 * never a partial write.
 * <p>
 * The temp file name carries the process id, a timestamp and a random UUID
 * so concurrent writers (even across processes) never share a temp file:
 * <pre>
 * .accounts.json.4711.1760890000000.3f1c...e2.tmp
 * </pre>
 * <p>
 * Some platforms refuse to rename onto a destination that is held open
 * (observed as {@link FileAlreadyExistsException} or
 * {@link AccessDeniedException}). In that case the target is deleted and the
 * rename retried exactly once.
 */
public final class AtomicFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileWriter.class);

    private static final String TMP_SUFFIX = ".tmp";

    /**
     * Moves a fully written temp file onto its target.
     */
    @FunctionalInterface
    interface Mover {
        void move(Path source, Path target) throws IOException;
    }

    private final boolean syncEnabled;
    private final Mover mover;

    public AtomicFileWriter(boolean syncEnabled) {
        this(syncEnabled, AtomicFileWriter::atomicMove);
    }

    AtomicFileWriter(boolean syncEnabled, Mover mover) {
        this.syncEnabled = syncEnabled;
        this.mover = mover;
    }

    /**
     * Durably replaces {@code target} with {@code content}, or leaves it unchanged.
     * <p>
     * Returns only after the rename has completed. On failure the temp file is
     * removed (best effort) and the original exception is rethrown.
     *
     * @param target  the file to replace
     * @param content the new content
     * @throws IOException if the content could not be written or renamed into place
     */
    public void write(Path target, byte[] content) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path tmpPath = dir.resolve(tempName(absolute.getFileName().toString()));

        try {
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(content);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                }
            }

            try {
                mover.move(tmpPath, absolute);
            } catch (FileAlreadyExistsException | AccessDeniedException e) {
                LOG.warn("Rename onto {} refused ({}), removing target and retrying once",
                        absolute, e.getClass().getSimpleName());
                Files.deleteIfExists(absolute);
                mover.move(tmpPath, absolute);
            }
            LOG.trace("Atomic rename: {} -> {}", tmpPath, absolute);

            if (syncEnabled) {
                syncDirectory(dir);
            }
        } catch (IOException | RuntimeException e) {
            deleteTempFile(tmpPath);
            throw e;
        }

        LOG.debug("Wrote {} bytes to {}", content.length, absolute);
    }

    static String tempName(String baseName) {
        return "." + baseName + "." + ProcessHandle.current().pid() + "." + System.currentTimeMillis()
                + "." + UUID.randomUUID() + TMP_SUFFIX;
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTempFile(Path tmpPath) {
        try {
            if (Files.deleteIfExists(tmpPath)) {
                LOG.debug("Removed temp file after failed write: {}", tmpPath);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmpPath, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory so the rename itself is durable.
     * <p>
     * Skipped on Windows, where directories cannot be opened for sync.
     */
    private static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
