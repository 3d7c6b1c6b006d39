/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.vconsole.vfs.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.vconsole.core.JsonSupport;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link StorageProvider} that keeps the inode table in memory and writes it as
 * a JSON snapshot after every mutation.
 *
 * <p>Snapshots are written to a temporary file and atomically renamed over the
 * previous one, so a crash leaves either the old or the new table on disk.
 * {@link #open()} reloads the last snapshot when one exists.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
public final class SnapshotStorageProvider extends MemoryStorageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotStorageProvider.class);

    private final Path snapshotFile;
    private final ObjectMapper mapper = JsonSupport.mapper();

    public SnapshotStorageProvider(Path snapshotFile) {
        this(snapshotFile, false);
    }

    public SnapshotStorageProvider(Path snapshotFile, boolean readOnly) {
        super("snapshot", readOnly);
        this.snapshotFile = snapshotFile;
    }

    @Override
    public Future<Void> open() {
        if (Files.exists(snapshotFile)) {
            try {
                Snapshot snapshot = mapper.readValue(snapshotFile.toFile(), Snapshot.class);
                restore(snapshot);
                LOG.info("Loaded filesystem snapshot: file={}, inodes={}", snapshotFile, snapshot.entries().size());
            } catch (IOException e) {
                LOG.error("Failed to load filesystem snapshot {}", snapshotFile, e);
                return Future.failedFuture(e);
            }
        } else {
            LOG.debug("No snapshot at {}, starting with an empty filesystem", snapshotFile);
        }
        return super.open();
    }

    @Override
    public Future<Void> close() {
        return flush().compose(v -> super.close());
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }

    /**
     * Writes the current inode table to disk.
     */
    public Future<Void> flush() {
        if (isReadOnly()) {
            return Future.succeededFuture();
        }
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot());
            Files.move(tmp, snapshotFile,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            return Future.succeededFuture();
        } catch (IOException e) {
            LOG.warn("Failed to write filesystem snapshot {}: {}", snapshotFile, e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    protected Future<Void> afterMutation() {
        return flush();
    }
}
