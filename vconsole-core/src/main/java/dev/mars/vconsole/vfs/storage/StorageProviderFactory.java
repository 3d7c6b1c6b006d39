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

import dev.mars.vconsole.config.VConsoleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Factory for creating {@link StorageProvider} instances based on configuration.
 *
 * <p>This factory supports the following storage backends:</p>
 * <ul>
 *   <li><b>memory</b> (default) - volatile, lost when the process ends</li>
 *   <li><b>snapshot</b> - in-memory table written to a JSON file after each change</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
public final class StorageProviderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StorageProviderFactory.class);

    private StorageProviderFactory() {
        // Utility class
    }

    /**
     * Creates the root provider described by the configuration.
     *
     * @param configuration the console configuration
     * @return an unopened provider
     * @throws IllegalArgumentException if the configured backend is unknown
     */
    public static StorageProvider create(VConsoleConfiguration configuration) {
        StorageBackend backend = StorageBackend.parse(configuration.getStorageBackend());
        return create(backend, Path.of(configuration.getSnapshotPath()), false);
    }

    /**
     * Creates a provider of the given backend.
     *
     * @param backend the backend
     * @param snapshotFile the snapshot location (ignored for memory)
     * @param readOnly whether mutation is rejected
     * @return an unopened provider
     */
    public static StorageProvider create(StorageBackend backend, Path snapshotFile, boolean readOnly) {
        LOG.info("Creating StorageProvider: backend={}, readOnly={}", backend, readOnly);
        return switch (backend) {
            case MEMORY -> new MemoryStorageProvider("memory", readOnly);
            case SNAPSHOT -> {
                LOG.info("Using SnapshotStorageProvider at {}", snapshotFile);
                yield new SnapshotStorageProvider(snapshotFile, readOnly);
            }
        };
    }

    /**
     * Creates a volatile provider; convenience for tests and scratch mounts.
     */
    public static MemoryStorageProvider createInMemory() {
        return new MemoryStorageProvider();
    }
}
