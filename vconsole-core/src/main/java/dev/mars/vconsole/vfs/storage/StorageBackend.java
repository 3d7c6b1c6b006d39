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

import java.util.Locale;

/**
 * Supported storage backends, selected through configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
public enum StorageBackend {
    /** Volatile in-memory storage (default) */
    MEMORY,
    /** In-memory storage persisted as a JSON snapshot file */
    SNAPSHOT;

    /**
     * Parses a configured backend name.
     *
     * @param type the configured name, null or blank for the default
     * @return the backend
     * @throws IllegalArgumentException if the name is unknown
     */
    public static StorageBackend parse(String type) {
        if (type == null || type.isBlank()) {
            return MEMORY;
        }
        return switch (type.toLowerCase(Locale.ROOT).trim()) {
            case "memory", "inmemory", "in-memory" -> MEMORY;
            case "snapshot", "json", "file" -> SNAPSHOT;
            default -> throw new IllegalArgumentException(
                    "Unknown storage backend: '" + type + "'. Valid options: memory, snapshot");
        };
    }
}
