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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageProviderFactoryTest {

    @ParameterizedTest
    @ValueSource(strings = {"memory", "MEMORY", "in-memory", "inmemory", " memory "})
    void testMemoryAliases(String name) {
        assertThat(StorageBackend.parse(name)).isEqualTo(StorageBackend.MEMORY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"snapshot", "json", "File"})
    void testSnapshotAliases(String name) {
        assertThat(StorageBackend.parse(name)).isEqualTo(StorageBackend.SNAPSHOT);
    }

    @Test
    void testBlankDefaultsToMemory() {
        assertThat(StorageBackend.parse(null)).isEqualTo(StorageBackend.MEMORY);
        assertThat(StorageBackend.parse("  ")).isEqualTo(StorageBackend.MEMORY);
    }

    @Test
    void testUnknownBackendIsRejected() {
        assertThatThrownBy(() -> StorageBackend.parse("redis"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown storage backend");
    }

    @Test
    void testCreateFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(VConsoleConfiguration.STORAGE_BACKEND, "snapshot");
        properties.setProperty(VConsoleConfiguration.SNAPSHOT_PATH, "target/fs.json");

        StorageProvider provider = StorageProviderFactory.create(new VConsoleConfiguration(properties));

        assertThat(provider).isInstanceOf(SnapshotStorageProvider.class);
        assertThat(((SnapshotStorageProvider) provider).getSnapshotFile()).isEqualTo(Path.of("target/fs.json"));
    }

    @Test
    void testDefaultConfigurationIsMemory() {
        StorageProvider provider = StorageProviderFactory.create(VConsoleConfiguration.defaults());
        assertThat(provider).isExactlyInstanceOf(MemoryStorageProvider.class);
        assertThat(provider.isReadOnly()).isFalse();
    }

    @Test
    void testReadOnlyFlagIsPassedThrough() {
        StorageProvider provider = StorageProviderFactory.create(StorageBackend.MEMORY, null, true);
        assertThat(provider.isReadOnly()).isTrue();
    }
}
