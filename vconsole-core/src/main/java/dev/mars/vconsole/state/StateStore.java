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

package dev.mars.vconsole.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.vconsole.core.JsonSupport;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Key/value store for one namespace of the {@link StateStoreArena}.
 *
 * <p>Values are held as JSON trees, so anything Jackson can bind (strings,
 * lists, maps, records) can be stored and read back with its type. A durable
 * store writes its entries to {@code <namespace>.json} on {@link #persist()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final String namespace;
    private final Path file;
    private final ObjectMapper mapper = JsonSupport.mapper();
    private final ObjectNode entries;

    StateStore(String namespace, Path file) {
        this.namespace = namespace;
        this.file = file;
        this.entries = mapper.createObjectNode();
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isDurable() {
        return file != null;
    }

    /**
     * Returns the arena-wide form of a key, {@code <namespace>:<key>}.
     */
    public String qualify(String key) {
        return namespace + ":" + key;
    }

    public synchronized <T> Optional<T> get(String key, Class<T> type) {
        JsonNode node = entries.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(mapper.convertValue(node, type));
    }

    public synchronized <T> Optional<T> get(String key, TypeReference<T> type) {
        JsonNode node = entries.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(mapper.convertValue(node, type));
    }

    public synchronized void set(String key, Object value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("State key cannot be empty");
        }
        entries.set(key, mapper.valueToTree(value));
    }

    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public synchronized boolean has(String key) {
        return entries.has(key);
    }

    public synchronized Set<String> keys() {
        Set<String> keys = new TreeSet<>();
        entries.fieldNames().forEachRemaining(keys::add);
        return keys;
    }

    public synchronized void clear() {
        entries.removeAll();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Writes the entries to the backing file. A no-op for in-memory stores.
     */
    public Future<Void> persist() {
        if (file == null) {
            return Future.succeededFuture();
        }
        try {
            StateDocument document;
            synchronized (this) {
                document = new StateDocument(namespace, entries.deepCopy());
            }
            Files.createDirectories(file.toAbsolutePath().getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Persisted state namespace {} ({} keys) to {}", namespace, document.entries().size(), file);
            return Future.succeededFuture();
        } catch (IOException e) {
            logger.warn("Failed to persist state namespace {}: {}", namespace, e.getMessage());
            return Future.failedFuture(e);
        }
    }

    /**
     * Replaces the entries with the content of the backing file, when it exists.
     */
    public Future<Void> restore() {
        if (file == null || !Files.exists(file)) {
            return Future.succeededFuture();
        }
        try {
            StateDocument document = mapper.readValue(file.toFile(), StateDocument.class);
            synchronized (this) {
                entries.removeAll();
                if (document.entries() != null) {
                    Iterator<Map.Entry<String, JsonNode>> fields = document.entries().fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        entries.set(field.getKey(), field.getValue());
                    }
                }
            }
            logger.debug("Restored state namespace {} from {}", namespace, file);
            return Future.succeededFuture();
        } catch (IOException e) {
            logger.warn("Failed to restore state namespace {}: {}", namespace, e.getMessage());
            return Future.failedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "StateStore{" + "namespace='" + namespace + '\'' + ", keys=" + keys() + '}';
    }

    /**
     * On-disk form of a store.
     */
    public record StateDocument(String namespace, ObjectNode entries) {
    }
}
