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

import dev.mars.vconsole.config.VConsoleConfiguration;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Arena of {@link StateStore}s indexed by namespace.
 *
 * <p>Child namespaces are plain keys of the form {@code parent/child}; stores
 * hold no reference to their parent or children. In durable mode every
 * namespace is backed by {@code <directory>/<namespace>.json}, so a child
 * namespace lands in a subdirectory named after its parent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class StateStoreArena {

    private static final Logger logger = LoggerFactory.getLogger(StateStoreArena.class);

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final Map<String, StateStore> stores = new ConcurrentHashMap<>();

    /**
     * Creates an arena whose stores live in memory only.
     */
    public StateStoreArena() {
        this(null);
    }

    /**
     * Creates an arena that persists each namespace under {@code directory}.
     */
    public StateStoreArena(Path directory) {
        this.directory = directory;
    }

    public static StateStoreArena fromConfiguration(VConsoleConfiguration configuration) {
        String stateDirectory = configuration.getStateDirectory();
        if (stateDirectory == null || stateDirectory.isBlank()) {
            return new StateStoreArena();
        }
        logger.info("Session state will be stored under {}", stateDirectory);
        return new StateStoreArena(Paths.get(stateDirectory));
    }

    public boolean isDurable() {
        return directory != null;
    }

    /**
     * Returns the store for {@code namespace}, creating it on first use. A
     * durable store is loaded from disk when it is created.
     *
     * @throws IllegalArgumentException if the namespace is not well formed
     */
    public StateStore store(String namespace) {
        validate(namespace);
        return stores.computeIfAbsent(namespace, ns -> {
            StateStore store = new StateStore(ns, directory == null ? null : directory.resolve(ns + ".json"));
            store.restore().onFailure(err ->
                    logger.warn("Starting namespace {} empty: {}", ns, err.getMessage()));
            return store;
        });
    }

    public StateStore child(String parent, String child) {
        return store(parent + "/" + child);
    }

    public Optional<StateStore> find(String namespace) {
        return Optional.ofNullable(stores.get(namespace));
    }

    public boolean contains(String namespace) {
        return stores.containsKey(namespace);
    }

    /**
     * Returns the direct child namespaces of {@code parent}, sorted.
     */
    public List<String> children(String parent) {
        String prefix = parent + "/";
        List<String> result = new ArrayList<>();
        for (String namespace : stores.keySet()) {
            if (namespace.startsWith(prefix) && namespace.indexOf('/', prefix.length()) < 0) {
                result.add(namespace);
            }
        }
        result.sort(String::compareTo);
        return result;
    }

    public List<String> namespaces() {
        List<String> result = new ArrayList<>(stores.keySet());
        result.sort(String::compareTo);
        return result;
    }

    /**
     * Removes a namespace and all of its children from the arena. Files already
     * written are left in place.
     */
    public void remove(String namespace) {
        String prefix = namespace + "/";
        stores.keySet().removeIf(ns -> ns.equals(namespace) || ns.startsWith(prefix));
    }

    /**
     * Persists every store. Fails with the first error after attempting all.
     */
    public Future<Void> persistAll() {
        List<Future<Void>> writes = new ArrayList<>();
        for (StateStore store : stores.values()) {
            writes.add(store.persist());
        }
        return Future.join(writes).mapEmpty();
    }

    private static void validate(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            throw new IllegalArgumentException("Namespace cannot be empty");
        }
        for (String segment : namespace.split("/", -1)) {
            if (!SEGMENT.matcher(segment).matches() || ".".equals(segment) || "..".equals(segment)) {
                throw new IllegalArgumentException("Invalid namespace: " + namespace);
            }
        }
    }

    @Override
    public String toString() {
        return "StateStoreArena{" + "directory=" + directory + ", namespaces=" + namespaces() + '}';
    }
}
