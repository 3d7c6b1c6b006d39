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

import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.DirEntry;
import dev.mars.vconsole.vfs.FileType;
import dev.mars.vconsole.vfs.INode;
import dev.mars.vconsole.vfs.InodeUpdate;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Volatile {@link StorageProvider} keeping every inode in a map.
 *
 * <p>All futures are completed before the method returns. Subclasses can
 * persist the table by overriding {@link #afterMutation()}, which runs after
 * every successful change.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-19
 */
public class MemoryStorageProvider implements StorageProvider {

    public static final long ROOT_INODE = 1L;

    static final String DEFAULT_OWNER = "user";
    static final String DEFAULT_GROUP = "users";

    private final String name;
    private final boolean readOnly;
    private final Map<Long, Entry> entries = new HashMap<>();
    private long nextInode = ROOT_INODE + 1;
    private boolean opened = false;

    public MemoryStorageProvider() {
        this("memory", false);
    }

    public MemoryStorageProvider(String name, boolean readOnly) {
        this.name = name;
        this.readOnly = readOnly;
        createRoot();
    }

    /**
     * A stored inode with its content and, for directories, its children.
     */
    private static final class Entry {
        INode inode;
        byte[] data;
        final TreeMap<String, Long> children;

        Entry(INode inode, byte[] data, Map<String, Long> children) {
            this.inode = inode;
            this.data = data;
            this.children = new TreeMap<>(children);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public synchronized Future<Void> open() {
        opened = true;
        return Future.succeededFuture();
    }

    @Override
    public synchronized Future<Void> close() {
        opened = false;
        return Future.succeededFuture();
    }

    public synchronized boolean isOpen() {
        return opened;
    }

    @Override
    public long getRootInode() {
        return ROOT_INODE;
    }

    // =========================================================================
    // Inode Operations
    // =========================================================================

    @Override
    public synchronized Future<INode> getInode(long inode) {
        Entry entry = entries.get(inode);
        if (entry == null) {
            return Future.failedFuture(inodeNotFound(inode));
        }
        return Future.succeededFuture(entry.inode);
    }

    @Override
    public Future<INode> createInode(FileType type, int mode) {
        INode created;
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(nextInode)));
            }
            Instant now = Instant.now();
            created = new INode(nextInode++, type, mode, DEFAULT_OWNER, DEFAULT_GROUP, 0L,
                    now, now, now, type == FileType.DIRECTORY ? 2 : 1, null);
            entries.put(created.inode(), new Entry(created, new byte[0], Map.of()));
        }
        return afterMutation().map(created);
    }

    @Override
    public Future<Void> deleteInode(long inode) {
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(inode)));
            }
            Entry entry = entries.get(inode);
            if (entry == null) {
                return Future.failedFuture(inodeNotFound(inode));
            }
            if (inode == ROOT_INODE) {
                return Future.failedFuture(VfsException.accessDenied(describe(inode)));
            }
            if (entry.inode.isDirectory() && !entry.children.isEmpty()) {
                return Future.failedFuture(VfsException.notEmpty(describe(inode)));
            }
            entries.remove(inode);
        }
        return afterMutation();
    }

    @Override
    public Future<INode> updateInode(long inode, InodeUpdate update) {
        INode updated;
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(inode)));
            }
            Entry entry = entries.get(inode);
            if (entry == null) {
                return Future.failedFuture(inodeNotFound(inode));
            }
            entry.inode = entry.inode.apply(update);
            updated = entry.inode;
        }
        return afterMutation().map(updated);
    }

    @Override
    public synchronized Future<Boolean> exists(long inode) {
        return Future.succeededFuture(entries.containsKey(inode));
    }

    // =========================================================================
    // Content Operations
    // =========================================================================

    @Override
    public synchronized Future<byte[]> readFile(long inode) {
        Entry entry = entries.get(inode);
        if (entry == null) {
            return Future.failedFuture(inodeNotFound(inode));
        }
        if (entry.inode.isDirectory()) {
            return Future.failedFuture(VfsException.isDirectory(describe(inode)));
        }
        entry.inode = entry.inode.apply(InodeUpdate.empty().withAccessedAt(Instant.now()));
        return Future.succeededFuture(entry.data.clone());
    }

    @Override
    public Future<Void> writeFile(long inode, byte[] data) {
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(inode)));
            }
            Entry entry = entries.get(inode);
            if (entry == null) {
                return Future.failedFuture(inodeNotFound(inode));
            }
            if (entry.inode.isDirectory()) {
                return Future.failedFuture(VfsException.isDirectory(describe(inode)));
            }
            entry.data = data.clone();
            entry.inode = entry.inode.apply(InodeUpdate.empty()
                    .withSize(data.length)
                    .withModifiedAt(Instant.now()));
        }
        return afterMutation();
    }

    // =========================================================================
    // Directory Operations
    // =========================================================================

    @Override
    public synchronized Future<List<DirEntry>> readDir(long inode) {
        Entry entry;
        try {
            entry = directory(inode);
        } catch (VfsException e) {
            return Future.failedFuture(e);
        }
        List<DirEntry> result = new ArrayList<>(entry.children.size());
        entry.children.forEach((childName, childInode) -> {
            Entry child = entries.get(childInode);
            if (child != null) {
                result.add(new DirEntry(childName, childInode, child.inode.type()));
            }
        });
        return Future.succeededFuture(result);
    }

    @Override
    public synchronized Future<Optional<Long>> lookup(long directory, String childName) {
        try {
            return Future.succeededFuture(Optional.ofNullable(directory(directory).children.get(childName)));
        } catch (VfsException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<Void> link(long directory, String childName, long inode) {
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(directory)));
            }
            try {
                Entry parent = directory(directory);
                if (!entries.containsKey(inode)) {
                    return Future.failedFuture(inodeNotFound(inode));
                }
                if (parent.children.containsKey(childName)) {
                    return Future.failedFuture(VfsException.fileExists(childName));
                }
                parent.children.put(childName, inode);
                parent.inode = parent.inode.apply(InodeUpdate.empty().withModifiedAt(Instant.now()));
            } catch (VfsException e) {
                return Future.failedFuture(e);
            }
        }
        return afterMutation();
    }

    @Override
    public Future<Void> unlink(long directory, String childName) {
        synchronized (this) {
            if (readOnly) {
                return Future.failedFuture(VfsException.accessDenied(describe(directory)));
            }
            try {
                Entry parent = directory(directory);
                if (parent.children.remove(childName) == null) {
                    return Future.failedFuture(VfsException.notFound(childName));
                }
                parent.inode = parent.inode.apply(InodeUpdate.empty().withModifiedAt(Instant.now()));
            } catch (VfsException e) {
                return Future.failedFuture(e);
            }
        }
        return afterMutation();
    }

    @Override
    public synchronized StorageStats getStats() {
        long files = 0;
        long directories = 0;
        long bytes = 0;
        for (Entry entry : entries.values()) {
            if (entry.inode.isDirectory()) {
                directories++;
            } else {
                files++;
                bytes += entry.data.length;
            }
        }
        return new StorageStats(entries.size(), files, directories, bytes);
    }

    // =========================================================================
    // Subclass Hooks
    // =========================================================================

    /**
     * Called after every successful mutation. The returned future decides the
     * outcome reported to the caller.
     */
    protected Future<Void> afterMutation() {
        return Future.succeededFuture();
    }

    /**
     * Returns copies of the stored entries and the next inode number.
     */
    protected synchronized Snapshot snapshot() {
        List<SnapshotEntry> copy = new ArrayList<>(entries.size());
        entries.values().forEach(e -> copy.add(new SnapshotEntry(e.inode, e.data.clone(), new TreeMap<>(e.children))));
        return new Snapshot(nextInode, copy);
    }

    /**
     * Replaces the whole inode table.
     */
    protected synchronized void restore(Snapshot snapshot) {
        entries.clear();
        for (SnapshotEntry entry : snapshot.entries()) {
            byte[] data = entry.data() != null ? entry.data() : new byte[0];
            Map<String, Long> children = entry.children() != null ? entry.children() : Map.of();
            entries.put(entry.inode().inode(), new Entry(entry.inode(), data, children));
        }
        if (!entries.containsKey(ROOT_INODE)) {
            createRoot();
        }
        long highest = entries.keySet().stream().mapToLong(Long::longValue).max().orElse(ROOT_INODE);
        nextInode = Math.max(snapshot.nextInode(), highest + 1);
    }

    /**
     * Serializable form of the inode table.
     */
    public record Snapshot(long nextInode, List<SnapshotEntry> entries) {
    }

    public record SnapshotEntry(INode inode, byte[] data, Map<String, Long> children) {
    }

    // =========================================================================
    // Private Helpers
    // =========================================================================

    private void createRoot() {
        Instant now = Instant.now();
        INode root = new INode(ROOT_INODE, FileType.DIRECTORY, 0755, "root", "root", 0L,
                now, now, now, 2, null);
        entries.put(ROOT_INODE, new Entry(root, new byte[0], Map.of()));
    }

    private Entry directory(long inode) throws VfsException {
        Entry entry = entries.get(inode);
        if (entry == null) {
            throw inodeNotFound(inode);
        }
        if (!entry.inode.isDirectory()) {
            throw VfsException.notAFile(describe(inode));
        }
        return entry;
    }

    private VfsException inodeNotFound(long inode) {
        return VfsException.notFound(describe(inode));
    }

    private String describe(long inode) {
        return name + ":inode/" + inode;
    }

    @Override
    public String toString() {
        return "MemoryStorageProvider{" + "name='" + name + '\'' + ", readOnly=" + readOnly + '}';
    }
}
