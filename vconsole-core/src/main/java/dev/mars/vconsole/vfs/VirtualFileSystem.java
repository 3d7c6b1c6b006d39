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

package dev.mars.vconsole.vfs;

import dev.mars.vconsole.config.VConsoleConfiguration;
import dev.mars.vconsole.core.OperationQueue;
import dev.mars.vconsole.core.event.ObserverRegistry;
import dev.mars.vconsole.core.event.Subscription;
import dev.mars.vconsole.core.exceptions.VfsErrorCode;
import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.storage.StorageProvider;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Hierarchical virtual filesystem over one or more {@link StorageProvider}s.
 *
 * <p>The filesystem owns path resolution, the mount table, the path-to-inode
 * cache and the inode cache; providers own the bytes and metadata. A path is
 * resolved by normalizing it, selecting the mount with the longest matching
 * prefix and walking the provider's directory entries from the mount root,
 * consulting the caches first.</p>
 *
 * <h2>Concurrency</h2>
 * <p>All operations return Vert.x futures. Mutations are serialized through a
 * single {@link OperationQueue}, so two sessions sharing one filesystem never
 * interleave changes. Cache entries are updated together with the provider
 * call that makes them valid and evicted on deletion.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * VirtualFileSystem vfs = new VirtualFileSystem(new MemoryStorageProvider(), configuration);
 * vfs.initialize()
 *     .compose(v -> vfs.createDir("/data/logs", true))
 *     .compose(v -> vfs.writeFile("/data/logs/app.log", "started\n".getBytes()))
 *     .compose(v -> vfs.readDir("/data/logs"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class VirtualFileSystem {

    private static final Logger logger = LoggerFactory.getLogger(VirtualFileSystem.class);

    public static final int DEFAULT_FILE_MODE = 0644;
    public static final int DEFAULT_DIRECTORY_MODE = 0755;
    static final int MAX_SYMLINK_DEPTH = 8;

    private static final List<String> STANDARD_DIRECTORIES = List.of(
            "/home", "/home/user", "/usr", "/usr/bin", "/etc", "/tmp", "/var");
    private static final String README_PATH = "/home/user/README.txt";
    private static final String README_CONTENT = """
            Welcome to VConsole!

            This is an embeddable terminal backed by a virtual file system.
            Type 'help' to see available commands.

            Features:
            - POSIX-like file operations
            - Pipes, redirections and variable expansion
            - Pluggable storage backends
            """;

    private final StorageProvider rootProvider;
    private final long maxFileSize;
    private final boolean standardLayout;

    private final Map<String, MountPoint> mounts = new ConcurrentHashMap<>();
    private final Map<String, Long> pathCache = new ConcurrentHashMap<>();
    private final Map<InodeKey, INode> inodeCache = new ConcurrentHashMap<>();
    private final ObserverRegistry<VfsEventType, VfsEvent> events = new ObserverRegistry<>(VfsEventType.class);
    private final OperationQueue mutations = new OperationQueue("vfs");

    // Statistics
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);

    private volatile boolean initialized = false;

    private record InodeKey(String mountPath, long inode) {
    }

    /**
     * A resolved filesystem object.
     */
    private record Node(String path, MountPoint mount, INode inode) {
    }

    /**
     * The mount serving a path and the path relative to that mount's root.
     */
    public record MountResolution(MountPoint mount, String relativePath) {
    }

    public VirtualFileSystem(StorageProvider rootProvider) {
        this(rootProvider, VConsoleConfiguration.defaults());
    }

    public VirtualFileSystem(StorageProvider rootProvider, VConsoleConfiguration configuration) {
        this.rootProvider = rootProvider;
        this.maxFileSize = configuration.getMaxFileSize();
        this.standardLayout = configuration.isStandardLayoutEnabled();
    }

    // ==================== Lifecycle ====================

    /**
     * Opens the root provider, mounts it at {@code /} and creates the standard
     * directory layout when enabled. Calling it again has no effect.
     */
    public Future<Void> initialize() {
        if (initialized) {
            return Future.succeededFuture();
        }
        return rootProvider.open()
                .compose(v -> {
                    mounts.put(VfsPaths.ROOT, new MountPoint(VfsPaths.ROOT, rootProvider, rootProvider.isReadOnly()));
                    initialized = true;
                    logger.info("Virtual filesystem initialized with root provider '{}'", rootProvider.name());
                    return standardLayout && !rootProvider.isReadOnly()
                            ? ensureStandardLayout()
                            : Future.succeededFuture();
                });
    }

    /**
     * Closes every mounted provider.
     */
    public Future<Void> shutdown() {
        List<MountPoint> all = getMounts();
        Collections.reverse(all);
        Future<Void> chain = Future.succeededFuture();
        for (MountPoint mount : all) {
            chain = chain.compose(v -> mount.provider().close());
        }
        return chain.onComplete(ar -> {
            mounts.clear();
            clearCache();
            events.clear();
            initialized = false;
            logger.info("Virtual filesystem shut down");
        });
    }

    public boolean isInitialized() {
        return initialized;
    }

    private Future<Void> ensureStandardLayout() {
        Future<Void> chain = Future.succeededFuture();
        for (String dir : STANDARD_DIRECTORIES) {
            chain = chain.compose(v -> exists(dir))
                    .compose(present -> present ? Future.<Void>succeededFuture() : createDir(dir, true));
        }
        return chain
                .compose(v -> exists(README_PATH))
                .compose(present -> present
                        ? Future.<Void>succeededFuture()
                        : writeFile(README_PATH, README_CONTENT.getBytes(StandardCharsets.UTF_8)));
    }

    // ==================== Path Operations ====================

    public String resolve(String path) {
        return VfsPaths.resolve(path);
    }

    public String join(String... parts) {
        return VfsPaths.join(parts);
    }

    public String dirname(String path) {
        return VfsPaths.dirname(path);
    }

    public String basename(String path) {
        return VfsPaths.basename(path);
    }

    public String basename(String path, String extension) {
        return VfsPaths.basename(path, extension);
    }

    public String extname(String path) {
        return VfsPaths.extname(path);
    }

    // ==================== File Operations ====================

    public Future<byte[]> readFile(String path) {
        return normalize(path)
                .compose(p -> resolveNode(p, true))
                .compose(node -> {
                    if (node.inode().isDirectory()) {
                        return Future.failedFuture(VfsException.isDirectory(node.path()));
                    }
                    return node.mount().provider().readFile(node.inode().inode());
                });
    }

    public Future<String> readTextFile(String path) {
        return readFile(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Creates the file if it is absent and replaces its content otherwise.
     * Emits {@link VfsEventType#FILE_CREATED} or {@link VfsEventType#FILE_CHANGED}.
     */
    public Future<Void> writeFile(String path, byte[] data) {
        return mutate(path, p -> doWriteFile(p, data, 0));
    }

    public Future<Void> writeTextFile(String path, String content) {
        return writeFile(path, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends to a file, creating it when absent.
     */
    public Future<Void> appendFile(String path, byte[] data) {
        return mutate(path, p -> lookup(p, 0).compose(existing -> {
            if (existing.isEmpty()) {
                return doWriteFile(p, data, 0);
            }
            return resolveNode(p, true)
                    .compose(node -> {
                        if (node.inode().isDirectory()) {
                            return Future.failedFuture(VfsException.isDirectory(p));
                        }
                        return node.mount().provider().readFile(node.inode().inode());
                    })
                    .compose(current -> {
                        byte[] combined = new byte[current.length + data.length];
                        System.arraycopy(current, 0, combined, 0, current.length);
                        System.arraycopy(data, 0, combined, current.length, data.length);
                        return doWriteFile(p, combined, 0);
                    });
        }));
    }

    /**
     * Removes a file or symbolic link. Fails with IS_DIRECTORY for directories.
     */
    public Future<Void> deleteFile(String path) {
        return mutate(path, p -> requireNode(p).compose(node -> {
            if (node.inode().isDirectory()) {
                return Future.failedFuture(VfsException.isDirectory(p));
            }
            return removeEntry(node, VfsEventType.FILE_DELETED);
        }));
    }

    /**
     * Returns whether the path names an object. Symbolic links are not followed.
     */
    public Future<Boolean> exists(String path) {
        return normalize(path)
                .compose(p -> lookup(p, 0))
                .map(Optional::isPresent)
                .otherwise(err -> {
                    logger.debug("exists({}) resolved to false: {}", path, err.getMessage());
                    return false;
                });
    }

    /**
     * Returns the metadata of the object, following symbolic links.
     */
    public Future<INode> stat(String path) {
        return normalize(path).compose(p -> resolveNode(p, true)).map(Node::inode);
    }

    /**
     * Returns the metadata of the object without following a final symbolic link.
     */
    public Future<INode> lstat(String path) {
        return normalize(path).compose(this::requireNode).map(Node::inode);
    }

    /**
     * Moves a file or directory. When the destination is an existing directory
     * the source is moved into it; an existing destination file is replaced.
     * Both paths must be served by the same mount.
     */
    public Future<Void> rename(String from, String to) {
        return normalize(from).compose(source -> normalize(to).compose(target ->
                mutations.submit(() -> doRename(source, target))));
    }

    // ==================== Directory Operations ====================

    public Future<List<DirEntry>> readDir(String path) {
        return normalize(path)
                .compose(p -> resolveNode(p, true))
                .compose(node -> {
                    if (!node.inode().isDirectory()) {
                        return Future.failedFuture(VfsException.notAFile(node.path()));
                    }
                    return node.mount().provider().readDir(node.inode().inode());
                });
    }

    public Future<Void> createDir(String path) {
        return createDir(path, false, DEFAULT_DIRECTORY_MODE);
    }

    public Future<Void> createDir(String path, boolean recursive) {
        return createDir(path, recursive, DEFAULT_DIRECTORY_MODE);
    }

    /**
     * Creates a directory. Fails with FILE_EXISTS if the path already names an
     * object. With {@code recursive}, missing ancestors are created first with
     * mode {@code 0755}; existing ancestors are left untouched.
     */
    public Future<Void> createDir(String path, boolean recursive, int mode) {
        return mutate(path, p -> doCreateDir(p, recursive, mode));
    }

    /**
     * Deletes a directory. A non-empty directory is only removed with
     * {@code recursive}, children first.
     */
    public Future<Void> deleteDir(String path, boolean recursive) {
        return mutate(path, p -> doDeleteDir(p, recursive));
    }

    // ==================== Links ====================

    /**
     * Creates a symbolic link at {@code linkPath} pointing to {@code target}.
     * The target is stored as the link's content and need not exist.
     */
    public Future<Void> symlink(String target, String linkPath) {
        return mutate(linkPath, p -> lookup(p, 0).compose(existing -> {
            if (existing.isPresent()) {
                return Future.failedFuture(VfsException.fileExists(p));
            }
            return parentDirectory(p).compose(parent -> {
                StorageProvider provider = parent.mount().provider();
                String childPath = VfsPaths.join(parent.path(), VfsPaths.basename(p));
                byte[] content = target.getBytes(StandardCharsets.UTF_8);
                return provider.createInode(FileType.SYMLINK, 0777)
                        .compose(inode -> provider.writeFile(inode.inode(), content)
                                .compose(v -> provider.updateInode(inode.inode(),
                                        InodeUpdate.empty().withSymlinkTarget(target)))
                                .compose(updated -> linkChild(parent, childPath, updated, VfsEventType.FILE_CREATED)));
            });
        }));
    }

    public Future<String> readlink(String path) {
        return normalize(path).compose(this::requireNode).compose(node -> {
            if (!node.inode().isSymlink()) {
                return Future.failedFuture(new VfsException(VfsErrorCode.INVALID_PATH,
                        "Not a symbolic link", node.path()));
            }
            return node.mount().provider().readFile(node.inode().inode())
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
        });
    }

    // ==================== Permission Operations ====================

    public Future<Void> chmod(String path, int mode) {
        return mutate(path, p -> updateNode(p, InodeUpdate.ofMode(mode)));
    }

    public Future<Void> chown(String path, String owner, String group) {
        return mutate(path, p -> updateNode(p, InodeUpdate.ofOwner(owner, group)));
    }

    /**
     * Sets the access and modification times of an existing object to now, or
     * creates an empty file.
     */
    public Future<Void> touch(String path) {
        return mutate(path, p -> lookup(p, 0).compose(existing -> {
            if (existing.isEmpty()) {
                return doWriteFile(p, new byte[0], 0);
            }
            Instant now = Instant.now();
            return updateNode(p, InodeUpdate.empty().withModifiedAt(now).withAccessedAt(now));
        }));
    }

    // ==================== Mount Operations ====================

    /**
     * Attaches a provider at {@code path}, creating the mount directory in the
     * parent filesystem when it is missing.
     */
    public Future<Void> mount(String path, StorageProvider provider, boolean readOnly) {
        return normalize(path).compose(p -> mutations.submit(() -> {
            if (mounts.containsKey(p)) {
                return Future.failedFuture(new VfsException(VfsErrorCode.FILE_EXISTS,
                        "Mount point already exists", p));
            }
            return lookup(p, 0)
                    .compose(existing -> existing.isPresent()
                            ? Future.<Void>succeededFuture()
                            : doCreateDir(p, true, DEFAULT_DIRECTORY_MODE))
                    .compose(v -> provider.open())
                    .map(v -> {
                        MountPoint mount = new MountPoint(p, provider, readOnly || provider.isReadOnly());
                        mounts.put(p, mount);
                        evictTree(p);
                        logger.info("Mounted {} at {}", provider.name(), p);
                        events.publish(VfsEventType.MOUNT_ADDED, new VfsEvent(VfsEventType.MOUNT_ADDED, p, -1));
                        return null;
                    });
        }));
    }

    public Future<Void> unmount(String path) {
        return normalize(path).compose(p -> mutations.submit(() -> {
            if (VfsPaths.ROOT.equals(p)) {
                return Future.failedFuture(new VfsException(VfsErrorCode.ACCESS_DENIED,
                        "The root mount cannot be removed", p));
            }
            MountPoint mount = mounts.remove(p);
            if (mount == null) {
                return Future.failedFuture(new VfsException(VfsErrorCode.NOT_FOUND, "Mount point not found", p));
            }
            evictTree(p);
            logger.info("Unmounted {} from {}", mount.provider().name(), p);
            events.publish(VfsEventType.MOUNT_REMOVED, new VfsEvent(VfsEventType.MOUNT_REMOVED, p, -1));
            return mount.provider().close();
        }));
    }

    /**
     * Returns the mount points ordered by path.
     */
    public List<MountPoint> getMounts() {
        List<MountPoint> result = new ArrayList<>(mounts.values());
        result.sort(Comparator.comparing(MountPoint::path));
        return result;
    }

    /**
     * Selects the mount with the longest path prefix of {@code path}.
     *
     * @throws IllegalArgumentException if the path is relative
     * @throws IllegalStateException if the filesystem is not initialized
     */
    public MountResolution resolveMount(String path) {
        String resolved = VfsPaths.resolve(path);
        MountPoint mount = findMount(resolved);
        return new MountResolution(mount, mount.relativePath(resolved));
    }

    // ==================== Glob ====================

    /**
     * Finds paths matching a {@code *}/{@code ?} pattern.
     *
     * <p>A pattern without {@code /} is matched against entry names in
     * {@code cwd} and every directory below it. A pattern with {@code /} is
     * matched against whole paths (relative patterns are taken from
     * {@code cwd}), and wildcards do not cross a separator. Entries starting
     * with a dot only match patterns whose last segment starts with a dot.</p>
     *
     * @return matching absolute paths in lexical order
     */
    public Future<List<String>> glob(String pattern, String cwd) {
        String start;
        GlobMatcher matcher;
        boolean includeHidden;
        try {
            String absolute = pattern.indexOf('/') >= 0 ? VfsPaths.resolve(cwd, pattern) : pattern;
            matcher = GlobMatcher.compile(absolute);
            start = matcher.isPathPattern() ? literalPrefix(absolute) : VfsPaths.resolve(cwd);
            String lastSegment = absolute.substring(absolute.lastIndexOf('/') + 1);
            includeHidden = lastSegment.startsWith(".");
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(VfsException.invalidPath(cwd));
        }
        List<String> results = Collections.synchronizedList(new ArrayList<>());
        return searchDir(start, matcher, includeHidden, results).map(v -> {
            List<String> sorted = new ArrayList<>(results);
            Collections.sort(sorted);
            return sorted;
        });
    }

    private Future<Void> searchDir(String dir, GlobMatcher matcher, boolean includeHidden, List<String> results) {
        return readDir(dir)
                .compose(entries -> {
                    Future<Void> chain = Future.succeededFuture();
                    for (DirEntry entry : entries) {
                        if (entry.name().startsWith(".") && !includeHidden) {
                            continue;
                        }
                        String fullPath = VfsPaths.join(dir, entry.name());
                        if (matcher.matches(fullPath, entry.name())) {
                            results.add(fullPath);
                        }
                        boolean descend = entry.isDirectory()
                                && (!matcher.isPathPattern() || VfsPaths.segments(fullPath).size() < matcher.depth());
                        if (descend) {
                            chain = chain.compose(v -> searchDir(fullPath, matcher, includeHidden, results));
                        }
                    }
                    return chain;
                })
                .recover(err -> {
                    logger.debug("glob skipped unreadable directory {}: {}", dir, err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private static String literalPrefix(String absolutePattern) {
        StringBuilder prefix = new StringBuilder();
        String[] segments = absolutePattern.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (segments[i].isEmpty()) {
                continue;
            }
            if (GlobMatcher.hasWildcard(segments[i])) {
                break;
            }
            prefix.append('/').append(segments[i].replaceAll("\\\\(.)", "$1"));
        }
        return prefix.length() == 0 ? VfsPaths.ROOT : prefix.toString();
    }

    // ==================== Watch ====================

    /**
     * Subscribes to the structural events (file created, changed or deleted,
     * directory created or deleted) at or beneath {@code path}.
     */
    public Subscription watch(String path, Handler<VfsEvent> handler) {
        String watched = VfsPaths.resolve(path);
        return events.subscribeAll(event -> {
            if (event.type().isStructural() && event.concerns(watched)) {
                handler.handle(event);
            }
        });
    }

    public Subscription subscribe(VfsEventType type, Handler<VfsEvent> handler) {
        return events.subscribe(type, handler);
    }

    public Subscription subscribeAll(Handler<VfsEvent> handler) {
        return events.subscribeAll(handler);
    }

    // ==================== Cache ====================

    public CacheStats getCacheStats() {
        return new CacheStats(pathCache.size(), inodeCache.size(), cacheHits.get(), cacheMisses.get());
    }

    public void clearCache() {
        pathCache.clear();
        inodeCache.clear();
    }

    // ==================== Mutation Internals ====================

    private Future<Void> mutate(String path, Function<String, Future<Void>> operation) {
        return normalize(path).compose(p -> mutations.submit(() -> {
            MountPoint mount = findMount(p);
            if (mount.readOnly()) {
                return Future.failedFuture(VfsException.accessDenied(p));
            }
            return operation.apply(p);
        }));
    }

    private Future<Void> doWriteFile(String path, byte[] data, int depth) {
        if (data.length > maxFileSize) {
            return Future.failedFuture(VfsException.noSpace(path));
        }
        return lookup(path, 0).compose(existing -> {
            if (existing.isPresent()) {
                Node node = existing.get();
                if (node.inode().isSymlink()) {
                    if (depth >= MAX_SYMLINK_DEPTH) {
                        return Future.failedFuture(VfsException.tooManyLinks(path));
                    }
                    return doWriteFile(symlinkTarget(node), data, depth + 1);
                }
                if (node.inode().isDirectory()) {
                    return Future.failedFuture(VfsException.isDirectory(path));
                }
                if (node.mount().readOnly()) {
                    return Future.failedFuture(VfsException.accessDenied(path));
                }
                StorageProvider provider = node.mount().provider();
                long inode = node.inode().inode();
                return provider.writeFile(inode, data)
                        .compose(v -> provider.getInode(inode))
                        .map(updated -> {
                            cacheNode(node.path(), node.mount(), updated);
                            publish(VfsEventType.FILE_CHANGED, node.path(), inode);
                            return null;
                        });
            }
            return parentDirectory(path).compose(parent -> {
                if (parent.mount().readOnly()) {
                    return Future.failedFuture(VfsException.accessDenied(path));
                }
                StorageProvider provider = parent.mount().provider();
                String childPath = VfsPaths.join(parent.path(), VfsPaths.basename(path));
                return provider.createInode(FileType.FILE, DEFAULT_FILE_MODE)
                        .compose(inode -> provider.writeFile(inode.inode(), data)
                                .compose(v -> provider.getInode(inode.inode())))
                        .compose(inode -> linkChild(parent, childPath, inode, VfsEventType.FILE_CREATED));
            });
        });
    }

    private Future<Void> doCreateDir(String path, boolean recursive, int mode) {
        if (VfsPaths.ROOT.equals(path)) {
            return Future.failedFuture(VfsException.fileExists(path));
        }
        return lookup(path, 0).compose(existing -> {
            if (existing.isPresent()) {
                return Future.failedFuture(VfsException.fileExists(path));
            }
            Future<Void> ancestors = Future.succeededFuture();
            if (recursive) {
                ancestors = ensureDirectory(VfsPaths.dirname(path));
            }
            return ancestors
                    .compose(v -> parentDirectory(path))
                    .compose(parent -> createDirectoryIn(parent, VfsPaths.basename(path), mode));
        });
    }

    private Future<Void> ensureDirectory(String path) {
        if (VfsPaths.ROOT.equals(path)) {
            return Future.succeededFuture();
        }
        return lookup(path, 0).compose(existing -> {
            if (existing.isPresent()) {
                return resolveNode(path, true).compose(node -> node.inode().isDirectory()
                        ? Future.<Void>succeededFuture()
                        : Future.failedFuture(VfsException.notAFile(path)));
            }
            return ensureDirectory(VfsPaths.dirname(path))
                    .compose(v -> parentDirectory(path))
                    .compose(parent -> createDirectoryIn(parent, VfsPaths.basename(path), DEFAULT_DIRECTORY_MODE));
        });
    }

    private Future<Void> createDirectoryIn(Node parent, String name, int mode) {
        if (parent.mount().readOnly()) {
            return Future.failedFuture(VfsException.accessDenied(parent.path()));
        }
        String childPath = VfsPaths.join(parent.path(), name);
        return parent.mount().provider().createInode(FileType.DIRECTORY, mode)
                .compose(inode -> linkChild(parent, childPath, inode, VfsEventType.DIRECTORY_CREATED));
    }

    private Future<Void> doDeleteDir(String path, boolean recursive) {
        if (VfsPaths.ROOT.equals(path) || mounts.containsKey(path)) {
            return Future.failedFuture(new VfsException(VfsErrorCode.ACCESS_DENIED,
                    "Cannot remove a mount point", path));
        }
        return requireNode(path).compose(node -> {
            if (!node.inode().isDirectory()) {
                return Future.failedFuture(VfsException.notAFile(path));
            }
            StorageProvider provider = node.mount().provider();
            return provider.readDir(node.inode().inode()).compose(children -> {
                if (children.isEmpty()) {
                    return removeEntry(node, VfsEventType.DIRECTORY_DELETED);
                }
                if (!recursive) {
                    return Future.failedFuture(VfsException.notEmpty(path));
                }
                Future<Void> chain = Future.succeededFuture();
                for (DirEntry child : children) {
                    String childPath = VfsPaths.join(path, child.name());
                    chain = chain.compose(v -> child.isDirectory()
                            ? doDeleteDir(childPath, true)
                            : requireNode(childPath).compose(c -> removeEntry(c, VfsEventType.FILE_DELETED)));
                }
                return chain
                        .compose(v -> requireNode(path))
                        .compose(refreshed -> removeEntry(refreshed, VfsEventType.DIRECTORY_DELETED));
            });
        });
    }

    private Future<Void> doRename(String source, String target) {
        if (VfsPaths.ROOT.equals(source) || mounts.containsKey(source)) {
            return Future.failedFuture(VfsException.accessDenied(source));
        }
        if (VfsPaths.isWithin(source, target) && !source.equals(target)) {
            return Future.failedFuture(new VfsException(VfsErrorCode.INVALID_PATH,
                    "Cannot move a directory into itself", target));
        }
        return requireNode(source).compose(from -> lookup(target, 0).compose(existing -> {
            String destination = target;
            if (existing.isPresent() && existing.get().inode().isDirectory()) {
                destination = VfsPaths.join(target, VfsPaths.basename(source));
            }
            String finalDestination = destination;
            return lookup(finalDestination, 0).compose(occupied -> {
                if (finalDestination.equals(source)) {
                    return Future.succeededFuture();
                }
                Future<Void> cleared = Future.succeededFuture();
                if (occupied.isPresent()) {
                    Node victim = occupied.get();
                    if (victim.inode().isDirectory() || from.inode().isDirectory()) {
                        return Future.failedFuture(VfsException.fileExists(finalDestination));
                    }
                    cleared = removeEntry(victim, VfsEventType.FILE_DELETED);
                }
                return cleared
                        .compose(v -> parentDirectory(finalDestination))
                        .compose(parent -> moveEntry(from, parent, finalDestination));
            });
        }));
    }

    private Future<Void> moveEntry(Node from, Node newParent, String destination) {
        if (!newParent.mount().path().equals(from.mount().path())) {
            return Future.failedFuture(new VfsException(VfsErrorCode.INVALID_PATH,
                    "Cannot move across mount points", destination));
        }
        if (from.mount().readOnly()) {
            return Future.failedFuture(VfsException.accessDenied(from.path()));
        }
        StorageProvider provider = from.mount().provider();
        long inode = from.inode().inode();
        String newPath = VfsPaths.join(newParent.path(), VfsPaths.basename(destination));
        return parentDirectory(from.path())
                .compose(oldParent -> provider.link(newParent.inode().inode(), VfsPaths.basename(newPath), inode)
                        .compose(v -> provider.unlink(oldParent.inode().inode(), VfsPaths.basename(from.path())))
                        .map(v -> {
                            evictTree(from.path());
                            evictInode(oldParent);
                            evictInode(newParent);
                            inodeCache.remove(new InodeKey(from.mount().path(), inode));
                            boolean directory = from.inode().isDirectory();
                            publish(directory ? VfsEventType.DIRECTORY_DELETED : VfsEventType.FILE_DELETED,
                                    from.path(), inode);
                            publish(directory ? VfsEventType.DIRECTORY_CREATED : VfsEventType.FILE_CREATED,
                                    newPath, inode);
                            return null;
                        }));
    }

    private Future<Void> updateNode(String path, InodeUpdate update) {
        return resolveNode(path, true).compose(node -> node.mount().provider()
                .updateInode(node.inode().inode(), update)
                .map(updated -> {
                    cacheNode(node.path(), node.mount(), updated);
                    return null;
                }));
    }

    private Future<Void> linkChild(Node parent, String childPath, INode child, VfsEventType event) {
        return parent.mount().provider().link(parent.inode().inode(), VfsPaths.basename(childPath), child.inode())
                .map(v -> {
                    evictInode(parent);
                    pathCache.put(childPath, child.inode());
                    publish(event, childPath, child.inode());
                    return null;
                });
    }

    private Future<Void> removeEntry(Node node, VfsEventType event) {
        StorageProvider provider = node.mount().provider();
        return parentDirectory(node.path())
                .compose(parent -> provider.unlink(parent.inode().inode(), VfsPaths.basename(node.path()))
                        .compose(v -> provider.deleteInode(node.inode().inode()))
                        .map(v -> {
                            evictTree(node.path());
                            inodeCache.remove(new InodeKey(node.mount().path(), node.inode().inode()));
                            evictInode(parent);
                            publish(event, node.path(), node.inode().inode());
                            return null;
                        }));
    }

    // ==================== Resolution Internals ====================

    private Future<String> normalize(String path) {
        if (!initialized) {
            return Future.failedFuture(new IllegalStateException("Virtual filesystem is not initialized"));
        }
        try {
            return Future.succeededFuture(VfsPaths.resolve(path));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(VfsException.invalidPath(path));
        }
    }

    private MountPoint findMount(String path) {
        MountPoint best = null;
        for (MountPoint mount : mounts.values()) {
            if (mount.covers(path) && (best == null || mount.path().length() > best.path().length())) {
                best = mount;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No mount point found for path: " + path);
        }
        return best;
    }

    private Future<Node> requireNode(String path) {
        return lookup(path, 0).compose(found -> found
                .map(Future::succeededFuture)
                .orElseGet(() -> Future.failedFuture(VfsException.notFound(path))));
    }

    private Future<Node> resolveNode(String path, boolean followFinal) {
        return resolveNode(path, followFinal, 0);
    }

    private Future<Node> resolveNode(String path, boolean followFinal, int depth) {
        return lookup(path, depth).compose(found -> {
            if (found.isEmpty()) {
                return Future.failedFuture(VfsException.notFound(path));
            }
            Node node = found.get();
            if (followFinal && node.inode().isSymlink()) {
                if (depth >= MAX_SYMLINK_DEPTH) {
                    return Future.failedFuture(VfsException.tooManyLinks(path));
                }
                return resolveNode(symlinkTarget(node), true, depth + 1);
            }
            return Future.succeededFuture(node);
        });
    }

    private Future<Node> parentDirectory(String path) {
        String parentPath = VfsPaths.dirname(path);
        return resolveNode(parentPath, true).compose(parent -> parent.inode().isDirectory()
                ? Future.succeededFuture(parent)
                : Future.failedFuture(VfsException.notAFile(parentPath)));
    }

    private Future<Optional<Node>> lookup(String path, int depth) {
        MountPoint mount = findMount(path);
        Long cached = pathCache.get(path);
        if (cached != null) {
            INode inode = inodeCache.get(new InodeKey(mount.path(), cached));
            if (inode != null) {
                cacheHits.incrementAndGet();
                return Future.succeededFuture(Optional.of(new Node(path, mount, inode)));
            }
        }
        cacheMisses.incrementAndGet();
        List<String> segments = VfsPaths.segments(mount.relativePath(path));
        return walk(mount, mount.path(), mount.provider().getRootInode(), segments, 0, depth);
    }

    private Future<Optional<Node>> walk(MountPoint mount, String currentPath, long current,
                                        List<String> segments, int index, int depth) {
        return loadInode(mount, current).compose(inode -> {
            pathCache.put(currentPath, current);
            if (index == segments.size()) {
                return Future.succeededFuture(Optional.of(new Node(currentPath, mount, inode)));
            }
            if (inode.isSymlink()) {
                if (depth >= MAX_SYMLINK_DEPTH) {
                    return Future.failedFuture(VfsException.tooManyLinks(currentPath));
                }
                String rest = String.join("/", segments.subList(index, segments.size()));
                String redirected = VfsPaths.join(symlinkTarget(new Node(currentPath, mount, inode)), rest);
                return lookup(redirected, depth + 1);
            }
            if (!inode.isDirectory()) {
                return Future.failedFuture(VfsException.notAFile(currentPath));
            }
            String name = segments.get(index);
            String childPath = VfsPaths.join(currentPath, name);
            return mount.provider().lookup(current, name).compose(child -> child.isEmpty()
                    ? Future.succeededFuture(Optional.<Node>empty())
                    : walk(mount, childPath, child.get(), segments, index + 1, depth));
        });
    }

    private Future<INode> loadInode(MountPoint mount, long inode) {
        INode cached = inodeCache.get(new InodeKey(mount.path(), inode));
        if (cached != null) {
            return Future.succeededFuture(cached);
        }
        return mount.provider().getInode(inode).map(loaded -> {
            inodeCache.put(new InodeKey(mount.path(), inode), loaded);
            return loaded;
        });
    }

    private static String symlinkTarget(Node link) {
        String target = link.inode().symlinkTarget();
        return VfsPaths.resolve(VfsPaths.dirname(link.path()), target == null ? "" : target);
    }

    private void cacheNode(String path, MountPoint mount, INode inode) {
        pathCache.put(path, inode.inode());
        inodeCache.put(new InodeKey(mount.path(), inode.inode()), inode);
    }

    private void evictInode(Node node) {
        inodeCache.remove(new InodeKey(node.mount().path(), node.inode().inode()));
    }

    private void evictTree(String path) {
        String prefix = VfsPaths.ROOT.equals(path) ? VfsPaths.ROOT : path + "/";
        pathCache.keySet().removeIf(p -> p.equals(path) || p.startsWith(prefix));
    }

    private void publish(VfsEventType type, String path, long inode) {
        logger.debug("{} {}", type, path);
        events.publish(type, new VfsEvent(type, path, inode));
    }

    @Override
    public String toString() {
        return "VirtualFileSystem{" + "mounts=" + getMounts() + ", cache=" + getCacheStats() + '}';
    }
}
