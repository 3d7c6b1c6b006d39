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

import dev.mars.vconsole.vfs.DirEntry;
import dev.mars.vconsole.vfs.FileType;
import dev.mars.vconsole.vfs.INode;
import dev.mars.vconsole.vfs.InodeUpdate;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Abstraction for the durable inode and byte storage behind a mount point.
 *
 * <p>The {@link dev.mars.vconsole.vfs.VirtualFileSystem} owns path resolution and
 * caching; a provider owns the inode table, file contents and directory
 * children, and is the source of truth on a cache miss. Directory children are
 * a mapping from name to inode number, so renaming is a pointer move.</p>
 *
 * <h2>Error Handling</h2>
 * <p>Failed futures carry a {@link dev.mars.vconsole.core.exceptions.VfsException}
 * whose code describes the condition (NOT_FOUND for unknown inodes, NOT_EMPTY
 * when deleting a directory that still has children, ACCESS_DENIED when a
 * read-only provider is asked to mutate).</p>
 *
 * <h2>Inode numbering</h2>
 * <p>Inode numbers are assigned monotonically by the provider and are never
 * reused for the lifetime of its storage.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-19
 */
public interface StorageProvider {

    /**
     * Short backend name, used in mount listings.
     */
    String name();

    boolean isReadOnly();

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Opens the storage, loading any persisted state and creating the root directory.
     */
    Future<Void> open();

    Future<Void> close();

    /**
     * Returns the inode number of the provider's root directory.
     */
    long getRootInode();

    // =========================================================================
    // Inode Operations
    // =========================================================================

    Future<INode> getInode(long inode);

    /**
     * Allocates a new inode.
     *
     * @param type the object kind
     * @param mode permission bits
     * @return the created inode, with a fresh inode number
     */
    Future<INode> createInode(FileType type, int mode);

    /**
     * Removes an inode and its content. Fails with NOT_EMPTY for a directory
     * that still has children.
     */
    Future<Void> deleteInode(long inode);

    /**
     * Applies the non-null fields of {@code update} and returns the new inode.
     */
    Future<INode> updateInode(long inode, InodeUpdate update);

    Future<Boolean> exists(long inode);

    // =========================================================================
    // Content Operations
    // =========================================================================

    Future<byte[]> readFile(long inode);

    /**
     * Replaces the content of a file or symlink inode and updates its size and
     * modification time.
     */
    Future<Void> writeFile(long inode, byte[] data);

    // =========================================================================
    // Directory Operations
    // =========================================================================

    Future<List<DirEntry>> readDir(long inode);

    /**
     * Looks up a child of a directory by name.
     *
     * @return the child inode number, or empty when absent
     */
    Future<Optional<Long>> lookup(long directory, String name);

    /**
     * Adds a directory entry. Fails with FILE_EXISTS if the name is taken.
     */
    Future<Void> link(long directory, String name, long inode);

    /**
     * Removes a directory entry without deleting the inode it points to.
     */
    Future<Void> unlink(long directory, String name);

    StorageStats getStats();
}
