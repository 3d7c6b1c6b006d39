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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Immutable metadata record of a filesystem object, addressed by its inode number.
 *
 * @param inode inode number, unique within one storage provider
 * @param type the object kind
 * @param mode permission bits ({@code 0755} style)
 * @param owner owning user
 * @param group owning group
 * @param size content size in bytes
 * @param createdAt creation time
 * @param modifiedAt last content or metadata modification
 * @param accessedAt last access
 * @param linkCount number of directory entries referencing the inode
 * @param symlinkTarget target path of a symbolic link, otherwise {@code null}
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public record INode(long inode,
                    FileType type,
                    int mode,
                    String owner,
                    String group,
                    long size,
                    Instant createdAt,
                    Instant modifiedAt,
                    Instant accessedAt,
                    int linkCount,
                    String symlinkTarget) {

    @JsonIgnore
    public boolean isDirectory() {
        return type == FileType.DIRECTORY;
    }

    @JsonIgnore
    public boolean isFile() {
        return type == FileType.FILE;
    }

    @JsonIgnore
    public boolean isSymlink() {
        return type == FileType.SYMLINK;
    }

    /**
     * Returns a copy with every non-null field of {@code update} applied.
     */
    public INode apply(InodeUpdate update) {
        return new INode(
                inode,
                type,
                update.mode() != null ? update.mode() : mode,
                update.owner() != null ? update.owner() : owner,
                update.group() != null ? update.group() : group,
                update.size() != null ? update.size() : size,
                createdAt,
                update.modifiedAt() != null ? update.modifiedAt() : modifiedAt,
                update.accessedAt() != null ? update.accessedAt() : accessedAt,
                update.linkCount() != null ? update.linkCount() : linkCount,
                update.symlinkTarget() != null ? update.symlinkTarget() : symlinkTarget);
    }
}
