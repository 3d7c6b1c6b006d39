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

/**
 * Events published by the {@link VirtualFileSystem}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public enum VfsEventType {
    FILE_CREATED,
    FILE_CHANGED,
    FILE_DELETED,
    DIRECTORY_CREATED,
    DIRECTORY_DELETED,
    MOUNT_ADDED,
    MOUNT_REMOVED;

    /**
     * Returns true for the events describing a change to the directory tree.
     */
    public boolean isStructural() {
        return this != MOUNT_ADDED && this != MOUNT_REMOVED;
    }
}
