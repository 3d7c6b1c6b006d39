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

import java.time.Instant;

/**
 * A filesystem change notification.
 *
 * @param type what happened
 * @param path the absolute path concerned (the mount path for mount events)
 * @param inode the inode concerned, or {@code -1} for mount events
 * @param timestamp when the change was applied
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public record VfsEvent(VfsEventType type, String path, long inode, Instant timestamp) {

    public VfsEvent(VfsEventType type, String path, long inode) {
        this(type, path, inode, Instant.now());
    }

    /**
     * Returns true if the event path equals {@code path} or lies beneath it.
     */
    public boolean concerns(String path) {
        if ("/".equals(path)) {
            return true;
        }
        return this.path.equals(path) || this.path.startsWith(path + "/");
    }
}
