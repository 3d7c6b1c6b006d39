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

import dev.mars.vconsole.vfs.storage.StorageProvider;

/**
 * A storage provider attached to the path namespace.
 *
 * @param path the normalized mount path
 * @param provider the backing storage
 * @param readOnly whether mutations under this mount are rejected
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public record MountPoint(String path, StorageProvider provider, boolean readOnly) {

    /**
     * Returns true if {@code absolutePath} is served by this mount (ignoring nested mounts).
     */
    public boolean covers(String absolutePath) {
        return VfsPaths.ROOT.equals(path) || absolutePath.equals(path) || absolutePath.startsWith(path + "/");
    }

    /**
     * Returns the path relative to this mount's root, always starting with {@code /}.
     */
    public String relativePath(String absolutePath) {
        if (VfsPaths.ROOT.equals(path)) {
            return absolutePath;
        }
        String relative = absolutePath.substring(path.length());
        return relative.isEmpty() ? VfsPaths.ROOT : relative;
    }

    @Override
    public String toString() {
        return path + " (" + provider.name() + (readOnly ? ", ro" : ", rw") + ")";
    }
}
