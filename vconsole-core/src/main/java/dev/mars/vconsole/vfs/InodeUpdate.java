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
 * Partial inode update; {@code null} fields are left unchanged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public record InodeUpdate(Integer mode,
                          String owner,
                          String group,
                          Long size,
                          Instant modifiedAt,
                          Instant accessedAt,
                          Integer linkCount,
                          String symlinkTarget) {

    private static final InodeUpdate EMPTY = new InodeUpdate(null, null, null, null, null, null, null, null);

    public static InodeUpdate empty() {
        return EMPTY;
    }

    public static InodeUpdate ofMode(int mode) {
        return EMPTY.withMode(mode);
    }

    public static InodeUpdate ofOwner(String owner, String group) {
        return new InodeUpdate(null, owner, group, null, null, null, null, null);
    }

    public InodeUpdate withMode(int newMode) {
        return new InodeUpdate(newMode, owner, group, size, modifiedAt, accessedAt, linkCount, symlinkTarget);
    }

    public InodeUpdate withSize(long newSize) {
        return new InodeUpdate(mode, owner, group, newSize, modifiedAt, accessedAt, linkCount, symlinkTarget);
    }

    public InodeUpdate withModifiedAt(Instant time) {
        return new InodeUpdate(mode, owner, group, size, time, accessedAt, linkCount, symlinkTarget);
    }

    public InodeUpdate withAccessedAt(Instant time) {
        return new InodeUpdate(mode, owner, group, size, modifiedAt, time, linkCount, symlinkTarget);
    }

    public InodeUpdate withLinkCount(int count) {
        return new InodeUpdate(mode, owner, group, size, modifiedAt, accessedAt, count, symlinkTarget);
    }

    public InodeUpdate withSymlinkTarget(String target) {
        return new InodeUpdate(mode, owner, group, size, modifiedAt, accessedAt, linkCount, target);
    }
}
