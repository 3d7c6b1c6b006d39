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

import dev.mars.vconsole.vfs.FileType;
import dev.mars.vconsole.vfs.INode;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static dev.mars.vconsole.TestFutures.await;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotStorageProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingSnapshotStartsEmpty() throws Exception {
        SnapshotStorageProvider provider = new SnapshotStorageProvider(tempDir.resolve("fs.json"));
        await(provider.open());

        assertTrue(await(provider.readDir(provider.getRootInode())).isEmpty());
        assertFalse(Files.exists(provider.getSnapshotFile()));
    }

    @Test
    void testContentSurvivesReopen() throws Exception {
        Path file = tempDir.resolve("state/fs.json");

        VirtualFileSystem first = new VirtualFileSystem(new SnapshotStorageProvider(file));
        await(first.initialize());
        await(first.writeTextFile("/tmp/notes.txt", "remember me"));
        await(first.symlink("/tmp/notes.txt", "/tmp/link"));
        await(first.chmod("/tmp/notes.txt", 0600));
        await(first.shutdown());

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("fs.json.tmp")));

        VirtualFileSystem second = new VirtualFileSystem(new SnapshotStorageProvider(file));
        await(second.initialize());
        assertEquals("remember me", await(second.readTextFile("/tmp/notes.txt")));
        assertEquals("remember me", await(second.readTextFile("/tmp/link")));
        INode inode = await(second.stat("/tmp/notes.txt"));
        assertEquals(0600, inode.mode());
    }

    @Test
    void testEveryMutationIsFlushed() throws Exception {
        Path file = tempDir.resolve("fs.json");
        SnapshotStorageProvider provider = new SnapshotStorageProvider(file);
        VirtualFileSystem vfs = new VirtualFileSystem(provider);
        await(vfs.initialize());
        await(vfs.writeTextFile("/tmp/a", "1"));

        SnapshotStorageProvider reader = new SnapshotStorageProvider(file, true);
        VirtualFileSystem view = new VirtualFileSystem(reader);
        await(view.initialize());
        assertEquals("1", await(view.readTextFile("/tmp/a")));
    }

    @Test
    void testInodeNumbersContinueAfterRestore() throws Exception {
        Path file = tempDir.resolve("fs.json");
        SnapshotStorageProvider provider = new SnapshotStorageProvider(file);
        await(provider.open());
        long created = await(provider.createInode(FileType.FILE, 0644)).inode();
        await(provider.close());

        SnapshotStorageProvider reopened = new SnapshotStorageProvider(file);
        await(reopened.open());
        long next = await(reopened.createInode(FileType.FILE, 0644)).inode();
        assertTrue(next > created);
    }
}
