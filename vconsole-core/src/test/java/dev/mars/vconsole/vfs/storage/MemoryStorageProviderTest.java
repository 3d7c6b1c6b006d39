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

import dev.mars.vconsole.core.exceptions.VfsErrorCode;
import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.DirEntry;
import dev.mars.vconsole.vfs.FileType;
import dev.mars.vconsole.vfs.INode;
import dev.mars.vconsole.vfs.InodeUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static dev.mars.vconsole.TestFutures.await;
import static dev.mars.vconsole.TestFutures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageProviderTest {

    private MemoryStorageProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        provider = new MemoryStorageProvider();
        await(provider.open());
    }

    @Test
    void testRootExistsAsDirectory() throws Exception {
        INode root = await(provider.getInode(provider.getRootInode()));
        assertTrue(root.isDirectory());
        assertEquals(MemoryStorageProvider.ROOT_INODE, root.inode());
        assertTrue(await(provider.readDir(MemoryStorageProvider.ROOT_INODE)).isEmpty());
    }

    @Test
    void testCreateLinkAndLookup() throws Exception {
        INode file = await(provider.createInode(FileType.FILE, 0644));
        await(provider.link(MemoryStorageProvider.ROOT_INODE, "a.txt", file.inode()));

        assertEquals(Optional.of(file.inode()), await(provider.lookup(MemoryStorageProvider.ROOT_INODE, "a.txt")));
        assertEquals(Optional.empty(), await(provider.lookup(MemoryStorageProvider.ROOT_INODE, "b.txt")));
        List<DirEntry> entries = await(provider.readDir(MemoryStorageProvider.ROOT_INODE));
        assertEquals(List.of(new DirEntry("a.txt", file.inode(), FileType.FILE)), entries);
    }

    @Test
    void testInodeNumbersAreUnique() throws Exception {
        long first = await(provider.createInode(FileType.FILE, 0644)).inode();
        long second = await(provider.createInode(FileType.DIRECTORY, 0755)).inode();
        assertNotEquals(first, second);
    }

    @Test
    void testWriteUpdatesSizeAndReturnsCopies() throws Exception {
        INode file = await(provider.createInode(FileType.FILE, 0644));
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);
        await(provider.writeFile(file.inode(), data));
        data[0] = 'j';

        byte[] read = await(provider.readFile(file.inode()));
        assertEquals("hello", new String(read, StandardCharsets.UTF_8));
        assertEquals(5, await(provider.getInode(file.inode())).size());
    }

    @Test
    void testDuplicateLinkFails() throws Exception {
        INode file = await(provider.createInode(FileType.FILE, 0644));
        await(provider.link(MemoryStorageProvider.ROOT_INODE, "x", file.inode()));

        Throwable error = awaitFailure(provider.link(MemoryStorageProvider.ROOT_INODE, "x", file.inode()));
        assertEquals(VfsErrorCode.FILE_EXISTS, ((VfsException) error).getCode());
    }

    @Test
    void testDeleteNonEmptyDirectoryFails() throws Exception {
        INode dir = await(provider.createInode(FileType.DIRECTORY, 0755));
        INode file = await(provider.createInode(FileType.FILE, 0644));
        await(provider.link(dir.inode(), "f", file.inode()));

        Throwable error = awaitFailure(provider.deleteInode(dir.inode()));
        assertEquals(VfsErrorCode.NOT_EMPTY, ((VfsException) error).getCode());

        await(provider.unlink(dir.inode(), "f"));
        await(provider.deleteInode(dir.inode()));
        assertFalse(await(provider.exists(dir.inode())));
    }

    @Test
    void testRootCannotBeDeleted() throws Exception {
        Throwable error = awaitFailure(provider.deleteInode(MemoryStorageProvider.ROOT_INODE));
        assertEquals(VfsErrorCode.ACCESS_DENIED, ((VfsException) error).getCode());
    }

    @Test
    void testReadingDirectoryContentFails() throws Exception {
        Throwable error = awaitFailure(provider.readFile(MemoryStorageProvider.ROOT_INODE));
        assertEquals(VfsErrorCode.IS_DIRECTORY, ((VfsException) error).getCode());
    }

    @Test
    void testUnknownInodeIsNotFound() throws Exception {
        Throwable error = awaitFailure(provider.getInode(999));
        assertEquals(VfsErrorCode.NOT_FOUND, ((VfsException) error).getCode());
    }

    @Test
    void testUpdateInodeAppliesChanges() throws Exception {
        INode file = await(provider.createInode(FileType.FILE, 0644));
        INode updated = await(provider.updateInode(file.inode(), InodeUpdate.ofMode(0600)));

        assertEquals(0600, updated.mode());
        assertEquals(file.owner(), updated.owner());
    }

    @Test
    void testReadOnlyProviderRejectsMutation() throws Exception {
        MemoryStorageProvider readOnly = new MemoryStorageProvider("ro", true);
        await(readOnly.open());

        Throwable error = awaitFailure(readOnly.createInode(FileType.FILE, 0644));
        assertEquals(VfsErrorCode.ACCESS_DENIED, ((VfsException) error).getCode());
    }

    @Test
    void testStatsCountFilesDirectoriesAndBytes() throws Exception {
        INode file = await(provider.createInode(FileType.FILE, 0644));
        await(provider.writeFile(file.inode(), new byte[10]));
        await(provider.createInode(FileType.DIRECTORY, 0755));

        StorageStats stats = provider.getStats();
        assertEquals(3, stats.inodes());
        assertEquals(1, stats.files());
        assertEquals(2, stats.directories());
        assertEquals(10, stats.totalBytes());
    }
}
