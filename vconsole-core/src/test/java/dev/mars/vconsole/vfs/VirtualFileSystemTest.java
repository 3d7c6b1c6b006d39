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
import dev.mars.vconsole.core.event.Subscription;
import dev.mars.vconsole.core.exceptions.VfsErrorCode;
import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.vfs.storage.MemoryStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static dev.mars.vconsole.TestFutures.await;
import static dev.mars.vconsole.TestFutures.awaitFailure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
class VirtualFileSystemTest {

    private VirtualFileSystem vfs;

    @BeforeEach
    void setUp() throws Exception {
        vfs = new VirtualFileSystem(new MemoryStorageProvider());
        await(vfs.initialize());
    }

    private static VfsErrorCode codeOf(Throwable error) {
        assertInstanceOf(VfsException.class, error);
        return ((VfsException) error).getCode();
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void testStandardLayoutIsCreated() throws Exception {
            for (String dir : List.of("/home", "/home/user", "/usr", "/usr/bin", "/etc", "/tmp", "/var")) {
                assertTrue(await(vfs.stat(dir)).isDirectory(), dir);
            }
            assertThat(await(vfs.readTextFile("/home/user/README.txt"))).contains("Welcome to VConsole!");
        }

        @Test
        void testStandardLayoutCanBeDisabled() throws Exception {
            Properties properties = new Properties();
            properties.setProperty(VConsoleConfiguration.STANDARD_LAYOUT, "false");
            VirtualFileSystem bare = new VirtualFileSystem(new MemoryStorageProvider(),
                    new VConsoleConfiguration(properties));
            await(bare.initialize());

            assertTrue(await(bare.readDir("/")).isEmpty());
        }

        @Test
        void testOperationsBeforeInitializeFail() throws Exception {
            VirtualFileSystem fresh = new VirtualFileSystem(new MemoryStorageProvider());
            assertInstanceOf(IllegalStateException.class, awaitFailure(fresh.readFile("/x")));
        }

        @Test
        void testShutdownClosesProviders() throws Exception {
            MemoryStorageProvider extra = new MemoryStorageProvider("extra", false);
            await(vfs.mount("/mnt/extra", extra, false));
            assertTrue(extra.isOpen());

            await(vfs.shutdown());

            assertFalse(extra.isOpen());
            assertFalse(vfs.isInitialized());
        }
    }

    @Nested
    @DisplayName("Files")
    class Files {

        @Test
        void testWriteThenReadReturnsSameBytes() throws Exception {
            byte[] data = {0, 1, 2, (byte) 0xFF};
            await(vfs.writeFile("/tmp/data.bin", data));

            assertArrayEquals(data, await(vfs.readFile("/tmp/data.bin")));
            assertEquals(4, await(vfs.stat("/tmp/data.bin")).size());
        }

        @Test
        void testOverwriteReplacesContent() throws Exception {
            await(vfs.writeTextFile("/tmp/a.txt", "first"));
            await(vfs.writeTextFile("/tmp/a.txt", "second"));

            assertEquals("second", await(vfs.readTextFile("/tmp/a.txt")));
        }

        @Test
        void testAppendCreatesAndExtends() throws Exception {
            await(vfs.appendFile("/tmp/log", "a".getBytes(StandardCharsets.UTF_8)));
            await(vfs.appendFile("/tmp/log", "b".getBytes(StandardCharsets.UTF_8)));

            assertEquals("ab", await(vfs.readTextFile("/tmp/log")));
        }

        @Test
        void testReadMissingFileIsNotFound() throws Exception {
            assertEquals(VfsErrorCode.NOT_FOUND, codeOf(awaitFailure(vfs.readFile("/nope"))));
        }

        @Test
        void testReadDirectoryIsDirectoryError() throws Exception {
            assertEquals(VfsErrorCode.IS_DIRECTORY, codeOf(awaitFailure(vfs.readFile("/tmp"))));
        }

        @Test
        void testWriteUnderMissingParentIsNotFound() throws Exception {
            assertEquals(VfsErrorCode.NOT_FOUND, codeOf(awaitFailure(vfs.writeTextFile("/no/such/file", "x"))));
        }

        @Test
        void testWriteThroughFileParentIsNotADirectory() throws Exception {
            await(vfs.writeTextFile("/tmp/file", "x"));
            assertEquals(VfsErrorCode.NOT_A_FILE, codeOf(awaitFailure(vfs.writeTextFile("/tmp/file/child", "y"))));
        }

        @Test
        void testWriteBeyondSizeLimitIsNoSpace() throws Exception {
            Properties properties = new Properties();
            properties.setProperty(VConsoleConfiguration.MAX_FILE_SIZE, "4");
            VirtualFileSystem small = new VirtualFileSystem(new MemoryStorageProvider(),
                    new VConsoleConfiguration(properties));
            await(small.initialize());

            assertEquals(VfsErrorCode.NO_SPACE, codeOf(awaitFailure(small.writeTextFile("/tmp/big", "12345"))));
        }

        @Test
        void testDeleteFile() throws Exception {
            await(vfs.writeTextFile("/tmp/gone", "x"));
            await(vfs.deleteFile("/tmp/gone"));

            assertFalse(await(vfs.exists("/tmp/gone")));
        }

        @Test
        void testDeleteFileOnDirectoryFails() throws Exception {
            assertEquals(VfsErrorCode.IS_DIRECTORY, codeOf(awaitFailure(vfs.deleteFile("/tmp"))));
        }

        @Test
        void testExistsNeverFails() throws Exception {
            assertTrue(await(vfs.exists("/tmp")));
            assertFalse(await(vfs.exists("/tmp/missing/deeper")));
            assertFalse(await(vfs.exists("relative")));
        }

        @Test
        void testRelativePathIsInvalid() throws Exception {
            assertEquals(VfsErrorCode.INVALID_PATH, codeOf(awaitFailure(vfs.readFile("tmp/x"))));
        }

        @Test
        void testTouchCreatesEmptyFileAndUpdatesTimes() throws Exception {
            await(vfs.touch("/tmp/t"));
            INode created = await(vfs.stat("/tmp/t"));
            assertEquals(0, created.size());

            Thread.sleep(5);
            await(vfs.touch("/tmp/t"));
            assertTrue(await(vfs.stat("/tmp/t")).modifiedAt().isAfter(created.modifiedAt()));
        }
    }

    @Nested
    @DisplayName("Directories")
    class Directories {

        @Test
        void testCreateDirRecursiveCreatesAncestors() throws Exception {
            await(vfs.createDir("/a/b/c", true));

            assertTrue(await(vfs.stat("/a")).isDirectory());
            assertTrue(await(vfs.stat("/a/b")).isDirectory());
            assertTrue(await(vfs.stat("/a/b/c")).isDirectory());
        }

        @Test
        void testCreateDirWithoutRecursiveNeedsParent() throws Exception {
            assertEquals(VfsErrorCode.NOT_FOUND, codeOf(awaitFailure(vfs.createDir("/x/y"))));
        }

        @Test
        void testCreateExistingDirFails() throws Exception {
            assertEquals(VfsErrorCode.FILE_EXISTS, codeOf(awaitFailure(vfs.createDir("/tmp"))));
            assertEquals(VfsErrorCode.FILE_EXISTS, codeOf(awaitFailure(vfs.createDir("/tmp", true))));
        }

        @Test
        void testCreateDirAppliesMode() throws Exception {
            await(vfs.createDir("/tmp/private", false, 0700));
            assertEquals(0700, await(vfs.stat("/tmp/private")).mode());
        }

        @Test
        void testReadDirListsChildrenInOrder() throws Exception {
            await(vfs.writeTextFile("/tmp/b", ""));
            await(vfs.writeTextFile("/tmp/a", ""));
            await(vfs.createDir("/tmp/c"));

            List<DirEntry> entries = await(vfs.readDir("/tmp"));
            assertThat(entries).extracting(DirEntry::name).containsExactly("a", "b", "c");
            assertThat(entries).extracting(DirEntry::type)
                    .containsExactly(FileType.FILE, FileType.FILE, FileType.DIRECTORY);
        }

        @Test
        void testReadDirOnFileFails() throws Exception {
            assertEquals(VfsErrorCode.NOT_A_FILE, codeOf(awaitFailure(vfs.readDir("/home/user/README.txt"))));
        }

        @Test
        void testDeleteNonEmptyDirNeedsRecursive() throws Exception {
            await(vfs.createDir("/tmp/full/sub", true));
            await(vfs.writeTextFile("/tmp/full/sub/f", "x"));

            assertEquals(VfsErrorCode.NOT_EMPTY, codeOf(awaitFailure(vfs.deleteDir("/tmp/full", false))));

            await(vfs.deleteDir("/tmp/full", true));
            assertFalse(await(vfs.exists("/tmp/full")));
        }

        @Test
        void testDeleteRootIsDenied() throws Exception {
            assertEquals(VfsErrorCode.ACCESS_DENIED, codeOf(awaitFailure(vfs.deleteDir("/", true))));
        }
    }

    @Nested
    @DisplayName("Rename")
    class Rename {

        @Test
        void testRenameFile() throws Exception {
            await(vfs.writeTextFile("/tmp/old", "content"));
            await(vfs.rename("/tmp/old", "/tmp/new"));

            assertFalse(await(vfs.exists("/tmp/old")));
            assertEquals("content", await(vfs.readTextFile("/tmp/new")));
        }

        @Test
        void testRenameIntoDirectory() throws Exception {
            await(vfs.writeTextFile("/tmp/f", "x"));
            await(vfs.rename("/tmp/f", "/home"));

            assertEquals("x", await(vfs.readTextFile("/home/f")));
        }

        @Test
        void testRenameDirectoryKeepsChildren() throws Exception {
            await(vfs.createDir("/tmp/d/e", true));
            await(vfs.writeTextFile("/tmp/d/e/f", "deep"));
            await(vfs.rename("/tmp/d", "/var/d2"));

            assertEquals("deep", await(vfs.readTextFile("/var/d2/e/f")));
            assertFalse(await(vfs.exists("/tmp/d")));
        }

        @Test
        void testRenameIntoItselfFails() throws Exception {
            await(vfs.createDir("/tmp/d"));
            assertEquals(VfsErrorCode.INVALID_PATH, codeOf(awaitFailure(vfs.rename("/tmp/d", "/tmp/d/inner"))));
        }

        @Test
        void testRenameMissingSourceFails() throws Exception {
            assertEquals(VfsErrorCode.NOT_FOUND, codeOf(awaitFailure(vfs.rename("/tmp/none", "/tmp/x"))));
        }
    }

    @Nested
    @DisplayName("Symbolic links")
    class Links {

        @Test
        void testSymlinkIsFollowedOnRead() throws Exception {
            await(vfs.symlink("/home/user/README.txt", "/tmp/readme"));

            assertThat(await(vfs.readTextFile("/tmp/readme"))).contains("Welcome");
            assertTrue(await(vfs.lstat("/tmp/readme")).isSymlink());
            assertTrue(await(vfs.stat("/tmp/readme")).isFile());
            assertEquals("/home/user/README.txt", await(vfs.readlink("/tmp/readme")));
        }

        @Test
        void testReadlinkOnRegularFileFails() throws Exception {
            assertEquals(VfsErrorCode.INVALID_PATH, codeOf(awaitFailure(vfs.readlink("/home/user/README.txt"))));
        }

        @Test
        void testSymlinkLoopIsDetected() throws Exception {
            await(vfs.symlink("/tmp/b", "/tmp/a"));
            await(vfs.symlink("/tmp/a", "/tmp/b"));

            assertEquals(VfsErrorCode.TOO_MANY_LINKS, codeOf(awaitFailure(vfs.readFile("/tmp/a"))));
        }

        @Test
        void testDirnameAndBasenameRejoinToSameInode() throws Exception {
            await(vfs.symlink("/home/user/README.txt", "/tmp/readme"));

            for (String path : List.of("/", "/home", "/home/user/README.txt", "/home/./user//README.txt",
                    "/tmp/readme", "/tmp/../home/user/")) {
                String rejoined = VfsPaths.join(VfsPaths.dirname(path), VfsPaths.basename(path));
                assertEquals(await(vfs.stat(path)).inode(), await(vfs.stat(rejoined)).inode(), path);
            }
        }
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        void testChmodAndChown() throws Exception {
            await(vfs.writeTextFile("/tmp/f", "x"));
            await(vfs.chmod("/tmp/f", 0600));
            await(vfs.chown("/tmp/f", "root", "wheel"));

            INode inode = await(vfs.stat("/tmp/f"));
            assertEquals(0600, inode.mode());
            assertEquals("root", inode.owner());
            assertEquals("wheel", inode.group());
        }
    }

    @Nested
    @DisplayName("Mounts")
    class Mounts {

        @Test
        void testLongestPrefixWins() throws Exception {
            await(vfs.mount("/mnt/data", new MemoryStorageProvider("data", false), false));

            assertEquals("/mnt/data", vfs.resolveMount("/mnt/data/x/y").mount().path());
            assertEquals("/x/y", vfs.resolveMount("/mnt/data/x/y").relativePath());
            assertEquals("/", vfs.resolveMount("/mnt/database").mount().path());
        }

        @Test
        void testFilesLiveInTheMountedProvider() throws Exception {
            MemoryStorageProvider data = new MemoryStorageProvider("data", false);
            await(vfs.mount("/mnt/data", data, false));
            await(vfs.writeTextFile("/mnt/data/hello.txt", "hi"));

            assertEquals(1, data.getStats().files());
            await(vfs.unmount("/mnt/data"));
            assertFalse(await(vfs.exists("/mnt/data/hello.txt")));
        }

        @Test
        void testReadOnlyMountRejectsWrites() throws Exception {
            await(vfs.mount("/ro", new MemoryStorageProvider("ro", false), true));

            assertEquals(VfsErrorCode.ACCESS_DENIED, codeOf(awaitFailure(vfs.writeTextFile("/ro/f", "x"))));
        }

        @Test
        void testDuplicateMountAndUnknownUnmountFail() throws Exception {
            await(vfs.mount("/mnt/a", new MemoryStorageProvider("a", false), false));

            assertEquals(VfsErrorCode.FILE_EXISTS,
                    codeOf(awaitFailure(vfs.mount("/mnt/a", new MemoryStorageProvider("b", false), false))));
            assertEquals(VfsErrorCode.NOT_FOUND, codeOf(awaitFailure(vfs.unmount("/mnt/none"))));
            assertEquals(VfsErrorCode.ACCESS_DENIED, codeOf(awaitFailure(vfs.unmount("/"))));
        }

        @Test
        void testRenameAcrossMountsFails() throws Exception {
            await(vfs.mount("/mnt/a", new MemoryStorageProvider("a", false), false));
            await(vfs.writeTextFile("/tmp/f", "x"));

            assertEquals(VfsErrorCode.INVALID_PATH, codeOf(awaitFailure(vfs.rename("/tmp/f", "/mnt/a/f"))));
        }

        @Test
        void testMountsAreListedByPath() throws Exception {
            await(vfs.mount("/mnt/b", new MemoryStorageProvider("b", false), false));
            await(vfs.mount("/mnt/a", new MemoryStorageProvider("a", false), false));

            assertThat(vfs.getMounts()).extracting(MountPoint::path).containsExactly("/", "/mnt/a", "/mnt/b");
        }
    }

    @Nested
    @DisplayName("Glob")
    class Glob {

        @BeforeEach
        void createFiles() throws Exception {
            await(vfs.createDir("/data/sub", true));
            await(vfs.writeTextFile("/data/a.txt", ""));
            await(vfs.writeTextFile("/data/b.txt", ""));
            await(vfs.writeTextFile("/data/c.md", ""));
            await(vfs.writeTextFile("/data/.hidden.txt", ""));
            await(vfs.writeTextFile("/data/sub/d.txt", ""));
        }

        @Test
        void testNamePatternSearchesBelowCwd() throws Exception {
            assertEquals(List.of("/data/a.txt", "/data/b.txt", "/data/sub/d.txt"), await(vfs.glob("*.txt", "/data")));
        }

        @Test
        void testPathPatternStaysAtItsDepth() throws Exception {
            assertEquals(List.of("/data/a.txt", "/data/b.txt"), await(vfs.glob("/data/*.txt", "/")));
            assertEquals(List.of("/data/sub/d.txt"), await(vfs.glob("/data/*/*.txt", "/")));
        }

        @Test
        void testRelativePathPatternUsesCwd() throws Exception {
            assertEquals(List.of("/data/sub/d.txt"), await(vfs.glob("sub/?.txt", "/data")));
        }

        @Test
        void testDotFilesNeedExplicitDot() throws Exception {
            assertEquals(List.of("/data/.hidden.txt"), await(vfs.glob("/data/.*", "/")));
        }

        @Test
        void testNoMatchIsEmpty() throws Exception {
            assertTrue(await(vfs.glob("/data/*.pdf", "/")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Events and cache")
    class EventsAndCache {

        @Test
        void testWatchReceivesEventsBelowPath() throws Exception {
            List<VfsEvent> events = new ArrayList<>();
            Subscription subscription = vfs.watch("/tmp", events::add);

            await(vfs.writeTextFile("/tmp/w", "1"));
            await(vfs.writeTextFile("/tmp/w", "2"));
            await(vfs.deleteFile("/tmp/w"));
            await(vfs.writeTextFile("/var/elsewhere", "x"));

            assertThat(events).extracting(VfsEvent::type).containsExactly(
                    VfsEventType.FILE_CREATED, VfsEventType.FILE_CHANGED, VfsEventType.FILE_DELETED);

            subscription.unsubscribe();
            await(vfs.writeTextFile("/tmp/after", "x"));
            assertEquals(3, events.size());
        }

        @Test
        void testMountEvents() throws Exception {
            List<VfsEvent> events = new ArrayList<>();
            vfs.subscribe(VfsEventType.MOUNT_ADDED, events::add);
            vfs.subscribe(VfsEventType.MOUNT_REMOVED, events::add);

            await(vfs.mount("/mnt/x", new MemoryStorageProvider("x", false), false));
            await(vfs.unmount("/mnt/x"));

            assertThat(events).extracting(VfsEvent::path).containsExactly("/mnt/x", "/mnt/x");
        }

        @Test
        void testRepeatedLookupsHitTheCache() throws Exception {
            await(vfs.stat("/home/user/README.txt"));
            long hits = vfs.getCacheStats().hits();
            await(vfs.stat("/home/user/README.txt"));

            assertTrue(vfs.getCacheStats().hits() > hits);

            vfs.clearCache();
            assertEquals(0, vfs.getCacheStats().pathEntries());
        }
    }
}
