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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
class VfsPathsTest {

    @ParameterizedTest
    @CsvSource({
            "/, /",
            "//, /",
            "/a/b/, /a/b",
            "/a/./b, /a/b",
            "/a/b/.., /a",
            "/a/../../.., /",
            "/a//b///c, /a/b/c"
    })
    void testResolveNormalizes(String input, String expected) {
        assertEquals(expected, VfsPaths.resolve(input));
    }

    @ParameterizedTest
    @CsvSource({"/", "//", "/a/b/", "/a/./b/../c", "/a/../../..", "/a//b///c/.", "/x y/z"})
    void testResolveIsIdempotent(String input) {
        String once = VfsPaths.resolve(input);
        assertEquals(once, VfsPaths.resolve(once));
    }

    @Test
    void testResolveRejectsRelativePaths() {
        assertThrows(IllegalArgumentException.class, () -> VfsPaths.resolve("a/b"));
        assertThrows(IllegalArgumentException.class, () -> VfsPaths.resolve((String) null));
    }

    @Test
    void testResolveAgainstBase() {
        assertEquals("/home/user/docs", VfsPaths.resolve("/home/user", "docs"));
        assertEquals("/home", VfsPaths.resolve("/home/user", ".."));
        assertEquals("/etc", VfsPaths.resolve("/home/user", "/etc"));
        assertEquals("/home/user", VfsPaths.resolve("/home/user", ""));
    }

    @Test
    void testDirnameAndBasename() {
        assertEquals("/home", VfsPaths.dirname("/home/user"));
        assertEquals("/", VfsPaths.dirname("/home"));
        assertEquals("/", VfsPaths.dirname("/"));
        assertEquals("user", VfsPaths.basename("/home/user/"));
        assertEquals("", VfsPaths.basename("/"));
        assertEquals("notes", VfsPaths.basename("/docs/notes.txt", ".txt"));
    }

    @Test
    void testExtname() {
        assertEquals(".gz", VfsPaths.extname("/a/archive.tar.gz"));
        assertEquals("", VfsPaths.extname("/a/.profile"));
        assertEquals("", VfsPaths.extname("/a/Makefile"));
    }

    @Test
    void testJoinAndSegments() {
        assertEquals("/a/b/c", VfsPaths.join("/a", "b/", "c"));
        assertEquals(List.of("a", "b"), VfsPaths.segments("/a/b"));
        assertTrue(VfsPaths.segments("/").isEmpty());
    }

    @Test
    void testIsWithin() {
        assertTrue(VfsPaths.isWithin("/a", "/a/b"));
        assertTrue(VfsPaths.isWithin("/a", "/a"));
        assertTrue(VfsPaths.isWithin("/", "/anything"));
        assertFalse(VfsPaths.isWithin("/a", "/ab"));
    }

    @Test
    void testRelativize() {
        assertEquals("b/c", VfsPaths.relativize("/a", "/a/b/c"));
        assertEquals(".", VfsPaths.relativize("/a", "/a"));
        assertEquals("etc", VfsPaths.relativize("/", "/etc"));
        assertEquals("/x/y", VfsPaths.relativize("/a", "/x/y"));
    }
}
