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

package dev.mars.vconsole.command;

import dev.mars.vconsole.command.BaseCommand.ParsedArgs;
import dev.mars.vconsole.vfs.FileType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BaseCommandTest {

    @Test
    void testFlagsAreSplitIntoLetters() {
        ParsedArgs args = ParsedArgs.parse(List.of("-la", "--verbose", "dir"));

        assertEquals(Set.of("l", "a", "verbose"), args.flags());
        assertEquals(List.of("dir"), args.positional());
        assertTrue(args.has("x", "a"));
        assertFalse(args.has("r"));
    }

    @Test
    void testLongOptionsTakeValuesAfterEquals() {
        ParsedArgs args = ParsedArgs.parse(List.of("--format=long", "--color", "auto"));

        assertEquals(Map.of("format", "long"), args.options());
        assertEquals("long", args.option("format", "short"));
        assertEquals("none", args.option("width", "none"));
        assertTrue(args.has("color"));
        assertEquals(List.of("auto"), args.positional());
    }

    @Test
    void testDoubleDashEndsOptions() {
        ParsedArgs args = ParsedArgs.parse(List.of("-r", "--", "-file", "-"));

        assertEquals(Set.of("r"), args.flags());
        assertEquals(List.of("-file", "-"), args.positional());
    }

    @Test
    void testFormatPermissions() {
        assertEquals("drwxr-xr-x", BaseCommand.formatPermissions(FileType.DIRECTORY, 0755));
        assertEquals("-rw-r--r--", BaseCommand.formatPermissions(FileType.FILE, 0644));
        assertEquals("lrwxrwxrwx", BaseCommand.formatPermissions(FileType.SYMLINK, 0777));
        assertEquals("----------", BaseCommand.formatPermissions(FileType.FILE, 0));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0B", BaseCommand.formatFileSize(0));
        assertEquals("512B", BaseCommand.formatFileSize(512));
        assertEquals("1.5K", BaseCommand.formatFileSize(1536));
        assertEquals("2.0M", BaseCommand.formatFileSize(2L * 1024 * 1024));
    }
}
