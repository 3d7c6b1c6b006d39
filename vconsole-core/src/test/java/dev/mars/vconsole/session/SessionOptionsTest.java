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

package dev.mars.vconsole.session;

import dev.mars.vconsole.config.VConsoleConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SessionOptionsTest {

    @Test
    void testDefaults() {
        SessionOptions options = SessionOptions.defaults();

        assertNull(options.getId());
        assertEquals("/home/user", options.getWorkingDirectory());
        assertEquals(1000, options.getHistorySize());
        assertFalse(options.isPersistenceEnabled());
        assertEquals(0, options.getCommandTimeoutMs());
        assertEquals("$ ", options.getPrompt());
        assertEquals("/usr/bin:/bin", options.getEnvironment().get("PATH"));
        assertEquals("/home/user", options.getEnvironment().get("HOME"));
        assertEquals("user", options.getEnvironment().get("USER"));
    }

    @Test
    void testFromConfiguration() {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.DEFAULT_CWD, "/tmp");
        overrides.setProperty(VConsoleConfiguration.HISTORY_MAX_SIZE, "50");
        overrides.setProperty(VConsoleConfiguration.PERSISTENCE_ENABLED, "true");
        overrides.setProperty(VConsoleConfiguration.COMMAND_TIMEOUT_MS, "250");

        SessionOptions options = SessionOptions.builder(new VConsoleConfiguration(overrides)).build();

        assertEquals("/tmp", options.getWorkingDirectory());
        assertEquals(50, options.getHistorySize());
        assertTrue(options.isPersistenceEnabled());
        assertEquals(250, options.getCommandTimeoutMs());
    }

    @Test
    void testEnvironmentIsCopiedAndImmutable() {
        SessionOptions options = SessionOptions.builder()
                .clearEnvironment()
                .environment("LANG", "C")
                .build();

        assertEquals(1, options.getEnvironment().size());
        assertThrows(UnsupportedOperationException.class, () -> options.getEnvironment().put("X", "1"));
    }

    @Test
    void testToBuilderKeepsValues() {
        SessionOptions original = SessionOptions.builder().id("a").historySize(7).environment("K", "v").build();

        SessionOptions copy = original.toBuilder().prompt("> ").build();

        assertEquals("a", copy.getId());
        assertEquals(7, copy.getHistorySize());
        assertEquals("v", copy.getEnvironment().get("K"));
        assertEquals("> ", copy.getPrompt());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SessionOptions.builder().historySize(0));
        assertThrows(IllegalArgumentException.class, () -> SessionOptions.builder().commandTimeoutMs(-1));
        assertThrows(NullPointerException.class, () -> SessionOptions.builder().workingDirectory(null));
        assertThrows(NullPointerException.class, () -> SessionOptions.builder().environment("X", null));
    }
}
