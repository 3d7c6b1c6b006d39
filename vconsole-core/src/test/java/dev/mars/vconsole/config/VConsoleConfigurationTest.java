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

package dev.mars.vconsole.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class VConsoleConfigurationTest {

    @Test
    void testDefaults() {
        VConsoleConfiguration config = VConsoleConfiguration.defaults();

        assertEquals("memory", config.getStorageBackend());
        assertEquals("vconsole-vfs.json", config.getSnapshotPath());
        assertEquals(1000, config.getHistoryMaxSize());
        assertEquals("/home/user", config.getDefaultWorkingDirectory());
        assertEquals("$ ", config.getPrompt());
        assertFalse(config.isPersistenceEnabled());
        assertEquals("", config.getStateDirectory());
        assertTrue(config.isStandardLayoutEnabled());
        assertEquals(16L * 1024 * 1024, config.getMaxFileSize());
        assertEquals(0, config.getCommandTimeoutMs());
    }

    @Test
    void testOverridesReplaceDefaults() {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.HISTORY_MAX_SIZE, "50");
        overrides.setProperty(VConsoleConfiguration.PROMPT, "vc> ");
        overrides.setProperty(VConsoleConfiguration.PERSISTENCE_ENABLED, "true");
        overrides.setProperty(VConsoleConfiguration.COMMAND_TIMEOUT_MS, "2500");

        VConsoleConfiguration config = new VConsoleConfiguration(overrides);

        assertEquals(50, config.getHistoryMaxSize());
        assertEquals("vc> ", config.getPrompt());
        assertTrue(config.isPersistenceEnabled());
        assertEquals(2500, config.getCommandTimeoutMs());
        assertEquals("memory", config.getStorageBackend());
    }

    @Test
    void testNonPositiveHistorySizeFallsBack() {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.HISTORY_MAX_SIZE, "0");

        assertEquals(1000, new VConsoleConfiguration(overrides).getHistoryMaxSize());
    }

    @Test
    void testMalformedNumbersFallBack() {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.HISTORY_MAX_SIZE, "lots");
        overrides.setProperty(VConsoleConfiguration.MAX_FILE_SIZE, "big");

        VConsoleConfiguration config = new VConsoleConfiguration(overrides);
        assertEquals(1000, config.getHistoryMaxSize());
        assertEquals(16L * 1024 * 1024, config.getMaxFileSize());
    }

    @Test
    void testNumbersAreTrimmed() {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.MAX_FILE_SIZE, " 1024 ");

        assertEquals(1024, new VConsoleConfiguration(overrides).getMaxFileSize());
    }

    @Test
    void testSetPropertyIsVisible() {
        VConsoleConfiguration config = VConsoleConfiguration.defaults();
        config.setProperty(VConsoleConfiguration.DEFAULT_CWD, "/tmp");

        assertEquals("/tmp", config.getDefaultWorkingDirectory());
        assertEquals("/tmp", config.getProperty(VConsoleConfiguration.DEFAULT_CWD));
        assertEquals("fallback", config.getProperty("vconsole.unknown", "fallback"));
        assertNull(config.getProperty("vconsole.unknown"));
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        String key = VConsoleConfiguration.PROMPT;
        String previous = System.getProperty(key);
        System.setProperty(key, "sys> ");
        try {
            assertEquals("sys> ", new VConsoleConfiguration().getPrompt());
        } finally {
            if (previous == null) {
                System.clearProperty(key);
            } else {
                System.setProperty(key, previous);
            }
        }
    }
}
