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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the virtual console.
 * Values are layered: built-in defaults, then the first {@code vconsole.properties}
 * found on disk or the classpath, then {@code vconsole.*} system properties, then
 * explicit overrides passed to the constructor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class VConsoleConfiguration {
    private static final Logger logger = Logger.getLogger(VConsoleConfiguration.class.getName());

    public static final String STORAGE_BACKEND = "vconsole.storage.backend";
    public static final String SNAPSHOT_PATH = "vconsole.storage.snapshot.path";
    public static final String HISTORY_MAX_SIZE = "vconsole.history.max.size";
    public static final String DEFAULT_CWD = "vconsole.session.default.cwd";
    public static final String PROMPT = "vconsole.session.prompt";
    public static final String PERSISTENCE_ENABLED = "vconsole.session.persistence.enabled";
    public static final String STATE_DIRECTORY = "vconsole.state.directory";
    public static final String STANDARD_LAYOUT = "vconsole.vfs.standard.layout";
    public static final String MAX_FILE_SIZE = "vconsole.vfs.max.file.size";
    public static final String COMMAND_TIMEOUT_MS = "vconsole.command.timeout.ms";

    // Default configuration values
    private static final String DEFAULT_STORAGE_BACKEND = "memory";
    private static final String DEFAULT_SNAPSHOT_PATH = "vconsole-vfs.json";
    private static final int DEFAULT_HISTORY_MAX_SIZE = 1000;
    private static final String DEFAULT_WORKING_DIRECTORY = "/home/user";
    private static final String DEFAULT_PROMPT = "$ ";
    private static final long DEFAULT_MAX_FILE_SIZE = 16L * 1024 * 1024; // 16MB
    private static final long DEFAULT_COMMAND_TIMEOUT_MS = 0; // no timeout

    private final Properties properties;

    public VConsoleConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults and the given properties only,
     * ignoring files and system properties.
     */
    public VConsoleConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    /**
     * Returns a configuration made of the defaults alone.
     */
    public static VConsoleConfiguration defaults() {
        return new VConsoleConfiguration(null);
    }

    // Storage Configuration
    public String getStorageBackend() {
        return getStringProperty(STORAGE_BACKEND, DEFAULT_STORAGE_BACKEND);
    }

    public String getSnapshotPath() {
        return getStringProperty(SNAPSHOT_PATH, DEFAULT_SNAPSHOT_PATH);
    }

    // Filesystem Configuration
    public boolean isStandardLayoutEnabled() {
        return getBooleanProperty(STANDARD_LAYOUT, true);
    }

    public long getMaxFileSize() {
        return getLongProperty(MAX_FILE_SIZE, DEFAULT_MAX_FILE_SIZE);
    }

    // Session Configuration
    public int getHistoryMaxSize() {
        int size = getIntProperty(HISTORY_MAX_SIZE, DEFAULT_HISTORY_MAX_SIZE);
        if (size < 1) {
            logger.warning("History size must be positive, got " + size + ". Using default: "
                    + DEFAULT_HISTORY_MAX_SIZE);
            return DEFAULT_HISTORY_MAX_SIZE;
        }
        return size;
    }

    public String getDefaultWorkingDirectory() {
        return getStringProperty(DEFAULT_CWD, DEFAULT_WORKING_DIRECTORY);
    }

    public String getPrompt() {
        return getStringProperty(PROMPT, DEFAULT_PROMPT);
    }

    public boolean isPersistenceEnabled() {
        return getBooleanProperty(PERSISTENCE_ENABLED, false);
    }

    /**
     * Directory for durable session state, or an empty string to keep state in memory.
     */
    public String getStateDirectory() {
        return getStringProperty(STATE_DIRECTORY, "");
    }

    public long getCommandTimeoutMs() {
        return getLongProperty(COMMAND_TIMEOUT_MS, DEFAULT_COMMAND_TIMEOUT_MS);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                        ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(STORAGE_BACKEND, DEFAULT_STORAGE_BACKEND);
        properties.setProperty(SNAPSHOT_PATH, DEFAULT_SNAPSHOT_PATH);
        properties.setProperty(HISTORY_MAX_SIZE, String.valueOf(DEFAULT_HISTORY_MAX_SIZE));
        properties.setProperty(DEFAULT_CWD, DEFAULT_WORKING_DIRECTORY);
        properties.setProperty(PROMPT, DEFAULT_PROMPT);
        properties.setProperty(PERSISTENCE_ENABLED, "false");
        properties.setProperty(STATE_DIRECTORY, "");
        properties.setProperty(STANDARD_LAYOUT, "true");
        properties.setProperty(MAX_FILE_SIZE, String.valueOf(DEFAULT_MAX_FILE_SIZE));
        properties.setProperty(COMMAND_TIMEOUT_MS, String.valueOf(DEFAULT_COMMAND_TIMEOUT_MS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "vconsole.properties",
                "config/vconsole.properties",
                System.getProperty("user.home") + "/.vconsole/vconsole.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("vconsole.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("vconsole."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "VConsoleConfiguration{" +
                "storageBackend='" + getStorageBackend() + '\'' +
                ", historyMaxSize=" + getHistoryMaxSize() +
                ", persistenceEnabled=" + isPersistenceEnabled() +
                ", maxFileSize=" + getMaxFileSize() +
                '}';
    }
}
