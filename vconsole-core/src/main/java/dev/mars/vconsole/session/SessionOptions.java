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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings a {@link ConsoleSession} is created with.
 *
 * <pre>{@code
 * SessionOptions options = SessionOptions.builder()
 *     .workingDirectory("/tmp")
 *     .environment("EDITOR", "vi")
 *     .historySize(200)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class SessionOptions {

    public static final String DEFAULT_HOME = "/home/user";

    private final String id;
    private final String workingDirectory;
    private final Map<String, String> environment;
    private final int historySize;
    private final boolean persistenceEnabled;
    private final long commandTimeoutMs;
    private final String prompt;

    private SessionOptions(Builder builder) {
        this.id = builder.id;
        this.workingDirectory = builder.workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.historySize = builder.historySize;
        this.persistenceEnabled = builder.persistenceEnabled;
        this.commandTimeoutMs = builder.commandTimeoutMs;
        this.prompt = builder.prompt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder primed with the session defaults of the configuration.
     */
    public static Builder builder(VConsoleConfiguration configuration) {
        return new Builder()
                .workingDirectory(configuration.getDefaultWorkingDirectory())
                .historySize(configuration.getHistoryMaxSize())
                .persistenceEnabled(configuration.isPersistenceEnabled())
                .commandTimeoutMs(configuration.getCommandTimeoutMs())
                .prompt(configuration.getPrompt());
    }

    public static SessionOptions defaults() {
        return builder().build();
    }

    /**
     * Returns the requested id, or null to let the owner assign one.
     */
    public String getId() {
        return id;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public int getHistorySize() {
        return historySize;
    }

    public boolean isPersistenceEnabled() {
        return persistenceEnabled;
    }

    /**
     * Per-command time limit; 0 disables it.
     */
    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public String getPrompt() {
        return prompt;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .workingDirectory(workingDirectory)
                .historySize(historySize)
                .persistenceEnabled(persistenceEnabled)
                .commandTimeoutMs(commandTimeoutMs)
                .prompt(prompt);
        builder.environment.clear();
        builder.environment.putAll(environment);
        return builder;
    }

    @Override
    public String toString() {
        return "SessionOptions{" +
                "id='" + id + '\'' +
                ", workingDirectory='" + workingDirectory + '\'' +
                ", historySize=" + historySize +
                ", persistenceEnabled=" + persistenceEnabled +
                ", commandTimeoutMs=" + commandTimeoutMs +
                '}';
    }

    public static final class Builder {
        private String id;
        private String workingDirectory = DEFAULT_HOME;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private int historySize = HistoryBuffer.DEFAULT_CAPACITY;
        private boolean persistenceEnabled;
        private long commandTimeoutMs;
        private String prompt = "$ ";

        private Builder() {
            environment.put("PATH", "/usr/bin:/bin");
            environment.put("HOME", DEFAULT_HOME);
            environment.put("USER", "user");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
            return this;
        }

        public Builder environment(String name, String value) {
            environment.put(Objects.requireNonNull(name, "Variable name cannot be null"),
                    Objects.requireNonNull(value, "Variable value cannot be null"));
            return this;
        }

        /**
         * Adds the given variables on top of the defaults.
         */
        public Builder environment(Map<String, String> variables) {
            variables.forEach(this::environment);
            return this;
        }

        /**
         * Drops the default variables.
         */
        public Builder clearEnvironment() {
            environment.clear();
            return this;
        }

        public Builder historySize(int historySize) {
            if (historySize <= 0) {
                throw new IllegalArgumentException("History size must be positive: " + historySize);
            }
            this.historySize = historySize;
            return this;
        }

        public Builder persistenceEnabled(boolean persistenceEnabled) {
            this.persistenceEnabled = persistenceEnabled;
            return this;
        }

        public Builder commandTimeoutMs(long commandTimeoutMs) {
            if (commandTimeoutMs < 0) {
                throw new IllegalArgumentException("Command timeout cannot be negative: " + commandTimeoutMs);
            }
            this.commandTimeoutMs = commandTimeoutMs;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = Objects.requireNonNull(prompt, "Prompt cannot be null");
            return this;
        }

        public SessionOptions build() {
            return new SessionOptions(this);
        }
    }
}
