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

import dev.mars.vconsole.state.StateStore;
import dev.mars.vconsole.vfs.VfsPaths;
import dev.mars.vconsole.vfs.VirtualFileSystem;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link CommandHandler} sees while it runs: its expanded
 * arguments, the effective environment, the working directory, the
 * filesystem, an input buffer, output sinks, the session's state store and a
 * handle to the session itself.
 *
 * <p>A context is built per pipeline segment. The environment map is a copy,
 * so handlers that need to change session variables go through
 * {@link #getSession()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class CommandContext {

    private final String commandName;
    private final List<String> args;
    private final Map<String, String> environment;
    private final String workingDirectory;
    private final VirtualFileSystem vfs;
    private final byte[] stdin;
    private final ByteArrayOutputStream stdout;
    private final ByteArrayOutputStream stderr;
    private final StateStore state;
    private final ShellSession session;

    private CommandContext(Builder builder) {
        this.commandName = builder.commandName;
        this.args = List.copyOf(builder.args);
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.workingDirectory = builder.workingDirectory;
        this.vfs = builder.vfs;
        this.stdin = builder.stdin;
        this.stdout = builder.stdout;
        this.stderr = builder.stderr;
        this.state = builder.state;
        this.session = builder.session;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCommandName() {
        return commandName;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public String getEnv(String name, String defaultValue) {
        return environment.getOrDefault(name, defaultValue);
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public VirtualFileSystem getVfs() {
        return vfs;
    }

    public byte[] getStdin() {
        return stdin;
    }

    public String getStdinText() {
        return new String(stdin, StandardCharsets.UTF_8);
    }

    public boolean hasStdin() {
        return stdin.length > 0;
    }

    public ByteArrayOutputStream getStdout() {
        return stdout;
    }

    public ByteArrayOutputStream getStderr() {
        return stderr;
    }

    public StateStore getState() {
        return state;
    }

    /**
     * The owning session, or {@code null} when the command runs detached.
     */
    public ShellSession getSession() {
        return session;
    }

    public void out(String text) {
        stdout.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    public void out(byte[] bytes) {
        stdout.writeBytes(bytes);
    }

    public void err(String text) {
        stderr.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Resolves a path argument against the working directory.
     */
    public String resolvePath(String path) {
        return VfsPaths.resolve(workingDirectory, path);
    }

    public static final class Builder {
        private String commandName = "";
        private List<String> args = List.of();
        private Map<String, String> environment = Map.of();
        private String workingDirectory = VfsPaths.ROOT;
        private VirtualFileSystem vfs;
        private byte[] stdin = new byte[0];
        private ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        private StateStore state;
        private ShellSession session;

        private Builder() {
        }

        public Builder commandName(String commandName) {
            this.commandName = commandName;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder vfs(VirtualFileSystem vfs) {
            this.vfs = vfs;
            return this;
        }

        public Builder stdin(byte[] stdin) {
            this.stdin = stdin == null ? new byte[0] : stdin;
            return this;
        }

        public Builder stdout(ByteArrayOutputStream stdout) {
            this.stdout = stdout;
            return this;
        }

        public Builder stderr(ByteArrayOutputStream stderr) {
            this.stderr = stderr;
            return this;
        }

        public Builder state(StateStore state) {
            this.state = state;
            return this;
        }

        public Builder session(ShellSession session) {
            this.session = session;
            return this;
        }

        public CommandContext build() {
            Objects.requireNonNull(vfs, "vfs");
            return new CommandContext(this);
        }
    }
}
