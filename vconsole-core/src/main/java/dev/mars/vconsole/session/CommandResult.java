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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

/**
 * Outcome of one {@link ConsoleSession#execute(String)} call.
 *
 * <p>For a pipeline, {@code stdout} is the output of the last segment that
 * was not redirected away; {@code stderr} collects what every segment wrote
 * to its error stream. For a command list the outputs of the pipelines that
 * ran are concatenated and the exit code is that of the last one.</p>
 *
 * <p>Instances are immutable; the byte arrays are copied on the way in and
 * out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class CommandResult {

    private static final byte[] EMPTY = new byte[0];

    private final int exitCode;
    private final byte[] stdout;
    private final byte[] stderr;
    private final Duration elapsed;
    private final boolean background;

    private CommandResult(Builder builder) {
        this.exitCode = builder.exitCode;
        this.stdout = builder.stdout.clone();
        this.stderr = builder.stderr.clone();
        this.elapsed = builder.elapsed;
        this.background = builder.background;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CommandResult success() {
        return builder().build();
    }

    public static CommandResult failure(int exitCode, String stderr) {
        return builder().exitCode(exitCode).stderr(stderr).build();
    }

    public int getExitCode() {
        return exitCode;
    }

    public byte[] getStdout() {
        return stdout.clone();
    }

    public byte[] getStderr() {
        return stderr.clone();
    }

    public String getStdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String getStderrText() {
        return new String(stderr, StandardCharsets.UTF_8);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * True when the input ended with {@code &}. The pipeline still ran to
     * completion before the result was produced.
     */
    public boolean isBackground() {
        return background;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .exitCode(exitCode)
                .stdout(stdout)
                .stderr(stderr)
                .elapsed(elapsed)
                .background(background);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CommandResult that)) {
            return false;
        }
        return exitCode == that.exitCode
                && background == that.background
                && Arrays.equals(stdout, that.stdout)
                && Arrays.equals(stderr, that.stderr)
                && elapsed.equals(that.elapsed);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(exitCode);
        result = 31 * result + Arrays.hashCode(stdout);
        result = 31 * result + Arrays.hashCode(stderr);
        result = 31 * result + elapsed.hashCode();
        return 31 * result + Boolean.hashCode(background);
    }

    @Override
    public String toString() {
        return "CommandResult{" +
                "exitCode=" + exitCode +
                ", stdout=" + stdout.length + " bytes" +
                ", stderr=" + stderr.length + " bytes" +
                ", elapsed=" + elapsed +
                ", background=" + background +
                '}';
    }

    public static final class Builder {
        private int exitCode;
        private byte[] stdout = EMPTY;
        private byte[] stderr = EMPTY;
        private Duration elapsed = Duration.ZERO;
        private boolean background;

        private Builder() {
        }

        public Builder exitCode(int exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder stdout(byte[] stdout) {
            this.stdout = stdout == null ? EMPTY : stdout;
            return this;
        }

        public Builder stdout(String stdout) {
            return stdout(stdout.getBytes(StandardCharsets.UTF_8));
        }

        public Builder stderr(byte[] stderr) {
            this.stderr = stderr == null ? EMPTY : stderr;
            return this;
        }

        public Builder stderr(String stderr) {
            return stderr(stderr.getBytes(StandardCharsets.UTF_8));
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
            return this;
        }

        public Builder background(boolean background) {
            this.background = background;
            return this;
        }

        public CommandResult build() {
            return new CommandResult(this);
        }
    }
}
