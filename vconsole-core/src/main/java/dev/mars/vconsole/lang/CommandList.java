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

package dev.mars.vconsole.lang;

import java.util.List;

/**
 * Pipelines joined by {@code ;}, newlines, {@code &&} and {@code ||}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record CommandList(List<Entry> entries) {

    public CommandList {
        entries = List.copyOf(entries);
    }

    /**
     * How a pipeline is gated on the exit code of the one before it.
     */
    public enum Connector {
        /** Run unconditionally ({@code ;}, newline, or first entry). */
        ALWAYS,
        /** Run only after success ({@code &&}). */
        AND,
        /** Run only after failure ({@code ||}). */
        OR;

        public boolean shouldRun(int previousExitCode) {
            return switch (this) {
                case ALWAYS -> true;
                case AND -> previousExitCode == 0;
                case OR -> previousExitCode != 0;
            };
        }
    }

    public record Entry(Connector connector, ParsedCommand command) {
    }

    public int size() {
        return entries.size();
    }
}
