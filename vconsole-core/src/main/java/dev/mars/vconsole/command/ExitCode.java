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

/**
 * POSIX-flavoured exit codes used by handlers and the session.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public final class ExitCode {

    public static final int SUCCESS = 0;
    public static final int ERROR = 1;
    /** Invalid usage of a command. */
    public static final int MISUSE = 2;
    public static final int COMMAND_NOT_FOUND = 127;
    /** {@code exit} called with a non-numeric argument. */
    public static final int INVALID_EXIT_ARGUMENT = 128;
    /** Terminated by an interrupt. */
    public static final int INTERRUPTED = 130;

    private ExitCode() {
        // Constants class
    }
}
