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

import io.vertx.core.Future;

/**
 * A command that can be registered with the {@link CommandRegistry} and run by
 * a console session.
 *
 * <p>Handlers write their output to the sinks of the {@link CommandContext} and
 * complete the returned future with an exit code. A failed future, or an
 * exception thrown from {@link #execute}, is reported by the session as
 * {@code <name>: <reason>} with exit code 1; throwing a
 * {@link dev.mars.vconsole.core.exceptions.CommandException} selects another
 * code.</p>
 */
public interface CommandHandler {

    /**
     * Name the command is invoked by.
     */
    String name();

    CommandKind kind();

    /**
     * One-line description shown by {@code help}.
     */
    String description();

    /**
     * Usage synopsis, for example {@code ls [-la] [path...]}.
     */
    String usage();

    /**
     * Run the command.
     *
     * @param context arguments, environment, streams and session handle
     * @return future completed with the exit code
     */
    Future<Integer> execute(CommandContext context);

    /**
     * Called before {@link #execute}.
     */
    default void beforeExecute(CommandContext context) {
    }

    /**
     * Called after {@link #execute} completed with an exit code.
     */
    default void afterExecute(CommandContext context, int exitCode) {
    }

    /**
     * Called when {@link #execute} failed.
     */
    default void onError(CommandContext context, Throwable error) {
    }
}
