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

import java.util.List;
import java.util.Map;

/**
 * The part of a console session that built-in commands may change: working
 * directory, environment, aliases and history.
 */
public interface ShellSession {

    String getId();

    String getWorkingDirectory();

    /**
     * Directory that was current before the last successful directory change,
     * or {@code null}.
     */
    String getPreviousDirectory();

    /**
     * Changes the working directory after checking that it exists and is a
     * directory.
     *
     * @param path absolute path or path relative to the working directory
     */
    Future<String> changeDirectory(String path);

    Map<String, String> getEnvironment();

    void setEnvironment(String name, String value);

    boolean unsetEnvironment(String name);

    /**
     * Session aliases, name to replacement text.
     */
    Map<String, String> getAliases();

    void setAlias(String name, String value);

    boolean removeAlias(String name);

    List<String> getHistory();

    void clearHistory();

    CommandRegistry getRegistry();

    /**
     * Asks the host to end the session with the given exit code.
     */
    void requestExit(int exitCode);
}
