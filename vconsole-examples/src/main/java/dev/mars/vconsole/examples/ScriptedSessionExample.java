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

package dev.mars.vconsole.examples;

import dev.mars.vconsole.config.VConsoleConfiguration;
import dev.mars.vconsole.core.ShellContext;
import dev.mars.vconsole.examples.util.ExampleLogger;
import dev.mars.vconsole.session.CommandResult;
import dev.mars.vconsole.session.ConsoleSession;
import dev.mars.vconsole.session.SessionEventType;
import dev.mars.vconsole.vfs.storage.MemoryStorageProvider;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed script through one session to show the command language:
 * pipes, redirections, variables, command substitution, globbing, aliases
 * and conditional lists.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class ScriptedSessionExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(ScriptedSessionExample.class);

    static final List<String> SCRIPT = List.of(
            "pwd",
            "cat README.txt | cat -n",
            "mkdir -p projects/demo && cd projects/demo",
            "echo 'first line' > notes.txt",
            "echo \"second line from $USER\" >> notes.txt",
            "cat notes.txt",
            "touch a.log b.log c.txt",
            "echo *.log",
            "NAME=vconsole",
            "echo \"running in $(pwd) as ${NAME}\"",
            "alias ll='ls -l'",
            "ll",
            "cat missing.txt 2>&1 || echo recovered",
            "nosuchcommand",
            "echo last exit was $?",
            "history");

    public static void main(String[] args) {
        try {
            List<CommandResult> results = new ScriptedSessionExample().runExample();
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.success("Script finished: " + results.size() + " commands, " + failed + " with a non-zero exit");
        } catch (Exception e) {
            log.unexpectedError("Scripted Session Example", e);
            System.exit(1);
        }
    }

    public List<CommandResult> runExample() throws Exception {
        log.header("VConsole Scripted Session Example");

        log.step(1, "Starting shell context...");
        ShellContext context = new ShellContext(VConsoleConfiguration.defaults(), new MemoryStorageProvider(), null);
        await(context.start());

        log.step(2, "Creating session...");
        ConsoleSession session = await(context.createSession());
        session.subscribe(SessionEventType.CWD_CHANGED,
                event -> log.detail("(cwd " + event.subject() + " -> " + event.value() + ")"));
        log.keyValue("Session", session.getId());
        log.keyValue("Working directory", session.getWorkingDirectory());

        log.step(3, "Running script...");
        log.section("Transcript");
        List<CommandResult> results = new ArrayList<>();
        for (String line : SCRIPT) {
            CommandResult result = await(session.execute(line));
            log.command(session.getPrompt(), line, result);
            results.add(result);
        }

        log.step(4, "Shutting down...");
        await(context.shutdown());
        return results;
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}
