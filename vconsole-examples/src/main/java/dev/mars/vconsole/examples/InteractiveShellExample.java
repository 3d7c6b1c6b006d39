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
import dev.mars.vconsole.vfs.storage.StorageProviderFactory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A line-oriented shell over stdin and stdout.
 *
 * <p>Configuration is read from {@code vconsole.properties} and system
 * properties, so for example {@code -Dvconsole.storage.backend=snapshot}
 * keeps the filesystem between runs. The loop ends on end of input or when
 * {@code exit} runs, and the process exits with the requested code.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class InteractiveShellExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(InteractiveShellExample.class);

    public static void main(String[] args) {
        VConsoleConfiguration configuration = new VConsoleConfiguration();
        Vertx vertx = Vertx.vertx();
        ShellContext context = new ShellContext(configuration, StorageProviderFactory.create(configuration), vertx);
        int exitCode = 0;
        try {
            await(context.start());
            ConsoleSession session = await(context.createSession());
            System.out.println("VConsole - type 'help' for commands, 'exit' to leave");
            exitCode = repl(session, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    System.out, System.err);
        } catch (Exception e) {
            log.unexpectedError("Interactive Shell", e);
            exitCode = 1;
        } finally {
            try {
                await(context.shutdown());
                await(vertx.close());
            } catch (Exception e) {
                log.failure("Shutdown did not complete: " + e.getMessage());
            }
        }
        System.exit(exitCode);
    }

    /**
     * Reads lines until end of input or an exit request.
     *
     * @return the exit code the shell should end with
     */
    static int repl(ConsoleSession session, BufferedReader in, PrintStream out, PrintStream err)
            throws IOException, InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            out.print(session.getPrompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                return session.getLastExitCode();
            }
            CommandResult result = await(session.execute(line));
            out.print(result.getStdoutText());
            err.print(result.getStderrText());
            out.flush();
            err.flush();
            if (session.isExitRequested()) {
                return session.getRequestedExitCode().orElse(result.getExitCode());
            }
        }
    }

    private static <T> T await(Future<T> future) throws InterruptedException, ExecutionException, TimeoutException {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }
}
