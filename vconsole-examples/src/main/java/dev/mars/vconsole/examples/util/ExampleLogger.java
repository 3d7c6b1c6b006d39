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

package dev.mars.vconsole.examples.util;

import dev.mars.vconsole.session.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Console output for the VConsole examples.
 *
 * <p>Formatted text goes to stdout for the reader; the same events are
 * logged through SLF4J so they can be captured by the logging setup.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("My Example");
 * log.step(1, "Starting context...");
 * log.command("$ ", "ls /home", result);
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;

    private ExampleLogger(Class<?> clazz, PrintStream out) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.out = out;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz, System.out);
    }

    public static ExampleLogger getLogger(Class<?> clazz, PrintStream out) {
        return new ExampleLogger(clazz, out);
    }

    /**
     * Example: === My Example ===
     */
    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: {}", title);
    }

    public void section(String title) {
        out.println();
        out.println("--- " + title + " ---");
        logger.debug("Section: {}", title);
    }

    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.info("Step {}: {}", stepNumber, description);
    }

    public void detail(String message) {
        out.println(INDENT + message);
    }

    public void keyValue(String key, Object value) {
        out.println(INDENT + key + ": " + value);
    }

    public void success(String message) {
        out.println(SYMBOL_SUCCESS + " " + message);
        logger.info("Success: {}", message);
    }

    public void failure(String message) {
        out.println(SYMBOL_FAILURE + " " + message);
        logger.warn("Failure: {}", message);
    }

    /**
     * Echoes a command line as typed at the prompt, followed by what it
     * printed and, when it failed, its exit code.
     */
    public void command(String prompt, String input, CommandResult result) {
        out.println(prompt + input);
        out.print(indent(result.getStdoutText()));
        out.print(indent(result.getStderrText()));
        if (!result.isSuccess()) {
            out.println(INDENT + "[exit " + result.getExitCode() + "]");
        }
        logger.debug("'{}' exited with {} in {} ms", input, result.getExitCode(), result.getElapsed().toMillis());
    }

    public void unexpectedError(String context, Throwable t) {
        out.println();
        out.println(SYMBOL_FAILURE + " UNEXPECTED ERROR in " + context + ": " + t.getMessage());
        logger.error("Unexpected error in {}", context, t);
    }

    private static String indent(String text) {
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder indented = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (!line.isEmpty()) {
                indented.append(INDENT).append(line);
            }
            indented.append('\n');
        }
        // split leaves one extra empty element after a trailing newline
        return text.endsWith("\n") ? indented.substring(0, indented.length() - 1) : indented.toString();
    }
}
