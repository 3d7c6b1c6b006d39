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

import com.fasterxml.jackson.core.type.TypeReference;
import dev.mars.vconsole.command.CommandContext;
import dev.mars.vconsole.command.CommandHandler;
import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.command.ExitCode;
import dev.mars.vconsole.command.ShellSession;
import dev.mars.vconsole.core.OperationQueue;
import dev.mars.vconsole.core.event.ObserverRegistry;
import dev.mars.vconsole.core.event.Subscription;
import dev.mars.vconsole.core.exceptions.CommandException;
import dev.mars.vconsole.core.exceptions.ParseException;
import dev.mars.vconsole.core.exceptions.ShellException;
import dev.mars.vconsole.core.exceptions.VfsException;
import dev.mars.vconsole.lang.CommandList;
import dev.mars.vconsole.lang.ParsedCommand;
import dev.mars.vconsole.lang.Parser;
import dev.mars.vconsole.lang.PipelineSegment;
import dev.mars.vconsole.lang.Redirection;
import dev.mars.vconsole.lang.RedirectionType;
import dev.mars.vconsole.lang.Word;
import dev.mars.vconsole.state.StateStore;
import dev.mars.vconsole.state.StateStoreArena;
import dev.mars.vconsole.vfs.VfsPaths;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * One interactive shell: a working directory, an environment, aliases and a
 * history, executing input lines against a shared filesystem and command
 * registry.
 *
 * <p>{@link #execute(String)} never fails. Parse errors, unknown commands,
 * handler failures and timeouts all come back as a {@link CommandResult} with
 * the matching exit code and a message on stderr. Calls are queued, so input
 * B starts only once input A has returned to {@link SessionState#IDLE}.</p>
 *
 * <h3>Execution of one input line:</h3>
 * <ol>
 *   <li>Blank input succeeds at once and is not recorded.</li>
 *   <li>The raw line is added to the history.</li>
 *   <li>The line is parsed into pipelines joined by {@code ;}, {@code &&}
 *       and {@code ||}, run left to right.</li>
 *   <li>Each segment has its aliases replaced, its words expanded, its input
 *       redirection read, and its handler run with the previous segment's
 *       stdout as stdin.</li>
 *   <li>Output redirections send the segment's streams to files or to each
 *       other.</li>
 * </ol>
 *
 * <h3>Persistence:</h3>
 * <p>When enabled, the {@code history}, {@code cwd} and {@code env} keys of
 * the {@code console-<id>} state namespace are read by {@link #initialize()}
 * and written by {@link #destroy()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public class ConsoleSession implements ShellSession {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleSession.class);

    public static final String INTERRUPT_MARKER = "^C";
    public static final String HISTORY_KEY = "history";
    public static final String CWD_KEY = "cwd";
    public static final String ENV_KEY = "env";

    private static final String SHELL_NAME = "vconsole";
    private static final byte[] NO_INPUT = new byte[0];

    private final String id;
    private final SessionOptions options;
    private final VirtualFileSystem vfs;
    private final CommandRegistry registry;
    private final StateStore state;
    private final Vertx vertx;
    private final HistoryBuffer history;
    private final Map<String, String> environment = new LinkedHashMap<>();
    private final Map<String, String> aliases = new TreeMap<>();
    private final ObserverRegistry<SessionEventType, SessionEvent> observers =
            new ObserverRegistry<>(SessionEventType.class);
    private final OperationQueue queue;
    private final StringBuilder interruptOutput = new StringBuilder();

    private volatile SessionState sessionState = SessionState.CREATED;
    private volatile String workingDirectory;
    private volatile String previousDirectory;
    private volatile int lastExitCode;
    private volatile Integer requestedExitCode;

    public ConsoleSession(String id, VirtualFileSystem vfs, CommandRegistry registry) {
        this(id, SessionOptions.defaults(), vfs, registry, new StateStoreArena(), null);
    }

    /**
     * @param vertx used for command timeouts; may be null, in which case
     *        commands run without a time limit
     */
    public ConsoleSession(String id, SessionOptions options, VirtualFileSystem vfs, CommandRegistry registry,
                          StateStoreArena arena, Vertx vertx) {
        this.id = Objects.requireNonNull(id, "Session id cannot be null");
        this.options = Objects.requireNonNull(options, "Session options cannot be null");
        this.vfs = Objects.requireNonNull(vfs, "Virtual filesystem cannot be null");
        this.registry = Objects.requireNonNull(registry, "Command registry cannot be null");
        this.state = arena.store(namespace(id));
        this.vertx = vertx;
        this.history = new HistoryBuffer(options.getHistorySize());
        this.queue = new OperationQueue("session-" + id);
        this.workingDirectory = VfsPaths.resolve(options.getWorkingDirectory());
        this.environment.putAll(options.getEnvironment());

        if (options.getCommandTimeoutMs() > 0 && vertx == null) {
            logger.warn("Session {}: command timeout of {} ms ignored, no Vert.x instance available",
                    id, options.getCommandTimeoutMs());
        }
    }

    /**
     * Returns the state namespace of the session with the given id.
     */
    public static String namespace(String sessionId) {
        return "console-" + sessionId;
    }

    // ===== Lifecycle =====

    /**
     * Restores persisted state when enabled, checks the working directory
     * and moves the session to {@link SessionState#IDLE}.
     */
    public Future<Void> initialize() {
        if (sessionState != SessionState.CREATED) {
            return Future.failedFuture(new IllegalStateException(
                    "Session " + id + " cannot be initialized in state " + sessionState));
        }
        if (options.isPersistenceEnabled()) {
            restoreState();
        }
        return vfs.stat(workingDirectory).transform(ar -> {
            if (ar.failed() || !ar.result().isDirectory()) {
                logger.warn("Session {}: working directory {} is not available, starting in /", id, workingDirectory);
                workingDirectory = VfsPaths.ROOT;
            }
            synchronized (environment) {
                environment.put("PWD", workingDirectory);
            }
            sessionState = SessionState.IDLE;
            logger.info("Session {} ready in {}", id, workingDirectory);
            publish(SessionEvent.of(id, SessionEventType.READY));
            return Future.succeededFuture();
        });
    }

    /**
     * Discards queued input, waits for the running command, writes the
     * persisted state when enabled, and releases all subscribers.
     */
    public Future<Void> destroy() {
        if (sessionState == SessionState.DESTROYED) {
            return Future.succeededFuture();
        }
        publish(SessionEvent.of(id, SessionEventType.DESTROYING));
        queue.discardPending();
        return queue.<Void>submit(() -> options.isPersistenceEnabled() ? persistState() : Future.succeededFuture())
                .recover(err -> {
                    logger.warn("Session {}: failed to persist state: {}", id, err.getMessage());
                    return Future.succeededFuture();
                })
                .onComplete(ar -> {
                    sessionState = SessionState.DESTROYED;
                    publish(SessionEvent.of(id, SessionEventType.DESTROYED));
                    observers.clear();
                    logger.info("Session {} destroyed", id);
                });
    }

    private void restoreState() {
        state.get(HISTORY_KEY, new TypeReference<List<String>>() { }).ifPresent(history::addAll);
        state.get(CWD_KEY, String.class).ifPresent(cwd -> workingDirectory = cwd);
        state.get(ENV_KEY, new TypeReference<List<List<String>>>() { }).ifPresent(pairs -> {
            synchronized (environment) {
                for (List<String> pair : pairs) {
                    if (pair.size() == 2) {
                        environment.put(pair.get(0), pair.get(1));
                    }
                }
            }
        });
        logger.debug("Session {}: restored {} history entries from {}", id, history.size(), state.getNamespace());
    }

    private Future<Void> persistState() {
        List<List<String>> pairs = new ArrayList<>();
        getEnvironment().forEach((name, value) -> pairs.add(List.of(name, value)));
        state.set(HISTORY_KEY, history.toList());
        state.set(CWD_KEY, workingDirectory);
        state.set(ENV_KEY, pairs);
        return state.persist();
    }

    // ===== Execution =====

    /**
     * Runs one line of input. The returned future always succeeds.
     */
    public Future<CommandResult> execute(String input) {
        if (sessionState == SessionState.DESTROYED || sessionState == SessionState.CREATED) {
            String reason = sessionState == SessionState.DESTROYED ? "destroyed" : "not initialized";
            return Future.succeededFuture(CommandResult.failure(ExitCode.ERROR,
                    SHELL_NAME + ": session " + id + " is " + reason + "\n"));
        }
        return queue.submit(() -> process(input)).recover(err -> {
            if (err instanceof CancellationException) {
                return Future.succeededFuture(CommandResult.builder().exitCode(ExitCode.INTERRUPTED).build());
            }
            logger.error("Session {}: unexpected failure executing '{}'", id, input, err);
            return Future.succeededFuture(CommandResult.failure(ExitCode.ERROR,
                    SHELL_NAME + ": " + describe(err) + "\n"));
        });
    }

    /**
     * Marks the input as interrupted: queued input that has not started is
     * discarded and its results complete with exit code 130. A handler that is
     * already running is left to finish.
     */
    public CommandResult interrupt() {
        queue.discardPending();
        synchronized (interruptOutput) {
            interruptOutput.append(INTERRUPT_MARKER).append('\n');
        }
        lastExitCode = ExitCode.INTERRUPTED;
        logger.debug("Session {} interrupted", id);
        return CommandResult.builder()
                .exitCode(ExitCode.INTERRUPTED)
                .stdout(INTERRUPT_MARKER + "\n")
                .build();
    }

    private Future<CommandResult> process(String input) {
        long started = System.nanoTime();
        if (input == null || input.trim().isEmpty()) {
            return Future.succeededFuture(CommandResult.success());
        }
        history.add(input);
        publish(SessionEvent.historyUpdated(id, input));
        // an exit request only stops the rest of the line it was made in
        requestedExitCode = null;

        sessionState = SessionState.RUNNING;
        publish(SessionEvent.commandStart(id, input));
        logger.debug("Session {} executing: {}", id, input);

        Execution execution = new Execution();
        Future<Void> run;
        try {
            run = runList(Parser.parseList(input), execution);
        } catch (ParseException e) {
            execution.err(SHELL_NAME + ": " + e.getMessage() + "\n");
            execution.finish(ExitCode.ERROR);
            run = Future.succeededFuture();
        }

        return run.recover(err -> {
            logger.error("Session {}: failed to execute '{}'", id, input, err);
            execution.err(SHELL_NAME + ": " + describe(err) + "\n");
            execution.finish(ExitCode.ERROR);
            return Future.succeededFuture();
        }).map(v -> {
            lastExitCode = execution.exitCode;
            if (sessionState == SessionState.RUNNING) {
                sessionState = SessionState.IDLE;
            }
            CommandResult result = execution.toResult(Duration.ofNanos(System.nanoTime() - started));
            publish(SessionEvent.commandEnd(id, input, result.getExitCode()));
            return result;
        });
    }

    private Future<Void> runList(CommandList list, Execution execution) {
        Future<Void> chain = Future.succeededFuture();
        for (CommandList.Entry entry : list.entries()) {
            chain = chain.compose(v -> {
                if (requestedExitCode != null || !entry.connector().shouldRun(execution.exitCode)) {
                    return Future.succeededFuture();
                }
                return runPipeline(entry.command(), execution);
            });
        }
        return chain;
    }

    private Future<Void> runPipeline(ParsedCommand command, Execution execution) {
        Expander expander = expander(execution);
        Expander.Scope scope = scope();

        if (command.isEmpty()) {
            // NAME=value on its own sets session variables
            return expandAssignments(command.environment(), expander, scope).map(values -> {
                values.forEach(this::setEnvironment);
                execution.finish(ExitCode.SUCCESS);
                lastExitCode = ExitCode.SUCCESS;
                return null;
            });
        }
        if (command.background()) {
            logger.debug("Session {}: background pipeline runs to completion before returning", id);
        }
        return expandAssignments(command.environment(), expander, scope)
                .compose(leading -> runSegments(command.segments(), leading, null, Set.of(), execution))
                .map(outcome -> {
                    // only the last segment's streams reach the caller
                    execution.out(outcome.stdout());
                    execution.stderr.writeBytes(outcome.stderr());
                    execution.background |= command.background();
                    execution.finish(outcome.exitCode());
                    lastExitCode = outcome.exitCode();
                    return null;
                });
    }

    private Future<Outcome> runSegments(List<PipelineSegment> segments, Map<String, String> leading, byte[] stdin,
                                        Set<String> expandedAliases, Execution execution) {
        // the first segment reads the pipeline input
        Future<Outcome> chain = Future.succeededFuture(new Outcome(ExitCode.SUCCESS, stdin, NO_INPUT));
        for (PipelineSegment segment : segments) {
            chain = chain.compose(previous ->
                    runSegment(segment, leading, previous.stdout(), expandedAliases, execution));
        }
        return chain;
    }

    private Future<Outcome> runSegment(PipelineSegment segment, Map<String, String> leading, byte[] stdin,
                                       Set<String> expandedAliases, Execution execution) {
        String alias = expandedAliases.contains(segment.command()) ? null : aliasFor(segment.command());
        if (alias != null) {
            return runAlias(segment, alias, leading, stdin, expandedAliases, execution);
        }

        Expander expander = expander(execution);
        Expander.Scope scope = scope();
        return prepare(segment, leading, expander, scope).compose(invocation ->
                resolveRedirections(segment.redirections(), expander, scope).compose(redirections ->
                        readInput(redirections, stdin).compose(input -> {
                            if (input.failure() != null) {
                                execution.err(input.failure());
                                return Future.succeededFuture(new Outcome(ExitCode.ERROR, NO_INPUT, NO_INPUT));
                            }
                            return invoke(invocation, input.data())
                                    .compose(streams -> route(redirections, streams, execution));
                        })));
    }

    private Future<Outcome> runAlias(PipelineSegment segment, String alias, Map<String, String> leading,
                                     byte[] stdin, Set<String> expandedAliases, Execution execution) {
        ParsedCommand replacement;
        try {
            replacement = Parser.parse(alias);
        } catch (ParseException e) {
            execution.err(SHELL_NAME + ": alias " + segment.command() + ": " + e.getMessage() + "\n");
            return Future.succeededFuture(new Outcome(ExitCode.ERROR, NO_INPUT, NO_INPUT));
        }
        if (replacement.isEmpty()) {
            return Future.succeededFuture(new Outcome(ExitCode.SUCCESS, NO_INPUT, NO_INPUT));
        }

        // arguments and redirections go to the last segment, assignments to the first
        List<PipelineSegment> segments = new ArrayList<>(replacement.segments());
        PipelineSegment first = segments.get(0);
        Map<String, String> firstEnv = new LinkedHashMap<>(replacement.environment());
        firstEnv.putAll(first.environment());
        firstEnv.putAll(segment.environment());
        segments.set(0, new PipelineSegment(first.command(), first.words(), first.redirections(), firstEnv));

        int lastIndex = segments.size() - 1;
        PipelineSegment last = segments.get(lastIndex);
        List<Word> words = new ArrayList<>(last.words());
        words.addAll(segment.words());
        List<Redirection> redirections = new ArrayList<>(last.redirections());
        redirections.addAll(segment.redirections());
        segments.set(lastIndex, new PipelineSegment(last.command(), words, redirections, last.environment()));

        Set<String> seen = new HashSet<>(expandedAliases);
        seen.add(segment.command());
        return runSegments(segments, leading, stdin, seen, execution);
    }

    private Future<Invocation> prepare(PipelineSegment segment, Map<String, String> leading,
                                       Expander expander, Expander.Scope scope) {
        return expander.expandWord(Word.bare(segment.command()), scope).compose(name ->
                expander.expandWords(segment.words(), scope).compose(args ->
                        expandAssignments(segment.environment(), expander, scope).map(assignments -> {
                            List<String> argv = new ArrayList<>(name);
                            argv.addAll(args);
                            Map<String, String> env = new LinkedHashMap<>(scope.environment());
                            env.putAll(leading);
                            env.putAll(assignments);
                            String commandName = argv.isEmpty() ? "" : argv.remove(0);
                            return new Invocation(commandName, argv, env);
                        })));
    }

    private Future<Map<String, String>> expandAssignments(Map<String, String> assignments, Expander expander,
                                                          Expander.Scope scope) {
        Map<String, String> expanded = new LinkedHashMap<>();
        Future<Void> chain = Future.succeededFuture();
        for (Map.Entry<String, String> assignment : assignments.entrySet()) {
            chain = chain.compose(v -> expander.expandValue(assignment.getValue(), scope))
                    .map(value -> {
                        expanded.put(assignment.getKey(), value);
                        return null;
                    });
        }
        return chain.map(v -> expanded);
    }

    /**
     * Expands redirection targets and makes file targets absolute.
     */
    private Future<List<Redirection>> resolveRedirections(List<Redirection> redirections, Expander expander,
                                                          Expander.Scope scope) {
        List<Redirection> resolved = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (Redirection redirection : redirections) {
            if (redirection.isDescriptor()) {
                chain = chain.map(v -> {
                    resolved.add(redirection);
                    return null;
                });
                continue;
            }
            chain = chain.compose(v -> expander.expandValue(redirection.target(), scope))
                    .map(target -> {
                        resolved.add(Redirection.toFile(redirection.type(), absolute(target)));
                        return null;
                    });
        }
        return chain.map(v -> resolved);
    }

    private String absolute(String target) {
        try {
            return VfsPaths.resolve(workingDirectory, target);
        } catch (IllegalArgumentException e) {
            // left as written; the filesystem reports it as an invalid path
            return target;
        }
    }

    private Future<Input> readInput(List<Redirection> redirections, byte[] piped) {
        Redirection source = null;
        for (Redirection redirection : redirections) {
            if (redirection.type() == RedirectionType.INPUT && !redirection.isDescriptor()) {
                source = redirection;
            }
        }
        if (source == null) {
            return Future.succeededFuture(new Input(piped, null));
        }
        String path = source.target();
        return vfs.readFile(path).transform(ar -> ar.succeeded()
                ? Future.succeededFuture(new Input(ar.result(), null))
                : Future.succeededFuture(new Input(null, SHELL_NAME + ": " + reasonFor(path, ar.cause()) + "\n")));
    }

    private Future<Streams> invoke(Invocation invocation, byte[] stdin) {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        if (invocation.name().isEmpty()) {
            return Future.succeededFuture(new Streams(ExitCode.SUCCESS, NO_INPUT, NO_INPUT));
        }

        CommandHandler handler = registry.get(invocation.name()).orElse(null);
        if (handler == null) {
            logger.debug("Session {}: command not found: {}", id, invocation.name());
            write(stderr, invocation.name() + ": command not found\n");
            return Future.succeededFuture(new Streams(ExitCode.COMMAND_NOT_FOUND, NO_INPUT, stderr.toByteArray()));
        }

        CommandContext context = CommandContext.builder()
                .commandName(invocation.name())
                .args(invocation.args())
                .environment(invocation.environment())
                .workingDirectory(workingDirectory)
                .vfs(vfs)
                .stdin(stdin)
                .stdout(stdout)
                .stderr(stderr)
                .state(state)
                .session(this)
                .build();

        return runHandler(handler, context)
                .map(code -> new Streams(code, stdout.toByteArray(), stderr.toByteArray()));
    }

    private Future<Integer> runHandler(CommandHandler handler, CommandContext context) {
        String name = context.getCommandName();
        Future<Integer> running;
        try {
            handler.beforeExecute(context);
            running = handler.execute(context);
            if (running == null) {
                running = Future.failedFuture(new IllegalStateException("handler returned no result"));
            }
        } catch (RuntimeException e) {
            running = Future.failedFuture(e);
        }

        return withTimeout(name, running).transform(ar -> {
            if (ar.succeeded()) {
                handler.afterExecute(context, ar.result());
                return Future.succeededFuture(ar.result());
            }
            Throwable error = ar.cause();
            int exitCode = error instanceof CommandException ce ? ce.getExitCode() : ExitCode.ERROR;
            if (error instanceof ShellException) {
                logger.debug("Session {}: {} failed: {}", id, name, error.getMessage());
            } else {
                logger.error("Session {}: handler {} crashed", id, name, error);
            }
            handler.onError(context, error);
            context.err(name + ": " + describe(error) + "\n");
            publish(SessionEvent.commandError(id, name, describe(error), exitCode));
            return Future.succeededFuture(exitCode);
        });
    }

    private Future<Integer> withTimeout(String name, Future<Integer> running) {
        long timeoutMs = options.getCommandTimeoutMs();
        if (timeoutMs <= 0 || vertx == null || running.isComplete()) {
            return running;
        }
        Promise<Integer> promise = Promise.promise();
        long timerId = vertx.setTimer(timeoutMs, t -> promise.tryFail(
                new CommandException(name, ExitCode.ERROR, "timed out after " + timeoutMs + " ms")));
        running.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    /**
     * Sends each stream to its final destination. Descriptor 1 and 2 start
     * at the segment's stdout and stderr; each redirection, in order, points
     * one of them at a file or at the current destination of the other.
     */
    private Future<Outcome> route(List<Redirection> redirections, Streams streams, Execution execution) {
        Destination[] destinations = {null, Destination.STDOUT, Destination.STDERR};
        Map<String, FileSink> sinks = new LinkedHashMap<>();
        int exitCode = streams.exitCode();

        for (Redirection redirection : redirections) {
            int source = redirection.sourceDescriptor();
            if (redirection.type() == RedirectionType.INPUT) {
                continue;
            }
            if (redirection.isDescriptor()) {
                int target = redirection.descriptor();
                if (target != 1 && target != 2) {
                    execution.err(SHELL_NAME + ": " + target + ": Bad file descriptor\n");
                    exitCode = ExitCode.ERROR;
                    continue;
                }
                destinations[source] = destinations[target];
            } else {
                String path = redirection.target();
                sinks.computeIfAbsent(path, p -> new FileSink(p, redirection.type().isAppend()));
                destinations[source] = Destination.file(path);
            }
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        deliver(streams.stdout(), destinations[1], stdout, stderr, sinks);
        deliver(streams.stderr(), destinations[2], stdout, stderr, sinks);

        Future<Integer> chain = Future.succeededFuture(exitCode);
        for (FileSink sink : sinks.values()) {
            chain = chain.compose(code -> writeSink(sink).transform(ar -> {
                if (ar.succeeded()) {
                    return Future.succeededFuture(code);
                }
                execution.err(SHELL_NAME + ": " + reasonFor(sink.path(), ar.cause()) + "\n");
                return Future.succeededFuture(ExitCode.ERROR);
            }));
        }
        return chain.map(code -> new Outcome(code, stdout.toByteArray(), stderr.toByteArray()));
    }

    private static void deliver(byte[] data, Destination destination, ByteArrayOutputStream stdout,
                                ByteArrayOutputStream stderr, Map<String, FileSink> sinks) {
        if (destination.path() != null) {
            sinks.get(destination.path()).data().writeBytes(data);
        } else if (destination.descriptor() == 1) {
            stdout.writeBytes(data);
        } else {
            stderr.writeBytes(data);
        }
    }

    private Future<Void> writeSink(FileSink sink) {
        byte[] data = sink.data().toByteArray();
        return sink.append() ? vfs.appendFile(sink.path(), data) : vfs.writeFile(sink.path(), data);
    }

    private Expander expander(Execution execution) {
        return new Expander(vfs, command -> substitute(command, execution));
    }

    /**
     * Runs the text of a command substitution in this session, outside the
     * input queue and the history.
     */
    private Future<String> substitute(String command, Execution parent) {
        CommandList list;
        try {
            list = Parser.parseList(command);
        } catch (ParseException e) {
            parent.err(SHELL_NAME + ": " + e.getMessage() + "\n");
            return Future.succeededFuture("");
        }
        Execution nested = new Execution();
        return runList(list, nested).map(v -> {
            parent.stderr.writeBytes(nested.stderr.toByteArray());
            return nested.stdout.toString(StandardCharsets.UTF_8);
        });
    }

    private Expander.Scope scope() {
        return new Expander.Scope(getEnvironment(), workingDirectory, lastExitCode);
    }

    private String aliasFor(String name) {
        synchronized (aliases) {
            return aliases.get(name);
        }
    }

    private static String reasonFor(String path, Throwable error) {
        if (error instanceof VfsException vfsError) {
            return path + ": " + vfsError.getReason();
        }
        return path + ": " + describe(error);
    }

    private static String describe(Throwable error) {
        if (error instanceof VfsException vfsError) {
            return vfsError.getMessage();
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void write(ByteArrayOutputStream stream, String text) {
        stream.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    // ===== ShellSession =====

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public String getPreviousDirectory() {
        return previousDirectory;
    }

    /**
     * Changes the working directory after checking that the target is a
     * directory. Updates {@code PWD} and {@code OLDPWD}.
     */
    @Override
    public Future<String> changeDirectory(String path) {
        String target;
        try {
            target = VfsPaths.resolve(workingDirectory, path);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(VfsException.invalidPath(path));
        }
        return vfs.stat(target).compose(inode -> {
            if (!inode.isDirectory()) {
                return Future.failedFuture(VfsException.notAFile(target));
            }
            String previous = workingDirectory;
            previousDirectory = previous;
            workingDirectory = target;
            synchronized (environment) {
                environment.put("OLDPWD", previous);
                environment.put("PWD", target);
            }
            logger.debug("Session {}: working directory {} -> {}", id, previous, target);
            publish(SessionEvent.cwdChanged(id, previous, target));
            return Future.succeededFuture(target);
        });
    }

    @Override
    public Map<String, String> getEnvironment() {
        synchronized (environment) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        }
    }

    @Override
    public void setEnvironment(String name, String value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        Objects.requireNonNull(value, "Variable value cannot be null");
        synchronized (environment) {
            environment.put(name, value);
        }
        publish(SessionEvent.envChanged(id, name, value));
    }

    @Override
    public boolean unsetEnvironment(String name) {
        boolean removed;
        synchronized (environment) {
            removed = environment.remove(name) != null;
        }
        if (removed) {
            publish(SessionEvent.envChanged(id, name, null));
        }
        return removed;
    }

    @Override
    public Map<String, String> getAliases() {
        synchronized (aliases) {
            return Collections.unmodifiableMap(new TreeMap<>(aliases));
        }
    }

    @Override
    public void setAlias(String name, String value) {
        Objects.requireNonNull(value, "Alias value cannot be null");
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Alias name cannot be empty");
        }
        synchronized (aliases) {
            aliases.put(name, value);
        }
    }

    @Override
    public boolean removeAlias(String name) {
        synchronized (aliases) {
            return aliases.remove(name) != null;
        }
    }

    @Override
    public List<String> getHistory() {
        return history.toList();
    }

    @Override
    public void clearHistory() {
        history.clear();
        publish(SessionEvent.of(id, SessionEventType.HISTORY_CLEARED));
    }

    @Override
    public CommandRegistry getRegistry() {
        return registry;
    }

    @Override
    public void requestExit(int exitCode) {
        requestedExitCode = exitCode;
        logger.debug("Session {}: exit requested with code {}", id, exitCode);
    }

    // ===== Accessors =====

    /**
     * True when the last input ran {@code exit}. Cleared when the next input
     * starts.
     */
    public boolean isExitRequested() {
        return requestedExitCode != null;
    }

    public OptionalInt getRequestedExitCode() {
        Integer code = requestedExitCode;
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public SessionState getState() {
        return sessionState;
    }

    public SessionOptions getOptions() {
        return options;
    }

    public String getPrompt() {
        return options.getPrompt();
    }

    /**
     * Returns the exit code of the last pipeline, as seen by {@code $?}.
     */
    public int getLastExitCode() {
        return lastExitCode;
    }

    public String getInterruptOutput() {
        synchronized (interruptOutput) {
            return interruptOutput.toString();
        }
    }

    public StateStore getStateStore() {
        return state;
    }

    public VirtualFileSystem getVfs() {
        return vfs;
    }

    public Subscription subscribe(SessionEventType type, Handler<SessionEvent> handler) {
        return observers.subscribe(type, handler);
    }

    public Subscription subscribeAll(Handler<SessionEvent> handler) {
        return observers.subscribeAll(handler);
    }

    private void publish(SessionEvent event) {
        observers.publish(event.type(), event);
    }

    @Override
    public String toString() {
        return "ConsoleSession{" +
                "id='" + id + '\'' +
                ", state=" + sessionState +
                ", cwd='" + workingDirectory + '\'' +
                ", history=" + history.size() +
                '}';
    }

    // ===== Internal types =====

    /**
     * Output collected while one input line runs.
     */
    private static final class Execution {
        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        private int exitCode;
        private boolean background;

        void out(byte[] data) {
            if (data != null) {
                stdout.writeBytes(data);
            }
        }

        void err(String text) {
            write(stderr, text);
        }

        void finish(int code) {
            exitCode = code;
        }

        CommandResult toResult(Duration elapsed) {
            return CommandResult.builder()
                    .exitCode(exitCode)
                    .stdout(stdout.toByteArray())
                    .stderr(stderr.toByteArray())
                    .elapsed(elapsed)
                    .background(background)
                    .build();
        }
    }

    private record Invocation(String name, List<String> args, Map<String, String> environment) {
    }

    private record Input(byte[] data, String failure) {
    }

    private record Streams(int exitCode, byte[] stdout, byte[] stderr) {
    }

    private record Outcome(int exitCode, byte[] stdout, byte[] stderr) {
    }

    private record FileSink(String path, boolean append, ByteArrayOutputStream data) {

        FileSink(String path, boolean append) {
            this(path, append, new ByteArrayOutputStream());
        }
    }

    private record Destination(int descriptor, String path) {

        static final Destination STDOUT = new Destination(1, null);
        static final Destination STDERR = new Destination(2, null);

        static Destination file(String path) {
            return new Destination(0, path);
        }
    }
}
