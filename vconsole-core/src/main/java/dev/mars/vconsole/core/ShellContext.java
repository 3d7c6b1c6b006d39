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

package dev.mars.vconsole.core;

import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.command.builtin.BuiltinCommands;
import dev.mars.vconsole.config.VConsoleConfiguration;
import dev.mars.vconsole.core.event.ObserverRegistry;
import dev.mars.vconsole.core.event.Subscription;
import dev.mars.vconsole.core.exceptions.CommandRegistrationException;
import dev.mars.vconsole.session.ConsoleSession;
import dev.mars.vconsole.session.SessionOptions;
import dev.mars.vconsole.state.StateStoreArena;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import dev.mars.vconsole.vfs.storage.StorageProvider;
import dev.mars.vconsole.vfs.storage.StorageProviderFactory;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one filesystem, one command registry, the session state stores and
 * the sessions running on them. Independent contexts share nothing, so any
 * number can live in one JVM.
 *
 * <pre>{@code
 * ShellContext context = new ShellContext(VConsoleConfiguration.defaults());
 * context.start()
 *     .compose(v -> context.createSession())
 *     .compose(session -> session.execute("ls -l /home/user"))
 *     .onSuccess(result -> System.out.print(result.getStdoutText()));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public class ShellContext {

    private static final Logger logger = LoggerFactory.getLogger(ShellContext.class);

    /**
     * Lifecycle of a context.
     */
    public enum State {
        CREATED,
        STARTING,
        RUNNING,
        STOPPED
    }

    private final VConsoleConfiguration configuration;
    private final VirtualFileSystem vfs;
    private final CommandRegistry registry;
    private final StateStoreArena stateArena;
    private final Vertx vertx;
    private final Map<String, ConsoleSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger nextSessionId = new AtomicInteger();
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final ObserverRegistry<ContextEventType, ContextEvent> observers =
            new ObserverRegistry<>(ContextEventType.class);

    public ShellContext() {
        this(VConsoleConfiguration.defaults());
    }

    public ShellContext(VConsoleConfiguration configuration) {
        this(configuration, StorageProviderFactory.create(configuration), null);
    }

    /**
     * @param rootProvider provider mounted at {@code /}
     * @param vertx used for command timeouts; may be null
     */
    public ShellContext(VConsoleConfiguration configuration, StorageProvider rootProvider, Vertx vertx) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.vfs = new VirtualFileSystem(Objects.requireNonNull(rootProvider, "Root provider cannot be null"),
                configuration);
        this.registry = new CommandRegistry();
        try {
            BuiltinCommands.registerAll(registry);
        } catch (CommandRegistrationException e) {
            throw new IllegalStateException("Built-in commands could not be registered", e);
        }
        this.stateArena = StateStoreArena.fromConfiguration(configuration);
        this.vertx = vertx;
    }

    /**
     * Initializes the filesystem. Sessions can be created once the returned
     * future succeeds.
     */
    public Future<Void> start() {
        if (!state.compareAndSet(State.CREATED, State.STARTING)) {
            return Future.failedFuture(new IllegalStateException("Context cannot be started in state " + state.get()));
        }
        return vfs.initialize()
                .onSuccess(v -> {
                    state.set(State.RUNNING);
                    logger.info("Shell context started with {} commands", registry.list().size());
                    publish(new ContextEvent(ContextEventType.STARTED, null));
                })
                .onFailure(err -> {
                    state.set(State.CREATED);
                    logger.error("Failed to start shell context", err);
                });
    }

    public Future<ConsoleSession> createSession() {
        return createSession(SessionOptions.builder(configuration).build());
    }

    /**
     * Creates and initializes a session. A session id is assigned when the
     * options carry none.
     */
    public Future<ConsoleSession> createSession(SessionOptions options) {
        if (state.get() != State.RUNNING) {
            return Future.failedFuture(new IllegalStateException("Context is not running: " + state.get()));
        }
        String id = options.getId() != null ? options.getId() : "session-" + nextSessionId.incrementAndGet();
        ConsoleSession session;
        try {
            session = new ConsoleSession(id, options, vfs, registry, stateArena, vertx);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        if (sessions.putIfAbsent(id, session) != null) {
            return Future.failedFuture(new IllegalArgumentException("Session already exists: " + id));
        }
        return session.initialize()
                .map(v -> {
                    logger.info("Created session {}", id);
                    publish(new ContextEvent(ContextEventType.SESSION_CREATED, id));
                    return session;
                })
                .onFailure(err -> {
                    sessions.remove(id);
                    logger.warn("Failed to create session {}: {}", id, err.getMessage());
                });
    }

    public Optional<ConsoleSession> getSession(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * Returns the live sessions ordered by id.
     */
    public List<ConsoleSession> listSessions() {
        List<ConsoleSession> list = new ArrayList<>(sessions.values());
        list.sort(Comparator.comparing(ConsoleSession::getId));
        return list;
    }

    /**
     * Destroys a session. Completes with false when no session has that id.
     */
    public Future<Boolean> destroySession(String id) {
        ConsoleSession session = sessions.remove(id);
        if (session == null) {
            return Future.succeededFuture(false);
        }
        return session.destroy().map(v -> {
            publish(new ContextEvent(ContextEventType.SESSION_DESTROYED, id));
            return true;
        });
    }

    /**
     * Destroys every session, flushes the state stores and shuts the
     * filesystem down.
     */
    public Future<Void> shutdown() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return Future.succeededFuture();
        }
        logger.info("Shutting down shell context with {} session(s)", sessions.size());
        List<Future<Boolean>> destroyed = new ArrayList<>();
        for (String id : new ArrayList<>(sessions.keySet())) {
            destroyed.add(destroySession(id));
        }
        return Future.join(destroyed)
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Some sessions failed to shut down cleanly: {}", ar.cause().getMessage());
                    }
                    return stateArena.persistAll();
                })
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Failed to persist state stores: {}", ar.cause().getMessage());
                    }
                    return previous == State.CREATED ? Future.<Void>succeededFuture() : vfs.shutdown();
                })
                .onComplete(ar -> {
                    publish(new ContextEvent(ContextEventType.STOPPED, null));
                    observers.clear();
                    logger.info("Shell context stopped");
                });
    }

    public State getState() {
        return state.get();
    }

    public VConsoleConfiguration getConfiguration() {
        return configuration;
    }

    public VirtualFileSystem getVfs() {
        return vfs;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public StateStoreArena getStateArena() {
        return stateArena;
    }

    public Subscription subscribe(ContextEventType type, Handler<ContextEvent> handler) {
        return observers.subscribe(type, handler);
    }

    public Subscription subscribeAll(Handler<ContextEvent> handler) {
        return observers.subscribeAll(handler);
    }

    private void publish(ContextEvent event) {
        observers.publish(event.type(), event);
    }
}
