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

import dev.mars.vconsole.core.event.ObserverRegistry;
import dev.mars.vconsole.core.event.Subscription;
import dev.mars.vconsole.core.exceptions.CommandRegistrationException;
import io.vertx.core.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Name-keyed registry of {@link CommandHandler}s with one level of aliasing.
 *
 * <p>An alias maps a new name onto a registered command. {@link #get(String)}
 * resolves aliases before looking up commands; an alias never shadows a
 * command of the same name because such aliases are rejected. Unregistering a
 * command drops the aliases pointing at it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class CommandRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CommandHandler> commands = new TreeMap<>();
    private final Map<String, String> aliases = new TreeMap<>();
    private final ObserverRegistry<RegistryEventType, RegistryEvent> events =
            new ObserverRegistry<>(RegistryEventType.class);

    /**
     * Registers a handler under its name.
     *
     * @throws CommandRegistrationException if the name is invalid, already
     *         registered, or currently used by an alias
     */
    public void register(CommandHandler handler) throws CommandRegistrationException {
        String name = handler.name();
        validateName(name);
        synchronized (this) {
            if (commands.containsKey(name)) {
                throw new CommandRegistrationException(name, "Command '" + name + "' is already registered");
            }
            if (aliases.containsKey(name)) {
                throw new CommandRegistrationException(name, "Command '" + name + "' collides with an existing alias");
            }
            commands.put(name, handler);
        }
        logger.debug("Registered command: {} ({})", name, handler.kind());
        events.publish(RegistryEventType.REGISTERED,
                new RegistryEvent(RegistryEventType.REGISTERED, name, null, handler.kind()));
    }

    /**
     * Removes a command and every alias that points at it.
     *
     * @return true if the command was registered
     */
    public boolean unregister(String name) {
        CommandHandler removed;
        List<String> orphaned = new ArrayList<>();
        synchronized (this) {
            removed = commands.remove(name);
            if (removed == null) {
                return false;
            }
            aliases.forEach((alias, target) -> {
                if (target.equals(name)) {
                    orphaned.add(alias);
                }
            });
            orphaned.forEach(aliases::remove);
        }
        logger.debug("Unregistered command: {}", name);
        for (String alias : orphaned) {
            events.publish(RegistryEventType.ALIAS_REMOVED,
                    new RegistryEvent(RegistryEventType.ALIAS_REMOVED, alias, name, CommandKind.ALIAS));
        }
        events.publish(RegistryEventType.UNREGISTERED,
                new RegistryEvent(RegistryEventType.UNREGISTERED, name, null, removed.kind()));
        return true;
    }

    /**
     * Looks up a command by name or alias.
     */
    public synchronized Optional<CommandHandler> get(String name) {
        String resolved = aliases.getOrDefault(name, name);
        return Optional.ofNullable(commands.get(resolved));
    }

    public synchronized boolean has(String name) {
        return commands.containsKey(aliases.getOrDefault(name, name));
    }

    public synchronized boolean isAlias(String name) {
        return aliases.containsKey(name);
    }

    /**
     * Makes {@code aliasName} an alternative name for {@code targetName}.
     * Re-aliasing an existing alias points it at the new target.
     *
     * @throws CommandRegistrationException if {@code aliasName} is a command
     *         name or {@code targetName} is not a registered command
     */
    public void alias(String aliasName, String targetName) throws CommandRegistrationException {
        validateName(aliasName);
        synchronized (this) {
            if (commands.containsKey(aliasName)) {
                throw new CommandRegistrationException(aliasName,
                        "Cannot create alias '" + aliasName + "': command with same name exists");
            }
            if (!commands.containsKey(targetName)) {
                throw new CommandRegistrationException(aliasName,
                        "Cannot create alias for unknown command '" + targetName + "'");
            }
            aliases.put(aliasName, targetName);
        }
        logger.debug("Added alias: {} -> {}", aliasName, targetName);
        events.publish(RegistryEventType.ALIAS_ADDED,
                new RegistryEvent(RegistryEventType.ALIAS_ADDED, aliasName, targetName, CommandKind.ALIAS));
    }

    public boolean unalias(String aliasName) {
        String target;
        synchronized (this) {
            target = aliases.remove(aliasName);
        }
        if (target == null) {
            return false;
        }
        logger.debug("Removed alias: {}", aliasName);
        events.publish(RegistryEventType.ALIAS_REMOVED,
                new RegistryEvent(RegistryEventType.ALIAS_REMOVED, aliasName, target, CommandKind.ALIAS));
        return true;
    }

    /**
     * Returns alias to target, ordered by alias.
     */
    public synchronized Map<String, String> getAliases() {
        return new LinkedHashMap<>(aliases);
    }

    /**
     * Returns the registered command names in lexical order.
     */
    public synchronized List<String> list() {
        return new ArrayList<>(commands.keySet());
    }

    public synchronized List<CommandHandler> getByKind(CommandKind kind) {
        List<CommandHandler> result = new ArrayList<>();
        for (CommandHandler handler : commands.values()) {
            if (handler.kind() == kind) {
                result.add(handler);
            }
        }
        return result;
    }

    /**
     * Returns the command and alias names starting with {@code prefix}, sorted.
     */
    public synchronized List<String> getCompletions(String prefix) {
        String p = prefix == null ? "" : prefix;
        List<String> completions = new ArrayList<>();
        for (String name : commands.keySet()) {
            if (name.startsWith(p)) {
                completions.add(name);
            }
        }
        for (String alias : aliases.keySet()) {
            if (alias.startsWith(p)) {
                completions.add(alias);
            }
        }
        completions.sort(String::compareTo);
        return completions;
    }

    public synchronized RegistryStats getStats() {
        Map<CommandKind, Integer> byKind = new EnumMap<>(CommandKind.class);
        for (CommandHandler handler : commands.values()) {
            byKind.merge(handler.kind(), 1, Integer::sum);
        }
        return new RegistryStats(commands.size(), aliases.size(), byKind);
    }

    public Subscription subscribe(RegistryEventType type, Handler<RegistryEvent> handler) {
        return events.subscribe(type, handler);
    }

    public Subscription subscribeAll(Handler<RegistryEvent> handler) {
        return events.subscribeAll(handler);
    }

    /**
     * Removes every command and alias without publishing events.
     */
    public synchronized void clear() {
        commands.clear();
        aliases.clear();
    }

    private static void validateName(String name) throws CommandRegistrationException {
        if (name == null || name.isBlank()) {
            throw new CommandRegistrationException(String.valueOf(name), "Command name cannot be empty");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || "|&;<>()$`\\\"'=/".indexOf(c) >= 0) {
                throw new CommandRegistrationException(name, "Invalid command name: " + name);
            }
        }
    }
}
