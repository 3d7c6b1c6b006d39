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

package dev.mars.vconsole.core.event;

import io.vertx.core.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-component registry of event subscribers keyed by event type.
 *
 * <p>Each component (filesystem, command registry, session, context) owns one
 * registry instead of inheriting from a shared emitter. A listener that throws
 * is logged and does not prevent delivery to the remaining listeners.</p>
 *
 * @param <T> the event type enum
 * @param <E> the event payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class ObserverRegistry<T extends Enum<T>, E> {

    private static final Logger logger = LoggerFactory.getLogger(ObserverRegistry.class);

    private final Map<T, List<Handler<E>>> listeners;
    private final List<Handler<E>> wildcardListeners = new CopyOnWriteArrayList<>();

    public ObserverRegistry(Class<T> eventType) {
        this.listeners = new EnumMap<>(eventType);
    }

    /**
     * Subscribes to a single event type.
     *
     * @param type the event type
     * @param handler the listener
     * @return a token that removes the listener
     */
    public Subscription subscribe(T type, Handler<E> handler) {
        List<Handler<E>> list;
        synchronized (listeners) {
            list = listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        }
        list.add(handler);
        return () -> list.remove(handler);
    }

    /**
     * Subscribes to every event type.
     *
     * @param handler the listener
     * @return a token that removes the listener
     */
    public Subscription subscribeAll(Handler<E> handler) {
        wildcardListeners.add(handler);
        return () -> wildcardListeners.remove(handler);
    }

    public void publish(T type, E event) {
        List<Handler<E>> list;
        synchronized (listeners) {
            list = listeners.get(type);
        }
        if (list != null) {
            list.forEach(handler -> deliver(type, handler, event));
        }
        wildcardListeners.forEach(handler -> deliver(type, handler, event));
    }

    public int listenerCount(T type) {
        synchronized (listeners) {
            List<Handler<E>> list = listeners.get(type);
            return list == null ? 0 : list.size();
        }
    }

    public int totalListenerCount() {
        synchronized (listeners) {
            return listeners.values().stream().mapToInt(List::size).sum() + wildcardListeners.size();
        }
    }

    public void clear() {
        synchronized (listeners) {
            listeners.clear();
        }
        wildcardListeners.clear();
    }

    private void deliver(T type, Handler<E> handler, E event) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            logger.warn("Listener for {} failed: {}", type, e.getMessage(), e);
        }
    }
}
