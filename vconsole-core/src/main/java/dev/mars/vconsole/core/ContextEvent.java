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

import java.time.Instant;

/**
 * @param type what happened
 * @param sessionId the session concerned, or null for context-wide events
 * @param timestamp when the event was published
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public record ContextEvent(ContextEventType type, String sessionId, Instant timestamp) {

    public ContextEvent(ContextEventType type, String sessionId) {
        this(type, sessionId, Instant.now());
    }
}
