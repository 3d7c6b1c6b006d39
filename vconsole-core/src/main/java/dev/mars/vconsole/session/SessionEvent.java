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

import java.time.Instant;

/**
 * A session notification.
 *
 * @param sessionId the session that published the event
 * @param type what happened
 * @param subject the input line, directory, or variable name concerned
 * @param value the new value for CWD_CHANGED and ENV_CHANGED, the error
 *        message for COMMAND_ERROR, otherwise null
 * @param exitCode the exit code for COMMAND_END and COMMAND_ERROR, otherwise 0
 * @param timestamp when the event was published
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public record SessionEvent(String sessionId,
                           SessionEventType type,
                           String subject,
                           String value,
                           int exitCode,
                           Instant timestamp) {

    public static SessionEvent of(String sessionId, SessionEventType type) {
        return new SessionEvent(sessionId, type, null, null, 0, Instant.now());
    }

    public static SessionEvent commandStart(String sessionId, String input) {
        return new SessionEvent(sessionId, SessionEventType.COMMAND_START, input, null, 0, Instant.now());
    }

    public static SessionEvent commandEnd(String sessionId, String input, int exitCode) {
        return new SessionEvent(sessionId, SessionEventType.COMMAND_END, input, null, exitCode, Instant.now());
    }

    public static SessionEvent commandError(String sessionId, String command, String message, int exitCode) {
        return new SessionEvent(sessionId, SessionEventType.COMMAND_ERROR, command, message, exitCode, Instant.now());
    }

    public static SessionEvent cwdChanged(String sessionId, String previous, String current) {
        return new SessionEvent(sessionId, SessionEventType.CWD_CHANGED, previous, current, 0, Instant.now());
    }

    /**
     * @param value the new value, or null when the variable was removed
     */
    public static SessionEvent envChanged(String sessionId, String name, String value) {
        return new SessionEvent(sessionId, SessionEventType.ENV_CHANGED, name, value, 0, Instant.now());
    }

    public static SessionEvent historyUpdated(String sessionId, String entry) {
        return new SessionEvent(sessionId, SessionEventType.HISTORY_UPDATED, entry, null, 0, Instant.now());
    }
}
