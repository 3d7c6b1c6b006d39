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

import dev.mars.vconsole.config.VConsoleConfiguration;
import dev.mars.vconsole.session.CommandResult;
import dev.mars.vconsole.session.ConsoleSession;
import dev.mars.vconsole.session.SessionOptions;
import dev.mars.vconsole.session.SessionState;
import dev.mars.vconsole.vfs.storage.MemoryStorageProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static dev.mars.vconsole.TestFutures.await;
import static dev.mars.vconsole.TestFutures.awaitFailure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ShellContextTest {

    private ShellContext context;

    @BeforeEach
    void setUp() {
        context = new ShellContext(VConsoleConfiguration.defaults(), new MemoryStorageProvider(), null);
    }

    @AfterEach
    void tearDown() throws Exception {
        await(context.shutdown());
    }

    @Test
    void testStart() throws Exception {
        assertEquals(ShellContext.State.CREATED, context.getState());

        await(context.start());

        assertEquals(ShellContext.State.RUNNING, context.getState());
        assertTrue(context.getVfs().isInitialized());
        assertTrue(context.getRegistry().has("echo"));
        assertFalse(context.getStateArena().isDurable());
    }

    @Test
    void testStartTwiceFails() throws Exception {
        await(context.start());

        assertInstanceOf(IllegalStateException.class, awaitFailure(context.start()));
    }

    @Test
    void testCreateSessionBeforeStartFails() throws Exception {
        assertInstanceOf(IllegalStateException.class, awaitFailure(context.createSession()));
    }

    @Test
    void testSessionsShareFilesystem() throws Exception {
        await(context.start());
        ConsoleSession first = await(context.createSession());
        ConsoleSession second = await(context.createSession());

        assertEquals("session-1", first.getId());
        assertEquals("session-2", second.getId());
        assertEquals(SessionState.IDLE, first.getState());

        await(first.execute("echo shared > /tmp/shared.txt"));
        CommandResult result = await(second.execute("cat /tmp/shared.txt"));
        assertEquals("shared\n", result.getStdoutText());
    }

    @Test
    void testSessionsHaveSeparateEnvironments() throws Exception {
        await(context.start());
        ConsoleSession first = await(context.createSession());
        ConsoleSession second = await(context.createSession());

        await(first.execute("export ONLY_FIRST=1"));

        assertEquals("1", first.getEnvironment().get("ONLY_FIRST"));
        assertNull(second.getEnvironment().get("ONLY_FIRST"));
    }

    @Test
    void testExplicitSessionId() throws Exception {
        await(context.start());
        ConsoleSession named = await(context.createSession(SessionOptions.builder().id("ops").build()));

        assertEquals("ops", named.getId());
        assertSame(named, context.getSession("ops").orElseThrow());
        assertInstanceOf(IllegalArgumentException.class,
                awaitFailure(context.createSession(SessionOptions.builder().id("ops").build())));
    }

    @Test
    void testConfigurationDrivesSessionOptions() throws Exception {
        Properties overrides = new Properties();
        overrides.setProperty(VConsoleConfiguration.DEFAULT_CWD, "/tmp");
        overrides.setProperty(VConsoleConfiguration.PROMPT, "vc> ");
        context = new ShellContext(new VConsoleConfiguration(overrides), new MemoryStorageProvider(), null);
        await(context.start());

        ConsoleSession session = await(context.createSession());

        assertEquals("/tmp", session.getWorkingDirectory());
        assertEquals("vc> ", session.getPrompt());
    }

    @Test
    void testDestroySession() throws Exception {
        await(context.start());
        ConsoleSession session = await(context.createSession());

        assertTrue(await(context.destroySession(session.getId())));
        assertFalse(await(context.destroySession(session.getId())));
        assertEquals(SessionState.DESTROYED, session.getState());
        assertTrue(context.getSession(session.getId()).isEmpty());
    }

    @Test
    void testListSessionsSortedById() throws Exception {
        await(context.start());
        await(context.createSession(SessionOptions.builder().id("b").build()));
        await(context.createSession(SessionOptions.builder().id("a").build()));

        List<String> ids = context.listSessions().stream().map(ConsoleSession::getId).collect(Collectors.toList());
        assertEquals(List.of("a", "b"), ids);
    }

    @Test
    void testEvents() throws Exception {
        List<ContextEvent> events = new ArrayList<>();
        context.subscribeAll(events::add);

        await(context.start());
        ConsoleSession session = await(context.createSession());
        await(context.destroySession(session.getId()));
        await(context.shutdown());

        assertThat(events).extracting(ContextEvent::type).containsExactly(
                ContextEventType.STARTED,
                ContextEventType.SESSION_CREATED,
                ContextEventType.SESSION_DESTROYED,
                ContextEventType.STOPPED);
        assertEquals("session-1", events.get(1).sessionId());
    }

    @Test
    void testShutdownDestroysSessions() throws Exception {
        await(context.start());
        ConsoleSession session = await(context.createSession());

        await(context.shutdown());

        assertEquals(ShellContext.State.STOPPED, context.getState());
        assertEquals(SessionState.DESTROYED, session.getState());
        assertTrue(context.listSessions().isEmpty());
        assertFalse(context.getVfs().isInitialized());
        assertInstanceOf(IllegalStateException.class, awaitFailure(context.createSession()));
    }
}
