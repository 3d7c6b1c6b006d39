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

import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.command.builtin.BuiltinCommands;
import dev.mars.vconsole.examples.util.ExampleLogger;
import dev.mars.vconsole.session.CommandResult;
import dev.mars.vconsole.session.ConsoleSession;
import dev.mars.vconsole.vfs.MountPoint;
import dev.mars.vconsole.vfs.VfsEventType;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import dev.mars.vconsole.vfs.storage.MemoryStorageProvider;
import dev.mars.vconsole.vfs.storage.SnapshotStorageProvider;
import io.vertx.core.Future;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Mounts a snapshot-backed provider at {@code /data} next to an in-memory
 * root, writes through a session, and shows that only the mounted tree
 * survives a restart.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class MountedStorageExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(MountedStorageExample.class);

    public static void main(String[] args) {
        try {
            Path snapshot = Files.createTempFile("vconsole-data", ".json");
            Files.delete(snapshot);
            new MountedStorageExample().runExample(snapshot);
            Files.deleteIfExists(snapshot);
        } catch (Exception e) {
            log.unexpectedError("Mounted Storage Example", e);
            System.exit(1);
        }
    }

    /**
     * @return the content of {@code /data/kept.txt} as read after the restart
     */
    public String runExample(Path snapshot) throws Exception {
        log.header("VConsole Mounted Storage Example");

        log.step(1, "First run: writing to / and /data");
        ConsoleSession first = openSession(snapshot);
        for (MountPoint mount : first.getVfs().getMounts()) {
            log.keyValue("Mount " + mount.path(), mount.provider().name() + (mount.readOnly() ? " (ro)" : ""));
        }
        run(first, "echo 'lost on restart' > /tmp/scratch.txt");
        run(first, "echo 'kept on restart' > /data/kept.txt");
        run(first, "cp /tmp/scratch.txt /data/copy.txt");
        await(first.destroy());
        await(first.getVfs().shutdown());
        log.keyValue("Snapshot file", snapshot + " (" + Files.size(snapshot) + " bytes)");

        log.step(2, "Second run: same snapshot, fresh root");
        ConsoleSession second = openSession(snapshot);
        run(second, "ls /data");
        run(second, "cat /tmp/scratch.txt");
        CommandResult kept = run(second, "cat /data/kept.txt");
        await(second.destroy());
        await(second.getVfs().shutdown());

        if (kept.isSuccess()) {
            log.success("Mounted data survived the restart");
        } else {
            log.failure("Mounted data was not restored");
        }
        return kept.getStdoutText();
    }

    private ConsoleSession openSession(Path snapshot) throws Exception {
        VirtualFileSystem vfs = new VirtualFileSystem(new MemoryStorageProvider());
        await(vfs.initialize());
        await(vfs.mount("/data", new SnapshotStorageProvider(snapshot), false));
        vfs.subscribe(VfsEventType.FILE_CREATED, event -> log.detail("(created " + event.path() + ")"));

        CommandRegistry registry = new CommandRegistry();
        BuiltinCommands.registerAll(registry);
        ConsoleSession session = new ConsoleSession("storage", vfs, registry);
        await(session.initialize());
        return session;
    }

    private static CommandResult run(ConsoleSession session, String line) throws Exception {
        CommandResult result = await(session.execute(line));
        log.command(session.getPrompt(), line, result);
        return result;
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}
