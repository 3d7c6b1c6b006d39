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

package dev.mars.vconsole.command.builtin;

import dev.mars.vconsole.command.CommandRegistry;
import dev.mars.vconsole.session.CommandResult;
import dev.mars.vconsole.session.ConsoleSession;
import dev.mars.vconsole.vfs.VirtualFileSystem;
import dev.mars.vconsole.vfs.storage.MemoryStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static dev.mars.vconsole.TestFutures.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the built-in commands through a session, the way a user would.
 */
class BuiltinCommandsTest {

    private VirtualFileSystem vfs;
    private CommandRegistry registry;
    private ConsoleSession session;

    @BeforeEach
    void setUp() throws Exception {
        vfs = new VirtualFileSystem(new MemoryStorageProvider());
        await(vfs.initialize());
        registry = new CommandRegistry();
        BuiltinCommands.registerAll(registry);
        session = new ConsoleSession("test", vfs, registry);
        await(session.initialize());
    }

    private CommandResult run(String input) throws Exception {
        return await(session.execute(input));
    }

    @Test
    void testAllBuiltinsAreRegistered() {
        assertThat(registry.list()).containsExactly(
                "alias", "cat", "cd", "clear", "cp", "date", "echo", "env", "exit", "export", "false",
                "help", "history", "ls", "mkdir", "mv", "pwd", "rm", "test", "touch", "true", "unalias",
                "unset", "which");
    }

    @Test
    void testTrueAndFalse() throws Exception {
        assertEquals(0, run("true").getExitCode());
        assertEquals(1, run("false").getExitCode());
    }

    @Nested
    @DisplayName("echo")
    class Echo {

        @Test
        void testJoinsArgumentsWithSpaces() throws Exception {
            assertEquals("hello  world\n", run("echo 'hello ' world").getStdoutText());
        }

        @Test
        void testNoNewlineFlag() throws Exception {
            assertEquals("hi", run("echo -n hi").getStdoutText());
        }

        @Test
        void testEscapesWithE() throws Exception {
            assertEquals("a\tb\n", run("echo -e 'a\\tb'").getStdoutText());
            assertEquals("a\\tb\n", run("echo 'a\\tb'").getStdoutText());
        }

        @Test
        void testUnknownFlagIsPrinted() throws Exception {
            assertEquals("-x y\n", run("echo -x y").getStdoutText());
        }

        @Test
        void testInterpretEscapes() {
            assertEquals("A", EchoCommand.interpretEscapes("\\x41"));
            assertEquals("A", EchoCommand.interpretEscapes("\\0101"));
            assertEquals("\\q", EchoCommand.interpretEscapes("\\q"));
        }
    }

    @Nested
    @DisplayName("cd and pwd")
    class Directories {

        @Test
        void testCdChangesWorkingDirectory() throws Exception {
            assertEquals("/home/user\n", run("pwd").getStdoutText());
            assertEquals(0, run("cd /tmp").getExitCode());
            assertEquals("/tmp\n", run("pwd").getStdoutText());
            assertEquals("/tmp", session.getEnvironment().get("PWD"));
            assertEquals("/home/user", session.getEnvironment().get("OLDPWD"));
        }

        @Test
        void testCdDashReturnsAndPrints() throws Exception {
            run("cd /etc");
            CommandResult back = run("cd -");

            assertEquals("/home/user\n", back.getStdoutText());
            assertEquals("/home/user", session.getWorkingDirectory());
        }

        @Test
        void testCdWithoutArgumentGoesHome() throws Exception {
            run("cd /");
            run("cd");
            assertEquals("/home/user", session.getWorkingDirectory());
        }

        @Test
        void testCdToMissingDirectory() throws Exception {
            CommandResult result = run("cd /nope");

            assertEquals(1, result.getExitCode());
            assertEquals("cd: /nope: No such file or directory\n", result.getStderrText());
        }

        @Test
        void testCdToFile() throws Exception {
            CommandResult result = run("cd README.txt");

            assertEquals(1, result.getExitCode());
            assertEquals("cd: README.txt: Not a directory\n", result.getStderrText());
        }

        @Test
        void testCdDashWithoutPreviousDirectory() throws Exception {
            CommandResult result = run("cd -");
            assertEquals("cd: OLDPWD not set\n", result.getStderrText());
        }
    }

    @Nested
    @DisplayName("Files")
    class Files {

        @Test
        void testCatFileAndStdin() throws Exception {
            await(vfs.writeTextFile("/tmp/f", "one\ntwo\n"));

            assertEquals("one\ntwo\n", run("cat /tmp/f").getStdoutText());
            assertEquals("     1\tone\n     2\ttwo\n", run("cat -n /tmp/f").getStdoutText());
            assertEquals("one\ntwo\n", run("cat /tmp/f | cat").getStdoutText());
        }

        @Test
        void testCatMissingFile() throws Exception {
            CommandResult result = run("cat /missing");

            assertEquals(1, result.getExitCode());
            assertEquals("cat: /missing: No such file or directory\n", result.getStderrText());
        }

        @Test
        void testCatFormatting() {
            CatCommand.Options squeeze = new CatCommand.Options(false, false, true, false, true);
            assertEquals("a$\n$\nb$\n", CatCommand.format("a\n\n\nb\n", squeeze, new CatCommand.LineCounter()));

            CatCommand.Options nonBlank = new CatCommand.Options(false, true, false, false, false);
            assertEquals("     1\ta\n\n     2\tb", CatCommand.format("a\n\nb", nonBlank, new CatCommand.LineCounter()));
        }

        @Test
        void testMkdirTouchLsRm() throws Exception {
            assertEquals(0, run("mkdir -p /work/src").getExitCode());
            assertEquals(0, run("touch /work/src/Main.java /work/notes").getExitCode());

            assertEquals("notes  src\n", run("ls /work").getStdoutText());
            assertEquals("Main.java\n", run("ls /work/src").getStdoutText());

            assertEquals(1, run("rm /work/src").getExitCode());
            assertEquals(0, run("rm -r /work/src").getExitCode());
            assertEquals("notes\n", run("ls /work").getStdoutText());
        }

        @Test
        void testMkdirExistingDirectory() throws Exception {
            CommandResult result = run("mkdir /tmp");

            assertEquals(1, result.getExitCode());
            assertEquals("mkdir: cannot create directory '/tmp': File exists\n", result.getStderrText());
            assertEquals(0, run("mkdir -p /tmp").getExitCode());
        }

        @Test
        void testMkdirWithoutOperandIsMisuse() throws Exception {
            assertEquals(2, run("mkdir").getExitCode());
        }

        @Test
        void testRmForceIgnoresMissing() throws Exception {
            assertEquals(0, run("rm -f /nothing").getExitCode());
            assertEquals(1, run("rm /nothing").getExitCode());
        }

        @Test
        void testLsHidesDotFilesUnlessAll() throws Exception {
            await(vfs.writeTextFile("/tmp/.hidden", ""));
            await(vfs.writeTextFile("/tmp/shown", ""));

            assertEquals("shown\n", run("ls /tmp").getStdoutText());
            assertEquals(".hidden\nshown\n", run("ls -a1 /tmp").getStdoutText());
        }

        @Test
        void testLsLongFormat() throws Exception {
            String listing = run("ls -l /home/user").getStdoutText();

            assertThat(listing).startsWith("-rw-r--r--");
            assertThat(listing).contains("user").endsWith("README.txt\n");
        }

        @Test
        void testLsMissingPath() throws Exception {
            CommandResult result = run("ls /nope");
            assertEquals("ls: cannot access '/nope': No such file or directory\n", result.getStderrText());
        }

        @Test
        void testCpFileAndTree() throws Exception {
            assertEquals(0, run("cp README.txt /tmp/copy.txt").getExitCode());
            assertThat(await(vfs.readTextFile("/tmp/copy.txt"))).contains("Welcome");

            assertEquals(1, run("cp /home /tmp/h").getExitCode());
            assertEquals(0, run("cp -r /home /tmp/h").getExitCode());
            assertTrue(await(vfs.exists("/tmp/h/user/README.txt")));
        }

        @Test
        void testCpIntoItselfFails() throws Exception {
            run("mkdir /tmp/d");
            CommandResult result = run("cp -r /tmp/d /tmp/d/inner");

            assertEquals(1, result.getExitCode());
            assertThat(result.getStderrText()).contains("into itself");
        }

        @Test
        void testMvRenamesAndMovesIntoDirectory() throws Exception {
            run("touch /tmp/a");
            assertEquals(0, run("mv /tmp/a /tmp/b").getExitCode());
            assertEquals(0, run("mv /tmp/b /var").getExitCode());

            assertFalse(await(vfs.exists("/tmp/b")));
            assertTrue(await(vfs.exists("/var/b")));
        }

        @Test
        void testMvManySourcesNeedsDirectory() throws Exception {
            run("touch /tmp/a /tmp/b");
            CommandResult result = run("mv /tmp/a /tmp/b /tmp/c");

            assertEquals(1, result.getExitCode());
            assertEquals("mv: target '/tmp/c' is not a directory\n", result.getStderrText());
        }
    }

    @Nested
    @DisplayName("Environment")
    class Environment {

        @Test
        void testExportAndUnset() throws Exception {
            run("export GREETING=hello");
            assertEquals("hello", session.getEnvironment().get("GREETING"));
            assertEquals("hello\n", run("echo $GREETING").getStdoutText());

            run("unset GREETING");
            assertFalse(session.getEnvironment().containsKey("GREETING"));
        }

        @Test
        void testExportListsDeclarations() throws Exception {
            assertThat(run("export").getStdoutText()).contains("declare -x HOME=\"/home/user\"\n");
        }

        @Test
        void testExportRejectsBadIdentifier() throws Exception {
            CommandResult result = run("export 1A=x");
            assertEquals(1, result.getExitCode());
            assertEquals("export: `1A=x': not a valid identifier\n", result.getStderrText());
        }

        @Test
        void testEnvPrintsSortedWithOverrides() throws Exception {
            String output = run("env EXTRA=1").getStdoutText();

            assertThat(output).contains("EXTRA=1\n", "HOME=/home/user\n", "USER=user\n");
            assertThat(output.indexOf("EXTRA=")).isLessThan(output.indexOf("HOME="));
            assertFalse(session.getEnvironment().containsKey("EXTRA"));
        }

        @Test
        void testEnvIgnoreEnvironment() throws Exception {
            assertEquals("ONLY=1\n", run("env -i ONLY=1").getStdoutText());
        }

        @Test
        void testEnvCannotRunCommands() throws Exception {
            assertEquals(2, run("env ls").getExitCode());
        }
    }

    @Nested
    @DisplayName("Aliases")
    class Aliases {

        @Test
        void testDefineListAndRemove() throws Exception {
            run("alias ll='ls -l'");
            assertEquals("alias ll='ls -l'\n", run("alias").getStdoutText());
            assertEquals("alias ll='ls -l'\n", run("alias ll").getStdoutText());

            assertEquals(0, run("unalias ll").getExitCode());
            assertEquals(1, run("unalias ll").getExitCode());
        }

        @Test
        void testRegistryAliasesAreListed() throws Exception {
            registry.alias("dir", "ls");
            assertEquals("alias dir='ls'\n", run("alias").getStdoutText());
            assertEquals("dir: aliased to ls\n", run("which dir").getStdoutText());
        }

        @Test
        void testUnaliasAll() throws Exception {
            session.setAlias("a", "true");
            session.setAlias("b", "false");
            run("unalias -a");
            assertTrue(session.getAliases().isEmpty());
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        void testHistoryListsNumberedEntries() throws Exception {
            run("echo a");
            run("echo b");

            assertEquals("    1  echo a\n    2  echo b\n    3  history\n", run("history").getStdoutText());
            assertEquals("    4  history 1\n", run("history 1").getStdoutText());
        }

        @Test
        void testHistoryClear() throws Exception {
            run("echo a");
            run("history -c");
            assertEquals(List.of(), session.getHistory());
        }

        @Test
        void testHistoryRejectsNonNumeric() throws Exception {
            assertEquals("history: x: numeric argument required\n", run("history x").getStderrText());
        }
    }

    @Nested
    @DisplayName("test")
    class Conditions {

        @Test
        void testFilePredicates() throws Exception {
            run("touch /tmp/empty");

            assertEquals(0, run("test -e README.txt").getExitCode());
            assertEquals(0, run("test -f /home/user/README.txt").getExitCode());
            assertEquals(1, run("test -d README.txt").getExitCode());
            assertEquals(0, run("test -d /tmp").getExitCode());
            assertEquals(0, run("test -s README.txt").getExitCode());
            assertEquals(1, run("test -s /tmp/empty").getExitCode());
            assertEquals(0, run("test -r /tmp/empty").getExitCode());
            assertEquals(1, run("test -x /tmp/empty").getExitCode());
            assertEquals(1, run("test -e /nope").getExitCode());
            assertEquals(1, run("test -f /nope").getExitCode());
        }

        @Test
        void testSymbolicLinkPredicates() throws Exception {
            await(vfs.symlink("/home/user/README.txt", "/tmp/readme"));

            assertEquals(0, run("test -L /tmp/readme").getExitCode());
            assertEquals(0, run("test -h /tmp/readme").getExitCode());
            assertEquals(1, run("test -L README.txt").getExitCode());
            assertEquals(0, run("test -f /tmp/readme").getExitCode());
            assertEquals(0, run("test /tmp/readme -ef README.txt").getExitCode());
            assertEquals(1, run("test /tmp -ef README.txt").getExitCode());
            assertEquals(1, run("test /nope -nt README.txt").getExitCode());
        }

        @Test
        void testStringComparisons() throws Exception {
            assertEquals(0, run("test abc").getExitCode());
            assertEquals(1, run("test").getExitCode());
            assertEquals(0, run("test -n abc").getExitCode());
            assertEquals(1, run("test -z abc").getExitCode());
            assertEquals(0, run("test abc = abc").getExitCode());
            assertEquals(0, run("test abc == abc").getExitCode());
            assertEquals(0, run("test abc != abd").getExitCode());
            assertEquals(1, run("test abc = abd").getExitCode());
        }

        @Test
        void testIntegerComparisons() throws Exception {
            assertEquals(0, run("test 5 -gt 3").getExitCode());
            assertEquals(1, run("test 5 -lt 3").getExitCode());
            assertEquals(0, run("test 3 -le 3").getExitCode());
            assertEquals(0, run("test 3 -ge 3").getExitCode());
            assertEquals(0, run("test 10 -eq 10").getExitCode());
            assertEquals(0, run("test 10 -ne 11").getExitCode());
        }

        @Test
        void testNegation() throws Exception {
            assertEquals(1, run("test ! -d /tmp").getExitCode());
            assertEquals(0, run("test ! -e /nope").getExitCode());
        }

        @Test
        void testMalformedExpressions() throws Exception {
            CommandResult notANumber = run("test abc -gt 3");
            assertEquals(2, notANumber.getExitCode());
            assertThat(notANumber.getStderrText()).startsWith("test: integer expression expected: abc\n");

            CommandResult unknown = run("test -q x");
            assertEquals(2, unknown.getExitCode());
            assertThat(unknown.getStderrText()).startsWith("test: unknown unary operator: -q\n");

            assertEquals(2, run("test a b c d").getExitCode());
        }

        @Test
        void testDrivesConditionalLists() throws Exception {
            CommandResult result = run("test -d /tmp && echo dir || echo other");
            assertEquals("dir\n", result.getStdoutText());

            result = run("test -d README.txt && echo dir || echo other");
            assertEquals("other\n", result.getStdoutText());
        }
    }

    @Nested
    @DisplayName("Help and which")
    class Help {

        @Test
        void testHelpListsCommands() throws Exception {
            String output = run("help").getStdoutText();

            assertThat(output).startsWith("Available commands:\n\n");
            assertThat(output).contains("  ls           List directory contents\n");
        }

        @Test
        void testHelpForOneCommand() throws Exception {
            assertEquals("ls - List directory contents\n\nUsage: ls [-laAhtr1] [FILE]...\n",
                    run("help ls").getStdoutText());
            assertEquals(1, run("help nothing").getExitCode());
        }

        @Test
        void testHelpFlag() throws Exception {
            assertEquals("pwd - Print the working directory\n\nUsage: pwd\n", run("pwd --help").getStdoutText());
        }

        @Test
        void testWhich() throws Exception {
            session.setAlias("greet", "echo hi");

            assertEquals("ls: shell built-in command\ngreet: aliased to echo hi\n",
                    run("which ls greet").getStdoutText());
            CommandResult missing = run("which nope");
            assertEquals(1, missing.getExitCode());
            assertEquals("which: nope: not found\n", missing.getStderrText());
        }
    }

    @Nested
    @DisplayName("exit, clear and date")
    class Misc {

        @Test
        void testExitRequestsExit() throws Exception {
            CommandResult result = run("exit 3");

            assertEquals(3, result.getExitCode());
            assertTrue(session.isExitRequested());
            assertEquals(3, session.getRequestedExitCode().getAsInt());
        }

        @Test
        void testExitWrapsCode() throws Exception {
            assertEquals(1, run("exit 257").getExitCode());
        }

        @Test
        void testExitRejectsNonNumeric() throws Exception {
            CommandResult result = run("exit abc");

            assertEquals(128, result.getExitCode());
            assertEquals("exit: abc: numeric argument required\n", result.getStderrText());
            assertFalse(session.isExitRequested());
        }

        @Test
        void testClearWritesEscapeSequence() throws Exception {
            assertEquals(ClearCommand.CLEAR_SEQUENCE, run("clear").getStdoutText());
        }

        @Test
        void testDateCustomFormat() {
            ZonedDateTime time = ZonedDateTime.of(2025, 3, 7, 9, 5, 2, 0, ZoneOffset.UTC);

            assertEquals("2025-03-07 09:05:02", DateCommand.formatCustom(time, "%Y-%m-%d %H:%M:%S"));
            assertEquals("Fri Mar 100%", DateCommand.formatCustom(time, "%a %b 100%%"));
            assertEquals("%q", DateCommand.formatCustom(time, "%q"));
        }

        @Test
        void testDatePrintsOneLine() throws Exception {
            CommandResult result = run("date -u +%Y");
            assertThat(result.getStdoutText()).matches("\\d{4}\n");
        }
    }
}
