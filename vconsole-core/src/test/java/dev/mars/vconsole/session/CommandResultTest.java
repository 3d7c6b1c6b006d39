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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CommandResultTest {

    @Test
    void testSuccess() {
        CommandResult result = CommandResult.success();

        assertTrue(result.isSuccess());
        assertEquals(0, result.getExitCode());
        assertEquals("", result.getStdoutText());
        assertEquals("", result.getStderrText());
        assertEquals(Duration.ZERO, result.getElapsed());
        assertFalse(result.isBackground());
    }

    @Test
    void testFailure() {
        CommandResult result = CommandResult.failure(127, "x: command not found\n");

        assertFalse(result.isSuccess());
        assertEquals(127, result.getExitCode());
        assertEquals("x: command not found\n", result.getStderrText());
    }

    @Test
    void testOutputIsCopied() {
        byte[] data = "héllo".getBytes(StandardCharsets.UTF_8);
        CommandResult result = CommandResult.builder().stdout(data).build();

        data[0] = 'X';
        result.getStdout()[1] = 'Y';

        assertEquals("héllo", result.getStdoutText());
    }

    @Test
    void testToBuilderAndEquality() {
        CommandResult result = CommandResult.builder()
                .exitCode(2)
                .stdout("out")
                .stderr("err")
                .elapsed(Duration.ofMillis(5))
                .background(true)
                .build();

        CommandResult copy = result.toBuilder().build();

        assertEquals(result, copy);
        assertEquals(result.hashCode(), copy.hashCode());
        assertNotEquals(result, copy.toBuilder().exitCode(3).build());
    }
}
