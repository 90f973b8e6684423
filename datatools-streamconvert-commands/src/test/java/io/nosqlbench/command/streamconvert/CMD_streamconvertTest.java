package io.nosqlbench.command.streamconvert;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CMD_streamconvertTest {

    @Test
    public void testNoSubcommandPrintsUsage() {
        CommandRunner.Result result = CommandRunner.execute();

        assertEquals(0, result.exitCode());
        for (String sub : new String[]{"run", "split", "verify", "status", "clean"}) {
            assertTrue(result.out().contains(sub), "usage should list subcommand " + sub);
        }
    }

    @Test
    public void testUnknownOptionIsInvalidInput() {
        CommandRunner.Result result = CommandRunner.execute("run", "--no-such-option");

        assertEquals(64, result.exitCode());
        assertTrue(result.err().contains("--no-such-option"));
    }

    @Test
    public void testMissingRequiredOptionIsInvalidInput() {
        CommandRunner.Result result = CommandRunner.execute("run", "--output", "out.jsonl");

        assertEquals(64, result.exitCode());
        assertTrue(result.err().contains("--input"));
    }

    @Test
    public void testVersion() {
        CommandRunner.Result result = CommandRunner.execute("--version");

        assertEquals(0, result.exitCode());
        assertTrue(result.out().startsWith("streamconvert "));
    }
}
