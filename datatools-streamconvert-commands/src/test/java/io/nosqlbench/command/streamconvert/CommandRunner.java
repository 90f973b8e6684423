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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Runs the command line in-process with stdout and stderr captured.
public final class CommandRunner {

    public record Result(int exitCode, String out, String err) {
    }

    private CommandRunner() {
    }

    public static Result execute(String... args) {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        ByteArrayOutputStream errContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = CMD_streamconvert.commandLine().execute(args);
            return new Result(exitCode, outContent.toString(StandardCharsets.UTF_8),
                errContent.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    /// Writes a JSON array of `count` boolean question records, one per line.
    public static Path booleanSource(Path file, int count) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("[\n");
            for (int i = 0; i < count; i++) {
                if (i > 0) {
                    out.write(",\n");
                }
                out.write("  {\"id\":\"t" + i + "\",\"question\":\"Is step " + i + " valid?\",\"correct\":"
                    + (i % 2 == 0) + "}");
            }
            out.write("\n]\n");
        }
        return file;
    }
}
