package io.nosqlbench.command.streamconvert.subcommands;

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

import io.nosqlbench.command.streamconvert.CommandRunner;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CMD_streamconvert_splitTest {

    @TempDir
    Path tempDir;

    @Test
    void splitsIntoChunkFilesAndPrintsPlan() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 10);
        Path chunks = tempDir.resolve("chunks");

        CommandRunner.Result result = CommandRunner.execute("split", "--input", source.toString(),
            "--chunk-dir", chunks.toString(), "--max-objects-per-chunk", "3");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("chunk-000001.json  records [0,3)")
            .contains("chunk-000004.json  records [9,10)")
            .contains("10 records in 4 chunks");
        try (Stream<Path> files = Files.list(chunks)) {
            assertThat(files).hasSize(4);
        }
    }

    @Test
    void defaultChunkDirIsNextToTheSource() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 4);

        CommandRunner.Result result = CommandRunner.execute("split", "-i", source.toString(), "-q");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEmpty();
        assertThat(tempDir.resolve("source.json.chunks").resolve("chunk-000001.json")).exists();
    }

    @Test
    void truncatedSourceExitsWithDataIntegrity() throws Exception {
        Path source = Files.writeString(tempDir.resolve("broken.json"), "[{\"a\":1},{\"a\":");

        CommandRunner.Result result = CommandRunner.execute("split", "-i", source.toString(),
            "--chunk-dir", tempDir.resolve("chunks").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("byte offset 9");
    }

    @Test
    void zeroObjectLimitIsInvalidInput() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 4);

        CommandRunner.Result result = CommandRunner.execute("split", "-i", source.toString(),
            "--max-objects-per-chunk", "0");

        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.err()).contains("max_objects_per_chunk must be positive");
    }
}
