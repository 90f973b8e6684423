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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.command.streamconvert.CommandRunner;
import io.nosqlbench.streamconvert.checkpoint.CheckpointLog;
import io.nosqlbench.streamconvert.pipeline.PipelineOrchestrator;
import io.nosqlbench.streamconvert.pipeline.WorkDirectory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CMD_streamconvert_runTest {

    @TempDir
    Path tempDir;

    private String[] runArgs(Path source, Path output, String... extra) {
        String[] base = {"run", "--input", source.toString(), "--output", output.toString(),
            "--memory-ceiling", "2GiB", "--per-worker-memory", "16MiB", "--workers", "2", "--transformer", "boolean"};
        String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    private static long checkpointCount(Path output) throws Exception {
        WorkDirectory work = CMD_streamconvert_status.resolve(output);
        return CheckpointLog.inspect(work.sealedCheckpointLog(), c -> { }).checkpointCount();
    }

    @Test
    void convertsSourceAndPrintsSummary() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 10);
        Path output = tempDir.resolve("dataset.jsonl");

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, output, "--max-objects-per-chunk", "3"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("COMPLETED (exit 0)").contains("10 in 4 chunks");
        assertThat(Files.readAllLines(output)).hasSize(10);
        assertThat(PipelineOrchestrator.reportFileFor(output)).exists();
        assertThat(checkpointCount(output)).isEqualTo(4);
    }

    @Test
    void jsonSummary() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 5);
        Path output = tempDir.resolve("dataset.jsonl");

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, output, "--json"));

        assertThat(result.exitCode()).isZero();
        JsonObject summary = JsonParser.parseString(result.out()).getAsJsonObject();
        assertThat(summary.get("state").getAsString()).isEqualTo("COMPLETED");
        assertThat(summary.get("integrity_score").getAsDouble()).isEqualTo(1.0);
        assertThat(summary.get("total_records").getAsLong()).isEqualTo(5);
    }

    @Test
    void commandLineOverridesConfigFile() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 10);
        Path output = tempDir.resolve("dataset.jsonl");
        Path config = tempDir.resolve("pipeline.yaml");
        Files.writeString(config, "max_objects_per_chunk: 3\nfailure_rate_threshold: 0.5\n");

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, output,
            "--config", config.toString(), "--max-objects-per-chunk", "5", "-q"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEmpty();
        assertThat(checkpointCount(output)).isEqualTo(2);
    }

    @Test
    void configFileValuesApply() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 10);
        Path output = tempDir.resolve("dataset.jsonl");
        Path config = tempDir.resolve("pipeline.yaml");
        Files.writeString(config, "max_objects_per_chunk: 3\n");

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, output, "--config", config.toString()));

        assertThat(result.exitCode()).isZero();
        assertThat(checkpointCount(output)).isEqualTo(4);
    }

    @Test
    void invalidSettingIsInvalidInput() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 3);

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, tempDir.resolve("dataset.jsonl"),
            "--failure-rate-threshold", "2"));

        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.err()).contains("failure_rate_threshold");
    }

    @Test
    void badSizeIsInvalidInput() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 3);

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, tempDir.resolve("dataset.jsonl"),
            "--max-chunk-bytes", "lots"));

        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.err()).contains("invalid size value 'lots'");
    }

    @Test
    void unknownTransformerIsInvalidInput() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 3);

        CommandRunner.Result result = CommandRunner.execute(runArgs(source, tempDir.resolve("dataset.jsonl"),
            "--transformer", "telepathy"));

        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.err()).contains("unknown transformer 'telepathy'");
    }

    @Test
    void missingSourceExitsWithDataIntegrity() {
        CommandRunner.Result result = CommandRunner.execute(runArgs(tempDir.resolve("absent.json"),
            tempDir.resolve("dataset.jsonl")));

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).contains("source file not found").contains("remediation:");
    }

    @Test
    void noResumeStartsOver() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 6);
        Path output = tempDir.resolve("dataset.jsonl");
        assertThat(CommandRunner.execute(runArgs(source, output)).exitCode()).isZero();

        CommandRunner.Result again = CommandRunner.execute(runArgs(source, output, "--no-resume"));

        assertThat(again.exitCode()).isZero();
        assertThat(again.out()).doesNotContain("resumed after");
        assertThat(Files.readAllLines(output)).hasSize(6);
    }
}
