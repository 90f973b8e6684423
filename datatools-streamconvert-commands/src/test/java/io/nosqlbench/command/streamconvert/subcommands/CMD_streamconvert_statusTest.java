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
import io.nosqlbench.streamconvert.checkpoint.CheckpointStatus;
import io.nosqlbench.streamconvert.pipeline.WorkDirectory;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import io.nosqlbench.streamconvert.split.SourceFormat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CMD_streamconvert_statusTest {

    private static final String HASH = "sha256:" + "ab".repeat(32);

    @TempDir
    Path tempDir;

    private WorkDirectory liveWorkDir(int chunks) throws Exception {
        WorkDirectory work = new WorkDirectory(tempDir.resolve("dataset.jsonl.work"));
        work.create();
        byte[] fingerprint = ChunkPlan.fingerprint(1000, 1 << 20, 10, SourceFormat.AUTO);
        try (CheckpointLog log = CheckpointLog.create(work.checkpointLog(), UUID.randomUUID(), fingerprint)) {
            for (int id = 1; id <= chunks; id++) {
                log.append(id, id * 10L, HASH, id == 2 ? CheckpointStatus.DEGRADED : CheckpointStatus.CLEAN);
            }
        }
        return work;
    }

    @Test
    void reportsLiveLogByOutputPath() throws Exception {
        liveWorkDir(3);

        CommandRunner.Result result = CommandRunner.execute("status", tempDir.resolve("dataset.jsonl").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("checkpoints.log (live)")
            .contains("last chunk:         3")
            .contains("records committed:  30")
            .contains("degraded:           1 checkpoints");
    }

    @Test
    void listsCheckpointsByWorkDir() throws Exception {
        WorkDirectory work = liveWorkDir(2);

        CommandRunner.Result result = CommandRunner.execute("status", "--list", work.root().toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("chunk      1").contains("chunk      2").contains("DEGRADED");
    }

    @Test
    void jsonStatus() throws Exception {
        liveWorkDir(4);

        CommandRunner.Result result = CommandRunner.execute("status", "--json",
            tempDir.resolve("dataset.jsonl").toString());

        assertThat(result.exitCode()).isZero();
        JsonObject status = JsonParser.parseString(result.out()).getAsJsonObject();
        assertThat(status.get("last_chunk_id").getAsInt()).isEqualTo(4);
        assertThat(status.get("records_committed").getAsLong()).isEqualTo(40);
        assertThat(status.get("sealed").getAsBoolean()).isFalse();
        assertThat(status.has("checkpoints")).isFalse();
    }

    @Test
    void reportsSealedLogAfterCompletedRun() throws Exception {
        Path source = CommandRunner.booleanSource(tempDir.resolve("source.json"), 7);
        Path output = tempDir.resolve("dataset.jsonl");
        assertThat(CommandRunner.execute("run", "-i", source.toString(), "-o", output.toString(),
            "--max-objects-per-chunk", "2", "--memory-ceiling", "2GiB", "--per-worker-memory", "16MiB",
            "--transformer", "boolean", "-q").exitCode()).isZero();

        CommandRunner.Result result = CommandRunner.execute("status", output.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("(sealed, run completed)").contains("checkpoints:        4");
    }

    @Test
    void missingLogFails() {
        CommandRunner.Result result = CommandRunner.execute("status", tempDir.resolve("never.jsonl").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("No checkpoint log");
    }
}
