package io.nosqlbench.streamconvert.pipeline;

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

import io.nosqlbench.streamconvert.DurableFiles;
import io.nosqlbench.streamconvert.checkpoint.CheckpointLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Layout of a run's intermediate files:
///
/// ```
/// <work_dir>/
///   chunks/chunk-000001.json
///   results/result-000001.jsonl
///   checkpoints.log
///   checkpoints.log.completed   (after a successful run)
/// ```
public record WorkDirectory(Path root) {

    public Path chunks() {
        return root.resolve("chunks");
    }

    public Path results() {
        return root.resolve("results");
    }

    public Path checkpointLog() {
        return root.resolve(CheckpointLog.FILE_NAME);
    }

    public Path sealedCheckpointLog() {
        return root.resolve(CheckpointLog.FILE_NAME + CheckpointLog.SEALED_SUFFIX);
    }

    public void create() throws IOException {
        Files.createDirectories(chunks());
        Files.createDirectories(results());
    }

    /// Removes chunk and result files, keeping the checkpoint logs.
    public void deleteIntermediates() throws IOException {
        DurableFiles.deleteTree(chunks());
        DurableFiles.deleteTree(results());
    }

    /// Removes everything, including the checkpoint logs.
    public void deleteAll() throws IOException {
        DurableFiles.deleteTree(root);
    }
}
