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

import io.nosqlbench.streamconvert.checkpoint.ProcessingCheckpoint;
import io.nosqlbench.streamconvert.process.ChunkResult;

/// Progress callbacks from a [PipelineOrchestrator]. All methods are called on the
/// orchestrator's control thread.
public interface PipelineListener {

    default void stateChanged(PipelineState from, PipelineState to) {
    }

    /// A worker finished a chunk. Chunks may finish in any order.
    default void chunkProcessed(ChunkResult result) {
    }

    /// A checkpoint was durably appended. Called in strictly increasing chunk order.
    default void chunkCommitted(ProcessingCheckpoint checkpoint) {
    }
}
