package io.nosqlbench.streamconvert.process;

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

import io.nosqlbench.streamconvert.split.ChunkDescriptor;

import java.nio.file.Path;

/// A chunk whose result file is durably written.
///
/// @param chunk      the chunk that was processed
/// @param resultFile the published JSON-lines result file
/// @param checksum   `sha256:<hex>` of the result file, recorded as the checkpoint's content hash
/// @param quality    the chunk-local tally
public record ChunkResult(ChunkDescriptor chunk, Path resultFile, String checksum, QualityReport quality) {

    public int chunkId() {
        return chunk.chunkId();
    }

    public boolean degraded() {
        return quality.failureCount() > 0;
    }

    public static String fileName(int chunkId) {
        return String.format("result-%06d.jsonl", chunkId);
    }
}
