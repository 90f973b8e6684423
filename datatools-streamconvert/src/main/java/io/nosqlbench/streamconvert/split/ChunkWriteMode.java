package io.nosqlbench.streamconvert.split;

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

/// What the splitter does with the file for each chunk it plans.
public enum ChunkWriteMode {
    /// Always write the chunk file, replacing any existing one.
    WRITE,
    /// Keep an existing chunk file when its checksum matches the recomputed one, otherwise rewrite it.
    REUSE_IF_VALID,
    /// Compute the descriptor and checksum only; no file is written.
    DIGEST_ONLY
}
