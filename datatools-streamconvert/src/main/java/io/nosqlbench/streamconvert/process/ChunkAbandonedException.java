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

/// A chunk stopped early because the run was cancelled. Nothing from it was published.
public class ChunkAbandonedException extends Exception {

    private final int chunkId;

    public ChunkAbandonedException(int chunkId, CancellationToken.Reason reason) {
        super("chunk " + chunkId + " abandoned: " + reason);
        this.chunkId = chunkId;
    }

    public int chunkId() {
        return chunkId;
    }
}
