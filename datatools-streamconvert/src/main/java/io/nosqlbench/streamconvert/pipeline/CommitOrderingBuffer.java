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

import io.nosqlbench.streamconvert.process.ChunkResult;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/// Holds chunk results that finished ahead of their predecessors, and releases them strictly
/// in chunk id order.
public final class CommitOrderingBuffer {

    private final TreeMap<Integer, ChunkResult> waiting = new TreeMap<>();
    private int nextChunkId;

    /// @param firstChunkId the id that must be released first
    public CommitOrderingBuffer(int firstChunkId) {
        this.nextChunkId = firstChunkId;
    }

    /// @throws IllegalArgumentException if the chunk was already released or offered
    public void offer(ChunkResult result) {
        int id = result.chunkId();
        if (id < nextChunkId || waiting.containsKey(id)) {
            throw new IllegalArgumentException("chunk " + id + " was already offered");
        }
        waiting.put(id, result);
    }

    /// Removes and returns the results contiguous with the last released chunk.
    public List<ChunkResult> drainReady() {
        List<ChunkResult> ready = new ArrayList<>();
        while (!waiting.isEmpty() && waiting.firstKey() == nextChunkId) {
            ready.add(waiting.pollFirstEntry().getValue());
            nextChunkId++;
        }
        return ready;
    }

    public int nextChunkId() {
        return nextChunkId;
    }

    /// Results held back behind a missing predecessor.
    public int waitingCount() {
        return waiting.size();
    }
}
