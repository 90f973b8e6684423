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

import io.nosqlbench.streamconvert.DurableFiles;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * The ordered chunks of one source file.
 *
 * <p>A plan is deterministic: the same source bytes split with the same
 * {@code maxChunkBytes} and {@code maxObjectsPerChunk} always give the same chunk
 * boundaries and checksums. Resume depends on this, since the plan is never persisted and is
 * re-derived on every run.</p>
 *
 * <p>The constructor enforces completeness: chunk ids are dense from 1 and record ranges
 * are contiguous, non-overlapping, and cover {@code [0, totalRecords)} exactly.</p>
 */
public record ChunkPlan(
    Path source,
    SourceFormat format,
    long sourceBytes,
    long totalRecords,
    long maxChunkBytes,
    int maxObjectsPerChunk,
    List<ChunkDescriptor> chunks
) {

    public ChunkPlan {
        chunks = List.copyOf(chunks);
        long expectedFirst = 0;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkDescriptor chunk = chunks.get(i);
            if (chunk.chunkId() != i + 1) {
                throw new IllegalArgumentException("chunk ids must be dense from 1, found " + chunk.chunkId()
                    + " at position " + i);
            }
            if (chunk.firstRecord() != expectedFirst) {
                throw new IllegalArgumentException("chunk " + chunk.chunkId() + " starts at record "
                    + chunk.firstRecord() + ", expected " + expectedFirst);
            }
            expectedFirst = chunk.endRecord();
        }
        if (expectedFirst != totalRecords) {
            throw new IllegalArgumentException("chunks cover " + expectedFirst + " records but the plan has "
                + totalRecords);
        }
    }

    public int chunkCount() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public Optional<ChunkDescriptor> chunk(int chunkId) {
        if (chunkId < 1 || chunkId > chunks.size()) {
            return Optional.empty();
        }
        return Optional.of(chunks.get(chunkId - 1));
    }

    /// Number of records in chunks `1..chunkId`.
    public long cumulativeRecords(int chunkId) {
        if (chunkId <= 0 || chunks.isEmpty()) {
            return 0;
        }
        return chunks.get(Math.min(chunkId, chunks.size()) - 1).endRecord();
    }

    /// Identifies the inputs that determine the plan: source size, split limits and layout.
    /// Stored in the checkpoint log header and compared on resume.
    public static byte[] fingerprint(long sourceBytes, long maxChunkBytes, int maxObjectsPerChunk,
                                     SourceFormat requestedFormat) {
        MessageDigest digest = DurableFiles.sha256();
        digest.update(ByteBuffer.allocate(Long.BYTES * 2 + Integer.BYTES)
            .putLong(sourceBytes)
            .putLong(maxChunkBytes)
            .putInt(maxObjectsPerChunk)
            .array());
        digest.update(requestedFormat.name().getBytes(StandardCharsets.UTF_8));
        return digest.digest();
    }
}
