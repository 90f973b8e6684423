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

import java.nio.file.Path;

/// One contiguous slice of the source, written as its own JSON array file.
///
/// @param chunkId     1-based, dense chunk number
/// @param firstRecord index of the first record in the chunk
/// @param endRecord   index just past the last record
/// @param byteStart   source offset of the first record's first byte
/// @param byteEnd     source offset just past the last record's last byte
/// @param file        the chunk file
/// @param checksum    `sha256:<hex>` of the chunk file bytes
public record ChunkDescriptor(
    int chunkId,
    long firstRecord,
    long endRecord,
    long byteStart,
    long byteEnd,
    Path file,
    String checksum
) {

    public ChunkDescriptor {
        if (chunkId < 1) {
            throw new IllegalArgumentException("chunk ids start at 1, got " + chunkId);
        }
        if (firstRecord < 0 || endRecord <= firstRecord) {
            throw new IllegalArgumentException("chunk " + chunkId + " has an empty or negative record range ["
                + firstRecord + "," + endRecord + ")");
        }
        if (byteStart < 0 || byteEnd < byteStart) {
            throw new IllegalArgumentException("chunk " + chunkId + " has an invalid byte range ["
                + byteStart + "," + byteEnd + ")");
        }
    }

    public long recordCount() {
        return endRecord - firstRecord;
    }

    public static String fileName(int chunkId) {
        return String.format("chunk-%06d.json", chunkId);
    }

    @Override
    public String toString() {
        return "chunk " + chunkId + " records [" + firstRecord + "," + endRecord + ") bytes ["
            + byteStart + "," + byteEnd + ")";
    }
}
