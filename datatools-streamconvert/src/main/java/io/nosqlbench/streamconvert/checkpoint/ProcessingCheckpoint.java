package io.nosqlbench.streamconvert.checkpoint;

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

import java.security.MessageDigest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One committed chunk, as recorded in the {@link CheckpointLog}.
 *
 * @param pipelineId the run the checkpoint belongs to
 * @param chunkId the committed chunk
 * @param cumulativeRecordCount records in chunks {@code 1..chunkId}
 * @param contentHash the {@linkplain #contentHashOf(List) content hash} of the result files this
 *                    checkpoint covers
 * @param timestamp when the checkpoint was written
 * @param status whether any records of the chunk were skipped
 */
public record ProcessingCheckpoint(
    UUID pipelineId,
    int chunkId,
    long cumulativeRecordCount,
    String contentHash,
    Instant timestamp,
    CheckpointStatus status
) {

    /**
     * The content hash of a checkpoint covering the given result files, in chunk order.
     *
     * <p>A checkpoint covering a single chunk stores that chunk's result file checksum. One
     * covering several chunks, when checkpoints are written every N chunks, stores the sha256 of
     * their result digests concatenated, so every covered result file is still pinned.</p>
     *
     * @param resultChecksums {@code sha256:<hex>} checksums of the covered result files
     */
    public static String contentHashOf(List<String> resultChecksums) {
        if (resultChecksums.isEmpty()) {
            throw new IllegalArgumentException("a checkpoint covers at least one result file");
        }
        if (resultChecksums.size() == 1) {
            return resultChecksums.get(0);
        }
        MessageDigest digest = DurableFiles.sha256();
        for (String checksum : resultChecksums) {
            digest.update(DurableFiles.digestOf(checksum));
        }
        return DurableFiles.checksum(digest.digest());
    }
}
