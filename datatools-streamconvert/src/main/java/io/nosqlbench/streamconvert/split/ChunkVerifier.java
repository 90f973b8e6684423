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
import io.nosqlbench.streamconvert.IntegrityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Checks chunk files on disk against the descriptors of a [ChunkPlan].
///
/// A chunk passes when its file exists, hashes to the descriptor's checksum, and is a
/// structurally complete JSON array holding exactly the descriptor's record count.
/// Element contents are not parsed, so a chunk holding a malformed record still passes.
public final class ChunkVerifier {

    private static final Logger logger = LogManager.getLogger(ChunkVerifier.class);

    /// One chunk that failed verification.
    public record Problem(int chunkId, String message) {
        @Override
        public String toString() {
            return "chunk " + chunkId + ": " + message;
        }
    }

    private ChunkVerifier() {
    }

    public static List<Problem> verify(ChunkPlan plan) throws IOException {
        List<Problem> problems = new ArrayList<>();
        for (ChunkDescriptor chunk : plan.chunks()) {
            verify(chunk).ifPresent(problems::add);
        }
        if (problems.isEmpty()) {
            logger.debug("verified {} chunk files", plan.chunkCount());
        } else {
            logger.warn("{} of {} chunk files failed verification", problems.size(), plan.chunkCount());
        }
        return problems;
    }

    public static Optional<Problem> verify(ChunkDescriptor chunk) throws IOException {
        if (!Files.isRegularFile(chunk.file())) {
            return Optional.of(new Problem(chunk.chunkId(), "missing file " + chunk.file()));
        }
        String actual = DurableFiles.checksumOf(chunk.file());
        if (!actual.equals(chunk.checksum())) {
            return Optional.of(new Problem(chunk.chunkId(),
                "checksum mismatch, expected " + chunk.checksum() + " but file has " + actual));
        }
        long elements = 0;
        try (JsonValueScanner scanner = new JsonValueScanner(
            new BufferedInputStream(Files.newInputStream(chunk.file())), SourceFormat.JSON_ARRAY)) {
            while (scanner.next()) {
                elements++;
            }
        } catch (IntegrityException e) {
            return Optional.of(new Problem(chunk.chunkId(), "not a complete JSON array: " + e.getMessage()));
        }
        if (elements != chunk.recordCount()) {
            return Optional.of(new Problem(chunk.chunkId(),
                "holds " + elements + " records, expected " + chunk.recordCount()));
        }
        return Optional.empty();
    }
}
