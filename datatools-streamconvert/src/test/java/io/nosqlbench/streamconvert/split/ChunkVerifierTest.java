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
import io.nosqlbench.streamconvert.testing.SourceFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class ChunkVerifierTest {

    @TempDir
    Path tempDir;

    private ChunkPlan plan;

    @BeforeEach
    void split() throws Exception {
        Path source = SourceFiles.jsonArray(tempDir.resolve("source.json"), 6);
        plan = new BoundarySplitter(1 << 20, 2, SourceFormat.AUTO)
            .split(source, tempDir.resolve("chunks"), ChunkWriteMode.WRITE);
    }

    @Test
    void freshChunksVerify() throws Exception {
        assertThat(ChunkVerifier.verify(plan)).isEmpty();
    }

    @Test
    void missingChunkFileIsReported() throws Exception {
        Files.delete(plan.chunk(2).orElseThrow().file());

        List<ChunkVerifier.Problem> problems = ChunkVerifier.verify(plan);
        assertThat(problems).singleElement().satisfies(p -> {
            assertThat(p.chunkId()).isEqualTo(2);
            assertThat(p.message()).startsWith("missing file");
        });
    }

    @Test
    void modifiedChunkFileIsReported() throws Exception {
        Path file = plan.chunk(3).orElseThrow().file();
        Files.writeString(file, Files.readString(file).replace("t4", "t9"));

        assertThat(ChunkVerifier.verify(plan.chunk(3).orElseThrow()))
            .get().extracting(ChunkVerifier.Problem::message).asString().contains("checksum mismatch");
    }

    @Test
    void elementCountIsCheckedAgainstTheDescriptor() throws Exception {
        ChunkDescriptor real = plan.chunk(1).orElseThrow();
        Files.writeString(real.file(), "[\n" + SourceFiles.booleanRecord(0) + "\n]\n");
        ChunkDescriptor rehashed = new ChunkDescriptor(real.chunkId(), real.firstRecord(), real.endRecord(),
            real.byteStart(), real.byteEnd(), real.file(), DurableFiles.checksumOf(real.file()));

        assertThat(ChunkVerifier.verify(rehashed))
            .get().extracting(ChunkVerifier.Problem::message).asString().contains("holds 1 records, expected 2");
    }

    @Test
    void truncatedChunkArrayIsReported() throws Exception {
        ChunkDescriptor real = plan.chunk(1).orElseThrow();
        Files.writeString(real.file(), "[\n" + SourceFiles.booleanRecord(0) + ",\n");
        ChunkDescriptor rehashed = new ChunkDescriptor(real.chunkId(), real.firstRecord(), real.endRecord(),
            real.byteStart(), real.byteEnd(), real.file(), DurableFiles.checksumOf(real.file()));

        assertThat(ChunkVerifier.verify(rehashed))
            .get().extracting(ChunkVerifier.Problem::message).asString().contains("not a complete JSON array");
    }
}
