package io.nosqlbench.streamconvert.assemble;

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

import com.fasterxml.jackson.databind.JsonNode;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.json.RecordJson;
import io.nosqlbench.streamconvert.process.CancellationToken;
import io.nosqlbench.streamconvert.process.ChunkProcessor;
import io.nosqlbench.streamconvert.process.FailureRatePolicy;
import io.nosqlbench.streamconvert.process.QualityReport;
import io.nosqlbench.streamconvert.split.BoundarySplitter;
import io.nosqlbench.streamconvert.split.ChunkDescriptor;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import io.nosqlbench.streamconvert.split.ChunkWriteMode;
import io.nosqlbench.streamconvert.split.SourceFormat;
import io.nosqlbench.streamconvert.testing.SourceFiles;
import io.nosqlbench.streamconvert.transform.BooleanQuestionTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class ResultAssemblerTest {

    @TempDir
    Path tempDir;

    private ChunkPlan plan;
    private ChunkProcessor processor;

    @BeforeEach
    void processAllChunks() throws Exception {
        Path source = SourceFiles.jsonArray(tempDir.resolve("source.json"), 8,
            i -> i == 5 ? SourceFiles.unanswerableRecord(i) : SourceFiles.booleanRecord(i));
        plan = new BoundarySplitter(1 << 20, 3, SourceFormat.AUTO)
            .split(source, tempDir.resolve("chunks"), ChunkWriteMode.WRITE);
        processor = new ChunkProcessor(new BooleanQuestionTransformer(), new FailureRatePolicy(0.5),
            tempDir.resolve("results"));
        for (ChunkDescriptor chunk : plan.chunks()) {
            processor.process(chunk, new CancellationToken());
        }
    }

    @Test
    void auditCountsSkippedRecords() throws Exception {
        QualityReport report = new ResultAssembler(plan, processor::resultFileFor).audit();

        assertThat(report.totalRecords()).isEqualTo(8);
        assertThat(report.successCount()).isEqualTo(7);
        assertThat(report.skipped()).singleElement().extracting(s -> s.index()).isEqualTo(5L);
        assertThat(report.integrityScore()).isEqualTo(7 / 8.0);
    }

    @Test
    void writesJsonLinesWithoutSkippedRecords() throws Exception {
        ResultAssembler assembler = new ResultAssembler(plan, processor::resultFileFor);
        Path output = tempDir.resolve("dataset.jsonl");
        Path staged = tempDir.resolve("dataset.jsonl.tmp");

        long written = assembler.write(output, staged, assembler.audit());

        List<String> lines = Files.readAllLines(staged);
        assertThat(written).isEqualTo(7);
        assertThat(lines).hasSize(7);
        JsonNode sixth = RecordJson.mapper().readTree(lines.get(5));
        assertThat(sixth.get("metadata").get("record_index").asLong()).isEqualTo(6);
        assertThat(output).as("only the staged file is written").doesNotExist();
    }

    @Test
    void writesJsonDocument() throws Exception {
        ResultAssembler assembler = new ResultAssembler(plan, processor::resultFileFor);
        Path staged = tempDir.resolve("out.tmp");

        assembler.write(tempDir.resolve("planning_bool.json"), staged, assembler.audit());

        JsonNode document = RecordJson.mapper().readTree(staged.toFile());
        assertThat(document.get("name").asText()).isEqualTo("planning_bool");
        assertThat(document.get("total_records").asLong()).isEqualTo(7);
        assertThat(document.get("records").size()).isEqualTo(7);
        assertThat(Files.readString(staged)).endsWith("}\n");
    }

    @Test
    void missingResultFileFailsTheAudit() throws Exception {
        Files.delete(processor.resultFileFor(2));

        assertThatThrownBy(() -> new ResultAssembler(plan, processor::resultFileFor).audit())
            .isInstanceOf(IntegrityException.class)
            .hasMessageContaining("chunk 2 is missing");
    }

    @Test
    void outOfSequenceResultsFailTheAudit() throws Exception {
        Path second = processor.resultFileFor(2);
        List<String> lines = Files.readAllLines(second);
        Files.write(second, List.of(lines.get(1), lines.get(0), lines.get(2)));

        assertThatThrownBy(() -> new ResultAssembler(plan, processor::resultFileFor).audit())
            .isInstanceOf(IntegrityException.class)
            .hasMessageContaining("has record 4 where record 3 was expected");
    }

    @Test
    void datasetNameDropsExtension() {
        assertThat(ResultAssembler.datasetName(Path.of("/a/b/planning.graph.json"))).isEqualTo("planning.graph");
        assertThat(ResultAssembler.datasetName(Path.of("plain"))).isEqualTo("plain");
    }
}
