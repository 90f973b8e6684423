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

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.streamconvert.DurableFiles;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.json.RecordJson;
import io.nosqlbench.streamconvert.process.QualityReport;
import io.nosqlbench.streamconvert.split.ChunkDescriptor;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.IntFunction;

/**
 * Merges committed chunk result files, in chunk order, into the final dataset.
 *
 * <p>Assembly is two passes over the result files. {@link #audit()} computes the aggregate
 * {@link QualityReport} and checks that record indexes run from 0 without gaps.
 * {@link #write(Path, Path, QualityReport)} then streams the converted records into a staged file next to the output,
 * which the caller publishes with {@link DurableFiles#publish(Path, Path)} or discards. Only one
 * result line is held in memory at a time.</p>
 */
public final class ResultAssembler {

    private static final Logger logger = LogManager.getLogger(ResultAssembler.class);

    private static final int STREAM_BUFFER = 256 * 1024;

    private final ChunkPlan plan;
    private final IntFunction<Path> resultFileForChunk;
    private final ObjectMapper mapper = RecordJson.mapper();

    public ResultAssembler(ChunkPlan plan, IntFunction<Path> resultFileForChunk) {
        this.plan = plan;
        this.resultFileForChunk = resultFileForChunk;
    }

    private interface LineVisitor {
        void visit(long index, JsonNode envelope) throws IOException;
    }

    /// Reads every result line and tallies successes and skipped records.
    ///
    /// @throws IntegrityException if a result file is missing, unreadable, or out of sequence
    public QualityReport audit() throws IOException, IntegrityException {
        QualityReport.Tally tally = new QualityReport.Tally();
        readAll((index, envelope) -> {
            if (envelope.has("record")) {
                tally.success();
            } else {
                tally.failure(index, envelope.path("error").asText("unknown error"));
            }
        });
        QualityReport report = tally.report();
        logger.debug("audited {} records: {} converted, {} skipped", report.totalRecords(), report.successCount(),
            report.failureCount());
        return report;
    }

    /// Writes the converted records to `staged`, in the layout chosen by `output`'s name.
    ///
    /// @param audited the report from [#audit()], which supplies the record count for the document header
    /// @return the number of records written
    public long write(Path output, Path staged, QualityReport audited) throws IOException, IntegrityException {
        OutputFormat format = OutputFormat.forPath(output);
        long[] written = {0};
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(staged), STREAM_BUFFER)) {
            if (format == OutputFormat.JSON_LINES) {
                readAll((index, envelope) -> {
                    JsonNode record = envelope.get("record");
                    if (record != null) {
                        out.write(mapper.writeValueAsBytes(record));
                        out.write('\n');
                        written[0]++;
                    }
                });
            } else {
                long total = audited.successCount();
                try (JsonGenerator gen = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
                    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
                    gen.writeStartObject();
                    gen.writeStringField("name", datasetName(output));
                    gen.writeNumberField("total_records", total);
                    gen.writeArrayFieldStart("records");
                    readAll((index, envelope) -> {
                        JsonNode record = envelope.get("record");
                        if (record != null) {
                            mapper.writeTree(gen, record);
                            written[0]++;
                        }
                    });
                    gen.writeEndArray();
                    gen.writeEndObject();
                }
                out.write('\n');
            }
        }
        logger.info("assembled {} records into {}", written[0], output);
        return written[0];
    }

    static String datasetName(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private void readAll(LineVisitor visitor) throws IOException, IntegrityException {
        long expected = 0;
        for (ChunkDescriptor chunk : plan.chunks()) {
            Path file = resultFileForChunk.apply(chunk.chunkId());
            if (!Files.isRegularFile(file)) {
                throw new IntegrityException("result file for chunk " + chunk.chunkId() + " is missing: " + file);
            }
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    JsonNode envelope = mapper.readTree(line);
                    long index = envelope.path("index").asLong(-1);
                    if (index != expected) {
                        throw new IntegrityException("result file " + file + " has record " + index
                            + " where record " + expected + " was expected");
                    }
                    visitor.visit(index, envelope);
                    expected++;
                }
            }
            if (expected != chunk.endRecord()) {
                throw new IntegrityException("result file " + file + " ends at record " + expected
                    + ", expected " + chunk.endRecord());
            }
        }
        if (expected != plan.totalRecords()) {
            throw new IntegrityException("results hold " + expected + " records, expected " + plan.totalRecords());
        }
    }
}
