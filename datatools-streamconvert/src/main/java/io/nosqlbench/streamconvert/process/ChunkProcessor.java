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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.streamconvert.DataIntegrityException;
import io.nosqlbench.streamconvert.DurableFiles;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.PipelineException;
import io.nosqlbench.streamconvert.json.RecordJson;
import io.nosqlbench.streamconvert.split.ChunkDescriptor;
import io.nosqlbench.streamconvert.split.JsonValueScanner;
import io.nosqlbench.streamconvert.split.MalformedLine;
import io.nosqlbench.streamconvert.split.SourceFormat;
import io.nosqlbench.streamconvert.transform.ConversionRecord;
import io.nosqlbench.streamconvert.transform.RecordTransformer;
import io.nosqlbench.streamconvert.transform.TransformException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.Optional;

/// Converts the records of one chunk file and writes them to the chunk's result file.
///
/// ## Streaming
///
/// Values are read one at a time from the chunk file, parsed to a [JsonNode], handed to the
/// [RecordTransformer], and written out as a [ResultEnvelope] line before the next value is
/// read. At most one record is held in memory.
///
/// ## Per-record failures
///
/// A value that is not valid JSON, a [MalformedLine] carried over from a JSON-lines source, or a
/// value that the transformer rejects, becomes a
/// [RecordOutcome.Failed] line in the result file and is counted in the chunk's
/// [QualityReport]. Once the failures exceed what the [FailureRatePolicy] allows for the chunk's
/// record count, the chunk fails with [DataIntegrityException].
///
/// ## Cancellation
///
/// The [CancellationToken] is checked before each record. A cancelled chunk deletes its temp
/// file and throws [ChunkAbandonedException]; it never publishes a partial result.
///
/// One processor is shared by all workers of a run.
public final class ChunkProcessor {

    private static final Logger logger = LogManager.getLogger(ChunkProcessor.class);

    private static final int STREAM_BUFFER = 256 * 1024;

    private final RecordTransformer transformer;
    private final FailureRatePolicy policy;
    private final Path resultDir;
    private final ObjectMapper mapper = RecordJson.mapper();
    private volatile long releaseEpoch;

    public ChunkProcessor(RecordTransformer transformer, FailureRatePolicy policy, Path resultDir) {
        this.transformer = transformer;
        this.policy = policy;
        this.resultDir = resultDir;
    }

    /// Asks running chunks to flush their buffered output at the next record boundary.
    /// Wired to the memory monitor's warning level.
    public void requestRelease() {
        releaseEpoch++;
    }

    public Path resultFileFor(int chunkId) {
        return resultDir.resolve(ChunkResult.fileName(chunkId));
    }

    /// @throws DataIntegrityException if too many records fail
    /// @throws IntegrityException if the chunk file itself is damaged
    /// @throws ChunkAbandonedException if the run was cancelled before the chunk finished
    public ChunkResult process(ChunkDescriptor chunk, CancellationToken token)
        throws IOException, PipelineException, ChunkAbandonedException {
        Files.createDirectories(resultDir);
        Path target = resultFileFor(chunk.chunkId());
        Path temp = DurableFiles.tempFor(target);
        MessageDigest digest = DurableFiles.sha256();
        QualityReport.Tally tally = new QualityReport.Tally();
        long seenEpoch = releaseEpoch;
        boolean published = false;

        try (InputStream in = new BufferedInputStream(Files.newInputStream(chunk.file()), STREAM_BUFFER);
             JsonValueScanner scanner = new JsonValueScanner(in, SourceFormat.JSON_ARRAY);
             OutputStream out = new BufferedOutputStream(
                 new DigestOutputStream(Files.newOutputStream(temp), digest), STREAM_BUFFER)) {

            long index = chunk.firstRecord();
            while (true) {
                if (token.isCancelled()) {
                    throw new ChunkAbandonedException(chunk.chunkId(), token.reason().orElseThrow());
                }
                if (!scanner.next()) {
                    break;
                }
                if (index >= chunk.endRecord()) {
                    throw new IntegrityException("chunk " + chunk.chunkId() + " holds more than its "
                        + chunk.recordCount() + " records");
                }
                RecordOutcome outcome = convert(index, scanner.valueBuffer(), scanner.valueLength());
                tally.add(outcome);
                out.write(mapper.writeValueAsBytes(ResultEnvelope.of(outcome)));
                out.write('\n');

                if (outcome instanceof RecordOutcome.Failed failed) {
                    logger.debug("chunk {} record {} skipped: {}", chunk.chunkId(), failed.index(), failed.message());
                    if (policy.exceeded(tally.failures(), chunk.recordCount())) {
                        throw new DataIntegrityException("chunk " + chunk.chunkId() + " exceeded the failure rate"
                            + " threshold of " + policy.threshold() + " with " + tally.failures() + " failed of "
                            + chunk.recordCount() + " records; last failure at record " + failed.index() + ": "
                            + failed.message());
                    }
                }
                if (releaseEpoch != seenEpoch) {
                    seenEpoch = releaseEpoch;
                    out.flush();
                }
                index++;
            }
            if (index != chunk.endRecord()) {
                throw new IntegrityException("chunk " + chunk.chunkId() + " holds " + (index - chunk.firstRecord())
                    + " records, expected " + chunk.recordCount());
            }
            out.close();
            DurableFiles.publish(temp, target);
            published = true;
        } finally {
            if (!published) {
                Files.deleteIfExists(temp);
            }
        }

        QualityReport quality = tally.report();
        if (quality.failureCount() > 0) {
            logger.warn("chunk {}: {} of {} records skipped", chunk.chunkId(), quality.failureCount(),
                quality.totalRecords());
        }
        return new ChunkResult(chunk, target, DurableFiles.checksum(digest.digest()), quality);
    }

    private RecordOutcome convert(long index, byte[] buffer, int length) {
        JsonNode raw;
        try {
            raw = mapper.readTree(buffer, 0, length);
        } catch (JsonProcessingException e) {
            return new RecordOutcome.Failed(index, "invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return new RecordOutcome.Failed(index, "unreadable record: " + e.getMessage());
        }
        Optional<String> malformed = MalformedLine.problemOf(raw);
        if (malformed.isPresent()) {
            return new RecordOutcome.Failed(index, "malformed source line: " + malformed.get());
        }
        try {
            ConversionRecord record = transformer.transform(index, raw);
            if (record == null) {
                return new RecordOutcome.Failed(index, "transformer produced no record");
            }
            return new RecordOutcome.Converted(index, record);
        } catch (TransformException e) {
            return new RecordOutcome.Failed(index, e.getMessage());
        } catch (RuntimeException e) {
            return new RecordOutcome.Failed(index, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
