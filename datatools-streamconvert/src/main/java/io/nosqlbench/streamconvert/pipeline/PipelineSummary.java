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

import io.nosqlbench.streamconvert.ExitCode;
import io.nosqlbench.streamconvert.config.ConfigValues;
import io.nosqlbench.streamconvert.process.QualityReport;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Outcome of one {@link PipelineOrchestrator#run()}, also written as the processing report.
 *
 * <p>Skipped and failed record counts are always reported, including on success. A failed run
 * names the last committed chunk and how to continue.</p>
 *
 * @param state                 {@link PipelineState#COMPLETED} or {@link PipelineState#FAILED}
 * @param exitCode              the process exit code for this outcome
 * @param source                the source file
 * @param output                the dataset file, written only on success
 * @param totalRecords          records in the source, or -1 if splitting did not finish
 * @param recordsProcessed      records covered by committed chunks
 * @param chunkCount            chunks in the plan
 * @param chunksProcessed       chunks converted by this run, excluding ones committed earlier
 * @param resumedFromChunk      last chunk committed before this run started, 0 for a fresh run
 * @param lastCommittedChunkId  last chunk in the checkpoint log when the run ended
 * @param duration              wall clock time of the run
 * @param peakMemoryBytes       highest memory reading observed
 * @param memoryCeilingBytes    the configured ceiling
 * @param integrityScore        converted / total, 1.0 for an empty dataset
 * @param quality               aggregate tally, present once assembly has audited the results
 * @param error                 failure message, null on success
 * @param remediation           what to do next, null on success
 */
public record PipelineSummary(
    PipelineState state,
    ExitCode exitCode,
    Path source,
    Path output,
    long totalRecords,
    long recordsProcessed,
    int chunkCount,
    int chunksProcessed,
    int resumedFromChunk,
    int lastCommittedChunkId,
    Duration duration,
    long peakMemoryBytes,
    long memoryCeilingBytes,
    double integrityScore,
    QualityReport quality,
    String error,
    String remediation
) {

    public boolean succeeded() {
        return state == PipelineState.COMPLETED;
    }

    public long successCount() {
        return quality == null ? 0 : quality.successCount();
    }

    public long failureCount() {
        return quality == null ? 0 : quality.failureCount();
    }

    /// Multi-line, human readable form for the console.
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("state:              ").append(state).append(" (exit ").append(exitCode.code()).append(")\n");
        sb.append("source:             ").append(source).append('\n');
        if (succeeded()) {
            sb.append("output:             ").append(output).append('\n');
        }
        sb.append("records:            ").append(totalRecords < 0 ? "unknown" : totalRecords)
            .append(" in ").append(chunkCount).append(" chunks\n");
        sb.append("records committed:  ").append(recordsProcessed).append('\n');
        if (resumedFromChunk > 0) {
            sb.append("resumed after:      chunk ").append(resumedFromChunk).append('\n');
        }
        sb.append("chunks this run:    ").append(chunksProcessed).append('\n');
        if (quality != null) {
            sb.append("converted:          ").append(quality.successCount()).append('\n');
            sb.append("skipped:            ").append(quality.failureCount()).append('\n');
            sb.append(String.format(Locale.ROOT, "integrity score:    %.4f%n", integrityScore));
        }
        sb.append("peak memory:        ").append(ConfigValues.formatBytes(peakMemoryBytes))
            .append(" of ").append(ConfigValues.formatBytes(memoryCeilingBytes)).append('\n');
        sb.append(String.format(Locale.ROOT, "duration:           %.3fs%n", duration.toMillis() / 1000.0));
        if (!succeeded()) {
            sb.append("last committed:     chunk ").append(lastCommittedChunkId).append('\n');
            sb.append("error:              ").append(error).append('\n');
            sb.append("remediation:        ").append(remediation).append('\n');
        }
        return sb.toString();
    }
}
