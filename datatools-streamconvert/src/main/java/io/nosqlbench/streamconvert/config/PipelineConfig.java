package io.nosqlbench.streamconvert.config;

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

import io.nosqlbench.streamconvert.split.SourceFormat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for one pipeline run.
 *
 * <p>Use {@link #builder()}; every value not set explicitly takes its default:</p>
 * <table>
 *   <caption>defaults</caption>
 *   <tr><td>maxChunkBytes</td><td>16 MiB</td></tr>
 *   <tr><td>maxObjectsPerChunk</td><td>10000</td></tr>
 *   <tr><td>memoryCeilingBytes</td><td>80% of the maximum heap</td></tr>
 *   <tr><td>workerCount</td><td>available processors - 1, at least 1</td></tr>
 *   <tr><td>perWorkerMemoryBudget</td><td>4 x maxChunkBytes</td></tr>
 *   <tr><td>failureRateThreshold</td><td>0.01</td></tr>
 *   <tr><td>checkpointInterval</td><td>1 chunk</td></tr>
 *   <tr><td>wallClockTimeout</td><td>30 minutes</td></tr>
 *   <tr><td>minIntegrityScore</td><td>0.95</td></tr>
 *   <tr><td>warningFraction / hardFraction</td><td>0.80 / 0.90 of the ceiling</td></tr>
 *   <tr><td>memorySampleInterval</td><td>250 ms</td></tr>
 *   <tr><td>memoryGraceWindow</td><td>10 s</td></tr>
 *   <tr><td>sourceFormat</td><td>{@link SourceFormat#AUTO}</td></tr>
 *   <tr><td>transformer</td><td>{@code auto}</td></tr>
 *   <tr><td>workDir</td><td>{@code <output>.work}</td></tr>
 *   <tr><td>resume</td><td>true</td></tr>
 * </table>
 */
public record PipelineConfig(
    long maxChunkBytes,
    int maxObjectsPerChunk,
    long memoryCeilingBytes,
    int workerCount,
    long perWorkerMemoryBudget,
    double failureRateThreshold,
    int checkpointInterval,
    Duration wallClockTimeout,
    double minIntegrityScore,
    double warningFraction,
    double hardFraction,
    Duration memorySampleInterval,
    Duration memoryGraceWindow,
    SourceFormat sourceFormat,
    String transformer,
    Path workDir,
    boolean resume
) {

    public static final long DEFAULT_MAX_CHUNK_BYTES = 16L << 20;
    public static final int DEFAULT_MAX_OBJECTS_PER_CHUNK = 10_000;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.01;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 1;
    public static final Duration DEFAULT_WALL_CLOCK_TIMEOUT = Duration.ofMinutes(30);
    public static final double DEFAULT_MIN_INTEGRITY_SCORE = 0.95;
    public static final double DEFAULT_WARNING_FRACTION = 0.80;
    public static final double DEFAULT_HARD_FRACTION = 0.90;
    public static final Duration DEFAULT_MEMORY_SAMPLE_INTERVAL = Duration.ofMillis(250);
    public static final Duration DEFAULT_MEMORY_GRACE_WINDOW = Duration.ofSeconds(10);
    public static final String DEFAULT_TRANSFORMER = "auto";

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /// Number of workers actually started: the configured count, reduced so that
    /// `workers x perWorkerMemoryBudget` stays within the ceiling, never below one.
    public int effectiveWorkerCount() {
        long fit = memoryCeilingBytes / perWorkerMemoryBudget;
        return (int) Math.max(1, Math.min(workerCount, fit));
    }

    public long warningBytes() {
        return (long) (memoryCeilingBytes * warningFraction);
    }

    public long hardBytes() {
        return (long) (memoryCeilingBytes * hardFraction);
    }

    /// The intermediate directory for a run writing to `output`.
    public Path workDirFor(Path output) {
        if (workDir != null) {
            return workDir;
        }
        Path abs = output.toAbsolutePath();
        return abs.resolveSibling(abs.getFileName() + ".work");
    }

    public Builder toBuilder() {
        return new Builder()
            .maxChunkBytes(maxChunkBytes)
            .maxObjectsPerChunk(maxObjectsPerChunk)
            .memoryCeilingBytes(memoryCeilingBytes)
            .workerCount(workerCount)
            .perWorkerMemoryBudget(perWorkerMemoryBudget)
            .failureRateThreshold(failureRateThreshold)
            .checkpointInterval(checkpointInterval)
            .wallClockTimeout(wallClockTimeout)
            .minIntegrityScore(minIntegrityScore)
            .warningFraction(warningFraction)
            .hardFraction(hardFraction)
            .memorySampleInterval(memorySampleInterval)
            .memoryGraceWindow(memoryGraceWindow)
            .sourceFormat(sourceFormat)
            .transformer(transformer)
            .workDir(workDir)
            .resume(resume);
    }

    public static final class Builder {
        private Long maxChunkBytes;
        private Integer maxObjectsPerChunk;
        private Long memoryCeilingBytes;
        private Integer workerCount;
        private Long perWorkerMemoryBudget;
        private double failureRateThreshold = DEFAULT_FAILURE_RATE_THRESHOLD;
        private int checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;
        private Duration wallClockTimeout = DEFAULT_WALL_CLOCK_TIMEOUT;
        private double minIntegrityScore = DEFAULT_MIN_INTEGRITY_SCORE;
        private double warningFraction = DEFAULT_WARNING_FRACTION;
        private double hardFraction = DEFAULT_HARD_FRACTION;
        private Duration memorySampleInterval = DEFAULT_MEMORY_SAMPLE_INTERVAL;
        private Duration memoryGraceWindow = DEFAULT_MEMORY_GRACE_WINDOW;
        private SourceFormat sourceFormat = SourceFormat.AUTO;
        private String transformer = DEFAULT_TRANSFORMER;
        private Path workDir;
        private boolean resume = true;

        private Builder() {
        }

        public Builder maxChunkBytes(long maxChunkBytes) {
            this.maxChunkBytes = maxChunkBytes;
            return this;
        }

        public Builder maxObjectsPerChunk(int maxObjectsPerChunk) {
            this.maxObjectsPerChunk = maxObjectsPerChunk;
            return this;
        }

        public Builder memoryCeilingBytes(long memoryCeilingBytes) {
            this.memoryCeilingBytes = memoryCeilingBytes;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder perWorkerMemoryBudget(long perWorkerMemoryBudget) {
            this.perWorkerMemoryBudget = perWorkerMemoryBudget;
            return this;
        }

        public Builder failureRateThreshold(double failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder wallClockTimeout(Duration wallClockTimeout) {
            this.wallClockTimeout = wallClockTimeout;
            return this;
        }

        public Builder minIntegrityScore(double minIntegrityScore) {
            this.minIntegrityScore = minIntegrityScore;
            return this;
        }

        public Builder warningFraction(double warningFraction) {
            this.warningFraction = warningFraction;
            return this;
        }

        public Builder hardFraction(double hardFraction) {
            this.hardFraction = hardFraction;
            return this;
        }

        public Builder memorySampleInterval(Duration memorySampleInterval) {
            this.memorySampleInterval = memorySampleInterval;
            return this;
        }

        public Builder memoryGraceWindow(Duration memoryGraceWindow) {
            this.memoryGraceWindow = memoryGraceWindow;
            return this;
        }

        public Builder sourceFormat(SourceFormat sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public Builder transformer(String transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        /// @throws IllegalArgumentException naming the first invalid setting
        public PipelineConfig build() {
            long chunkBytes = maxChunkBytes != null ? maxChunkBytes : DEFAULT_MAX_CHUNK_BYTES;
            int objects = maxObjectsPerChunk != null ? maxObjectsPerChunk : DEFAULT_MAX_OBJECTS_PER_CHUNK;
            long ceiling = memoryCeilingBytes != null
                ? memoryCeilingBytes
                : (long) (Runtime.getRuntime().maxMemory() * 0.80);
            int workers = workerCount != null
                ? workerCount
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
            long budget = perWorkerMemoryBudget != null ? perWorkerMemoryBudget : 4 * chunkBytes;

            require(chunkBytes > 0, "max_chunk_bytes must be positive, got " + chunkBytes);
            require(objects > 0, "max_objects_per_chunk must be positive, got " + objects);
            require(ceiling > 0, "memory_ceiling must be positive, got " + ceiling);
            require(workers >= 1, "worker_count must be at least 1, got " + workers);
            require(budget > 0, "per_worker_memory_budget must be positive, got " + budget);
            require(budget <= ceiling, "per_worker_memory_budget (" + ConfigValues.formatBytes(budget)
                + ") exceeds memory_ceiling (" + ConfigValues.formatBytes(ceiling) + ")");
            require(failureRateThreshold >= 0.0 && failureRateThreshold <= 1.0,
                "failure_rate_threshold must be in [0,1], got " + failureRateThreshold);
            require(checkpointInterval >= 1, "checkpoint_interval must be at least 1, got " + checkpointInterval);
            Objects.requireNonNull(wallClockTimeout, "wall_clock_timeout");
            require(!wallClockTimeout.isNegative() && !wallClockTimeout.isZero(),
                "wall_clock_timeout must be positive, got " + wallClockTimeout);
            require(minIntegrityScore >= 0.0 && minIntegrityScore <= 1.0,
                "min_integrity_score must be in [0,1], got " + minIntegrityScore);
            require(warningFraction > 0.0 && warningFraction < hardFraction,
                "warning_fraction must be positive and below hard_fraction, got " + warningFraction);
            require(hardFraction <= 1.0, "hard_fraction must be at most 1.0, got " + hardFraction);
            Objects.requireNonNull(memorySampleInterval, "memory_sample_interval");
            require(!memorySampleInterval.isNegative() && !memorySampleInterval.isZero(),
                "memory_sample_interval must be positive, got " + memorySampleInterval);
            Objects.requireNonNull(memoryGraceWindow, "memory_grace_window");
            require(!memoryGraceWindow.isNegative(), "memory_grace_window must not be negative, got " + memoryGraceWindow);
            Objects.requireNonNull(sourceFormat, "source_format");
            require(transformer != null && !transformer.isBlank(), "transformer must be named");

            return new PipelineConfig(chunkBytes, objects, ceiling, workers, budget, failureRateThreshold,
                checkpointInterval, wallClockTimeout, minIntegrityScore, warningFraction, hardFraction,
                memorySampleInterval, memoryGraceWindow, sourceFormat, transformer, workDir, resume);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
