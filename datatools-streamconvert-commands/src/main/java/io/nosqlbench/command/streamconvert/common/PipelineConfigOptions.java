package io.nosqlbench.command.streamconvert.common;

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

import io.nosqlbench.streamconvert.config.PipelineConfig;
import io.nosqlbench.streamconvert.config.YamlPipelineConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Every {@link PipelineConfig} setting as a command line option.
 *
 * <p>Values are layered: built-in defaults, then the YAML file named by {@code --config}, then
 * the options given on the command line. Validation happens once, in
 * {@link PipelineConfig.Builder#build()}.</p>
 */
public class PipelineConfigOptions {

    private static final Logger logger = LogManager.getLogger(PipelineConfigOptions.class);

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "YAML file with pipeline settings; command line options take precedence"
    )
    private Path configFile;

    @CommandLine.Mixin
    private SplitOptions splitOptions = new SplitOptions();

    @CommandLine.Option(
        names = {"--memory-ceiling"},
        paramLabel = "SIZE",
        description = "Memory ceiling for the whole run (default: 80% of max heap)",
        converter = SplitOptions.SizeConverter.class
    )
    private Long memoryCeiling;

    @CommandLine.Option(
        names = {"-t", "--workers"},
        paramLabel = "N",
        description = "Worker threads (default: cores - 1, at least 1)"
    )
    private Integer workers;

    @CommandLine.Option(
        names = {"--per-worker-memory"},
        paramLabel = "SIZE",
        description = "Memory budget per worker; limits the worker count under the ceiling"
            + " (default: 4 x max chunk bytes)",
        converter = SplitOptions.SizeConverter.class
    )
    private Long perWorkerMemory;

    @CommandLine.Option(
        names = {"--failure-rate-threshold"},
        paramLabel = "RATE",
        description = "Largest fraction of failed records a chunk may have (default: 0.01)"
    )
    private Double failureRateThreshold;

    @CommandLine.Option(
        names = {"--checkpoint-interval"},
        paramLabel = "N",
        description = "Append a checkpoint every N committed chunks (default: 1)"
    )
    private Integer checkpointInterval;

    @CommandLine.Option(
        names = {"--timeout"},
        paramLabel = "DURATION",
        description = "Wall clock timeout, e.g. 30m, 90s (default: 30m)",
        converter = SplitOptions.DurationConverter.class
    )
    private Duration timeout;

    @CommandLine.Option(
        names = {"--min-integrity-score"},
        paramLabel = "SCORE",
        description = "Smallest converted fraction accepted for the dataset (default: 0.95)"
    )
    private Double minIntegrityScore;

    @CommandLine.Option(
        names = {"--warning-fraction"},
        paramLabel = "FRACTION",
        description = "Fraction of the memory ceiling for the warning level (default: 0.80)"
    )
    private Double warningFraction;

    @CommandLine.Option(
        names = {"--hard-fraction"},
        paramLabel = "FRACTION",
        description = "Fraction of the memory ceiling for the hard level (default: 0.90)"
    )
    private Double hardFraction;

    @CommandLine.Option(
        names = {"--memory-sample-interval"},
        paramLabel = "DURATION",
        description = "Interval between memory samples (default: 250ms)",
        converter = SplitOptions.DurationConverter.class
    )
    private Duration memorySampleInterval;

    @CommandLine.Option(
        names = {"--memory-grace-window"},
        paramLabel = "DURATION",
        description = "How long memory may stay at the hard level before the run fails (default: 10s)",
        converter = SplitOptions.DurationConverter.class
    )
    private Duration memoryGraceWindow;

    @CommandLine.Option(
        names = {"--transformer"},
        paramLabel = "NAME",
        description = "Record transformer: boolean, mcq, generation, graphwalk, passthrough, auto,"
            + " or the name of a plugged-in transformer (default: auto)"
    )
    private String transformer;

    @CommandLine.Option(
        names = {"--work-dir"},
        paramLabel = "DIR",
        description = "Directory for chunks, results and the checkpoint log (default: <output>.work)"
    )
    private Path workDir;

    @CommandLine.Option(
        names = {"--resume"},
        negatable = true,
        description = "Continue from an existing checkpoint log (default: true);"
            + " --no-resume discards earlier progress"
    )
    private Boolean resume;

    /// @throws IOException if the config file cannot be read
    /// @throws IllegalArgumentException if a value is invalid
    public PipelineConfig toConfig() throws IOException {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        if (configFile != null) {
            logger.debug("loading pipeline settings from {}", configFile);
            YamlPipelineConfig.load(configFile, builder);
        }
        splitOptions.applyTo(builder);
        if (memoryCeiling != null) {
            builder.memoryCeilingBytes(memoryCeiling);
        }
        if (workers != null) {
            builder.workerCount(workers);
        }
        if (perWorkerMemory != null) {
            builder.perWorkerMemoryBudget(perWorkerMemory);
        }
        if (failureRateThreshold != null) {
            builder.failureRateThreshold(failureRateThreshold);
        }
        if (checkpointInterval != null) {
            builder.checkpointInterval(checkpointInterval);
        }
        if (timeout != null) {
            builder.wallClockTimeout(timeout);
        }
        if (minIntegrityScore != null) {
            builder.minIntegrityScore(minIntegrityScore);
        }
        if (warningFraction != null) {
            builder.warningFraction(warningFraction);
        }
        if (hardFraction != null) {
            builder.hardFraction(hardFraction);
        }
        if (memorySampleInterval != null) {
            builder.memorySampleInterval(memorySampleInterval);
        }
        if (memoryGraceWindow != null) {
            builder.memoryGraceWindow(memoryGraceWindow);
        }
        if (transformer != null) {
            builder.transformer(transformer);
        }
        if (workDir != null) {
            builder.workDir(workDir);
        }
        if (resume != null) {
            builder.resume(resume);
        }
        return builder.build();
    }
}
