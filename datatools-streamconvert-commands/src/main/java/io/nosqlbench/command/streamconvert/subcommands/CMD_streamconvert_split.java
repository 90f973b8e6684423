package io.nosqlbench.command.streamconvert.subcommands;

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

import io.nosqlbench.command.streamconvert.common.SplitOptions;
import io.nosqlbench.command.streamconvert.common.VerbosityOption;
import io.nosqlbench.streamconvert.ExitCode;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.config.ConfigValues;
import io.nosqlbench.streamconvert.config.PipelineConfig;
import io.nosqlbench.streamconvert.split.BoundarySplitter;
import io.nosqlbench.streamconvert.split.ChunkDescriptor;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import io.nosqlbench.streamconvert.split.ChunkWriteMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Splits a source into chunk files without converting anything, and prints the plan.
 * Useful for sizing {@code --max-chunk-bytes} and {@code --max-objects-per-chunk} before a run.
 */
@CommandLine.Command(name = "split",
    header = "Split a source into chunk files and print the plan",
    description = "Writes one JSON array file per chunk, cut only at record boundaries.",
    exitCodeList = {"0: success", "1: malformed or truncated source", "64: invalid command line input"})
public class CMD_streamconvert_split implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_streamconvert_split.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"},
        paramLabel = "FILE",
        description = "Source file, a JSON array or JSON lines",
        required = true)
    private Path input;

    @CommandLine.Option(names = {"--chunk-dir"},
        paramLabel = "DIR",
        description = "Directory for the chunk files (default: <input>.chunks)")
    private Path chunkDir;

    @CommandLine.Mixin
    private SplitOptions splitOptions = new SplitOptions();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        verbosity.apply(spec);
        BoundarySplitter splitter = splitterFor(spec, splitOptions);
        Path target = chunkDir != null ? chunkDir : defaultChunkDir(input);

        ChunkPlan plan;
        try {
            plan = splitter.split(input, target, ChunkWriteMode.WRITE);
        } catch (IntegrityException e) {
            System.err.println("Error: " + e.getMessage());
            return e.exitCode().code();
        } catch (IOException e) {
            logger.error("splitting {} failed", input, e);
            System.err.println("Error: " + e.getMessage());
            return ExitCode.DATA_INTEGRITY.code();
        }

        if (verbosity.showNormalOutput()) {
            for (ChunkDescriptor chunk : plan.chunks()) {
                System.out.printf("%s  records [%d,%d)  bytes [%d,%d)  %s%n", chunk.file().getFileName(),
                    chunk.firstRecord(), chunk.endRecord(), chunk.byteStart(), chunk.byteEnd(), chunk.checksum());
            }
            System.out.printf("%d records in %d chunks (%s %s source) written to %s%n", plan.totalRecords(),
                plan.chunkCount(), ConfigValues.formatBytes(plan.sourceBytes()), plan.format(), target);
        }
        return ExitCode.SUCCESS.code();
    }

    static Path defaultChunkDir(Path input) {
        Path abs = input.toAbsolutePath();
        return abs.resolveSibling(abs.getFileName() + ".chunks");
    }

    /// Builds a splitter from the options, with the same defaults and validation as `run`.
    static BoundarySplitter splitterFor(CommandLine.Model.CommandSpec spec, SplitOptions options) {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        options.applyTo(builder);
        try {
            PipelineConfig config = builder.build();
            return new BoundarySplitter(config.maxChunkBytes(), config.maxObjectsPerChunk(), config.sourceFormat());
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
