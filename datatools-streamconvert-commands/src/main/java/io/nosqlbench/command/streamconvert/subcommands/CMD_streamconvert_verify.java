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
import io.nosqlbench.streamconvert.split.BoundarySplitter;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import io.nosqlbench.streamconvert.split.ChunkVerifier;
import io.nosqlbench.streamconvert.split.ChunkWriteMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Re-derives the chunk plan from the source, without writing anything, and checks the chunk
/// files on disk against it. The split options must match the ones the chunks were written with.
@CommandLine.Command(name = "verify",
    header = "Check chunk files against the source",
    description = "Each chunk file must exist, match the checksum the source implies, and hold"
        + " a complete JSON array with the planned number of records.",
    exitCodeList = {"0: all chunks valid", "1: missing, modified or damaged chunks", "64: invalid command line input"})
public class CMD_streamconvert_verify implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_streamconvert_verify.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"},
        paramLabel = "FILE",
        description = "Source file the chunks were split from",
        required = true)
    private Path input;

    @CommandLine.Option(names = {"--chunk-dir"},
        paramLabel = "DIR",
        description = "Directory holding the chunk files (default: <input>.chunks;"
            + " for a pipeline run use <output>.work/chunks)")
    private Path chunkDir;

    @CommandLine.Mixin
    private SplitOptions splitOptions = new SplitOptions();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        verbosity.apply(spec);
        BoundarySplitter splitter = CMD_streamconvert_split.splitterFor(spec, splitOptions);
        Path dir = chunkDir != null ? chunkDir : CMD_streamconvert_split.defaultChunkDir(input);
        if (!Files.isDirectory(dir)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "chunk directory not found: " + dir);
        }

        try {
            ChunkPlan plan = splitter.split(input, dir, ChunkWriteMode.DIGEST_ONLY);
            List<ChunkVerifier.Problem> problems = ChunkVerifier.verify(plan);
            for (ChunkVerifier.Problem problem : problems) {
                System.out.println(problem);
            }
            if (!problems.isEmpty()) {
                System.out.printf("%d of %d chunks failed verification%n", problems.size(), plan.chunkCount());
                return ExitCode.DATA_INTEGRITY.code();
            }
            if (verbosity.showNormalOutput()) {
                System.out.printf("all %d chunks verified (%d records)%n", plan.chunkCount(), plan.totalRecords());
            }
            return ExitCode.SUCCESS.code();
        } catch (IntegrityException e) {
            System.err.println("Error: " + e.getMessage());
            return e.exitCode().code();
        } catch (IOException e) {
            logger.error("verifying chunks in {} failed", dir, e);
            System.err.println("Error: " + e.getMessage());
            return ExitCode.DATA_INTEGRITY.code();
        }
    }
}
