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

import io.nosqlbench.streamconvert.ExitCode;
import io.nosqlbench.streamconvert.pipeline.WorkDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Removes a work directory. Only directories that hold a checkpoint log or a chunk directory
/// are touched, so a mistyped path cannot delete unrelated files.
@CommandLine.Command(name = "clean",
    header = "Remove the intermediate files of a run",
    description = "PATH is a work directory, or the output file of a run whose work directory"
        + " is <output>.work. Removing the checkpoint log discards all resumable progress.",
    exitCodeList = {"0: removed or nothing to remove", "1: removal failed", "64: not a work directory"})
public class CMD_streamconvert_clean implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_streamconvert_clean.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PATH",
        description = "Work directory or output file")
    private Path path;

    @CommandLine.Option(names = {"--keep-log"},
        description = "Remove chunk and result files only, keeping the checkpoint logs")
    private boolean keepLog = false;

    @Override
    public Integer call() {
        WorkDirectory work = CMD_streamconvert_status.resolve(path);
        if (!Files.exists(work.root())) {
            System.out.println("Nothing to clean at " + work.root());
            return ExitCode.SUCCESS.code();
        }
        boolean looksLikeWorkDir = Files.exists(work.checkpointLog()) || Files.exists(work.sealedCheckpointLog())
            || Files.isDirectory(work.chunks()) || Files.isDirectory(work.results());
        if (!Files.isDirectory(work.root()) || !looksLikeWorkDir) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "not a work directory: " + work.root());
        }

        try {
            if (keepLog) {
                work.deleteIntermediates();
                System.out.println("Removed chunk and result files from " + work.root());
            } else {
                work.deleteAll();
                System.out.println("Removed " + work.root());
            }
            return ExitCode.SUCCESS.code();
        } catch (IOException e) {
            logger.error("cleaning {} failed", work.root(), e);
            System.err.println("Error: " + e.getMessage());
            return ExitCode.DATA_INTEGRITY.code();
        }
    }
}
