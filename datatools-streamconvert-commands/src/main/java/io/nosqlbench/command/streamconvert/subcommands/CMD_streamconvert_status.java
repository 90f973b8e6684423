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
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.checkpoint.CheckpointLog;
import io.nosqlbench.streamconvert.checkpoint.CheckpointStatus;
import io.nosqlbench.streamconvert.checkpoint.ProcessingCheckpoint;
import io.nosqlbench.streamconvert.json.StreamConvertGsonConfig;
import io.nosqlbench.streamconvert.pipeline.WorkDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Prints the progress recorded in a work directory's checkpoint log, without modifying it.
 *
 * <p>A live log means the run is unfinished (or running); a sealed log means the dataset was
 * written. An invalid tail is reported but not repaired; the next {@code run} truncates it.</p>
 */
@CommandLine.Command(name = "status",
    header = "Show the checkpoint progress of a run",
    description = "PATH is a work directory, or the output file of a run whose work directory"
        + " is <output>.work.",
    exitCodeList = {"0: log found", "1: no readable checkpoint log", "64: invalid command line input"})
public class CMD_streamconvert_status implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_streamconvert_status.class);

    @CommandLine.Parameters(index = "0", paramLabel = "PATH",
        description = "Work directory or output file")
    private Path path;

    @CommandLine.Option(names = {"--json"},
        description = "Print the status as JSON")
    private boolean json = false;

    @CommandLine.Option(names = {"-l", "--list"},
        description = "List every checkpoint, not just the last")
    private boolean list = false;

    /// What `status` reports, also its JSON form.
    public record Status(
        Path workDir,
        Path logFile,
        boolean sealed,
        UUID pipelineId,
        String fingerprint,
        long checkpointCount,
        int lastChunkId,
        long recordsCommitted,
        Instant lastCommit,
        long degradedCheckpoints,
        long invalidTailBytes,
        String tailProblem,
        List<ProcessingCheckpoint> checkpoints
    ) {
    }

    @Override
    public Integer call() {
        WorkDirectory work = resolve(path);
        Path logFile = Files.isRegularFile(work.checkpointLog()) ? work.checkpointLog() : work.sealedCheckpointLog();
        if (!Files.isRegularFile(logFile)) {
            System.err.println("No checkpoint log in " + work.root());
            return ExitCode.DATA_INTEGRITY.code();
        }

        Status status;
        try {
            status = read(work, logFile, list);
        } catch (IntegrityException e) {
            System.err.println("Error: " + e.getMessage());
            return e.exitCode().code();
        } catch (IOException e) {
            logger.error("reading {} failed", logFile, e);
            System.err.println("Error: " + e.getMessage());
            return ExitCode.DATA_INTEGRITY.code();
        }

        if (json) {
            System.out.println(StreamConvertGsonConfig.gson().toJson(status));
        } else {
            print(status);
        }
        return ExitCode.SUCCESS.code();
    }

    /// A directory holding a live or sealed log is a work directory; anything else is taken as
    /// an output file.
    static WorkDirectory resolve(Path path) {
        WorkDirectory direct = new WorkDirectory(path);
        if (Files.isDirectory(path)
            && (Files.exists(direct.checkpointLog()) || Files.exists(direct.sealedCheckpointLog())
            || Files.isDirectory(direct.chunks()))) {
            return direct;
        }
        Path abs = path.toAbsolutePath();
        return new WorkDirectory(abs.resolveSibling(abs.getFileName() + ".work"));
    }

    static Status read(WorkDirectory work, Path logFile, boolean keepCheckpoints)
        throws IOException, IntegrityException {
        List<ProcessingCheckpoint> checkpoints = new ArrayList<>();
        long[] degraded = new long[1];
        CheckpointLog.Inspection inspection = CheckpointLog.inspect(logFile, checkpoint -> {
            if (checkpoint.status() == CheckpointStatus.DEGRADED) {
                degraded[0]++;
            }
            if (keepCheckpoints) {
                checkpoints.add(checkpoint);
            }
        });
        ProcessingCheckpoint last = inspection.last().orElse(null);
        return new Status(
            work.root(),
            logFile,
            logFile.equals(work.sealedCheckpointLog()),
            inspection.pipelineId(),
            inspection.fingerprint(),
            inspection.checkpointCount(),
            last == null ? 0 : last.chunkId(),
            last == null ? 0 : last.cumulativeRecordCount(),
            last == null ? null : last.timestamp(),
            degraded[0],
            inspection.invalidTailBytes(),
            inspection.tailProblem(),
            keepCheckpoints ? checkpoints : null);
    }

    private static void print(Status status) {
        System.out.println("work directory:     " + status.workDir());
        System.out.println("checkpoint log:     " + status.logFile().getFileName()
            + (status.sealed() ? " (sealed, run completed)" : " (live)"));
        System.out.println("pipeline id:        " + status.pipelineId());
        System.out.println("checkpoints:        " + status.checkpointCount());
        System.out.println("last chunk:         " + status.lastChunkId());
        System.out.println("records committed:  " + status.recordsCommitted());
        if (status.lastCommit() != null) {
            System.out.println("last commit:        " + status.lastCommit());
        }
        if (status.degradedCheckpoints() > 0) {
            System.out.println("degraded:           " + status.degradedCheckpoints() + " checkpoints cover skipped records");
        }
        if (status.invalidTailBytes() > 0) {
            System.out.println("invalid tail:       " + status.invalidTailBytes() + " bytes ("
                + status.tailProblem() + "), truncated on the next run");
        }
        if (status.checkpoints() != null) {
            for (ProcessingCheckpoint checkpoint : status.checkpoints()) {
                System.out.printf("  chunk %6d  %10d records  %-8s  %s  %s%n", checkpoint.chunkId(),
                    checkpoint.cumulativeRecordCount(), checkpoint.status(), checkpoint.timestamp(),
                    checkpoint.contentHash());
            }
        }
    }
}
