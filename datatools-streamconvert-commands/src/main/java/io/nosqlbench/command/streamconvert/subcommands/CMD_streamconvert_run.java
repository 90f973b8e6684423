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

import io.nosqlbench.command.streamconvert.common.PipelineConfigOptions;
import io.nosqlbench.command.streamconvert.common.VerbosityOption;
import io.nosqlbench.streamconvert.config.PipelineConfig;
import io.nosqlbench.streamconvert.json.StreamConvertGsonConfig;
import io.nosqlbench.streamconvert.pipeline.PipelineOrchestrator;
import io.nosqlbench.streamconvert.pipeline.PipelineSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the whole pipeline: split, convert, checkpoint, assemble.
 *
 * <p>The exit code is the pipeline's. An interrupt (Ctrl-C) cancels the run cooperatively; the
 * JVM waits for in-flight chunks to stop so that the checkpoint log stays valid, and a later
 * {@code run} with the same arguments resumes after the last committed chunk.</p>
 */
@CommandLine.Command(name = "run",
    header = "Convert a source file into a dataset",
    description = "Splits the source into chunks, converts them in parallel under a memory ceiling,"
        + " and writes the dataset plus <output>.report.json. Interrupted runs resume automatically.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: success",
        "1: data integrity failure",
        "2: memory ceiling exceeded",
        "3: timeout or cancelled",
        "64: invalid command line input",
        "70: internal error"
    })
public class CMD_streamconvert_run implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_streamconvert_run.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"},
        paramLabel = "FILE",
        description = "Source file, a JSON array or JSON lines",
        required = true)
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Dataset file; .jsonl writes one record per line, .json one document",
        required = true)
    private Path output;

    @CommandLine.Option(names = {"--json"},
        description = "Print the run summary as JSON instead of text")
    private boolean json = false;

    @CommandLine.Mixin
    private PipelineConfigOptions configOptions = new PipelineConfigOptions();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        verbosity.apply(spec);
        PipelineOrchestrator orchestrator = buildOrchestrator();

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            orchestrator.cancel();
            try {
                if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.error("pipeline did not stop within {} seconds of the interrupt", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "streamconvert-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        PipelineSummary summary;
        try {
            summary = orchestrator.run();
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }

        if (json) {
            System.out.println(StreamConvertGsonConfig.gson().toJson(summary));
        } else if (verbosity.showNormalOutput() || !summary.succeeded()) {
            System.out.print(summary.describe());
        }
        return summary.exitCode().code();
    }

    private PipelineOrchestrator buildOrchestrator() {
        try {
            PipelineConfig config = configOptions.toConfig();
            logger.debug("pipeline config: {}", config);
            return PipelineOrchestrator.builder()
                .source(input)
                .output(output)
                .config(config)
                .build();
        } catch (IOException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "cannot read config file: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // the JVM is already shutting down and the hook is running
            logger.debug("shutdown in progress, hook stays registered");
        }
    }
}
