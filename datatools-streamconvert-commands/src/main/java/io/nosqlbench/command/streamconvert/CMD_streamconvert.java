package io.nosqlbench.command.streamconvert;

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

import io.nosqlbench.command.streamconvert.subcommands.CMD_streamconvert_clean;
import io.nosqlbench.command.streamconvert.subcommands.CMD_streamconvert_run;
import io.nosqlbench.command.streamconvert.subcommands.CMD_streamconvert_split;
import io.nosqlbench.command.streamconvert.subcommands.CMD_streamconvert_status;
import io.nosqlbench.command.streamconvert.subcommands.CMD_streamconvert_verify;
import io.nosqlbench.streamconvert.ExitCode;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Streaming Dataset Conversion

 Converts a large JSON dataset into the normalized question/answer record layout with bounded
 memory. The source is split into chunk files at record boundaries, the chunks are converted in
 parallel, and progress is recorded in an append-only checkpoint log so that an interrupted run
 continues where it stopped.

 ## Subcommands
 - `run`: the full pipeline, from source file to dataset file
 - `split`: split a source into chunk files and print the plan
 - `verify`: check chunk files against the plan re-derived from the source
 - `status`: print the checkpoint log of a work directory
 - `clean`: remove a work directory

 # Basic Usage
 ```
 streamconvert run --input planning.json --output planning_bool.jsonl --transformer boolean
 streamconvert status planning_bool.jsonl
 ```
 */
@CommandLine.Command(name = "streamconvert",
    header = "Convert large JSON datasets in resumable, memory-bounded chunks",
    description = "Splits a JSON array or JSON-lines source into chunks, converts them in parallel,"
        + " and assembles a normalized dataset. Use a subcommand.",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_streamconvert.VersionProvider.class,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: success",
        "1: data integrity failure",
        "2: memory ceiling exceeded",
        "3: timeout or cancelled",
        "64: invalid command line input",
        "70: internal error"
    },
    subcommands = {
        CMD_streamconvert_run.class,
        CMD_streamconvert_split.class,
        CMD_streamconvert_verify.class,
        CMD_streamconvert_status.class,
        CMD_streamconvert_clean.class,
        CommandLine.HelpCommand.class
    })
public class CMD_streamconvert implements Callable<Integer> {

    public CMD_streamconvert() {
    }

    /// A command line configured the way [#main(String[])] runs it.
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_streamconvert())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExitCodeOnInvalidInput(ExitCode.INVALID_INPUT.code())
            .setExitCodeOnExecutionException(ExitCode.INTERNAL_ERROR.code());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_streamconvert.class.getPackage().getImplementationVersion();
            return new String[]{"streamconvert " + (version != null ? version : "development build")};
        }
    }
}
