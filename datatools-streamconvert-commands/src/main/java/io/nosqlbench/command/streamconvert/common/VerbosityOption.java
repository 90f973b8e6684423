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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags, which control both the
 * console summary and the log level of the pipeline packages.
 */
public class VerbosityOption {

    static final String LOGGER_ROOT = "io.nosqlbench";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output, including debug logging of each chunk"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Checks if normal (non-verbose, non-quiet) output should be shown.
     *
     * @return true if normal output should be shown
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates the flags and sets the pipeline log level to match them.
     *
     * @throws CommandLine.ParameterException if both verbose and quiet are enabled
     */
    public void apply(CommandLine.Model.CommandSpec spec) {
        if (verbose && quiet) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Cannot specify both --verbose and --quiet options");
        }
        if (verbose) {
            Configurator.setLevel(LOGGER_ROOT, Level.DEBUG);
        } else if (quiet) {
            Configurator.setLevel(LOGGER_ROOT, Level.ERROR);
        }
    }
}
