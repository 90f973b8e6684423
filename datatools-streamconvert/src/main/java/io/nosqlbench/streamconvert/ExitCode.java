package io.nosqlbench.streamconvert;

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

/// Process exit codes reported by a pipeline run.
///
/// Codes 0 through 3 are the outcome of [io.nosqlbench.streamconvert.pipeline.PipelineOrchestrator#run()].
/// The remaining codes are used by the command line front end only.
public enum ExitCode {
    SUCCESS(0),
    DATA_INTEGRITY(1),
    RESOURCE_EXHAUSTED(2),
    TIMEOUT(3),
    INVALID_INPUT(64),
    INTERNAL_ERROR(70);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
