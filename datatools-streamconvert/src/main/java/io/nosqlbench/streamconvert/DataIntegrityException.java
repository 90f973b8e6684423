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

/// Too many records failed conversion, either inside one chunk or across the whole dataset.
public class DataIntegrityException extends PipelineException {

    public DataIntegrityException(String message) {
        super(ExitCode.DATA_INTEGRITY, message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(ExitCode.DATA_INTEGRITY, message, cause);
    }
}
