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

/**
 * Malformed or truncated source input found while splitting, or a chunk plan
 * that no longer matches what was committed by an earlier run.
 */
public class IntegrityException extends PipelineException {

    private final long byteOffset;

    public IntegrityException(String message, long byteOffset) {
        super(ExitCode.DATA_INTEGRITY, byteOffset >= 0 ? message + " at byte offset " + byteOffset : message);
        this.byteOffset = byteOffset;
    }

    public IntegrityException(String message) {
        this(message, -1L);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ExitCode.DATA_INTEGRITY, message, cause);
        this.byteOffset = -1L;
    }

    /// @return the source offset of the problem, or -1 when it is not tied to a position
    public long byteOffset() {
        return byteOffset;
    }
}
