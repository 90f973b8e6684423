package io.nosqlbench.streamconvert.checkpoint;

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

/// Outcome of a committed chunk.
public enum CheckpointStatus {
    /** Every record converted */
    CLEAN(0),
    /** Some records were skipped, within the failure rate threshold */
    DEGRADED(1);

    private final int code;

    CheckpointStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static CheckpointStatus fromCode(int code) {
        for (CheckpointStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown checkpoint status code " + code);
    }
}
