package io.nosqlbench.streamconvert.memory;

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

/// Memory use relative to the configured ceiling.
public enum MemoryLevel {
    /** Below the warning threshold */
    NORMAL,
    /** At or above the warning threshold: workers should release buffers */
    WARNING,
    /** At or above the hard threshold: no new chunks are admitted */
    HARD
}
