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

/**
 * One memory reading.
 *
 * @param timestampMillis epoch millis of the reading
 * @param usedBytes bytes in use
 * @param ceilingBytes the configured ceiling
 * @param level level of this reading
 */
public record MemorySample(long timestampMillis, long usedBytes, long ceilingBytes, MemoryLevel level) {

    public double usageFraction() {
        return ceilingBytes == 0 ? 0.0 : (double) usedBytes / ceilingBytes;
    }

    @Override
    public String toString() {
        return String.format("MemorySample[used=%d MB, ceiling=%d MB, %.1f%%, %s]",
            usedBytes / (1024 * 1024),
            ceilingBytes / (1024 * 1024),
            usageFraction() * 100,
            level);
    }
}
