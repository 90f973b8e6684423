package io.nosqlbench.streamconvert.process;

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

/// Decides when per-record failures make a whole chunk fail: a chunk with `f` failures out of
/// `n` records fails iff `f / n > threshold`.
public record FailureRatePolicy(double threshold) {

    public FailureRatePolicy {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
    }

    public boolean exceeded(long failures, long total) {
        if (total <= 0 || failures <= 0) {
            return false;
        }
        return (double) failures / total > threshold;
    }
}
