package io.nosqlbench.streamconvert.split;

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

/// Layout of the source file.
public enum SourceFormat {
    /// Decide from the first non-whitespace byte: `[` means [#JSON_ARRAY], anything else [#JSON_LINES].
    AUTO,
    /// One top-level JSON array whose elements are the records.
    JSON_ARRAY,
    /// One record per line. A malformed line is one failed record, not a broken source.
    JSON_LINES,
    /// Whitespace separated top-level values, such as pretty-printed records one after another.
    /// Never picked by [#AUTO].
    JSON_STREAM
}
