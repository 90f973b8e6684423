package io.nosqlbench.streamconvert.assemble;

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

import java.nio.file.Path;
import java.util.Locale;

/// Layout of the final dataset, chosen from the output file name.
public enum OutputFormat {
    /// One conversion record per line.
    JSON_LINES,
    /// A single document: `{"name": ..., "total_records": N, "records": [...]}`.
    JSON_DOCUMENT;

    public static OutputFormat forPath(Path output) {
        String name = output.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jsonl") || name.endsWith(".ndjson") ? JSON_LINES : JSON_DOCUMENT;
    }
}
