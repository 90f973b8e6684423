package io.nosqlbench.streamconvert.testing;

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

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.LongFunction;

/// Writes synthetic source datasets for tests.
public final class SourceFiles {

    private SourceFiles() {
    }

    /// A boolean question record with a unique id.
    public static String booleanRecord(long id) {
        return "{\"id\":\"t" + id + "\",\"question\":\"Is step " + id + " valid?\",\"correct\":"
            + (id % 2 == 0) + ",\"context\":\"plan " + id + "\"}";
    }

    /// A record the boolean transformer rejects, because it has no `correct` field.
    public static String unanswerableRecord(long id) {
        return "{\"id\":\"t" + id + "\",\"question\":\"Is step " + id + " valid?\"}";
    }

    public static Path jsonArray(Path file, long count) throws IOException {
        return jsonArray(file, count, SourceFiles::booleanRecord);
    }

    /// Writes `[r0,\n r1, ...]` with one record per line.
    public static Path jsonArray(Path file, long count, LongFunction<String> record) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("[\n");
            for (long i = 0; i < count; i++) {
                if (i > 0) {
                    out.write(",\n");
                }
                out.write("  ");
                out.write(record.apply(i));
            }
            out.write("\n]\n");
        }
        return file;
    }

    public static Path jsonLines(Path file, long count, LongFunction<String> record) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (long i = 0; i < count; i++) {
                out.write(record.apply(i));
                out.write('\n');
            }
        }
        return file;
    }

    public static Path text(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
