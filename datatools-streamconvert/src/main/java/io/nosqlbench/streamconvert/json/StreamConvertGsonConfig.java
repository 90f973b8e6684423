package io.nosqlbench.streamconvert.json;

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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

/// Gson configuration shared by the processing report and the `status` output.
///
/// Field names are written in snake_case. [Instant], [Duration] and [Path] values are written as
/// their ISO-8601 or path string forms, since reflective access into `java.*` types is not
/// permitted on current JDKs.
///
/// The [Gson] instances are thread-safe and shared.
public final class StreamConvertGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private StreamConvertGsonConfig() {
    }

    /// @return the shared, pretty printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a single-line instance for line oriented output
    public static Gson compactGson() {
        return COMPACT;
    }

    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(Instant.class, new StringFormAdapter<>(Instant::toString, Instant::parse).nullSafe())
            .registerTypeAdapter(Duration.class, new StringFormAdapter<>(Duration::toString, Duration::parse).nullSafe())
            .registerTypeHierarchyAdapter(Path.class, new StringFormAdapter<Path>(Path::toString, Path::of).nullSafe());
    }

    private static final class StringFormAdapter<T> extends TypeAdapter<T> {
        private final Function<T, String> writer;
        private final Function<String, T> reader;

        private StringFormAdapter(Function<T, String> writer,
                                  Function<String, T> reader) {
            this.writer = writer;
            this.reader = reader;
        }

        @Override
        public void write(JsonWriter out, T value) throws IOException {
            out.value(writer.apply(value));
        }

        @Override
        public T read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return reader.apply(in.nextString());
        }
    }
}
