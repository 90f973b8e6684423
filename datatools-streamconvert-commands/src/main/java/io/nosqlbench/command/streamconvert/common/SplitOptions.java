package io.nosqlbench.command.streamconvert.common;

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

import io.nosqlbench.streamconvert.config.ConfigValues;
import io.nosqlbench.streamconvert.config.PipelineConfig;
import io.nosqlbench.streamconvert.split.SourceFormat;
import picocli.CommandLine;

import java.time.Duration;

/**
 * Options that decide how a source is cut into chunks. Shared by {@code split}, {@code verify}
 * and, through {@link PipelineConfigOptions}, {@code run}; the chunk plan only matches between
 * commands when these agree.
 *
 * <p>Unset options stay null so that values from a YAML config file are not overridden.</p>
 */
public class SplitOptions {

    @CommandLine.Option(
        names = {"--max-chunk-bytes"},
        paramLabel = "SIZE",
        description = "Byte ceiling per chunk, e.g. 16MiB, 200MB, 512k (default: 16MiB)",
        converter = SizeConverter.class
    )
    private Long maxChunkBytes;

    @CommandLine.Option(
        names = {"--max-objects-per-chunk"},
        paramLabel = "N",
        description = "Record ceiling per chunk (default: 10000)"
    )
    private Integer maxObjectsPerChunk;

    @CommandLine.Option(
        names = {"--source-format"},
        paramLabel = "FORMAT",
        description = "Source layout, one of ${COMPLETION-CANDIDATES} (default: auto)"
    )
    private SourceFormat sourceFormat;

    public void applyTo(PipelineConfig.Builder builder) {
        if (maxChunkBytes != null) {
            builder.maxChunkBytes(maxChunkBytes);
        }
        if (maxObjectsPerChunk != null) {
            builder.maxObjectsPerChunk(maxObjectsPerChunk);
        }
        if (sourceFormat != null) {
            builder.sourceFormat(sourceFormat);
        }
    }

    /// Picocli converter for byte sizes with optional unit suffix.
    public static final class SizeConverter implements CommandLine.ITypeConverter<Long> {
        @Override
        public Long convert(String value) {
            try {
                return ConfigValues.parseSize(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /// Picocli converter for durations such as `30m`, `10s`, `250ms` or ISO-8601 `PT5M`.
    public static final class DurationConverter implements CommandLine.ITypeConverter<Duration> {
        @Override
        public Duration convert(String value) {
            try {
                return ConfigValues.parseDuration(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
