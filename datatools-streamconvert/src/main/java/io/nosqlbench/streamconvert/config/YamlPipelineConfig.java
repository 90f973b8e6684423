package io.nosqlbench.streamconvert.config;

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

import io.nosqlbench.streamconvert.split.SourceFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/// Reads pipeline settings from a YAML mapping onto a [PipelineConfig.Builder].
///
/// Keys use the snake_case setting names (`max_chunk_bytes`, `memory_ceiling`, ...); dashes are
/// accepted in place of underscores. Size and duration values may be given as numbers or with
/// units, see [ConfigValues].
///
/// ```yaml
/// max_chunk_bytes: 8MiB
/// max_objects_per_chunk: 5000
/// wall_clock_timeout: 45m
/// transformer: mcq
/// ```
public final class YamlPipelineConfig {

    private static final Logger logger = LogManager.getLogger(YamlPipelineConfig.class);

    private YamlPipelineConfig() {
    }

    public static PipelineConfig.Builder load(Path yamlFile, PipelineConfig.Builder builder) throws IOException {
        return apply(Files.readString(yamlFile), builder);
    }

    public static PipelineConfig.Builder apply(String yamlText, PipelineConfig.Builder builder) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object loaded = yaml.loadFromString(yamlText);
        if (loaded == null) {
            return builder;
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("pipeline config must be a YAML mapping, got "
                + loaded.getClass().getSimpleName());
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT).replace('-', '_');
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            applyOne(builder, key, value);
        }
        return builder;
    }

    private static void applyOne(PipelineConfig.Builder builder, String key, Object value) {
        switch (key) {
            case "max_chunk_bytes" -> builder.maxChunkBytes(size(value));
            case "max_objects_per_chunk" -> builder.maxObjectsPerChunk(Math.toIntExact(integer(key, value)));
            case "memory_ceiling", "memory_ceiling_bytes" -> builder.memoryCeilingBytes(size(value));
            case "worker_count", "workers" -> builder.workerCount(Math.toIntExact(integer(key, value)));
            case "per_worker_memory_budget" -> builder.perWorkerMemoryBudget(size(value));
            case "failure_rate_threshold" -> builder.failureRateThreshold(decimal(key, value));
            case "checkpoint_interval" -> builder.checkpointInterval(Math.toIntExact(integer(key, value)));
            case "wall_clock_timeout", "timeout" -> builder.wallClockTimeout(duration(value));
            case "min_integrity_score" -> builder.minIntegrityScore(decimal(key, value));
            case "warning_fraction" -> builder.warningFraction(decimal(key, value));
            case "hard_fraction" -> builder.hardFraction(decimal(key, value));
            case "memory_sample_interval" -> builder.memorySampleInterval(duration(value));
            case "memory_grace_window" -> builder.memoryGraceWindow(duration(value));
            case "source_format", "format" -> builder.sourceFormat(
                SourceFormat.valueOf(value.toString().trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            case "transformer" -> builder.transformer(value.toString());
            case "work_dir" -> builder.workDir(Path.of(value.toString()));
            case "resume" -> builder.resume(bool(key, value));
            default -> logger.warn("ignoring unknown pipeline config key '{}'", key);
        }
    }

    private static long size(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return ConfigValues.parseSize(value.toString());
    }

    private static Duration duration(Object value) {
        if (value instanceof Number n) {
            return Duration.ofSeconds(n.longValue());
        }
        return ConfigValues.parseDuration(value.toString());
    }

    private static long integer(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static double decimal(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean bool(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }
}
