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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class YamlPipelineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsAllSettingsFromFile() throws Exception {
        Path file = tempDir.resolve("pipeline.yaml");
        Files.writeString(file, """
            # conversion settings
            max_chunk_bytes: 15MB
            max-objects-per-chunk: 500
            memory_ceiling: 200MB
            workers: 4
            per_worker_memory_budget: 40MiB
            failure_rate_threshold: 0.02
            checkpoint_interval: 5
            wall_clock_timeout: 2h
            min_integrity_score: 0.9
            memory_grace_window: 1500ms
            source_format: json-lines
            transformer: mcq
            resume: false
            """);

        PipelineConfig config = YamlPipelineConfig.load(file, PipelineConfig.builder()).build();

        assertThat(config.maxChunkBytes()).isEqualTo(15_000_000L);
        assertThat(config.maxObjectsPerChunk()).isEqualTo(500);
        assertThat(config.memoryCeilingBytes()).isEqualTo(200_000_000L);
        assertThat(config.workerCount()).isEqualTo(4);
        assertThat(config.perWorkerMemoryBudget()).isEqualTo(40L << 20);
        assertThat(config.failureRateThreshold()).isEqualTo(0.02);
        assertThat(config.checkpointInterval()).isEqualTo(5);
        assertThat(config.wallClockTimeout()).isEqualTo(Duration.ofHours(2));
        assertThat(config.minIntegrityScore()).isEqualTo(0.9);
        assertThat(config.memoryGraceWindow()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.sourceFormat()).isEqualTo(SourceFormat.JSON_LINES);
        assertThat(config.transformer()).isEqualTo("mcq");
        assertThat(config.resume()).isFalse();
    }

    @Test
    void laterBuilderCallsOverrideTheFile() {
        PipelineConfig config = YamlPipelineConfig.apply("memory_ceiling_bytes: 1073741824\nworkers: 2\n",
                PipelineConfig.builder().perWorkerMemoryBudget(1L << 20))
            .workerCount(6)
            .build();

        assertThat(config.memoryCeilingBytes()).isEqualTo(1L << 30);
        assertThat(config.workerCount()).isEqualTo(6);
    }

    @Test
    void numericDurationsAreSeconds() {
        PipelineConfig config = YamlPipelineConfig.apply("timeout: 45\nmemory_ceiling: 1g\n",
            PipelineConfig.builder().perWorkerMemoryBudget(1L << 20)).build();
        assertThat(config.wallClockTimeout()).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void unknownKeysAreIgnored() {
        PipelineConfig config = YamlPipelineConfig.apply("colour: blue\nmemory_ceiling: 1g\n",
            PipelineConfig.builder().perWorkerMemoryBudget(1L << 20)).build();
        assertThat(config.memoryCeilingBytes()).isEqualTo(1L << 30);
    }

    @Test
    void emptyDocumentChangesNothing() {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        assertThat(YamlPipelineConfig.apply("", builder)).isSameAs(builder);
    }

    @Test
    void rejectsNonMappingsAndBadValues() {
        assertThatThrownBy(() -> YamlPipelineConfig.apply("- a\n- b\n", PipelineConfig.builder()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("YAML mapping");
        assertThatThrownBy(() -> YamlPipelineConfig.apply("workers: many\n", PipelineConfig.builder()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("worker");
        assertThatThrownBy(() -> YamlPipelineConfig.apply("resume: perhaps\n", PipelineConfig.builder()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
