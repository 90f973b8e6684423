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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class MemoryMonitorTest {

    private static final long CEILING = 1_000_000;

    private final AtomicLong used = new AtomicLong();
    private MemoryMonitor monitor;

    @BeforeEach
    void setUp() {
        used.set(0);
        monitor = new MemoryMonitor(CEILING, 0.80, 0.90, Duration.ofMillis(10), used::get);
    }

    @Test
    void classifiesAgainstThresholds() {
        used.set(799_999);
        assertThat(monitor.sample().level()).isEqualTo(MemoryLevel.NORMAL);
        used.set(800_000);
        assertThat(monitor.sample().level()).isEqualTo(MemoryLevel.WARNING);
        used.set(900_000);
        assertThat(monitor.sample().level()).isEqualTo(MemoryLevel.HARD);
        assertThat(monitor.level()).isEqualTo(MemoryLevel.HARD);
    }

    @Test
    void notifiesListenersOnlyOnCrossings() {
        List<String> events = new ArrayList<>();
        monitor.addListener((previous, current) -> events.add(previous + "->" + current.level()));

        for (long reading : new long[]{100, 200, 850_000, 860_000, 950_000, 100}) {
            used.set(reading);
            monitor.sample();
        }

        assertThat(events).containsExactly("NORMAL->WARNING", "WARNING->HARD", "HARD->NORMAL");
    }

    @Test
    void tracksPeakAndHardDuration() throws Exception {
        used.set(950_000);
        monitor.sample();
        Thread.sleep(20);
        used.set(920_000);
        monitor.sample();

        assertThat(monitor.peakBytes()).isEqualTo(950_000);
        assertThat(monitor.hardDuration()).isGreaterThanOrEqualTo(Duration.ofMillis(20));

        used.set(10);
        monitor.sample();
        assertThat(monitor.hardDuration()).isEqualTo(Duration.ZERO);
        assertThat(monitor.peakBytes()).isEqualTo(950_000);
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < MemoryMonitor.HISTORY_SIZE + 15; i++) {
            used.set(i);
            monitor.sample();
        }
        List<MemorySample> history = monitor.history();
        assertThat(history).hasSize(MemoryMonitor.HISTORY_SIZE);
        assertThat(history.get(history.size() - 1).usedBytes()).isEqualTo(MemoryMonitor.HISTORY_SIZE + 14);
    }

    @Test
    void reportsTrend() {
        assertThat(monitor.trend()).isEqualTo(MemoryTrend.INSUFFICIENT_DATA);
        for (long reading : new long[]{100_000, 110_000, 130_000, 150_000}) {
            used.set(reading);
            monitor.sample();
        }
        assertThat(monitor.trend()).isEqualTo(MemoryTrend.INCREASING);
        for (int i = 0; i < 10; i++) {
            used.set(150_000 + i);
            monitor.sample();
        }
        assertThat(monitor.trend()).isEqualTo(MemoryTrend.STABLE);
        for (int i = 0; i < 10; i++) {
            used.set(150_000 - i * 10_000);
            monitor.sample();
        }
        assertThat(monitor.trend()).isEqualTo(MemoryTrend.DECREASING);
    }

    @Test
    void awaitBelowReturnsOnceUsageDrops() {
        used.set(950_000);
        monitor.sample();
        Thread dropper = new Thread(() -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            used.set(100);
        });
        dropper.start();

        assertThat(monitor.awaitBelow(MemoryLevel.WARNING, Duration.ofSeconds(5))).isTrue();
        assertThat(monitor.level()).isEqualTo(MemoryLevel.NORMAL);
    }

    @Test
    void awaitBelowTimesOutWhenUsageStaysHigh() {
        used.set(990_000);
        assertThat(monitor.awaitBelow(MemoryLevel.HARD, Duration.ofMillis(50))).isFalse();
    }

    @Test
    void backgroundSamplingReachesListeners() throws Exception {
        CountDownLatch hard = new CountDownLatch(1);
        monitor.addListener((previous, current) -> {
            if (current.level() == MemoryLevel.HARD) {
                hard.countDown();
            }
        });
        try (MemoryMonitor running = monitor) {
            running.start();
            used.set(999_999);
            assertThat(hard.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void rejectsInvalidThresholds() {
        assertThatThrownBy(() -> new MemoryMonitor(CEILING, 0.95, 0.90, Duration.ofMillis(10), used::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("warningFraction");
        assertThatThrownBy(() -> new MemoryMonitor(0, 0.5, 0.9, Duration.ofMillis(10), used::get))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
