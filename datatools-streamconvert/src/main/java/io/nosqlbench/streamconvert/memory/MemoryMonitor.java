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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Samples process memory at a fixed interval and classifies it against a ceiling.
 *
 * <h2>Levels</h2>
 *
 * <ul>
 *   <li><b>NORMAL</b> - below {@code warningFraction} of the ceiling</li>
 *   <li><b>WARNING</b> - workers are asked to release buffered output</li>
 *   <li><b>HARD</b> - at or above {@code hardFraction}; the orchestrator stops admitting chunks,
 *   and fails the run if the level persists beyond its grace window</li>
 * </ul>
 *
 * <p>Listeners are told about every level crossing. The monitor also keeps the peak reading
 * and a bounded history used for {@link #trend()}.</p>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (MemoryMonitor monitor = new MemoryMonitor(ceiling, 0.80, 0.90, Duration.ofMillis(250), MemoryProbe.jvm())) {
 *     monitor.addListener((previous, sample) -> logger.info("memory {}", sample));
 *     monitor.start();
 *     ...
 *     if (monitor.level() == MemoryLevel.HARD) {
 *         // hold back new work
 *     }
 * }
 * }</pre>
 *
 * <p>This class is thread-safe. {@link #sample()} may be called directly, which is what tests do
 * instead of starting the background thread.</p>
 */
public final class MemoryMonitor implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(MemoryMonitor.class);

    /** Number of samples kept for trend analysis */
    public static final int HISTORY_SIZE = 60;

    /** Relative change within which the trend is reported as stable */
    public static final double STABLE_BAND = 0.05;

    private static final int TREND_WINDOW = 10;

    private final long ceilingBytes;
    private final double warningFraction;
    private final double hardFraction;
    private final Duration sampleInterval;
    private final MemoryProbe probe;
    private final List<MemoryListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<MemorySample> history = new ArrayDeque<>(HISTORY_SIZE);

    private volatile MemoryLevel level = MemoryLevel.NORMAL;
    private volatile long peakBytes;
    private long hardSinceNanos = -1;
    private ScheduledExecutorService scheduler;

    /**
     * @param ceilingBytes memory ceiling the fractions apply to
     * @param warningFraction fraction of the ceiling for WARNING, in (0, hardFraction)
     * @param hardFraction fraction of the ceiling for HARD, in (warningFraction, 1]
     * @param sampleInterval interval between background samples
     * @param probe the source of readings
     * @throws IllegalArgumentException if the thresholds are invalid
     */
    public MemoryMonitor(long ceilingBytes, double warningFraction, double hardFraction, Duration sampleInterval,
                         MemoryProbe probe) {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException("ceilingBytes must be positive, got: " + ceilingBytes);
        }
        if (hardFraction <= 0.0 || hardFraction > 1.0) {
            throw new IllegalArgumentException("hardFraction must be in (0, 1], got: " + hardFraction);
        }
        if (warningFraction <= 0.0 || warningFraction >= hardFraction) {
            throw new IllegalArgumentException(
                "warningFraction must be in (0, hardFraction), got: " + warningFraction);
        }
        if (sampleInterval.isZero() || sampleInterval.isNegative()) {
            throw new IllegalArgumentException("sampleInterval must be positive, got: " + sampleInterval);
        }
        this.ceilingBytes = ceilingBytes;
        this.warningFraction = warningFraction;
        this.hardFraction = hardFraction;
        this.sampleInterval = sampleInterval;
        this.probe = probe;
    }

    public void addListener(MemoryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MemoryListener listener) {
        listeners.remove(listener);
    }

    /// Starts background sampling on a daemon thread. Calling it twice has no effect.
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-monitor");
            t.setDaemon(true);
            return t;
        });
        long periodNanos = sampleInterval.toNanos();
        scheduler.scheduleAtFixedRate(this::sampleSafely, 0, periodNanos, TimeUnit.NANOSECONDS);
        logger.debug("memory monitor started, ceiling {} MB, sampling every {} ms",
            ceilingBytes / (1024 * 1024), sampleInterval.toMillis());
    }

    /// A failing probe or listener must not cancel the periodic task.
    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            logger.error("memory sample failed", e);
        }
    }

    /// Takes one reading, updates level, peak and history, and notifies listeners on a crossing.
    public MemorySample sample() {
        long used = probe.usedBytes();
        MemoryLevel previous;
        MemorySample sample;
        synchronized (this) {
            MemoryLevel current = classify(used);
            sample = new MemorySample(System.currentTimeMillis(), used, ceilingBytes, current);
            if (history.size() == HISTORY_SIZE) {
                history.removeFirst();
            }
            history.addLast(sample);
            if (used > peakBytes) {
                peakBytes = used;
            }
            previous = level;
            if (current == MemoryLevel.HARD && previous != MemoryLevel.HARD) {
                hardSinceNanos = System.nanoTime();
            } else if (current != MemoryLevel.HARD) {
                hardSinceNanos = -1;
            }
            level = current;
        }
        if (previous != sample.level()) {
            if (sample.level().compareTo(previous) > 0) {
                logger.warn("memory level {} -> {}: {}", previous, sample.level(), sample);
            } else {
                logger.info("memory level {} -> {}: {}", previous, sample.level(), sample);
            }
            for (MemoryListener listener : listeners) {
                listener.levelChanged(previous, sample);
            }
        }
        return sample;
    }

    private MemoryLevel classify(long used) {
        double fraction = (double) used / ceilingBytes;
        if (fraction >= hardFraction) {
            return MemoryLevel.HARD;
        }
        if (fraction >= warningFraction) {
            return MemoryLevel.WARNING;
        }
        return MemoryLevel.NORMAL;
    }

    public MemoryLevel level() {
        return level;
    }

    /// How long the level has been HARD without interruption, or zero when it is not HARD.
    public synchronized Duration hardDuration() {
        if (hardSinceNanos < 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(System.nanoTime() - hardSinceNanos);
    }

    public long peakBytes() {
        return peakBytes;
    }

    public long ceilingBytes() {
        return ceilingBytes;
    }

    public synchronized List<MemorySample> history() {
        return new ArrayList<>(history);
    }

    /// Compares the oldest and newest of the last few samples; changes within
    /// [#STABLE_BAND] are stable.
    public synchronized MemoryTrend trend() {
        if (history.size() < 3) {
            return MemoryTrend.INSUFFICIENT_DATA;
        }
        List<MemorySample> samples = new ArrayList<>(history);
        List<MemorySample> window = samples.subList(Math.max(0, samples.size() - TREND_WINDOW), samples.size());
        long first = window.get(0).usedBytes();
        long last = window.get(window.size() - 1).usedBytes();
        if (first == 0) {
            return last == 0 ? MemoryTrend.STABLE : MemoryTrend.INCREASING;
        }
        double change = (double) (last - first) / first;
        if (change > STABLE_BAND) {
            return MemoryTrend.INCREASING;
        }
        if (change < -STABLE_BAND) {
            return MemoryTrend.DECREASING;
        }
        return MemoryTrend.STABLE;
    }

    /// Suggests a collection, then polls until the level is below `target` or the timeout passes.
    ///
    /// @return true if the level dropped below `target` in time
    public boolean awaitBelow(MemoryLevel target, Duration timeout) {
        if (sample().level().compareTo(target) < 0) {
            return true;
        }
        System.gc();

        long deadline = System.nanoTime() + timeout.toNanos();
        long sleepMillis = Math.max(1, Math.min(sampleInterval.toMillis(), 100));
        while (System.nanoTime() < deadline) {
            if (sample().level().compareTo(target) < 0) {
                return true;
            }
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return sample().level().compareTo(target) < 0;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
