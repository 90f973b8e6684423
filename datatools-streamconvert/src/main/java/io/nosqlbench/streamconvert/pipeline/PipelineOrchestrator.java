package io.nosqlbench.streamconvert.pipeline;

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

import io.nosqlbench.streamconvert.DataIntegrityException;
import io.nosqlbench.streamconvert.DurableFiles;
import io.nosqlbench.streamconvert.ExitCode;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.PipelineException;
import io.nosqlbench.streamconvert.ResourceExhaustedException;
import io.nosqlbench.streamconvert.TimeoutExceededException;
import io.nosqlbench.streamconvert.assemble.ResultAssembler;
import io.nosqlbench.streamconvert.checkpoint.CheckpointLog;
import io.nosqlbench.streamconvert.checkpoint.CheckpointStatus;
import io.nosqlbench.streamconvert.checkpoint.ProcessingCheckpoint;
import io.nosqlbench.streamconvert.config.ConfigValues;
import io.nosqlbench.streamconvert.config.PipelineConfig;
import io.nosqlbench.streamconvert.json.StreamConvertGsonConfig;
import io.nosqlbench.streamconvert.memory.MemoryLevel;
import io.nosqlbench.streamconvert.memory.MemoryMonitor;
import io.nosqlbench.streamconvert.memory.MemoryProbe;
import io.nosqlbench.streamconvert.process.CancellationToken;
import io.nosqlbench.streamconvert.process.ChunkAbandonedException;
import io.nosqlbench.streamconvert.process.ChunkProcessor;
import io.nosqlbench.streamconvert.process.ChunkResult;
import io.nosqlbench.streamconvert.process.FailureRatePolicy;
import io.nosqlbench.streamconvert.process.QualityReport;
import io.nosqlbench.streamconvert.split.BoundarySplitter;
import io.nosqlbench.streamconvert.split.ChunkDescriptor;
import io.nosqlbench.streamconvert.split.ChunkPlan;
import io.nosqlbench.streamconvert.split.ChunkWriteMode;
import io.nosqlbench.streamconvert.transform.RecordTransformer;
import io.nosqlbench.streamconvert.transform.RecordTransformers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs the whole conversion: split, process in parallel, commit in order, assemble.
///
/// ## Flow
///
/// 1. If the work directory holds a non-empty checkpoint log (and resume is enabled), the run
///    enters `RESUMING`: the log's plan fingerprint must match the current source and split
///    settings.
/// 2. `SPLITTING` derives the deterministic [ChunkPlan]. Already committed chunks are only
///    digested; existing chunk files for the rest are reused when their checksum matches.
///    On resume the committed chunks are checked against their chunk files, and every
///    checkpoint against the plan and the hashes of the result files it covers.
/// 3. `PROCESSING` admits chunks into a fixed pool of `effectiveWorkerCount()` workers, at most
///    one chunk per worker in flight. Admission pauses while memory is at the hard level; if
///    that lasts longer than the grace window the run fails with [ResourceExhaustedException].
///    Finished chunks pass through a [CommitOrderingBuffer] so the checkpoint log only grows in
///    chunk order.
/// 4. `ASSEMBLING` audits all result files. Below `min_integrity_score` the run fails and keeps
///    its intermediate files; otherwise the dataset is published, the report written, the log
///    sealed and the chunk and result files removed.
///
/// ## Cancellation
///
/// The wall clock timeout and [#cancel()] both set a shared [CancellationToken]. Workers stop
/// at the next record boundary without publishing anything, completed chunks contiguous with the
/// committed prefix are still checkpointed, and the run ends with [ExitCode#TIMEOUT], resumable.
///
/// ## Failure
///
/// Every failure leaves a valid checkpoint log. [#run()] never throws; the outcome, including
/// the exit code and a remediation hint, is in the returned [PipelineSummary] and in the report
/// file `<output>.report.json`.
public final class PipelineOrchestrator {

    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);

    private static final long POLL_MILLIS = 50;
    private static final long LOG_EVERY_CHUNKS = 10;

    private final Path source;
    private final Path output;
    private final PipelineConfig config;
    private final RecordTransformer transformer;
    private final MemoryProbe probe;
    private final List<PipelineListener> listeners;
    private final CancellationToken token = new CancellationToken();
    private final PipelineStateMachine stateMachine;
    private final WorkDirectory work;

    private int resumedFromChunk;
    private int chunksProcessed;
    private CheckpointLog log;
    private ChunkPlan plan;
    private QualityReport quality;
    private MemoryMonitor monitor;

    private PipelineOrchestrator(Builder builder) {
        this.source = builder.source;
        this.output = builder.output;
        this.config = builder.config;
        this.transformer = builder.transformer != null
            ? builder.transformer
            : RecordTransformers.named(config.transformer());
        this.probe = builder.probe;
        this.listeners = List.copyOf(builder.listeners);
        this.stateMachine = new PipelineStateMachine(listeners);
        this.work = new WorkDirectory(config.workDirFor(output));
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineState state() {
        return stateMachine.state();
    }

    public WorkDirectory workDirectory() {
        return work;
    }

    /// Requests cooperative cancellation. The run ends with [ExitCode#TIMEOUT] once in-flight
    /// chunks have stopped, and can be resumed.
    public void cancel() {
        if (token.cancel(CancellationToken.Reason.CANCELLED)) {
            logger.warn("cancellation requested");
        }
    }

    public static Path reportFileFor(Path output) {
        Path abs = output.toAbsolutePath();
        return abs.resolveSibling(abs.getFileName() + ".report.json");
    }

    /// Runs the pipeline to completion or failure.
    public PipelineSummary run() {
        long started = System.nanoTime();
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemonFactory("pipeline-timer"));
        monitor = new MemoryMonitor(config.memoryCeilingBytes(), config.warningFraction(), config.hardFraction(),
            config.memorySampleInterval(), probe);
        PipelineSummary summary;
        try {
            timer.schedule(() -> {
                if (token.cancel(CancellationToken.Reason.TIMEOUT)) {
                    logger.warn("wall clock timeout of {} reached, stopping", config.wallClockTimeout());
                }
            }, config.wallClockTimeout().toMillis(), TimeUnit.MILLISECONDS);
            monitor.start();

            execute();
            summary = summarize(started, ExitCode.SUCCESS, null, null);
        } catch (PipelineException e) {
            logger.error("pipeline failed: {}", e.getMessage());
            summary = fail(started, e.exitCode(), e.getMessage(), remediation(e));
        } catch (IOException e) {
            logger.error("pipeline failed on I/O: {}", e.getMessage(), e);
            summary = fail(started, ExitCode.DATA_INTEGRITY, "I/O error: " + e.getMessage(),
                "check the disk holding " + work.root() + ", then re-run with resume enabled to continue after chunk "
                    + lastCommitted());
        } catch (RuntimeException e) {
            logger.error("pipeline failed with an internal error", e);
            summary = fail(started, ExitCode.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(),
                "re-run with resume enabled to continue after chunk " + lastCommitted()
                    + "; report the error if it persists");
        } finally {
            timer.shutdownNow();
            monitor.close();
            closeLog();
        }
        writeReport(summary);
        logger.info("pipeline finished {} with exit code {}", summary.state(), summary.exitCode().code());
        return summary;
    }

    private void execute() throws PipelineException, IOException {
        if (!Files.isRegularFile(source)) {
            throw new IntegrityException("source file not found: " + source);
        }
        work.create();
        long sourceBytes = Files.size(source);
        byte[] fingerprint = ChunkPlan.fingerprint(sourceBytes, config.maxChunkBytes(), config.maxObjectsPerChunk(),
            config.sourceFormat());
        UUID pipelineId = pipelineIdFor(fingerprint);

        if (!config.resume()) {
            Files.deleteIfExists(work.checkpointLog());
            work.deleteIntermediates();
            work.create();
        }
        CheckpointLog existing = CheckpointLog.open(work.checkpointLog()).orElse(null);
        if (existing != null && existing.lastChunkId() > 0) {
            log = existing;
            stateMachine.transition(PipelineState.RESUMING);
            if (!Arrays.equals(existing.fingerprint(), fingerprint)) {
                throw new IntegrityException("the checkpoint log in " + work.root()
                    + " was written for a different source or split settings");
            }
            resumedFromChunk = existing.lastChunkId();
            logger.info("resuming pipeline {} after chunk {} ({} records committed)", existing.pipelineId(),
                resumedFromChunk, existing.last().map(ProcessingCheckpoint::cumulativeRecordCount).orElse(0L));
        } else {
            if (existing != null) {
                existing.close();
            }
            log = CheckpointLog.create(work.checkpointLog(), pipelineId, fingerprint);
        }

        stateMachine.transition(PipelineState.SPLITTING);
        BoundarySplitter splitter = new BoundarySplitter(config.maxChunkBytes(), config.maxObjectsPerChunk(),
            config.sourceFormat());
        int committed = resumedFromChunk;
        plan = splitter.split(source, work.chunks(),
            id -> id <= committed ? ChunkWriteMode.DIGEST_ONLY : ChunkWriteMode.REUSE_IF_VALID);
        logger.info("split {} ({}) into {} chunks, {} records, format {}", source,
            ConfigValues.formatBytes(plan.sourceBytes()), plan.chunkCount(), plan.totalRecords(), plan.format());
        if (resumedFromChunk > 0) {
            validateResume();
        }

        stateMachine.transition(PipelineState.PROCESSING);
        processChunks();

        stateMachine.transition(PipelineState.ASSEMBLING);
        assemble();
        stateMachine.transition(PipelineState.COMPLETED);
    }

    private UUID pipelineIdFor(byte[] fingerprint) {
        byte[] path = source.toAbsolutePath().normalize().toString().getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(ByteBuffer.allocate(fingerprint.length + path.length)
            .put(fingerprint).put(path).array());
    }

    /// Every committed chunk must still be what was processed: its re-derived chunk bytes must
    /// hash like the chunk file that was converted, each checkpoint must agree with the plan's
    /// record counts, and the result files a checkpoint covers must hash to its content hash.
    private void validateResume() throws IOException, IntegrityException {
        if (resumedFromChunk > plan.chunkCount()) {
            throw new IntegrityException("checkpoint log commits chunk " + resumedFromChunk + " but the plan has only "
                + plan.chunkCount() + " chunks");
        }
        for (int id = 1; id <= resumedFromChunk; id++) {
            ChunkDescriptor chunk = plan.chunks().get(id - 1);
            if (!Files.isRegularFile(chunk.file())) {
                throw new IntegrityException("chunk file of committed chunk " + id + " is missing: " + chunk.file());
            }
            if (!DurableFiles.checksumOf(chunk.file()).equals(chunk.checksum())) {
                throw new IntegrityException("source records of committed chunk " + id
                    + " changed since it was processed (" + chunk + ")");
            }
        }

        List<ProcessingCheckpoint> checkpoints = new ArrayList<>();
        log.forEach(checkpoints::add);
        int covered = 0;
        for (ProcessingCheckpoint checkpoint : checkpoints) {
            long expected = plan.cumulativeRecords(checkpoint.chunkId());
            if (checkpoint.cumulativeRecordCount() != expected) {
                throw new IntegrityException("checkpoint for chunk " + checkpoint.chunkId() + " covers "
                    + checkpoint.cumulativeRecordCount() + " records but the plan has " + expected);
            }
            List<String> checksums = new ArrayList<>();
            for (int id = covered + 1; id <= checkpoint.chunkId(); id++) {
                Path result = resultFile(id);
                if (!Files.isRegularFile(result)) {
                    throw new IntegrityException("result file of committed chunk " + id + " is missing: " + result);
                }
                checksums.add(DurableFiles.checksumOf(result));
            }
            if (!ProcessingCheckpoint.contentHashOf(checksums).equals(checkpoint.contentHash())) {
                throw new IntegrityException(checksums.size() == 1
                    ? "result file of committed chunk " + checkpoint.chunkId() + " no longer matches its checkpoint hash"
                    : "result files of committed chunks " + (covered + 1) + " to " + checkpoint.chunkId()
                    + " no longer match their checkpoint hash");
            }
            covered = checkpoint.chunkId();
        }
        logger.debug("validated {} committed chunks and {} checkpoints against the plan", resumedFromChunk,
            checkpoints.size());
    }

    private Path resultFile(int chunkId) {
        return work.results().resolve(ChunkResult.fileName(chunkId));
    }

    private record TaskOutcome(ChunkDescriptor chunk, ChunkResult result, Exception error) {
    }

    private void processChunks() throws PipelineException, IOException {
        List<ChunkDescriptor> pending = plan.chunks().subList(resumedFromChunk, plan.chunkCount());
        if (pending.isEmpty()) {
            logger.info("no chunks left to process");
            return;
        }
        int workers = config.effectiveWorkerCount();
        if (workers < config.workerCount()) {
            logger.info("limiting workers to {} so that {} per worker fits the {} ceiling", workers,
                ConfigValues.formatBytes(config.perWorkerMemoryBudget()),
                ConfigValues.formatBytes(config.memoryCeilingBytes()));
        }
        FailureRatePolicy policy = new FailureRatePolicy(config.failureRateThreshold());
        ChunkProcessor processor = new ChunkProcessor(transformer, policy, work.results());
        monitor.addListener((previous, sample) -> {
            if (sample.level() != MemoryLevel.NORMAL && sample.level().compareTo(previous) > 0) {
                processor.requestRelease();
            }
        });

        ExecutorService pool = Executors.newFixedThreadPool(workers, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "chunk-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(pool);
        CommitOrderingBuffer ordering = new CommitOrderingBuffer(resumedFromChunk + 1);
        Map<Integer, ChunkResult> uncheckpointed = new HashMap<>();
        PipelineException failure = null;
        int next = 0;
        int inFlight = 0;
        boolean paused = false;
        int lastReady = resumedFromChunk;

        logger.info("processing {} chunks with {} workers", pending.size(), workers);
        try {
            while (true) {
                boolean hard = monitor.level() == MemoryLevel.HARD;
                if (hard != paused) {
                    paused = hard;
                    logger.info(paused ? "memory at hard level, pausing chunk admission"
                        : "memory below hard level, resuming chunk admission");
                }
                while (failure == null && !token.isCancelled() && !paused && next < pending.size()
                    && inFlight < workers) {
                    ChunkDescriptor chunk = pending.get(next++);
                    completion.submit(() -> runChunk(processor, chunk));
                    inFlight++;
                }
                if (inFlight == 0 && (next >= pending.size() || token.isCancelled() || failure != null)) {
                    break;
                }
                if (paused && failure == null && monitor.hardDuration().compareTo(config.memoryGraceWindow()) > 0) {
                    token.cancel(CancellationToken.Reason.RESOURCE);
                    failure = new ResourceExhaustedException("memory stayed at or above "
                        + ConfigValues.formatBytes(config.hardBytes()) + " for longer than "
                        + config.memoryGraceWindow().toMillis() + " ms (peak "
                        + ConfigValues.formatBytes(monitor.peakBytes()) + ")");
                    logger.error(failure.getMessage());
                }

                Future<TaskOutcome> done = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                inFlight--;
                TaskOutcome outcome = done.get();
                if (outcome.result() != null) {
                    chunksProcessed++;
                    ChunkResult result = outcome.result();
                    logger.debug("chunk {} processed: {} records, {} skipped", result.chunkId(),
                        result.quality().totalRecords(), result.quality().failureCount());
                    for (PipelineListener listener : listeners) {
                        listener.chunkProcessed(result);
                    }
                    ordering.offer(result);
                    for (ChunkResult ready : ordering.drainReady()) {
                        uncheckpointed.put(ready.chunkId(), ready);
                        lastReady = ready.chunkId();
                        boolean due = lastReady - log.lastChunkId() >= config.checkpointInterval()
                            || lastReady == plan.chunkCount();
                        if (due) {
                            commit(uncheckpointed, lastReady);
                        }
                    }
                } else if (outcome.error() instanceof ChunkAbandonedException abandoned) {
                    logger.debug(abandoned.getMessage());
                } else if (failure == null) {
                    failure = asPipelineException(outcome.chunk(), outcome.error());
                    token.cancel(CancellationToken.Reason.FAILED);
                    logger.error("chunk {} failed: {}", outcome.chunk().chunkId(), failure.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel(CancellationToken.Reason.CANCELLED);
            failure = new TimeoutExceededException("interrupted while processing chunks", true);
        } catch (ExecutionException e) {
            // runChunk catches everything, so this is an error escaping the worker itself
            throw new IllegalStateException("chunk worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("chunk workers did not stop within 60 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (lastReady > log.lastChunkId()) {
            commit(uncheckpointed, lastReady);
        }
        if (ordering.waitingCount() > 0) {
            logger.info("{} finished chunks were held back behind an unfinished predecessor and will be redone"
                + " on resume", ordering.waitingCount());
        }
        if (failure != null) {
            throw failure;
        }
        if (token.isCancelled()) {
            CancellationToken.Reason reason = token.reason().orElseThrow();
            throw new TimeoutExceededException(reason == CancellationToken.Reason.TIMEOUT
                ? "wall clock timeout of " + config.wallClockTimeout() + " reached"
                : "run cancelled", reason != CancellationToken.Reason.TIMEOUT);
        }
    }

    private TaskOutcome runChunk(ChunkProcessor processor, ChunkDescriptor chunk) {
        try {
            return new TaskOutcome(chunk, processor.process(chunk, token), null);
        } catch (Exception e) {
            return new TaskOutcome(chunk, null, e);
        }
    }

    private static PipelineException asPipelineException(ChunkDescriptor chunk, Exception error) {
        if (error instanceof PipelineException pe) {
            return pe;
        }
        if (error instanceof IOException) {
            return new PipelineException(ExitCode.DATA_INTEGRITY,
                "chunk " + chunk.chunkId() + " failed on I/O: " + error.getMessage(), error);
        }
        return new PipelineException(ExitCode.INTERNAL_ERROR,
            "chunk " + chunk.chunkId() + " failed: " + error.getClass().getSimpleName() + ": " + error.getMessage(),
            error);
    }

    /// Appends one checkpoint covering every ready chunk up to `chunkId`.
    private void commit(Map<Integer, ChunkResult> uncheckpointed, int chunkId) throws IOException {
        ChunkResult result = uncheckpointed.get(chunkId);
        boolean degraded = false;
        List<String> checksums = new ArrayList<>();
        for (int id = log.lastChunkId() + 1; id <= chunkId; id++) {
            ChunkResult covered = Objects.requireNonNull(uncheckpointed.remove(id), () -> "chunk not ready");
            degraded |= covered.degraded();
            checksums.add(covered.checksum());
        }
        log.append(chunkId, result.chunk().endRecord(), ProcessingCheckpoint.contentHashOf(checksums),
            degraded ? CheckpointStatus.DEGRADED : CheckpointStatus.CLEAN);
        ProcessingCheckpoint checkpoint = log.last().orElseThrow();
        if (chunkId % LOG_EVERY_CHUNKS == 0 || chunkId == plan.chunkCount()) {
            logger.info("committed chunk {} of {} ({} records)", chunkId, plan.chunkCount(),
                checkpoint.cumulativeRecordCount());
        }
        for (PipelineListener listener : listeners) {
            listener.chunkCommitted(checkpoint);
        }
    }

    private void assemble() throws PipelineException, IOException {
        ResultAssembler assembler = new ResultAssembler(plan, this::resultFile);
        quality = assembler.audit();
        if (quality.failureCount() > 0) {
            logger.warn("{} of {} records were skipped", quality.failureCount(), quality.totalRecords());
        }
        if (quality.integrityScore() < config.minIntegrityScore()) {
            throw new DataIntegrityException(String.format(Locale.ROOT,
                "integrity score %.4f is below the minimum of %.4f (%d of %d records skipped)",
                quality.integrityScore(), config.minIntegrityScore(), quality.failureCount(), quality.totalRecords()));
        }
        Path target = output.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path staged = DurableFiles.tempFor(target);
        try {
            assembler.write(target, staged, quality);
            DurableFiles.publish(staged, target);
        } finally {
            Files.deleteIfExists(staged);
        }
        Path sealed = log.seal();
        work.deleteIntermediates();
        logger.info("dataset written to {}, checkpoint log sealed as {}", target, sealed.getFileName());
    }

    private int lastCommitted() {
        return log == null ? 0 : log.lastChunkId();
    }

    private void closeLog() {
        if (log == null) {
            return;
        }
        try {
            log.close();
        } catch (IOException e) {
            logger.error("failed to close checkpoint log {}", log.file(), e);
        }
    }

    private String remediation(PipelineException e) {
        int last = lastCommitted();
        return switch (e.exitCode()) {
            case RESOURCE_EXHAUSTED -> "raise the memory ceiling, or lower the worker count or chunk size,"
                + " then re-run with resume enabled to continue after chunk " + last;
            case TIMEOUT -> "re-run with resume enabled to continue after chunk " + last;
            case DATA_INTEGRITY -> e instanceof IntegrityException
                ? "check the source file, or remove " + work.root() + " (or run with resume disabled) to start fresh"
                : "fix the offending records or relax the failure thresholds, then re-run with resume enabled"
                + " to continue after chunk " + last;
            default -> "re-run with resume enabled to continue after chunk " + last;
        };
    }

    private PipelineSummary fail(long started, ExitCode exitCode, String error, String remediation) {
        if (!stateMachine.state().isTerminal()) {
            stateMachine.transition(PipelineState.FAILED);
        }
        return summarize(started, exitCode, error, remediation);
    }

    private PipelineSummary summarize(long started, ExitCode exitCode, String error, String remediation) {
        long committedRecords = log == null ? 0 : log.last().map(ProcessingCheckpoint::cumulativeRecordCount).orElse(0L);
        if (stateMachine.state() == PipelineState.COMPLETED && plan != null) {
            committedRecords = plan.totalRecords();
        }
        return new PipelineSummary(
            stateMachine.state(),
            exitCode,
            source,
            output,
            plan == null ? -1 : plan.totalRecords(),
            committedRecords,
            plan == null ? 0 : plan.chunkCount(),
            chunksProcessed,
            resumedFromChunk,
            plan != null && stateMachine.state() == PipelineState.COMPLETED ? plan.chunkCount() : lastCommitted(),
            Duration.ofNanos(System.nanoTime() - started),
            monitor.peakBytes(),
            config.memoryCeilingBytes(),
            quality == null ? 0.0 : quality.integrityScore(),
            quality,
            error,
            remediation);
    }

    private void writeReport(PipelineSummary summary) {
        Path report = reportFileFor(output);
        try {
            Files.createDirectories(report.getParent());
            Path temp = DurableFiles.tempFor(report);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                StreamConvertGsonConfig.gson().toJson(summary, writer);
            }
            DurableFiles.publish(temp, report);
            logger.debug("report written to {}", report);
        } catch (IOException | RuntimeException e) {
            logger.error("failed to write report {}: {}", report, e.getMessage(), e);
        }
    }

    private static ThreadFactory daemonFactory(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private Path source;
        private Path output;
        private PipelineConfig config = PipelineConfig.defaults();
        private RecordTransformer transformer;
        private MemoryProbe probe = MemoryProbe.jvm();
        private final List<PipelineListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        /// Overrides the transformer named by the config.
        public Builder transformer(RecordTransformer transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder memoryProbe(MemoryProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder listener(PipelineListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public PipelineOrchestrator build() {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(probe, "memoryProbe");
            return new PipelineOrchestrator(this);
        }
    }
}
