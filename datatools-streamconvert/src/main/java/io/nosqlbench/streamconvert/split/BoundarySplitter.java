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

import io.nosqlbench.streamconvert.DurableFiles;
import io.nosqlbench.streamconvert.IntegrityException;
import io.nosqlbench.streamconvert.config.ConfigValues;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/// Splits a large JSON array or JSON-lines file into chunk files without materializing the document.
///
/// ## Algorithm
///
/// The source is read once through a [JsonValueScanner]. Complete top-level values are appended
/// to the active chunk until adding the next one would exceed `maxChunkBytes`, or the chunk holds
/// `maxObjectsPerChunk` values. The chunk is then closed: its file is forced to disk and renamed
/// into place before the next chunk starts. A boundary never falls inside a value, and a single
/// value larger than `maxChunkBytes` becomes a chunk of its own.
///
/// Only one value is buffered at a time; chunk bytes stream straight into the chunk's temp file
/// while being digested. With [ChunkWriteMode#REUSE_IF_VALID] the temp file is discarded when an
/// existing chunk file already has the same checksum.
///
/// ## Chunk files
///
/// Each chunk file is an independent JSON array with one element per line:
///
/// ```
/// [
/// {"id":1, ...},
/// {"id":2, ...}
/// ]
/// ```
///
/// A JSON-lines record whose line is malformed is written as a [MalformedLine] carrier, so the
/// chunk stays a valid array and the record fails individually during processing.
///
/// ## Failure
///
/// A structural error in the source raises [IntegrityException]. Any failure removes the chunk
/// files written during the call, so no partial plan is ever visible.
public final class BoundarySplitter {

    private static final Logger logger = LogManager.getLogger(BoundarySplitter.class);

    private static final byte[] OPEN = "[\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SEPARATOR = ",\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CLOSE = "\n]\n".getBytes(StandardCharsets.UTF_8);
    private static final int STREAM_BUFFER = 256 * 1024;

    private final long maxChunkBytes;
    private final int maxObjectsPerChunk;
    private final SourceFormat format;

    public BoundarySplitter(long maxChunkBytes, int maxObjectsPerChunk, SourceFormat format) {
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be positive, got " + maxChunkBytes);
        }
        if (maxObjectsPerChunk <= 0) {
            throw new IllegalArgumentException("maxObjectsPerChunk must be positive, got " + maxObjectsPerChunk);
        }
        this.maxChunkBytes = maxChunkBytes;
        this.maxObjectsPerChunk = maxObjectsPerChunk;
        this.format = format;
    }

    public ChunkPlan split(Path source, Path chunkDir, ChunkWriteMode mode) throws IOException, IntegrityException {
        return split(source, chunkDir, id -> mode);
    }

    /// Plans and writes the chunks of `source` into `chunkDir`.
    ///
    /// @param modeForChunk the write mode for each chunk id, so a resumed run can skip writing
    ///                     chunks that are already committed
    public ChunkPlan split(Path source, Path chunkDir, IntFunction<ChunkWriteMode> modeForChunk)
        throws IOException, IntegrityException {
        Files.createDirectories(chunkDir);
        long sourceBytes = Files.size(source);
        List<ChunkDescriptor> chunks = new ArrayList<>();
        List<Path> published = new ArrayList<>();
        ChunkSink sink = null;
        long records = 0;
        int reused = 0;
        SourceFormat resolved;

        try (InputStream raw = Files.newInputStream(source);
             JsonValueScanner scanner = new JsonValueScanner(new BufferedInputStream(raw, STREAM_BUFFER), format)) {
            while (scanner.next()) {
                byte[] value = scanner.valueBuffer();
                int length = scanner.valueLength();
                if (scanner.valueProblem() != null) {
                    logger.debug("record {} at byte offset {} is a malformed line ({}), it is kept as a failed record",
                        records, scanner.valueOffset(), scanner.valueProblem());
                    value = MalformedLine.encode(value, length, scanner.valueProblem());
                    length = value.length;
                }
                if (sink != null && sink.wouldOverflow(length)) {
                    chunks.add(sink.finish(published));
                    reused += sink.reused ? 1 : 0;
                    sink = null;
                }
                if (sink == null) {
                    int chunkId = chunks.size() + 1;
                    sink = new ChunkSink(chunkId, chunkDir.resolve(ChunkDescriptor.fileName(chunkId)),
                        modeForChunk.apply(chunkId), records, scanner.valueOffset());
                }
                if (length > maxChunkBytes) {
                    logger.warn("record {} at byte offset {} is {} which exceeds the chunk size limit of {};"
                            + " it forms chunk {} on its own", records, scanner.valueOffset(),
                        ConfigValues.formatBytes(length), ConfigValues.formatBytes(maxChunkBytes), sink.chunkId);
                }
                sink.add(value, length, scanner.valueEndOffset());
                records++;
                if (sink.count >= maxObjectsPerChunk) {
                    chunks.add(sink.finish(published));
                    reused += sink.reused ? 1 : 0;
                    sink = null;
                }
            }
            if (sink != null) {
                chunks.add(sink.finish(published));
                reused += sink.reused ? 1 : 0;
                sink = null;
            }
            resolved = scanner.format();
        } catch (IOException | IntegrityException | RuntimeException e) {
            try {
                if (sink != null) {
                    sink.abandon();
                }
                for (Path file : published) {
                    Files.deleteIfExists(file);
                }
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        ChunkPlan plan = new ChunkPlan(source, resolved, sourceBytes, records, maxChunkBytes, maxObjectsPerChunk,
            chunks);
        if (reused > 0) {
            logger.info("reused {} of {} existing chunk files in {}", reused, plan.chunkCount(), chunkDir);
        }
        logger.debug("planned {} chunks for {} records ({}) from {}", plan.chunkCount(), records,
            ConfigValues.formatBytes(sourceBytes), source);
        return plan;
    }

    /// Streams one chunk into its temp file (or only into the digest) while it is being filled.
    private final class ChunkSink {
        private final int chunkId;
        private final Path target;
        private final Path temp;
        private final ChunkWriteMode mode;
        private final long firstRecord;
        private final long byteStart;
        private final MessageDigest digest = DurableFiles.sha256();
        private final OutputStream out;
        private int count;
        private long bytes;
        private long byteEnd;
        private boolean reused;

        private ChunkSink(int chunkId, Path target, ChunkWriteMode mode, long firstRecord, long byteStart)
            throws IOException {
            this.chunkId = chunkId;
            this.target = target;
            this.temp = DurableFiles.tempFor(target);
            this.mode = mode;
            this.firstRecord = firstRecord;
            this.byteStart = byteStart;
            this.byteEnd = byteStart;
            OutputStream base = mode == ChunkWriteMode.DIGEST_ONLY
                ? OutputStream.nullOutputStream()
                : Files.newOutputStream(temp);
            this.out = new BufferedOutputStream(new DigestOutputStream(base, digest), STREAM_BUFFER);
            out.write(OPEN);
        }

        private boolean wouldOverflow(int length) {
            return count > 0 && bytes + SEPARATOR.length + length > maxChunkBytes;
        }

        private void add(byte[] value, int length, long valueEnd) throws IOException {
            if (count > 0) {
                out.write(SEPARATOR);
                bytes += SEPARATOR.length;
            }
            out.write(value, 0, length);
            bytes += length;
            count++;
            byteEnd = valueEnd;
        }

        private ChunkDescriptor finish(List<Path> published) throws IOException {
            out.write(CLOSE);
            out.close();
            String checksum = DurableFiles.checksum(digest.digest());
            if (mode == ChunkWriteMode.REUSE_IF_VALID
                && Files.isRegularFile(target)
                && DurableFiles.checksumOf(target).equals(checksum)) {
                Files.delete(temp);
                reused = true;
            } else if (mode != ChunkWriteMode.DIGEST_ONLY) {
                DurableFiles.publish(temp, target);
                published.add(target);
                logger.debug("wrote chunk {} ({} records, {})", chunkId, count, ConfigValues.formatBytes(bytes));
            }
            return new ChunkDescriptor(chunkId, firstRecord, firstRecord + count, byteStart, byteEnd, target,
                checksum);
        }

        private void abandon() throws IOException {
            out.close();
            Files.deleteIfExists(temp);
        }
    }
}
