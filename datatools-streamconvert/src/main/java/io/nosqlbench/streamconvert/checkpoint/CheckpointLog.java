package io.nosqlbench.streamconvert.checkpoint;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.zip.CRC32;

/// Append-only, crash-consistent log of committed chunks.
///
/// ## Format
///
/// Little-endian, fixed size records, readable front to back without loading the file:
///
/// | offset | size | header field |
/// |--------|------|--------------|
/// | 0  | 4  | magic `SCKP` |
/// | 4  | 2  | format version |
/// | 6  | 2  | record size (80) |
/// | 8  | 16 | pipeline id (UUID, most significant half first) |
/// | 24 | 32 | plan fingerprint |
/// | 56 | 8  | reserved |
///
/// | offset | size | record field |
/// |--------|------|--------------|
/// | 0  | 4  | chunk id (u32) |
/// | 4  | 1  | status |
/// | 5  | 3  | padding |
/// | 8  | 8  | cumulative record count |
/// | 16 | 32 | content hash of the covered result files, see [ProcessingCheckpoint#contentHashOf] |
/// | 48 | 8  | timestamp, epoch millis |
/// | 56 | 4  | crc32 of bytes 0..55 |
/// | 60 | 16 | reserved |
/// | 76 | 4  | commit marker `CMIT` |
///
/// ## Durability
///
/// A record is written without its commit marker and forced to disk, then the marker is written
/// and forced. A record is valid only with a matching crc and the marker present.
///
/// ## Recovery
///
/// [#open(Path)] scans forward and truncates the file at the first incomplete or invalid record,
/// which is where a crash during an append leaves it. An append always writes right after the
/// last committed record, dropping the remains of an earlier append that failed part way.
/// Records are never rewritten in place.
public final class CheckpointLog implements Closeable {

    private static final Logger logger = LogManager.getLogger(CheckpointLog.class);

    public static final String FILE_NAME = "checkpoints.log";
    public static final String SEALED_SUFFIX = ".completed";

    static final int HEADER_SIZE = 64;
    static final int RECORD_SIZE = 80;
    static final short VERSION = 1;
    private static final byte[] MAGIC = "SCKP".getBytes(StandardCharsets.US_ASCII);
    private static final int COMMIT_MARKER = 0x54494D43; // "CMIT" read little-endian
    private static final int CRC_OFFSET = 56;
    private static final int MARKER_OFFSET = 76;
    private static final int HASH_BYTES = 32;

    private final Path file;
    private final FileChannel channel;
    private final UUID pipelineId;
    private final byte[] fingerprint;
    private ProcessingCheckpoint last;
    private long recordCount;
    private boolean closed;

    private CheckpointLog(Path file, FileChannel channel, UUID pipelineId, byte[] fingerprint,
                          ProcessingCheckpoint last, long recordCount) {
        this.file = file;
        this.channel = channel;
        this.pipelineId = pipelineId;
        this.fingerprint = fingerprint;
        this.last = last;
        this.recordCount = recordCount;
    }

    /// Starts a new, empty log, replacing any file at `file`.
    public static CheckpointLog create(Path file, UUID pipelineId, byte[] fingerprint) throws IOException {
        Objects.requireNonNull(pipelineId, "pipelineId");
        if (fingerprint.length != HASH_BYTES) {
            throw new IllegalArgumentException("fingerprint must be " + HASH_BYTES + " bytes, got " + fingerprint.length);
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ,
            StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
            header.put(MAGIC)
                .putShort(VERSION)
                .putShort((short) RECORD_SIZE)
                .putLong(pipelineId.getMostSignificantBits())
                .putLong(pipelineId.getLeastSignificantBits())
                .put(fingerprint);
            header.position(0);
            writeFully(channel, header, 0);
            channel.force(true);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        DurableFiles.syncDirectory(file.toAbsolutePath().getParent());
        logger.debug("created checkpoint log {} for pipeline {}", file, pipelineId);
        return new CheckpointLog(file, channel, pipelineId, fingerprint.clone(), null, 0);
    }

    /// Opens an existing log for appending, truncating an incomplete or corrupt tail.
    ///
    /// @return empty when there is no file, or it is too short to hold a header
    /// @throws IntegrityException if the file is not a checkpoint log
    public static Optional<CheckpointLog> open(Path file) throws IOException, IntegrityException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
        try {
            if (channel.size() < HEADER_SIZE) {
                logger.warn("checkpoint log {} has an incomplete header ({} bytes), discarding it", file, channel.size());
                channel.close();
                Files.delete(file);
                return Optional.empty();
            }
            Header header = readHeader(channel, file);
            Scan scan = scan(channel, header.pipelineId, null);
            if (scan.validEnd < channel.size()) {
                logger.warn("truncating checkpoint log {} from {} to {} bytes: {}", file, channel.size(),
                    scan.validEnd, scan.stopReason);
                channel.truncate(scan.validEnd);
                channel.force(true);
            }
            channel.position(scan.validEnd);
            return Optional.of(new CheckpointLog(file, channel, header.pipelineId, header.fingerprint, scan.last,
                scan.count));
        } catch (IOException | IntegrityException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    /// Reads a log without modifying it, for inspection.
    ///
    /// @param each receives every valid checkpoint in order
    /// @return a summary of the file, including any invalid tail
    public static Inspection inspect(Path file, Consumer<ProcessingCheckpoint> each)
        throws IOException, IntegrityException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            if (channel.size() < HEADER_SIZE) {
                throw new IntegrityException("checkpoint log " + file + " has an incomplete header");
            }
            Header header = readHeader(channel, file);
            Scan scan = scan(channel, header.pipelineId, each);
            return new Inspection(header.pipelineId, HexFormat.of().formatHex(header.fingerprint), scan.count,
                Optional.ofNullable(scan.last), channel.size() - scan.validEnd, scan.stopReason);
        }
    }

    /// Summary of a log read by [#inspect(Path, Consumer)].
    ///
    /// @param invalidTailBytes bytes after the last valid record, which [#open(Path)] would truncate
    /// @param tailProblem why the scan stopped before the end of the file, or null
    public record Inspection(UUID pipelineId, String fingerprint, long checkpointCount,
                             Optional<ProcessingCheckpoint> last, long invalidTailBytes, String tailProblem) {
    }

    public UUID pipelineId() {
        return pipelineId;
    }

    public byte[] fingerprint() {
        return fingerprint.clone();
    }

    public Path file() {
        return file;
    }

    public Optional<ProcessingCheckpoint> last() {
        return Optional.ofNullable(last);
    }

    /// Highest committed chunk id, or 0 when nothing is committed.
    public int lastChunkId() {
        return last == null ? 0 : last.chunkId();
    }

    public long recordCount() {
        return recordCount;
    }

    /// Reads every committed checkpoint in order, one record at a time.
    public void forEach(Consumer<ProcessingCheckpoint> each) throws IOException {
        ensureOpen();
        try {
            scan(channel, pipelineId, each);
        } catch (IntegrityException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    /// Durably appends one checkpoint.
    ///
    /// @throws IllegalArgumentException if the chunk id does not follow the last committed one
    public synchronized void append(int chunkId, long cumulativeRecordCount, String contentHash,
                                    CheckpointStatus status) throws IOException {
        ensureOpen();
        if (chunkId <= lastChunkId()) {
            throw new IllegalArgumentException("checkpoint chunk ids must increase: " + chunkId
                + " after " + lastChunkId());
        }
        byte[] hash = DurableFiles.digestOf(contentHash);
        if (hash.length != HASH_BYTES) {
            throw new IllegalArgumentException("content hash must be sha256, got " + contentHash);
        }
        Instant now = Instant.ofEpochMilli(System.currentTimeMillis());

        ByteBuffer record = ByteBuffer.allocate(RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        record.putInt(chunkId)
            .put((byte) status.code())
            .put(new byte[3])
            .putLong(cumulativeRecordCount)
            .put(hash)
            .putLong(now.toEpochMilli());
        CRC32 crc = new CRC32();
        crc.update(record.array(), 0, CRC_OFFSET);
        record.putInt(CRC_OFFSET, (int) crc.getValue());

        long position = HEADER_SIZE + recordCount * RECORD_SIZE;
        if (channel.size() > position) {
            // left behind by an append that failed before its marker was written
            logger.warn("discarding {} bytes of an unfinished record at the end of {}", channel.size() - position, file);
            channel.truncate(position);
        }
        // payload first, then the marker, each forced, so a torn write never looks committed
        ByteBuffer payload = ByteBuffer.wrap(record.array(), 0, MARKER_OFFSET);
        writeFully(channel, payload, position);
        channel.force(false);
        ByteBuffer marker = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(COMMIT_MARKER);
        marker.flip();
        writeFully(channel, marker, position + MARKER_OFFSET);
        channel.force(false);

        last = new ProcessingCheckpoint(pipelineId, chunkId, cumulativeRecordCount, contentHash, now, status);
        recordCount++;
        logger.debug("checkpoint chunk {} cumulative {} {}", chunkId, cumulativeRecordCount, status);
    }

    /// Closes the log and renames it to `checkpoints.log.completed`, so the next run starts fresh.
    ///
    /// @return the sealed file
    public Path seal() throws IOException {
        close();
        Path sealed = file.resolveSibling(file.getFileName() + SEALED_SUFFIX);
        Files.move(file, sealed, StandardCopyOption.REPLACE_EXISTING);
        DurableFiles.syncDirectory(file.toAbsolutePath().getParent());
        logger.debug("sealed checkpoint log as {}", sealed);
        return sealed;
    }

    @Override
    public synchronized void close() throws IOException {
        if (!closed) {
            closed = true;
            channel.close();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("checkpoint log " + file + " is closed");
        }
    }

    private record Header(UUID pipelineId, byte[] fingerprint) {
    }

    private static Header readHeader(FileChannel channel, Path file) throws IOException, IntegrityException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        readFully(channel, header, 0);
        header.flip();
        byte[] magic = new byte[4];
        header.get(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IntegrityException("not a checkpoint log (bad magic): " + file, 0);
        }
        short version = header.getShort();
        if (version != VERSION) {
            throw new IntegrityException("unsupported checkpoint log version " + version + " in " + file, 4);
        }
        short recordSize = header.getShort();
        if (recordSize != RECORD_SIZE) {
            throw new IntegrityException("unexpected checkpoint record size " + recordSize + " in " + file, 6);
        }
        UUID id = new UUID(header.getLong(), header.getLong());
        byte[] fingerprint = new byte[HASH_BYTES];
        header.get(fingerprint);
        return new Header(id, fingerprint);
    }

    private static final class Scan {
        private long validEnd = HEADER_SIZE;
        private long count;
        private ProcessingCheckpoint last;
        private String stopReason;
    }

    private static Scan scan(FileChannel channel, UUID pipelineId, Consumer<ProcessingCheckpoint> each)
        throws IOException, IntegrityException {
        Scan scan = new Scan();
        long size = channel.size();
        ByteBuffer record = ByteBuffer.allocate(RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        int lastChunkId = 0;
        while (scan.validEnd < size) {
            if (size - scan.validEnd < RECORD_SIZE) {
                scan.stopReason = "incomplete record at offset " + scan.validEnd;
                break;
            }
            record.clear();
            readFully(channel, record, scan.validEnd);
            ProcessingCheckpoint checkpoint = decode(record, pipelineId);
            if (checkpoint == null) {
                scan.stopReason = "uncommitted or corrupt record at offset " + scan.validEnd;
                break;
            }
            if (checkpoint.chunkId() <= lastChunkId) {
                scan.stopReason = "out of order chunk id " + checkpoint.chunkId() + " at offset " + scan.validEnd;
                break;
            }
            lastChunkId = checkpoint.chunkId();
            scan.last = checkpoint;
            scan.count++;
            scan.validEnd += RECORD_SIZE;
            if (each != null) {
                each.accept(checkpoint);
            }
        }
        return scan;
    }

    /// @return the checkpoint, or null when the record is not fully committed
    private static ProcessingCheckpoint decode(ByteBuffer record, UUID pipelineId) {
        if (record.getInt(MARKER_OFFSET) != COMMIT_MARKER) {
            return null;
        }
        CRC32 crc = new CRC32();
        crc.update(record.array(), 0, CRC_OFFSET);
        if (record.getInt(CRC_OFFSET) != (int) crc.getValue()) {
            return null;
        }
        int chunkId = record.getInt(0);
        CheckpointStatus status;
        try {
            status = CheckpointStatus.fromCode(record.get(4));
        } catch (IllegalArgumentException e) {
            return null;
        }
        long cumulative = record.getLong(8);
        byte[] hash = new byte[HASH_BYTES];
        record.get(16, hash);
        long millis = record.getLong(48);
        return new ProcessingCheckpoint(pipelineId, chunkId, cumulative, DurableFiles.checksum(hash),
            Instant.ofEpochMilli(millis), status);
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long at = position;
        while (buffer.hasRemaining()) {
            at += channel.write(buffer, at);
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long at = position;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, at);
            if (n < 0) {
                throw new IOException("unexpected end of checkpoint log at offset " + at);
            }
            at += n;
        }
    }
}
