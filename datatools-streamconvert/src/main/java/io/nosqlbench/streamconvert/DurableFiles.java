package io.nosqlbench.streamconvert;

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

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;

/// File helpers for the crash-consistent parts of the pipeline.
///
/// Every chunk file, result file and final output is produced the same way: written to a
/// `.tmp` sibling, forced to disk, then moved over the target with an atomic rename. A reader
/// therefore sees either the complete previous file or the complete new one.
///
/// Content checksums are `sha256:<lowercase hex>`.
public final class DurableFiles {

    private static final Logger logger = LogManager.getLogger(DurableFiles.class);

    public static final String CHECKSUM_PREFIX = "sha256:";
    private static final int HASH_BUFFER = 64 * 1024;

    private DurableFiles() {
    }

    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String checksum(byte[] digest) {
        return CHECKSUM_PREFIX + HexFormat.of().formatHex(digest);
    }

    public static byte[] hash(Path file) throws IOException {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[HASH_BUFFER];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buffer)) > 0) {
                digest.update(buffer, 0, n);
            }
        }
        return digest.digest();
    }

    public static String checksumOf(Path file) throws IOException {
        return checksum(hash(file));
    }

    /// Decodes a `sha256:<hex>` checksum back to its 32 digest bytes.
    public static byte[] digestOf(String checksum) {
        if (checksum == null || !checksum.startsWith(CHECKSUM_PREFIX)) {
            throw new IllegalArgumentException("not a sha256 checksum: " + checksum);
        }
        return HexFormat.of().parseHex(checksum.substring(CHECKSUM_PREFIX.length()));
    }

    public static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    /// Forces `file` to the storage device.
    public static void force(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
    }

    /// Forces a fully written temp file, renames it over `target` and syncs the parent directory.
    public static void publish(Path temp, Path target) throws IOException {
        force(temp);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        syncDirectory(target.toAbsolutePath().getParent());
    }

    /// Directory fsync makes a rename durable on POSIX file systems. Platforms that cannot open
    /// a directory for syncing only lose the rename durability, so that failure is logged.
    public static void syncDirectory(Path dir) {
        if (dir == null) {
            return;
        }
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            logger.debug("directory sync not available for {}: {}", dir, e.getMessage());
        }
    }

    /// Recursively deletes a directory tree, if present.
    public static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (var paths = Files.walk(root)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
