package io.nosqlbench.streamconvert.process;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Success and failure tally for a chunk or for the whole dataset.
 *
 * <p>The skipped-record list is a bounded sample: at most {@link #MAX_SKIPPED} entries are
 * kept, and {@code skippedTruncated} records whether any were dropped. The counts are always
 * exact.</p>
 *
 * @param totalRecords records seen
 * @param successCount records converted
 * @param failureCount records skipped
 * @param skipped sample of skipped records in index order
 * @param skippedTruncated true when {@code skipped} holds fewer entries than {@code failureCount}
 */
public record QualityReport(
    long totalRecords,
    long successCount,
    long failureCount,
    List<SkippedRecord> skipped,
    boolean skippedTruncated
) {

    public static final int MAX_SKIPPED = 1000;

    private static final QualityReport EMPTY = new QualityReport(0, 0, 0, List.of(), false);

    public QualityReport {
        if (successCount + failureCount != totalRecords) {
            throw new IllegalArgumentException("success (" + successCount + ") + failure (" + failureCount
                + ") != total (" + totalRecords + ")");
        }
        skipped = List.copyOf(skipped);
    }

    public static QualityReport empty() {
        return EMPTY;
    }

    /// `successCount / totalRecords`, and 1.0 for an empty dataset.
    public double integrityScore() {
        if (totalRecords == 0) {
            return 1.0;
        }
        return (double) successCount / totalRecords;
    }

    /// Combines this report with one for the records that follow it.
    public QualityReport merge(QualityReport next) {
        List<SkippedRecord> combined = new ArrayList<>(Math.min(MAX_SKIPPED, skipped.size() + next.skipped.size()));
        combined.addAll(skipped);
        boolean truncated = skippedTruncated || next.skippedTruncated;
        for (SkippedRecord record : next.skipped) {
            if (combined.size() >= MAX_SKIPPED) {
                truncated = true;
                break;
            }
            combined.add(record);
        }
        return new QualityReport(totalRecords + next.totalRecords, successCount + next.successCount,
            failureCount + next.failureCount, combined, truncated);
    }

    /// Accumulates outcomes in order.
    public static final class Tally {
        private long total;
        private long success;
        private long failure;
        private final List<SkippedRecord> skipped = new ArrayList<>();
        private boolean truncated;

        public void add(RecordOutcome outcome) {
            if (outcome instanceof RecordOutcome.Failed failed) {
                failure(failed.index(), failed.message());
            } else {
                success();
            }
        }

        public void success() {
            total++;
            success++;
        }

        public void failure(long index, String message) {
            total++;
            failure++;
            if (skipped.size() < MAX_SKIPPED) {
                skipped.add(new SkippedRecord(index, message));
            } else {
                truncated = true;
            }
        }

        public long total() {
            return total;
        }

        public long failures() {
            return failure;
        }

        public QualityReport report() {
            return new QualityReport(total, success, failure, skipped, truncated);
        }
    }
}
