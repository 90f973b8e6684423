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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class QualityReportTest {

    @Test
    void emptyReportScoresOne() {
        assertThat(QualityReport.empty().integrityScore()).isEqualTo(1.0);
    }

    @Test
    void tallyCountsOutcomesInOrder() {
        QualityReport.Tally tally = new QualityReport.Tally();
        tally.success();
        tally.add(new RecordOutcome.Failed(1, "bad"));
        tally.success();
        tally.success();

        QualityReport report = tally.report();
        assertThat(report.totalRecords()).isEqualTo(4);
        assertThat(report.successCount()).isEqualTo(3);
        assertThat(report.failureCount()).isEqualTo(1);
        assertThat(report.skipped()).containsExactly(new SkippedRecord(1, "bad"));
        assertThat(report.integrityScore()).isEqualTo(0.75);
    }

    @Test
    void mergeAddsCountsAndKeepsSkippedOrder() {
        QualityReport first = new QualityReport(10, 9, 1, List.of(new SkippedRecord(3, "a")), false);
        QualityReport second = new QualityReport(5, 3, 2,
            List.of(new SkippedRecord(11, "b"), new SkippedRecord(14, "c")), false);

        QualityReport merged = QualityReport.empty().merge(first).merge(second);
        assertThat(merged.totalRecords()).isEqualTo(15);
        assertThat(merged.failureCount()).isEqualTo(3);
        assertThat(merged.skipped()).extracting(SkippedRecord::index).containsExactly(3L, 11L, 14L);
        assertThat(merged.skippedTruncated()).isFalse();
    }

    @Test
    void skippedSampleIsBoundedButCountsStayExact() {
        QualityReport.Tally tally = new QualityReport.Tally();
        for (int i = 0; i < QualityReport.MAX_SKIPPED + 5; i++) {
            tally.failure(i, "x");
        }
        QualityReport report = tally.report();
        assertThat(report.failureCount()).isEqualTo(QualityReport.MAX_SKIPPED + 5);
        assertThat(report.skipped()).hasSize(QualityReport.MAX_SKIPPED);
        assertThat(report.skippedTruncated()).isTrue();

        QualityReport merged = report.merge(new QualityReport(1, 0, 1, List.of(new SkippedRecord(9999, "y")), false));
        assertThat(merged.skipped()).hasSize(QualityReport.MAX_SKIPPED);
        assertThat(merged.failureCount()).isEqualTo(QualityReport.MAX_SKIPPED + 6);
    }

    @Test
    void rejectsInconsistentCounts() {
        assertThatThrownBy(() -> new QualityReport(5, 3, 1, List.of(), false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("!= total (5)");
    }
}
