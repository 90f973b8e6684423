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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.nosqlbench.streamconvert.transform.ConversionRecord;

/// One line of a chunk result file: `{"index":N,"record":{...}}` or `{"index":N,"error":"..."}`.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"index", "record", "error"})
public record ResultEnvelope(long index, ConversionRecord record, String error) {

    public static ResultEnvelope of(RecordOutcome outcome) {
        if (outcome instanceof RecordOutcome.Converted converted) {
            return new ResultEnvelope(converted.index(), converted.record(), null);
        }
        RecordOutcome.Failed failed = (RecordOutcome.Failed) outcome;
        return new ResultEnvelope(failed.index(), null, failed.message());
    }
}
