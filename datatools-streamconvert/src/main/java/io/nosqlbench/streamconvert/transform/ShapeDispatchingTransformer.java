package io.nosqlbench.streamconvert.transform;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/// Chooses a built-in transformer per record.
///
/// An explicit `question_type` field wins (`boolean`/`bool`, `mcq`/`multiple_choice`,
/// `generation`/`gen`, `graphwalk`/`graph`). Otherwise the record's fields decide:
/// `graph` means graphwalk, `choices` mcq, `correct` boolean, `expected_response` generation.
/// Anything else, including non-object records, passes through.
public final class ShapeDispatchingTransformer implements RecordTransformer {

    private final RecordTransformer booleans = new BooleanQuestionTransformer();
    private final RecordTransformer mcq = new MultipleChoiceTransformer();
    private final RecordTransformer generation = new GenerationTransformer();
    private final RecordTransformer graphwalk = new GraphWalkTransformer();
    private final RecordTransformer passthrough = new PassthroughTransformer();

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        return select(raw).transform(index, raw);
    }

    RecordTransformer select(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return passthrough;
        }
        JsonNode declared = raw.get("question_type");
        if (declared != null && declared.isTextual()) {
            switch (declared.textValue().strip().toLowerCase(Locale.ROOT)) {
                case "boolean", "bool" -> {
                    return booleans;
                }
                case "mcq", "multiple_choice" -> {
                    return mcq;
                }
                case "generation", "gen" -> {
                    return generation;
                }
                case "graphwalk", "graph" -> {
                    return graphwalk;
                }
                default -> {
                }
            }
        }
        if (raw.has("graph")) {
            return graphwalk;
        }
        if (raw.has("choices")) {
            return mcq;
        }
        if (raw.has("correct")) {
            return booleans;
        }
        if (raw.has("expected_response")) {
            return generation;
        }
        return passthrough;
    }
}
