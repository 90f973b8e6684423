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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * One standardized dataset entry, produced from exactly one source record.
 *
 * <p>Records hold no wall-clock values, so converting the same source twice gives byte-identical
 * output.</p>
 *
 * @param question      the question text, or the serialized payload for passthrough records
 * @param answerType    what {@code correctAnswer} holds
 * @param correctAnswer the answer value; a boolean, choice index, string, list or number
 * @param choices       the answer options, empty unless the record is multiple choice
 * @param metadata      descriptive fields carried over from the source
 */
@JsonPropertyOrder({"question", "answer_type", "correct_answer", "choices", "metadata"})
public record ConversionRecord(
    @JsonProperty("question") String question,
    @JsonProperty("answer_type") AnswerType answerType,
    @JsonProperty("correct_answer") JsonNode correctAnswer,
    @JsonProperty("choices") List<String> choices,
    @JsonProperty("metadata") ObjectNode metadata
) {

    public ConversionRecord {
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(answerType, "answerType");
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
