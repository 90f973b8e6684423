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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.streamconvert.json.RecordJson;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ShapeDispatchingTransformerTest {

    private static final ObjectMapper MAPPER = RecordJson.mapper();
    private final ShapeDispatchingTransformer dispatcher = new ShapeDispatchingTransformer();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{\"graph\":{},\"choices\":[1]}                       | GraphWalkTransformer",
        "{\"choices\":[\"a\"],\"correct\":true}                | MultipleChoiceTransformer",
        "{\"correct\":true}                                   | BooleanQuestionTransformer",
        "{\"expected_response\":\"x\"}                         | GenerationTransformer",
        "{\"other\":1}                                        | PassthroughTransformer",
        "[1,2,3]                                             | PassthroughTransformer",
        "{\"question_type\":\"generation\",\"correct\":true}    | GenerationTransformer",
        "{\"question_type\":\"MCQ\"}                           | MultipleChoiceTransformer",
        "{\"question_type\":\"unknown\",\"correct\":false}      | BooleanQuestionTransformer"
    })
    void selectsByShape(String record, String expected) throws Exception {
        assertThat(dispatcher.select(MAPPER.readTree(record)).getClass().getSimpleName()).isEqualTo(expected);
    }

    @Test
    void convertsMixedRecords() throws Exception {
        assertThat(dispatcher.transform(0, MAPPER.readTree("{\"question\":\"Q\",\"correct\":true}")).answerType())
            .isEqualTo(AnswerType.BOOL);
        assertThat(dispatcher.transform(1, MAPPER.readTree("42")).answerType())
            .isEqualTo(AnswerType.PAYLOAD);
    }
}
