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
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.streamconvert.json.RecordJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("reference transformers")
class ReferenceTransformersTest {

    private static final ObjectMapper MAPPER = RecordJson.mapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("boolean")
    class Booleans {

        private final RecordTransformer transformer = new BooleanQuestionTransformer();

        @Test
        void convertsWithContext() throws Exception {
            ConversionRecord record = transformer.transform(4, json(
                "{\"id\":\"p-1\",\"group\":\"g2\",\"context\":\" stack A on B \",\"question\":\"Is it valid?\",\"correct\":true}"));

            assertThat(record.question()).isEqualTo("Context: stack A on B\n\nQuestion: Is it valid?");
            assertThat(record.answerType()).isEqualTo(AnswerType.BOOL);
            assertThat(record.correctAnswer().booleanValue()).isTrue();
            assertThat(record.choices()).isEmpty();
            assertThat(record.metadata().get("record_index").asLong()).isEqualTo(4);
            assertThat(record.metadata().get("task_id").asText()).isEqualTo("p-1");
            assertThat(record.metadata().get("planning_group").asText()).isEqualTo("g2");
            assertThat(record.metadata().get("question_type").asText()).isEqualTo("boolean");
        }

        @Test
        void acceptsTextualFlagAndMissingContext() throws Exception {
            ConversionRecord record = transformer.transform(0, json("{\"question\":\"Q\",\"correct\":\"False\"}"));

            assertThat(record.question()).isEqualTo("Q");
            assertThat(record.correctAnswer().booleanValue()).isFalse();
            assertThat(record.metadata().get("task_id").asText()).isEqualTo("unknown");
        }

        @Test
        void stripsControlCharacters() throws Exception {
            ConversionRecord record = transformer.transform(0, json("{\"question\":\"a\\u0000b\\u0007c\\td\",\"correct\":true}"));
            assertThat(record.question()).isEqualTo("abc\td");
        }

        @Test
        void rejectsMissingAnswer() {
            assertThatThrownBy(() -> transformer.transform(7, json("{\"question\":\"Q\"}")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("record 7")
                .hasMessageContaining("'correct'");
        }

        @Test
        void rejectsNonObjects() {
            assertThatThrownBy(() -> transformer.transform(3, json("[1,2]")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("not a JSON object but array");
        }
    }

    @Nested
    @DisplayName("multiple choice")
    class MultipleChoice {

        private final RecordTransformer transformer = new MultipleChoiceTransformer();

        @Test
        void resolvesAnswerToChoiceIndex() throws Exception {
            ConversionRecord record = transformer.transform(1, json(
                "{\"id\":\"m\",\"question\":\"Pick\",\"choices\":[\"A) red\",\"B) green\",\"C) blue\"],\"answer\":\"B) green\"}"));

            assertThat(record.answerType()).isEqualTo(AnswerType.INT);
            assertThat(record.correctAnswer().intValue()).isEqualTo(1);
            assertThat(record.choices()).containsExactly("A) red", "B) green", "C) blue");
            assertThat(record.metadata().get("choice_count").asInt()).isEqualTo(3);
        }

        @ParameterizedTest
        @CsvSource({
            "'B) green', 1",
            "'c)', 2",
            "'blue', 2",
            "'RED', 0",
            "'the color green, obviously', 1",
            "'purple', -1",
            "'D) purple', -1"
        })
        void answerResolution(String answer, int expected) {
            assertThat(MultipleChoiceTransformer.resolveAnswer(answer, List.of("A) red", "B) green", "C) blue")))
                .isEqualTo(expected);
        }

        @Test
        void exactMatchWinsOverPrefix() {
            assertThat(MultipleChoiceTransformer.resolveAnswer("b) x", List.of("a) y", "z", "b) x"))).isEqualTo(2);
        }

        @Test
        void unmatchedAnswerIsATransformError() {
            assertThatThrownBy(() -> transformer.transform(2, json(
                "{\"question\":\"Pick\",\"choices\":[\"yes\",\"no\"],\"answer\":\"maybe\"}")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("matches none of 2 choices");
        }

        @Test
        void emptyChoicesAreRejected() {
            assertThatThrownBy(() -> transformer.transform(2, json(
                "{\"question\":\"Pick\",\"choices\":[],\"answer\":\"x\"}")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("no 'choices' list");
        }
    }

    @Nested
    @DisplayName("generation")
    class Generation {

        @Test
        void keepsExpectedResponse() throws Exception {
            ConversionRecord record = new GenerationTransformer().transform(9, json(
                "{\"question\":\"Describe\",\"context\":\"ctx\",\"expected_response\":\"a plan\"}"));

            assertThat(record.answerType()).isEqualTo(AnswerType.STR);
            assertThat(record.correctAnswer().asText()).isEqualTo("a plan");
            assertThat(record.metadata().get("expected_length").asInt()).isEqualTo(6);
            assertThat(record.question()).startsWith("Context: ctx");
        }

        @Test
        void requiresExpectedResponse() {
            assertThatThrownBy(() -> new GenerationTransformer().transform(9, json("{\"question\":\"Describe\"}")))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("expected_response");
        }
    }

    @Nested
    @DisplayName("graph walk")
    class GraphWalk {

        @Test
        void describesGraphInQuestion() throws Exception {
            ConversionRecord record = new GraphWalkTransformer().transform(0, json("""
                {"id":"g7",
                 "graph":{"nodes":[{"id":"a","x":0,"y":1},{"id":"b","x":2,"y":3}],
                          "edges":[{"from":"a","to":"b","weight":2.5}]},
                 "spatial_context":"grid city",
                 "question":"Shortest path from a to b?",
                 "answer":["a","b"],
                 "reasoning":"direct edge"}
                """));

            assertThat(record.question()).isEqualTo("""
                Graph Structure: 2 nodes, 1 edges

                Spatial Context: 2D navigation

                Graph Type: Weighted graph with edge costs

                Navigation Context: grid city

                Question: Shortest path from a to b?""");
            assertThat(record.answerType()).isEqualTo(AnswerType.PATH);
            assertThat(record.metadata().get("graph_id").asText()).isEqualTo("g7");
            assertThat(record.metadata().get("spatial_dimensions").asInt()).isEqualTo(2);
            assertThat(record.metadata().get("weighted").asBoolean()).isTrue();
            assertThat(record.metadata().get("reasoning").asText()).isEqualTo("direct edge");
        }

        @Test
        void answerTypeFollowsAnswerShape() throws Exception {
            assertThat(GraphWalkTransformer.answerType(json("[\"a\",\"b\"]"))).isEqualTo(AnswerType.PATH);
            assertThat(GraphWalkTransformer.answerType(json("[1,2]"))).isEqualTo(AnswerType.SEQUENCE);
            assertThat(GraphWalkTransformer.answerType(json("12.5"))).isEqualTo(AnswerType.NUMERIC);
            assertThat(GraphWalkTransformer.answerType(json("\"b\""))).isEqualTo(AnswerType.TEXT);
        }

        @Test
        void plainGraphHasNoSpatialOrWeightLines() throws Exception {
            ConversionRecord record = new GraphWalkTransformer().transform(5, json(
                "{\"graph\":{\"nodes\":[\"a\",\"b\",\"c\"],\"edges\":[[\"a\",\"b\"]]},\"question\":\"Q\",\"answer\":3}"));

            assertThat(record.question()).isEqualTo("Graph Structure: 3 nodes, 1 edges\n\nQuestion: Q");
            assertThat(record.metadata().get("graph_id").asText()).isEqualTo("record_5");
            assertThat(record.correctAnswer().intValue()).isEqualTo(3);
        }
    }

    @Test
    void passthroughKeepsCompactJson() throws Exception {
        ConversionRecord record = new PassthroughTransformer().transform(2, json("{ \"anything\" : [1, 2] }"));

        assertThat(record.question()).isEqualTo("{\"anything\":[1,2]}");
        assertThat(record.answerType()).isEqualTo(AnswerType.PAYLOAD);
        assertThat(record.correctAnswer().isNull()).isTrue();
        assertThat(record.metadata().get("source_type").asText()).isEqualTo("object");
    }

    @Test
    void recordsSerializeWithSnakeCaseFields() throws Exception {
        ConversionRecord record = new BooleanQuestionTransformer().transform(0, json("{\"question\":\"Q\",\"correct\":true}"));
        String text = MAPPER.writeValueAsString(record);

        assertThat(text).startsWith("{\"question\":\"Q\",\"answer_type\":\"bool\",\"correct_answer\":true,\"choices\":[]");
    }
}
