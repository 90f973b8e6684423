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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.List;

/// Free-text answer questions: `{id, group, context, question, expected_response}`.
public final class GenerationTransformer implements RecordTransformer {

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        ObjectNode item = SourceFields.requireObject(index, raw);
        String context = SourceFields.text(item, "context", "");
        String question = SourceFields.requireText(index, item, "question");
        String expected = SourceFields.requireText(index, item, "expected_response");

        ObjectNode metadata = SourceFields.metadata(index);
        metadata.put("task_id", SourceFields.text(item, "id", "unknown"));
        metadata.put("planning_group", SourceFields.text(item, "group", "unknown"));
        metadata.put("question_type", "generation");
        metadata.put("domain", "planning_reasoning");
        metadata.put("original_context", context);
        metadata.put("expected_length", expected.length());

        return new ConversionRecord(SourceFields.questionWithContext(context, question), AnswerType.STR,
            TextNode.valueOf(expected), List.of(), metadata);
    }
}
