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
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/// True/false planning questions: `{id, group, context, question, correct}`.
public final class BooleanQuestionTransformer implements RecordTransformer {

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        ObjectNode item = SourceFields.requireObject(index, raw);
        String context = SourceFields.text(item, "context", "");
        String question = SourceFields.requireText(index, item, "question");
        boolean correct = correctValue(index, item.get("correct"));

        ObjectNode metadata = SourceFields.metadata(index);
        metadata.put("task_id", SourceFields.text(item, "id", "unknown"));
        metadata.put("planning_group", SourceFields.text(item, "group", "unknown"));
        metadata.put("question_type", "boolean");
        metadata.put("domain", "planning_reasoning");
        metadata.put("original_context", context);

        return new ConversionRecord(SourceFields.questionWithContext(context, question), AnswerType.BOOL,
            BooleanNode.valueOf(correct), List.of(), metadata);
    }

    private static boolean correctValue(long index, JsonNode node) throws TransformException {
        if (node != null && node.isBoolean()) {
            return node.booleanValue();
        }
        if (node != null && node.isTextual()) {
            String text = node.textValue().strip();
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new TransformException("record " + index + " has no boolean 'correct' field");
    }
}
