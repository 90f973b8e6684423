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
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Multiple choice questions: `{id, group, context, question, choices, answer}`.
///
/// The answer text is resolved to a choice index by, in order:
///
/// 1. an exact match against a choice,
/// 2. a letter prefix such as `B)` read as a position,
/// 3. containment either way, ignoring case and any `X)` prefix.
///
/// An answer that matches no choice is a transform error.
public final class MultipleChoiceTransformer implements RecordTransformer {

    private static final Pattern LETTER_PREFIX = Pattern.compile("^([A-Za-z])\\)");
    private static final Pattern STRIP_PREFIX = Pattern.compile("^[A-Za-z]\\)\\s*");

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        ObjectNode item = SourceFields.requireObject(index, raw);
        String context = SourceFields.text(item, "context", "");
        String question = SourceFields.requireText(index, item, "question");
        String answer = SourceFields.requireText(index, item, "answer");
        List<String> choices = choices(index, item.get("choices"));

        int answerIndex = resolveAnswer(answer, choices);
        if (answerIndex < 0) {
            throw new TransformException("record " + index + ": answer '" + answer + "' matches none of "
                + choices.size() + " choices");
        }

        ObjectNode metadata = SourceFields.metadata(index);
        metadata.put("task_id", SourceFields.text(item, "id", "unknown"));
        metadata.put("planning_group", SourceFields.text(item, "group", "unknown"));
        metadata.put("question_type", "multiple_choice");
        metadata.put("domain", "planning_reasoning");
        metadata.put("original_context", context);
        metadata.put("choice_count", choices.size());

        return new ConversionRecord(SourceFields.questionWithContext(context, question), AnswerType.INT,
            IntNode.valueOf(answerIndex), choices, metadata);
    }

    private static List<String> choices(long index, JsonNode node) throws TransformException {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new TransformException("record " + index + " has no 'choices' list");
        }
        List<String> choices = new ArrayList<>(node.size());
        for (JsonNode choice : node) {
            String text = SourceFields.clean(choice.isValueNode() ? choice.asText() : choice.toString());
            if (!choice.isNull() && !text.isEmpty()) {
                choices.add(text);
            }
        }
        if (choices.isEmpty()) {
            throw new TransformException("record " + index + " has only empty choices");
        }
        return choices;
    }

    /// @return the 0-based choice index, or -1 when nothing matches
    static int resolveAnswer(String answer, List<String> choices) {
        String trimmed = answer.strip();
        for (int i = 0; i < choices.size(); i++) {
            if (trimmed.equals(choices.get(i).strip())) {
                return i;
            }
        }

        Matcher prefix = LETTER_PREFIX.matcher(trimmed);
        if (prefix.find()) {
            int position = Character.toUpperCase(prefix.group(1).charAt(0)) - 'A';
            if (position < choices.size()) {
                return position;
            }
        }

        String answerContent = STRIP_PREFIX.matcher(trimmed.toLowerCase(Locale.ROOT)).replaceFirst("");
        if (answerContent.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < choices.size(); i++) {
            String choiceContent = STRIP_PREFIX.matcher(choices.get(i).strip().toLowerCase(Locale.ROOT)).replaceFirst("");
            if (choiceContent.isEmpty()) {
                continue;
            }
            if (choiceContent.contains(answerContent) || answerContent.contains(choiceContent)) {
                return i;
            }
        }
        return -1;
    }
}
