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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/// Field access and text cleanup shared by the reference transformers.
final class SourceFields {

    private SourceFields() {
    }

    static ObjectNode requireObject(long index, JsonNode raw) throws TransformException {
        if (raw == null || !raw.isObject()) {
            throw new TransformException("record " + index + " is not a JSON object but "
                + (raw == null ? "missing" : raw.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return (ObjectNode) raw;
    }

    /// Text of a field after [#clean(String)], or `fallback` when absent or null.
    /// Non-string scalars are rendered with their JSON text.
    static String text(JsonNode object, String field, String fallback) {
        JsonNode node = object.get(field);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        return clean(node.isValueNode() ? node.asText() : node.toString());
    }

    static String requireText(long index, JsonNode object, String field) throws TransformException {
        String value = text(object, field, null);
        if (value == null || value.isEmpty()) {
            throw new TransformException("record " + index + " has no '" + field + "' field");
        }
        return value;
    }

    /// Drops control characters other than tab, CR and LF, and trims surrounding whitespace.
    static String clean(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 0x20 || c == '\n' || c == '\r' || c == '\t') {
                sb.append(c);
            }
        }
        return sb.toString().strip();
    }

    /// `Context: ...` followed by `Question: ...`, or only the question when there is no context.
    static String questionWithContext(String context, String question) {
        if (context == null || context.isEmpty()) {
            return question;
        }
        return "Context: " + context + "\n\nQuestion: " + question;
    }

    static ObjectNode metadata(long index) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("record_index", index);
        return metadata;
    }
}
