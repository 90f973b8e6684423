package io.nosqlbench.streamconvert.split;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nosqlbench.streamconvert.json.RecordJson;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/// Chunk file form of a JSON-lines record whose line is not one well-formed value.
///
/// Copying such a line into a chunk array verbatim would break the array, so the splitter
/// writes it as
///
/// ```
/// {"$malformed_line":{"problem":"line ends with 1 unclosed bracket(s)","text":"{\"id\":7"}}
/// ```
///
/// and the chunk processor turns it back into a failed record. The field name is reserved: a
/// source object whose only field is `$malformed_line` holding an object is read the same way.
public final class MalformedLine {

    public static final String FIELD = "$malformed_line";

    private static final ObjectMapper MAPPER = RecordJson.mapper();

    private MalformedLine() {
    }

    /// @return the UTF-8 JSON bytes of the carrier object
    public static byte[] encode(byte[] line, int length, String problem) {
        ObjectNode carried = MAPPER.createObjectNode();
        carried.put("problem", problem);
        carried.put("text", new String(line, 0, length, StandardCharsets.UTF_8));
        ObjectNode carrier = MAPPER.createObjectNode();
        carrier.set(FIELD, carried);
        try {
            return MAPPER.writeValueAsBytes(carrier);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot encode malformed line", e);
        }
    }

    /// @return the problem recorded by [#encode], or empty when `node` is an ordinary record
    public static Optional<String> problemOf(JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) {
            return Optional.empty();
        }
        JsonNode carried = node.get(FIELD);
        if (carried == null || !carried.isObject()) {
            return Optional.empty();
        }
        return Optional.of(carried.path("problem").asText("malformed line"));
    }
}
