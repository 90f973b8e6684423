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
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;

/// Carries any record through unchanged as its compact JSON text, with no answer value.
public final class PassthroughTransformer implements RecordTransformer {

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        if (raw == null || raw.isMissingNode()) {
            throw new TransformException("record " + index + " is empty");
        }
        ObjectNode metadata = SourceFields.metadata(index);
        metadata.put("source_type", raw.getNodeType().name().toLowerCase(Locale.ROOT));
        return new ConversionRecord(raw.toString(), AnswerType.PAYLOAD, NullNode.instance, List.of(), metadata);
    }
}
