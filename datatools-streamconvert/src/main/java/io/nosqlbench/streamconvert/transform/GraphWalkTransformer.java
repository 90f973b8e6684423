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

import java.util.ArrayList;
import java.util.List;

/// Graph traversal questions: `{id, graph: {nodes, edges}, question, answer, spatial_context?, reasoning?}`.
///
/// The question text is built from parts separated by blank lines:
///
/// ```
/// Graph Structure: 12 nodes, 30 edges
///
/// Spatial Context: 2D navigation
///
/// Navigation Context: <spatial_context>
///
/// Question: <question>
/// ```
///
/// The answer type follows the answer's shape: a list of strings is a `path`, any other list a
/// `sequence`, a number is `numeric`, anything else `text`.
public final class GraphWalkTransformer implements RecordTransformer {

    @Override
    public ConversionRecord transform(long index, JsonNode raw) throws TransformException {
        ObjectNode item = SourceFields.requireObject(index, raw);
        JsonNode graph = item.get("graph");
        if (graph == null || !graph.isObject()) {
            throw new TransformException("record " + index + " has no 'graph' object");
        }
        JsonNode nodes = graph.path("nodes");
        JsonNode edges = graph.path("edges");
        int nodeCount = nodes.isArray() || nodes.isObject() ? nodes.size() : 0;
        int edgeCount = edges.isArray() || edges.isObject() ? edges.size() : 0;
        int dimensions = spatialDimensions(nodes);
        boolean weighted = isWeighted(edges);
        String question = SourceFields.requireText(index, item, "question");
        String spatialContext = SourceFields.text(item, "spatial_context", "");

        List<String> parts = new ArrayList<>();
        parts.add("Graph Structure: " + nodeCount + " nodes, " + edgeCount + " edges");
        if (dimensions > 0) {
            parts.add("Spatial Context: " + dimensions + "D navigation");
        }
        if (weighted) {
            parts.add("Graph Type: Weighted graph with edge costs");
        }
        if (!spatialContext.isEmpty()) {
            parts.add("Navigation Context: " + spatialContext);
        }
        parts.add("Question: " + question);

        JsonNode answer = item.get("answer");
        if (answer == null) {
            answer = NullNode.instance;
        }

        ObjectNode metadata = SourceFields.metadata(index);
        metadata.put("graph_id", SourceFields.text(item, "id", "record_" + index));
        metadata.put("node_count", nodeCount);
        metadata.put("edge_count", edgeCount);
        metadata.put("spatial_dimensions", dimensions);
        metadata.put("weighted", weighted);
        metadata.put("reasoning_type", "spatial_traversal");
        String reasoning = SourceFields.text(item, "reasoning", "");
        if (!reasoning.isEmpty()) {
            metadata.put("reasoning", reasoning);
        }

        return new ConversionRecord(String.join("\n\n", parts), answerType(answer), answer.deepCopy(), List.of(),
            metadata);
    }

    static AnswerType answerType(JsonNode answer) {
        if (answer.isArray()) {
            for (JsonNode step : answer) {
                if (!step.isTextual()) {
                    return AnswerType.SEQUENCE;
                }
            }
            return AnswerType.PATH;
        }
        if (answer.isNumber()) {
            return AnswerType.NUMERIC;
        }
        return AnswerType.TEXT;
    }

    /// Counts the `x`/`y`/`z` coordinates present on the first node, or 0 for nodes without coordinates.
    private static int spatialDimensions(JsonNode nodes) {
        JsonNode first = null;
        if (nodes.isArray() && !nodes.isEmpty()) {
            first = nodes.get(0);
        } else if (nodes.isObject() && !nodes.isEmpty()) {
            first = nodes.elements().next();
        }
        if (first == null || !first.isObject()) {
            return 0;
        }
        JsonNode coordinates = first.has("position") ? first.get("position") : first;
        if (coordinates.isArray()) {
            return Math.min(coordinates.size(), 3);
        }
        int dimensions = 0;
        for (String axis : new String[]{"x", "y", "z"}) {
            if (coordinates.path(axis).isNumber()) {
                dimensions++;
            }
        }
        return dimensions;
    }

    private static boolean isWeighted(JsonNode edges) {
        for (JsonNode edge : edges) {
            if (edge.isObject() && (edge.has("weight") || edge.has("cost"))) {
                return true;
            }
        }
        return false;
    }
}
