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

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/// The built-in transformers, selectable by name.
public enum TransformerKind {
    BOOLEAN("boolean", "true/false questions with a 'correct' flag", BooleanQuestionTransformer::new),
    MCQ("mcq", "multiple choice questions resolved to a choice index", MultipleChoiceTransformer::new),
    GENERATION("generation", "free text questions with an 'expected_response'", GenerationTransformer::new),
    GRAPHWALK("graphwalk", "graph traversal questions with a 'graph' of nodes and edges", GraphWalkTransformer::new),
    PASSTHROUGH("passthrough", "any record, kept as its JSON text", PassthroughTransformer::new),
    AUTO("auto", "picks one of the above per record from its fields", ShapeDispatchingTransformer::new);

    private final String label;
    private final String description;
    private final Supplier<RecordTransformer> factory;

    TransformerKind(String label, String description, Supplier<RecordTransformer> factory) {
        this.label = label;
        this.description = description;
        this.factory = factory;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public RecordTransformer create() {
        return factory.get();
    }

    public static Optional<TransformerKind> forLabel(String name) {
        String wanted = name.strip().toLowerCase(Locale.ROOT);
        for (TransformerKind kind : values()) {
            if (kind.label.equals(wanted) || kind.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
