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

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class RecordTransformersTest {

    @Test
    void resolvesBuiltInsByLabelOrEnumName() {
        assertThat(RecordTransformers.named("mcq")).isInstanceOf(MultipleChoiceTransformer.class);
        assertThat(RecordTransformers.named(" GraphWalk ")).isInstanceOf(GraphWalkTransformer.class);
        assertThat(RecordTransformers.named("AUTO")).isInstanceOf(ShapeDispatchingTransformer.class);
    }

    @Test
    void resolvesServiceLoaderProviders() throws Exception {
        RecordTransformer transformer = RecordTransformers.named("UPPERCASE");

        assertThat(transformer.transform(3, TextNode.valueOf("abc")).question()).isEqualTo("\"ABC\"");
        assertThat(RecordTransformers.findProvider("uppercase")).isPresent();
    }

    @Test
    void listsBuiltInsBeforeProviders() {
        assertThat(RecordTransformers.names())
            .startsWith("boolean", "mcq", "generation", "graphwalk", "passthrough", "auto")
            .contains("uppercase");
    }

    @Test
    void unknownNameListsAlternatives() {
        assertThatThrownBy(() -> RecordTransformers.named("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown transformer 'nope'")
            .hasMessageContaining("passthrough");
    }
}
