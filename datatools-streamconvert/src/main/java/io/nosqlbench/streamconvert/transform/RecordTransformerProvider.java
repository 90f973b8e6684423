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

/// Service interface for transformers supplied from outside this library.
///
/// Register implementations in `META-INF/services/io.nosqlbench.streamconvert.transform.RecordTransformerProvider`;
/// they become selectable by [#name()] anywhere a transformer name is accepted.
public interface RecordTransformerProvider {

    /// The selection name, matched case-insensitively.
    String name();

    /// A one-line description for listings.
    default String description() {
        return name();
    }

    RecordTransformer create();
}
