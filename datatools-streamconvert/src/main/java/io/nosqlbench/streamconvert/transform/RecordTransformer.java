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

/// Maps one raw source record to one [ConversionRecord].
///
/// Implementations must be pure: the result depends only on the arguments, and a transformer
/// instance is called concurrently from several chunk workers.
@FunctionalInterface
public interface RecordTransformer {

    /// @param index the record's ordinal position in the source, from 0
    /// @param raw   the parsed record
    /// @throws TransformException if the record does not have the expected shape
    ConversionRecord transform(long index, JsonNode raw) throws TransformException;
}
