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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/// Resolves transformer names to instances: built-in [TransformerKind]s first, then any
/// [RecordTransformerProvider] found through [ServiceLoader].
public final class RecordTransformers {

    private static final Logger logger = LogManager.getLogger(RecordTransformers.class);

    private RecordTransformers() {
    }

    /// @throws IllegalArgumentException if no transformer has this name
    public static RecordTransformer named(String name) {
        Optional<TransformerKind> kind = TransformerKind.forLabel(name);
        if (kind.isPresent()) {
            return kind.get().create();
        }
        Optional<RecordTransformerProvider> provider = findProvider(name);
        if (provider.isPresent()) {
            logger.debug("using transformer '{}' from {}", name, provider.get().getClass().getName());
            return provider.get().create();
        }
        throw new IllegalArgumentException("unknown transformer '" + name + "', available: " + String.join(", ", names()));
    }

    public static Optional<RecordTransformerProvider> findProvider(String name) {
        return ServiceLoader.load(RecordTransformerProvider.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .filter(p -> p.name().equalsIgnoreCase(name.strip()))
            .findFirst();
    }

    /// Every selectable name, built-ins first.
    public static List<String> names() {
        List<String> names = new ArrayList<>();
        for (TransformerKind kind : TransformerKind.values()) {
            names.add(kind.label());
        }
        ServiceLoader.load(RecordTransformerProvider.class).forEach(p -> names.add(p.name()));
        return names;
    }
}
