package io.nosqlbench.streamconvert.memory;

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

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/// Source of memory readings for the [MemoryMonitor]. Tests supply synthetic probes.
@FunctionalInterface
public interface MemoryProbe {

    /// @return bytes currently in use
    long usedBytes();

    /// Heap plus non-heap use of this JVM.
    static MemoryProbe jvm() {
        MemoryMXBean memoryMXBean = ManagementFactory.getMemoryMXBean();
        return () -> memoryMXBean.getHeapMemoryUsage().getUsed() + memoryMXBean.getNonHeapMemoryUsage().getUsed();
    }
}
