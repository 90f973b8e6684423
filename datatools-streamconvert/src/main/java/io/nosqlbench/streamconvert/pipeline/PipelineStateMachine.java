package io.nosqlbench.streamconvert.pipeline;

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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/// Guards the [PipelineState] transitions:
///
/// ```
/// INITIALIZED -> [RESUMING ->] SPLITTING -> PROCESSING -> ASSEMBLING -> COMPLETED
/// ```
///
/// `FAILED` is reachable from every non-terminal state. Anything else raises
/// [IllegalStateException].
public final class PipelineStateMachine {

    private static final Logger logger = LogManager.getLogger(PipelineStateMachine.class);

    private static final Map<PipelineState, Set<PipelineState>> ALLOWED = new EnumMap<>(PipelineState.class);

    static {
        ALLOWED.put(PipelineState.INITIALIZED, EnumSet.of(PipelineState.RESUMING, PipelineState.SPLITTING));
        ALLOWED.put(PipelineState.RESUMING, EnumSet.of(PipelineState.SPLITTING));
        ALLOWED.put(PipelineState.SPLITTING, EnumSet.of(PipelineState.PROCESSING));
        ALLOWED.put(PipelineState.PROCESSING, EnumSet.of(PipelineState.ASSEMBLING));
        ALLOWED.put(PipelineState.ASSEMBLING, EnumSet.of(PipelineState.COMPLETED));
        ALLOWED.put(PipelineState.COMPLETED, EnumSet.noneOf(PipelineState.class));
        ALLOWED.put(PipelineState.FAILED, EnumSet.noneOf(PipelineState.class));
    }

    private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();
    private volatile PipelineState state = PipelineState.INITIALIZED;

    public PipelineStateMachine(List<PipelineListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public PipelineState state() {
        return state;
    }

    public static boolean isAllowed(PipelineState from, PipelineState to) {
        if (to == PipelineState.FAILED) {
            return !from.isTerminal();
        }
        return ALLOWED.get(from).contains(to);
    }

    /// @throws IllegalStateException if `to` cannot follow the current state
    public synchronized void transition(PipelineState to) {
        PipelineState from = state;
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("illegal pipeline transition " + from + " -> " + to);
        }
        state = to;
        logger.info("pipeline {} -> {}", from, to);
        for (PipelineListener listener : listeners) {
            listener.stateChanged(from, to);
        }
    }
}
