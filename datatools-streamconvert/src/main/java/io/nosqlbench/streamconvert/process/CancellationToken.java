package io.nosqlbench.streamconvert.process;

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

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/// Cooperative cancellation shared by the orchestrator and its chunk workers.
/// The first reason to be set wins; later calls are ignored.
public final class CancellationToken {

    public enum Reason {
        /** The wall clock timeout elapsed */
        TIMEOUT,
        /** Cancelled from outside, for example by a shutdown hook */
        CANCELLED,
        /** Another chunk failed and the run is ending */
        FAILED,
        /** Memory stayed at the hard level past the grace window */
        RESOURCE
    }

    private final AtomicReference<Reason> reason = new AtomicReference<>();

    /// @return true if this call set the reason
    public boolean cancel(Reason why) {
        return reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<Reason> reason() {
        return Optional.ofNullable(reason.get());
    }
}
