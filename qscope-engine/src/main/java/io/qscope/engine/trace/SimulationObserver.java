package io.qscope.engine.trace;

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

import io.qscope.engine.SimulationResult;
import io.qscope.engine.SimulationStep;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.json.QscopeGsonConfig;

/// Observer for monitoring a simulation as it runs.
///
/// ## Lifecycle
///
/// ```text
///   ┌───────────────────┐
///   │ onSimulationStart │ ──► limits checked, before the register is allocated
///   └───────────────────┘
///           │
///           ▼
///   ┌──────────────┐
///   │ onStep       │ ──► once for step 0, then once per gate
///   │ (n+1 times)  │
///   └──────────────┘
///           │
///           ▼
///   ┌──────────────────────┐
///   │ onSimulationComplete │ ──► final metrics available
///   └──────────────────────┘
/// ```
///
/// If the simulation fails, [#onSimulationComplete(SimulationResult)] is not called.
///
/// ## Usage
///
/// ```java
/// try (NdjsonTraceObserver trace = new NdjsonTraceObserver(Path.of("trace.ndjson"))) {
///     SimulationOptions options = SimulationOptions.builder().observer(trace).build();
///     simulator.simulate(circuit, options);
/// }
/// ```
///
/// Observers are passed per call. The engine never keeps one between calls.
public interface SimulationObserver {

    /// No-op observer, the default.
    SimulationObserver NOOP = new SimulationObserver() {
        @Override
        public void onSimulationStart(Circuit circuit) {
            // No-op
        }

        @Override
        public void onStep(SimulationStep step) {
            // No-op
        }

        @Override
        public void onSimulationComplete(SimulationResult result) {
            // No-op
        }
    };

    /// @param circuit the normalized circuit about to run
    void onSimulationStart(Circuit circuit);

    /// @param step the step just computed
    void onStep(SimulationStep step);

    /// @param result the complete result
    void onSimulationComplete(SimulationResult result);

    /// Formats an object as compact single-line JSON with the engine's Gson configuration.
    ///
    /// @param event the object to format
    /// @return compact JSON
    static String toCompactJson(Object event) {
        return QscopeGsonConfig.compactGson().toJson(event);
    }
}
