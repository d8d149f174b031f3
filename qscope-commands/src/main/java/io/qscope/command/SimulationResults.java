package io.qscope.command;

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

import io.qscope.engine.EngineConfig;
import io.qscope.engine.SimulationResult;
import io.qscope.engine.SimulationStep;
import io.qscope.engine.circuit.CircuitStatistics;
import io.qscope.engine.metrics.MetricsEngine;
import io.qscope.engine.state.AmplitudeInfo;
import io.qscope.engine.state.BlochVector;
import io.qscope.engine.state.StateVector;

import java.util.List;
import java.util.Map;

/// Caller-side helpers for presenting simulation outcomes.
public final class SimulationResults {

    /// Operation name of the placeholder step.
    public static final String ERROR_OPERATION = "error";

    private SimulationResults() {
        // Utility class
    }

    /// Builds a safe placeholder result for callers that must always return a value.
    ///
    /// The placeholder is a single step holding the 1-qubit ground state |0⟩, whose
    /// explanation carries the failure message.
    ///
    /// @param message failure description shown to the user
    /// @return a result with one step, purity 1 and entropy 0
    public static SimulationResult fallback(String message) {
        StateVector ground = StateVector.ground(1);
        SimulationStep step = new SimulationStep(0, ERROR_OPERATION, null, ground,
            Map.of(0, BlochVector.GROUND), ground.probabilities(), AmplitudeInfo.listOf(ground), null,
            "Simulation error: " + message, null, null);
        return new SimulationResult(1, List.of(step),
            new MetricsEngine(EngineConfig.defaults()).compute(ground, ground),
            new CircuitStatistics(0, Map.of(), 0, 1, 0.0));
    }
}
