package io.qscope.engine;

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

import com.google.gson.annotations.SerializedName;
import io.qscope.engine.circuit.CircuitStatistics;
import io.qscope.engine.metrics.MetricsBundle;
import io.qscope.engine.state.StateVector;

import java.util.List;

/// Full step-by-step result of [QuantumSimulator#simulate(io.qscope.engine.circuit.Circuit, SimulationOptions)].
///
/// @param numQubits register size
/// @param steps trace, step 0 first
/// @param finalMetrics metrics of the final state
/// @param circuitStatistics gate counts and circuit shape
public record SimulationResult(
    @SerializedName("num_qubits") int numQubits,
    @SerializedName("steps") List<SimulationStep> steps,
    @SerializedName("final_metrics") MetricsBundle finalMetrics,
    @SerializedName("circuit_statistics") CircuitStatistics circuitStatistics
) {

    public SimulationResult {
        steps = List.copyOf(steps);
    }

    public SimulationStep finalStep() {
        return steps.get(steps.size() - 1);
    }

    public StateVector finalState() {
        return finalStep().stateVector();
    }
}
