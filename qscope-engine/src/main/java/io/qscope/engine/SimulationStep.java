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
import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.math.ComplexMatrix;
import io.qscope.engine.metrics.MetricsBundle;
import io.qscope.engine.narrate.StepExplanation;
import io.qscope.engine.state.AmplitudeInfo;
import io.qscope.engine.state.BlochVector;
import io.qscope.engine.state.StateVector;

import java.util.List;
import java.util.Map;

/// One snapshot of a simulation trace.
///
/// Step 0 is always |0…0⟩ with no gate. Step k > 0 is the state after the k-th gate in
/// normalized order.
///
/// @param step index in the trace
/// @param operation "initialization" for step 0, otherwise the gate kind
/// @param gate applied gate, null for step 0
/// @param stateVector amplitudes after this step
/// @param blochVectors Bloch vector per qubit
/// @param measurementProbabilities |ψᵢ|² per basis state
/// @param probabilityAmplitudes polar view of each amplitude
/// @param gateMatrix full-system operator, null for step 0 or when not exported
/// @param explanation one-line explanation
/// @param detailedExplanation full narration, null for step 0
/// @param metrics metrics of this snapshot, null when not requested
public record SimulationStep(
    @SerializedName("step") int step,
    @SerializedName("operation") String operation,
    @SerializedName("gate") GateSpec gate,
    @SerializedName("state_vector") StateVector stateVector,
    @SerializedName("bloch_vectors") Map<Integer, BlochVector> blochVectors,
    @SerializedName("measurement_probabilities") double[] measurementProbabilities,
    @SerializedName("probability_amplitudes") List<AmplitudeInfo> probabilityAmplitudes,
    @SerializedName("gate_matrix") ComplexMatrix gateMatrix,
    @SerializedName("explanation") String explanation,
    @SerializedName("detailed_explanation") StepExplanation detailedExplanation,
    @SerializedName("metrics") MetricsBundle metrics
) {

    /// Operation name of step 0.
    public static final String INITIALIZATION = "initialization";

    public boolean isInitial() {
        return gate == null;
    }
}
