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

import java.util.List;

/// Single-shot result of [QuantumSimulator#simulateFinal(io.qscope.engine.circuit.Circuit)].
///
/// Keys match the compact payload consumed by lightweight callers, hence the camel-case
/// `measurementProbabilities`.
///
/// @param qubits Bloch vector per qubit
/// @param entanglement average single-qubit entanglement entropy
/// @param purity Σpᵢ²
/// @param fidelity √purity
/// @param measurementProbabilities |ψᵢ|² per basis state
public record FinalStateResult(
    @SerializedName("qubits") List<QubitBloch> qubits,
    @SerializedName("entanglement") double entanglement,
    @SerializedName("purity") double purity,
    @SerializedName("fidelity") double fidelity,
    @SerializedName("measurementProbabilities") double[] measurementProbabilities
) {

    public FinalStateResult {
        qubits = List.copyOf(qubits);
    }
}
