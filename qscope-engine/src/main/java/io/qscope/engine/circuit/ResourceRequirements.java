package io.qscope.engine.circuit;

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

/// Symbolic simulation cost of a circuit.
///
/// @param qubitsRequired qubit count
/// @param gatesRequired gate count
/// @param memoryComplexity e.g. `O(2^3)`
/// @param timeComplexity e.g. `O(4 * 2^3)`
public record ResourceRequirements(
    @SerializedName("qubits_required") int qubitsRequired,
    @SerializedName("gates_required") int gatesRequired,
    @SerializedName("memory_complexity") String memoryComplexity,
    @SerializedName("time_complexity") String timeComplexity
) {

    public static ResourceRequirements of(int qubits, int gates) {
        return new ResourceRequirements(qubits, gates,
            "O(2^" + qubits + ")",
            "O(" + gates + " * 2^" + qubits + ")");
    }
}
