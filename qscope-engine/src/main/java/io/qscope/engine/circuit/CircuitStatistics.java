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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Gate counts and shape of a circuit.
///
/// @param totalGates number of gate applications
/// @param gateCounts count per gate kind, in catalog order, only kinds that occur
/// @param circuitDepth max position + 1, or 0 for an empty circuit
/// @param numQubits qubit count the circuit is simulated on
/// @param density `totalGates / (numQubits * circuitDepth)`, or 0 when depth is 0
public record CircuitStatistics(
    @SerializedName("total_gates") int totalGates,
    @SerializedName("gate_counts") Map<String, Integer> gateCounts,
    @SerializedName("circuit_depth") int circuitDepth,
    @SerializedName("num_qubits") int numQubits,
    @SerializedName("density") double density
) {

    public CircuitStatistics {
        gateCounts = Collections.unmodifiableMap(new LinkedHashMap<>(gateCounts));
    }

    /// Computes statistics for a normalized circuit.
    ///
    /// @param circuit the circuit
    /// @return its statistics; never fails, including for the empty circuit
    public static CircuitStatistics of(Circuit circuit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GateKind kind : GateKind.values()) {
            int count = 0;
            for (GateSpec gate : circuit.gates()) {
                if (gate.kind() == kind) {
                    count++;
                }
            }
            if (count > 0) {
                counts.put(kind.name(), count);
            }
        }
        int depth = circuit.depth();
        double density = depth > 0
            ? (double) circuit.gateCount() / ((double) circuit.numQubits() * depth)
            : 0.0;
        return new CircuitStatistics(circuit.gateCount(), counts, depth, circuit.numQubits(), density);
    }
}
