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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// A position-ordered, immutable sequence of gate applications.
///
/// ## Ordering
///
/// Gates are stable-sorted by [GateSpec#position()]: gates sharing a position keep the
/// order in which they were supplied. The resulting order is the application order.
///
/// ## Qubit count
///
/// `numQubits = max(qubit) + 1` over all gates, or [#DEFAULT_EMPTY_QUBITS] when the
/// circuit has no gates.
public final class Circuit {

    /// Qubit count assumed for a circuit without gates.
    public static final int DEFAULT_EMPTY_QUBITS = 2;

    private final List<GateSpec> gates;
    private final int numQubits;

    private Circuit(List<GateSpec> orderedGates, int numQubits) {
        this.gates = Collections.unmodifiableList(orderedGates);
        this.numQubits = numQubits;
    }

    /// Builds a circuit from gate specs in any order.
    ///
    /// @param gates gate applications; sorted here by position, ties kept in list order
    /// @return the ordered circuit
    public static Circuit of(List<GateSpec> gates) {
        Objects.requireNonNull(gates, "gates");
        List<GateSpec> ordered = new ArrayList<>(gates);
        // List.sort is a stable merge sort
        ordered.sort(Comparator.comparingInt(GateSpec::position));
        int maxQubit = -1;
        for (GateSpec gate : ordered) {
            maxQubit = Math.max(maxQubit, gate.qubit());
        }
        int qubits = ordered.isEmpty() ? DEFAULT_EMPTY_QUBITS : maxQubit + 1;
        return new Circuit(ordered, qubits);
    }

    public static Circuit of(GateSpec... gates) {
        return of(List.of(gates));
    }

    /// @return a circuit with no gates on the default qubit count
    public static Circuit empty() {
        return of(List.of());
    }

    /// @return gates in application order
    public List<GateSpec> gates() {
        return gates;
    }

    public int numQubits() {
        return numQubits;
    }

    public int gateCount() {
        return gates.size();
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }

    /// @return max position + 1, or 0 for an empty circuit
    public int depth() {
        int maxPosition = -1;
        for (GateSpec gate : gates) {
            maxPosition = Math.max(maxPosition, gate.position());
        }
        return maxPosition + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Circuit)) return false;
        Circuit circuit = (Circuit) o;
        return numQubits == circuit.numQubits && gates.equals(circuit.gates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gates, numQubits);
    }

    @Override
    public String toString() {
        return "Circuit{qubits=" + numQubits + ", gates=" + gates + "}";
    }
}
