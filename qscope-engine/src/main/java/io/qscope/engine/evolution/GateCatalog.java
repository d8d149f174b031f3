package io.qscope.engine.evolution;

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

import io.qscope.engine.circuit.GateKind;
import io.qscope.engine.math.Complex;
import io.qscope.engine.math.ComplexMatrix;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// Process-wide constant table of the supported 2×2 gate unitaries and their descriptions.
///
/// | Gate | Matrix |
/// |------|--------|
/// | H | (1/√2)·[[1, 1], [1, −1]] |
/// | X | [[0, 1], [1, 0]] |
/// | Y | [[0, −i], [i, 0]] |
/// | Z | [[1, 0], [0, −1]] |
/// | I | [[1, 0], [0, 1]] |
///
/// Both tables are built once from exhaustive switches over [GateKind], so adding a gate
/// kind without a matrix or description does not compile.
public final class GateCatalog {

    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    private static final Map<GateKind, ComplexMatrix> MATRICES;
    private static final Map<GateKind, GateDescription> DESCRIPTIONS;

    static {
        Map<GateKind, ComplexMatrix> matrices = new EnumMap<>(GateKind.class);
        Map<GateKind, GateDescription> descriptions = new EnumMap<>(GateKind.class);
        for (GateKind kind : GateKind.values()) {
            matrices.put(kind, buildMatrix(kind));
            descriptions.put(kind, buildDescription(kind));
        }
        MATRICES = Collections.unmodifiableMap(matrices);
        DESCRIPTIONS = Collections.unmodifiableMap(descriptions);
    }

    private GateCatalog() {
        // Utility class
    }

    /// @param kind gate kind
    /// @return its 2×2 unitary
    public static ComplexMatrix matrix(GateKind kind) {
        return MATRICES.get(kind);
    }

    /// @param kind gate kind
    /// @return its fixed description texts
    public static GateDescription describe(GateKind kind) {
        return DESCRIPTIONS.get(kind);
    }

    /// @return all matrices keyed by kind, unmodifiable
    public static Map<GateKind, ComplexMatrix> matrices() {
        return MATRICES;
    }

    private static ComplexMatrix buildMatrix(GateKind kind) {
        Complex zero = Complex.ZERO;
        Complex one = Complex.ONE;
        Complex h = Complex.real(INV_SQRT2);
        return switch (kind) {
            case H -> ComplexMatrix.of(new Complex[][]{{h, h}, {h, h.scale(-1.0)}});
            case X -> ComplexMatrix.of(new Complex[][]{{zero, one}, {one, zero}});
            case Y -> ComplexMatrix.of(new Complex[][]{{zero, Complex.of(0.0, -1.0)}, {Complex.I, zero}});
            case Z -> ComplexMatrix.of(new Complex[][]{{one, zero}, {zero, Complex.real(-1.0)}});
            case I -> ComplexMatrix.identity(2);
        };
    }

    private static GateDescription buildDescription(GateKind kind) {
        return switch (kind) {
            case H -> new GateDescription(kind, kind.displayName(),
                "(1/√2)[[1, 1], [1, -1]]",
                "H|0⟩ = (|0⟩ + |1⟩)/√2, H|1⟩ = (|0⟩ - |1⟩)/√2",
                "Creates superposition - equal probability amplitudes for |0⟩ and |1⟩",
                "Rotation to equator, creating equal superposition",
                "Y then X", "90° then 180°", "To equator",
                "Hadamard gate: Creates superposition, rotates Bloch vector");
            case X -> new GateDescription(kind, kind.displayName(),
                "[[0, 1], [1, 0]]",
                "X|0⟩ = |1⟩, X|1⟩ = |0⟩",
                "Bit flip operation - rotates 180° around X-axis on Bloch sphere",
                "180° rotation around X-axis (bit flip)",
                "X", "180°", "Flip across XZ-plane",
                "Pauli-X gate: Bit flip, 180° rotation around X-axis");
            case Y -> new GateDescription(kind, kind.displayName(),
                "[[0, -i], [i, 0]]",
                "Y|0⟩ = i|1⟩, Y|1⟩ = -i|0⟩",
                "Bit and phase flip - rotates 180° around Y-axis with complex phase",
                "180° rotation around Y-axis (bit + phase flip)",
                "Y", "180°", "Rotate around Y-axis",
                "Pauli-Y gate: Bit and phase flip, 180° rotation around Y-axis");
            case Z -> new GateDescription(kind, kind.displayName(),
                "[[1, 0], [0, -1]]",
                "Z|0⟩ = |0⟩, Z|1⟩ = -|1⟩",
                "Phase flip operation - rotates 180° around Z-axis",
                "180° rotation around Z-axis (phase flip)",
                "Z", "180°", "Flip across XY-plane",
                "Pauli-Z gate: Phase flip, 180° rotation around Z-axis");
            case I -> new GateDescription(kind, kind.displayName(),
                "[[1, 0], [0, 1]]",
                "I|0⟩ = |0⟩, I|1⟩ = |1⟩",
                "Identity operation - no change to the quantum state",
                "No rotation - vector unchanged",
                "none", "0°", "No movement",
                "Identity gate: No operation, leaves qubit unchanged");
        };
    }
}
