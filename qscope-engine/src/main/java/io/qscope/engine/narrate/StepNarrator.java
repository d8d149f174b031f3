package io.qscope.engine.narrate;

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

import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.evolution.GateCatalog;
import io.qscope.engine.evolution.GateDescription;
import io.qscope.engine.evolution.StateTransition;
import io.qscope.engine.state.StateVector;

import java.util.ArrayList;
import java.util.List;

/// Produces the human-readable side of each simulation step.
///
/// Everything here is derived from the catalog texts and the two state snapshots;
/// nothing feeds back into the simulation.
public final class StepNarrator {

    /// Amplitudes at or below this magnitude have no meaningful phase.
    public static final double PHASE_MAGNITUDE_THRESHOLD = 1e-10;

    private StepNarrator() {
        // Utility class
    }

    /// @param numQubits register size
    /// @return explanation line for step 0
    public static String initialSummary(int numQubits) {
        return "Initialize " + numQubits + "-qubit system in |" + "0".repeat(numQubits) + "⟩ state";
    }

    /// One-line explanation of a gate step.
    ///
    /// @param gate the applied gate
    /// @return e.g. "Applied Pauli-X gate to qubit 1. Bit flip operation: ..."
    public static String summary(GateSpec gate) {
        int q = gate.qubit();
        return switch (gate.kind()) {
            case H -> "Applied Hadamard gate to qubit " + q + ". Creates superposition: "
                + "transforms |0⟩ → (|0⟩ + |1⟩)/√2 and |1⟩ → (|0⟩ - |1⟩)/√2";
            case X -> "Applied Pauli-X gate to qubit " + q + ". Bit flip operation: "
                + "transforms |0⟩ → |1⟩ and |1⟩ → |0⟩";
            case Y -> "Applied Pauli-Y gate to qubit " + q + ". Bit and phase flip: "
                + "transforms |0⟩ → i|1⟩ and |1⟩ → -i|0⟩";
            case Z -> "Applied Pauli-Z gate to qubit " + q + ". Phase flip operation: "
                + "transforms |0⟩ → |0⟩ and |1⟩ → -|1⟩";
            case I -> "Applied Identity gate to qubit " + q + ". No change to the qubit state";
        };
    }

    /// Full narration of one transition.
    ///
    /// @param transition the gate step
    /// @return the explanation
    public static StepExplanation narrate(StateTransition transition) {
        GateSpec gate = transition.gate();
        GateDescription d = GateCatalog.describe(gate.kind());
        String impact = transition.before().numQubits() < 2
            ? "Single qubit operation - no entanglement possible"
            : "Local single-qubit operation - entanglement structure preserved";
        return new StepExplanation(
            gate.kind(),
            gate.qubit(),
            "Apply " + gate.kind() + " gate to qubit " + gate.qubit(),
            d.matrixLiteral(),
            d.basisAction(),
            d.physicalEffect(),
            d.blochAction(),
            new BlochMovement(d.rotationAxis(), d.rotationAngle(), d.movement()),
            impact,
            analyzeChanges(transition.before(), transition.after()));
    }

    /// Compares two states of the same dimension.
    ///
    /// @param before earlier state
    /// @param after later state
    /// @return fidelity, per-basis deltas and the total absolute probability change
    public static StateChanges analyzeChanges(StateVector before, StateVector after) {
        List<AmplitudeChange> amplitudeChanges = new ArrayList<>(before.dimension());
        List<PhaseChange> phaseChanges = new ArrayList<>();
        double totalChange = 0.0;
        for (int i = 0; i < before.dimension(); i++) {
            String label = before.basisLabel(i);
            double pBefore = before.probability(i);
            double pAfter = after.probability(i);
            double mBefore = Math.sqrt(pBefore);
            double mAfter = Math.sqrt(pAfter);
            double phaseChange = Math.atan2(after.im(i), after.re(i)) - Math.atan2(before.im(i), before.re(i));
            amplitudeChanges.add(new AmplitudeChange(label, pBefore, pAfter, pAfter - pBefore,
                mBefore, mAfter, mAfter - mBefore, phaseChange));
            if (mBefore > PHASE_MAGNITUDE_THRESHOLD && mAfter > PHASE_MAGNITUDE_THRESHOLD) {
                phaseChanges.add(new PhaseChange(label, phaseChange));
            }
            totalChange += Math.abs(pAfter - pBefore);
        }
        return new StateChanges(before.fidelity(after), amplitudeChanges, phaseChanges, totalChange);
    }
}
