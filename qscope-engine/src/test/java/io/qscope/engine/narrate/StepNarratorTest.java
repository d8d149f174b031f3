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

import io.qscope.engine.EngineConfig;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.GateKind;
import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.evolution.StateEvolutionEngine;
import io.qscope.engine.evolution.StateTransition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class StepNarratorTest {

    private final StateEvolutionEngine engine = new StateEvolutionEngine(EngineConfig.defaults());

    @Test
    void summaries() {
        assertThat(StepNarrator.initialSummary(3)).isEqualTo("Initialize 3-qubit system in |000⟩ state");
        assertThat(StepNarrator.summary(GateSpec.of(GateKind.X, 1, 0)))
            .startsWith("Applied Pauli-X gate to qubit 1. Bit flip operation");
        assertThat(StepNarrator.summary(GateSpec.of(GateKind.I, 0, 0)))
            .isEqualTo("Applied Identity gate to qubit 0. No change to the qubit state");
    }

    @Test
    void bitFlipMovesAllProbability() {
        StateTransition flip = engine.evolve(Circuit.of(GateSpec.of(GateKind.X, 0, 0))).get(0);
        StepExplanation explanation = StepNarrator.narrate(flip);

        assertThat(explanation.gateType()).isEqualTo(GateKind.X);
        assertThat(explanation.description()).isEqualTo("Apply X gate to qubit 0");
        assertThat(explanation.entanglementImpact()).contains("Single qubit");
        StateChanges changes = explanation.stateChanges();
        assertThat(changes.fidelity()).isCloseTo(0.0, within(1e-12));
        assertThat(changes.totalProbabilityChange()).isCloseTo(2.0, within(1e-12));
        assertThat(changes.phaseChanges()).isEmpty();
        assertThat(changes.amplitudeChanges()).extracting(AmplitudeChange::basisState).containsExactly("0", "1");
        assertThat(changes.amplitudeChanges().get(1).probabilityChange()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void phaseFlipIsReportedOnlyWhereAmplitudeIsPresent() {
        List<StateTransition> transitions = engine.evolve(Circuit.of(
            GateSpec.of(GateKind.H, 0, 0),
            GateSpec.of(GateKind.Z, 0, 1),
            GateSpec.of(GateKind.I, 1, 1)));
        StateChanges changes = StepNarrator.narrate(transitions.get(1)).stateChanges();

        assertThat(changes.totalProbabilityChange()).isCloseTo(0.0, within(1e-12));
        assertThat(changes.phaseChanges()).extracting(PhaseChange::basisState).containsExactly("00", "01");
        assertThat(changes.phaseChanges().get(1).phaseChange()).isCloseTo(Math.PI, within(1e-12));
        assertThat(StepNarrator.narrate(transitions.get(1)).entanglementImpact())
            .contains("entanglement structure preserved");
    }
}
