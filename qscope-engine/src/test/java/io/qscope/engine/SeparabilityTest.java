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

import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.GateKind;
import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.metrics.EntanglementAnalysis;
import io.qscope.engine.metrics.PairEntanglement;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/// Single-qubit gates never entangle. Every snapshot of a random circuit must be a
/// normalized product state, so every subsystem entropy stays at zero.
@Tag("accuracy")
class SeparabilityTest {

    private static final double EPS = 1e-9;
    private static final int CIRCUITS = 200;

    private final QuantumSimulator simulator = new QuantumSimulator();

    @Test
    void randomCircuitsStayNormalizedProductStates() {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(7L);
        GateKind[] kinds = GateKind.values();
        SimulationOptions options = SimulationOptions.builder().includeOperators(false).build();

        for (int c = 0; c < CIRCUITS; c++) {
            int qubits = 1 + rng.nextInt(5);
            int gateCount = 1 + rng.nextInt(20);
            List<GateSpec> gates = new ArrayList<>(gateCount);
            for (int g = 0; g < gateCount; g++) {
                gates.add(GateSpec.of(kinds[rng.nextInt(kinds.length)], rng.nextInt(qubits), g));
            }
            Circuit circuit = Circuit.of(gates);

            for (SimulationStep step : simulator.simulate(circuit, options).steps()) {
                String where = "circuit " + c + " step " + step.step();
                assertThat(step.stateVector().normSquared()).as(where).isCloseTo(1.0, within(EPS));
                assertThat(step.metrics()).as(where).isNotNull();

                EntanglementAnalysis analysis = step.metrics().entanglementAnalysis();
                assertThat(analysis.qubitEntropies()).as(where).hasSize(circuit.numQubits());
                for (double entropy : analysis.qubitEntropies()) {
                    assertThat(entropy).as(where).isCloseTo(0.0, within(EPS));
                }
                for (PairEntanglement pair : analysis.pairs()) {
                    assertThat(pair.jointEntropy()).as(where + " pair " + pair.label()).isCloseTo(0.0, within(EPS));
                    assertThat(pair.mutualInformation()).as(where + " pair " + pair.label())
                        .isCloseTo(0.0, within(EPS));
                }
            }
        }
    }
}
