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

import io.qscope.engine.MalformedCircuitException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CircuitNormalizerTest {

    @Test
    void sortsByPositionKeepingInputOrderForTies() {
        Circuit circuit = CircuitNormalizer.normalize(List.of(
            GateInput.of("Z", 0, 2),
            GateInput.of("h", 1, 0),
            GateInput.of(" X ", 0, 0),
            GateInput.of("Y", 2, 1)));

        assertThat(circuit.gates()).extracting(GateSpec::kind)
            .containsExactly(GateKind.H, GateKind.X, GateKind.Y, GateKind.Z);
        assertThat(circuit.numQubits()).isEqualTo(3);
        assertThat(circuit.depth()).isEqualTo(3);
    }

    @Test
    void missingQubitAndPositionDefaultToZero() {
        Circuit circuit = CircuitNormalizer.normalize(List.of(new GateInput("X", null, null)));
        assertThat(circuit.gates()).containsExactly(new GateSpec(GateKind.X, 0, 0));
        assertThat(circuit.numQubits()).isEqualTo(1);
    }

    @Test
    void emptyInputGivesDefaultRegister() {
        assertThat(CircuitNormalizer.normalize(List.of()).numQubits()).isEqualTo(Circuit.DEFAULT_EMPTY_QUBITS);
        assertThat(CircuitNormalizer.normalize(null).isEmpty()).isTrue();
        assertThat(Circuit.empty().depth()).isZero();
    }

    @Test
    void rejectsTwoQubitAndUnknownGates() {
        assertThatThrownBy(() -> CircuitNormalizer.normalize(List.of(
            GateInput.of("H", 0, 0),
            GateInput.of("CNOT", 1, 1))))
            .isInstanceOf(MalformedCircuitException.class)
            .satisfies(e -> {
                MalformedCircuitException m = (MalformedCircuitException) e;
                assertThat(m.getToken()).isEqualTo("CNOT");
                assertThat(m.getGateIndex()).isEqualTo(1);
            });
        assertThatThrownBy(() -> GateKind.fromToken("RX", 0)).isInstanceOf(MalformedCircuitException.class);
        assertThatThrownBy(() -> GateKind.fromToken(null, 3))
            .isInstanceOf(MalformedCircuitException.class)
            .hasMessageContaining("3");
    }

    @Test
    void rejectsNegativeIndicesAndMissingEntries() {
        assertThatThrownBy(() -> CircuitNormalizer.normalize(List.of(GateInput.of("X", -1, 0))))
            .isInstanceOf(MalformedCircuitException.class)
            .hasMessageContaining("negative qubit");
        assertThatThrownBy(() -> CircuitNormalizer.normalize(List.of(GateInput.of("X", 0, -2))))
            .isInstanceOf(MalformedCircuitException.class)
            .hasMessageContaining("negative position");
        assertThatThrownBy(() -> CircuitNormalizer.normalize(Arrays.asList(GateInput.of("X", 0, 0), null)))
            .isInstanceOf(MalformedCircuitException.class);
    }
}
