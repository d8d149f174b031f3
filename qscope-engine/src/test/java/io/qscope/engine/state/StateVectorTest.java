package io.qscope.engine.state;

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

import io.qscope.engine.math.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class StateVectorTest {

    @Test
    void groundAndUniform() {
        StateVector ground = StateVector.ground(3);
        assertThat(ground.dimension()).isEqualTo(8);
        assertThat(ground.probability(0)).isEqualTo(1.0);
        assertThat(StateVector.uniform(3).fidelity(ground)).isCloseTo(0.125, within(1e-12));
    }

    @Test
    void basisLabelsPutHighestQubitFirst() {
        assertThat(StateVector.basisLabel(1, 3)).isEqualTo("001");
        assertThat(StateVector.basisLabel(6, 3)).isEqualTo("110");
    }

    @Test
    void innerProductConjugatesLeftSide() {
        StateVector a = StateVector.of(Complex.ZERO, Complex.I);
        StateVector b = StateVector.of(Complex.ZERO, Complex.ONE);
        Complex overlap = a.innerProduct(b);
        assertThat(overlap.re()).isCloseTo(0.0, within(1e-12));
        assertThat(overlap.im()).isCloseTo(-1.0, within(1e-12));
        assertThat(a.fidelity(b)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void rejectsInvalidDimensions() {
        assertThatThrownBy(() -> StateVector.fromParts(new double[3], new double[3]))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StateVector.ground(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StateVector.ground(1).fidelity(StateVector.ground(2)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void amplitudeInfoListsEveryBasisState() {
        StateVector state = StateVector.of(Complex.real(0.6), Complex.of(0, 0.8));
        List<AmplitudeInfo> infos = AmplitudeInfo.listOf(state);
        assertThat(infos).extracting(AmplitudeInfo::basisState).containsExactly("0", "1");
        assertThat(infos.get(1).probability()).isCloseTo(0.64, within(1e-12));
        assertThat(infos.get(1).phase()).isCloseTo(Math.PI / 2, within(1e-12));
        assertThat(infos.get(1).magnitude()).isCloseTo(0.8, within(1e-12));
    }
}
