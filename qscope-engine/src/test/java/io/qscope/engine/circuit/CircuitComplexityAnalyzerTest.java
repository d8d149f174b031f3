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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CircuitComplexityAnalyzerTest {

    @Test
    void emptyCircuitIsTrivial() {
        ComplexityAnalysis analysis = CircuitComplexityAnalyzer.analyze(Circuit.empty());
        assertThat(analysis.complexityClass()).isEqualTo(ComplexityClass.TRIVIAL);
        assertThat(analysis.statistics().totalGates()).isZero();
        assertThat(analysis.statistics().density()).isZero();
        assertThat(analysis.parallelizationFactor()).isEqualTo(1.0);
        assertThat(analysis.optimizationSuggestions()).isEmpty();
    }

    @Test
    void statisticsAndWeights() {
        Circuit circuit = Circuit.of(
            GateSpec.of(GateKind.H, 0, 0),
            GateSpec.of(GateKind.H, 1, 0),
            GateSpec.of(GateKind.Z, 0, 1),
            GateSpec.of(GateKind.I, 1, 1));
        ComplexityAnalysis analysis = CircuitComplexityAnalyzer.analyze(circuit);

        assertThat(analysis.statistics().gateCounts()).containsEntry("H", 2).containsEntry("Z", 1)
            .containsEntry("I", 1).doesNotContainKey("X");
        assertThat(analysis.statistics().circuitDepth()).isEqualTo(2);
        assertThat(analysis.statistics().density()).isCloseTo(1.0, within(1e-12));
        assertThat(analysis.parallelizationFactor()).isCloseTo(2.0, within(1e-12));
        assertThat(analysis.estimatedExecutionTime()).isCloseTo(2.6, within(1e-12));
        assertThat(analysis.complexityClass()).isEqualTo(ComplexityClass.SIMPLE);
        assertThat(analysis.resourceRequirements().memoryComplexity()).isEqualTo("O(2^2)");
    }

    @Test
    void suggestsCancellingPairsAndIdentityRemoval() {
        Circuit circuit = Circuit.of(
            GateSpec.of(GateKind.X, 0, 0),
            GateSpec.of(GateKind.I, 0, 1),
            GateSpec.of(GateKind.X, 0, 2),
            GateSpec.of(GateKind.H, 1, 0),
            GateSpec.of(GateKind.Z, 1, 1),
            GateSpec.of(GateKind.H, 1, 2));

        assertThat(CircuitComplexityAnalyzer.analyze(circuit).optimizationSuggestions())
            .containsExactly("Remove 1 pair of consecutive X gates (X² = I)", "Remove 1 identity gate");
    }

    @Test
    void classBoundaries() {
        assertThat(ComplexityClass.classify(10, 5)).isEqualTo(ComplexityClass.SIMPLE);
        assertThat(ComplexityClass.classify(11, 5)).isEqualTo(ComplexityClass.MODERATE);
        assertThat(ComplexityClass.classify(50, 21)).isEqualTo(ComplexityClass.COMPLEX);

        List<GateSpec> many = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            many.add(GateSpec.of(GateKind.Y, i % 3, i / 3));
        }
        assertThat(CircuitComplexityAnalyzer.analyze(Circuit.of(many)).complexityClass())
            .isEqualTo(ComplexityClass.COMPLEX);
    }
}
