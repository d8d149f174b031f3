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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Static analysis of a normalized circuit: size class, cost estimates and
/// simplification hints. No state is simulated.
///
/// ## Execution time weights
///
/// | Gate | Weight |
/// |------|--------|
/// | H | 1.0 |
/// | X, Y | 0.8 |
/// | Z | 0.5 |
/// | I | 0.1 |
///
/// ## Suggestions
///
/// - two applications of the same non-identity gate that are adjacent on one qubit's
///   timeline cancel, since every supported gate is self-inverse
/// - identity gates can always be removed
public final class CircuitComplexityAnalyzer {

    private static final Logger logger = LogManager.getLogger(CircuitComplexityAnalyzer.class);

    private static final Map<GateKind, Double> EXECUTION_WEIGHTS = new EnumMap<>(Map.of(
        GateKind.H, 1.0,
        GateKind.X, 0.8,
        GateKind.Y, 0.8,
        GateKind.Z, 0.5,
        GateKind.I, 0.1
    ));

    private CircuitComplexityAnalyzer() {
        // Utility class
    }

    /// Analyzes a circuit.
    ///
    /// @param circuit the normalized circuit
    /// @return complexity analysis; the empty circuit is `trivial`
    public static ComplexityAnalysis analyze(Circuit circuit) {
        CircuitStatistics stats = CircuitStatistics.of(circuit);
        ComplexityClass complexityClass = ComplexityClass.classify(stats.totalGates(), stats.circuitDepth());
        double parallelization = stats.circuitDepth() > 0
            ? (double) stats.totalGates() / stats.circuitDepth()
            : 1.0;
        List<String> suggestions = suggestOptimizations(circuit);
        logger.debug("Circuit classified as {} ({} gates, depth {}, {} suggestions)",
            complexityClass, stats.totalGates(), stats.circuitDepth(), suggestions.size());
        return new ComplexityAnalysis(
            stats,
            complexityClass,
            parallelization,
            estimateExecutionTime(circuit),
            ResourceRequirements.of(circuit.numQubits(), circuit.gateCount()),
            suggestions);
    }

    /// @param circuit the circuit
    /// @return sum of per-gate execution weights
    public static double estimateExecutionTime(Circuit circuit) {
        double total = 0.0;
        for (GateSpec gate : circuit.gates()) {
            total += EXECUTION_WEIGHTS.get(gate.kind());
        }
        return total;
    }

    static List<String> suggestOptimizations(Circuit circuit) {
        List<String> suggestions = new ArrayList<>();

        // last unpaired gate seen on each qubit
        Map<Integer, GateKind> lastOnQubit = new HashMap<>();
        Map<GateKind, Integer> cancellingPairs = new EnumMap<>(GateKind.class);
        int identities = 0;
        for (GateSpec gate : circuit.gates()) {
            if (gate.kind() == GateKind.I) {
                identities++;
                continue;
            }
            GateKind previous = lastOnQubit.get(gate.qubit());
            if (previous == gate.kind() && gate.kind().isNontrivialInvolution()) {
                cancellingPairs.merge(gate.kind(), 1, Integer::sum);
                lastOnQubit.remove(gate.qubit());
            } else {
                lastOnQubit.put(gate.qubit(), gate.kind());
            }
        }

        for (Map.Entry<GateKind, Integer> entry : cancellingPairs.entrySet()) {
            String name = entry.getKey().name();
            int pairs = entry.getValue();
            suggestions.add(String.format("Remove %d pair%s of consecutive %s gates (%s² = I)",
                pairs, pairs == 1 ? "" : "s", name, name));
        }
        if (identities > 0) {
            suggestions.add("Remove " + identities + " identity gate" + (identities == 1 ? "" : "s"));
        }
        return suggestions;
    }
}
