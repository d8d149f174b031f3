package io.qscope.engine.metrics;

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
import io.qscope.engine.state.BlochVector;
import io.qscope.engine.state.DensityMatrix;
import io.qscope.engine.state.PartialTrace;
import io.qscope.engine.state.StateVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes metrics of a pure register state.
 *
 * <h2>Global metrics</h2>
 *
 * <p>Derived from the basis probabilities pᵢ = |ψᵢ|² alone: purity, distribution entropy,
 * linear entropy, participation ratio, coherence heuristics and the information metrics.
 * These are functions of the measurement distribution, not of the density operator.
 *
 * <h2>Subsystem metrics</h2>
 *
 * <p>Derived from reduced density matrices: for each qubit and each qubit pair the matrix
 * is obtained by {@link PartialTrace}, validated against the configured tolerance and
 * diagonalized. Validation failures surface as
 * {@link io.qscope.engine.InternalInvariantViolationException}.
 *
 * <p>Every method is total over valid states.
 */
public final class MetricsEngine {

    private static final Logger logger = LogManager.getLogger(MetricsEngine.class);

    /** Probabilities at or below this threshold are skipped in entropy sums. */
    public static final double PROBABILITY_THRESHOLD = 1e-16;

    private static final double LN2 = Math.log(2.0);

    private final double tolerance;

    public MetricsEngine(EngineConfig config) {
        this.tolerance = config.getInvariantTolerance();
    }

    /**
     * Computes the full bundle.
     *
     * @param state the state to measure
     * @param reference reference state of the same dimension for fidelity and trace distance
     * @return all metrics
     */
    public MetricsBundle compute(StateVector state, StateVector reference) {
        double[] p = state.probabilities();
        double purity = purity(p);
        double entropy = shannonEntropy(p);
        double referenceFidelity = reference.fidelity(state);
        EntanglementAnalysis entanglement = entanglement(state);

        MetricsBundle bundle = new MetricsBundle(
            purity,
            entropy,
            1.0 - purity,
            participationRatio(p),
            purity > PROBABILITY_THRESHOLD ? 1.0 / purity : 1.0,
            p[0],
            Math.sqrt(purity),
            entanglement.measure(),
            referenceFidelity,
            traceDistance(referenceFidelity),
            coherence(state),
            information(p),
            distances(state, referenceFidelity),
            geometric(state),
            entanglement);
        logger.trace("Metrics for {}-qubit state: purity={}, entropy={}", state.numQubits(), purity, entropy);
        return bundle;
    }

    /** @return Σpᵢ² */
    public static double purity(double[] p) {
        double sum = 0.0;
        for (double pi : p) {
            sum += pi * pi;
        }
        return sum;
    }

    /** @return −Σpᵢ log₂ pᵢ over pᵢ above {@link #PROBABILITY_THRESHOLD} */
    public static double shannonEntropy(double[] p) {
        double h = 0.0;
        for (double pi : p) {
            if (pi > PROBABILITY_THRESHOLD) {
                h -= pi * Math.log(pi) / LN2;
            }
        }
        return h;
    }

    /** @return 1/Σpᵢ², or 1 if the sum is below {@link #PROBABILITY_THRESHOLD} */
    public static double participationRatio(double[] p) {
        double squares = purity(p);
        return squares < PROBABILITY_THRESHOLD ? 1.0 : 1.0 / squares;
    }

    /** @return √(1 − F), clamped at 0 against rounding */
    public static double traceDistance(double fidelity) {
        return Math.sqrt(Math.max(0.0, 1.0 - fidelity));
    }

    public static CoherenceMeasures coherence(StateVector state) {
        double magnitudeSum = 0.0;
        double probabilitySum = 0.0;
        for (int i = 0; i < state.dimension(); i++) {
            double prob = state.probability(i);
            magnitudeSum += Math.sqrt(prob);
            probabilitySum += prob;
        }
        double[] p = state.probabilities();
        double maxEntropy = Math.log(state.dimension()) / LN2;
        return CoherenceMeasures.computational(
            magnitudeSum - Math.sqrt(probabilitySum),
            maxEntropy - shannonEntropy(p));
    }

    public static InformationMetrics information(double[] p) {
        int n = p.length;
        double fisher = 0.0;
        for (int i = 0; i < n; i++) {
            double x = (double) i / (n - 1);
            fisher += p[i] * x * x;
        }
        double squares = purity(p);
        return new InformationMetrics(
            shannonEntropy(p),
            squares > 0.0 ? -Math.log(squares) / LN2 : 0.0,
            4.0 * fisher,
            Math.log(n) / LN2);
    }

    private static DistanceMetrics distances(StateVector state, double referenceFidelity) {
        double ground = StateVector.ground(state.numQubits()).fidelity(state);
        double uniform = StateVector.uniform(state.numQubits()).fidelity(state);
        return new DistanceMetrics(
            ground, traceDistance(ground),
            uniform, traceDistance(uniform),
            referenceFidelity, traceDistance(referenceFidelity));
    }

    /**
     * @param state the register state
     * @return average single-qubit purity, plus the Bloch vector for a 1-qubit register
     */
    public GeometricMetrics geometric(StateVector state) {
        int n = state.numQubits();
        double puritySum = 0.0;
        for (int q = 0; q < n; q++) {
            puritySum += reduce(state, q).purity();
        }
        if (n == 1) {
            BlochVector bloch = PartialTrace.bloch(state, 0);
            return new GeometricMetrics(n, puritySum, bloch, bloch.length());
        }
        return new GeometricMetrics(n, puritySum / n, null, null);
    }

    /**
     * Entropies of every single-qubit and two-qubit reduction.
     *
     * @param state the register state
     * @return per-qubit entropies, per-pair mutual information and the classification
     */
    public EntanglementAnalysis entanglement(StateVector state) {
        int n = state.numQubits();
        List<Double> qubitEntropies = new ArrayList<>(n);
        double total = 0.0;
        for (int q = 0; q < n; q++) {
            double s = reduce(state, q).entropy();
            qubitEntropies.add(s);
            total += s;
        }
        List<PairEntanglement> pairs = new ArrayList<>();
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                double joint = reduce(state, a, b).entropy();
                double sa = qubitEntropies.get(a);
                double sb = qubitEntropies.get(b);
                pairs.add(new PairEntanglement(a, b, sa, sb, joint, sa + sb - joint));
            }
        }
        double measure = n < 2 ? 0.0 : total / n;
        EntanglementClass type = EntanglementClass.classify(n, measure);
        return new EntanglementAnalysis(
            type,
            measure,
            type.description(),
            Math.log(Math.min(2, n)) / LN2,
            qubitEntropies,
            pairs);
    }

    /**
     * @param state the register state
     * @param qubits qubits to keep
     * @return the validated reduced density matrix
     */
    public DensityMatrix reduce(StateVector state, int... qubits) {
        return PartialTrace.reduce(state, qubits).validate(tolerance);
    }
}
