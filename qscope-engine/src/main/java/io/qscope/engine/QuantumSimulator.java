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
import io.qscope.engine.circuit.CircuitNormalizer;
import io.qscope.engine.circuit.CircuitStatistics;
import io.qscope.engine.circuit.GateInput;
import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.evolution.StateEvolutionEngine;
import io.qscope.engine.evolution.StateTransition;
import io.qscope.engine.math.ComplexMatrix;
import io.qscope.engine.metrics.MetricsBundle;
import io.qscope.engine.metrics.MetricsEngine;
import io.qscope.engine.narrate.StepNarrator;
import io.qscope.engine.state.AmplitudeInfo;
import io.qscope.engine.state.BlochVector;
import io.qscope.engine.state.PartialTrace;
import io.qscope.engine.state.StateVector;
import io.qscope.engine.trace.SimulationObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the engine: runs a circuit and returns its trace or final state.
 *
 * <h2>Data flow</h2>
 *
 * <pre>{@code
 * List<GateInput> ──► CircuitNormalizer ──► Circuit
 *                                             │
 *                                             ▼
 *                                  StateEvolutionEngine ──► StateTransition*
 *                                                                │
 *                           PartialTrace / MetricsEngine / StepNarrator
 *                                                                │
 *                                                                ▼
 *                                                          SimulationStep*
 * }</pre>
 *
 * <h2>Operations</h2>
 *
 * <ul>
 *   <li>{@link #simulate(Circuit, SimulationOptions)}: one step per gate plus step 0, final
 *       metrics and circuit statistics</li>
 *   <li>{@link #simulateFinal(Circuit)}: per-qubit Bloch vectors, purity, fidelity and
 *       probabilities of the final state only</li>
 * </ul>
 *
 * <p>The simulator is stateless apart from its configuration. Concurrent calls share
 * nothing mutable.
 */
public final class QuantumSimulator {

    private static final Logger logger = LogManager.getLogger(QuantumSimulator.class);

    private final EngineConfig config;
    private final StateEvolutionEngine evolution;
    private final MetricsEngine metrics;

    public QuantumSimulator() {
        this(EngineConfig.defaults());
    }

    public QuantumSimulator(EngineConfig config) {
        this.config = config;
        this.evolution = new StateEvolutionEngine(config);
        this.metrics = new MetricsEngine(config);
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Normalizes raw gate input and simulates it.
     *
     * @param gates raw gate entries
     * @param options per-call options
     * @return the full trace
     * @throws MalformedCircuitException if the input contains an unsupported gate
     * @throws ResourceLimitExceededException if the circuit exceeds the configured ceilings
     */
    public SimulationResult simulate(List<GateInput> gates, SimulationOptions options) {
        return simulate(CircuitNormalizer.normalize(gates), options);
    }

    public SimulationResult simulate(Circuit circuit) {
        return simulate(circuit, SimulationOptions.defaults());
    }

    /**
     * Simulates a circuit step by step.
     *
     * @param circuit the normalized circuit
     * @param options per-call options
     * @return the full trace, step 0 first
     * @throws MalformedCircuitException if the reference state does not match the register size
     * @throws ResourceLimitExceededException if the circuit exceeds the configured ceilings
     * @throws InternalInvariantViolationException if a numerical invariant fails
     */
    public SimulationResult simulate(Circuit circuit, SimulationOptions options) {
        evolution.checkLimits(circuit);
        int n = circuit.numQubits();
        StateVector reference = resolveReference(options.reference(), n);
        SimulationObserver observer = options.observer();
        boolean exportOperators = options.includeOperators() && n <= config.getOperatorExportQubitLimit();

        logger.debug("Simulating {} gates on {} qubits (operators={}, step metrics={})",
            circuit.gateCount(), n, exportOperators, options.includeStepMetrics());
        observer.onSimulationStart(circuit);

        List<SimulationStep> steps = new ArrayList<>(circuit.gateCount() + 1);
        StateVector ground = StateVector.ground(n);
        MetricsBundle initialMetrics = options.includeStepMetrics() ? metrics.compute(ground, reference) : null;
        SimulationStep initial = new SimulationStep(0, SimulationStep.INITIALIZATION, null, ground,
            blochVectors(ground), ground.probabilities(), AmplitudeInfo.listOf(ground), null,
            StepNarrator.initialSummary(n), null, initialMetrics);
        steps.add(initial);
        observer.onStep(initial);

        MetricsBundle[] last = {initialMetrics};
        StateVector finalState = evolution.run(circuit, transition -> {
            MetricsBundle stepMetrics = options.includeStepMetrics()
                ? metrics.compute(transition.after(), reference)
                : null;
            SimulationStep step = toStep(transition, exportOperators, stepMetrics);
            steps.add(step);
            last[0] = stepMetrics;
            observer.onStep(step);
        });

        MetricsBundle finalMetrics = last[0] != null ? last[0] : metrics.compute(finalState, reference);
        SimulationResult result = new SimulationResult(n, steps, finalMetrics, CircuitStatistics.of(circuit));
        observer.onSimulationComplete(result);
        logger.debug("Simulation finished: {} steps, purity {}", steps.size(), finalMetrics.purity());
        return result;
    }

    /**
     * Simulates a circuit and reports only the final state.
     *
     * @param circuit the normalized circuit
     * @return Bloch vectors, purity, √purity, entanglement and probabilities
     * @throws ResourceLimitExceededException if the circuit exceeds the configured ceilings
     */
    public FinalStateResult simulateFinal(Circuit circuit) {
        StateVector state = evolution.finalState(circuit);
        double[] p = state.probabilities();
        double purity = MetricsEngine.purity(p);
        List<QubitBloch> qubits = new ArrayList<>(state.numQubits());
        for (Map.Entry<Integer, BlochVector> entry : blochVectors(state).entrySet()) {
            qubits.add(new QubitBloch(entry.getKey(), entry.getValue()));
        }
        return new FinalStateResult(
            qubits,
            metrics.entanglement(state).measure(),
            purity,
            Math.sqrt(purity),
            p);
    }

    private SimulationStep toStep(StateTransition transition, boolean exportOperator, MetricsBundle stepMetrics) {
        GateSpec gate = transition.gate();
        StateVector after = transition.after();
        ComplexMatrix operator = exportOperator
            ? StateEvolutionEngine.systemOperator(gate.kind(), gate.qubit(), after.numQubits())
            : null;
        return new SimulationStep(
            transition.step(),
            gate.kind().name(),
            gate,
            after,
            blochVectors(after),
            after.probabilities(),
            AmplitudeInfo.listOf(after),
            operator,
            StepNarrator.summary(gate),
            StepNarrator.narrate(transition),
            stepMetrics);
    }

    private static Map<Integer, BlochVector> blochVectors(StateVector state) {
        Map<Integer, BlochVector> out = new LinkedHashMap<>();
        for (int q = 0; q < state.numQubits(); q++) {
            out.put(q, PartialTrace.bloch(state, q));
        }
        return out;
    }

    private static StateVector resolveReference(StateVector reference, int numQubits) {
        if (reference == null) {
            return StateVector.ground(numQubits);
        }
        if (reference.numQubits() != numQubits) {
            logger.warn("Rejecting reference state: {} qubits, circuit has {}", reference.numQubits(), numQubits);
            throw new MalformedCircuitException("Reference state has " + reference.numQubits()
                + " qubits but the circuit has " + numQubits);
        }
        return reference;
    }
}
