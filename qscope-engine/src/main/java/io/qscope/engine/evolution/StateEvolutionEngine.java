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

import io.qscope.engine.EngineConfig;
import io.qscope.engine.InternalInvariantViolationException;
import io.qscope.engine.ResourceLimitExceededException;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.GateKind;
import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.math.ComplexMatrix;
import io.qscope.engine.state.StateVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Exact unitary evolution of a register under a normalized circuit.
 *
 * <h2>Operator construction</h2>
 *
 * <p>For a gate G on qubit t of an n-qubit register the system operator is
 *
 * <pre>{@code
 * U = F(n-1) ⊗ F(n-2) ⊗ ... ⊗ F(0)      F(t) = G, F(q) = I otherwise
 * }</pre>
 *
 * <p>With qubit 0 as the rightmost factor, bit b of the basis index is qubit b, matching
 * {@link StateVector}. X on qubit 0 of |00⟩ gives basis index 1.
 *
 * <h2>Limits</h2>
 *
 * <p>{@link #checkLimits(Circuit)} runs before the 2ⁿ state is allocated and rejects circuits
 * above the configured qubit or gate ceilings.
 *
 * <p>Instances hold only their configuration and may be shared between threads.
 */
public final class StateEvolutionEngine {

    private static final Logger logger = LogManager.getLogger(StateEvolutionEngine.class);

    private final EngineConfig config;

    public StateEvolutionEngine(EngineConfig config) {
        this.config = config;
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Rejects circuits above the configured ceilings.
     *
     * @param circuit the normalized circuit
     * @throws ResourceLimitExceededException if the qubit or gate count is too large
     */
    public void checkLimits(Circuit circuit) {
        if (circuit.numQubits() > config.getMaxQubits()) {
            logger.warn("Rejecting circuit: {} qubits exceeds limit of {}",
                circuit.numQubits(), config.getMaxQubits());
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Resource.QUBITS,
                circuit.numQubits(), config.getMaxQubits());
        }
        if (circuit.gateCount() > config.getMaxGates()) {
            logger.warn("Rejecting circuit: {} gates exceeds limit of {}",
                circuit.gateCount(), config.getMaxGates());
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Resource.GATES,
                circuit.gateCount(), config.getMaxGates());
        }
    }

    /**
     * Builds the full-system operator for one gate.
     *
     * @param kind the gate
     * @param target target qubit
     * @param numQubits register size
     * @return the 2ⁿ × 2ⁿ unitary
     */
    public static ComplexMatrix systemOperator(GateKind kind, int target, int numQubits) {
        if (target < 0 || target >= numQubits) {
            throw new IllegalArgumentException("Target qubit " + target + " out of range for "
                + numQubits + " qubits");
        }
        ComplexMatrix gate = GateCatalog.matrix(kind);
        ComplexMatrix identity = GateCatalog.matrix(GateKind.I);
        ComplexMatrix operator = null;
        for (int q = numQubits - 1; q >= 0; q--) {
            ComplexMatrix factor = q == target ? gate : identity;
            operator = operator == null ? factor : operator.kron(factor);
        }
        return operator;
    }

    /**
     * Runs the circuit from |0…0⟩ and records every transition.
     *
     * @param circuit the normalized circuit
     * @return one transition per gate, in application order
     * @throws ResourceLimitExceededException if the circuit exceeds the configured ceilings
     * @throws InternalInvariantViolationException if a state loses normalization
     */
    public List<StateTransition> evolve(Circuit circuit) {
        List<StateTransition> transitions = new ArrayList<>(circuit.gateCount());
        run(circuit, transitions::add);
        return transitions;
    }

    /**
     * Runs the circuit from |0…0⟩, passing each transition to a consumer as it happens.
     *
     * @param circuit the normalized circuit
     * @param sink receives each transition
     * @return the final state
     */
    public StateVector run(Circuit circuit, Consumer<StateTransition> sink) {
        checkLimits(circuit);
        int n = circuit.numQubits();
        logger.debug("Evolving {}-qubit register through {} gates", n, circuit.gateCount());

        StateVector current = StateVector.ground(n);
        int step = 1;
        for (GateSpec gate : circuit.gates()) {
            ComplexMatrix operator = systemOperator(gate.kind(), gate.qubit(), n);
            StateVector next = current.apply(operator);
            checkNormalization(next, step);
            logger.debug("Step {}: applied {} with {}x{} operator", step, gate, operator.rows(), operator.cols());
            sink.accept(new StateTransition(step, gate, current, next));
            current = next;
            step++;
        }
        return current;
    }

    /**
     * @param circuit the normalized circuit
     * @return the state after all gates
     */
    public StateVector finalState(Circuit circuit) {
        return run(circuit, transition -> { });
    }

    private void checkNormalization(StateVector state, int step) {
        double deviation = Math.abs(state.normSquared() - 1.0);
        if (deviation > config.getInvariantTolerance()) {
            logger.error("State lost normalization at step {} (deviation {})", step, deviation);
            throw new InternalInvariantViolationException(
                "State norm deviates from 1 by " + deviation + " at step " + step, deviation);
        }
    }
}
