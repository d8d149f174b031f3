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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Turns raw gate input into an ordered [Circuit].
///
/// Every entry is resolved to a [GateKind]; the first unsupported token, negative
/// index or missing entry aborts normalization with a [MalformedCircuitException].
/// Normalization has no side effects beyond logging.
public final class CircuitNormalizer {

    private static final Logger logger = LogManager.getLogger(CircuitNormalizer.class);

    private CircuitNormalizer() {
        // Utility class
    }

    /// Normalizes a raw gate list.
    ///
    /// @param inputs gate entries in any order; null is treated as an empty list
    /// @return the position-ordered circuit
    /// @throws MalformedCircuitException if any entry cannot be applied by the engine
    public static Circuit normalize(List<GateInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return Circuit.empty();
        }
        List<GateSpec> specs = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            specs.add(toSpec(inputs.get(i), i));
        }
        Circuit circuit = Circuit.of(specs);
        logger.debug("Normalized {} gates onto {} qubits", circuit.gateCount(), circuit.numQubits());
        return circuit;
    }

    private static GateSpec toSpec(GateInput input, int index) {
        if (input == null) {
            logger.warn("Rejecting circuit: gate entry {} is missing", index);
            throw new MalformedCircuitException("Gate entry " + index + " is missing", null, index);
        }
        GateKind kind;
        try {
            kind = GateKind.fromToken(input.gate(), index);
        } catch (MalformedCircuitException e) {
            logger.warn("Rejecting circuit: {}", e.getMessage());
            throw e;
        }
        int qubit = input.qubitOrDefault();
        int position = input.positionOrDefault();
        if (qubit < 0) {
            logger.warn("Rejecting circuit: gate {} targets negative qubit {}", index, qubit);
            throw new MalformedCircuitException(
                "Gate " + index + " targets negative qubit " + qubit, input.gate(), index);
        }
        if (position < 0) {
            logger.warn("Rejecting circuit: gate {} has negative position {}", index, position);
            throw new MalformedCircuitException(
                "Gate " + index + " has negative position " + position, input.gate(), index);
        }
        return new GateSpec(kind, qubit, position);
    }
}
