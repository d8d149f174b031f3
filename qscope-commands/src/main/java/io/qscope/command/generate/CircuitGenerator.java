package io.qscope.command.generate;

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

import io.qscope.engine.circuit.GateInput;
import io.qscope.engine.circuit.GateKind;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CollectionSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteUniformSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;

/// Seeded random circuits over the supported gate set.
///
/// Each gate gets a uniformly chosen kind and target qubit. Positions are assigned in
/// columns of `qubits` gates, so a 3-qubit, 7-gate circuit uses positions 0, 0, 0, 1, 1, 1, 2.
/// When at least one gate is generated, qubit `qubits - 1` is always targeted, so the
/// circuit spans the full requested register. The same seed always yields the same circuit.
public final class CircuitGenerator {

    private final UniformRandomProvider rng;

    public CircuitGenerator(UniformRandomProvider rng) {
        this.rng = rng;
    }

    /// @param seed generator seed
    /// @return an XorShiRo256++ provider
    public static RestorableUniformRandomProvider createRandom(long seed) {
        return RandomSource.XO_SHI_RO_256_PP.create(seed);
    }

    public static CircuitGenerator seeded(long seed) {
        return new CircuitGenerator(createRandom(seed));
    }

    /// @param qubits register size, at least 1
    /// @param gates gate count, at least 0
    /// @return the generated gate list
    public List<GateInput> generate(int qubits, int gates) {
        if (qubits < 1) {
            throw new IllegalArgumentException("qubits must be at least 1, got: " + qubits);
        }
        if (gates < 0) {
            throw new IllegalArgumentException("gates must not be negative, got: " + gates);
        }
        CollectionSampler<GateKind> kinds = new CollectionSampler<>(rng, List.of(GateKind.values()));
        SharedStateDiscreteSampler targets = DiscreteUniformSampler.of(rng, 0, qubits - 1);
        int top = qubits - 1;
        boolean topTargeted = false;
        List<GateInput> out = new ArrayList<>(gates);
        for (int i = 0; i < gates; i++) {
            int target = targets.sample();
            topTargeted |= target == top;
            out.add(GateInput.of(kinds.sample().name(), target, i / qubits));
        }
        if (gates > 0 && !topTargeted) {
            int index = rng.nextInt(gates);
            GateInput moved = out.get(index);
            out.set(index, GateInput.of(moved.gate(), top, moved.position()));
        }
        return out;
    }
}
