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

import io.qscope.engine.state.StateVector;
import io.qscope.engine.trace.SimulationObserver;

import java.util.Objects;

/**
 * Per-call options for {@link QuantumSimulator#simulate(io.qscope.engine.circuit.Circuit, SimulationOptions)}.
 *
 * <pre>{@code
 * SimulationOptions options = SimulationOptions.builder()
 *     .reference(StateVector.uniform(2))
 *     .includeOperators(false)
 *     .build();
 * }</pre>
 */
public final class SimulationOptions {

    private static final SimulationOptions DEFAULTS = builder().build();

    private final StateVector reference;
    private final boolean includeOperators;
    private final boolean includeStepMetrics;
    private final SimulationObserver observer;

    private SimulationOptions(Builder builder) {
        this.reference = builder.reference;
        this.includeOperators = builder.includeOperators;
        this.includeStepMetrics = builder.includeStepMetrics;
        this.observer = builder.observer;
    }

    /**
     * @return ground reference, operators and step metrics included, no observer
     */
    public static SimulationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the reference state, or null to compare against |0…0⟩ of matching size
     */
    public StateVector reference() {
        return reference;
    }

    public boolean includeOperators() {
        return includeOperators;
    }

    public boolean includeStepMetrics() {
        return includeStepMetrics;
    }

    public SimulationObserver observer() {
        return observer;
    }

    public static final class Builder {
        private StateVector reference;
        private boolean includeOperators = true;
        private boolean includeStepMetrics = true;
        private SimulationObserver observer = SimulationObserver.NOOP;

        private Builder() {
        }

        public Builder reference(StateVector reference) {
            this.reference = reference;
            return this;
        }

        public Builder includeOperators(boolean includeOperators) {
            this.includeOperators = includeOperators;
            return this;
        }

        public Builder includeStepMetrics(boolean includeStepMetrics) {
            this.includeStepMetrics = includeStepMetrics;
            return this;
        }

        public Builder observer(SimulationObserver observer) {
            this.observer = Objects.requireNonNull(observer, "observer");
            return this;
        }

        public SimulationOptions build() {
            return new SimulationOptions(this);
        }
    }
}
