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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable engine configuration.
 *
 * <h2>Purpose</h2>
 *
 * <p>Holds the ceilings the engine enforces before committing to a 2ⁿ allocation,
 * plus the numerical tolerance for its internal invariant checks. Unset fields in a
 * loaded file keep their defaults.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "max_qubits": 10,
 *   "max_gates": 100,
 *   "invariant_tolerance": 1e-9,
 *   "operator_export_qubit_limit": 6
 * }
 * }</pre>
 *
 * <p>Instances are immutable once built; {@link #withMaxQubits(int)} and
 * {@link #withMaxGates(int)} return modified copies.
 */
public final class EngineConfig {

    /** Default qubit ceiling. */
    public static final int DEFAULT_MAX_QUBITS = 10;
    /** Default gate-count ceiling. */
    public static final int DEFAULT_MAX_GATES = 100;
    /** Default tolerance for trace, Hermiticity and normalization checks. */
    public static final double DEFAULT_INVARIANT_TOLERANCE = 1e-9;
    /** Default largest system for which full-system operators are attached to steps. */
    public static final int DEFAULT_OPERATOR_EXPORT_QUBIT_LIMIT = 6;
    /**
     * Hard ceiling on {@code max_qubits}. Every step builds a dense 2ⁿ × 2ⁿ operator, which at
     * 12 qubits already holds 2²⁴ complex entries.
     */
    public static final int MAX_SUPPORTED_QUBITS = 12;

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("max_qubits")
    private final int maxQubits;

    @SerializedName("max_gates")
    private final int maxGates;

    @SerializedName("invariant_tolerance")
    private final double invariantTolerance;

    @SerializedName("operator_export_qubit_limit")
    private final int operatorExportQubitLimit;

    /**
     * Creates a validated configuration.
     *
     * @param maxQubits largest permitted qubit count
     * @param maxGates largest permitted gate count
     * @param invariantTolerance tolerance for internal numerical checks
     * @param operatorExportQubitLimit largest qubit count for which step operators are exported
     * @throws IllegalArgumentException if any limit is not positive or max_qubits exceeds
     *     {@link #MAX_SUPPORTED_QUBITS}
     */
    public EngineConfig(int maxQubits, int maxGates, double invariantTolerance, int operatorExportQubitLimit) {
        if (maxQubits <= 0) {
            throw new IllegalArgumentException("max_qubits must be positive, got: " + maxQubits);
        }
        if (maxQubits > MAX_SUPPORTED_QUBITS) {
            throw new IllegalArgumentException("max_qubits must not exceed " + MAX_SUPPORTED_QUBITS
                + ", the largest register with a dense operator the engine can allocate, got: " + maxQubits);
        }
        if (maxGates <= 0) {
            throw new IllegalArgumentException("max_gates must be positive, got: " + maxGates);
        }
        if (!(invariantTolerance > 0.0)) {
            throw new IllegalArgumentException("invariant_tolerance must be positive, got: " + invariantTolerance);
        }
        if (operatorExportQubitLimit < 0) {
            throw new IllegalArgumentException("operator_export_qubit_limit must not be negative, got: "
                + operatorExportQubitLimit);
        }
        this.maxQubits = maxQubits;
        this.maxGates = maxGates;
        this.invariantTolerance = invariantTolerance;
        this.operatorExportQubitLimit = operatorExportQubitLimit;
    }

    /**
     * @return the default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_QUBITS, DEFAULT_MAX_GATES,
            DEFAULT_INVARIANT_TOLERANCE, DEFAULT_OPERATOR_EXPORT_QUBIT_LIMIT);
    }

    public int getMaxQubits() {
        return maxQubits;
    }

    public int getMaxGates() {
        return maxGates;
    }

    public double getInvariantTolerance() {
        return invariantTolerance;
    }

    public int getOperatorExportQubitLimit() {
        return operatorExportQubitLimit;
    }

    public EngineConfig withMaxQubits(int maxQubits) {
        return new EngineConfig(maxQubits, maxGates, invariantTolerance, operatorExportQubitLimit);
    }

    public EngineConfig withMaxGates(int maxGates) {
        return new EngineConfig(maxQubits, maxGates, invariantTolerance, operatorExportQubitLimit);
    }

    /**
     * Loads configuration from a JSON file. Missing fields keep their defaults.
     *
     * @param path the JSON file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not valid configuration JSON
     */
    public static EngineConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Parses configuration from JSON. Missing fields keep their defaults.
     *
     * @param reader JSON source
     * @return the parsed configuration
     * @throws IllegalArgumentException if the content is not valid configuration JSON
     */
    public static EngineConfig fromJson(Reader reader) {
        RawConfig raw;
        try {
            raw = GSON.fromJson(reader, RawConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid engine configuration: " + e.getMessage(), e);
        }
        if (raw == null) {
            return defaults();
        }
        return new EngineConfig(
            raw.maxQubits != null ? raw.maxQubits : DEFAULT_MAX_QUBITS,
            raw.maxGates != null ? raw.maxGates : DEFAULT_MAX_GATES,
            raw.invariantTolerance != null ? raw.invariantTolerance : DEFAULT_INVARIANT_TOLERANCE,
            raw.operatorExportQubitLimit != null ? raw.operatorExportQubitLimit : DEFAULT_OPERATOR_EXPORT_QUBIT_LIMIT);
    }

    /**
     * Saves this configuration as pretty-printed JSON.
     *
     * @param path destination file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            GSON.toJson(this, writer);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /** Nullable mirror used so absent JSON fields can fall back to defaults. */
    private static final class RawConfig {
        @SerializedName("max_qubits")
        private Integer maxQubits;
        @SerializedName("max_gates")
        private Integer maxGates;
        @SerializedName("invariant_tolerance")
        private Double invariantTolerance;
        @SerializedName("operator_export_qubit_limit")
        private Integer operatorExportQubitLimit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineConfig)) return false;
        EngineConfig that = (EngineConfig) o;
        return maxQubits == that.maxQubits
            && maxGates == that.maxGates
            && Double.compare(invariantTolerance, that.invariantTolerance) == 0
            && operatorExportQubitLimit == that.operatorExportQubitLimit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxQubits, maxGates, invariantTolerance, operatorExportQubitLimit);
    }

    @Override
    public String toString() {
        return String.format("EngineConfig{maxQubits=%d, maxGates=%d, tolerance=%g, operatorExportLimit=%d}",
            maxQubits, maxGates, invariantTolerance, operatorExportQubitLimit);
    }
}
