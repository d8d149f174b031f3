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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/// A validated gate application: which gate, on which qubit, at which circuit position.
///
/// @param kind the gate to apply
/// @param qubit target qubit index, bit `qubit` of the basis index
/// @param position column in the circuit; gates are applied in ascending position order
public record GateSpec(
    @SerializedName("gate") GateKind kind,
    @SerializedName("qubit") int qubit,
    @SerializedName("position") int position
) {

    public GateSpec {
        Objects.requireNonNull(kind, "kind");
        if (qubit < 0) {
            throw new IllegalArgumentException("qubit must not be negative, got: " + qubit);
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative, got: " + position);
        }
    }

    public static GateSpec of(GateKind kind, int qubit, int position) {
        return new GateSpec(kind, qubit, position);
    }

    @Override
    public String toString() {
        return kind + "(q" + qubit + "@" + position + ")";
    }
}
