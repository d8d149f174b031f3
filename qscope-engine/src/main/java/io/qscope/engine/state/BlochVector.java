package io.qscope.engine.state;

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

/// Bloch-sphere coordinates of a single-qubit reduced state.
///
/// Length 1 means the qubit is in a pure local state; anything shorter means it is
/// correlated with the rest of the register.
///
/// @param x ⟨σx⟩
/// @param y ⟨σy⟩
/// @param z ⟨σz⟩
public record BlochVector(
    @SerializedName("x") double x,
    @SerializedName("y") double y,
    @SerializedName("z") double z
) {

    /// The north pole, |0⟩.
    public static final BlochVector GROUND = new BlochVector(0.0, 0.0, 1.0);

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /// @param tolerance allowed deviation of the length from 1
    /// @return true if the vector lies on the sphere surface
    public boolean isPure(double tolerance) {
        return Math.abs(length() - 1.0) <= tolerance;
    }

    /// @return the corresponding 2×2 density matrix purity, (1 + |r|²) / 2
    public double purity() {
        double r = length();
        return (1.0 + r * r) / 2.0;
    }
}
