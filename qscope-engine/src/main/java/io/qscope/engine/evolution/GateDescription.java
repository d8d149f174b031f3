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

import com.google.gson.annotations.SerializedName;
import io.qscope.engine.circuit.GateKind;

/// Fixed human-readable facts about one gate kind.
///
/// @param gate the gate kind
/// @param name display name, e.g. "Hadamard"
/// @param matrixLiteral the 2×2 matrix as text
/// @param basisAction action on |0⟩ and |1⟩
/// @param physicalEffect one-line physical interpretation
/// @param blochAction Bloch-sphere action
/// @param rotationAxis rotation axis, "none" for identity
/// @param rotationAngle rotation angle, e.g. "180°"
/// @param movement short description of the Bloch vector movement
/// @param summary catalog summary line
public record GateDescription(
    @SerializedName("gate") GateKind gate,
    @SerializedName("name") String name,
    @SerializedName("matrix_representation") String matrixLiteral,
    @SerializedName("action_on_basis") String basisAction,
    @SerializedName("physical_effect") String physicalEffect,
    @SerializedName("bloch_sphere_action") String blochAction,
    @SerializedName("rotation_axis") String rotationAxis,
    @SerializedName("rotation_angle") String rotationAngle,
    @SerializedName("movement") String movement,
    @SerializedName("summary") String summary
) {
}
