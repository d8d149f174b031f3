package io.qscope.engine.narrate;

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

/// Narration of one gate step.
///
/// @param gateType applied gate
/// @param targetQubit target qubit
/// @param description e.g. "Apply H gate to qubit 0"
/// @param matrixRepresentation the 2×2 matrix literal
/// @param actionOnBasis action on |0⟩ and |1⟩
/// @param physicalInterpretation physical effect
/// @param blochSphereAction Bloch-sphere action
/// @param blochMovement rotation axis and angle
/// @param entanglementImpact effect on entanglement structure
/// @param stateChanges numeric before/after difference
public record StepExplanation(
    @SerializedName("gate_type") GateKind gateType,
    @SerializedName("target_qubit") int targetQubit,
    @SerializedName("description") String description,
    @SerializedName("matrix_representation") String matrixRepresentation,
    @SerializedName("action_on_basis") String actionOnBasis,
    @SerializedName("physical_interpretation") String physicalInterpretation,
    @SerializedName("bloch_sphere_action") String blochSphereAction,
    @SerializedName("bloch_sphere_movement") BlochMovement blochMovement,
    @SerializedName("entanglement_impact") String entanglementImpact,
    @SerializedName("state_changes") StateChanges stateChanges
) {
}
