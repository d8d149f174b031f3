package io.qscope.engine.metrics;

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

/// Pure-state fidelity |⟨ref|ψ⟩|² and trace distance √(1 − F) against three references.
///
/// @param groundStateFidelity against |0…0⟩
/// @param groundStateTraceDistance against |0…0⟩
/// @param uniformStateFidelity against (1/√N)Σ|i⟩
/// @param uniformStateTraceDistance against (1/√N)Σ|i⟩
/// @param referenceFidelity against the caller's reference state
/// @param referenceTraceDistance against the caller's reference state
public record DistanceMetrics(
    @SerializedName("ground_state_fidelity") double groundStateFidelity,
    @SerializedName("ground_state_trace_distance") double groundStateTraceDistance,
    @SerializedName("mixed_state_fidelity") double uniformStateFidelity,
    @SerializedName("mixed_state_trace_distance") double uniformStateTraceDistance,
    @SerializedName("reference_fidelity") double referenceFidelity,
    @SerializedName("reference_trace_distance") double referenceTraceDistance
) {
}
