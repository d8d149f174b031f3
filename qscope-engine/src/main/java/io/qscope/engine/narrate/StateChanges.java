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

import java.util.List;

/// Numeric difference between two consecutive states.
///
/// @param fidelity |⟨before|after⟩|²
/// @param amplitudeChanges one entry per basis state
/// @param phaseChanges entries whose magnitudes exceed 1e−10 on both sides
/// @param totalProbabilityChange Σ|Δpᵢ|
public record StateChanges(
    @SerializedName("fidelity") double fidelity,
    @SerializedName("amplitude_changes") List<AmplitudeChange> amplitudeChanges,
    @SerializedName("phase_changes") List<PhaseChange> phaseChanges,
    @SerializedName("total_probability_change") double totalProbabilityChange
) {

    public StateChanges {
        amplitudeChanges = List.copyOf(amplitudeChanges);
        phaseChanges = List.copyOf(phaseChanges);
    }
}
