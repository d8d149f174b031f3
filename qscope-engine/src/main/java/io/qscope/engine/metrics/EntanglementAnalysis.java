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

import java.util.List;

/// Subsystem entropies computed from true reduced density matrices.
///
/// Only single-qubit gates are supported, so for any reachable state every entry here
/// is 0 up to rounding. The values are still computed from eigenvalues, not assumed.
///
/// @param type classification of `measure`
/// @param measure average single-qubit entropy
/// @param description text for `type`
/// @param maxEntanglement log₂(min(2, n))
/// @param qubitEntropies S(ρᵢ) per qubit, indexed by qubit
/// @param pairs one entry per qubit pair a < b
public record EntanglementAnalysis(
    @SerializedName("type") EntanglementClass type,
    @SerializedName("measure") double measure,
    @SerializedName("description") String description,
    @SerializedName("max_entanglement") double maxEntanglement,
    @SerializedName("qubit_entropies") List<Double> qubitEntropies,
    @SerializedName("pairs") List<PairEntanglement> pairs
) {

    public EntanglementAnalysis {
        qubitEntropies = List.copyOf(qubitEntropies);
        pairs = List.copyOf(pairs);
    }
}
