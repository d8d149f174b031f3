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

/// All metrics of one state snapshot.
///
/// Field names follow the established result payload. Two of them do not mean what
/// their names suggest and are kept as-is for output compatibility:
///
/// - `von_neumann_entropy` is the Shannon entropy of the global measurement
///   distribution. The von Neumann entropy of the pure global state would always be 0.
/// - `fidelity` is √purity. Fidelity against a reference state is `reference_fidelity`.
///
/// @param purity Σpᵢ²
/// @param vonNeumannEntropy −Σpᵢ log₂ pᵢ over pᵢ > 1e−16
/// @param linearEntropy 1 − purity
/// @param participationRatio 1/Σpᵢ², 1 when Σpᵢ² < 1e−16
/// @param effectiveDimension 1/purity, 1 when purity < 1e−16
/// @param groundStateFidelity p₀
/// @param fidelity √purity
/// @param entanglement average single-qubit entanglement entropy
/// @param referenceFidelity |⟨ref|ψ⟩|²
/// @param traceDistance √(1 − referenceFidelity)
/// @param coherence coherence measures
/// @param information information-theoretic metrics
/// @param distances distances to fixed references
/// @param geometric Bloch-sphere geometry
/// @param entanglementAnalysis subsystem entropies and classification
public record MetricsBundle(
    @SerializedName("purity") double purity,
    @SerializedName("von_neumann_entropy") double vonNeumannEntropy,
    @SerializedName("linear_entropy") double linearEntropy,
    @SerializedName("participation_ratio") double participationRatio,
    @SerializedName("effective_dimension") double effectiveDimension,
    @SerializedName("ground_state_fidelity") double groundStateFidelity,
    @SerializedName("fidelity") double fidelity,
    @SerializedName("entanglement") double entanglement,
    @SerializedName("reference_fidelity") double referenceFidelity,
    @SerializedName("trace_distance") double traceDistance,
    @SerializedName("coherence_measures") CoherenceMeasures coherence,
    @SerializedName("information_metrics") InformationMetrics information,
    @SerializedName("distance_metrics") DistanceMetrics distances,
    @SerializedName("geometric_metrics") GeometricMetrics geometric,
    @SerializedName("entanglement_analysis") EntanglementAnalysis entanglementAnalysis
) {
}
