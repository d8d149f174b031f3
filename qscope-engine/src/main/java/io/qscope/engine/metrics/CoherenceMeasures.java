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

/// Coherence of a state in the computational basis.
///
/// Both values are heuristics kept for output compatibility:
///
/// - `l1_norm_coherence` is `Σ|ψᵢ| − √(Σpᵢ)`, a magnitude sum rather than the
///   off-diagonal ℓ1 norm of ρ
/// - `relative_entropy_coherence` is `log₂ N` minus the distribution entropy
///
/// @param l1NormCoherence magnitude-sum coherence
/// @param relativeEntropyCoherence `log₂ N − H(p)`
/// @param coherenceBasis always "computational"
public record CoherenceMeasures(
    @SerializedName("l1_norm_coherence") double l1NormCoherence,
    @SerializedName("relative_entropy_coherence") double relativeEntropyCoherence,
    @SerializedName("coherence_basis") String coherenceBasis
) {

    public static final String COMPUTATIONAL_BASIS = "computational";

    public static CoherenceMeasures computational(double l1, double relativeEntropy) {
        return new CoherenceMeasures(l1, relativeEntropy, COMPUTATIONAL_BASIS);
    }
}
