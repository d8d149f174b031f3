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

/// Subsystem entropies of one qubit pair (a < b).
///
/// @param qubitA lower qubit index
/// @param qubitB higher qubit index
/// @param entropyA S(ρa)
/// @param entropyB S(ρb)
/// @param jointEntropy S(ρab)
/// @param mutualInformation S(ρa) + S(ρb) − S(ρab)
public record PairEntanglement(
    @SerializedName("qubit_a") int qubitA,
    @SerializedName("qubit_b") int qubitB,
    @SerializedName("entropy_a") double entropyA,
    @SerializedName("entropy_b") double entropyB,
    @SerializedName("joint_entropy") double jointEntropy,
    @SerializedName("mutual_information") double mutualInformation
) {

    /// @return "a-b"
    public String label() {
        return qubitA + "-" + qubitB;
    }
}
