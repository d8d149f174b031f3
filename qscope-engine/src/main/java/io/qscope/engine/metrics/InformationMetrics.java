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

/// Information-theoretic view of the measurement distribution.
///
/// @param shannonEntropy −Σ p log₂ p
/// @param renyiEntropy2 −log₂ Σp²
/// @param fisherInformation simplified Fisher information 4·Σ pᵢ·(i/(N−1))²
/// @param maxEntropy log₂ N
public record InformationMetrics(
    @SerializedName("shannon_entropy") double shannonEntropy,
    @SerializedName("renyi_entropy_2") double renyiEntropy2,
    @SerializedName("fisher_information") double fisherInformation,
    @SerializedName("max_entropy") double maxEntropy
) {
}
