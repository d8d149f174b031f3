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
import io.qscope.engine.state.BlochVector;

/// Bloch-sphere geometry of the register.
///
/// @param numQubits register size
/// @param averageQubitPurity mean of Tr(ρᵢ²) over all single-qubit reductions
/// @param blochVector the Bloch vector, only for a 1-qubit register, otherwise null
/// @param blochLength its length, only for a 1-qubit register, otherwise null
public record GeometricMetrics(
    @SerializedName("num_qubits") int numQubits,
    @SerializedName("average_qubit_purity") double averageQubitPurity,
    @SerializedName("bloch_vector") BlochVector blochVector,
    @SerializedName("bloch_length") Double blochLength
) {
}
