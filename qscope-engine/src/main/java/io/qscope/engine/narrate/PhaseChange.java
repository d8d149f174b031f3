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

/// Phase difference of an amplitude that is non-negligible both before and after a gate.
///
/// @param basisState bit string, qubit n−1 first
/// @param phaseChange arg(after) − arg(before)
public record PhaseChange(
    @SerializedName("basis_state") String basisState,
    @SerializedName("phase_change") double phaseChange
) {
}
