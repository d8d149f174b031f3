package io.qscope.engine.circuit;

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

/// A gate entry as it arrives from a caller, before normalization.
///
/// The gate token is kept as a string so unsupported tokens can be reported with their
/// original spelling. Missing qubit and position values default to 0.
///
/// @param gate gate token such as "H"; "type" is accepted as an alias in JSON
/// @param qubit target qubit, nullable
/// @param position circuit column, nullable
public record GateInput(
    @SerializedName(value = "gate", alternate = {"type"}) String gate,
    @SerializedName("qubit") Integer qubit,
    @SerializedName("position") Integer position
) {

    public static GateInput of(String gate, int qubit, int position) {
        return new GateInput(gate, qubit, position);
    }

    public int qubitOrDefault() {
        return qubit != null ? qubit : 0;
    }

    public int positionOrDefault() {
        return position != null ? position : 0;
    }
}
