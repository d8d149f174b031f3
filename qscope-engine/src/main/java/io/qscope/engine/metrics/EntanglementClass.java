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

/// Classification of the average single-qubit entanglement entropy.
public enum EntanglementClass {

    @SerializedName("none")
    NONE("Single qubit - no entanglement"),
    @SerializedName("separable")
    SEPARABLE("State is approximately separable (product state)"),
    @SerializedName("weakly_entangled")
    WEAKLY_ENTANGLED("State shows weak entanglement"),
    @SerializedName("moderately_entangled")
    MODERATELY_ENTANGLED("State is moderately entangled"),
    @SerializedName("strongly_entangled")
    STRONGLY_ENTANGLED("State is strongly entangled");

    private final String description;

    EntanglementClass(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /// @param numQubits register size
    /// @param measure average single-qubit entropy in bits
    /// @return `NONE` for one qubit, otherwise the band the measure falls in
    public static EntanglementClass classify(int numQubits, double measure) {
        if (numQubits < 2) {
            return NONE;
        }
        if (measure < 0.1) {
            return SEPARABLE;
        }
        if (measure < 0.5) {
            return WEAKLY_ENTANGLED;
        }
        if (measure < 0.9) {
            return MODERATELY_ENTANGLED;
        }
        return STRONGLY_ENTANGLED;
    }
}
