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

/// Coarse size classification of a circuit.
public enum ComplexityClass {

    /// No gates.
    @SerializedName("trivial")
    TRIVIAL,
    /// At most 10 gates and depth at most 5.
    @SerializedName("simple")
    SIMPLE,
    /// At most 50 gates and depth at most 20.
    @SerializedName("moderate")
    MODERATE,
    /// Everything larger.
    @SerializedName("complex")
    COMPLEX;

    public static ComplexityClass classify(int gateCount, int depth) {
        if (gateCount == 0) {
            return TRIVIAL;
        }
        if (gateCount <= 10 && depth <= 5) {
            return SIMPLE;
        }
        if (gateCount <= 50 && depth <= 20) {
            return MODERATE;
        }
        return COMPLEX;
    }
}
