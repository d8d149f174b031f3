package io.qscope.engine.state;

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

import java.util.ArrayList;
import java.util.List;

/// Polar and Cartesian view of one basis-state amplitude.
///
/// @param index basis index
/// @param basisState bit string, qubit n−1 first
/// @param magnitude |ψᵢ|
/// @param phase arg ψᵢ in (−π, π]
/// @param probability |ψᵢ|²
/// @param real Re ψᵢ
/// @param imaginary Im ψᵢ
public record AmplitudeInfo(
    @SerializedName("index") int index,
    @SerializedName("basis_state") String basisState,
    @SerializedName("magnitude") double magnitude,
    @SerializedName("phase") double phase,
    @SerializedName("probability") double probability,
    @SerializedName("real") double real,
    @SerializedName("imaginary") double imaginary
) {

    /// @param state a state vector
    /// @return one entry per basis state, in index order
    public static List<AmplitudeInfo> listOf(StateVector state) {
        List<AmplitudeInfo> out = new ArrayList<>(state.dimension());
        for (int i = 0; i < state.dimension(); i++) {
            double re = state.re(i);
            double im = state.im(i);
            out.add(new AmplitudeInfo(i, state.basisLabel(i), Math.hypot(re, im), Math.atan2(im, re),
                re * re + im * im, re, im));
        }
        return out;
    }
}
