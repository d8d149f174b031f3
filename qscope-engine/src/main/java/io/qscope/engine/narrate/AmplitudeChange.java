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

/// Before and after values of one basis-state amplitude.
///
/// `phase_change` is the raw difference of arguments and is not wrapped into (−π, π].
public record AmplitudeChange(
    @SerializedName("basis_state") String basisState,
    @SerializedName("before_probability") double beforeProbability,
    @SerializedName("after_probability") double afterProbability,
    @SerializedName("probability_change") double probabilityChange,
    @SerializedName("before_magnitude") double beforeMagnitude,
    @SerializedName("after_magnitude") double afterMagnitude,
    @SerializedName("magnitude_change") double magnitudeChange,
    @SerializedName("phase_change") double phaseChange
) {
}
