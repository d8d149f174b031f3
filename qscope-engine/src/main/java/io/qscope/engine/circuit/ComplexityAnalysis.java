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

import java.util.List;

/// Result of [CircuitComplexityAnalyzer#analyze(Circuit)].
///
/// @param statistics gate counts, depth and density
/// @param complexityClass size classification
/// @param parallelizationFactor gates per circuit column; 1 for an empty circuit
/// @param estimatedExecutionTime weighted gate count in arbitrary units
/// @param resourceRequirements symbolic memory and time cost
/// @param optimizationSuggestions human-readable simplifications, possibly empty
public record ComplexityAnalysis(
    @SerializedName("statistics") CircuitStatistics statistics,
    @SerializedName("complexity_class") ComplexityClass complexityClass,
    @SerializedName("parallelization_factor") double parallelizationFactor,
    @SerializedName("estimated_execution_time") double estimatedExecutionTime,
    @SerializedName("resource_requirements") ResourceRequirements resourceRequirements,
    @SerializedName("optimization_suggestions") List<String> optimizationSuggestions
) {

    public ComplexityAnalysis {
        optimizationSuggestions = List.copyOf(optimizationSuggestions);
    }
}
