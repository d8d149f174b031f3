package io.qscope.engine.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.qscope.engine.math.ComplexMatrix;
import io.qscope.engine.state.StateVector;

/// Centralized Gson configuration for engine results.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled for [#gson()] | Human-readable results |
/// | Serialize nulls | Disabled | Optional fields disappear |
/// | HTML escaping | Disabled | Keeps `⟩` and `'` readable |
/// | Special floats | Allowed | NaN never aborts serialization |
/// | [StateVector] adapter | Registered | Amplitudes as `{re, im}` arrays |
/// | [ComplexMatrix] adapter | Registered | Matrices as nested `{re, im}` arrays |
///
/// The [Gson] instances are thread-safe and shared.
public final class QscopeGsonConfig {

    private static final Gson INSTANCE = builder().create();
    private static final Gson COMPACT = compactBuilder().create();

    private QscopeGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Single-line output, for NDJSON traces and `--compact` command output.
    ///
    /// @return the shared compact instance
    public static Gson compactGson() {
        return COMPACT;
    }

    /// @return a new builder with the engine defaults, pretty-printing enabled
    public static GsonBuilder builder() {
        return compactBuilder().setPrettyPrinting();
    }

    private static GsonBuilder compactBuilder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(StateVector.class, new StateVectorTypeAdapter())
            .registerTypeAdapter(ComplexMatrix.class, new ComplexMatrixTypeAdapter());
    }
}
