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

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/// Streaming helpers shared by the amplitude and matrix adapters.
final class ComplexJson {

    private ComplexJson() {
        // Utility class
    }

    static void write(JsonWriter out, double re, double im) throws IOException {
        out.beginObject();
        out.name("re").value(re);
        out.name("im").value(im);
        out.endObject();
    }

    /// Reads `{"re": ..., "im": ...}`; missing parts are 0.
    static double[] read(JsonReader in) throws IOException {
        double re = 0.0;
        double im = 0.0;
        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            switch (name) {
                case "re", "real" -> re = in.nextDouble();
                case "im", "imag" -> im = in.nextDouble();
                default -> in.skipValue();
            }
        }
        in.endObject();
        return new double[]{re, im};
    }
}
