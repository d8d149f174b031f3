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

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.qscope.engine.state.StateVector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Writes a [StateVector] as an array of `{"re": ..., "im": ...}` amplitudes, in basis order.
final class StateVectorTypeAdapter extends TypeAdapter<StateVector> {

    @Override
    public void write(JsonWriter out, StateVector state) throws IOException {
        if (state == null) {
            out.nullValue();
            return;
        }
        out.beginArray();
        for (int i = 0; i < state.dimension(); i++) {
            ComplexJson.write(out, state.re(i), state.im(i));
        }
        out.endArray();
    }

    @Override
    public StateVector read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        List<double[]> parts = new ArrayList<>();
        in.beginArray();
        while (in.hasNext()) {
            parts.add(ComplexJson.read(in));
        }
        in.endArray();
        double[] re = new double[parts.size()];
        double[] im = new double[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            re[i] = parts.get(i)[0];
            im[i] = parts.get(i)[1];
        }
        return StateVector.fromParts(re, im);
    }
}
