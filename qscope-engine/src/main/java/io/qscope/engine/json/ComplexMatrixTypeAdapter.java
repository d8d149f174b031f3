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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.qscope.engine.math.ComplexMatrix;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Writes a [ComplexMatrix] as nested row arrays of `{"re": ..., "im": ...}` entries.
final class ComplexMatrixTypeAdapter extends TypeAdapter<ComplexMatrix> {

    @Override
    public void write(JsonWriter out, ComplexMatrix matrix) throws IOException {
        if (matrix == null) {
            out.nullValue();
            return;
        }
        out.beginArray();
        for (int r = 0; r < matrix.rows(); r++) {
            out.beginArray();
            for (int c = 0; c < matrix.cols(); c++) {
                ComplexJson.write(out, matrix.getRe(r, c), matrix.getIm(r, c));
            }
            out.endArray();
        }
        out.endArray();
    }

    @Override
    public ComplexMatrix read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        List<List<double[]>> rows = new ArrayList<>();
        in.beginArray();
        while (in.hasNext()) {
            List<double[]> row = new ArrayList<>();
            in.beginArray();
            while (in.hasNext()) {
                row.add(ComplexJson.read(in));
            }
            in.endArray();
            rows.add(row);
        }
        in.endArray();
        if (rows.isEmpty()) {
            throw new JsonParseException("Matrix must have at least one row");
        }
        int cols = rows.get(0).size();
        double[] re = new double[rows.size() * cols];
        double[] im = new double[rows.size() * cols];
        for (int r = 0; r < rows.size(); r++) {
            if (rows.get(r).size() != cols) {
                throw new JsonParseException("Ragged matrix at row " + r);
            }
            for (int c = 0; c < cols; c++) {
                re[r * cols + c] = rows.get(r).get(c)[0];
                im[r * cols + c] = rows.get(r).get(c)[1];
            }
        }
        return ComplexMatrix.fromParts(rows.size(), cols, re, im);
    }
}
