package io.qscope.command.common;

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
import com.google.gson.annotations.SerializedName;
import io.qscope.engine.circuit.GateInput;
import io.qscope.engine.json.QscopeGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// On-disk circuit description.
///
/// ```json
/// {"gates": [{"gate": "H", "qubit": 0, "position": 0}]}
/// ```
///
/// `type` is accepted in place of `gate`.
///
/// @param gates raw gate entries, not yet normalized
public record CircuitFile(@SerializedName("gates") List<GateInput> gates) {

    public CircuitFile {
        gates = gates == null ? List.of() : gates;
    }

    /// Reads a circuit file.
    ///
    /// @param path the JSON file
    /// @return the parsed circuit file; a file without `gates` yields an empty list
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a circuit JSON object
    public static CircuitFile read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            CircuitFile file = QscopeGsonConfig.gson().fromJson(reader, CircuitFile.class);
            if (file == null) {
                throw new IllegalArgumentException("Circuit file is empty: " + path);
            }
            return file;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid circuit file " + path + ": " + e.getMessage(), e);
        }
    }

    /// Writes this circuit as pretty-printed JSON.
    ///
    /// @param path destination file
    /// @throws IOException if the file cannot be written
    public void write(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            QscopeGsonConfig.gson().toJson(this, writer);
        }
    }

    public String toJson() {
        return QscopeGsonConfig.gson().toJson(this);
    }
}
