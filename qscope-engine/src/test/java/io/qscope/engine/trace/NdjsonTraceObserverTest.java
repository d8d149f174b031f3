package io.qscope.engine.trace;

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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.qscope.engine.QuantumSimulator;
import io.qscope.engine.SimulationOptions;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.GateKind;
import io.qscope.engine.circuit.GateSpec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class NdjsonTraceObserverTest {

    @TempDir
    Path tempDir;

    private final Circuit circuit = Circuit.of(GateSpec.of(GateKind.H, 0, 0), GateSpec.of(GateKind.X, 1, 1));

    @Test
    void writesOneEventPerLine() {
        StringWriter out = new StringWriter();
        NdjsonTraceObserver observer = new NdjsonTraceObserver(out);
        new QuantumSimulator().simulate(circuit, SimulationOptions.builder().observer(observer).build());

        List<String> lines = out.toString().lines().toList();
        assertThat(lines).hasSize(5);

        JsonObject start = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertThat(start.get("event").getAsString()).isEqualTo("simulation_start");
        assertThat(start.get("num_qubits").getAsInt()).isEqualTo(2);
        assertThat(start.get("gate_count").getAsInt()).isEqualTo(2);
        assertThat(start.has("timestamp")).isTrue();

        JsonObject initial = JsonParser.parseString(lines.get(1)).getAsJsonObject();
        assertThat(initial.get("operation").getAsString()).isEqualTo("initialization");
        assertThat(initial.has("qubit")).isFalse();

        JsonObject second = JsonParser.parseString(lines.get(3)).getAsJsonObject();
        assertThat(second.get("step").getAsInt()).isEqualTo(2);
        assertThat(second.get("operation").getAsString()).isEqualTo("X");
        assertThat(second.get("qubit").getAsInt()).isEqualTo(1);
        assertThat(second.getAsJsonArray("probabilities")).hasSize(4);

        JsonObject complete = JsonParser.parseString(lines.get(4)).getAsJsonObject();
        assertThat(complete.get("event").getAsString()).isEqualTo("simulation_complete");
        assertThat(complete.get("steps").getAsInt()).isEqualTo(3);
    }

    @Test
    void writesToFile() throws IOException {
        Path trace = tempDir.resolve("trace.ndjson");
        try (NdjsonTraceObserver observer = new NdjsonTraceObserver(trace)) {
            new QuantumSimulator().simulate(circuit, SimulationOptions.builder().observer(observer).build());
        }
        assertThat(Files.readAllLines(trace)).hasSize(5)
            .allSatisfy(line -> assertThat(line).startsWith("{\"event\":"));
    }
}
