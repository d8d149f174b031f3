package io.qscope.command.subcommands;

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
import io.qscope.command.ExitCodes;
import io.qscope.command.common.CircuitFile;
import io.qscope.engine.circuit.GateInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_qscope_statsTest {

    @TempDir
    Path tempDir;

    @Test
    public void testStatsForSimpleCircuit() throws IOException {
        Path circuit = tempDir.resolve("circuit.json");
        new CircuitFile(List.of(
            GateInput.of("H", 0, 0),
            GateInput.of("H", 0, 1),
            GateInput.of("I", 1, 1))).write(circuit);

        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_qscope_stats()).execute("-i", circuit.toString());
            assertThat(exitCode).isEqualTo(ExitCodes.OK);
        } finally {
            System.setOut(originalOut);
        }

        JsonObject analysis = JsonParser.parseString(outContent.toString(StandardCharsets.UTF_8)).getAsJsonObject();
        JsonObject stats = analysis.getAsJsonObject("statistics");
        assertThat(stats.get("total_gates").getAsInt()).isEqualTo(3);
        assertThat(stats.get("num_qubits").getAsInt()).isEqualTo(2);
        assertThat(stats.getAsJsonObject("gate_counts").get("H").getAsInt()).isEqualTo(2);
        assertThat(analysis.get("complexity_class").getAsString()).isEqualTo("simple");
        assertThat(analysis.getAsJsonArray("optimization_suggestions")).hasSize(2);
    }

    @Test
    public void testRejectsUnsupportedGate() throws IOException {
        Path circuit = tempDir.resolve("bad.json");
        Files.writeString(circuit, "{\"gates\": [{\"type\": \"TOFFOLI\", \"qubit\": 0, \"position\": 0}]}");

        PrintStream originalErr = System.err;
        ByteArrayOutputStream errContent = new ByteArrayOutputStream();
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_qscope_stats()).execute("-i", circuit.toString());
            assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
        } finally {
            System.setErr(originalErr);
        }
        assertThat(errContent.toString(StandardCharsets.UTF_8)).contains("TOFFOLI");
    }
}
