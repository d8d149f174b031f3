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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.qscope.command.ExitCodes;
import io.qscope.command.common.CircuitFile;
import io.qscope.engine.circuit.GateInput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CMD_qscope_simulateTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void testFullTrace() throws IOException {
        Path circuit = writeCircuit(GateInput.of("H", 0, 0), GateInput.of("X", 1, 1));

        int exitCode = new CommandLine(new CMD_qscope_simulate()).execute("-i", circuit.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonObject result = JsonParser.parseString(stdout()).getAsJsonObject();
        assertThat(result.get("num_qubits").getAsInt()).isEqualTo(2);
        JsonArray steps = result.getAsJsonArray("steps");
        assertThat(steps).hasSize(3);
        assertThat(steps.get(2).getAsJsonObject().get("explanation").getAsString())
            .startsWith("Applied Pauli-X gate to qubit 1");
    }

    @Test
    public void testFinalCompact() throws IOException {
        Path circuit = writeCircuit(GateInput.of("X", 0, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--final", "--compact");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        String out = stdout().trim();
        assertThat(out).doesNotContain("\n");
        JsonObject result = JsonParser.parseString(out).getAsJsonObject();
        JsonArray probabilities = result.getAsJsonArray("measurementProbabilities");
        assertThat(probabilities.get(1).getAsDouble()).isCloseTo(1.0, within(1e-12));
        assertThat(result.getAsJsonArray("qubits")).hasSize(1);
    }

    @Test
    public void testUnsupportedGateIsInvalidInput() throws IOException {
        Path circuit = writeCircuit(GateInput.of("CNOT", 0, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate()).execute("-i", circuit.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
        assertThat(stdout()).isEmpty();
        assertThat(errContent.toString(StandardCharsets.UTF_8)).contains("CNOT");
    }

    @Test
    public void testFallbackOnError() throws IOException {
        Path circuit = writeCircuit(GateInput.of("CNOT", 0, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--fallback-on-error");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonObject step = JsonParser.parseString(stdout()).getAsJsonObject()
            .getAsJsonArray("steps").get(0).getAsJsonObject();
        assertThat(step.get("operation").getAsString()).isEqualTo("error");
        assertThat(step.get("explanation").getAsString()).startsWith("Simulation error: ");
    }

    @Test
    public void testQubitLimitFromOption() throws IOException {
        Path circuit = writeCircuit(GateInput.of("H", 3, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--max-qubits", "3");

        assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
    }

    @Test
    public void testLimitsFromConfigFile() throws IOException {
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, "{\"max_gates\": 1}");
        Path circuit = writeCircuit(GateInput.of("H", 0, 0), GateInput.of("H", 0, 1));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--config", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
    }

    @Test
    public void testInternalInvariantFailureIsReportedGenerically() throws IOException {
        Path config = tempDir.resolve("strict.json");
        Files.writeString(config, "{\"invariant_tolerance\": 1e-300}");
        Path circuit = writeCircuit(GateInput.of("H", 0, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--config", config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.INTERNAL_ERROR);
        assertThat(stdout()).isEmpty();
        String stderr = errContent.toString(StandardCharsets.UTF_8);
        assertThat(stderr).contains("Error: internal simulation error");
        assertThat(stderr).doesNotContain("deviates");
    }

    @Test
    public void testInternalInvariantFailureFallbackHidesDetails() throws IOException {
        Path config = tempDir.resolve("strict.json");
        Files.writeString(config, "{\"invariant_tolerance\": 1e-300}");
        Path circuit = writeCircuit(GateInput.of("H", 0, 0));

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--config", config.toString(), "--fallback-on-error");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonObject step = JsonParser.parseString(stdout()).getAsJsonObject()
            .getAsJsonArray("steps").get(0).getAsJsonObject();
        assertThat(step.get("explanation").getAsString())
            .isEqualTo("Simulation error: internal simulation error");
    }

    @Test
    public void testTraceFile() throws IOException {
        Path circuit = writeCircuit(GateInput.of("H", 0, 0));
        Path trace = tempDir.resolve("run.ndjson");

        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", circuit.toString(), "--trace", trace.toString(), "--no-operators");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readAllLines(trace)).hasSize(4);
        JsonObject step = JsonParser.parseString(stdout()).getAsJsonObject()
            .getAsJsonArray("steps").get(1).getAsJsonObject();
        assertThat(step.has("gate_matrix")).isFalse();
    }

    @Test
    public void testMissingFile() {
        int exitCode = new CommandLine(new CMD_qscope_simulate())
            .execute("-i", tempDir.resolve("absent.json").toString());
        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
    }

    @Test
    public void testMalformedJson() throws IOException {
        Path circuit = tempDir.resolve("broken.json");
        Files.writeString(circuit, "{\"gates\": [ {\"gate\": ");

        int exitCode = new CommandLine(new CMD_qscope_simulate()).execute("-i", circuit.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
    }

    private Path writeCircuit(GateInput... gates) throws IOException {
        Path file = tempDir.resolve("circuit.json");
        new CircuitFile(new ArrayList<>(List.of(gates))).write(file);
        return file;
    }

    private String stdout() {
        return outContent.toString(StandardCharsets.UTF_8);
    }
}
