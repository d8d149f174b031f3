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

import io.qscope.command.ExitCodes;
import io.qscope.command.common.CircuitFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_qscope_generateTest {

    @TempDir
    Path tempDir;

    @Test
    public void testWritesReadableCircuit() throws IOException {
        Path output = tempDir.resolve("random.json");

        int exitCode = new CommandLine(new CMD_qscope_generate())
            .execute("--qubits", "3", "--gates", "12", "--seed", "42", "-o", output.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        CircuitFile circuit = CircuitFile.read(output);
        assertThat(circuit.gates()).hasSize(12);
        assertThat(circuit.gates()).allSatisfy(g -> assertThat(g.qubit()).isBetween(0, 2));
    }

    @Test
    public void testSeedIsReproducible() {
        assertThat(generateToStdout("5")).isEqualTo(generateToStdout("5"));
    }

    @Test
    public void testRefusesToOverwriteWithoutForce() throws IOException {
        Path output = tempDir.resolve("existing.json");
        Files.writeString(output, "{}");

        int exitCode = new CommandLine(new CMD_qscope_generate())
            .execute("-q", "2", "-g", "4", "-s", "1", "-o", output.toString());
        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(Files.readString(output)).isEqualTo("{}");

        exitCode = new CommandLine(new CMD_qscope_generate())
            .execute("-q", "2", "-g", "4", "-s", "1", "-o", output.toString(), "--force");
        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(CircuitFile.read(output).gates()).hasSize(4);
    }

    @Test
    public void testInvalidQubitCount() {
        int exitCode = new CommandLine(new CMD_qscope_generate()).execute("-q", "0", "-g", "4");
        assertThat(exitCode).isEqualTo(ExitCodes.INVALID_INPUT);
    }

    private String generateToStdout(String seed) {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_qscope_generate())
                .execute("--qubits", "2", "--gates", "6", "--seed", seed);
            assertThat(exitCode).isEqualTo(ExitCodes.OK);
        } finally {
            System.setOut(originalOut);
        }
        return outContent.toString(StandardCharsets.UTF_8);
    }
}
