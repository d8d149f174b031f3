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
import io.qscope.command.common.RandomSeedOption;
import io.qscope.command.generate.CircuitGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Generate a random circuit file.
///
/// ```bash
/// qscope generate --qubits 3 --gates 20 --seed 42 -o random.json
/// ```
///
/// Without `-o` the circuit is printed to stdout.
@CommandLine.Command(
    name = "generate",
    header = "Generate a random circuit",
    description = "Writes a seeded random circuit over the H, X, Y, Z and I gates.",
    exitCodeList = {
        "0: Success",
        "1: Error writing file",
        "2: Invalid arguments"
    }
)
public class CMD_qscope_generate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_qscope_generate.class);

    @CommandLine.Option(
        names = {"--qubits", "-q"},
        description = "Number of qubits",
        required = true
    )
    private int qubits;

    @CommandLine.Option(
        names = {"--gates", "-g"},
        description = "Number of gates",
        required = true
    )
    private int gates;

    @CommandLine.Option(
        names = {"--output", "-o"},
        description = "Output circuit JSON file (default: stdout)"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--force", "-f"},
        description = "Overwrite an existing output file"
    )
    private boolean force = false;

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @Override
    public Integer call() {
        try {
            if (outputPath != null && Files.exists(outputPath) && !force) {
                System.err.println("Error: Output file already exists: " + outputPath + " (use --force to overwrite)");
                return ExitCodes.ERROR;
            }
            long seed = seedOption.getSeed();
            if (!seedOption.isSeedSpecified()) {
                // reproduce this circuit by passing the seed back in
                System.err.println("Using seed " + seed);
            }
            CircuitFile circuit = new CircuitFile(CircuitGenerator.seeded(seed).generate(qubits, gates));
            logger.debug("Generated {} gates on {} qubits with seed {}", gates, qubits, seed);
            if (outputPath == null) {
                System.out.println(circuit.toJson());
            } else {
                circuit.write(outputPath);
                System.err.println("Wrote " + gates + " gates to " + outputPath);
            }
            return ExitCodes.OK;
        } catch (Exception e) {
            logger.debug("Error generating circuit", e);
            System.err.println("Error: " + e.getMessage());
            return ExitCodes.forError(e);
        }
    }
}
