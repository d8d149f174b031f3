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

import com.google.gson.Gson;
import io.qscope.command.ExitCodes;
import io.qscope.command.SimulationResults;
import io.qscope.command.common.CircuitFile;
import io.qscope.command.common.EngineConfigOption;
import io.qscope.engine.InternalInvariantViolationException;
import io.qscope.engine.QscopeEngineException;
import io.qscope.engine.QuantumSimulator;
import io.qscope.engine.SimulationOptions;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.CircuitNormalizer;
import io.qscope.engine.json.QscopeGsonConfig;
import io.qscope.engine.trace.NdjsonTraceObserver;
import io.qscope.engine.trace.SimulationObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Simulate a circuit file and print the result as JSON.
///
/// ## Usage
///
/// ```bash
/// # Full step-by-step trace
/// qscope simulate -i circuit.json
///
/// # Final state only, single-line JSON
/// qscope simulate -i circuit.json --final --compact
///
/// # Write an NDJSON progress trace alongside
/// qscope simulate -i circuit.json --trace run.ndjson
/// ```
@CommandLine.Command(
    name = "simulate",
    header = "Simulate a circuit step by step",
    description = "Runs a circuit file through the state-vector engine and prints the trace or final state as JSON.",
    exitCodeList = {
        "0: Success",
        "1: Error reading or writing files",
        "2: Circuit or configuration rejected",
        "3: Internal numerical error"
    }
)
public class CMD_qscope_simulate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_qscope_simulate.class);

    /// Shown in place of the message of an internal invariant failure, which is only logged.
    private static final String INTERNAL_ERROR_MESSAGE = "internal simulation error";

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Circuit JSON file",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--final"},
        description = "Report only the final state (Bloch vectors, purity, probabilities)"
    )
    private boolean finalOnly = false;

    @CommandLine.Option(
        names = {"--trace"},
        description = "Write NDJSON progress events to this file"
    )
    private Path tracePath;

    @CommandLine.Option(
        names = {"--no-operators"},
        description = "Omit full-system gate matrices from each step"
    )
    private boolean noOperators = false;

    @CommandLine.Option(
        names = {"--no-step-metrics"},
        description = "Compute metrics for the final state only"
    )
    private boolean noStepMetrics = false;

    @CommandLine.Option(
        names = {"--compact"},
        description = "Print single-line JSON"
    )
    private boolean compact = false;

    @CommandLine.Option(
        names = {"--fallback-on-error"},
        description = "On a rejected circuit, print a ground-state placeholder result and exit 0"
    )
    private boolean fallbackOnError = false;

    @CommandLine.Mixin
    private EngineConfigOption engineConfig = new EngineConfigOption();

    @Override
    public Integer call() {
        Gson gson = compact ? QscopeGsonConfig.compactGson() : QscopeGsonConfig.gson();
        try {
            QuantumSimulator simulator = new QuantumSimulator(engineConfig.resolve());
            Circuit circuit = CircuitNormalizer.normalize(CircuitFile.read(inputPath).gates());
            if (finalOnly) {
                System.out.println(gson.toJson(simulator.simulateFinal(circuit)));
                return ExitCodes.OK;
            }
            if (tracePath != null) {
                try (NdjsonTraceObserver trace = new NdjsonTraceObserver(tracePath)) {
                    System.out.println(gson.toJson(simulator.simulate(circuit, options(trace))));
                }
            } else {
                System.out.println(gson.toJson(simulator.simulate(circuit, options(SimulationObserver.NOOP))));
            }
            return ExitCodes.OK;
        } catch (InternalInvariantViolationException e) {
            logger.error("Internal invariant violated simulating {} (deviation {})", inputPath, e.getDeviation(), e);
            if (fallbackOnError) {
                System.out.println(gson.toJson(SimulationResults.fallback(INTERNAL_ERROR_MESSAGE)));
                return ExitCodes.OK;
            }
            System.err.println("Error: " + INTERNAL_ERROR_MESSAGE);
            return ExitCodes.INTERNAL_ERROR;
        } catch (QscopeEngineException e) {
            if (fallbackOnError) {
                logger.warn("Simulation failed, printing placeholder result: {}", e.getMessage());
                System.out.println(gson.toJson(SimulationResults.fallback(e.getMessage())));
                return ExitCodes.OK;
            }
            System.err.println("Error: " + e.getMessage());
            return ExitCodes.forError(e);
        } catch (IOException | RuntimeException e) {
            logger.error("Error simulating circuit {}", inputPath, e);
            System.err.println("Error: " + e.getMessage());
            return ExitCodes.forError(e);
        }
    }

    private SimulationOptions options(SimulationObserver observer) {
        return SimulationOptions.builder()
            .includeOperators(!noOperators)
            .includeStepMetrics(!noStepMetrics)
            .observer(observer)
            .build();
    }
}
