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
import io.qscope.command.common.CircuitFile;
import io.qscope.engine.circuit.Circuit;
import io.qscope.engine.circuit.CircuitComplexityAnalyzer;
import io.qscope.engine.circuit.CircuitNormalizer;
import io.qscope.engine.json.QscopeGsonConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Print statistics and complexity analysis of a circuit file without simulating it.
///
/// ```bash
/// qscope stats -i circuit.json
/// ```
@CommandLine.Command(
    name = "stats",
    header = "Show circuit statistics",
    description = "Reports gate counts, depth, density, complexity class, cost estimates and simplification hints.",
    exitCodeList = {
        "0: Success",
        "1: Error reading file",
        "2: Circuit rejected"
    }
)
public class CMD_qscope_stats implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_qscope_stats.class);

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Circuit JSON file",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--compact"},
        description = "Print single-line JSON"
    )
    private boolean compact = false;

    @Override
    public Integer call() {
        try {
            Circuit circuit = CircuitNormalizer.normalize(CircuitFile.read(inputPath).gates());
            Gson gson = compact ? QscopeGsonConfig.compactGson() : QscopeGsonConfig.gson();
            System.out.println(gson.toJson(CircuitComplexityAnalyzer.analyze(circuit)));
            return ExitCodes.OK;
        } catch (Exception e) {
            logger.debug("Error analyzing circuit {}", inputPath, e);
            System.err.println("Error: " + e.getMessage());
            return ExitCodes.forError(e);
        }
    }
}
