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

import io.qscope.engine.EngineConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/// Engine configuration options, shared as a picocli mixin.
///
/// Values from `--config` are loaded first; `--max-qubits` and `--max-gates`
/// override them.
public class EngineConfigOption {

    @CommandLine.Option(
        names = {"--config"},
        description = "Engine configuration JSON file (max_qubits, max_gates, invariant_tolerance, operator_export_qubit_limit)"
    )
    private Path configPath;

    @CommandLine.Option(
        names = {"--max-qubits"},
        description = "Largest qubit count to simulate, at most 12 (default: from config or 10)"
    )
    private Integer maxQubits;

    @CommandLine.Option(
        names = {"--max-gates"},
        description = "Largest gate count to simulate (default: from config or 100)"
    )
    private Integer maxGates;

    /// Resolves the effective configuration.
    ///
    /// @return the configuration with overrides applied
    /// @throws IOException if the configuration file cannot be read
    public EngineConfig resolve() throws IOException {
        EngineConfig config = configPath != null ? EngineConfig.load(configPath) : EngineConfig.defaults();
        if (maxQubits != null) {
            config = config.withMaxQubits(maxQubits);
        }
        if (maxGates != null) {
            config = config.withMaxGates(maxGates);
        }
        return config;
    }
}
