package io.qscope.command;

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

import io.qscope.command.subcommands.CMD_qscope_generate;
import io.qscope.command.subcommands.CMD_qscope_simulate;
import io.qscope.command.subcommands.CMD_qscope_stats;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Umbrella command for simulating, inspecting and generating circuits.
///
/// ```bash
/// qscope simulate -i bell.json --no-operators
/// qscope stats -i bell.json
/// qscope generate --qubits 3 --gates 12 --seed 7 -o random.json
/// ```
@CommandLine.Command(name = "qscope",
    header = "Step-by-step state-vector simulation of single-qubit circuits",
    description = "Contains subcommands to simulate circuits, report circuit statistics and generate test circuits",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_qscope_simulate.class,
        CMD_qscope_stats.class,
        CMD_qscope_generate.class
    })
public class CMD_qscope implements Callable<Integer> {

    /// Run CMD_qscope
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_qscope()).execute(args));
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
