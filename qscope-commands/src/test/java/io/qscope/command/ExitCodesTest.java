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

import io.qscope.engine.InternalInvariantViolationException;
import io.qscope.engine.MalformedCircuitException;
import io.qscope.engine.ResourceLimitExceededException;
import io.qscope.engine.SimulationResult;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExitCodesTest {

    @Test
    void mapsErrorsToCodes() {
        assertThat(ExitCodes.forError(new MalformedCircuitException("bad"))).isEqualTo(ExitCodes.INVALID_INPUT);
        assertThat(ExitCodes.forError(new ResourceLimitExceededException(
            ResourceLimitExceededException.Resource.GATES, 200, 100))).isEqualTo(ExitCodes.INVALID_INPUT);
        assertThat(ExitCodes.forError(new IllegalArgumentException("x"))).isEqualTo(ExitCodes.INVALID_INPUT);
        assertThat(ExitCodes.forError(new InternalInvariantViolationException("norm", 1e-3)))
            .isEqualTo(ExitCodes.INTERNAL_ERROR);
        assertThat(ExitCodes.forError(new IOException("disk"))).isEqualTo(ExitCodes.ERROR);
    }

    @Test
    void fallbackResultIsGroundState() {
        SimulationResult result = SimulationResults.fallback("boom");
        assertThat(result.numQubits()).isEqualTo(1);
        assertThat(result.steps()).singleElement()
            .satisfies(step -> assertThat(step.explanation()).isEqualTo("Simulation error: boom"));
        assertThat(result.finalMetrics().purity()).isEqualTo(1.0);
    }

    @Test
    void umbrellaCommandListsSubcommands() {
        CommandLine cli = new CommandLine(new CMD_qscope());
        assertThat(cli.getSubcommands()).containsKeys("simulate", "stats", "generate");
    }
}
