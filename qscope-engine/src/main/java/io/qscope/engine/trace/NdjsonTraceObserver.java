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

import io.qscope.engine.SimulationResult;
import io.qscope.engine.SimulationStep;
import io.qscope.engine.circuit.Circuit;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/// SimulationObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// ```json
/// {"event":"simulation_start","num_qubits":2,"gate_count":3,"timestamp":1234567890}
/// {"event":"step","step":0,"operation":"initialization","probabilities":[1.0,0.0,0.0,0.0],"timestamp":1234567891}
/// {"event":"simulation_complete","steps":4,"purity":0.5,"von_neumann_entropy":1.0,"timestamp":1234567892}
/// ```
///
/// Step events carry the probabilities only; the full step is in the simulation result.
///
/// ## Thread Safety
///
/// Writes are synchronized, so one observer may be shared by concurrent simulations.
public final class NdjsonTraceObserver implements SimulationObserver, Closeable {

    private final BufferedWriter writer;
    private final Object writeLock = new Object();

    /// @param outputPath file to write, truncated if it exists
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonTraceObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    /// @param writer the writer to use (caller retains ownership)
    public NdjsonTraceObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw)
            ? bw
            : new BufferedWriter(writer);
    }

    @Override
    public void onSimulationStart(Circuit circuit) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "simulation_start");
        event.put("num_qubits", circuit.numQubits());
        event.put("gate_count", circuit.gateCount());
        writeEvent(event);
    }

    @Override
    public void onStep(SimulationStep step) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "step");
        event.put("step", step.step());
        event.put("operation", step.operation());
        if (step.gate() != null) {
            event.put("qubit", step.gate().qubit());
        }
        event.put("probabilities", step.measurementProbabilities());
        writeEvent(event);
    }

    @Override
    public void onSimulationComplete(SimulationResult result) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "simulation_complete");
        event.put("steps", result.steps().size());
        event.put("purity", result.finalMetrics().purity());
        event.put("von_neumann_entropy", result.finalMetrics().vonNeumannEntropy());
        writeEvent(event);
    }

    private void writeEvent(Map<String, Object> event) {
        event.put("timestamp", System.currentTimeMillis());
        synchronized (writeLock) {
            try {
                writer.write(SimulationObserver.toCompactJson(event));
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write trace event", e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
