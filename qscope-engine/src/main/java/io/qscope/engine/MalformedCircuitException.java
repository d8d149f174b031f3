package io.qscope.engine;

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

/// Exception thrown when a circuit contains something the engine cannot apply.
/// This covers unknown gate tokens (including two-qubit tokens such as `CNOT`),
/// negative qubit indices or positions, and missing gate entries.
public class MalformedCircuitException extends QscopeEngineException {

    private final String token;
    private final int gateIndex;

    public MalformedCircuitException(String message, String token, int gateIndex) {
        super(message);
        this.token = token;
        this.gateIndex = gateIndex;
    }

    public MalformedCircuitException(String message) {
        this(message, null, -1);
    }

    /// @return the offending gate token, or null when the problem is not a token
    public String getToken() {
        return token;
    }

    /// @return index of the offending gate in the input list, or -1 if not applicable
    public int getGateIndex() {
        return gateIndex;
    }
}
