package io.qscope.engine.circuit;

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

import io.qscope.engine.MalformedCircuitException;

import java.util.Locale;

/// The closed set of single-qubit gates the engine can apply.
///
/// Gate tokens from circuit input are resolved through [#fromToken(String, int)];
/// anything outside this set, including two-qubit tokens such as `CNOT`, is rejected.
public enum GateKind {

    /// Hadamard
    H("Hadamard"),
    /// Pauli-X (bit flip)
    X("Pauli-X"),
    /// Pauli-Y (bit and phase flip)
    Y("Pauli-Y"),
    /// Pauli-Z (phase flip)
    Z("Pauli-Z"),
    /// Identity
    I("Identity");

    private final String displayName;

    GateKind(String displayName) {
        this.displayName = displayName;
    }

    /// @return human-readable gate name, e.g. "Pauli-X"
    public String displayName() {
        return displayName;
    }

    /// Identity is excluded: removing it never changes a circuit, so it is
    /// reported separately by the complexity analysis.
    ///
    /// @return true for gates G with G·G = I that have a visible effect
    public boolean isNontrivialInvolution() {
        return this != I;
    }

    /// Resolves an input token to a gate kind.
    ///
    /// Matching ignores case and surrounding whitespace.
    ///
    /// @param token the gate token from circuit input
    /// @param gateIndex position of the gate in the input list, for error reporting
    /// @return the matching gate kind
    /// @throws MalformedCircuitException if the token is null or not a supported gate
    public static GateKind fromToken(String token, int gateIndex) {
        if (token == null || token.isBlank()) {
            throw new MalformedCircuitException("Gate " + gateIndex + " has no gate kind", token, gateIndex);
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (GateKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new MalformedCircuitException(
            "Unsupported gate '" + token + "' at index " + gateIndex
                + "; supported single-qubit gates are H, X, Y, Z, I",
            token, gateIndex);
    }
}
