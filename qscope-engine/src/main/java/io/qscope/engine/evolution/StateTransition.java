package io.qscope.engine.evolution;

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

import io.qscope.engine.circuit.GateSpec;
import io.qscope.engine.state.StateVector;

/// One gate application: the state before and after.
///
/// @param step 1-based step index; step 0 is the initial state and has no transition
/// @param gate the applied gate
/// @param before state before the gate
/// @param after state after the gate
public record StateTransition(int step, GateSpec gate, StateVector before, StateVector after) {
}
