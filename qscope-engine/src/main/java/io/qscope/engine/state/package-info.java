/// Quantum state representations.
///
/// Basis index bit `b` is the value of qubit `b`; labels print qubit n-1 first.
///
/// ## Key Components
///
/// - {@link io.qscope.engine.state.StateVector}: pure register state
/// - {@link io.qscope.engine.state.DensityMatrix}: reduced states from partial traces
/// - {@link io.qscope.engine.state.PartialTrace}: reduction and per-qubit Bloch vectors
package io.qscope.engine.state;

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
