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

/// Exception thrown when a numerical invariant of the engine itself fails, for example a
/// reduced density matrix whose trace drifts from 1 or which is not Hermitian.
///
/// This signals a defect in the engine rather than bad input. Callers should log it and
/// present a generic failure instead of the message.
public class InternalInvariantViolationException extends QscopeEngineException {

    private final double deviation;

    public InternalInvariantViolationException(String message, double deviation) {
        super(message);
        this.deviation = deviation;
    }

    /// @return the measured distance from the expected value
    public double getDeviation() {
        return deviation;
    }
}
