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
import io.qscope.engine.QscopeEngineException;

/// Process exit codes shared by all subcommands.
public final class ExitCodes {

    public static final int OK = 0;
    /// I/O failures and anything unexpected
    public static final int ERROR = 1;
    /// The circuit or configuration was rejected
    public static final int INVALID_INPUT = 2;
    /// The engine detected a numerical defect in itself
    public static final int INTERNAL_ERROR = 3;

    private ExitCodes() {
        // Utility class
    }

    /// @param error a failure raised while running a command
    /// @return the exit code to report for it
    public static int forError(Throwable error) {
        if (error instanceof InternalInvariantViolationException) {
            return INTERNAL_ERROR;
        }
        if (error instanceof QscopeEngineException || error instanceof IllegalArgumentException) {
            return INVALID_INPUT;
        }
        return ERROR;
    }
}
