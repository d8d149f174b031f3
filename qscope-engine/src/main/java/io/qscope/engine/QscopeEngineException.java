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

/// Base type for every failure the engine reports.
///
/// The engine fails loudly with one of the typed subclasses and never retries
/// or substitutes a fallback result; mapping failures to user-facing output is
/// left to the calling layer.
public class QscopeEngineException extends RuntimeException {

    public QscopeEngineException(String message) {
        super(message);
    }

    public QscopeEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
