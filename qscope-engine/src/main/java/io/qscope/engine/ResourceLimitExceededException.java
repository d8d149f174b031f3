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

/// Exception thrown before allocation when a circuit exceeds a configured ceiling.
public class ResourceLimitExceededException extends QscopeEngineException {

    /// Which ceiling was exceeded.
    public enum Resource {
        QUBITS,
        GATES
    }

    private final Resource resource;
    private final int requested;
    private final int limit;

    public ResourceLimitExceededException(Resource resource, int requested, int limit) {
        super(String.format("Circuit requires %d %s, maximum is %d",
              requested, resource.name().toLowerCase(), limit));
        this.resource = resource;
        this.requested = requested;
        this.limit = limit;
    }

    public Resource getResource() {
        return resource;
    }

    public int getRequested() {
        return requested;
    }

    public int getLimit() {
        return limit;
    }
}
