package io.qscope.command.common;

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

import picocli.CommandLine;

/// Random seed option, shared as a picocli mixin.
public class RandomSeedOption {

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for generation (default: current time)"
    )
    private Long seed;

    /// @return the explicit seed, or the current time when none was given
    public long getSeed() {
        return seed != null ? seed : System.currentTimeMillis();
    }

    public boolean isSeedSpecified() {
        return seed != null;
    }

    @Override
    public String toString() {
        return seed != null ? String.valueOf(seed) : "auto (time-based)";
    }
}
