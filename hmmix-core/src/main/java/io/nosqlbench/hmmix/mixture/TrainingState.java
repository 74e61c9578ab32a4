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


package io.nosqlbench.hmmix.mixture;

/// Lifecycle of one [EmTrainer] run.
///
/// ```text
/// UNINITIALIZED -> INITIALIZING -> EXPECTATION -> CONVERGENCE_CHECK -> MAXIMIZATION -> EXPECTATION ...
///                                                        |                  |
///                                                        v                  v
///                                                    CONVERGED      MAX_ITER_REACHED
/// ```
///
/// Both terminal states are successful outcomes.
public enum TrainingState {
    UNINITIALIZED,
    INITIALIZING,
    EXPECTATION,
    CONVERGENCE_CHECK,
    MAXIMIZATION,
    CONVERGED,
    MAX_ITER_REACHED;

    public boolean isTerminal() {
        return this == CONVERGED || this == MAX_ITER_REACHED;
    }
}
