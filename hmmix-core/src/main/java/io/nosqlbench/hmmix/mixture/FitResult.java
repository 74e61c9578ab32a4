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

import java.util.List;

/// Outcome of a training run.
///
/// @param logLikelihoods total dataset log-likelihood after each expectation step, in order
/// @param state the terminal state, [TrainingState#CONVERGED] or [TrainingState#MAX_ITER_REACHED]
/// @param iterations number of expectation steps run
public record FitResult(List<Double> logLikelihoods, TrainingState state, int iterations) {

    public FitResult {
        logLikelihoods = List.copyOf(logLikelihoods);
    }

    public boolean converged() {
        return state == TrainingState.CONVERGED;
    }

    /// Log-likelihood from the last expectation step, `NaN` if none ran.
    public double finalLogLikelihood() {
        return logLikelihoods.isEmpty() ? Double.NaN : logLikelihoods.get(logLikelihoods.size() - 1);
    }

    /// Number of maximization steps applied; a converged run skips the M-step of its last iteration.
    public int maximizationSteps() {
        return converged() ? iterations - 1 : iterations;
    }
}
