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


package io.nosqlbench.hmmix.trace;

import io.nosqlbench.hmmix.checkpoint.HmmixGsonConfig;
import io.nosqlbench.hmmix.mixture.FitResult;
import io.nosqlbench.hmmix.mixture.MixtureHmmConfig;

/// Observer interface for monitoring mixture training progress.
///
/// ## Lifecycle
///
/// ```text
///   ┌────────────┐
///   │ onFitStart │ ──► once, after validation and initialisation
///   └────────────┘
///         │
///         ▼
///   ┌─────────────────────┐
///   │ onIterationComplete │ ──► after each expectation step
///   │ (n_iter times max)  │     improvement is +Infinity on the first one
///   └─────────────────────┘
///         │
///         ▼
///   ┌───────────────┐
///   │ onFitComplete │ ──► once, with the terminal state
///   └───────────────┘
/// ```
///
/// A negative improvement means the log-likelihood went down. Observers get it
/// as reported; nothing is clamped.
///
/// ## Thread Safety
///
/// Training is single-threaded, so callbacks arrive from one thread in order.
public interface TrainingObserver {

    /// Observer that ignores every event.
    TrainingObserver NOOP = new TrainingObserver() {
        @Override
        public void onFitStart(MixtureHmmConfig config, int sequences) {
        }

        @Override
        public void onIterationComplete(int iteration, double logLikelihood, double improvement) {
        }

        @Override
        public void onFitComplete(FitResult result) {
        }
    };

    /// @param config the configuration training runs with
    /// @param sequences number of sequences in the dataset
    void onFitStart(MixtureHmmConfig config, int sequences);

    /// @param iteration zero-based iteration index
    /// @param logLikelihood total dataset log-likelihood from this iteration's expectation step
    /// @param improvement change from the previous iteration, `+Infinity` for the first
    void onIterationComplete(int iteration, double logLikelihood, double improvement);

    void onFitComplete(FitResult result);

    /// Returns an observer that forwards every event to `this`, then to `other`.
    default TrainingObserver andThen(TrainingObserver other) {
        TrainingObserver first = this;
        return new TrainingObserver() {
            @Override
            public void onFitStart(MixtureHmmConfig config, int sequences) {
                first.onFitStart(config, sequences);
                other.onFitStart(config, sequences);
            }

            @Override
            public void onIterationComplete(int iteration, double logLikelihood, double improvement) {
                first.onIterationComplete(iteration, logLikelihood, improvement);
                other.onIterationComplete(iteration, logLikelihood, improvement);
            }

            @Override
            public void onFitComplete(FitResult result) {
                first.onFitComplete(result);
                other.onFitComplete(result);
            }
        };
    }

    /// Formats an event as a single-line JSON string.
    static String toCompactJson(Object state) {
        return HmmixGsonConfig.compactGson().toJson(state);
    }
}
