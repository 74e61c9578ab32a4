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

import io.nosqlbench.hmmix.hmm.ComponentHmm;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.trace.TrainingObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Two-level expectation-maximization for a [MixtureHmm].
///
/// ## Algorithm
///
/// Each iteration runs:
///
/// 1. **E-step**: [SufficientStatisticsAccumulator] runs forward-backward for
///    every component on every sequence and folds the per-component statistics
///    by responsibility.
/// 2. **Convergence check**: from the second iteration on, stop when
///    `|ll[i] - ll[i-1]| < thresh`. The M-step of that iteration is skipped.
/// 3. **M-step**: MAP update of the weights when [ParamGroup#MIXTURE_WEIGHTS]
///    is in `params`, then each HMM maximises its own statistics.
///
/// A log-likelihood that drops by more than [#DECREASE_TOLERANCE] is logged
/// at WARN and passed to the observer as a negative improvement.
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. It mutates the model it trains.
public final class EmTrainer {

    private static final Logger logger = LogManager.getLogger(EmTrainer.class);

    /// Decreases smaller than this are treated as rounding noise.
    public static final double DECREASE_TOLERANCE = 1e-6;

    private final MixtureHmmConfig config;
    private final TrainingObserver observer;
    private TrainingState state = TrainingState.UNINITIALIZED;

    public EmTrainer(MixtureHmmConfig config, TrainingObserver observer) {
        this.config = Objects.requireNonNull(config, "config");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public TrainingState state() {
        return state;
    }

    /// Initialises the groups named by `init_params`, then runs EM on `model`.
    ///
    /// The dataset must already have passed the family's validation.
    public FitResult train(MixtureHmm model, Dataset dataset) {
        state = TrainingState.INITIALIZING;
        model.initialize(dataset, config.getInitParams());
        observer.onFitStart(config, dataset.size());

        List<ComponentHmm> hmms = model.components();
        MixtureWeights weights = model.weights();
        Set<ParamGroup> params = config.getParams();
        List<Double> logLikelihoods = new ArrayList<>();
        boolean converged = false;

        for (int iteration = 0; iteration < config.getNIter(); iteration++) {
            state = TrainingState.EXPECTATION;
            SufficientStatisticsAccumulator accumulator = new SufficientStatisticsAccumulator(hmms, weights, params);
            SufficientStatisticsAccumulator.Outer stats = accumulator.accumulateAll(dataset);
            double logLikelihood = stats.logLikelihood();
            logLikelihoods.add(logLikelihood);

            state = TrainingState.CONVERGENCE_CHECK;
            double improvement = iteration > 0
                ? logLikelihood - logLikelihoods.get(iteration - 1)
                : Double.POSITIVE_INFINITY;
            if (improvement < -DECREASE_TOLERANCE) {
                logger.warn("Log-likelihood decreased by {} at iteration {} ({} -> {})",
                    -improvement, iteration + 1, logLikelihoods.get(iteration - 1), logLikelihood);
            }
            observer.onIterationComplete(iteration, logLikelihood, improvement);
            if (iteration > 0 && Math.abs(improvement) < config.getThresh()) {
                converged = true;
                break;
            }

            state = TrainingState.MAXIMIZATION;
            maximize(stats, hmms, weights, params);
        }

        state = converged ? TrainingState.CONVERGED : TrainingState.MAX_ITER_REACHED;
        FitResult result = new FitResult(logLikelihoods, state, logLikelihoods.size());
        logger.debug("EM finished in state {} after {} iterations", state, result.iterations());
        observer.onFitComplete(result);
        return result;
    }

    private void maximize(SufficientStatisticsAccumulator.Outer stats, List<ComponentHmm> hmms,
                          MixtureWeights weights, Set<ParamGroup> params) {
        if (params.contains(ParamGroup.MIXTURE_WEIGHTS)) {
            weights.maximize(stats.componentWeights());
            int[] floored = weights.flooredComponents();
            if (floored.length > 0) {
                logger.warn("Components {} received no responsibility; their weights sit at the floor",
                    Arrays.toString(floored));
            }
        }
        if (ParamGroup.anyHmmGroup(params)) {
            for (int k = 0; k < hmms.size(); k++) {
                hmms.get(k).maximize(stats.hmmStatistics().get(k), params);
            }
        }
    }
}
