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
import io.nosqlbench.hmmix.hmm.ForwardResult;
import io.nosqlbench.hmmix.hmm.HmmStatistics;
import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.Sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/// E-step of the two-level EM.
///
/// ## Per sequence
///
/// ```text
///   for each component k:
///       frame   = hmm_k.frameLogLikelihood(seq)
///       fwd     = hmm_k.forwardPass(frame)        -> logLik_k
///       bwd     = hmm_k.backwardPass(frame)
///       gamma   = posteriors(fwd, bwd)
///       curr[k] = logLik_k + log w_k
///       inner_k = hmm_k statistics from gamma, fwd, bwd
///
///   resp = exp(logNormalize(curr))
///   outer.componentWeights[k] += resp[k]
///   outer.hmm[k]              += resp[k] * inner_k
///   outer.logLikelihood       += logsumexp(curr)
/// ```
///
/// Inner statistics are unweighted; only the fold into the [Outer] record
/// applies the responsibilities.
public final class SufficientStatisticsAccumulator {

    private final List<ComponentHmm> hmms;
    private final double[] logWeights;
    private final Set<ParamGroup> params;

    /// @param hmms the components, in mixture order
    /// @param weights the current weights, snapshotted at construction
    /// @param params the groups the following M-step will update
    public SufficientStatisticsAccumulator(List<ComponentHmm> hmms, MixtureWeights weights, Set<ParamGroup> params) {
        if (hmms.size() != weights.size()) {
            throw new IllegalArgumentException("have " + hmms.size() + " HMMs for " + weights.size() + " weights");
        }
        this.hmms = hmms;
        this.logWeights = weights.logWeights();
        this.params = params;
    }

    /// Statistics for one iteration over the whole dataset.
    public static final class Outer {
        private final double[] componentWeights;
        private final List<HmmStatistics> hmmStatistics;
        private double logLikelihood;
        private int sequences;

        Outer(List<ComponentHmm> hmms) {
            this.componentWeights = new double[hmms.size()];
            List<HmmStatistics> stats = new ArrayList<>(hmms.size());
            for (ComponentHmm hmm : hmms) {
                stats.add(hmm.initStatistics());
            }
            this.hmmStatistics = Collections.unmodifiableList(stats);
        }

        /// Responsibility mass per component.
        public double[] componentWeights() {
            return componentWeights;
        }

        /// Responsibility-weighted statistics per component.
        public List<HmmStatistics> hmmStatistics() {
            return hmmStatistics;
        }

        /// Sum of the sequence log-likelihoods accumulated so far.
        public double logLikelihood() {
            return logLikelihood;
        }

        public int sequences() {
            return sequences;
        }
    }

    public Outer newOuter() {
        return new Outer(hmms);
    }

    /// Runs the E-step over every sequence of `dataset`.
    public Outer accumulateAll(Dataset dataset) {
        Outer outer = newOuter();
        for (Sequence sequence : dataset) {
            accumulate(outer, sequence);
        }
        return outer;
    }

    /// Adds one sequence to `outer`.
    ///
    /// @return the sequence's mixture log-likelihood
    public double accumulate(Outer outer, Sequence sequence) {
        int nComponents = hmms.size();
        double[] currLogProb = new double[nComponents];
        HmmStatistics[] inner = new HmmStatistics[nComponents];
        for (int k = 0; k < nComponents; k++) {
            ComponentHmm hmm = hmms.get(k);
            double[][] frameLogProb = hmm.frameLogLikelihood(sequence);
            ForwardResult forward = hmm.forwardPass(frameLogProb);
            double[][] bwd = hmm.backwardPass(frameLogProb);
            double[][] posteriors = ComponentHmm.posteriors(forward.lattice(), bwd);
            currLogProb[k] = forward.logLikelihood() + logWeights[k];
            inner[k] = hmm.initStatistics();
            hmm.accumulate(inner[k], sequence, frameLogProb, posteriors, forward.lattice(), bwd, params);
        }
        double[] responsibilities = LogSpace.exp(LogSpace.logNormalize(currLogProb));
        for (int k = 0; k < nComponents; k++) {
            outer.componentWeights[k] += responsibilities[k];
            if (responsibilities[k] > 0.0) {
                outer.hmmStatistics.get(k).addScaled(inner[k], responsibilities[k]);
            }
        }
        double logLikelihood = LogSpace.logSumExp(currLogProb);
        outer.logLikelihood += logLikelihood;
        outer.sequences++;
        return logLikelihood;
    }
}
