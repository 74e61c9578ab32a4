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
import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.model.Sequence;

import java.util.List;

/// Computes per-sequence mixture log-likelihoods and component responsibilities.
///
/// For a sequence `x` and components `k`:
///
/// ```
/// joint[k]    = log P(x | hmm_k) + log w_k
/// logLik      = logsumexp(joint)
/// logResp[k]  = joint[k] - logLik
/// ```
///
/// When every component assigns zero probability the log-likelihood is
/// reported as `-Infinity` and the responsibilities fall back to the weights.
public final class ResponsibilityEngine {

    private final List<ComponentHmm> hmms;
    private final double[] logWeights;

    /// Binds to a snapshot of the weights; the HMM list is used as given.
    public ResponsibilityEngine(List<ComponentHmm> hmms, MixtureWeights weights) {
        if (hmms.size() != weights.size()) {
            throw new IllegalArgumentException("have " + hmms.size() + " HMMs for " + weights.size() + " weights");
        }
        this.hmms = hmms;
        this.logWeights = weights.logWeights();
    }

    public SequenceScore scoreOne(Sequence sequence) {
        double[] componentLogLik = new double[hmms.size()];
        for (int k = 0; k < componentLogLik.length; k++) {
            ComponentHmm hmm = hmms.get(k);
            componentLogLik[k] = hmm.forwardPass(hmm.frameLogLikelihood(sequence)).logLikelihood();
        }
        return combine(componentLogLik, logWeights);
    }

    /// Joins per-component log-likelihoods with log-weights into a [SequenceScore].
    public static SequenceScore combine(double[] componentLogLik, double[] logWeights) {
        double[] joint = new double[componentLogLik.length];
        for (int k = 0; k < joint.length; k++) {
            joint[k] = componentLogLik[k] + logWeights[k];
        }
        double logLikelihood = LogSpace.logSumExp(joint);
        if (logLikelihood == Double.NEGATIVE_INFINITY) {
            return new SequenceScore(logLikelihood, LogSpace.logNormalize(logWeights));
        }
        double[] logResponsibilities = new double[joint.length];
        for (int k = 0; k < joint.length; k++) {
            logResponsibilities[k] = joint[k] - logLikelihood;
        }
        return new SequenceScore(logLikelihood, logResponsibilities);
    }
}
