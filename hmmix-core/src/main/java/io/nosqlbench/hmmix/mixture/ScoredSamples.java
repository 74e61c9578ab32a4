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

import io.nosqlbench.hmmix.math.LogSpace;

/// Per-sequence scores for a dataset, in input order.
///
/// @param logLikelihoods mixture log-likelihood of each sequence
/// @param responsibilities `responsibilities[i][k]`, posterior probability that sequence `i` came from component `k`
public record ScoredSamples(double[] logLikelihoods, double[][] responsibilities) {

    public int size() {
        return logLikelihoods.length;
    }

    /// Most responsible component per sequence, lowest index on ties.
    public int[] predictions() {
        int[] labels = new int[responsibilities.length];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = LogSpace.argmax(responsibilities[i]);
        }
        return labels;
    }
}
