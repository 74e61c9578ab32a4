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


package io.nosqlbench.hmmix.hmm;

/// Statistics for single-rate emissions (Poisson and exponential).
public final class RateStatistics extends HmmStatistics {

    private final double[] post;
    private final double[] obs;

    public RateStatistics(int nStates) {
        super(nStates);
        this.post = new double[nStates];
        this.obs = new double[nStates];
    }

    /// Expected number of frames spent in each state.
    public double[] post() {
        return post;
    }

    /// Posterior-weighted sum of observations per state.
    public double[] obs() {
        return obs;
    }

    @Override
    protected void addEmissionsScaled(HmmStatistics other, double weight) {
        RateStatistics that = (RateStatistics) other;
        addScaled(post, that.post, weight);
        addScaled(obs, that.obs, weight);
    }
}
