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

/// Statistics for Gaussian emissions.
///
/// Spherical and diagonal covariances need only the per-feature second moments
/// in [#obsSquared()]; tied and full covariances need the outer products in
/// [#obsOuter()]. Only the field matching [#covarianceType()] is filled.
public final class GaussianStatistics extends HmmStatistics {

    private final CovarianceType covarianceType;
    private final double[] post;
    private final double[][] obs;
    private final double[][] obsSquared;
    private final double[][][] obsOuter;

    public GaussianStatistics(int nStates, int nFeatures, CovarianceType covarianceType) {
        super(nStates);
        this.covarianceType = covarianceType;
        this.post = new double[nStates];
        this.obs = new double[nStates][nFeatures];
        this.obsSquared = new double[nStates][nFeatures];
        this.obsOuter = new double[nStates][nFeatures][nFeatures];
    }

    public CovarianceType covarianceType() {
        return covarianceType;
    }

    public double[] post() {
        return post;
    }

    /// `obs[state][feature]`: posterior-weighted observation sums.
    public double[][] obs() {
        return obs;
    }

    /// `obsSquared[state][feature]`: posterior-weighted squared observations.
    public double[][] obsSquared() {
        return obsSquared;
    }

    /// `obsOuter[state][a][b]`: posterior-weighted `x[a] * x[b]`.
    public double[][][] obsOuter() {
        return obsOuter;
    }

    @Override
    protected void addEmissionsScaled(HmmStatistics other, double weight) {
        GaussianStatistics that = (GaussianStatistics) other;
        addScaled(post, that.post, weight);
        addScaled(obs, that.obs, weight);
        if (covarianceType.isDiagonal()) {
            addScaled(obsSquared, that.obsSquared, weight);
        } else {
            for (int s = 0; s < obsOuter.length; s++) {
                addScaled(obsOuter[s], that.obsOuter[s], weight);
            }
        }
    }
}
