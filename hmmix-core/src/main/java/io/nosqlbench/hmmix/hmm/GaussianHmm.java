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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.hmmix.checkpoint.EmissionType;
import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.Sequence;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.Arrays;
import java.util.Objects;

/// HMM with multivariate Gaussian emissions.
///
/// ## Covariance storage
///
/// Covariances are always held as one `F x F` matrix per state, whatever the
/// [CovarianceType]. The type constrains what the M-step produces and what
/// [#setCovars(double[][][])] accepts:
///
/// | Type | Constraint |
/// |------|------------|
/// | `SPHERICAL` | diagonal with one shared variance per state |
/// | `DIAG` | diagonal |
/// | `TIED` | the same matrix for every state |
/// | `FULL` | any symmetric positive-definite matrix |
///
/// Every M-step adds `minCovar` to the diagonal.
///
/// ## Densities
///
/// Each state's covariance is factored as `L Lᵀ` (closed form for diagonal
/// types, commons-math3 [CholeskyDecomposition] otherwise). The factors are
/// cached until the covariances change.
@EmissionType("gaussian")
public final class GaussianHmm extends ComponentHmm {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    /// States with less expected occupancy keep their previous parameters.
    private static final double MIN_OCCUPANCY = 1e-12;

    @SerializedName("n_features")
    private final int nFeatures;

    @SerializedName("covariance_type")
    private final CovarianceType covarianceType;

    @SerializedName("means")
    private double[][] means;

    @SerializedName("covars")
    private double[][][] covars;

    @SerializedName("means_var")
    private double meansVar = 1.0;

    @SerializedName("min_covar")
    private double minCovar = 1e-3;

    private transient double[][][] choleskyFactors;
    private transient double[] logDeterminants;

    public GaussianHmm(int nStates, int nFeatures, CovarianceType covarianceType) {
        super(nStates);
        if (nFeatures < 1) {
            throw new IllegalArgumentException("n_features must be positive, got " + nFeatures);
        }
        this.nFeatures = nFeatures;
        this.covarianceType = Objects.requireNonNull(covarianceType, "covarianceType");
        this.means = new double[nStates][nFeatures];
        this.covars = new double[nStates][][];
        for (int s = 0; s < nStates; s++) {
            covars[s] = identity(nFeatures);
        }
    }

    private GaussianHmm(GaussianHmm other) {
        super(other);
        this.nFeatures = other.nFeatures;
        this.covarianceType = other.covarianceType;
        this.means = deepCopy(other.means);
        this.covars = new double[other.covars.length][][];
        for (int s = 0; s < covars.length; s++) {
            covars[s] = deepCopy(other.covars[s]);
        }
        this.meansVar = other.meansVar;
        this.minCovar = other.minCovar;
    }

    @Override
    public EmissionFamily family() {
        return EmissionFamily.GAUSSIAN;
    }

    @Override
    public GaussianHmm copy() {
        return new GaussianHmm(this);
    }

    public int numFeatures() {
        return nFeatures;
    }

    public CovarianceType getCovarianceType() {
        return covarianceType;
    }

    public double[][] getMeans() {
        return deepCopy(means);
    }

    /// Per-state full covariance matrices, `covars[state][a][b]`.
    public double[][][] getCovars() {
        double[][][] copy = new double[covars.length][][];
        for (int s = 0; s < copy.length; s++) {
            copy[s] = deepCopy(covars[s]);
        }
        return copy;
    }

    public void setMeans(double[][] means) {
        Objects.requireNonNull(means, "means");
        if (means.length != numStates()) {
            throw new ShapeMismatchException("means", "must have " + numStates() + " rows, got " + means.length);
        }
        for (double[] row : means) {
            requireLength("means", row, nFeatures);
        }
        this.means = deepCopy(means);
    }

    /// @throws ShapeMismatchException unless the shape is `numStates() x F x F`
    /// @throws IllegalArgumentException if a matrix is not symmetric positive-definite or
    ///     breaks the structure of the covariance type
    public void setCovars(double[][][] covars) {
        Objects.requireNonNull(covars, "covars");
        if (covars.length != numStates()) {
            throw new ShapeMismatchException("covars", "must have " + numStates() + " matrices, got " + covars.length);
        }
        double[][][] copy = new double[covars.length][][];
        for (int s = 0; s < covars.length; s++) {
            if (covars[s].length != nFeatures) {
                throw new ShapeMismatchException("covars", "matrices must be " + nFeatures + " x " + nFeatures);
            }
            for (double[] row : covars[s]) {
                requireLength("covars", row, nFeatures);
            }
            requireStructure(covars[s], covars[0]);
            factor(covars[s]);
            copy[s] = deepCopy(covars[s]);
        }
        this.covars = copy;
        invalidateFactors();
    }

    private void requireStructure(double[][] covar, double[][] first) {
        for (int a = 0; a < nFeatures; a++) {
            for (int b = 0; b < nFeatures; b++) {
                if (covarianceType.isDiagonal() && a != b && covar[a][b] != 0.0) {
                    throw new IllegalArgumentException(covarianceType + " covariances must be diagonal");
                }
                if (covarianceType == CovarianceType.TIED && covar[a][b] != first[a][b]) {
                    throw new IllegalArgumentException("tied covariances must be identical for every state");
                }
            }
            if (covarianceType == CovarianceType.SPHERICAL && covar[a][a] != covar[0][0]) {
                throw new IllegalArgumentException("spherical covariances must share one variance per state");
            }
        }
    }

    public double getMeansVar() {
        return meansVar;
    }

    /// Spread of the initial means around the seed mean, in units of the seed variance.
    public GaussianHmm setMeansVar(double meansVar) {
        if (!(meansVar >= 0.0)) {
            throw new IllegalArgumentException("means_var must be non-negative, got " + meansVar);
        }
        this.meansVar = meansVar;
        return this;
    }

    public double getMinCovar() {
        return minCovar;
    }

    public GaussianHmm setMinCovar(double minCovar) {
        if (!(minCovar >= 0.0)) {
            throw new IllegalArgumentException("min_covar must be non-negative, got " + minCovar);
        }
        this.minCovar = minCovar;
        return this;
    }

    private void invalidateFactors() {
        choleskyFactors = null;
        logDeterminants = null;
    }

    private void ensureFactors() {
        if (choleskyFactors != null) {
            return;
        }
        double[][][] factors = new double[covars.length][][];
        double[] logDets = new double[covars.length];
        for (int s = 0; s < covars.length; s++) {
            factors[s] = factor(covars[s]);
            double logDet = 0.0;
            for (int d = 0; d < nFeatures; d++) {
                logDet += 2.0 * Math.log(factors[s][d][d]);
            }
            logDets[s] = logDet;
        }
        choleskyFactors = factors;
        logDeterminants = logDets;
    }

    /// Lower-triangular `L` with `L Lᵀ = covar`.
    private double[][] factor(double[][] covar) {
        if (covarianceType.isDiagonal()) {
            double[][] lower = new double[nFeatures][nFeatures];
            for (int d = 0; d < nFeatures; d++) {
                if (!(covar[d][d] > 0.0) || Double.isInfinite(covar[d][d])) {
                    throw new IllegalArgumentException("variances must be positive and finite, got " + covar[d][d]);
                }
                lower[d][d] = Math.sqrt(covar[d][d]);
            }
            return lower;
        }
        try {
            return new CholeskyDecomposition(MatrixUtils.createRealMatrix(covar)).getL().getData();
        } catch (MathIllegalArgumentException e) {
            throw new IllegalArgumentException("covariance must be symmetric positive-definite", e);
        }
    }

    @Override
    public double[][] frameLogLikelihood(Sequence sequence) {
        requireDimension("sequence", sequence.dimension());
        ensureFactors();
        int nStates = numStates();
        double[][] frames = new double[sequence.length()][nStates];
        double[] centered = new double[nFeatures];
        for (int t = 0; t < sequence.length(); t++) {
            for (int s = 0; s < nStates; s++) {
                for (int d = 0; d < nFeatures; d++) {
                    centered[d] = sequence.get(t, d) - means[s][d];
                }
                double mahalanobis = solveLowerSquaredNorm(choleskyFactors[s], centered);
                frames[t][s] = -0.5 * (nFeatures * LOG_2PI + logDeterminants[s] + mahalanobis);
            }
        }
        return frames;
    }

    /// `|y|²` where `L y = x`, by forward substitution.
    private static double solveLowerSquaredNorm(double[][] lower, double[] x) {
        double[] y = new double[x.length];
        double norm = 0.0;
        for (int i = 0; i < x.length; i++) {
            double sum = x[i];
            for (int k = 0; k < i; k++) {
                sum -= lower[i][k] * y[k];
            }
            y[i] = sum / lower[i][i];
            norm += y[i] * y[i];
        }
        return norm;
    }

    private void requireDimension(String argument, int dimension) {
        if (dimension != nFeatures) {
            throw new ShapeMismatchException(argument,
                "has dimension " + dimension + " but the model has " + nFeatures + " features");
        }
    }

    @Override
    public void checkCompatible(Dataset dataset) {
        requireDimension("dataset", dataset.dimension());
    }

    @Override
    public GaussianStatistics initStatistics() {
        return new GaussianStatistics(numStates(), nFeatures, covarianceType);
    }

    @Override
    protected void accumulateEmissions(HmmStatistics stats, Sequence sequence, double[][] posteriors) {
        GaussianStatistics gaussianStats = (GaussianStatistics) stats;
        double[] post = gaussianStats.post();
        double[][] obs = gaussianStats.obs();
        double[][] obsSquared = gaussianStats.obsSquared();
        double[][][] obsOuter = gaussianStats.obsOuter();
        for (int t = 0; t < sequence.length(); t++) {
            double[] x = sequence.frame(t);
            for (int s = 0; s < post.length; s++) {
                double gamma = posteriors[t][s];
                post[s] += gamma;
                for (int a = 0; a < nFeatures; a++) {
                    obs[s][a] += gamma * x[a];
                    if (covarianceType.isDiagonal()) {
                        obsSquared[s][a] += gamma * x[a] * x[a];
                    } else {
                        for (int b = 0; b < nFeatures; b++) {
                            obsOuter[s][a][b] += gamma * x[a] * x[b];
                        }
                    }
                }
            }
        }
    }

    @Override
    protected void maximizeEmissions(HmmStatistics stats) {
        GaussianStatistics gaussianStats = (GaussianStatistics) stats;
        double[] post = gaussianStats.post();
        double[][] obs = gaussianStats.obs();
        int nStates = numStates();
        for (int s = 0; s < nStates; s++) {
            if (post[s] > MIN_OCCUPANCY) {
                for (int d = 0; d < nFeatures; d++) {
                    means[s][d] = obs[s][d] / post[s];
                }
            }
        }
        switch (covarianceType) {
            case SPHERICAL, DIAG -> maximizeDiagonal(gaussianStats);
            case FULL -> maximizeFull(gaussianStats);
            case TIED -> maximizeTied(gaussianStats);
        }
        invalidateFactors();
    }

    private void maximizeDiagonal(GaussianStatistics stats) {
        double[] post = stats.post();
        double[][] obs = stats.obs();
        double[][] obsSquared = stats.obsSquared();
        for (int s = 0; s < post.length; s++) {
            if (post[s] <= MIN_OCCUPANCY) {
                continue;
            }
            double[] variances = new double[nFeatures];
            for (int d = 0; d < nFeatures; d++) {
                double mean = means[s][d];
                double second = obsSquared[s][d] - 2.0 * mean * obs[s][d] + mean * mean * post[s];
                variances[d] = Math.max(second / post[s], 0.0) + minCovar;
            }
            if (covarianceType == CovarianceType.SPHERICAL) {
                double average = 0.0;
                for (double variance : variances) {
                    average += variance;
                }
                Arrays.fill(variances, average / nFeatures);
            }
            covars[s] = diagonal(variances);
        }
    }

    private void maximizeFull(GaussianStatistics stats) {
        double[] post = stats.post();
        for (int s = 0; s < post.length; s++) {
            if (post[s] <= MIN_OCCUPANCY) {
                continue;
            }
            double[][] scatter = scatter(stats, s);
            for (int a = 0; a < nFeatures; a++) {
                for (int b = 0; b < nFeatures; b++) {
                    scatter[a][b] /= post[s];
                }
                scatter[a][a] += minCovar;
            }
            covars[s] = scatter;
        }
    }

    private void maximizeTied(GaussianStatistics stats) {
        double[] post = stats.post();
        double total = 0.0;
        double[][] pooled = new double[nFeatures][nFeatures];
        for (int s = 0; s < post.length; s++) {
            total += post[s];
            double[][] scatter = scatter(stats, s);
            for (int a = 0; a < nFeatures; a++) {
                for (int b = 0; b < nFeatures; b++) {
                    pooled[a][b] += scatter[a][b];
                }
            }
        }
        if (total <= MIN_OCCUPANCY) {
            return;
        }
        for (int a = 0; a < nFeatures; a++) {
            for (int b = 0; b < nFeatures; b++) {
                pooled[a][b] /= total;
            }
            pooled[a][a] += minCovar;
        }
        for (int s = 0; s < covars.length; s++) {
            covars[s] = deepCopy(pooled);
        }
    }

    /// Posterior-weighted scatter of state `s` around its current mean, kept exactly symmetric.
    private double[][] scatter(GaussianStatistics stats, int s) {
        double post = stats.post()[s];
        double[] obs = stats.obs()[s];
        double[][] outer = stats.obsOuter()[s];
        double[] mean = means[s];
        double[][] scatter = new double[nFeatures][nFeatures];
        for (int a = 0; a < nFeatures; a++) {
            for (int b = a; b < nFeatures; b++) {
                double value = outer[a][b] - obs[a] * mean[b] - mean[a] * obs[b] + post * mean[a] * mean[b];
                scatter[a][b] = value;
                scatter[b][a] = value;
            }
            scatter[a][a] = Math.max(scatter[a][a], 0.0);
        }
        return scatter;
    }

    @Override
    protected void initializeEmissions(Dataset dataset, UniformRandomProvider rng) {
        requireDimension("dataset", dataset.dimension());
        double[] sum = new double[nFeatures];
        double[] sumSquares = new double[nFeatures];
        int count = dataset.totalLength();
        for (Sequence sequence : dataset) {
            for (int t = 0; t < sequence.length(); t++) {
                for (int d = 0; d < nFeatures; d++) {
                    double x = sequence.get(t, d);
                    sum[d] += x;
                    sumSquares[d] += x * x;
                }
            }
        }
        double[] mean = new double[nFeatures];
        double[] variance = new double[nFeatures];
        for (int d = 0; d < nFeatures; d++) {
            mean[d] = sum[d] / count;
            variance[d] = Math.max(sumSquares[d] / count - mean[d] * mean[d], 0.0) + minCovar;
        }
        if (covarianceType == CovarianceType.SPHERICAL) {
            double average = 0.0;
            for (double v : variance) {
                average += v;
            }
            Arrays.fill(variance, average / nFeatures);
        }
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        for (int s = 0; s < means.length; s++) {
            for (int d = 0; d < nFeatures; d++) {
                means[s][d] = mean[d] + Math.sqrt(meansVar * variance[d]) * gaussian.sample();
            }
            covars[s] = diagonal(variance);
        }
        invalidateFactors();
    }

    @Override
    protected double[] sampleFrame(int state, UniformRandomProvider rng) {
        ensureFactors();
        double[][] lower = choleskyFactors[state];
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        double[] z = new double[nFeatures];
        for (int d = 0; d < nFeatures; d++) {
            z[d] = gaussian.sample();
        }
        double[] x = means[state].clone();
        for (int a = 0; a < nFeatures; a++) {
            for (int b = 0; b <= a; b++) {
                x[a] += lower[a][b] * z[b];
            }
        }
        return x;
    }

    private static double[][] identity(int n) {
        double[][] matrix = new double[n][n];
        for (int d = 0; d < n; d++) {
            matrix[d][d] = 1.0;
        }
        return matrix;
    }

    private static double[][] diagonal(double[] values) {
        double[][] matrix = new double[values.length][values.length];
        for (int d = 0; d < values.length; d++) {
            matrix[d][d] = values[d];
        }
        return matrix;
    }
}
