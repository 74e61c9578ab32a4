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
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.Arrays;
import java.util.Objects;

/// HMM with Poisson-distributed count emissions.
///
/// `log P(x | state) = x log(rate) - rate - log(x!)`. Rates are the
/// posterior-weighted mean count per state, floored at [#MIN_RATE].
@EmissionType("poisson")
public final class PoissonHmm extends ComponentHmm {

    /// Lower bound for any estimated rate.
    public static final double MIN_RATE = 1e-3;

    @SerializedName("rates")
    private double[] rates;

    @SerializedName("rates_var")
    private double ratesVar = 1.0;

    public PoissonHmm(int nStates) {
        super(nStates);
        this.rates = filled(nStates, 1.0);
    }

    private PoissonHmm(PoissonHmm other) {
        super(other);
        this.rates = other.rates.clone();
        this.ratesVar = other.ratesVar;
    }

    @Override
    public EmissionFamily family() {
        return EmissionFamily.POISSON;
    }

    @Override
    public PoissonHmm copy() {
        return new PoissonHmm(this);
    }

    public double[] getRates() {
        return rates.clone();
    }

    /// @throws ShapeMismatchException if the length is not `numStates()`
    /// @throws IllegalArgumentException if a rate is not positive and finite
    public void setRates(double[] rates) {
        Objects.requireNonNull(rates, "rates");
        requireLength("rates", rates, numStates());
        for (double rate : rates) {
            if (!(rate > 0.0) || Double.isInfinite(rate)) {
                throw new IllegalArgumentException("'rates' must be positive and finite, got " + Arrays.toString(rates));
            }
        }
        this.rates = rates.clone();
    }

    public double getRatesVar() {
        return ratesVar;
    }

    /// Variance of the Gaussian spread added to the seed mean when rates are initialised.
    public PoissonHmm setRatesVar(double ratesVar) {
        if (!(ratesVar >= 0.0)) {
            throw new IllegalArgumentException("rates_var must be non-negative, got " + ratesVar);
        }
        this.ratesVar = ratesVar;
        return this;
    }

    @Override
    public double[][] frameLogLikelihood(Sequence sequence) {
        requireScalar(sequence.dimension());
        int nStates = numStates();
        double[] logRates = new double[nStates];
        for (int s = 0; s < nStates; s++) {
            logRates[s] = Math.log(rates[s]);
        }
        double[][] frames = new double[sequence.length()][nStates];
        for (int t = 0; t < sequence.length(); t++) {
            double x = sequence.value(t);
            double logFactorial = Gamma.logGamma(x + 1.0);
            for (int s = 0; s < nStates; s++) {
                frames[t][s] = x * logRates[s] - rates[s] - logFactorial;
            }
        }
        return frames;
    }

    @Override
    public void checkCompatible(Dataset dataset) {
        requireScalar(dataset.dimension());
    }

    private static void requireScalar(int dimension) {
        if (dimension != 1) {
            throw new ShapeMismatchException("sequence", "Poisson data must be 1-dimensional, got " + dimension);
        }
    }

    @Override
    public RateStatistics initStatistics() {
        return new RateStatistics(numStates());
    }

    @Override
    protected void accumulateEmissions(HmmStatistics stats, Sequence sequence, double[][] posteriors) {
        RateStatistics rateStats = (RateStatistics) stats;
        double[] post = rateStats.post();
        double[] obs = rateStats.obs();
        for (int t = 0; t < sequence.length(); t++) {
            double x = sequence.value(t);
            for (int s = 0; s < post.length; s++) {
                post[s] += posteriors[t][s];
                obs[s] += posteriors[t][s] * x;
            }
        }
    }

    @Override
    protected void maximizeEmissions(HmmStatistics stats) {
        RateStatistics rateStats = (RateStatistics) stats;
        double[] post = rateStats.post();
        double[] obs = rateStats.obs();
        for (int s = 0; s < rates.length; s++) {
            if (post[s] > 0.0) {
                rates[s] = Math.max(obs[s] / post[s], MIN_RATE);
            }
        }
    }

    @Override
    protected void initializeEmissions(Dataset dataset, UniformRandomProvider rng) {
        double total = 0.0;
        for (Sequence sequence : dataset) {
            for (int t = 0; t < sequence.length(); t++) {
                total += sequence.value(t);
            }
        }
        double mean = total / dataset.totalLength();
        double spread = Math.sqrt(ratesVar);
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        for (int s = 0; s < rates.length; s++) {
            rates[s] = Math.max(mean + spread * gaussian.sample(), MIN_RATE);
        }
    }

    @Override
    protected double[] sampleFrame(int state, UniformRandomProvider rng) {
        return new double[] {RandomGenerators.poisson(rng, rates[state])};
    }
}
