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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.Arrays;
import java.util.Objects;

/// HMM with exponentially distributed emissions, `log P(x | state) = log(rate) - rate * x`.
///
/// The M-step rate is expected occupancy over the posterior-weighted sum of
/// observations. A state whose observations sum to zero keeps its rate.
@EmissionType("exponential")
public final class ExponentialHmm extends ComponentHmm {

    /// Lower bound for any estimated rate.
    public static final double MIN_RATE = 1e-3;

    /// Standard deviation of the log-normal jitter applied per unit of `sqrt(ratesVar)`.
    private static final double LOG_JITTER = 0.25;

    @SerializedName("rates")
    private double[] rates;

    @SerializedName("rates_var")
    private double ratesVar = 1.0;

    public ExponentialHmm(int nStates) {
        super(nStates);
        this.rates = filled(nStates, 1.0);
    }

    private ExponentialHmm(ExponentialHmm other) {
        super(other);
        this.rates = other.rates.clone();
        this.ratesVar = other.ratesVar;
    }

    @Override
    public EmissionFamily family() {
        return EmissionFamily.EXPONENTIAL;
    }

    @Override
    public ExponentialHmm copy() {
        return new ExponentialHmm(this);
    }

    public double[] getRates() {
        return rates.clone();
    }

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

    public ExponentialHmm setRatesVar(double ratesVar) {
        if (!(ratesVar >= 0.0)) {
            throw new IllegalArgumentException("rates_var must be non-negative, got " + ratesVar);
        }
        this.ratesVar = ratesVar;
        return this;
    }

    @Override
    public double[][] frameLogLikelihood(Sequence sequence) {
        if (sequence.dimension() != 1) {
            throw new ShapeMismatchException("sequence",
                "exponential data must be 1-dimensional, got " + sequence.dimension());
        }
        int nStates = numStates();
        double[][] frames = new double[sequence.length()][nStates];
        for (int t = 0; t < sequence.length(); t++) {
            double x = sequence.value(t);
            for (int s = 0; s < nStates; s++) {
                frames[t][s] = x < 0.0 ? Double.NEGATIVE_INFINITY : Math.log(rates[s]) - rates[s] * x;
            }
        }
        return frames;
    }

    @Override
    public void checkCompatible(Dataset dataset) {
        if (dataset.dimension() != 1) {
            throw new ShapeMismatchException("dataset",
                "exponential data must be 1-dimensional, got " + dataset.dimension());
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
            if (obs[s] > 0.0) {
                rates[s] = Math.max(post[s] / obs[s], MIN_RATE);
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
        double mean = Math.max(total / dataset.totalLength(), MIN_RATE);
        double sigma = LOG_JITTER * Math.sqrt(ratesVar);
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        for (int s = 0; s < rates.length; s++) {
            rates[s] = Math.max(Math.exp(sigma * gaussian.sample()) / mean, MIN_RATE);
        }
    }

    @Override
    protected double[] sampleFrame(int state, UniformRandomProvider rng) {
        return new double[] {RandomGenerators.exponential(rng, 1.0 / rates[state])};
    }
}
