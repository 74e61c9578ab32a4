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
import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.Sequence;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/// HMM with discrete emissions over the symbols `0..nSymbols-1`.
///
/// ## Emission model
///
/// `P(x = m | state = s) = emissionProb[s][m]`. Each row has a Dirichlet
/// prior; the M-step is `normalize(max(prior - 1 + counts, 1e-20))`.
///
/// ## Initialisation
///
/// Symbol frequencies of the seed data, add-one smoothed over the whole
/// alphabet, each state scaled by an independent jitter in `[0.5, 1.5)` and
/// renormalised.
@EmissionType("multinomial")
public final class MultinomialHmm extends ComponentHmm {

    @SerializedName("n_symbols")
    private final int nSymbols;

    @SerializedName("emission_prob")
    private double[][] emissionProb;

    @SerializedName("emission_prob_prior")
    private double[][] emissionProbPrior;

    private transient double[][] logEmissionProb;

    public MultinomialHmm(int nStates, int nSymbols) {
        super(nStates);
        if (nSymbols < 1) {
            throw new IllegalArgumentException("n_symbols must be positive, got " + nSymbols);
        }
        this.nSymbols = nSymbols;
        this.emissionProb = new double[nStates][];
        this.emissionProbPrior = new double[nStates][];
        for (int s = 0; s < nStates; s++) {
            emissionProb[s] = uniform(nSymbols);
            emissionProbPrior[s] = filled(nSymbols, 1.0);
        }
    }

    private MultinomialHmm(MultinomialHmm other) {
        super(other);
        this.nSymbols = other.nSymbols;
        this.emissionProb = deepCopy(other.emissionProb);
        this.emissionProbPrior = deepCopy(other.emissionProbPrior);
    }

    @Override
    public EmissionFamily family() {
        return EmissionFamily.MULTINOMIAL;
    }

    @Override
    public MultinomialHmm copy() {
        return new MultinomialHmm(this);
    }

    public int numSymbols() {
        return nSymbols;
    }

    public double[][] getEmissionProb() {
        return deepCopy(emissionProb);
    }

    public double[][] getEmissionProbPrior() {
        return deepCopy(emissionProbPrior);
    }

    /// @throws ShapeMismatchException unless the table is `numStates() x numSymbols()`
    /// @throws IllegalArgumentException if a row is not a distribution
    public void setEmissionProb(double[][] emissionProb) {
        Objects.requireNonNull(emissionProb, "emissionProb");
        requireTable("emissionprob", emissionProb);
        for (double[] row : emissionProb) {
            requireDistribution("emissionprob", row);
        }
        this.emissionProb = deepCopy(emissionProb);
        this.logEmissionProb = null;
    }

    public void setEmissionProbPrior(double[][] prior) {
        Objects.requireNonNull(prior, "prior");
        requireTable("emissionprob_prior", prior);
        this.emissionProbPrior = deepCopy(prior);
    }

    private void requireTable(String argument, double[][] table) {
        if (table.length != numStates()) {
            throw new ShapeMismatchException(argument, "must have " + numStates() + " rows, got " + table.length);
        }
        for (double[] row : table) {
            requireLength(argument, row, nSymbols);
        }
    }

    private double[][] logEmissionProb() {
        if (logEmissionProb == null) {
            double[][] logs = new double[emissionProb.length][];
            for (int s = 0; s < logs.length; s++) {
                logs[s] = LogSpace.log(emissionProb[s]);
            }
            logEmissionProb = logs;
        }
        return logEmissionProb;
    }

    @Override
    public double[][] frameLogLikelihood(Sequence sequence) {
        double[][] logEmission = logEmissionProb();
        int nStates = numStates();
        double[][] frames = new double[sequence.length()][nStates];
        for (int t = 0; t < sequence.length(); t++) {
            int symbol = requireSymbol(sequence.symbol(t));
            for (int s = 0; s < nStates; s++) {
                frames[t][s] = logEmission[s][symbol];
            }
        }
        return frames;
    }

    private int requireSymbol(int symbol) {
        if (symbol < 0 || symbol >= nSymbols) {
            throw new ShapeMismatchException("sequence",
                "symbol " + symbol + " is outside the alphabet of " + nSymbols + " symbols");
        }
        return symbol;
    }

    @Override
    public void checkCompatible(Dataset dataset) {
        if (dataset.dimension() != 1) {
            throw new ShapeMismatchException("dataset", "multinomial data must be 1-dimensional");
        }
        int max = (int) dataset.maxValue();
        if (max >= nSymbols) {
            throw new ShapeMismatchException("dataset",
                "contains symbol " + max + " but the model has " + nSymbols + " symbols");
        }
    }

    @Override
    public MultinomialStatistics initStatistics() {
        return new MultinomialStatistics(numStates(), nSymbols);
    }

    @Override
    protected void accumulateEmissions(HmmStatistics stats, Sequence sequence, double[][] posteriors) {
        double[][] obs = ((MultinomialStatistics) stats).obs();
        for (int t = 0; t < sequence.length(); t++) {
            int symbol = sequence.symbol(t);
            for (int s = 0; s < obs.length; s++) {
                obs[s][symbol] += posteriors[t][s];
            }
        }
    }

    @Override
    protected void maximizeEmissions(HmmStatistics stats) {
        double[][] obs = ((MultinomialStatistics) stats).obs();
        for (int s = 0; s < emissionProb.length; s++) {
            emissionProb[s] = mapEstimate(emissionProbPrior[s], obs[s]);
        }
        logEmissionProb = null;
    }

    @Override
    protected void initializeEmissions(Dataset dataset, UniformRandomProvider rng) {
        double[] frequencies = filled(nSymbols, 1.0);
        for (Sequence sequence : dataset) {
            for (int t = 0; t < sequence.length(); t++) {
                frequencies[requireSymbol(sequence.symbol(t))] += 1.0;
            }
        }
        frequencies = LogSpace.normalize(frequencies);
        for (int s = 0; s < emissionProb.length; s++) {
            double[] row = new double[nSymbols];
            for (int m = 0; m < nSymbols; m++) {
                row[m] = frequencies[m] * (0.5 + rng.nextDouble());
            }
            emissionProb[s] = LogSpace.normalize(row);
        }
        logEmissionProb = null;
    }

    @Override
    protected double[] sampleFrame(int state, UniformRandomProvider rng) {
        return new double[] {RandomGenerators.categorical(rng, emissionProb[state])};
    }
}
