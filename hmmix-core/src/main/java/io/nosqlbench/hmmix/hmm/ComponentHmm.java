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
import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.Sequence;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/// A single hidden Markov model with a family-specific emission distribution.
///
/// This class owns the parts every family shares: the start distribution, the
/// transition matrix, their Dirichlet priors, and the log-space forward,
/// backward and Viterbi recursions. Subclasses supply the emission density
/// through [#frameLogLikelihood(Sequence)] and the emission slice of the
/// statistics and M-step.
///
/// ## Log-space convention
///
/// All lattices hold natural-log probabilities. Zero probability is
/// `Double.NEGATIVE_INFINITY`, never NaN.
///
/// ## Thread safety
///
/// Instances are mutable and not thread-safe. The mixture trainer mutates them
/// only from the fitting thread.
public abstract sealed class ComponentHmm permits MultinomialHmm, PoissonHmm, ExponentialHmm, GaussianHmm {

    /// Tolerance for stochastic vectors supplied through setters.
    public static final double SUM_TOLERANCE = 1e-8;

    /// Floor applied before renormalising MAP estimates.
    public static final double PROBABILITY_FLOOR = 1e-20;

    /// Upper bound on the log of an expected transition count.
    static final double MAX_LOG_COUNT = 700.0;

    @SerializedName("n_states")
    private final int nStates;

    @SerializedName("start_prob")
    private double[] startProb;

    @SerializedName("trans_mat")
    private double[][] transMat;

    @SerializedName("start_prob_prior")
    private double[] startProbPrior;

    @SerializedName("trans_mat_prior")
    private double[][] transMatPrior;

    private transient double[] logStartProb;
    private transient double[][] logTransMat;

    protected ComponentHmm(int nStates) {
        if (nStates < 1) {
            throw new IllegalArgumentException("n_states must be positive, got " + nStates);
        }
        this.nStates = nStates;
        this.startProb = uniform(nStates);
        this.transMat = new double[nStates][];
        this.startProbPrior = filled(nStates, 1.0);
        this.transMatPrior = new double[nStates][];
        for (int i = 0; i < nStates; i++) {
            transMat[i] = uniform(nStates);
            transMatPrior[i] = filled(nStates, 1.0);
        }
    }

    /// Copies the start and transition slice of `other`.
    protected ComponentHmm(ComponentHmm other) {
        this.nStates = other.nStates;
        this.startProb = other.startProb.clone();
        this.transMat = deepCopy(other.transMat);
        this.startProbPrior = other.startProbPrior.clone();
        this.transMatPrior = deepCopy(other.transMatPrior);
    }

    public abstract EmissionFamily family();

    /// Returns a deep copy of this HMM, parameters and priors included.
    public abstract ComponentHmm copy();

    /// Per-frame, per-state emission log-likelihoods, `result[t][state]`.
    ///
    /// @throws ShapeMismatchException if the sequence does not fit this model's alphabet or dimension
    public abstract double[][] frameLogLikelihood(Sequence sequence);

    /// A zeroed statistics record of the matching family.
    public abstract HmmStatistics initStatistics();

    /// Rejects data whose alphabet or dimension this HMM cannot score.
    ///
    /// @throws ShapeMismatchException on an alphabet or dimension mismatch
    public abstract void checkCompatible(Dataset dataset);

    protected abstract void accumulateEmissions(HmmStatistics stats, Sequence sequence, double[][] posteriors);

    protected abstract void maximizeEmissions(HmmStatistics stats);

    protected abstract void initializeEmissions(Dataset dataset, UniformRandomProvider rng);

    protected abstract double[] sampleFrame(int state, UniformRandomProvider rng);

    public int numStates() {
        return nStates;
    }

    public double[] getStartProb() {
        return startProb.clone();
    }

    public double[][] getTransMat() {
        return deepCopy(transMat);
    }

    public double[] getStartProbPrior() {
        return startProbPrior.clone();
    }

    public double[][] getTransMatPrior() {
        return deepCopy(transMatPrior);
    }

    /// @throws ShapeMismatchException if the length is not `numStates()`
    /// @throws IllegalArgumentException if the entries are negative or do not sum to one
    public void setStartProb(double[] startProb) {
        Objects.requireNonNull(startProb, "startProb");
        requireLength("startprob", startProb, nStates);
        requireDistribution("startprob", startProb);
        this.startProb = startProb.clone();
        this.logStartProb = null;
    }

    /// @throws ShapeMismatchException if the matrix is not `numStates()` square
    /// @throws IllegalArgumentException if any row is not a distribution
    public void setTransMat(double[][] transMat) {
        Objects.requireNonNull(transMat, "transMat");
        requireSquare("transmat", transMat);
        for (double[] row : transMat) {
            requireDistribution("transmat", row);
        }
        this.transMat = deepCopy(transMat);
        this.logTransMat = null;
    }

    public void setStartProbPrior(double[] prior) {
        Objects.requireNonNull(prior, "prior");
        requireLength("startprob_prior", prior, nStates);
        this.startProbPrior = prior.clone();
    }

    public void setTransMatPrior(double[][] prior) {
        Objects.requireNonNull(prior, "prior");
        requireSquare("transmat_prior", prior);
        this.transMatPrior = deepCopy(prior);
    }

    protected double[] logStartProb() {
        if (logStartProb == null) {
            logStartProb = LogSpace.log(startProb);
        }
        return logStartProb;
    }

    protected double[][] logTransMat() {
        if (logTransMat == null) {
            double[][] logs = new double[nStates][];
            for (int i = 0; i < nStates; i++) {
                logs[i] = LogSpace.log(transMat[i]);
            }
            logTransMat = logs;
        }
        return logTransMat;
    }

    /// Forward recursion over precomputed frame log-likelihoods.
    public ForwardResult forwardPass(double[][] frameLogProb) {
        int length = frameLogProb.length;
        double[] logStart = logStartProb();
        double[][] logTrans = logTransMat();
        double[][] fwd = new double[length][nStates];
        for (int j = 0; j < nStates; j++) {
            fwd[0][j] = logStart[j] + frameLogProb[0][j];
        }
        double[] work = new double[nStates];
        for (int t = 1; t < length; t++) {
            for (int j = 0; j < nStates; j++) {
                for (int i = 0; i < nStates; i++) {
                    work[i] = fwd[t - 1][i] + logTrans[i][j];
                }
                fwd[t][j] = LogSpace.logSumExp(work) + frameLogProb[t][j];
            }
        }
        return new ForwardResult(LogSpace.logSumExp(fwd[length - 1]), fwd);
    }

    /// Backward recursion over precomputed frame log-likelihoods. The last row is all zeros.
    public double[][] backwardPass(double[][] frameLogProb) {
        int length = frameLogProb.length;
        double[][] logTrans = logTransMat();
        double[][] bwd = new double[length][nStates];
        double[] work = new double[nStates];
        for (int t = length - 2; t >= 0; t--) {
            for (int i = 0; i < nStates; i++) {
                for (int j = 0; j < nStates; j++) {
                    work[j] = logTrans[i][j] + frameLogProb[t + 1][j] + bwd[t + 1][j];
                }
                bwd[t][i] = LogSpace.logSumExp(work);
            }
        }
        return bwd;
    }

    /// State posteriors from forward and backward lattices. Each row sums to one.
    public static double[][] posteriors(double[][] fwd, double[][] bwd) {
        double[][] gamma = new double[fwd.length][];
        double[] work = new double[fwd[0].length];
        for (int t = 0; t < fwd.length; t++) {
            for (int i = 0; i < work.length; i++) {
                work[i] = fwd[t][i] + bwd[t][i];
            }
            gamma[t] = LogSpace.exp(LogSpace.logNormalize(work));
        }
        return gamma;
    }

    /// Log-likelihood of one sequence under this HMM.
    public double score(Sequence sequence) {
        return forwardPass(frameLogLikelihood(sequence)).logLikelihood();
    }

    /// Viterbi decoding of the most likely state path.
    public ViterbiResult decode(Sequence sequence) {
        double[][] frameLogProb = frameLogLikelihood(sequence);
        int length = frameLogProb.length;
        double[] logStart = logStartProb();
        double[][] logTrans = logTransMat();
        double[][] delta = new double[length][nStates];
        int[][] backPointer = new int[length][nStates];
        for (int j = 0; j < nStates; j++) {
            delta[0][j] = logStart[j] + frameLogProb[0][j];
        }
        for (int t = 1; t < length; t++) {
            for (int j = 0; j < nStates; j++) {
                int best = 0;
                double bestValue = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < nStates; i++) {
                    double value = delta[t - 1][i] + logTrans[i][j];
                    if (value > bestValue) {
                        bestValue = value;
                        best = i;
                    }
                }
                delta[t][j] = bestValue + frameLogProb[t][j];
                backPointer[t][j] = best;
            }
        }
        int[] states = new int[length];
        states[length - 1] = LogSpace.argmax(delta[length - 1]);
        for (int t = length - 1; t > 0; t--) {
            states[t - 1] = backPointer[t][states[t]];
        }
        return new ViterbiResult(delta[length - 1][states[length - 1]], states);
    }

    /// Adds one sequence's unweighted statistics to `stats`.
    ///
    /// Only the groups named in `params` are accumulated. Transition counts are
    /// skipped for length-1 sequences and for sequences this HMM cannot generate.
    public void accumulate(HmmStatistics stats, Sequence sequence, double[][] frameLogProb,
                           double[][] posteriors, double[][] fwd, double[][] bwd,
                           Set<ParamGroup> params) {
        if (params.contains(ParamGroup.START_PROBABILITIES)) {
            stats.addStart(posteriors[0]);
        }
        if (params.contains(ParamGroup.TRANSITIONS) && frameLogProb.length > 1) {
            double logProb = LogSpace.logSumExp(fwd[fwd.length - 1]);
            if (logProb != Double.NEGATIVE_INFINITY) {
                stats.addTransitions(expectedTransitions(frameLogProb, fwd, bwd, logProb));
            }
        }
        if (params.contains(ParamGroup.EMISSIONS)) {
            accumulateEmissions(stats, sequence, posteriors);
        }
    }

    /// Expected transition counts, `exp(logsumexp_t lneta[t][i][j])` with
    /// `lneta[t][i][j] = fwd[t][i] + logA[i][j] + frame[t+1][j] + bwd[t+1][j] - logProb`.
    double[][] expectedTransitions(double[][] frameLogProb, double[][] fwd, double[][] bwd, double logProb) {
        double[][] logTrans = logTransMat();
        int steps = frameLogProb.length - 1;
        double[][] counts = new double[nStates][nStates];
        double[] lneta = new double[steps];
        for (int i = 0; i < nStates; i++) {
            for (int j = 0; j < nStates; j++) {
                for (int t = 0; t < steps; t++) {
                    lneta[t] = fwd[t][i] + logTrans[i][j] + frameLogProb[t + 1][j] + bwd[t + 1][j] - logProb;
                }
                counts[i][j] = Math.exp(Math.min(LogSpace.logSumExp(lneta), MAX_LOG_COUNT));
            }
        }
        return counts;
    }

    /// MAP M-step for the groups named in `params`.
    public void maximize(HmmStatistics stats, Set<ParamGroup> params) {
        if (params.contains(ParamGroup.START_PROBABILITIES)) {
            startProb = mapEstimate(startProbPrior, stats.start());
            logStartProb = null;
        }
        if (params.contains(ParamGroup.TRANSITIONS)) {
            double[][] trans = stats.trans();
            for (int i = 0; i < nStates; i++) {
                transMat[i] = mapEstimate(transMatPrior[i], trans[i]);
            }
            logTransMat = null;
        }
        if (params.contains(ParamGroup.EMISSIONS)) {
            maximizeEmissions(stats);
        }
    }

    /// Resets the groups named in `params`. Start and transitions become
    /// uniform; emissions go through the family initialiser run on `dataset`.
    public void initialize(Dataset dataset, Set<ParamGroup> params, UniformRandomProvider rng) {
        if (params.contains(ParamGroup.START_PROBABILITIES)) {
            startProb = uniform(nStates);
            logStartProb = null;
        }
        if (params.contains(ParamGroup.TRANSITIONS)) {
            for (int i = 0; i < nStates; i++) {
                transMat[i] = uniform(nStates);
            }
            logTransMat = null;
        }
        if (params.contains(ParamGroup.EMISSIONS)) {
            initializeEmissions(dataset, rng);
        }
    }

    /// Generates `length` frames and the state path that produced them.
    public SampledSequence sample(int length, UniformRandomProvider rng) {
        if (length < 1) {
            throw new IllegalArgumentException("sample length must be positive, got " + length);
        }
        int[] states = new int[length];
        double[][] frames = new double[length][];
        int state = RandomGenerators.categorical(rng, startProb);
        for (int t = 0; t < length; t++) {
            states[t] = state;
            frames[t] = sampleFrame(state, rng);
            state = RandomGenerators.categorical(rng, transMat[state]);
        }
        return new SampledSequence(Sequence.ofVectors(frames), states);
    }

    /// `normalize(max(prior - 1 + counts, 1e-20))`
    protected static double[] mapEstimate(double[] prior, double[] counts) {
        double[] values = new double[counts.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.max(prior[i] - 1.0 + counts[i], PROBABILITY_FLOOR);
        }
        return LogSpace.normalize(values);
    }

    protected void requireSquare(String argument, double[][] matrix) {
        if (matrix.length != nStates) {
            throw new ShapeMismatchException(argument, "must have " + nStates + " rows, got " + matrix.length);
        }
        for (double[] row : matrix) {
            requireLength(argument, row, nStates);
        }
    }

    protected static void requireDistribution(String argument, double[] values) {
        double sum = 0.0;
        for (double value : values) {
            if (!(value >= 0.0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("'" + argument + "' must be non-negative and finite, got "
                    + Arrays.toString(values));
            }
            sum += value;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("'" + argument + "' must sum to 1.0, got " + sum);
        }
    }

    protected static void requireLength(String argument, double[] values, int expected) {
        if (values.length != expected) {
            throw new ShapeMismatchException(argument, "must have length " + expected + ", got " + values.length);
        }
    }

    protected static double[] uniform(int n) {
        return filled(n, 1.0 / n);
    }

    protected static double[] filled(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    protected static double[][] deepCopy(double[][] values) {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[states=" + nStates + ", startprob=" + Arrays.toString(startProb) + "]";
    }
}
