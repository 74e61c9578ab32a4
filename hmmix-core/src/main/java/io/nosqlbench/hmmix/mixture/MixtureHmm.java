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
import io.nosqlbench.hmmix.hmm.ExponentialHmm;
import io.nosqlbench.hmmix.hmm.GaussianHmm;
import io.nosqlbench.hmmix.hmm.MultinomialHmm;
import io.nosqlbench.hmmix.hmm.PoissonHmm;
import io.nosqlbench.hmmix.hmm.SampledSequence;
import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.Sequence;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import io.nosqlbench.hmmix.trace.TrainingObserver;
import io.nosqlbench.hmmix.trace.VerboseReporter;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// A mixture of K hidden Markov models over whole sequences.
///
/// Each sequence is assumed to come from exactly one of K component HMMs,
/// chosen with probability given by the mixture weights. [#fit(Dataset)]
/// learns the weights and every component's parameters with two-level EM;
/// the scoring methods turn the fitted model into per-sequence
/// log-likelihoods and component posteriors.
///
/// ## Usage
///
/// ```java
/// MixtureHmmConfig config = MixtureHmmConfig.of(EmissionFamily.POISSON, 2, 3)
///     .setRandomSeed(42L)
///     .setNIter(50);
/// MixtureHmm model = new MixtureHmm(config).fit(dataset);
/// int[] labels = model.predict(dataset);
/// ```
///
/// ## Warm restarts
///
/// Only the groups named in `init_params` are reset by `fit`. Supplying HMMs
/// and weights and clearing `init_params` continues training from them.
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. Use separate instances for concurrent operations.
public final class MixtureHmm {

    private static final Logger logger = LogManager.getLogger(MixtureHmm.class);

    private final MixtureHmmConfig config;
    private final UniformRandomProvider rng;
    private final MixtureWeights weights;
    private final List<ComponentHmm> hmms = new ArrayList<>();
    private TrainingObserver observer = TrainingObserver.NOOP;
    private FitResult lastFitResult;

    /// Creates an unfitted model; components are built on the first [#fit(Dataset)].
    ///
    /// @throws IllegalArgumentException if the configuration is invalid
    public MixtureHmm(MixtureHmmConfig config) {
        this(config, null);
    }

    /// Creates a model around caller-supplied components.
    ///
    /// @param hmms exactly `n_components` HMMs of the configured family, each with `n_states` states,
    ///     or `null` to build them on fit
    /// @throws ShapeMismatchException if the count or the state counts disagree with the configuration
    public MixtureHmm(MixtureHmmConfig config, List<? extends ComponentHmm> hmms) {
        this.config = Objects.requireNonNull(config, "config").copy().validate();
        Long seed = this.config.getRandomSeed();
        this.rng = seed != null ? RandomGenerators.create(seed) : RandomGenerators.createUnseeded();
        this.weights = new MixtureWeights(this.config.getNComponents(), this.config.getComponentWeightsPrior());
        if (hmms != null) {
            setComponents(hmms);
        }
    }

    private void setComponents(List<? extends ComponentHmm> components) {
        if (components.size() != config.getNComponents()) {
            throw new ShapeMismatchException("hmms",
                "must contain " + config.getNComponents() + " HMMs, got " + components.size());
        }
        for (ComponentHmm hmm : components) {
            Objects.requireNonNull(hmm, "hmms cannot contain null");
            if (hmm.numStates() != config.getNStates()) {
                throw new ShapeMismatchException("hmms",
                    "every HMM must have " + config.getNStates() + " states, got " + hmm.numStates());
            }
            if (hmm.family() != config.getEmissionFamily()) {
                throw new IllegalArgumentException("expected " + config.getEmissionFamily().typeName()
                    + " HMMs, got " + hmm.family().typeName());
            }
        }
        hmms.clear();
        hmms.addAll(components);
    }

    public MixtureHmmConfig getConfig() {
        return config.copy();
    }

    public int numComponents() {
        return config.getNComponents();
    }

    /// The component HMMs, live. Empty until the model is fitted or built with components.
    public List<ComponentHmm> getHmms() {
        return Collections.unmodifiableList(hmms);
    }

    /// Linear mixture weights.
    public double[] getComponentWeights() {
        return weights.get();
    }

    /// @see MixtureWeights#set(double[], UniformRandomProvider)
    public MixtureHmm setComponentWeights(double[] componentWeights) {
        weights.set(componentWeights, rng);
        return this;
    }

    public MixtureHmm setObserver(TrainingObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer");
        return this;
    }

    /// Result of the most recent [#fit(Dataset)], or `null` before the first.
    public FitResult getLastFitResult() {
        return lastFitResult;
    }

    MixtureWeights weights() {
        return weights;
    }

    List<ComponentHmm> components() {
        return hmms;
    }

    /// Estimates the model parameters from `dataset`.
    ///
    /// Validation runs before any parameter changes: a rejected dataset leaves
    /// the model as it was.
    ///
    /// @return this model
    /// @throws io.nosqlbench.hmmix.model.InvalidObservationException if values fall outside the family's domain
    /// @throws ShapeMismatchException if the data does not fit the components' alphabet or dimension
    public MixtureHmm fit(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        config.getEmissionFamily().validate(dataset);
        if (hmms.isEmpty()) {
            newHmm(dataset).checkCompatible(dataset);
        }
        for (ComponentHmm hmm : hmms) {
            hmm.checkCompatible(dataset);
        }
        TrainingObserver sink = config.getVerbose() > 0
            ? new VerboseReporter(config.getVerbose()).andThen(observer)
            : observer;
        lastFitResult = new EmTrainer(config, sink).train(this, dataset);
        return this;
    }

    /// Resets the named parameter groups ahead of EM.
    ///
    /// Components are built first if none exist. HMM groups are initialised
    /// farthest-first: component 0 from a randomly chosen seed sequence, every
    /// later component from the sequence with the lowest per-frame
    /// log-likelihood under the components seeded before it.
    void initialize(Dataset dataset, Set<ParamGroup> initParams) {
        if (hmms.isEmpty()) {
            for (int k = 0; k < config.getNComponents(); k++) {
                hmms.add(newHmm(dataset));
            }
            logger.debug("Built {} {} components for {} sequences",
                hmms.size(), config.getEmissionFamily().typeName(), dataset.size());
        }
        if (initParams.contains(ParamGroup.MIXTURE_WEIGHTS)) {
            weights.set(null, rng);
        }
        if (ParamGroup.anyHmmGroup(initParams)) {
            seedComponents(dataset, initParams);
        }
    }

    private void seedComponents(Dataset dataset, Set<ParamGroup> initParams) {
        int n = dataset.size();
        boolean[] used = new boolean[n];
        double[] bestPerFrame = new double[n];
        Arrays.fill(bestPerFrame, Double.NEGATIVE_INFINITY);
        int seed = rng.nextInt(n);
        for (int k = 0; k < hmms.size(); k++) {
            if (k > 0) {
                ComponentHmm previous = hmms.get(k - 1);
                for (int i = 0; i < n; i++) {
                    Sequence sequence = dataset.get(i);
                    bestPerFrame[i] = Math.max(bestPerFrame[i], previous.score(sequence) / sequence.length());
                }
                seed = worstExplained(bestPerFrame, used);
            }
            used[seed] = true;
            logger.debug("Seeding component {} from sequence {}", k, seed);
            hmms.get(k).initialize(Dataset.of(dataset.get(seed)), initParams, rng);
        }
    }

    private int worstExplained(double[] bestPerFrame, boolean[] used) {
        int worst = -1;
        for (int i = 0; i < bestPerFrame.length; i++) {
            if (!used[i] && (worst < 0 || bestPerFrame[i] < bestPerFrame[worst])) {
                worst = i;
            }
        }
        return worst >= 0 ? worst : rng.nextInt(bestPerFrame.length);
    }

    private ComponentHmm newHmm(Dataset dataset) {
        int nStates = config.getNStates();
        EmissionFamily family = config.getEmissionFamily();
        return switch (family) {
            case MULTINOMIAL -> {
                int nSymbols = config.getNSymbols() != null ? config.getNSymbols() : (int) dataset.maxValue() + 1;
                MultinomialHmm hmm = new MultinomialHmm(nStates, nSymbols);
                if (config.getEmissionProbPrior() != null) {
                    double[][] prior = new double[nStates][nSymbols];
                    for (double[] row : prior) {
                        Arrays.fill(row, config.getEmissionProbPrior());
                    }
                    hmm.setEmissionProbPrior(prior);
                }
                yield hmm;
            }
            case POISSON -> new PoissonHmm(nStates).setRatesVar(config.getRatesVar());
            case EXPONENTIAL -> new ExponentialHmm(nStates).setRatesVar(config.getRatesVar());
            case GAUSSIAN -> {
                int nFeatures = config.getNFeatures() != null ? config.getNFeatures() : dataset.dimension();
                yield new GaussianHmm(nStates, nFeatures, config.getCovarianceType())
                    .setMeansVar(config.getMeansVar())
                    .setMinCovar(config.getMinCovar());
            }
        };
    }

    private ResponsibilityEngine engine() {
        if (hmms.isEmpty()) {
            throw new IllegalStateException("Model has no components; fit it or supply HMMs first");
        }
        return new ResponsibilityEngine(hmms, weights);
    }

    /// Mixture log-likelihood and responsibilities for each sequence, in input order.
    public ScoredSamples scoreSamples(Dataset dataset) {
        ResponsibilityEngine engine = engine();
        double[] logLikelihoods = new double[dataset.size()];
        double[][] responsibilities = new double[dataset.size()][];
        for (int i = 0; i < dataset.size(); i++) {
            SequenceScore score = engine.scoreOne(dataset.get(i));
            logLikelihoods[i] = score.logLikelihood();
            responsibilities[i] = score.responsibilities();
        }
        return new ScoredSamples(logLikelihoods, responsibilities);
    }

    /// Mixture log-likelihood of each sequence, in input order.
    public double[] score(Dataset dataset) {
        ResponsibilityEngine engine = engine();
        double[] logLikelihoods = new double[dataset.size()];
        for (int i = 0; i < logLikelihoods.length; i++) {
            logLikelihoods[i] = engine.scoreOne(dataset.get(i)).logLikelihood();
        }
        return logLikelihoods;
    }

    /// Most likely component for each sequence, lowest index on ties.
    public int[] predict(Dataset dataset) {
        return scoreSamples(dataset).predictions();
    }

    /// Posterior component probabilities, `result[sequence][component]`.
    public double[][] predictProba(Dataset dataset) {
        return scoreSamples(dataset).responsibilities();
    }

    /// Generates sequences using this model's own random source.
    public MixtureSample sample(int nSequences, int minLength, int maxLength) {
        return sample(nSequences, minLength, maxLength, rng);
    }

    /// Generates `nSequences` sequences.
    ///
    /// For each sequence a component is drawn from the weights, a length
    /// uniformly from `[minLength, maxLength]`, and the frames from that component.
    public MixtureSample sample(int nSequences, int minLength, int maxLength, UniformRandomProvider random) {
        if (hmms.isEmpty()) {
            throw new IllegalStateException("Model has no components; fit it or supply HMMs first");
        }
        if (nSequences < 1) {
            throw new IllegalArgumentException("nSequences must be positive, got " + nSequences);
        }
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("need 1 <= minLength <= maxLength, got " + minLength + ", " + maxLength);
        }
        double[] componentWeights = weights.get();
        int[] components = new int[nSequences];
        List<Sequence> observations = new ArrayList<>(nSequences);
        List<int[]> states = new ArrayList<>(nSequences);
        for (int i = 0; i < nSequences; i++) {
            int component = RandomGenerators.categorical(random, componentWeights);
            int length = RandomGenerators.uniformInt(random, minLength, maxLength);
            SampledSequence sampled = hmms.get(component).sample(length, random);
            components[i] = component;
            observations.add(sampled.observations());
            states.add(sampled.states());
        }
        return new MixtureSample(components, observations, states);
    }

    @Override
    public String toString() {
        return "MixtureHmm[" + config.getEmissionFamily().typeName() + ", components=" + config.getNComponents()
            + ", states=" + config.getNStates() + ", weights=" + Arrays.toString(weights.get()) + "]";
    }
}
