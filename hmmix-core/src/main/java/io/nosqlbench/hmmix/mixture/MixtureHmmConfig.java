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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.hmmix.hmm.CovarianceType;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.ShapeMismatchException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * JSON-serializable configuration for a {@link MixtureHmm}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "emission_family": "multinomial",
 *   "n_components": 2,
 *   "n_states": 3,
 *   "n_symbols": 4,            // optional, inferred from the data
 *   "n_iter": 10,
 *   "thresh": 0.01,
 *   "params": "pste",
 *   "init_params": "pste",
 *   "verbose": 0,
 *   "random_seed": 42,         // optional, unseeded when absent
 *   "component_weights_prior": [1.0, 1.0],
 *   "emission_prob_prior": 1.0,
 *   "rates_var": 1.0,
 *   "means_var": 1.0,
 *   "covariance_type": "diag",
 *   "min_covar": 0.001
 * }
 * }</pre>
 *
 * <p>{@code params} and {@code init_params} are letter masks: {@code p} for the
 * mixture weights, {@code s} start probabilities, {@code t} transitions,
 * {@code e} emissions, and {@code h} for all three HMM groups.
 *
 * <p>Setters return {@code this} so a configuration can be built fluently.
 *
 * @see ParamGroup#parse(String)
 */
public class MixtureHmmConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    @SerializedName("emission_family")
    private EmissionFamily emissionFamily = EmissionFamily.MULTINOMIAL;

    @SerializedName("n_components")
    private int nComponents = 1;

    @SerializedName("n_states")
    private int nStates = 1;

    /** Alphabet size for multinomial emissions; inferred from the data when null. */
    @SerializedName("n_symbols")
    private Integer nSymbols;

    /** Feature dimension for Gaussian emissions; inferred from the data when null. */
    @SerializedName("n_features")
    private Integer nFeatures;

    @SerializedName("n_iter")
    private int nIter = 10;

    @SerializedName("thresh")
    private double thresh = 1e-2;

    @SerializedName("params")
    private String params = "pste";

    @SerializedName("init_params")
    private String initParams = "pste";

    @SerializedName("verbose")
    private int verbose = 0;

    @SerializedName("random_seed")
    private Long randomSeed;

    @SerializedName("component_weights_prior")
    private double[] componentWeightsPrior;

    /** Dirichlet concentration applied to every multinomial emission row. */
    @SerializedName("emission_prob_prior")
    private Double emissionProbPrior;

    @SerializedName("rates_var")
    private double ratesVar = 1.0;

    @SerializedName("means_var")
    private double meansVar = 1.0;

    @SerializedName("covariance_type")
    private CovarianceType covarianceType = CovarianceType.DIAG;

    @SerializedName("min_covar")
    private double minCovar = 1e-3;

    public MixtureHmmConfig() {
    }

    /**
     * Creates a configuration for the given family and sizes, other fields at their defaults.
     */
    public static MixtureHmmConfig of(EmissionFamily family, int nComponents, int nStates) {
        return new MixtureHmmConfig()
                .setEmissionFamily(family)
                .setNComponents(nComponents)
                .setNStates(nStates);
    }

    /**
     * Returns a field-by-field copy.
     */
    public MixtureHmmConfig copy() {
        return fromJson(toJson());
    }

    public EmissionFamily getEmissionFamily() {
        return emissionFamily;
    }

    public MixtureHmmConfig setEmissionFamily(EmissionFamily emissionFamily) {
        this.emissionFamily = Objects.requireNonNull(emissionFamily, "emissionFamily");
        return this;
    }

    public int getNComponents() {
        return nComponents;
    }

    public MixtureHmmConfig setNComponents(int nComponents) {
        this.nComponents = nComponents;
        return this;
    }

    public int getNStates() {
        return nStates;
    }

    public MixtureHmmConfig setNStates(int nStates) {
        this.nStates = nStates;
        return this;
    }

    public Integer getNSymbols() {
        return nSymbols;
    }

    public MixtureHmmConfig setNSymbols(Integer nSymbols) {
        this.nSymbols = nSymbols;
        return this;
    }

    public Integer getNFeatures() {
        return nFeatures;
    }

    public MixtureHmmConfig setNFeatures(Integer nFeatures) {
        this.nFeatures = nFeatures;
        return this;
    }

    public int getNIter() {
        return nIter;
    }

    public MixtureHmmConfig setNIter(int nIter) {
        this.nIter = nIter;
        return this;
    }

    public double getThresh() {
        return thresh;
    }

    public MixtureHmmConfig setThresh(double thresh) {
        this.thresh = thresh;
        return this;
    }

    /**
     * Groups updated by each M-step.
     */
    public Set<ParamGroup> getParams() {
        return ParamGroup.parse(params == null ? "" : params);
    }

    public MixtureHmmConfig setParams(Set<ParamGroup> params) {
        this.params = ParamGroup.toMask(params);
        return this;
    }

    public MixtureHmmConfig setParams(String mask) {
        this.params = ParamGroup.toMask(ParamGroup.parse(mask));
        return this;
    }

    /**
     * Groups (re)initialised before EM starts.
     */
    public Set<ParamGroup> getInitParams() {
        return ParamGroup.parse(initParams == null ? "" : initParams);
    }

    public MixtureHmmConfig setInitParams(Set<ParamGroup> initParams) {
        this.initParams = ParamGroup.toMask(initParams);
        return this;
    }

    public MixtureHmmConfig setInitParams(String mask) {
        this.initParams = ParamGroup.toMask(ParamGroup.parse(mask));
        return this;
    }

    public int getVerbose() {
        return verbose;
    }

    public MixtureHmmConfig setVerbose(int verbose) {
        this.verbose = verbose;
        return this;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public MixtureHmmConfig setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
        return this;
    }

    public double[] getComponentWeightsPrior() {
        return componentWeightsPrior == null ? null : componentWeightsPrior.clone();
    }

    public MixtureHmmConfig setComponentWeightsPrior(double[] componentWeightsPrior) {
        this.componentWeightsPrior = componentWeightsPrior == null ? null : componentWeightsPrior.clone();
        return this;
    }

    public Double getEmissionProbPrior() {
        return emissionProbPrior;
    }

    public MixtureHmmConfig setEmissionProbPrior(Double emissionProbPrior) {
        this.emissionProbPrior = emissionProbPrior;
        return this;
    }

    public double getRatesVar() {
        return ratesVar;
    }

    public MixtureHmmConfig setRatesVar(double ratesVar) {
        this.ratesVar = ratesVar;
        return this;
    }

    public double getMeansVar() {
        return meansVar;
    }

    public MixtureHmmConfig setMeansVar(double meansVar) {
        this.meansVar = meansVar;
        return this;
    }

    public CovarianceType getCovarianceType() {
        return covarianceType;
    }

    public MixtureHmmConfig setCovarianceType(CovarianceType covarianceType) {
        this.covarianceType = Objects.requireNonNull(covarianceType, "covarianceType");
        return this;
    }

    public double getMinCovar() {
        return minCovar;
    }

    public MixtureHmmConfig setMinCovar(double minCovar) {
        this.minCovar = minCovar;
        return this;
    }

    /**
     * Checks every field against its allowed range.
     *
     * @return this configuration
     * @throws IllegalArgumentException if a field is out of range
     * @throws ShapeMismatchException if the weights prior does not have {@code n_components} entries
     */
    public MixtureHmmConfig validate() {
        Objects.requireNonNull(emissionFamily, "emission_family is required");
        Objects.requireNonNull(covarianceType, "covariance_type is required");
        requirePositive("n_components", nComponents);
        requirePositive("n_states", nStates);
        requirePositive("n_iter", nIter);
        if (nSymbols != null) {
            requirePositive("n_symbols", nSymbols);
        }
        if (nFeatures != null) {
            requirePositive("n_features", nFeatures);
        }
        requireNonNegative("thresh", thresh);
        requireNonNegative("rates_var", ratesVar);
        requireNonNegative("means_var", meansVar);
        requireNonNegative("min_covar", minCovar);
        if (verbose < 0 || verbose > 2) {
            throw new IllegalArgumentException("verbose must be 0, 1 or 2, got " + verbose);
        }
        if (componentWeightsPrior != null && componentWeightsPrior.length != nComponents) {
            throw new ShapeMismatchException("componentWeightsPrior",
                    "must have length " + nComponents + ", got " + componentWeightsPrior.length);
        }
        if (emissionProbPrior != null && !(emissionProbPrior > 0.0)) {
            throw new IllegalArgumentException("emission_prob_prior must be positive, got " + emissionProbPrior);
        }
        return this;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0)) {
            throw new IllegalArgumentException(name + " must be non-negative, got " + value);
        }
    }

    /**
     * Parses a configuration from JSON. Absent fields keep their defaults.
     */
    public static MixtureHmmConfig fromJson(String json) {
        return GSON.fromJson(json, MixtureHmmConfig.class);
    }

    public static MixtureHmmConfig fromJson(Reader reader) {
        return GSON.fromJson(reader, MixtureHmmConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads and validates a configuration file.
     */
    public static MixtureHmmConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader).validate();
        }
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MixtureHmmConfig that)) {
            return false;
        }
        return nComponents == that.nComponents
                && nStates == that.nStates
                && nIter == that.nIter
                && Double.compare(thresh, that.thresh) == 0
                && verbose == that.verbose
                && Double.compare(ratesVar, that.ratesVar) == 0
                && Double.compare(meansVar, that.meansVar) == 0
                && Double.compare(minCovar, that.minCovar) == 0
                && emissionFamily == that.emissionFamily
                && covarianceType == that.covarianceType
                && Objects.equals(nSymbols, that.nSymbols)
                && Objects.equals(nFeatures, that.nFeatures)
                && getParams().equals(that.getParams())
                && getInitParams().equals(that.getInitParams())
                && Objects.equals(randomSeed, that.randomSeed)
                && Arrays.equals(componentWeightsPrior, that.componentWeightsPrior)
                && Objects.equals(emissionProbPrior, that.emissionProbPrior);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(emissionFamily, nComponents, nStates, nSymbols, nFeatures, nIter, thresh,
                getParams(), getInitParams(), verbose, randomSeed, emissionProbPrior, ratesVar, meansVar,
                covarianceType, minCovar);
        return 31 * result + Arrays.hashCode(componentWeightsPrior);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
