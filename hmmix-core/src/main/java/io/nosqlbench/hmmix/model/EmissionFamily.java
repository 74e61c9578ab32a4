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


package io.nosqlbench.hmmix.model;

import com.google.gson.annotations.SerializedName;

import java.util.BitSet;

/// The closed set of emission families a mixture component can use.
///
/// Each family carries its own input precondition. [#validate(Dataset)] runs
/// before any training state is touched, so a rejected dataset never leaves a
/// half-initialised model behind.
///
/// | Family | Observation | Requirement |
/// |--------|-------------|-------------|
/// | [#MULTINOMIAL] | symbol | non-negative, contiguous integers |
/// | [#POISSON] | count | non-negative integers |
/// | [#EXPONENTIAL] | duration | non-negative reals |
/// | [#GAUSSIAN] | feature vector | finite reals of one dimension |
public enum EmissionFamily {

    @SerializedName("multinomial")
    MULTINOMIAL("multinomial") {
        @Override
        public void validate(Dataset dataset) {
            String requirement = "a list of non-negative integer arrays where in all, every element must be continuous";
            requireScalar(dataset);
            requireMoreThanOneObservation(dataset, requirement);
            BitSet seen = new BitSet();
            for (Sequence sequence : dataset) {
                for (int t = 0; t < sequence.length(); t++) {
                    double v = sequence.value(t);
                    if (!isNonNegativeInteger(v)) {
                        throw new InvalidObservationException(this, requirement, dataset);
                    }
                    seen.set((int) v);
                }
            }
            int first = seen.nextSetBit(0);
            int gap = seen.nextClearBit(first);
            if (seen.nextSetBit(gap) >= 0) {
                throw new InvalidObservationException(this, requirement, dataset);
            }
        }
    },

    @SerializedName("poisson")
    POISSON("poisson") {
        @Override
        public void validate(Dataset dataset) {
            String requirement = "a list of non-negative integer arrays";
            requireScalar(dataset);
            requireMoreThanOneObservation(dataset, requirement);
            for (Sequence sequence : dataset) {
                for (int t = 0; t < sequence.length(); t++) {
                    if (!isNonNegativeInteger(sequence.value(t))) {
                        throw new InvalidObservationException(this, requirement, dataset);
                    }
                }
            }
        }
    },

    @SerializedName("exponential")
    EXPONENTIAL("exponential") {
        @Override
        public void validate(Dataset dataset) {
            String requirement = "a list of non-negative real arrays";
            requireScalar(dataset);
            requireMoreThanOneObservation(dataset, requirement);
            for (Sequence sequence : dataset) {
                for (int t = 0; t < sequence.length(); t++) {
                    double v = sequence.value(t);
                    if (!Double.isFinite(v) || v < 0) {
                        throw new InvalidObservationException(this, requirement, dataset);
                    }
                }
            }
        }
    },

    @SerializedName("gaussian")
    GAUSSIAN("gaussian") {
        @Override
        public void validate(Dataset dataset) {
            requireUniformDimension(dataset);
            for (Sequence sequence : dataset) {
                for (int t = 0; t < sequence.length(); t++) {
                    for (int d = 0; d < sequence.dimension(); d++) {
                        if (!Double.isFinite(sequence.get(t, d))) {
                            throw new InvalidObservationException(this, "a list of finite real arrays", dataset);
                        }
                    }
                }
            }
        }
    };

    private final String typeName;

    EmissionFamily(String typeName) {
        this.typeName = typeName;
    }

    /// Serialization name, also used as the JSON type discriminator.
    public String typeName() {
        return typeName;
    }

    /// Checks that `dataset` can be modelled by this family.
    ///
    /// @throws InvalidObservationException if a value is outside the family's domain
    /// @throws ShapeMismatchException if the frame dimension does not fit the family
    public abstract void validate(Dataset dataset);

    public static EmissionFamily fromTypeName(String typeName) {
        for (EmissionFamily family : values()) {
            if (family.typeName.equals(typeName)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown emission family: '" + typeName + "'");
    }

    private static boolean isNonNegativeInteger(double v) {
        return v >= 0 && v == Math.rint(v) && v <= Integer.MAX_VALUE;
    }

    /// Any width is allowed as long as every sequence shares it; [Dataset#dimension()] does the check.
    ///
    /// @throws ShapeMismatchException if the sequences disagree on their frame width
    private static void requireUniformDimension(Dataset dataset) {
        dataset.dimension();
    }

    private static void requireScalar(Dataset dataset) {
        if (dataset.dimension() != 1) {
            throw new ShapeMismatchException("dataset", "frames must hold a single value for discrete or exponential emissions");
        }
    }

    void requireMoreThanOneObservation(Dataset dataset, String requirement) {
        if (dataset.totalLength() < 2) {
            throw new InvalidObservationException(this, requirement, dataset);
        }
    }
}
