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

import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/// Prior probabilities of the K mixture components, stored in log space.
///
/// ## Invariants
///
/// - exactly K entries, fixed for the lifetime of the model
/// - every entry strictly positive (floored at [#FLOOR])
/// - the linear weights sum to one within [#SUM_TOLERANCE]
///
/// ## MAP update
///
/// ```
/// w = normalize(max(prior - 1 + accumulated, 1e-20))
/// ```
///
/// where `accumulated[k]` is the responsibility mass of component `k` over
/// the dataset and `prior` is a Dirichlet concentration vector.
public final class MixtureWeights {

    /// Smallest weight any component can hold.
    public static final double FLOOR = 1e-20;

    /// Accepted deviation of a supplied weight vector's sum from one.
    public static final double SUM_TOLERANCE = 1e-8;

    /// The normalised floor is dominated by the epsilon smoothing, about `2.2e-16`.
    private static final double LOG_COLLAPSED = Math.log(1e-15);

    private final int nComponents;
    private double[] prior;
    private double[] logWeights;

    /// Creates uniform weights.
    ///
    /// @param nComponents K, the number of mixture components
    /// @param prior Dirichlet concentration, or `null` for all ones
    public MixtureWeights(int nComponents, double[] prior) {
        if (nComponents < 1) {
            throw new IllegalArgumentException("n_components must be positive, got " + nComponents);
        }
        this.nComponents = nComponents;
        setPrior(prior);
        double[] uniform = new double[nComponents];
        Arrays.fill(uniform, 1.0 / nComponents);
        this.logWeights = LogSpace.log(uniform);
    }

    public int size() {
        return nComponents;
    }

    /// Fresh linear weights. No entry is exactly zero.
    public double[] get() {
        return LogSpace.exp(logWeights);
    }

    public double[] logWeights() {
        return logWeights.clone();
    }

    public double[] prior() {
        return prior.clone();
    }

    /// @param prior Dirichlet concentration of length K with positive entries, or `null` for all ones
    public void setPrior(double[] prior) {
        if (prior == null) {
            double[] ones = new double[nComponents];
            Arrays.fill(ones, 1.0);
            this.prior = ones;
            return;
        }
        if (prior.length != nComponents) {
            throw new ShapeMismatchException("componentWeightsPrior",
                "must have length " + nComponents + ", got " + prior.length);
        }
        for (double alpha : prior) {
            if (!(alpha > 0.0) || Double.isInfinite(alpha)) {
                throw new IllegalArgumentException("'componentWeightsPrior' entries must be positive and finite, got "
                    + Arrays.toString(prior));
            }
        }
        this.prior = prior.clone();
    }

    /// Replaces the weights.
    ///
    /// A vector containing zeros is renormalised first, so zero entries become
    /// tiny positive weights. Entries are then floored at [#FLOOR].
    ///
    /// @param weights the new linear weights, or `null` to draw from `Dirichlet(prior)`
    /// @param rng source for the Dirichlet draw
    /// @throws ShapeMismatchException if the length is not K
    /// @throws IllegalArgumentException if an entry is negative or not finite, or the sum is not one
    public void set(double[] weights, UniformRandomProvider rng) {
        double[] values;
        if (weights == null) {
            Objects.requireNonNull(rng, "rng");
            values = RandomGenerators.dirichlet(rng, prior);
        } else {
            if (weights.length != nComponents) {
                throw new ShapeMismatchException("componentWeights",
                    "must have length " + nComponents + ", got " + weights.length);
            }
            values = weights.clone();
        }
        boolean hasZero = false;
        for (double value : values) {
            if (!(value >= 0.0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("'componentWeights' must be non-negative and finite, got "
                    + Arrays.toString(values));
            }
            hasZero |= value == 0.0;
        }
        if (hasZero) {
            values = LogSpace.normalize(values);
        }
        double sum = LogSpace.sum(values);
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("'componentWeights' must sum to 1.0, got " + sum);
        }
        for (int k = 0; k < values.length; k++) {
            values[k] = Math.max(values[k], FLOOR);
        }
        this.logWeights = LogSpace.log(values);
    }

    /// Applies the MAP update using this instance's prior.
    ///
    /// @param accumulated responsibility mass per component
    public void maximize(double[] accumulated) {
        this.logWeights = LogSpace.log(mapEstimate(prior, accumulated));
    }

    /// `normalize(max(prior - 1 + accumulated, 1e-20))`
    public static double[] mapEstimate(double[] prior, double[] accumulated) {
        if (prior.length != accumulated.length) {
            throw new ShapeMismatchException("componentWeights",
                "prior has length " + prior.length + " but statistics have length " + accumulated.length);
        }
        double[] values = new double[prior.length];
        for (int k = 0; k < values.length; k++) {
            values[k] = Math.max(prior[k] - 1.0 + accumulated[k], FLOOR);
        }
        return LogSpace.normalize(values);
    }

    /// Indices of components whose weight collapsed to the floor during an update.
    public int[] flooredComponents() {
        return IntStream.range(0, nComponents)
            .filter(k -> logWeights[k] <= LOG_COLLAPSED)
            .toArray();
    }

    @Override
    public String toString() {
        return "MixtureWeights" + Arrays.toString(get());
    }
}
