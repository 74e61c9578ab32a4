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


package io.nosqlbench.hmmix.math;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AhrensDieterExponentialSampler;
import org.apache.commons.rng.sampling.distribution.DirichletSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seedable random sources and the few distributions the models draw from.
 * Based on Apache Commons RNG.
 *
 * <p>Every method takes the generator explicitly; nothing here holds a shared
 * or global random state.
 */
public final class RandomGenerators {

    /**
     * XorShiRo256++: 256-bit state, fast, with good statistical quality.
     */
    private static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomGenerators() {
        // Utility class
    }

    /**
     * Creates a new random number generator with the specified seed.
     *
     * @param seed The seed for deterministic random generation
     * @return A restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return SOURCE.create(seed);
    }

    /**
     * Creates a generator seeded from system entropy, for callers that did not ask for reproducibility.
     *
     * @return A restorable uniform random provider
     */
    public static RestorableUniformRandomProvider createUnseeded() {
        return SOURCE.create();
    }

    /**
     * Draws a probability vector from a Dirichlet distribution.
     *
     * @param rng The random number generator
     * @param alpha Concentration parameters, all strictly positive
     * @return A vector of the same length as {@code alpha} summing to one
     */
    public static double[] dirichlet(UniformRandomProvider rng, double[] alpha) {
        if (alpha.length == 1) {
            // DirichletSampler needs at least two categories
            return new double[] {1.0};
        }
        return DirichletSampler.of(rng, alpha).sample();
    }

    /**
     * Draws an index from a discrete distribution by inverting its cumulative sum.
     *
     * @param rng The random number generator
     * @param probabilities Probabilities summing to one
     * @return The first index whose cumulative probability exceeds a uniform draw
     */
    public static int categorical(UniformRandomProvider rng, double[] probabilities) {
        double u = rng.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (cumulative > u) {
                return i;
            }
        }
        return probabilities.length - 1;
    }

    /**
     * Creates a standard normal sampler bound to {@code rng}.
     */
    public static NormalizedGaussianSampler gaussian(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }

    /**
     * Draws a Poisson count; a non-positive mean always yields zero.
     */
    public static int poisson(UniformRandomProvider rng, double mean) {
        if (mean <= 0) {
            return 0;
        }
        return PoissonSampler.of(rng, mean).sample();
    }

    /**
     * Draws an exponential variate with the given mean (the inverse of its rate).
     */
    public static double exponential(UniformRandomProvider rng, double mean) {
        return AhrensDieterExponentialSampler.of(rng, mean).sample();
    }

    /**
     * Draws an integer uniformly from {@code [min, max]}, both ends inclusive.
     */
    public static int uniformInt(UniformRandomProvider rng, int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min: " + min + " > " + max);
        }
        return min + rng.nextInt(max - min + 1);
    }
}
