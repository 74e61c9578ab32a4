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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class RandomGeneratorsTest {

    @Test
    void sameSeedGivesSameStream() {
        UniformRandomProvider a = RandomGenerators.create(42L);
        UniformRandomProvider b = RandomGenerators.create(42L);
        for (int i = 0; i < 100; i++) {
            assertThat(a.nextLong()).isEqualTo(b.nextLong());
        }
    }

    @Test
    void seededStreamIsXoShiRo256PlusPlus() {
        UniformRandomProvider actual = RandomGenerators.create(7L);
        UniformRandomProvider expected = RandomSource.XO_SHI_RO_256_PP.create(7L);
        for (int i = 0; i < 10; i++) {
            assertThat(actual.nextLong()).isEqualTo(expected.nextLong());
        }
        assertThat(RandomGenerators.createUnseeded()).isInstanceOf(expected.getClass());
    }

    @Test
    void dirichletDrawIsADistribution() {
        double[] draw = RandomGenerators.dirichlet(RandomGenerators.create(1L), new double[] {1.0, 1.0, 1.0});
        assertThat(draw).hasSize(3);
        assertThat(LogSpace.sum(draw)).isCloseTo(1.0, within(1e-9));
        for (double p : draw) {
            assertThat(p).isBetween(0.0, 1.0);
        }
    }

    @Test
    void singleCategoryDirichletIsDegenerate() {
        assertThat(RandomGenerators.dirichlet(RandomGenerators.create(1L), new double[] {3.0})).containsExactly(1.0);
    }

    @Test
    void categoricalFollowsProbabilities() {
        UniformRandomProvider rng = RandomGenerators.create(7L);
        double[] probabilities = {0.1, 0.0, 0.9};
        int[] counts = new int[3];
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            counts[RandomGenerators.categorical(rng, probabilities)]++;
        }
        assertThat(counts[1]).isZero();
        assertThat(counts[2] / (double) draws).isCloseTo(0.9, within(0.02));
    }

    @Test
    void poissonWithNonPositiveMeanIsZero() {
        assertThat(RandomGenerators.poisson(RandomGenerators.create(3L), 0.0)).isZero();
    }

    @Test
    void poissonSampleMeanTracksRate() {
        UniformRandomProvider rng = RandomGenerators.create(11L);
        double total = 0;
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            total += RandomGenerators.poisson(rng, 4.0);
        }
        assertThat(total / draws).isCloseTo(4.0, within(0.1));
    }

    @Test
    void exponentialSampleMeanTracksMean() {
        UniformRandomProvider rng = RandomGenerators.create(13L);
        double total = 0;
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            double x = RandomGenerators.exponential(rng, 2.0);
            assertThat(x).isGreaterThanOrEqualTo(0.0);
            total += x;
        }
        assertThat(total / draws).isCloseTo(2.0, within(0.1));
    }

    @Test
    void uniformIntIsInclusive() {
        UniformRandomProvider rng = RandomGenerators.create(5L);
        boolean sawMin = false;
        boolean sawMax = false;
        for (int i = 0; i < 1000; i++) {
            int v = RandomGenerators.uniformInt(rng, 3, 5);
            assertThat(v).isBetween(3, 5);
            sawMin |= v == 3;
            sawMax |= v == 5;
        }
        assertThat(sawMin).isTrue();
        assertThat(sawMax).isTrue();
        assertThat(RandomGenerators.uniformInt(rng, 4, 4)).isEqualTo(4);
        assertThatThrownBy(() -> RandomGenerators.uniformInt(rng, 5, 4))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
