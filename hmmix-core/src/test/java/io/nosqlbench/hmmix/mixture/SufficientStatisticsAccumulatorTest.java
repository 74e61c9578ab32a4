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
import io.nosqlbench.hmmix.hmm.MultinomialHmm;
import io.nosqlbench.hmmix.hmm.PoissonHmm;
import io.nosqlbench.hmmix.hmm.RateStatistics;
import io.nosqlbench.hmmix.math.LogSpace;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.Sequence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SufficientStatisticsAccumulatorTest {

    private static List<ComponentHmm> poissonPair() {
        PoissonHmm low = new PoissonHmm(2);
        low.setRates(new double[] {1.0, 3.0});
        PoissonHmm high = new PoissonHmm(2);
        high.setRates(new double[] {15.0, 30.0});
        return List.of(low, high);
    }

    @Test
    void responsibilityMassSumsToSequenceCount() {
        List<ComponentHmm> hmms = poissonPair();
        MixtureWeights weights = new MixtureWeights(2, null);
        Dataset dataset = Dataset.of(Sequence.ofCounts(1, 2, 0), Sequence.ofCounts(20, 25), Sequence.ofCounts(8, 9, 10));

        SufficientStatisticsAccumulator.Outer outer =
            new SufficientStatisticsAccumulator(hmms, weights, ParamGroup.all()).accumulateAll(dataset);

        assertThat(LogSpace.sum(outer.componentWeights())).isCloseTo(3.0, within(1e-9));
        assertThat(outer.sequences()).isEqualTo(3);
    }

    @Test
    void logLikelihoodMatchesTheResponsibilityEngine() {
        List<ComponentHmm> hmms = poissonPair();
        MixtureWeights weights = new MixtureWeights(2, null);
        weights.set(new double[] {0.3, 0.7}, null);
        Dataset dataset = Dataset.of(Sequence.ofCounts(1, 2, 0), Sequence.ofCounts(20, 25));

        SufficientStatisticsAccumulator.Outer outer =
            new SufficientStatisticsAccumulator(hmms, weights, ParamGroup.all()).accumulateAll(dataset);

        ResponsibilityEngine engine = new ResponsibilityEngine(hmms, weights);
        double expected = engine.scoreOne(dataset.get(0)).logLikelihood() + engine.scoreOne(dataset.get(1)).logLikelihood();
        assertThat(outer.logLikelihood()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void innerStatisticsAreScaledByResponsibility() {
        List<ComponentHmm> hmms = poissonPair();
        MixtureWeights weights = new MixtureWeights(2, null);
        Sequence sequence = Sequence.ofCounts(5, 6, 7);
        SufficientStatisticsAccumulator accumulator = new SufficientStatisticsAccumulator(hmms, weights, ParamGroup.all());
        SufficientStatisticsAccumulator.Outer outer = accumulator.newOuter();

        accumulator.accumulate(outer, sequence);

        double[] resp = new ResponsibilityEngine(hmms, weights).scoreOne(sequence).responsibilities();
        for (int k = 0; k < 2; k++) {
            RateStatistics stats = (RateStatistics) outer.hmmStatistics().get(k);
            assertThat(LogSpace.sum(stats.post())).isCloseTo(3.0 * resp[k], within(1e-9));
            assertThat(LogSpace.sum(stats.obs())).isCloseTo(18.0 * resp[k], within(1e-9));
            assertThat(LogSpace.sum(stats.start())).isCloseTo(resp[k], within(1e-9));
        }
    }

    @Test
    void lengthOneSequenceAddsStartMassButNoTransitions() {
        MultinomialHmm hmm = new MultinomialHmm(2, 3);
        MixtureWeights weights = new MixtureWeights(1, null);
        SufficientStatisticsAccumulator.Outer outer =
            new SufficientStatisticsAccumulator(List.of(hmm), weights, ParamGroup.all())
                .accumulateAll(Dataset.of(Sequence.ofSymbols(1)));

        assertThat(LogSpace.sum(outer.hmmStatistics().get(0).start())).isCloseTo(1.0, within(1e-12));
        for (double[] row : outer.hmmStatistics().get(0).trans()) {
            assertThat(row).containsOnly(0.0);
        }
    }

    @Test
    void excludedGroupsStayEmpty() {
        List<ComponentHmm> hmms = poissonPair();
        SufficientStatisticsAccumulator.Outer outer =
            new SufficientStatisticsAccumulator(hmms, new MixtureWeights(2, null), ParamGroup.parse("p"))
                .accumulateAll(Dataset.of(Sequence.ofCounts(2, 3, 4)));

        RateStatistics stats = (RateStatistics) outer.hmmStatistics().get(0);
        assertThat(stats.post()).containsOnly(0.0);
        assertThat(stats.start()).containsOnly(0.0);
        assertThat(LogSpace.sum(outer.componentWeights())).isCloseTo(1.0, within(1e-12));
    }
}
