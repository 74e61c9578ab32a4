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

import io.nosqlbench.hmmix.math.RandomGenerators;
import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.Sequence;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.apache.commons.math3.special.Gamma;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class EmissionFamiliesTest {

    /// One E-step and M-step of `hmm` over `sequence`, emissions only.
    private static void fitEmissions(ComponentHmm hmm, Sequence... sequences) {
        HmmStatistics stats = hmm.initStatistics();
        for (Sequence sequence : sequences) {
            double[][] frames = hmm.frameLogLikelihood(sequence);
            ForwardResult forward = hmm.forwardPass(frames);
            double[][] backward = hmm.backwardPass(frames);
            double[][] gamma = ComponentHmm.posteriors(forward.lattice(), backward);
            hmm.accumulate(stats, sequence, frames, gamma, forward.lattice(), backward, ParamGroup.all());
        }
        hmm.maximize(stats, EnumSet.of(ParamGroup.EMISSIONS));
    }

    @Test
    void multinomialRejectsSymbolsOutsideItsAlphabet() {
        MultinomialHmm hmm = new MultinomialHmm(2, 3);
        assertThatThrownBy(() -> hmm.score(Sequence.ofSymbols(0, 3)))
            .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> hmm.checkCompatible(Dataset.of(Sequence.ofSymbols(0, 4))))
            .isInstanceOf(ShapeMismatchException.class);
        assertThatCode(() -> hmm.checkCompatible(Dataset.of(Sequence.ofSymbols(0, 2))))
            .doesNotThrowAnyException();
        assertThat(hmm.family()).isEqualTo(EmissionFamily.MULTINOMIAL);
    }

    @Test
    void multinomialEmissionUpdateIsSymbolFrequency() {
        MultinomialHmm hmm = new MultinomialHmm(1, 3);
        fitEmissions(hmm, Sequence.ofSymbols(0, 0, 1, 0));
        double[] row = hmm.getEmissionProb()[0];
        assertThat(row[0]).isCloseTo(0.75, within(1e-9));
        assertThat(row[1]).isCloseTo(0.25, within(1e-9));
        assertThat(row[2]).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void multinomialInitialisationGivesDistributions() {
        MultinomialHmm hmm = new MultinomialHmm(3, 4);
        hmm.initialize(Dataset.of(Sequence.ofSymbols(0, 1, 2, 3, 3)), ParamGroup.all(), RandomGenerators.create(1L));
        for (double[] row : hmm.getEmissionProb()) {
            double sum = 0;
            for (double p : row) {
                assertThat(p).isPositive();
                sum += p;
            }
            assertThat(sum).isCloseTo(1.0, within(1e-9));
        }
        assertThat(hmm.getStartProb()).containsOnly(1.0 / 3);
    }

    @Test
    void poissonFrameLikelihoodIsThePoissonPmf() {
        PoissonHmm hmm = new PoissonHmm(2);
        hmm.setRates(new double[] {2.0, 5.0});
        double[][] frames = hmm.frameLogLikelihood(Sequence.ofCounts(3));
        assertThat(frames[0][0]).isCloseTo(3 * Math.log(2.0) - 2.0 - Math.log(6.0), within(1e-12));
        assertThat(frames[0][1]).isCloseTo(3 * Math.log(5.0) - 5.0 - Gamma.logGamma(4.0), within(1e-12));
    }

    @Test
    void poissonRateUpdateIsWeightedMean() {
        PoissonHmm hmm = new PoissonHmm(1);
        fitEmissions(hmm, Sequence.ofCounts(2, 4, 6), Sequence.ofCounts(8));
        assertThat(hmm.getRates()[0]).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void poissonRatesAreFloored() {
        PoissonHmm hmm = new PoissonHmm(1);
        fitEmissions(hmm, Sequence.ofCounts(0, 0, 0));
        assertThat(hmm.getRates()[0]).isEqualTo(PoissonHmm.MIN_RATE);
    }

    @Test
    void poissonRejectsInvalidRates() {
        PoissonHmm hmm = new PoissonHmm(2);
        assertThatThrownBy(() -> hmm.setRates(new double[] {1.0})).isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> hmm.setRates(new double[] {1.0, 0.0})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hmm.setRatesVar(-1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void poissonInitialisationCentresOnTheDataMean() {
        PoissonHmm hmm = new PoissonHmm(4).setRatesVar(0.0);
        hmm.initialize(Dataset.of(Sequence.ofCounts(10, 20, 30)), ParamGroup.all(), RandomGenerators.create(3L));
        assertThat(hmm.getRates()).containsOnly(20.0);
    }

    @Test
    void exponentialFrameLikelihood() {
        ExponentialHmm hmm = new ExponentialHmm(1);
        hmm.setRates(new double[] {2.0});
        double[][] frames = hmm.frameLogLikelihood(Sequence.ofValues(0.5, -1.0));
        assertThat(frames[0][0]).isCloseTo(Math.log(2.0) - 1.0, within(1e-12));
        assertThat(frames[1][0]).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void exponentialRateUpdateIsInverseMean() {
        ExponentialHmm hmm = new ExponentialHmm(1);
        fitEmissions(hmm, Sequence.ofValues(0.5, 1.5, 1.0));
        assertThat(hmm.getRates()[0]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void exponentialStateWithZeroDurationsKeepsItsRate() {
        ExponentialHmm hmm = new ExponentialHmm(1);
        hmm.setRates(new double[] {3.0});
        fitEmissions(hmm, Sequence.ofValues(0.0, 0.0));
        assertThat(hmm.getRates()[0]).isEqualTo(3.0);
    }

    @Test
    void exponentialSamplesAreNonNegative() {
        ExponentialHmm hmm = new ExponentialHmm(2);
        SampledSequence sampled = hmm.sample(100, RandomGenerators.create(8L));
        for (int t = 0; t < 100; t++) {
            assertThat(sampled.observations().value(t)).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void gaussianFrameLikelihoodMatchesUnivariateDensity() {
        GaussianHmm hmm = new GaussianHmm(1, 1, CovarianceType.DIAG);
        hmm.setMeans(new double[][] {{1.0}});
        hmm.setCovars(new double[][][] {{{4.0}}});
        double x = 2.0;
        double expected = -0.5 * Math.log(2 * Math.PI * 4.0) - (x - 1.0) * (x - 1.0) / (2 * 4.0);
        assertThat(hmm.frameLogLikelihood(Sequence.ofValues(x))[0][0]).isCloseTo(expected, within(1e-12));
    }

    @Test
    void gaussianFullCovarianceMatchesClosedForm() {
        GaussianHmm hmm = new GaussianHmm(1, 2, CovarianceType.FULL);
        double[][] cov = {{2.0, 0.6}, {0.6, 1.0}};
        hmm.setCovars(new double[][][] {cov});
        double det = 2.0 * 1.0 - 0.6 * 0.6;
        double[] x = {1.0, -1.0};
        double quad = (x[0] * x[0] * cov[1][1] - 2 * x[0] * x[1] * cov[0][1] + x[1] * x[1] * cov[0][0]) / det;
        double expected = -0.5 * (2 * Math.log(2 * Math.PI) + Math.log(det) + quad);
        double actual = hmm.frameLogLikelihood(Sequence.ofVectors(new double[][] {x}))[0][0];
        assertThat(actual).isCloseTo(expected, within(1e-10));
    }

    @Test
    void gaussianRejectsCovariancesThatBreakTheirType() {
        GaussianHmm diag = new GaussianHmm(1, 2, CovarianceType.DIAG);
        assertThatThrownBy(() -> diag.setCovars(new double[][][] {{{1.0, 0.1}, {0.1, 1.0}}}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("diagonal");

        GaussianHmm spherical = new GaussianHmm(1, 2, CovarianceType.SPHERICAL);
        assertThatThrownBy(() -> spherical.setCovars(new double[][][] {{{1.0, 0.0}, {0.0, 2.0}}}))
            .isInstanceOf(IllegalArgumentException.class);

        GaussianHmm tied = new GaussianHmm(2, 1, CovarianceType.TIED);
        assertThatThrownBy(() -> tied.setCovars(new double[][][] {{{1.0}}, {{2.0}}}))
            .isInstanceOf(IllegalArgumentException.class);

        GaussianHmm full = new GaussianHmm(1, 2, CovarianceType.FULL);
        assertThatThrownBy(() -> full.setCovars(new double[][][] {{{1.0, 2.0}, {2.0, 1.0}}}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive-definite");
        assertThatThrownBy(() -> full.setCovars(new double[][][] {{{1.0}}}))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void gaussianDiagonalUpdateIsWeightedMomentPlusFloor() {
        GaussianHmm hmm = new GaussianHmm(1, 2, CovarianceType.DIAG).setMinCovar(0.01);
        fitEmissions(hmm, Sequence.ofVectors(new double[][] {{1.0, 10.0}, {3.0, 10.0}}));
        assertThat(hmm.getMeans()[0]).containsExactly(new double[] {2.0, 10.0}, within(1e-9));
        double[][] cov = hmm.getCovars()[0];
        assertThat(cov[0][0]).isCloseTo(1.01, within(1e-9));
        assertThat(cov[1][1]).isCloseTo(0.01, within(1e-9));
        assertThat(cov[0][1]).isZero();
    }

    @Test
    void gaussianSphericalUpdateAveragesVariances() {
        GaussianHmm hmm = new GaussianHmm(1, 2, CovarianceType.SPHERICAL).setMinCovar(0.0);
        fitEmissions(hmm, Sequence.ofVectors(new double[][] {{1.0, 0.0}, {3.0, 0.0}}));
        double[][] cov = hmm.getCovars()[0];
        assertThat(cov[0][0]).isCloseTo(0.5, within(1e-9));
        assertThat(cov[1][1]).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void gaussianFullUpdateCapturesCorrelation() {
        GaussianHmm hmm = new GaussianHmm(1, 2, CovarianceType.FULL).setMinCovar(0.0);
        fitEmissions(hmm, Sequence.ofVectors(new double[][] {{-1.0, -2.0}, {1.0, 2.0}}));
        double[][] cov = hmm.getCovars()[0];
        assertThat(cov[0][0]).isCloseTo(1.0, within(1e-9));
        assertThat(cov[0][1]).isCloseTo(2.0, within(1e-9));
        assertThat(cov[1][0]).isEqualTo(cov[0][1]);
        assertThat(cov[1][1]).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void gaussianTiedUpdateSharesOneMatrix() {
        GaussianHmm hmm = new GaussianHmm(2, 1, CovarianceType.TIED);
        hmm.setMeans(new double[][] {{-5.0}, {5.0}});
        fitEmissions(hmm, Sequence.ofVectors(new double[][] {{-6.0}, {-4.0}, {4.0}, {6.0}}));
        double[][][] covars = hmm.getCovars();
        assertThat(covars[0]).isDeepEqualTo(covars[1]);
        assertThat(hmm.getMeans()[0][0]).isCloseTo(-5.0, within(1e-3));
    }

    @Test
    void gaussianRejectsWrongDimension() {
        GaussianHmm hmm = new GaussianHmm(2, 3, CovarianceType.DIAG);
        assertThatThrownBy(() -> hmm.checkCompatible(Dataset.of(Sequence.ofValues(1.0, 2.0))))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void gaussianSamplesHaveTheModelDimension() {
        GaussianHmm hmm = new GaussianHmm(2, 3, CovarianceType.FULL);
        SampledSequence sampled = hmm.sample(10, RandomGenerators.create(4L));
        assertThat(sampled.observations().dimension()).isEqualTo(3);
        assertThat(sampled.states()).hasSize(10);
    }
}
