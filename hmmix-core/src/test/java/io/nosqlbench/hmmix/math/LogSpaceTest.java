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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class LogSpaceTest {

    private static final double NEG_INF = Double.NEGATIVE_INFINITY;

    @Test
    void logSumExpMatchesDirectComputation() {
        double[] values = {Math.log(0.2), Math.log(0.3), Math.log(0.5)};
        assertThat(LogSpace.logSumExp(values)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void logSumExpDoesNotOverflowForLargeValues() {
        double[] values = {1000.0, 1000.0};
        assertThat(LogSpace.logSumExp(values)).isCloseTo(1000.0 + Math.log(2.0), within(1e-9));
    }

    @Test
    void logSumExpOfAllNegativeInfinityIsNegativeInfinity() {
        assertThat(LogSpace.logSumExp(new double[] {NEG_INF, NEG_INF})).isEqualTo(NEG_INF);
    }

    @Test
    void logSumExpIgnoresNegativeInfinityEntries() {
        assertThat(LogSpace.logSumExp(new double[] {NEG_INF, 0.0})).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void logSumExpAlongAxes() {
        double[][] matrix = {
            {0.0, NEG_INF},
            {0.0, 0.0}
        };
        double[] columns = LogSpace.logSumExp(matrix, 0);
        double[] rows = LogSpace.logSumExp(matrix, 1);

        assertThat(columns[0]).isCloseTo(Math.log(2.0), within(1e-12));
        assertThat(columns[1]).isCloseTo(0.0, within(1e-12));
        assertThat(rows[0]).isCloseTo(0.0, within(1e-12));
        assertThat(rows[1]).isCloseTo(Math.log(2.0), within(1e-12));
        assertThatThrownBy(() -> LogSpace.logSumExp(matrix, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeSumsToOneAndLeavesNoZeros() {
        double[] normalized = LogSpace.normalize(new double[] {0.0, 3.0, 1.0});
        assertThat(LogSpace.sum(normalized)).isCloseTo(1.0, within(1e-12));
        assertThat(normalized[0]).isGreaterThan(0.0);
        assertThat(normalized[1]).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void normalizeOfZerosIsUniform() {
        double[] normalized = LogSpace.normalize(new double[4]);
        assertThat(normalized).containsOnly(0.25);
    }

    @Test
    void logNormalizeShiftsToUnitMass() {
        double[] out = LogSpace.logNormalize(new double[] {Math.log(2.0), Math.log(6.0)});
        assertThat(Math.exp(out[0])).isCloseTo(0.25, within(1e-12));
        assertThat(Math.exp(out[1])).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void logNormalizeOfAllNegativeInfinityIsUniform() {
        double[] out = LogSpace.logNormalize(new double[] {NEG_INF, NEG_INF});
        assertThat(out[0]).isCloseTo(Math.log(0.5), within(1e-12));
        assertThat(out[1]).isCloseTo(Math.log(0.5), within(1e-12));
    }

    @Test
    void argmaxPrefersLowestIndexOnTies() {
        assertThat(LogSpace.argmax(new double[] {1.0, 3.0, 3.0, 2.0})).isEqualTo(1);
    }

    @Test
    void logOfZeroIsNegativeInfinity() {
        assertThat(LogSpace.log(new double[] {0.0, 1.0})).containsExactly(NEG_INF, 0.0);
    }
}
