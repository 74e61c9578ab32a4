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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SequenceTest {

    @Test
    void scalarSequenceExposesValues() {
        Sequence sequence = Sequence.ofSymbols(0, 2, 1);
        assertThat(sequence.length()).isEqualTo(3);
        assertThat(sequence.dimension()).isEqualTo(1);
        assertThat(sequence.symbol(1)).isEqualTo(2);
        assertThat(sequence.value(2)).isEqualTo(1.0);
        assertThat(sequence).hasToString("[0.0, 2.0, 1.0]");
    }

    @Test
    void vectorSequenceIsDefensivelyCopied() {
        double[][] frames = {{1.0, 2.0}, {3.0, 4.0}};
        Sequence sequence = Sequence.ofVectors(frames);
        frames[0][0] = 99.0;
        assertThat(sequence.get(0, 0)).isEqualTo(1.0);

        double[] frame = sequence.frame(1);
        frame[1] = -1.0;
        assertThat(sequence.get(1, 1)).isEqualTo(4.0);
        assertThat(sequence.dimension()).isEqualTo(2);
    }

    @Test
    void emptySequenceIsRejected() {
        assertThatThrownBy(Sequence::ofSymbols)
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("at least one frame");
    }

    @Test
    void raggedFramesAreRejected() {
        assertThatThrownBy(() -> Sequence.ofVectors(new double[][] {{1.0, 2.0}, {3.0}}))
            .isInstanceOf(ShapeMismatchException.class)
            .extracting(e -> ((ShapeMismatchException) e).argument())
            .isEqualTo("sequence");
    }

    @Test
    void equalityIsByContent() {
        assertThat(Sequence.ofCounts(1, 2)).isEqualTo(Sequence.ofValues(1.0, 2.0));
        assertThat(Sequence.ofCounts(1, 2)).hasSameHashCodeAs(Sequence.ofValues(1.0, 2.0));
        assertThat(Sequence.ofCounts(1, 2)).isNotEqualTo(Sequence.ofCounts(2, 1));
    }

    @Test
    void datasetReportsTotalsAndDimension() {
        Dataset dataset = Dataset.of(Sequence.ofCounts(1, 2, 3), Sequence.ofCounts(7));
        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.totalLength()).isEqualTo(4);
        assertThat(dataset.dimension()).isEqualTo(1);
        assertThat(dataset.maxValue()).isEqualTo(7.0);
    }

    @Test
    void datasetRejectsEmptyAndMixedDimensions() {
        assertThatThrownBy(() -> Dataset.of(List.of()))
            .isInstanceOf(ShapeMismatchException.class);

        Dataset mixed = Dataset.of(Sequence.ofValues(1.0), Sequence.ofVectors(new double[][] {{1.0, 2.0}}));
        assertThatThrownBy(mixed::dimension)
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("dimension");
    }

    @Test
    void datasetToStringTruncatesLongInputs() {
        Sequence[] many = new Sequence[25];
        for (int i = 0; i < many.length; i++) {
            many[i] = Sequence.ofCounts(i);
        }
        assertThat(Dataset.of(many).toString()).endsWith("... (5 more)]");
    }
}
