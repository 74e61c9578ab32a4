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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// Ordered, immutable collection of observation sequences.
///
/// Insertion order defines the index used by scoring and prediction results;
/// it carries no statistical meaning.
public final class Dataset implements Iterable<Sequence> {

    private static final int MAX_ECHOED_SEQUENCES = 20;

    private final List<Sequence> sequences;

    private Dataset(List<Sequence> sequences) {
        if (sequences.isEmpty()) {
            throw new ShapeMismatchException("dataset", "must contain at least one sequence");
        }
        for (int i = 0; i < sequences.size(); i++) {
            Objects.requireNonNull(sequences.get(i), "sequence " + i + " cannot be null");
        }
        this.sequences = Collections.unmodifiableList(new ArrayList<>(sequences));
    }

    public static Dataset of(Sequence... sequences) {
        Objects.requireNonNull(sequences, "sequences cannot be null");
        return new Dataset(List.of(sequences));
    }

    public static Dataset of(List<Sequence> sequences) {
        Objects.requireNonNull(sequences, "sequences cannot be null");
        return new Dataset(sequences);
    }

    public int size() {
        return sequences.size();
    }

    public Sequence get(int index) {
        return sequences.get(index);
    }

    public List<Sequence> sequences() {
        return sequences;
    }

    /// Total number of frames across all sequences.
    public int totalLength() {
        int total = 0;
        for (Sequence sequence : sequences) {
            total += sequence.length();
        }
        return total;
    }

    /// Returns the frame width shared by every sequence.
    ///
    /// @throws ShapeMismatchException if sequences disagree on their dimension
    public int dimension() {
        int dimension = sequences.get(0).dimension();
        for (int i = 1; i < sequences.size(); i++) {
            if (sequences.get(i).dimension() != dimension) {
                throw new ShapeMismatchException("dataset",
                    "sequence " + i + " has dimension " + sequences.get(i).dimension() + ", expected " + dimension);
            }
        }
        return dimension;
    }

    /// Largest first-feature value in the dataset, used to size symbol alphabets.
    public double maxValue() {
        double max = Double.NEGATIVE_INFINITY;
        for (Sequence sequence : sequences) {
            for (int t = 0; t < sequence.length(); t++) {
                max = Math.max(max, sequence.value(t));
            }
        }
        return max;
    }

    @Override
    public Iterator<Sequence> iterator() {
        return sequences.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Dataset[");
        int shown = Math.min(sequences.size(), MAX_ECHOED_SEQUENCES);
        for (int i = 0; i < shown; i++) {
            if (i > 0) sb.append(", ");
            sb.append(sequences.get(i));
        }
        if (sequences.size() > shown) {
            sb.append(", ... (").append(sequences.size() - shown).append(" more)");
        }
        return sb.append(']').toString();
    }
}
