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

import java.util.Arrays;
import java.util.Objects;

/// Immutable ordered list of observation frames.
///
/// Every frame holds `dimension()` values. Discrete families (multinomial,
/// Poisson) and the exponential family use one value per frame; Gaussian
/// emissions may use feature vectors of any fixed width.
///
/// ```java
/// Sequence symbols = Sequence.ofSymbols(0, 1, 1, 3);
/// Sequence vectors = Sequence.ofVectors(new double[][]{{0.1, 2.0}, {0.3, 1.8}});
/// ```
public final class Sequence {

    private final double[][] frames;

    private Sequence(double[][] frames) {
        if (frames.length == 0) {
            throw new ShapeMismatchException("sequence", "must contain at least one frame");
        }
        int dimension = frames[0].length;
        if (dimension == 0) {
            throw new ShapeMismatchException("sequence", "frames must have at least one value");
        }
        double[][] copy = new double[frames.length][];
        for (int t = 0; t < frames.length; t++) {
            if (frames[t].length != dimension) {
                throw new ShapeMismatchException("sequence",
                    "frame " + t + " has " + frames[t].length + " values, expected " + dimension);
            }
            copy[t] = frames[t].clone();
        }
        this.frames = copy;
    }

    /// Creates a sequence of discrete symbols for multinomial emissions.
    public static Sequence ofSymbols(int... symbols) {
        return ofCounts(symbols);
    }

    /// Creates a sequence of event counts for Poisson emissions.
    public static Sequence ofCounts(int... counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        double[][] frames = new double[counts.length][1];
        for (int t = 0; t < counts.length; t++) {
            frames[t][0] = counts[t];
        }
        return new Sequence(frames);
    }

    /// Creates a sequence of scalar real observations.
    public static Sequence ofValues(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[][] frames = new double[values.length][1];
        for (int t = 0; t < values.length; t++) {
            frames[t][0] = values[t];
        }
        return new Sequence(frames);
    }

    /// Creates a sequence of feature vectors; all rows must have the same width.
    public static Sequence ofVectors(double[][] vectors) {
        Objects.requireNonNull(vectors, "vectors cannot be null");
        return new Sequence(vectors);
    }

    public int length() {
        return frames.length;
    }

    public int dimension() {
        return frames[0].length;
    }

    /// Returns the first value of frame `t`.
    public double value(int t) {
        return frames[t][0];
    }

    /// Returns frame `t` as a discrete symbol or count.
    public int symbol(int t) {
        return (int) frames[t][0];
    }

    /// Returns a copy of frame `t`.
    public double[] frame(int t) {
        return frames[t].clone();
    }

    /// Returns a copy of all frames.
    public double[][] frames() {
        double[][] copy = new double[frames.length][];
        for (int t = 0; t < frames.length; t++) {
            copy[t] = frames[t].clone();
        }
        return copy;
    }

    /// Reads a frame value without copying; `t` is the time step, `d` the feature.
    public double get(int t, int d) {
        return frames[t][d];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequence)) return false;
        return Arrays.deepEquals(frames, ((Sequence) o).frames);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(frames);
    }

    @Override
    public String toString() {
        if (dimension() == 1) {
            double[] flat = new double[frames.length];
            for (int t = 0; t < frames.length; t++) {
                flat[t] = frames[t][0];
            }
            return Arrays.toString(flat);
        }
        return Arrays.deepToString(frames);
    }
}
