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

import java.util.Arrays;

/// Numerically stable log-domain arithmetic.
///
/// All functions are pure. `-Infinity` stands for a zero probability and is
/// propagated rather than turned into NaN.
public final class LogSpace {

    /// Smallest increment added by [#normalize(double[])] so no entry is an exact zero.
    public static final double EPS = Math.ulp(1.0);

    private LogSpace() {
        // Utility class
    }

    /// Computes `log(sum(exp(values)))` without overflow.
    ///
    /// @return `-Infinity` when every value is `-Infinity`
    public static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > max) max = v;
        }
        if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY) {
            return max;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /// Reduces a matrix with [#logSumExp(double[])] along `axis`.
    ///
    /// Axis 0 collapses rows and yields one value per column; axis 1 collapses
    /// columns and yields one value per row.
    public static double[] logSumExp(double[][] values, int axis) {
        if (axis == 1) {
            double[] out = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                out[i] = logSumExp(values[i]);
            }
            return out;
        }
        if (axis != 0) {
            throw new IllegalArgumentException("axis must be 0 or 1, got: " + axis);
        }
        int columns = values[0].length;
        double[] out = new double[columns];
        double[] column = new double[values.length];
        for (int j = 0; j < columns; j++) {
            for (int i = 0; i < values.length; i++) {
                column[i] = values[i][j];
            }
            out[j] = logSumExp(column);
        }
        return out;
    }

    /// Scales a non-negative vector to sum to one.
    ///
    /// [#EPS] is added to every entry first, so the result has no exact zeros and an
    /// all-zero input becomes uniform.
    public static double[] normalize(double[] values) {
        double[] out = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] + EPS;
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }

    /// Shifts log-values so their exponentials sum to one.
    ///
    /// When every value is `-Infinity` there is no mass to normalize and the
    /// uniform log-distribution is returned.
    public static double[] logNormalize(double[] logValues) {
        double total = logSumExp(logValues);
        double[] out = new double[logValues.length];
        if (total == Double.NEGATIVE_INFINITY) {
            Arrays.fill(out, -Math.log(logValues.length));
            return out;
        }
        for (int i = 0; i < logValues.length; i++) {
            out[i] = logValues[i] - total;
        }
        return out;
    }

    /// Element-wise exponential.
    public static double[] exp(double[] logValues) {
        double[] out = new double[logValues.length];
        for (int i = 0; i < logValues.length; i++) {
            out[i] = Math.exp(logValues[i]);
        }
        return out;
    }

    /// Element-wise natural logarithm; zero maps to `-Infinity`.
    public static double[] log(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.log(values[i]);
        }
        return out;
    }

    /// Index of the largest value; ties resolve to the lowest index.
    public static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    public static double sum(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }
}
