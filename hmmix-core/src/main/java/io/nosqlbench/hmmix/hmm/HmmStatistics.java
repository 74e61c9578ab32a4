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

/// Sufficient statistics for one component HMM.
///
/// The shared part holds expected start-state occupancy and expected transition
/// counts; each emission family adds its own named fields. The same type serves
/// both as the per-sequence (inner) record built from one forward-backward pass
/// and as the iteration-wide (outer) record the M-step consumes.
public abstract sealed class HmmStatistics permits MultinomialStatistics, RateStatistics, GaussianStatistics {

    private final double[] start;
    private final double[][] trans;

    protected HmmStatistics(int nStates) {
        this.start = new double[nStates];
        this.trans = new double[nStates][nStates];
    }

    public int numStates() {
        return start.length;
    }

    /// Expected occupancy of each state at the first time step.
    public double[] start() {
        return start;
    }

    /// Expected number of transitions from state `i` (row) to state `j` (column).
    public double[][] trans() {
        return trans;
    }

    public void addStart(double[] posteriorRow) {
        for (int i = 0; i < start.length; i++) {
            start[i] += posteriorRow[i];
        }
    }

    public void addTransitions(double[][] counts) {
        for (int i = 0; i < trans.length; i++) {
            for (int j = 0; j < trans[i].length; j++) {
                trans[i][j] += counts[i][j];
            }
        }
    }

    /// Adds `weight` times every field of `other` into this record.
    ///
    /// @throws IllegalArgumentException if `other` belongs to another family or state count
    public void addScaled(HmmStatistics other, double weight) {
        if (other.getClass() != getClass() || other.numStates() != numStates()) {
            throw new IllegalArgumentException("Cannot fold " + other.getClass().getSimpleName()
                + " with " + other.numStates() + " states into " + getClass().getSimpleName()
                + " with " + numStates() + " states");
        }
        for (int i = 0; i < start.length; i++) {
            start[i] += weight * other.start[i];
            for (int j = 0; j < start.length; j++) {
                trans[i][j] += weight * other.trans[i][j];
            }
        }
        addEmissionsScaled(other, weight);
    }

    /// Family-specific part of [#addScaled]; `other` is already known to be the same type.
    protected abstract void addEmissionsScaled(HmmStatistics other, double weight);

    static void addScaled(double[] target, double[] source, double weight) {
        for (int i = 0; i < target.length; i++) {
            target[i] += weight * source[i];
        }
    }

    static void addScaled(double[][] target, double[][] source, double weight) {
        for (int i = 0; i < target.length; i++) {
            addScaled(target[i], source[i], weight);
        }
    }
}
