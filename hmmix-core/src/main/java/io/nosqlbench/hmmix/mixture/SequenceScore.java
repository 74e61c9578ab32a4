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

import io.nosqlbench.hmmix.math.LogSpace;

/// Mixture score of one sequence.
///
/// @param logLikelihood `log P(sequence)` under the mixture, `-Infinity` when no component can generate it
/// @param logResponsibilities `log P(component | sequence)` per component; the exponentials sum to one
public record SequenceScore(double logLikelihood, double[] logResponsibilities) {

    /// Linear responsibilities.
    public double[] responsibilities() {
        return LogSpace.exp(logResponsibilities);
    }

    /// Index of the most responsible component, lowest index on ties.
    public int mostLikelyComponent() {
        return LogSpace.argmax(logResponsibilities);
    }
}
