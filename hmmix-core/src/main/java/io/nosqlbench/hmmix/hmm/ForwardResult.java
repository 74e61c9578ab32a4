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

/// Output of [ComponentHmm#forwardPass(double[][])].
///
/// @param logLikelihood total log-probability of the sequence, `-Infinity` when impossible
/// @param lattice forward log-probabilities, `lattice[t][state]`
public record ForwardResult(double logLikelihood, double[][] lattice) {
}
