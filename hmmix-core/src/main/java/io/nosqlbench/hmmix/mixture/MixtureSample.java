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

import io.nosqlbench.hmmix.model.Dataset;
import io.nosqlbench.hmmix.model.Sequence;

import java.util.List;

/// Sequences generated by [MixtureHmm#sample].
///
/// @param components the component that generated each sequence
/// @param observations the generated sequences
/// @param states the hidden state path behind each sequence
public record MixtureSample(int[] components, List<Sequence> observations, List<int[]> states) {

    public MixtureSample {
        observations = List.copyOf(observations);
        states = List.copyOf(states);
    }

    public int size() {
        return components.length;
    }

    /// The observations as a dataset, ready for [MixtureHmm#fit(Dataset)].
    public Dataset toDataset() {
        return Dataset.of(observations);
    }
}
