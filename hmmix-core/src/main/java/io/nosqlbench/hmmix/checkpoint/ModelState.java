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


package io.nosqlbench.hmmix.checkpoint;

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.hmmix.hmm.ComponentHmm;
import io.nosqlbench.hmmix.mixture.MixtureHmm;
import io.nosqlbench.hmmix.mixture.MixtureHmmConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Serializable snapshot of a fitted [MixtureHmm].
///
/// ## JSON Schema
///
/// ```json
/// {
///   "version": 1,
///   "checksum": "sha256:abc123...",
///   "saved_at": 1760745600000,
///   "config": { "emission_family": "poisson", "n_components": 2, ... },
///   "component_weights": [0.4, 0.6],
///   "hmms": [ { "type": "poisson", "n_states": 2, ... }, ... ]
/// }
/// ```
///
/// @param version format version, see [#CURRENT_VERSION]
/// @param checksum `sha256:` digest of the snapshot serialized with a null checksum, or null before saving
/// @param savedAt wall-clock save time in epoch milliseconds
/// @param config the model configuration
/// @param componentWeights linear mixture weights
/// @param hmms component HMMs, empty for an unfitted model
/// @see ModelCheckpoints
public record ModelState(
    @SerializedName("version") int version,
    @SerializedName("checksum") String checksum,
    @SerializedName("saved_at") long savedAt,
    @SerializedName("config") MixtureHmmConfig config,
    @SerializedName("component_weights") double[] componentWeights,
    @SerializedName("hmms") List<ComponentHmm> hmms
) {

    /// Current snapshot format version.
    public static final int CURRENT_VERSION = 1;

    public ModelState {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(componentWeights, "componentWeights cannot be null");
        hmms = hmms == null ? List.of() : List.copyOf(hmms);
    }

    /// Captures the current parameters of `model`. The HMMs are copied.
    public static ModelState from(MixtureHmm model) {
        List<ComponentHmm> copies = new ArrayList<>();
        for (ComponentHmm hmm : model.getHmms()) {
            copies.add(hmm.copy());
        }
        return new ModelState(CURRENT_VERSION, null, System.currentTimeMillis(),
            model.getConfig(), model.getComponentWeights(), copies);
    }

    /// Same snapshot with a different checksum.
    public ModelState withChecksum(String newChecksum) {
        return new ModelState(version, newChecksum, savedAt, config, componentWeights, hmms);
    }

    /// Rebuilds a model holding copies of this snapshot's HMMs and weights.
    ///
    /// @throws io.nosqlbench.hmmix.model.ShapeMismatchException if the HMMs disagree with the configuration
    public MixtureHmm toModel() {
        List<ComponentHmm> copies = new ArrayList<>();
        for (ComponentHmm hmm : hmms) {
            copies.add(hmm.copy());
        }
        MixtureHmm model = new MixtureHmm(config, copies.isEmpty() ? null : copies);
        model.setComponentWeights(componentWeights.clone());
        return model;
    }
}
