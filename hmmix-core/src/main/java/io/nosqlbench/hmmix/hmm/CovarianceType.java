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

import com.google.gson.annotations.SerializedName;

/// Covariance structure of a Gaussian emission model.
public enum CovarianceType {
    /// One variance per state, shared by all features.
    @SerializedName("spherical")
    SPHERICAL,
    /// One variance per state and feature.
    @SerializedName("diag")
    DIAG,
    /// One full covariance matrix shared by all states.
    @SerializedName("tied")
    TIED,
    /// One full covariance matrix per state.
    @SerializedName("full")
    FULL;

    /// Whether the structure only needs per-feature second moments.
    public boolean isDiagonal() {
        return this == SPHERICAL || this == DIAG;
    }
}
