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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for model checkpoints and trace output.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Readable checkpoint files |
/// | HTML escaping | Disabled | Plain numeric output |
/// | Special floats | Serialized | `-Infinity` log-likelihoods survive |
/// | HMM adapter | Registered | Polymorphic [io.nosqlbench.hmmix.hmm.ComponentHmm] support |
///
/// The shared [Gson] instance is thread-safe.
///
/// @see ComponentHmmTypeAdapterFactory
/// @see ModelCheckpoints
public final class HmmixGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private HmmixGsonConfig() {
    }

    /// @return the shared pretty-printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// A builder preloaded with the checkpoint defaults, for callers that need to customise further.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(ComponentHmmTypeAdapterFactory.create());
    }

    /// Single-line variant for NDJSON output.
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(ComponentHmmTypeAdapterFactory.create())
            .create();
    }
}
