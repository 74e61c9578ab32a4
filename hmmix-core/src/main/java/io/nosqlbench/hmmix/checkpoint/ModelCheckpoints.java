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
import com.google.gson.JsonParseException;
import io.nosqlbench.hmmix.mixture.MixtureHmm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/// Saves and loads [ModelState] snapshots.
///
/// ## Atomic Writes
///
/// ```text
///   1. Serialize the snapshot with a null checksum
///   2. Compute the SHA-256 of that JSON
///   3. Write the snapshot with its checksum to model.json.tmp
///   4. Rename the temp file over model.json
/// ```
///
/// An interrupted save leaves any previous file intact.
///
/// ## Usage
///
/// ```java
/// ModelCheckpoints.save(Path.of("model.json"), model);
/// MixtureHmm restored = ModelCheckpoints.load(Path.of("model.json")).toModel();
/// ```
public final class ModelCheckpoints {

    private static final Logger logger = LogManager.getLogger(ModelCheckpoints.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private ModelCheckpoints() {
    }

    /// Snapshots `model` and saves it to `path`.
    public static ModelState save(Path path, MixtureHmm model) throws IOException {
        Objects.requireNonNull(model, "model cannot be null");
        return save(path, ModelState.from(model));
    }

    /// Saves `state` atomically with a freshly computed checksum.
    ///
    /// @return the state as written, checksum included
    /// @throws IOException if writing fails
    public static ModelState save(Path path, ModelState state) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(state, "state cannot be null");

        Gson gson = HmmixGsonConfig.gson();
        ModelState withChecksum = state.withChecksum(computeChecksum(gson.toJson(state.withChecksum(null))));
        String json = gson.toJson(withChecksum);

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved {}-component model to {}", withChecksum.componentWeights().length, path);
        return withChecksum;
    }

    /// Loads and verifies a snapshot.
    ///
    /// @throws IOException if reading fails
    /// @throws CheckpointException if the file is missing, malformed, of another version or fails its checksum
    public static ModelState load(Path path) throws IOException, CheckpointException {
        return load(path, true);
    }

    public static ModelState load(Path path, boolean verifyChecksum) throws IOException, CheckpointException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new CheckpointException("Checkpoint file not found: " + path);
        }
        String json = Files.readString(path, StandardCharsets.UTF_8);

        ModelState state;
        try {
            state = HmmixGsonConfig.gson().fromJson(json, ModelState.class);
        } catch (JsonParseException | NullPointerException | IllegalArgumentException e) {
            throw new CheckpointException("Invalid checkpoint JSON: " + e.getMessage(), e);
        }
        if (state == null) {
            throw new CheckpointException("Checkpoint file is empty");
        }
        if (state.version() != ModelState.CURRENT_VERSION) {
            throw new CheckpointException("Unsupported checkpoint version: " + state.version()
                + " (expected: " + ModelState.CURRENT_VERSION + ")");
        }
        if (verifyChecksum && state.checksum() != null) {
            String expected = computeChecksum(HmmixGsonConfig.gson().toJson(state.withChecksum(null)));
            if (!expected.equals(state.checksum())) {
                throw new CheckpointException(
                    "Checkpoint checksum mismatch: expected " + expected + " but found " + state.checksum());
            }
        }
        return state;
    }

    private static String computeChecksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Thrown when a checkpoint cannot be loaded or fails validation.
    public static class CheckpointException extends Exception {
        public CheckpointException(String message) {
            super(message);
        }

        public CheckpointException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
