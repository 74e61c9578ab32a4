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


package io.nosqlbench.hmmix.trace;

import io.nosqlbench.hmmix.mixture.FitResult;
import io.nosqlbench.hmmix.mixture.MixtureHmmConfig;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/// TrainingObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// ```json
/// {"event":"fit_start","config":{...},"sequences":200,"timestamp":1234567890}
/// {"event":"iteration","iteration":0,"log_likelihood":-1523.2,"improvement":Infinity,"timestamp":1234567891}
/// {"event":"fit_complete","state":"CONVERGED","iterations":7,"log_likelihoods":[...],"timestamp":1234567892}
/// ```
///
/// Non-finite numbers are written as the bare tokens `Infinity`, `-Infinity`
/// and `NaN`, which Gson reads back in lenient mode.
///
/// ## Usage
///
/// ```java
/// try (NdjsonTraceObserver trace = new NdjsonTraceObserver(Path.of("fit.ndjson"))) {
///     model.setObserver(trace);
///     model.fit(dataset);
/// }
/// ```
public final class NdjsonTraceObserver implements TrainingObserver, Closeable {

    private final BufferedWriter writer;

    /// @param outputPath file to create or truncate
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonTraceObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    /// @param writer destination; closing this observer closes it
    public NdjsonTraceObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw) ? bw : new BufferedWriter(writer);
    }

    @Override
    public void onFitStart(MixtureHmmConfig config, int sequences) {
        Map<String, Object> event = event("fit_start");
        event.put("config", config);
        event.put("sequences", sequences);
        writeEvent(event);
    }

    @Override
    public void onIterationComplete(int iteration, double logLikelihood, double improvement) {
        Map<String, Object> event = event("iteration");
        event.put("iteration", iteration);
        event.put("log_likelihood", logLikelihood);
        event.put("improvement", improvement);
        writeEvent(event);
    }

    @Override
    public void onFitComplete(FitResult result) {
        Map<String, Object> event = event("fit_complete");
        event.put("state", result.state().name());
        event.put("iterations", result.iterations());
        event.put("log_likelihoods", result.logLikelihoods());
        writeEvent(event);
    }

    private static Map<String, Object> event(String name) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        return event;
    }

    private void writeEvent(Map<String, Object> event) {
        event.put("timestamp", System.currentTimeMillis());
        try {
            writer.write(TrainingObserver.toCompactJson(event));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trace event", e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
