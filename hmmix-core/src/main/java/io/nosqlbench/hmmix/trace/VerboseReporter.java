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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/// Logs training progress at INFO.
///
/// | Verbosity | Reported iterations |
/// |-----------|---------------------|
/// | 0 | none |
/// | 1 | 1-10, then every 10th up to 100, every 100th up to 1000, and so on |
/// | 2 | every iteration |
public final class VerboseReporter implements TrainingObserver {

    private static final Logger logger = LogManager.getLogger(VerboseReporter.class);

    private final int verbosity;
    private int reportEvery = 1;
    private long startNanos;

    public VerboseReporter(int verbosity) {
        if (verbosity < 0 || verbosity > 2) {
            throw new IllegalArgumentException("verbose must be 0, 1 or 2, got " + verbosity);
        }
        this.verbosity = verbosity;
    }

    @Override
    public void onFitStart(MixtureHmmConfig config, int sequences) {
        reportEvery = 1;
        startNanos = System.nanoTime();
        if (verbosity > 0) {
            logger.info("Fitting {} {} HMMs with {} states on {} sequences",
                config.getNComponents(), config.getEmissionFamily().typeName(), config.getNStates(), sequences);
            logger.info(String.format("%10s %18s %16s %12s", "Iter", "Log-likelihood", "Improvement", "Elapsed"));
        }
    }

    @Override
    public void onIterationComplete(int iteration, double logLikelihood, double improvement) {
        if (!shouldReport(iteration)) {
            return;
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        logger.info(String.format("%10d %18.4f %16.4f %10dms", iteration + 1, logLikelihood, improvement, elapsedMillis));
    }

    /// Whether the iteration with zero-based index `iteration` is reported. Advances the
    /// logarithmic schedule at verbosity 1, so call once per iteration in order.
    boolean shouldReport(int iteration) {
        if (verbosity == 0) {
            return false;
        }
        if (verbosity == 2) {
            return true;
        }
        int count = iteration + 1;
        boolean report = count % reportEvery == 0;
        if (count >= reportEvery * 10) {
            reportEvery *= 10;
        }
        return report;
    }

    @Override
    public void onFitComplete(FitResult result) {
        if (verbosity > 0) {
            logger.info("Training finished: {} after {} iterations, log-likelihood {}",
                result.state(), result.iterations(), result.finalLogLikelihood());
        }
    }
}
