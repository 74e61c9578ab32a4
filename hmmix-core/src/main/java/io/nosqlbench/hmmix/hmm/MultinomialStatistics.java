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

/// Statistics for multinomial emissions: posterior-weighted symbol counts per state.
public final class MultinomialStatistics extends HmmStatistics {

    private final double[][] obs;

    public MultinomialStatistics(int nStates, int nSymbols) {
        super(nStates);
        this.obs = new double[nStates][nSymbols];
    }

    /// `obs[state][symbol]`: expected number of times `state` emitted `symbol`.
    public double[][] obs() {
        return obs;
    }

    @Override
    protected void addEmissionsScaled(HmmStatistics other, double weight) {
        addScaled(obs, ((MultinomialStatistics) other).obs, weight);
    }
}
