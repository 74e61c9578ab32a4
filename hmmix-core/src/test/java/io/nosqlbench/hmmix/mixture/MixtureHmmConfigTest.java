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

import io.nosqlbench.hmmix.hmm.CovarianceType;
import io.nosqlbench.hmmix.model.EmissionFamily;
import io.nosqlbench.hmmix.model.ParamGroup;
import io.nosqlbench.hmmix.model.ShapeMismatchException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MixtureHmmConfigTest {

    @Test
    void defaults() {
        MixtureHmmConfig config = new MixtureHmmConfig();
        assertThat(config.getEmissionFamily()).isEqualTo(EmissionFamily.MULTINOMIAL);
        assertThat(config.getNComponents()).isEqualTo(1);
        assertThat(config.getNStates()).isEqualTo(1);
        assertThat(config.getNIter()).isEqualTo(10);
        assertThat(config.getThresh()).isEqualTo(1e-2);
        assertThat(config.getParams()).isEqualTo(ParamGroup.all());
        assertThat(config.getInitParams()).isEqualTo(ParamGroup.all());
        assertThat(config.getVerbose()).isZero();
        assertThat(config.getRandomSeed()).isNull();
        assertThat(config.getNSymbols()).isNull();
        assertThat(config.getCovarianceType()).isEqualTo(CovarianceType.DIAG);
    }

    @Test
    void parsesSnakeCaseJsonAndKeepsDefaultsForAbsentFields() {
        MixtureHmmConfig config = MixtureHmmConfig.fromJson("""
            {
              "emission_family": "gaussian",
              "n_components": 3,
              "n_states": 2,
              "covariance_type": "full",
              "init_params": "st",
              "random_seed": 42
            }
            """);

        assertThat(config.getEmissionFamily()).isEqualTo(EmissionFamily.GAUSSIAN);
        assertThat(config.getNComponents()).isEqualTo(3);
        assertThat(config.getCovarianceType()).isEqualTo(CovarianceType.FULL);
        assertThat(config.getInitParams())
            .containsExactlyInAnyOrder(ParamGroup.START_PROBABILITIES, ParamGroup.TRANSITIONS);
        assertThat(config.getRandomSeed()).isEqualTo(42L);
        assertThat(config.getNIter()).isEqualTo(10);
        assertThat(config.getMinCovar()).isEqualTo(1e-3);
    }

    @Test
    void jsonRoundTripPreservesEquality() {
        MixtureHmmConfig config = MixtureHmmConfig.of(EmissionFamily.MULTINOMIAL, 2, 3)
            .setNSymbols(5)
            .setEmissionProbPrior(2.0)
            .setComponentWeightsPrior(new double[] {1.5, 2.5})
            .setParams(EnumSet.of(ParamGroup.EMISSIONS))
            .setRandomSeed(7L);

        MixtureHmmConfig restored = MixtureHmmConfig.fromJson(config.toJson());

        assertThat(restored).isEqualTo(config);
        assertThat(restored.hashCode()).isEqualTo(config.hashCode());
        assertThat(config.toJson()).contains("\"params\": \"e\"");
    }

    @Test
    void copyIsIndependent() {
        MixtureHmmConfig config = MixtureHmmConfig.of(EmissionFamily.POISSON, 2, 1);
        MixtureHmmConfig copy = config.copy().setNIter(99);
        assertThat(config.getNIter()).isEqualTo(10);
        assertThat(copy).isNotEqualTo(config);
    }

    @Test
    void masksAreCanonicalised() {
        MixtureHmmConfig config = new MixtureHmmConfig().setParams("hp").setInitParams("et");
        assertThat(config.toJson()).contains("\"params\": \"pste\"").contains("\"init_params\": \"te\"");
    }

    @Test
    void validateRejectsOutOfRangeFields() {
        assertThatThrownBy(() -> MixtureHmmConfig.of(EmissionFamily.POISSON, 1, 0).validate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("n_states");
        assertThatThrownBy(() -> new MixtureHmmConfig().setNIter(0).validate())
            .hasMessageContaining("n_iter");
        assertThatThrownBy(() -> new MixtureHmmConfig().setThresh(-1.0).validate())
            .hasMessageContaining("thresh");
        assertThatThrownBy(() -> new MixtureHmmConfig().setVerbose(3).validate())
            .hasMessageContaining("verbose");
        assertThatThrownBy(() -> new MixtureHmmConfig().setEmissionProbPrior(0.0).validate())
            .hasMessageContaining("emission_prob_prior");
        assertThatThrownBy(() -> MixtureHmmConfig.of(EmissionFamily.POISSON, 2, 1)
            .setComponentWeightsPrior(new double[] {1.0, 1.0, 1.0}).validate())
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void saveAndLoad(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("config.json");
        MixtureHmmConfig config = MixtureHmmConfig.of(EmissionFamily.EXPONENTIAL, 4, 2).setRatesVar(0.5);
        config.save(path);

        assertThat(Files.readString(path)).contains("\"emission_family\": \"exponential\"");
        assertThat(MixtureHmmConfig.load(path)).isEqualTo(config);
    }

    @Test
    void loadValidates(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("bad.json");
        Files.writeString(path, "{\"n_components\": -1}");
        assertThatThrownBy(() -> MixtureHmmConfig.load(path))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
