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
import io.nosqlbench.hmmix.hmm.ComponentHmm;
import io.nosqlbench.hmmix.hmm.CovarianceType;
import io.nosqlbench.hmmix.hmm.ExponentialHmm;
import io.nosqlbench.hmmix.hmm.GaussianHmm;
import io.nosqlbench.hmmix.hmm.MultinomialHmm;
import io.nosqlbench.hmmix.hmm.PoissonHmm;
import io.nosqlbench.hmmix.model.Sequence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ComponentHmmTypeAdapterFactoryTest {

    private final Gson gson = HmmixGsonConfig.compactGson();

    @Test
    void writesTheTypeDiscriminatorFirst() {
        PoissonHmm hmm = new PoissonHmm(2);
        hmm.setRates(new double[] {1.5, 8.0});
        String json = gson.toJson(hmm, ComponentHmm.class);
        assertThat(json).startsWith("{\"type\":\"poisson\"");
        assertThat(json).contains("\"rates\":[1.5,8.0]").contains("\"n_states\":2");
    }

    @Test
    void restoresTheConcreteClass() {
        GaussianHmm hmm = new GaussianHmm(2, 2, CovarianceType.FULL);
        hmm.setMeans(new double[][] {{1.0, 2.0}, {-1.0, 0.5}});
        hmm.setCovars(new double[][][] {
            {{2.0, 0.3}, {0.3, 1.0}},
            {{1.0, 0.0}, {0.0, 1.0}}});

        ComponentHmm restored = gson.fromJson(gson.toJson(hmm, ComponentHmm.class), ComponentHmm.class);

        assertThat(restored).isInstanceOf(GaussianHmm.class);
        GaussianHmm gaussian = (GaussianHmm) restored;
        assertThat(gaussian.getCovarianceType()).isEqualTo(CovarianceType.FULL);
        assertThat(gaussian.getMeans()).isDeepEqualTo(hmm.getMeans());
        Sequence probe = Sequence.ofVectors(new double[][] {{0.5, 1.0}, {-0.5, 0.2}});
        assertThat(gaussian.score(probe)).isEqualTo(hmm.score(probe));
    }

    @Test
    void restoredModelsScoreLikeTheOriginal() {
        MultinomialHmm multinomial = new MultinomialHmm(2, 3);
        multinomial.setEmissionProb(new double[][] {{0.2, 0.3, 0.5}, {0.6, 0.3, 0.1}});
        ExponentialHmm exponential = new ExponentialHmm(1);
        exponential.setRates(new double[] {4.0});

        ComponentHmm m = gson.fromJson(gson.toJson(multinomial, ComponentHmm.class), ComponentHmm.class);
        ComponentHmm e = gson.fromJson(gson.toJson(exponential, ComponentHmm.class), ComponentHmm.class);

        assertThat(m.score(Sequence.ofSymbols(0, 2, 1))).isEqualTo(multinomial.score(Sequence.ofSymbols(0, 2, 1)));
        assertThat(e.score(Sequence.ofValues(0.1, 0.3))).isEqualTo(exponential.score(Sequence.ofValues(0.1, 0.3)));
        assertThat(((MultinomialHmm) m).numSymbols()).isEqualTo(3);
    }

    @Test
    void rejectsUnknownOrMissingTypes() {
        assertThatThrownBy(() -> gson.fromJson("{\"type\":\"binomial\",\"n_states\":1}", ComponentHmm.class))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("binomial");
        assertThatThrownBy(() -> gson.fromJson("{\"n_states\":1}", ComponentHmm.class))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("type");
    }

    @Test
    void rejectsAMismatchedConcreteTarget() {
        String json = gson.toJson(new PoissonHmm(1), ComponentHmm.class);
        assertThatThrownBy(() -> gson.fromJson(json, ExponentialHmm.class))
            .isInstanceOf(JsonParseException.class);
    }

    @Test
    void everyFamilyIsRegistered() {
        ComponentHmmTypeAdapterFactory factory = ComponentHmmTypeAdapterFactory.create();
        assertThat(factory.getTypeName(MultinomialHmm.class)).isEqualTo("multinomial");
        assertThat(factory.getTypeName(PoissonHmm.class)).isEqualTo("poisson");
        assertThat(factory.getTypeName(ExponentialHmm.class)).isEqualTo("exponential");
        assertThat(factory.getTypeName(GaussianHmm.class)).isEqualTo("gaussian");
        assertThatThrownBy(() -> factory.registerType(PoissonHmm.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }
}
