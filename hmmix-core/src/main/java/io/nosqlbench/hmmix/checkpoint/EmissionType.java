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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the JSON type discriminator for a {@link io.nosqlbench.hmmix.hmm.ComponentHmm} implementation.
 *
 * <pre>{@code
 * @EmissionType("poisson")
 * public final class PoissonHmm extends ComponentHmm { ... }
 * }</pre>
 *
 * <p>The value must match {@link io.nosqlbench.hmmix.model.EmissionFamily#typeName()} of the family the
 * class implements.
 *
 * @see ComponentHmmTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EmissionType {
    /**
     * The type name written to the {@code "type"} field.
     */
    String value();
}
