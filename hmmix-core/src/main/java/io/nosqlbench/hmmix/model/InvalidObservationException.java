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

package io.nosqlbench.hmmix.model;

/// Thrown when a dataset holds values outside the domain of an emission family,
/// for example negative counts for Poisson emissions.
public class InvalidObservationException extends IllegalArgumentException {

    private final EmissionFamily family;

    public InvalidObservationException(EmissionFamily family, String requirement, Dataset dataset) {
        super("Input must be " + requirement + ", but " + dataset + " was given.");
        this.family = family;
    }

    public EmissionFamily family() {
        return family;
    }
}
