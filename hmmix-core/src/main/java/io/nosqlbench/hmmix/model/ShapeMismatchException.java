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

/// Thrown when an argument has the wrong length, arity or dimension.
///
/// The offending argument is named so callers can tell which input was rejected.
public class ShapeMismatchException extends IllegalArgumentException {

    private final String argument;

    public ShapeMismatchException(String argument, String message) {
        super("'" + argument + "' " + message);
        this.argument = argument;
    }

    /// Name of the rejected argument.
    public String argument() {
        return argument;
    }
}
