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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// Parameter groups that can take part in initialization and maximization.
///
/// Training reads two independent sets of these: `initParams` selects the groups
/// drawn afresh before EM starts, `params` selects the groups updated by each
/// M-step. Groups left out keep the values they were given.
public enum ParamGroup {

    /// The mixture component weights.
    MIXTURE_WEIGHTS('p'),
    /// Each component's initial state distribution.
    START_PROBABILITIES('s'),
    /// Each component's state transition matrix.
    TRANSITIONS('t'),
    /// Each component's emission parameters (symbol table, rates, means and covariances).
    EMISSIONS('e');

    private final char letter;

    ParamGroup(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /// Every group.
    public static Set<ParamGroup> all() {
        return EnumSet.allOf(ParamGroup.class);
    }

    /// The groups owned by the component HMMs.
    public static Set<ParamGroup> hmmGroups() {
        return EnumSet.of(START_PROBABILITIES, TRANSITIONS, EMISSIONS);
    }

    /// Whether any component HMM group is present in `groups`.
    public static boolean anyHmmGroup(Set<ParamGroup> groups) {
        return groups.contains(START_PROBABILITIES)
            || groups.contains(TRANSITIONS)
            || groups.contains(EMISSIONS);
    }

    /// Parses a letter mask such as `"ph"` or `"st"`.
    ///
    /// `'h'` expands to all HMM groups. Letters that name no group are ignored so
    /// that a mask listing every letter selects everything.
    public static Set<ParamGroup> parse(String mask) {
        Objects.requireNonNull(mask, "mask cannot be null");
        EnumSet<ParamGroup> groups = EnumSet.noneOf(ParamGroup.class);
        for (char c : mask.toCharArray()) {
            if (c == 'h') {
                groups.addAll(hmmGroups());
                continue;
            }
            for (ParamGroup group : values()) {
                if (group.letter == c) {
                    groups.add(group);
                }
            }
        }
        return groups;
    }

    /// Formats `groups` back into a letter mask.
    public static String toMask(Set<ParamGroup> groups) {
        StringBuilder sb = new StringBuilder();
        for (ParamGroup group : values()) {
            if (groups.contains(group)) {
                sb.append(group.letter);
            }
        }
        return sb.toString();
    }
}
