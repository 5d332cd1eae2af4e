package io.depinfer.regression;

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

/**
 * Rule for picking the penalty strength from a cross-validation curve.
 */
public enum PenaltyRule {

    /** Largest lambda with the minimum mean cross-validated error */
    MIN_ERROR("lambda.min"),

    /** Largest lambda whose error is within one standard error of the minimum */
    ONE_STANDARD_ERROR("lambda.1se");

    private final String label;

    PenaltyRule(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a rule from its label ("lambda.min", "lambda.1se") or enum name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static PenaltyRule fromLabel(String name) {
        for (PenaltyRule rule : values()) {
            if (rule.label.equalsIgnoreCase(name) || rule.name().equalsIgnoreCase(name)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown penalty rule: " + name);
    }
}
