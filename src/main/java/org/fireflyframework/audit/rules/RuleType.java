/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.audit.rules;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of business rule kinds and the type tags that select them in
 * rule configuration.
 */
public enum RuleType {

    RANGE("range"),
    PATTERN("pattern"),
    ALLOWED_VALUES("allowed_values");

    private final String key;

    RuleType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a configuration type tag.
     *
     * @param key the tag, e.g. {@code "range"}
     * @return the rule type, or empty if the tag is unknown
     */
    public static Optional<RuleType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equals(key))
                .findFirst();
    }
}
