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

import org.fireflyframework.audit.table.CellValues;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The string form of each value must match a regular expression anchored at the start
 * of the value (a prefix match, see {@link java.util.regex.Matcher#lookingAt()}).
 *
 * <p>The expression is compiled on evaluation, so a malformed expression surfaces as a
 * rule evaluation error for this rule only.</p>
 */
public record PatternRule(String name, String column, String pattern) implements BusinessRule {

    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public RuleType type() {
        return RuleType.PATTERN;
    }

    @Override
    public int countViolations(List<Object> values) {
        Pattern compiled = Pattern.compile(pattern);
        int violations = 0;
        for (Object value : values) {
            if (!compiled.matcher(CellValues.asText(value)).lookingAt()) {
                violations++;
            }
        }
        return violations;
    }

    @Override
    public String violationMessage() {
        return "Values don't match required pattern";
    }
}
