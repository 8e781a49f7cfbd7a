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
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Values must belong to a fixed set. Numbers match by numeric value ({@code 1} matches
 * {@code 1.0}); any other value matches by equality.
 */
public record AllowedValuesRule(String name, String column, List<Object> values) implements BusinessRule {

    public AllowedValuesRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        values = List.copyOf(values);
    }

    @Override
    public RuleType type() {
        return RuleType.ALLOWED_VALUES;
    }

    @Override
    public int countViolations(List<Object> cells) {
        Set<Object> allowed = values.stream()
                .map(CellValues::comparisonKey)
                .collect(Collectors.toSet());
        Set<Object> allowedNumbers = values.stream()
                .map(CellValues::numericKey)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return (int) cells.stream()
                .filter(cell -> cell instanceof Number
                        ? !allowedNumbers.contains(CellValues.numericKey(cell))
                        : !allowed.contains(CellValues.comparisonKey(cell)))
                .count();
    }

    @Override
    public String violationMessage() {
        return "Invalid values found. Allowed: " + values;
    }
}
