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

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Values must lie within {@code [min, max]}, both bounds inclusive. A {@code null} bound
 * leaves that side open. Text cells are read as numbers; a cell that is not a number
 * makes the rule fail to evaluate.
 */
public record RangeRule(String name, String column, BigDecimal min, BigDecimal max) implements BusinessRule {

    public RangeRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        if (min == null && max == null) {
            throw new IllegalArgumentException("Range rule '" + name + "' needs at least one bound");
        }
    }

    @Override
    public RuleType type() {
        return RuleType.RANGE;
    }

    @Override
    public int countViolations(List<Object> values) {
        int violations = 0;
        for (Object value : values) {
            Double number = CellValues.toDouble(value);
            if (number == null) {
                throw new IllegalArgumentException("Value '" + value + "' is not numeric");
            }
            if (violates(number, CellValues.toBigDecimal(value))) {
                violations++;
            }
        }
        return violations;
    }

    private boolean violates(double number, BigDecimal exact) {
        if (exact == null) {
            return number > 0 ? max != null : min != null;
        }
        boolean belowMin = min != null && exact.compareTo(min) < 0;
        boolean aboveMax = max != null && exact.compareTo(max) > 0;
        return belowMin || aboveMax;
    }

    @Override
    public String violationMessage() {
        if (min == null) {
            return "Values above maximum " + max.toPlainString();
        }
        if (max == null) {
            return "Values below minimum " + min.toPlainString();
        }
        return "Values outside range " + min.toPlainString() + "-" + max.toPlainString();
    }
}
