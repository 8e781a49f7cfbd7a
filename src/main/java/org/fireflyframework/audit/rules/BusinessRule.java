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

import java.util.List;

/**
 * A user-declared predicate over the cells of one named column.
 *
 * <p>The variants are closed: {@link RangeRule}, {@link PatternRule} and
 * {@link AllowedValuesRule}. Rules are built once by {@link RuleSetParser} and are
 * evaluated by the {@link BusinessRuleEngine}.</p>
 */
public sealed interface BusinessRule permits RangeRule, PatternRule, AllowedValuesRule {

    /**
     * Returns the name the rule was declared under.
     *
     * @return the rule name
     */
    String name();

    /**
     * Returns the name of the column the rule applies to.
     *
     * @return the target column name
     */
    String column();

    RuleType type();

    /**
     * Counts the values violating this rule.
     *
     * @param values the non-missing cells of the target column
     * @return the number of violations
     * @throws RuntimeException if the rule cannot be applied to the values
     */
    int countViolations(List<Object> values);

    /**
     * Describes a violation of this rule for reporting.
     *
     * @return the violation message
     */
    String violationMessage();
}
