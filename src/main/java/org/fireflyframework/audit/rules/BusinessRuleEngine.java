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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a {@link RuleSet} against a {@link Table}.
 *
 * <p>Rules whose target column does not exist are skipped, so one rule set can be shared
 * across tables with different layouts. Only non-missing cells are evaluated. Every
 * violated rule yields one {@link Severity#ERROR} finding; a rule that fails to evaluate
 * yields a {@link FindingKind#RULE_EVALUATION_ERROR} finding and the remaining rules
 * still run.</p>
 */
@Slf4j
public class BusinessRuleEngine {

    /**
     * Evaluates every rule of the set in order.
     *
     * @param table the table to check
     * @param rules the rules to apply
     * @return one finding per violated or failing rule
     */
    public List<Finding> evaluate(Table table, RuleSet rules) {
        List<Finding> findings = new ArrayList<>();

        for (BusinessRule rule : rules) {
            Optional<Column> column = table.findColumn(rule.column());
            if (column.isEmpty()) {
                log.debug("Skipping rule '{}': column '{}' not present", rule.name(), rule.column());
                continue;
            }
            evaluate(rule, column.get()).ifPresent(findings::add);
        }
        return findings;
    }

    private Optional<Finding> evaluate(BusinessRule rule, Column column) {
        int violations;
        try {
            violations = rule.countViolations(column.presentValues());
        } catch (RuntimeException e) {
            log.warn("Business rule '{}' could not be evaluated on column '{}': {}",
                    rule.name(), column.getName(), e.getMessage());
            return Optional.of(Finding.builder()
                    .kind(FindingKind.RULE_EVALUATION_ERROR)
                    .severity(Severity.ERROR)
                    .rule(rule.name())
                    .column(column.getName())
                    .message("Rule could not be evaluated: " + e.getMessage())
                    .build());
        }

        if (violations == 0) {
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .kind(FindingKind.BUSINESS_RULE_VIOLATION)
                .severity(Severity.ERROR)
                .rule(rule.name())
                .column(column.getName())
                .count(violations)
                .message(rule.violationMessage())
                .build());
    }
}
