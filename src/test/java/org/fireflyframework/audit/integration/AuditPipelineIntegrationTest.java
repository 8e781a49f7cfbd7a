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

package org.fireflyframework.audit.integration;

import org.fireflyframework.audit.AuditStrategy;
import org.fireflyframework.audit.DataAuditEngine;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.report.AuditReport;
import org.fireflyframework.audit.report.OverallAssessment;
import org.fireflyframework.audit.rules.RuleSet;
import org.fireflyframework.audit.rules.RuleSetParser;
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.ColumnType;
import org.fireflyframework.audit.table.Table;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Integration tests running the full audit pipeline, with parsed business rules,
 * against a small customer table carrying one problem of each common kind.
 */
class AuditPipelineIntegrationTest {

    private static final List<String> HEADERS = List.of("customer_id", "email", "age", "status", "signup_date");

    private static final List<List<Object>> ROWS = List.of(
            Arrays.asList(1, "ann@example.com", 34, "active", "2024-01-05"),
            Arrays.asList(2, "bob@example.com", 29, "ACTIVE", "2024-01-06"),
            Arrays.asList(3, null, 41, "closed", "2024-01-07"),
            Arrays.asList(4, "bad-email", 38, "active ", "2024-01-08"),
            Arrays.asList(5, "eve@example.com", 35, "closed", "2024-01-09"),
            Arrays.asList(6, "fay@example.com", 33, "active", "2024-01-10"),
            Arrays.asList(6, "gus@example.com", 36, "pending", "2024-01-11"),
            Arrays.asList(8, "hal@example.com", 240, "active", "2024-01-12"));

    private final RuleSetParser parser = new RuleSetParser();
    private final DataAuditEngine engine = new DataAuditEngine();

    @Test
    void audit_customerTable_reportsEveryProblemRankedBySeverity() {
        // Given
        Table table = Table.fromRows("customers.csv", HEADERS, ROWS);
        RuleSet rules = parser.parse(ruleConfiguration(false));

        // When & Then
        StepVerifier.create(engine.audit(table, rules))
                .assertNext(report -> {
                    assertThat(report.getFindings()).extracting(Finding::getKind).containsExactly(
                            FindingKind.DUPLICATE_IDS,
                            FindingKind.BUSINESS_RULE_VIOLATION,
                            FindingKind.BUSINESS_RULE_VIOLATION,
                            FindingKind.BUSINESS_RULE_VIOLATION,
                            FindingKind.MISSING_VALUES,
                            FindingKind.POTENTIAL_DATE_COLUMN,
                            FindingKind.OUTLIERS,
                            FindingKind.WHITESPACE_ISSUES,
                            FindingKind.INCONSISTENT_CASE);

                    assertThat(report.getByKind(FindingKind.BUSINESS_RULE_VIOLATION))
                            .extracting(Finding::getRule, Finding::getCount)
                            .containsExactly(
                                    tuple("email_format", 1),
                                    tuple("age_range", 1),
                                    tuple("status_set", 2));

                    Finding missing = report.getByKind(FindingKind.MISSING_VALUES).get(0);
                    assertThat(missing.getColumn()).isEqualTo("email");
                    assertThat(missing.getSeverity()).isEqualTo(Severity.WARNING);
                    assertThat(missing.getPercentage()).isEqualTo(12.5);

                    Finding outliers = report.getByKind(FindingKind.OUTLIERS).get(0);
                    assertThat(outliers.getColumn()).isEqualTo("age");
                    assertThat(outliers.getValues()).containsExactly(240);
                    assertThat(outliers.getPercentage()).isEqualTo(12.5);

                    assertThat(report.getSummary().getCritical()).isZero();
                    assertThat(report.getSummary().getErrors()).isEqualTo(4);
                    assertThat(report.getSummary().getWarnings()).isEqualTo(1);
                    assertThat(report.getSummary().getInfo()).isEqualTo(4);
                    assertThat(report.getSummary().getTotal()).isEqualTo(9);
                    assertThat(report.getAssessment()).isEqualTo(OverallAssessment.FAIR);

                    assertThat(report.getRecommendations()).containsExactly(
                            "Remove or investigate duplicate IDs to ensure data integrity",
                            "Standardize data types for consistent analysis",
                            "Investigate outliers - they may indicate data entry errors or legitimate special cases");

                    assertThat(report.getStatistics().getSourcePath()).isEqualTo("customers.csv");
                    assertThat(report.getStatistics().getRows()).isEqualTo(8);
                    assertThat(report.getStatistics().getHeaders()).isEqualTo(HEADERS);
                })
                .verifyComplete();
    }

    @Test
    void audit_ruleOnAbsentColumn_leavesReportUnchanged() {
        // Given
        Table table = Table.fromRows("customers.csv", HEADERS, ROWS);

        // When
        AuditReport without = engine.audit(table, parser.parse(ruleConfiguration(false))).block();
        AuditReport with = engine.audit(table, parser.parse(ruleConfiguration(true))).block();

        // Then
        assertThat(with).isEqualTo(without);
    }

    @Test
    void audit_strategies_produceIdenticalReports() {
        // Given
        Table table = Table.fromRows("customers.csv", HEADERS, ROWS);
        RuleSet rules = parser.parse(ruleConfiguration(true));

        // When
        AuditReport parallel = engine.audit(table, rules, AuditStrategy.PARALLEL).block();
        AuditReport sequential = engine.audit(table, rules, AuditStrategy.SEQUENTIAL).block();

        // Then
        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void audit_messyTextTable_flagsMixedTypesAndStructure() {
        // Given - numbers stored as text, an empty column and a repeated header
        Table table = Table.of(
                Column.text("amount", "10", "12.50", "n/a", "7", "9"),
                Column.text("notes", null, null, null, null, null),
                new Column("amount", ColumnType.NUMERIC, List.of(1, 2, 3, 4, 5)));

        // When & Then
        StepVerifier.create(engine.audit(table))
                .assertNext(report -> {
                    assertThat(report.getFindings()).extracting(Finding::getKind).containsExactly(
                            FindingKind.MISSING_VALUES,
                            FindingKind.DUPLICATE_HEADERS,
                            FindingKind.EMPTY_COLUMNS,
                            FindingKind.MIXED_TYPES_NUMERIC);
                    assertThat(report.getAssessment()).isEqualTo(OverallAssessment.POOR);
                    assertThat(report.getRecommendations()).containsExactly(
                            "Consider data imputation or collection strategies for columns with high missing values: [notes]",
                            "Standardize data types for consistent analysis");
                })
                .verifyComplete();
    }

    private static Map<String, Object> ruleConfiguration(boolean includeAbsentColumn) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("email_format", Map.of("column", "email", "type", "pattern", "pattern", "[^@]+@[^@]+\\.[a-z]+"));
        config.put("age_range", Map.of("column", "age", "type", "range", "min", 0, "max", 120));
        config.put("status_set", Map.of("column", "status", "type", "allowed_values",
                "values", List.of("active", "closed", "pending")));
        if (includeAbsentColumn) {
            config.put("tier_set", Map.of("column", "tier", "type", "allowed_values", "values", List.of("gold")));
        }
        return config;
    }
}
