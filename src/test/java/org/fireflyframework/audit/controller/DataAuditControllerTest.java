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

package org.fireflyframework.audit.controller;

import org.fireflyframework.audit.AuditStrategy;
import org.fireflyframework.audit.DataAuditEngine;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.model.AuditRequest;
import org.fireflyframework.audit.report.AuditReport;
import org.fireflyframework.audit.report.OverallAssessment;
import org.fireflyframework.audit.rules.PatternRule;
import org.fireflyframework.audit.rules.RuleConfigurationException;
import org.fireflyframework.audit.rules.RuleSet;
import org.fireflyframework.audit.rules.RuleSetParser;
import org.fireflyframework.audit.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DataAuditController}.
 */
@ExtendWith(MockitoExtension.class)
class DataAuditControllerTest {

    @Mock
    private DataAuditEngine mockEngine;

    private final RuleSetParser parser = new RuleSetParser();

    @Test
    void audit_shouldAuditPostedRowsWithRequestRules() {
        // Given
        DataAuditController controller = new DataAuditController(new DataAuditEngine(), parser);
        AuditRequest request = AuditRequest.builder()
                .name("orders.csv")
                .headers(List.of("order_id", "age"))
                .rows(List.of(
                        Arrays.asList(1, 30),
                        Arrays.asList(2, 151),
                        Arrays.asList(2, null)))
                .rules(Map.of("age_range", Map.of("column", "age", "type", "range", "min", 0, "max", 120)))
                .build();

        // When & Then
        StepVerifier.create(controller.audit(request))
                .assertNext(report -> {
                    assertThat(report.getStatistics().getSourcePath()).isEqualTo("orders.csv");
                    assertThat(report.getStatistics().getRows()).isEqualTo(3);
                    assertThat(report.getFindings()).extracting(Finding::getKind).containsExactly(
                            FindingKind.MISSING_VALUES,
                            FindingKind.DUPLICATE_IDS,
                            FindingKind.BUSINESS_RULE_VIOLATION);
                    assertThat(report.getAssessment()).isEqualTo(OverallAssessment.FAIR);
                })
                .verifyComplete();
    }

    @Test
    void audit_withoutRulesOrStrategy_shouldUseEngineDefaults() {
        // Given
        RuleSet defaults = RuleSet.of(new PatternRule("code_format", "code", "[A-Z]{3}"));
        AuditReport report = AuditReport.builder().findings(List.of()).build();
        when(mockEngine.getDefaultRules()).thenReturn(defaults);
        when(mockEngine.getDefaultStrategy()).thenReturn(AuditStrategy.SEQUENTIAL);
        when(mockEngine.audit(any(Table.class), eq(defaults), eq(AuditStrategy.SEQUENTIAL)))
                .thenReturn(Mono.just(report));

        DataAuditController controller = new DataAuditController(mockEngine, parser);
        AuditRequest request = AuditRequest.builder()
                .headers(List.of("code"))
                .rows(List.of(List.of("ABC")))
                .build();

        // When & Then
        StepVerifier.create(controller.audit(request))
                .expectNext(report)
                .verifyComplete();

        ArgumentCaptor<Table> table = ArgumentCaptor.forClass(Table.class);
        verify(mockEngine).audit(table.capture(), eq(defaults), eq(AuditStrategy.SEQUENTIAL));
        assertThat(table.getValue().getRowCount()).isEqualTo(1);
    }

    @Test
    void audit_raggedRows_shouldFailWithIllegalArgument() {
        DataAuditController controller = new DataAuditController(new DataAuditEngine(), parser);
        AuditRequest request = AuditRequest.builder()
                .headers(List.of("a", "b"))
                .rows(List.of(List.of(1, 2), List.of(3)))
                .build();

        StepVerifier.create(controller.audit(request))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessage("Row 1 has 1 cells, expected 2"))
                .verify();
    }

    @Test
    void audit_invalidRules_shouldFailWithRuleConfigurationException() {
        DataAuditController controller = new DataAuditController(new DataAuditEngine(), parser);
        AuditRequest request = AuditRequest.builder()
                .headers(List.of("a"))
                .rows(List.of(List.of(1)))
                .rules(Map.of("broken", Map.of("column", "a", "type", "checksum")))
                .build();

        StepVerifier.create(controller.audit(request))
                .expectError(RuleConfigurationException.class)
                .verify();
    }

    @Test
    void audit_emptyRequest_shouldReportEmptyTable() {
        DataAuditController controller = new DataAuditController(new DataAuditEngine(), parser);

        StepVerifier.create(controller.audit(new AuditRequest()))
                .assertNext(report -> {
                    assertThat(report.getFindings()).extracting(Finding::getKind)
                            .containsExactly(FindingKind.EMPTY_TABLE);
                    assertThat(report.getAssessment()).isEqualTo(OverallAssessment.POOR);
                })
                .verifyComplete();
    }
}
