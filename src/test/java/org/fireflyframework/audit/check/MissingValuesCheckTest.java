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

package org.fireflyframework.audit.check;

import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.ColumnType;
import org.fireflyframework.audit.table.Table;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MissingValuesCheck}.
 */
class MissingValuesCheckTest {

    private final MissingValuesCheck check = new MissingValuesCheck();

    @Test
    void check_sixOfTenMissing_shouldBeCritical() {
        // Given
        Table table = Table.of(columnWithMissing("balance", 10, 6));

        // When
        List<Finding> findings = check.check(table);

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getKind()).isEqualTo(FindingKind.MISSING_VALUES);
        assertThat(finding.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.getColumn()).isEqualTo("balance");
        assertThat(finding.getCount()).isEqualTo(6);
        assertThat(finding.getPercentage()).isEqualTo(60.0);
    }

    @Test
    void check_thresholdsShouldBeExclusive() {
        // Given - exactly 50%, 20% and 5% missing
        Table table = Table.of(
                columnWithMissing("half", 20, 10),
                columnWithMissing("fifth", 20, 4),
                columnWithMissing("twentieth", 20, 1));

        // When
        List<Finding> findings = check.check(table);

        // Then
        assertThat(findings).extracting(Finding::getSeverity)
                .containsExactly(Severity.ERROR, Severity.WARNING, Severity.INFO);
    }

    @Test
    void check_justAboveThresholds_shouldEscalate() {
        Table table = Table.of(
                columnWithMissing("a", 100, 51),
                columnWithMissing("b", 100, 21),
                columnWithMissing("c", 100, 6));

        assertThat(check.check(table)).extracting(Finding::getSeverity)
                .containsExactly(Severity.CRITICAL, Severity.ERROR, Severity.WARNING);
    }

    @Test
    void check_completeColumn_shouldReportNothing() {
        Table table = Table.of(columnWithMissing("complete", 10, 0));

        assertThat(check.check(table)).isEmpty();
    }

    @Test
    void check_shouldRoundPercentageToTwoDecimals() {
        List<Finding> findings = check.check(Table.of(columnWithMissing("ratio", 3, 1)));

        assertThat(findings.get(0).getPercentage()).isEqualTo(33.33);
    }

    @Test
    void severityFor_shouldMapPercentages() {
        assertThat(MissingValuesCheck.severityFor(50.01)).isEqualTo(Severity.CRITICAL);
        assertThat(MissingValuesCheck.severityFor(50.0)).isEqualTo(Severity.ERROR);
        assertThat(MissingValuesCheck.severityFor(20.0)).isEqualTo(Severity.WARNING);
        assertThat(MissingValuesCheck.severityFor(5.0)).isEqualTo(Severity.INFO);
        assertThat(MissingValuesCheck.severityFor(0.1)).isEqualTo(Severity.INFO);
    }

    private static Column columnWithMissing(String name, int rows, int missing) {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            values.add(i < missing ? null : i);
        }
        return new Column(name, ColumnType.NUMERIC, values);
    }
}
