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
import org.fireflyframework.audit.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-column census of missing cells.
 *
 * <p>Severity grows with the missing share of the column (thresholds are exclusive):</p>
 * <ul>
 *   <li>more than 50% - {@link Severity#CRITICAL}</li>
 *   <li>more than 20% - {@link Severity#ERROR}</li>
 *   <li>more than 5% - {@link Severity#WARNING}</li>
 *   <li>otherwise - {@link Severity#INFO}</li>
 * </ul>
 */
public class MissingValuesCheck implements TableCheck {

    @Override
    public List<Finding> check(Table table) {
        List<Finding> findings = new ArrayList<>();
        int rows = table.getRowCount();

        for (Column column : table.getColumns()) {
            int missing = column.missingCount();
            if (missing == 0) {
                continue;
            }
            double percentage = missing * 100.0 / rows;
            findings.add(Finding.builder()
                    .kind(FindingKind.MISSING_VALUES)
                    .severity(severityFor(percentage))
                    .column(column.getName())
                    .count(missing)
                    .percentage(Finding.percentage(missing, rows))
                    .message(missing + " of " + rows + " values are missing")
                    .build());
        }
        return findings;
    }

    static Severity severityFor(double percentage) {
        if (percentage > 50) {
            return Severity.CRITICAL;
        }
        if (percentage > 20) {
            return Severity.ERROR;
        }
        if (percentage > 5) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    @Override
    public String getCheckName() {
        return "missing-values";
    }
}
