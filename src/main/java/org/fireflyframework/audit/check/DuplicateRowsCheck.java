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
import org.fireflyframework.audit.table.CellValues;
import org.fireflyframework.audit.table.Table;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts rows that repeat an earlier row across every column.
 *
 * <p>Duplicates are a {@link Severity#WARNING}, escalated to {@link Severity#ERROR} when
 * they make up more than 10% of the rows.</p>
 */
public class DuplicateRowsCheck implements TableCheck {

    static final double ERROR_RATIO = 0.1;

    @Override
    public List<Finding> check(Table table) {
        int rows = table.getRowCount();
        Set<List<Object>> seen = new HashSet<>();
        int duplicates = 0;

        for (int row = 0; row < rows; row++) {
            List<Object> key = table.row(row).stream()
                    .map(CellValues::comparisonKey)
                    .toList();
            if (!seen.add(key)) {
                duplicates++;
            }
        }

        if (duplicates == 0) {
            return List.of();
        }

        Severity severity = duplicates > rows * ERROR_RATIO ? Severity.ERROR : Severity.WARNING;
        return List.of(Finding.builder()
                .kind(FindingKind.DUPLICATE_ROWS)
                .severity(severity)
                .count(duplicates)
                .percentage(Finding.percentage(duplicates, rows))
                .message(duplicates + " rows duplicate an earlier row")
                .build());
    }

    @Override
    public String getCheckName() {
        return "duplicate-rows";
    }
}
