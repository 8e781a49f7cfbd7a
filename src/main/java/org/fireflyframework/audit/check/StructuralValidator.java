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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema-level sanity checks: emptiness, fully missing columns and duplicate column names.
 *
 * <p>An empty table yields a single {@link Severity#CRITICAL} finding and nothing else;
 * the engine treats that finding as the signal to skip every other check.</p>
 */
public class StructuralValidator implements TableCheck {

    @Override
    public List<Finding> check(Table table) {
        if (table.isEmpty()) {
            return List.of(Finding.builder()
                    .kind(FindingKind.EMPTY_TABLE)
                    .severity(Severity.CRITICAL)
                    .message("Table is empty")
                    .build());
        }

        List<Finding> findings = new ArrayList<>();

        List<String> emptyColumns = table.getColumns().stream()
                .filter(Column::isAllMissing)
                .map(Column::getName)
                .toList();
        if (!emptyColumns.isEmpty()) {
            findings.add(Finding.builder()
                    .kind(FindingKind.EMPTY_COLUMNS)
                    .severity(Severity.WARNING)
                    .count(emptyColumns.size())
                    .message("Empty columns found: " + emptyColumns)
                    .build());
        }

        Set<String> duplicated = duplicatedNames(table);
        if (!duplicated.isEmpty()) {
            findings.add(Finding.builder()
                    .kind(FindingKind.DUPLICATE_HEADERS)
                    .severity(Severity.ERROR)
                    .count(duplicated.size())
                    .message("Duplicate headers: " + duplicated)
                    .build());
        }

        return findings;
    }

    /**
     * Returns whether the given structural findings make the rest of the audit pointless.
     *
     * @param findings the findings returned by {@link #check(Table)}
     * @return {@code true} if the table is empty
     */
    public boolean isFatal(List<Finding> findings) {
        return findings.stream().anyMatch(finding -> finding.getKind() == FindingKind.EMPTY_TABLE);
    }

    @Override
    public String getCheckName() {
        return "structure";
    }

    private Set<String> duplicatedNames(Table table) {
        Map<String, Integer> occurrences = new HashMap<>();
        Set<String> duplicated = new LinkedHashSet<>();
        for (Column column : table.getColumns()) {
            if (occurrences.merge(column.getName(), 1, Integer::sum) == 2) {
                duplicated.add(column.getName());
            }
        }
        return duplicated;
    }
}
