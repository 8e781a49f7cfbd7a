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
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Detects repeated values in identifier-like columns, i.e. columns whose name contains
 * {@code id}, {@code key}, {@code code} or {@code identifier} in any case.
 *
 * <p>Any collision is an {@link Severity#ERROR} regardless of how many rows it affects.</p>
 */
public class DuplicateKeysCheck implements TableCheck {

    static final List<String> KEY_HINTS = List.of("id", "key", "code", "identifier");

    @Override
    public List<Finding> check(Table table) {
        List<Finding> findings = new ArrayList<>();

        for (Column column : table.getColumns()) {
            if (!isKeyColumn(column.getName())) {
                continue;
            }
            int duplicates = countDuplicates(column.presentValues());
            if (duplicates > 0) {
                findings.add(Finding.builder()
                        .kind(FindingKind.DUPLICATE_IDS)
                        .severity(Severity.ERROR)
                        .column(column.getName())
                        .count(duplicates)
                        .message(duplicates + " duplicated identifier values")
                        .build());
            }
        }
        return findings;
    }

    static boolean isKeyColumn(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return KEY_HINTS.stream().anyMatch(lower::contains);
    }

    private int countDuplicates(List<Object> values) {
        Set<Object> seen = new HashSet<>();
        int duplicates = 0;
        for (Object value : values) {
            if (!seen.add(CellValues.comparisonKey(value))) {
                duplicates++;
            }
        }
        return duplicates;
    }

    @Override
    public String getCheckName() {
        return "duplicate-keys";
    }
}
