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
 * Formatting consistency of text columns: leading or trailing whitespace, and columns
 * mixing fully uppercase with fully lowercase values. Both are {@link Severity#INFO}.
 */
public class StringConsistencyCheck implements TableCheck {

    static final int CASE_SAMPLE_SIZE = 20;
    static final int MAX_EXAMPLES = 5;

    @Override
    public List<Finding> check(Table table) {
        List<Finding> findings = new ArrayList<>();

        for (Column column : table.getColumns()) {
            if (!column.isText()) {
                continue;
            }
            List<Object> present = column.presentValues();
            List<String> strings = present.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .toList();

            long padded = strings.stream().filter(s -> !s.equals(s.strip())).count();
            if (padded > 0) {
                findings.add(Finding.builder()
                        .kind(FindingKind.WHITESPACE_ISSUES)
                        .severity(Severity.INFO)
                        .column(column.getName())
                        .count((int) padded)
                        .message("Rows have leading/trailing whitespace")
                        .build());
            }

            boolean anyUpper = strings.stream().anyMatch(StringConsistencyCheck::isUpperCase);
            boolean anyLower = strings.stream().anyMatch(StringConsistencyCheck::isLowerCase);
            if (anyUpper && anyLower) {
                List<Object> examples = present.stream()
                        .limit(CASE_SAMPLE_SIZE)
                        .distinct()
                        .limit(MAX_EXAMPLES)
                        .toList();
                findings.add(Finding.builder()
                        .kind(FindingKind.INCONSISTENT_CASE)
                        .severity(Severity.INFO)
                        .column(column.getName())
                        .message("Mixed case usage detected")
                        .values(examples)
                        .build());
            }
        }
        return findings;
    }

    /**
     * Returns whether the text has at least one cased letter and no lowercase letter.
     */
    static boolean isUpperCase(String text) {
        return hasOnlyCase(text, true);
    }

    /**
     * Returns whether the text has at least one cased letter and no uppercase letter.
     */
    static boolean isLowerCase(String text) {
        return hasOnlyCase(text, false);
    }

    private static boolean hasOnlyCase(String text, boolean upper) {
        boolean cased = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isTitleCase(cp)) {
                return false;
            }
            if (Character.isUpperCase(cp)) {
                if (!upper) {
                    return false;
                }
                cased = true;
            } else if (Character.isLowerCase(cp)) {
                if (upper) {
                    return false;
                }
                cased = true;
            }
        }
        return cased;
    }

    @Override
    public String getCheckName() {
        return "string-consistency";
    }
}
