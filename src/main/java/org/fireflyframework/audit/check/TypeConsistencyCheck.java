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
 * Reports text columns whose content suggests a different type: partly numeric content
 * ({@link Severity#WARNING}) and date literals stored as text ({@link Severity#INFO}).
 * Both findings may fire for the same column.
 */
public class TypeConsistencyCheck implements TableCheck {

    private final TypeClassifier classifier;

    public TypeConsistencyCheck() {
        this(new TypeClassifier());
    }

    public TypeConsistencyCheck(TypeClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public List<Finding> check(Table table) {
        List<Finding> findings = new ArrayList<>();

        for (Column column : table.getColumns()) {
            if (!column.isText()) {
                continue;
            }
            TypeVerdict verdict = classifier.classify(column);
            if (verdict.getPresentCount() == 0) {
                continue;
            }

            if (verdict.isMixedNumeric()) {
                findings.add(Finding.builder()
                        .kind(FindingKind.MIXED_TYPES_NUMERIC)
                        .severity(Severity.WARNING)
                        .column(column.getName())
                        .count(verdict.getPresentCount() - verdict.getNumericCount())
                        .message("Column contains non-numeric values: " + verdict.getNonNumericExamples())
                        .values(verdict.getNonNumericExamples())
                        .build());
            }

            if (verdict.isLikelyDate()) {
                findings.add(Finding.builder()
                        .kind(FindingKind.POTENTIAL_DATE_COLUMN)
                        .severity(Severity.INFO)
                        .column(column.getName())
                        .message("Column appears to contain dates but is stored as text")
                        .build());
            }
        }
        return findings;
    }

    @Override
    public String getCheckName() {
        return "type-consistency";
    }
}
