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

package org.fireflyframework.audit.outlier;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.check.TableCheck;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flags values of numeric columns that lie strictly outside the IQR fences
 * {@code [Q1 - 1.5 * IQR, Q3 + 1.5 * IQR]}.
 *
 * <p>Columns with fewer than {@value #MIN_SAMPLE_SIZE} present values are skipped.
 * Each column with outliers yields one {@link Severity#INFO} finding carrying the first
 * {@value #MAX_REPORTED_VALUES} outliers in row order.</p>
 */
@Slf4j
public class OutlierDetector implements TableCheck {

    public static final int MIN_SAMPLE_SIZE = 4;
    public static final int MAX_REPORTED_VALUES = 10;

    private static final double FENCE_FACTOR = 1.5;

    @Override
    public List<Finding> check(Table table) {
        List<Finding> findings = new ArrayList<>();

        for (Column column : table.getColumns()) {
            if (!column.isNumeric()) {
                continue;
            }
            List<Object> present = column.presentValues();
            if (present.size() < MIN_SAMPLE_SIZE) {
                log.debug("Skipping outlier detection for column '{}': {} values", column.getName(), present.size());
                continue;
            }

            Fences fences = fences(present);
            List<Object> outliers = present.stream()
                    .filter(value -> fences.excludes(((Number) value).doubleValue()))
                    .toList();

            if (!outliers.isEmpty()) {
                findings.add(Finding.builder()
                        .kind(FindingKind.OUTLIERS)
                        .severity(Severity.INFO)
                        .column(column.getName())
                        .count(outliers.size())
                        .percentage(Finding.percentage(outliers.size(), present.size()))
                        .message(outliers.size() + " values outside [" + fences.lower() + ", " + fences.upper() + "]")
                        .values(outliers.subList(0, Math.min(MAX_REPORTED_VALUES, outliers.size())))
                        .build());
            }
        }
        return findings;
    }

    static Fences fences(List<Object> values) {
        double[] sorted = values.stream()
                .mapToDouble(value -> ((Number) value).doubleValue())
                .toArray();
        Arrays.sort(sorted);

        double q1 = Quantiles.linear(sorted, 0.25);
        double q3 = Quantiles.linear(sorted, 0.75);
        double iqr = q3 - q1;
        return new Fences(q1 - FENCE_FACTOR * iqr, q3 + FENCE_FACTOR * iqr);
    }

    @Override
    public String getCheckName() {
        return "outliers";
    }

    record Fences(double lower, double upper) {

        boolean excludes(double value) {
            return value < lower || value > upper;
        }
    }
}
