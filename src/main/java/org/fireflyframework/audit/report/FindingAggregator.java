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

package org.fireflyframework.audit.report;

import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.TableStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link AuditReport} from the findings of a completed audit.
 *
 * <p>A pure function of its inputs: counts findings per severity, orders them by severity,
 * derives the {@link OverallAssessment} and a fixed-order list of recommendations that
 * depend only on which kinds of findings are present.</p>
 */
public class FindingAggregator {

    static final double HIGH_MISSING_PERCENTAGE = 20;

    static final String IMPUTATION =
            "Consider data imputation or collection strategies for columns with high missing values: ";
    static final String INVESTIGATE_DUPLICATE_IDS =
            "Remove or investigate duplicate IDs to ensure data integrity";
    static final String STANDARDIZE_TYPES =
            "Standardize data types for consistent analysis";
    static final String INVESTIGATE_OUTLIERS =
            "Investigate outliers - they may indicate data entry errors or legitimate special cases";
    static final String LOOKS_GOOD =
            "Data quality appears good - consider setting up automated validation for future uploads";

    /**
     * Aggregates findings into a report.
     *
     * @param statistics the statistics of the audited table
     * @param findings   the findings in the order the checks reported them
     * @return the report
     */
    public AuditReport aggregate(TableStatistics statistics, List<Finding> findings) {
        List<Finding> ordered = findings.stream()
                .sorted(Comparator.comparing(Finding::getSeverity))
                .toList();

        AuditSummary summary = AuditSummary.builder()
                .critical(count(ordered, Severity.CRITICAL))
                .errors(count(ordered, Severity.ERROR))
                .warnings(count(ordered, Severity.WARNING))
                .info(count(ordered, Severity.INFO))
                .total(ordered.size())
                .build();

        return AuditReport.builder()
                .statistics(statistics)
                .summary(summary)
                .findings(ordered)
                .recommendations(recommendations(ordered))
                .assessment(OverallAssessment.of(summary))
                .build();
    }

    List<String> recommendations(List<Finding> findings) {
        List<String> recommendations = new ArrayList<>();

        List<String> highMissing = findings.stream()
                .filter(finding -> finding.getKind() == FindingKind.MISSING_VALUES)
                .filter(finding -> finding.getPercentage() != null
                        && finding.getPercentage() > HIGH_MISSING_PERCENTAGE)
                .map(Finding::getColumn)
                .toList();
        if (!highMissing.isEmpty()) {
            recommendations.add(IMPUTATION + highMissing);
        }

        Set<FindingKind> kinds = EnumSet.noneOf(FindingKind.class);
        findings.forEach(finding -> kinds.add(finding.getKind()));

        if (kinds.contains(FindingKind.DUPLICATE_IDS)) {
            recommendations.add(INVESTIGATE_DUPLICATE_IDS);
        }
        if (kinds.contains(FindingKind.MIXED_TYPES_NUMERIC) || kinds.contains(FindingKind.POTENTIAL_DATE_COLUMN)) {
            recommendations.add(STANDARDIZE_TYPES);
        }
        if (kinds.contains(FindingKind.OUTLIERS)) {
            recommendations.add(INVESTIGATE_OUTLIERS);
        }

        if (recommendations.isEmpty()) {
            recommendations.add(LOOKS_GOOD);
        }
        return List.copyOf(recommendations);
    }

    private int count(List<Finding> findings, Severity severity) {
        return (int) findings.stream()
                .filter(finding -> finding.getSeverity() == severity)
                .count();
    }
}
