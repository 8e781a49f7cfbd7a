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

/**
 * Human-facing verdict derived from an {@link AuditSummary}, from worst to best.
 *
 * <p>The first matching tier wins: any critical finding is {@link #POOR}, otherwise any
 * error is {@link #FAIR}, otherwise more than ten warnings is {@link #GOOD}, otherwise any
 * warning is {@link #VERY_GOOD}, otherwise {@link #EXCELLENT}. Informational findings never
 * affect the tier.</p>
 */
public enum OverallAssessment {

    POOR("Poor", "Critical issues must be addressed"),
    FAIR("Fair", "Errors need to be fixed before use"),
    GOOD("Good", "Many warnings suggest data quality issues"),
    VERY_GOOD("Very Good", "Minor issues to consider"),
    EXCELLENT("Excellent", "No significant issues detected");

    static final int MANY_WARNINGS = 10;

    private final String label;
    private final String description;

    OverallAssessment(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public static OverallAssessment of(AuditSummary summary) {
        if (summary.getCritical() > 0) {
            return POOR;
        }
        if (summary.getErrors() > 0) {
            return FAIR;
        }
        if (summary.getWarnings() > MANY_WARNINGS) {
            return GOOD;
        }
        if (summary.getWarnings() > 0) {
            return VERY_GOOD;
        }
        return EXCELLENT;
    }

    @Override
    public String toString() {
        return label + " - " + description;
    }
}
