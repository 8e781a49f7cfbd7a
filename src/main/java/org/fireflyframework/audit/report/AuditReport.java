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

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.TableStatistics;

import java.util.List;

/**
 * Read-only result of one audit run, produced by the {@link FindingAggregator}.
 *
 * <p>Findings are ordered from most to least severe; findings of equal severity keep the
 * order in which the checks reported them. The report carries no timestamp, so auditing
 * the same table twice yields equal reports.</p>
 */
@Data
@Builder
@Schema(description = "Data quality audit report")
public class AuditReport {

    @Schema(description = "Shape and source of the audited table")
    private final TableStatistics statistics;

    @Schema(description = "Finding counts per severity")
    private final AuditSummary summary;

    @Schema(description = "Findings, most severe first")
    private final List<Finding> findings;

    @Schema(description = "Advisory recommendations derived from the kinds of findings present")
    private final List<String> recommendations;

    @Schema(description = "Overall verdict derived from the summary", example = "FAIR")
    private final OverallAssessment assessment;

    /**
     * Returns the findings that must be fixed before the data is trusted
     * ({@link Severity#CRITICAL} and {@link Severity#ERROR}).
     *
     * @return the blocking findings
     */
    @JsonIgnore
    public List<Finding> getIssues() {
        return findings.stream()
                .filter(finding -> finding.getSeverity().isAtLeast(Severity.ERROR))
                .toList();
    }

    /**
     * Returns the advisory findings ({@link Severity#WARNING} and {@link Severity#INFO}).
     *
     * @return the non-blocking findings
     */
    @JsonIgnore
    public List<Finding> getWarnings() {
        return findings.stream()
                .filter(finding -> !finding.getSeverity().isAtLeast(Severity.ERROR))
                .toList();
    }

    public List<Finding> getBySeverity(Severity severity) {
        return findings.stream()
                .filter(finding -> finding.getSeverity() == severity)
                .toList();
    }

    public List<Finding> getByKind(FindingKind kind) {
        return findings.stream()
                .filter(finding -> finding.getKind() == kind)
                .toList();
    }
}
