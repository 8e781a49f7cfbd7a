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

package org.fireflyframework.audit.event;

import lombok.Data;
import org.fireflyframework.audit.report.AuditReport;
import org.fireflyframework.audit.report.OverallAssessment;
import org.fireflyframework.audit.table.TableStatistics;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.audit.DataAuditEngine} after each
 * audit run, carrying the complete report.
 *
 * <p>Listeners typically react to the overall assessment, for example to quarantine a
 * file that came back {@link OverallAssessment#POOR}:</p>
 *
 * <pre>{@code
 * @EventListener
 * public void onAudit(DataAuditEvent event) {
 *     if (event.getAssessment() == OverallAssessment.POOR) {
 *         quarantine(event.getSourcePath());
 *     }
 * }
 * }</pre>
 */
@Data
public class DataAuditEvent {

    private final AuditReport report;
    private final Instant timestamp;

    public DataAuditEvent(AuditReport report) {
        this.report = report;
        this.timestamp = Instant.now();
    }

    public OverallAssessment getAssessment() {
        return report.getAssessment();
    }

    /**
     * @return {@code true} if the audit produced a critical or error finding
     */
    public boolean hasIssues() {
        return !report.getIssues().isEmpty();
    }

    /**
     * @return the audited source, or {@code null} if the table was built in memory
     */
    public String getSourcePath() {
        TableStatistics statistics = report.getStatistics();
        return statistics == null ? null : statistics.getSourcePath();
    }
}
