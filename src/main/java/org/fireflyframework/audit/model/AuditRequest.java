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

package org.fireflyframework.audit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.audit.AuditStrategy;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the audit endpoint: a table in row-oriented form plus optional rules.
 *
 * <p><b>Example Request:</b></p>
 * <pre>{@code
 * {
 *   "name": "customers.csv",
 *   "headers": ["user_id", "age", "status"],
 *   "rows": [[1, 34, "active"], [2, 151, "closed"], [2, null, "pending"]],
 *   "rules": {
 *     "age_range": {"column": "age", "type": "range", "min": 0, "max": 120}
 *   }
 * }
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Table and optional business rules to audit")
public class AuditRequest {

    @Schema(description = "Name of the data source, echoed in the report statistics", example = "customers.csv")
    private String name;

    @Schema(description = "Column names in order", example = "[\"user_id\", \"age\", \"status\"]")
    private List<String> headers;

    @Schema(description = "Rows of scalar cells, one cell per header; null marks a missing cell")
    private List<List<Object>> rows;

    @Schema(description = "Business rules by name; the configured rules apply when omitted")
    private Map<String, Map<String, Object>> rules;

    @Schema(description = "Check scheduling; the configured strategy applies when omitted", example = "PARALLEL")
    private AuditStrategy strategy;
}
