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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

/**
 * Finding counts per severity.
 */
@Data
@Builder
@Schema(description = "Number of findings per severity")
public class AuditSummary {

    @Schema(description = "Critical findings", example = "0")
    private final int critical;

    @Schema(description = "Error findings", example = "2")
    private final int errors;

    @Schema(description = "Warning findings", example = "3")
    private final int warnings;

    @Schema(description = "Informational findings", example = "5")
    private final int info;

    @Schema(description = "All findings", example = "10")
    private final int total;
}
