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

package org.fireflyframework.audit.finding;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * A single classified observation about the audited table.
 *
 * <p>A finding without a {@code column} applies to the whole table. {@code count},
 * {@code percentage} and {@code values} are only set by the checks that measure them.</p>
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A single severity-classified observation about the data")
public class Finding {

    @Schema(description = "Kind of observation", example = "MISSING_VALUES")
    private final FindingKind kind;

    @Schema(description = "Severity of the observation", example = "WARNING")
    private final Severity severity;

    @Schema(description = "Column the observation applies to, absent for table-level findings", example = "email")
    private final String column;

    @Schema(description = "Business rule that produced the observation", example = "age_range")
    private final String rule;

    @Schema(description = "Number of affected cells, rows or values", example = "12")
    private final Integer count;

    @Schema(description = "Affected share in percent, rounded half-even to two decimals", example = "6.25")
    private final Double percentage;

    @Schema(description = "Human-readable description", example = "Rows have leading/trailing whitespace")
    private final String message;

    @Builder.Default
    @Schema(description = "Example values for inspection, capped per kind")
    private final List<Object> values = List.of();

    /**
     * Computes {@code part / whole * 100} to two decimals, rounding the exact binary value
     * half-even so that {@code 1 / 800} yields {@code 0.12}.
     *
     * @param part  the affected amount
     * @param whole the total amount, must be positive
     * @return the rounded percentage
     */
    public static double percentage(long part, long whole) {
        return new BigDecimal(part * 100.0 / whole)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
