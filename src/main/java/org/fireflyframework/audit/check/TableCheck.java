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
import org.fireflyframework.audit.table.Table;

import java.util.List;

/**
 * Port interface for a single audit concern evaluated against a whole {@link Table}.
 *
 * <p>Checks read the table and return the findings they discovered; they never modify
 * the table and keep no state between calls, so the engine may run them concurrently.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class NegativeBalanceCheck implements TableCheck {
 *
 *     @Override
 *     public List<Finding> check(Table table) {
 *         return table.findColumn("balance")
 *                 .filter(column -> column.presentValues().stream()
 *                         .anyMatch(value -> ((Number) value).doubleValue() < 0))
 *                 .map(column -> List.of(Finding.builder()
 *                         .kind(FindingKind.BUSINESS_RULE_VIOLATION)
 *                         .severity(Severity.ERROR)
 *                         .column(column.getName())
 *                         .message("Negative balances found")
 *                         .build()))
 *                 .orElse(List.of());
 *     }
 *
 *     @Override
 *     public String getCheckName() {
 *         return "negative-balance";
 *     }
 * }
 * }</pre>
 */
public interface TableCheck {

    /**
     * Evaluates this check against the given table.
     *
     * @param table the table to audit
     * @return the findings, possibly empty, never {@code null}
     */
    List<Finding> check(Table table);

    /**
     * Returns the unique name of this check.
     *
     * @return the check name
     */
    String getCheckName();
}
