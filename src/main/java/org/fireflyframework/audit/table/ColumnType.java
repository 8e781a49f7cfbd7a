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

package org.fireflyframework.audit.table;

import java.util.List;

/**
 * Declared semantic type of a {@link Column}.
 *
 * <ul>
 *   <li>{@link #TEXT} - string cells, or a mix of kinds</li>
 *   <li>{@link #NUMERIC} - every present cell is a {@link Number}</li>
 *   <li>{@link #BOOLEAN} - every present cell is a {@link Boolean}</li>
 *   <li>{@link #MISSING} - the column holds no present cell at all</li>
 * </ul>
 */
public enum ColumnType {

    TEXT,
    NUMERIC,
    BOOLEAN,
    MISSING;

    /**
     * Infers the declared type of a column from its cells, the way a delimited-file
     * loader types a column after parsing.
     *
     * @param values the cells, {@code null} or {@code NaN} meaning missing
     * @return the inferred type
     */
    public static ColumnType infer(List<?> values) {
        boolean allNumbers = true;
        boolean allBooleans = true;
        boolean anyPresent = false;

        for (Object value : values) {
            if (CellValues.isMissing(value)) {
                continue;
            }
            anyPresent = true;
            allNumbers &= value instanceof Number;
            allBooleans &= value instanceof Boolean;
        }

        if (!anyPresent) {
            return MISSING;
        }
        if (allNumbers) {
            return NUMERIC;
        }
        return allBooleans ? BOOLEAN : TEXT;
    }
}
