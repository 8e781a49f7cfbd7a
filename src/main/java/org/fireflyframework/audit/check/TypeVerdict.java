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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.audit.table.ColumnType;

import java.util.List;

/**
 * Outcome of classifying the cells of one column, produced by {@link TypeClassifier}.
 *
 * <p>A verdict only records what was observed; turning it into findings is the job of
 * {@link TypeConsistencyCheck}.</p>
 */
@Data
@Builder
public class TypeVerdict {

    private final String column;
    private final int presentCount;
    private final int numericCount;
    private final List<Object> nonNumericExamples;
    private final int dateSampleSize;
    private final int dateMatches;

    /**
     * Returns the type most of the present cells can be read as.
     *
     * @return {@link ColumnType#NUMERIC} when more than half of the cells coerce to numbers,
     *         {@link ColumnType#MISSING} when there is nothing to classify, otherwise
     *         {@link ColumnType#TEXT}
     */
    public ColumnType getDominantType() {
        if (presentCount == 0) {
            return ColumnType.MISSING;
        }
        return numericCount * 2 > presentCount ? ColumnType.NUMERIC : ColumnType.TEXT;
    }

    public boolean isMixedNumeric() {
        return numericCount > 0 && numericCount < presentCount;
    }

    public boolean isLikelyDate() {
        return dateSampleSize > 0 && dateMatches > dateSampleSize * 0.5;
    }
}
