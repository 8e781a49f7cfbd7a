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

import org.fireflyframework.audit.table.CellValues;
import org.fireflyframework.audit.table.Column;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure classification of a column's cells: how many coerce to numbers and whether a
 * leading sample looks like date literals.
 *
 * <p>Recognised date shapes, matched at the start of the value: ISO {@code YYYY-MM-DD},
 * US {@code MM/DD/YYYY} and EU {@code DD-MM-YYYY}.</p>
 */
public class TypeClassifier {

    static final int MAX_EXAMPLES = 5;
    static final int DATE_SAMPLE_SIZE = 10;

    private static final List<Pattern> DATE_SHAPES = List.of(
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("\\d{2}/\\d{2}/\\d{4}"),
            Pattern.compile("\\d{2}-\\d{2}-\\d{4}"));

    /**
     * Classifies the given column.
     *
     * @param column the column to classify
     * @return the verdict
     */
    public TypeVerdict classify(Column column) {
        List<Object> present = column.presentValues();

        int numeric = 0;
        Set<Object> nonNumeric = new LinkedHashSet<>();
        for (Object value : present) {
            if (CellValues.toDouble(value) != null) {
                numeric++;
            } else if (nonNumeric.size() < MAX_EXAMPLES) {
                nonNumeric.add(value);
            }
        }

        List<Object> sample = present.subList(0, Math.min(DATE_SAMPLE_SIZE, present.size()));
        int dateMatches = 0;
        for (Pattern shape : DATE_SHAPES) {
            for (Object value : sample) {
                if (shape.matcher(CellValues.asText(value)).lookingAt()) {
                    dateMatches++;
                }
            }
        }

        return TypeVerdict.builder()
                .column(column.getName())
                .presentCount(present.size())
                .numericCount(numeric)
                .nonNumericExamples(new ArrayList<>(nonNumeric))
                .dateSampleSize(sample.size())
                .dateMatches(dateMatches)
                .build();
    }
}
