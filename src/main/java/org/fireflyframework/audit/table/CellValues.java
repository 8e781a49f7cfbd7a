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

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static helpers for interpreting individual cell values.
 *
 * <p>A cell is missing when it is {@code null} or a floating-point {@code NaN}.
 * Numeric cells are compared by value, so {@code 1}, {@code 1L} and {@code 1.0}
 * are the same cell.</p>
 */
public final class CellValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private CellValues() {}

    /**
     * Returns whether the given cell is missing.
     *
     * @param value the cell value
     * @return {@code true} for {@code null} and {@code NaN}
     */
    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Coerces a cell to a number. Numbers are widened, strings are parsed the way a
     * CSV loader parses numeric text (surrounding whitespace allowed, decimal and
     * exponent notation, {@code inf}/{@code infinity}). Everything else yields {@code null}.
     *
     * @param value the cell value
     * @return the numeric value, or {@code null} if the cell is not numeric
     */
    public static Double toDouble(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            return parseDouble(text);
        }
        return null;
    }

    /**
     * Parses numeric text, returning {@code null} when it is not a number.
     *
     * @param text the text to parse
     * @return the parsed value or {@code null}
     */
    public static Double parseDouble(String text) {
        String trimmed = text.strip();
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String unsigned = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return null;
    }

    /**
     * Returns the string form of a cell as used by pattern and allowed-value rules.
     *
     * @param value the cell value, never missing
     * @return the string form
     */
    public static String asText(Object value) {
        return String.valueOf(value);
    }

    /**
     * Returns a key that is equal for two cells exactly when they represent the same
     * value. Missing cells share a single key.
     *
     * @param value the cell value
     * @return the comparison key
     */
    public static Object comparisonKey(Object value) {
        if (isMissing(value)) {
            return MissingCell.INSTANCE;
        }
        if (value instanceof Number) {
            return numericKey(value);
        }
        return value;
    }

    /**
     * Returns the exact decimal value of a finite numeric cell or numeric text.
     *
     * @param value the cell value
     * @return the exact value, or {@code null} if the cell is not a finite number
     */
    public static BigDecimal toBigDecimal(Object value) {
        Double number = toDouble(value);
        if (number == null || number.isInfinite()) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        String text = value instanceof String string ? string.strip() : value.toString();
        return new BigDecimal(text);
    }

    /**
     * Returns a key that is equal for two numeric cells, or numeric texts, exactly when
     * they denote the same number. {@code "2"}, {@code 2} and {@code 2.0} share a key.
     *
     * @param value the cell value
     * @return the numeric key, or {@code null} if the cell is not numeric
     */
    public static Object numericKey(Object value) {
        BigDecimal exact = toBigDecimal(value);
        if (exact != null) {
            return exact.stripTrailingZeros();
        }
        return toDouble(value);
    }

    /**
     * Returns whether two cells represent the same value.
     *
     * @param left  the first cell
     * @param right the second cell
     * @return {@code true} if the cells are equal by value
     */
    public static boolean sameValue(Object left, Object right) {
        return comparisonKey(left).equals(comparisonKey(right));
    }

    private enum MissingCell {
        INSTANCE
    }
}
