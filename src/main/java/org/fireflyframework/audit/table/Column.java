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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed, read-only sequence of cells.
 *
 * <p>Missing cells are {@code null} (or {@code NaN}, see {@link CellValues#isMissing(Object)}).
 * Names are not required to be unique within a {@link Table}.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Column {

    private final String name;
    private final ColumnType type;
    private final List<Object> values;

    public Column(String name, ColumnType type, List<?> values) {
        this.name = Objects.requireNonNull(name, "column name");
        this.type = Objects.requireNonNull(type, "column type");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Creates a column whose declared type is inferred from its values.
     *
     * @param name   the column name
     * @param values the cells
     * @return the column
     */
    public static Column inferred(String name, List<?> values) {
        return new Column(name, ColumnType.infer(values), values);
    }

    public static Column text(String name, String... values) {
        return new Column(name, ColumnType.TEXT, Arrays.asList(values));
    }

    public static Column numeric(String name, Number... values) {
        return new Column(name, ColumnType.NUMERIC, Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public boolean isMissing(int row) {
        return CellValues.isMissing(values.get(row));
    }

    public boolean isText() {
        return type == ColumnType.TEXT;
    }

    public boolean isNumeric() {
        return type == ColumnType.NUMERIC;
    }

    /**
     * Returns the non-missing cells in row order.
     *
     * @return the present values
     */
    public List<Object> presentValues() {
        return values.stream()
                .filter(value -> !CellValues.isMissing(value))
                .toList();
    }

    public int missingCount() {
        return (int) values.stream().filter(CellValues::isMissing).count();
    }

    public boolean isAllMissing() {
        return missingCount() == values.size();
    }
}
