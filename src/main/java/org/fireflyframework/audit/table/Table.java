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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fully materialized, read-only table: an ordered list of equally sized {@link Column}s
 * together with the {@link TableStatistics} reported by the loader.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Table table = Table.builder()
 *         .column(Column.numeric("user_id", 1, 2, 2, 3))
 *         .column(Column.text("email", "a@x.io", "b@x.io", null, "c@x.io"))
 *         .sourcePath("users.csv")
 *         .sourceBytes(2048)
 *         .build();
 * }</pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Table {

    private final List<Column> columns;
    private final int rowCount;
    private final TableStatistics statistics;

    @Builder
    private Table(@Singular List<Column> columns, String sourcePath, String encoding,
                  String delimiter, long sourceBytes) {
        this.columns = List.copyOf(columns);
        this.rowCount = this.columns.isEmpty() ? 0 : this.columns.get(0).size();

        for (Column column : this.columns) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                        + column.size() + " values, expected " + rowCount);
            }
        }

        this.statistics = TableStatistics.builder()
                .rows(rowCount)
                .columns(this.columns.size())
                .headers(this.columns.stream().map(Column::getName).toList())
                .sourceBytes(sourceBytes)
                .sourcePath(sourcePath)
                .encoding(encoding)
                .delimiter(delimiter)
                .build();
    }

    public static Table of(Column... columns) {
        return Table.builder().columns(List.of(columns)).build();
    }

    public static Table fromRows(List<String> headers, List<? extends List<?>> rows) {
        return fromRows(null, headers, rows);
    }

    /**
     * Builds a table from row-oriented data, inferring each column's type.
     *
     * @param sourcePath the name of the source the rows were read from, may be {@code null}
     * @param headers    the column names
     * @param rows       the rows, each with exactly one cell per header
     * @return the table
     * @throws IllegalArgumentException if a header or row is {@code null}, or a row does not
     *                                  have one cell per header
     */
    public static Table fromRows(String sourcePath, List<String> headers, List<? extends List<?>> rows) {
        List<List<Object>> cells = new ArrayList<>();
        for (int c = 0; c < headers.size(); c++) {
            if (headers.get(c) == null) {
                throw new IllegalArgumentException("Header " + c + " is null");
            }
            cells.add(new ArrayList<>(rows.size()));
        }

        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            if (row == null) {
                throw new IllegalArgumentException("Row " + r + " is null");
            }
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + row.size()
                        + " cells, expected " + headers.size());
            }
            for (int c = 0; c < row.size(); c++) {
                cells.get(c).add(row.get(c));
            }
        }

        TableBuilder builder = Table.builder().sourcePath(sourcePath);
        for (int c = 0; c < headers.size(); c++) {
            builder.column(Column.inferred(headers.get(c), cells.get(c)));
        }
        return builder.build();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Resolves a column by name. When the name is duplicated the first column wins.
     *
     * @param name the column name
     * @return the column, if present
     */
    public Optional<Column> findColumn(String name) {
        return columns.stream()
                .filter(column -> column.getName().equals(name))
                .findFirst();
    }

    /**
     * Returns the cells of one row across all columns, in column order.
     *
     * @param row the row index
     * @return the row cells
     */
    public List<Object> row(int row) {
        List<Object> cells = new ArrayList<>(columns.size());
        for (Column column : columns) {
            cells.add(column.get(row));
        }
        return cells;
    }
}
