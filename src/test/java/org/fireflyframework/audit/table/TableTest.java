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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Table} and {@link Column}.
 */
class TableTest {

    @Test
    void builder_shouldComputeStatistics() {
        // Given
        Table table = Table.builder()
                .column(Column.numeric("user_id", 1, 2, 3))
                .column(Column.text("email", "a@x.io", null, "c@x.io"))
                .sourcePath("users.csv")
                .encoding("utf-8")
                .delimiter(",")
                .sourceBytes(1024 * 1024)
                .build();

        // When
        TableStatistics statistics = table.getStatistics();

        // Then
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getColumnCount()).isEqualTo(2);
        assertThat(statistics.getRows()).isEqualTo(3);
        assertThat(statistics.getColumns()).isEqualTo(2);
        assertThat(statistics.getHeaders()).containsExactly("user_id", "email");
        assertThat(statistics.getSourcePath()).isEqualTo("users.csv");
        assertThat(statistics.getEncoding()).isEqualTo("utf-8");
        assertThat(statistics.getDelimiter()).isEqualTo(",");
        assertThat(statistics.getFileSizeMb()).isEqualTo(1.0);
    }

    @Test
    void builder_shouldRejectColumnsOfDifferentLength() {
        assertThatThrownBy(() -> Table.of(
                Column.numeric("a", 1, 2, 3),
                Column.numeric("b", 1, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void of_withoutColumns_shouldBeEmpty() {
        Table table = Table.of();

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.getStatistics().getHeaders()).isEmpty();
    }

    @Test
    void fromRows_shouldTransposeAndInferColumnTypes() {
        // Given
        List<String> headers = List.of("id", "name", "active", "notes");
        List<List<Object>> rows = List.of(
                Arrays.asList(1, "Alice", true, null),
                Arrays.asList(2.5, "Bob", false, null));

        // When
        Table table = Table.fromRows("people.csv", headers, rows);

        // Then
        assertThat(table.getRowCount()).isEqualTo(2);
        assertThat(table.getColumns()).extracting(Column::getType)
                .containsExactly(ColumnType.NUMERIC, ColumnType.TEXT, ColumnType.BOOLEAN, ColumnType.MISSING);
        assertThat(table.getColumns().get(1).getValues()).containsExactly("Alice", "Bob");
        assertThat(table.getStatistics().getSourcePath()).isEqualTo("people.csv");
    }

    @Test
    void fromRows_shouldTypeMixedColumnsAsText() {
        Table table = Table.fromRows(List.of("code"), List.of(List.of(1), List.of("A-2")));

        assertThat(table.getColumns().get(0).getType()).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void fromRows_shouldRejectRaggedRows() {
        assertThatThrownBy(() -> Table.fromRows(List.of("a", "b"), List.of(List.of(1, 2), List.of(3))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Row 1 has 1 cells, expected 2");
    }

    @Test
    void findColumn_shouldResolveFirstColumnWhenNamesRepeat() {
        // Given
        Table table = Table.of(
                Column.numeric("amount", 1, 2),
                Column.numeric("amount", 3, 4));

        // When & Then
        assertThat(table.findColumn("amount")).get()
                .extracting(column -> column.getValues().get(0))
                .isEqualTo(1);
        assertThat(table.findColumn("missing")).isEmpty();
    }

    @Test
    void row_shouldReturnCellsInColumnOrder() {
        Table table = Table.of(
                Column.numeric("id", 1, 2),
                Column.text("name", "a", null));

        assertThat(table.row(1)).containsExactly(2, null);
    }

    @Test
    void column_shouldCountMissingCellsIncludingNaN() {
        Column column = Column.numeric("score", 1.5, null, Double.NaN, 4);

        assertThat(column.missingCount()).isEqualTo(2);
        assertThat(column.presentValues()).containsExactly(1.5, 4);
        assertThat(column.isAllMissing()).isFalse();
        assertThat(column.isMissing(2)).isTrue();
    }

    @Test
    void column_valuesShouldBeReadOnly() {
        Column column = Column.text("name", "a", "b");

        assertThatThrownBy(() -> column.getValues().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fromRows_shouldRejectNullRow() {
        List<List<Object>> rows = Arrays.asList(List.of(1, "a"), null);

        assertThatThrownBy(() -> Table.fromRows(List.of("id", "name"), rows))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Row 1 is null");
    }

    @Test
    void fromRows_shouldRejectNullHeader() {
        List<String> headers = Arrays.asList("id", null);

        assertThatThrownBy(() -> Table.fromRows(headers, List.of(List.of(1, "a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Header 1 is null");
    }
}
