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
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.table.Column;
import org.fireflyframework.audit.table.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DuplicateKeysCheck}.
 */
class DuplicateKeysCheckTest {

    private final DuplicateKeysCheck check = new DuplicateKeysCheck();

    @Test
    void check_duplicatedIdentifier_shouldBeError() {
        // Given
        Table table = Table.of(
                Column.numeric("user_id", 1, 2, 2, 3),
                Column.numeric("amount", 5, 5, 5, 5));

        // When
        List<Finding> findings = check.check(table);

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getKind()).isEqualTo(FindingKind.DUPLICATE_IDS);
        assertThat(finding.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(finding.getColumn()).isEqualTo("user_id");
        assertThat(finding.getCount()).isEqualTo(1);
        assertThat(finding.getMessage()).isEqualTo("1 duplicated identifier values");
    }

    @Test
    void check_shouldIgnoreMissingKeys() {
        Table table = Table.of(Column.text("product_code", "A", null, null, "B"));

        assertThat(check.check(table)).isEmpty();
    }

    @Test
    void check_shouldCountEveryRepeatedOccurrence() {
        Table table = Table.of(Column.text("Account_Key", "x", "x", "x", "y"));

        assertThat(check.check(table)).extracting(Finding::getCount).containsExactly(2);
    }

    @Test
    void isKeyColumn_shouldMatchHintsCaseInsensitively() {
        assertThat(DuplicateKeysCheck.isKeyColumn("ID")).isTrue();
        assertThat(DuplicateKeysCheck.isKeyColumn("customerIdentifier")).isTrue();
        assertThat(DuplicateKeysCheck.isKeyColumn("zip_code")).isTrue();
        assertThat(DuplicateKeysCheck.isKeyColumn("amount")).isFalse();
    }
}
