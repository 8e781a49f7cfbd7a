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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Shape and provenance of a {@link Table}, as reported by the loader that produced it.
 */
@Data
@Builder
@Schema(description = "Shape and source information of the audited table")
public class TableStatistics {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    @Schema(description = "Number of data rows", example = "1000")
    private final int rows;

    @Schema(description = "Number of columns", example = "8")
    private final int columns;

    @Schema(description = "Column names in declared order", example = "[\"user_id\", \"email\", \"amount\"]")
    private final List<String> headers;

    @Schema(description = "Byte size of the originating source", example = "52480")
    private final long sourceBytes;

    @Schema(description = "Path or name of the originating source", example = "customers.csv")
    private final String sourcePath;

    @Schema(description = "Encoding the loader decoded the source with", example = "utf-8")
    private final String encoding;

    @Schema(description = "Field delimiter of the source", example = ",")
    private final String delimiter;

    /**
     * Returns the source size in megabytes.
     *
     * @return the size in MB
     */
    public double getFileSizeMb() {
        return sourceBytes / BYTES_PER_MB;
    }
}
