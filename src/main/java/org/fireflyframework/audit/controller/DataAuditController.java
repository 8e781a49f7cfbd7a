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

package org.fireflyframework.audit.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.AuditStrategy;
import org.fireflyframework.audit.DataAuditEngine;
import org.fireflyframework.audit.model.AuditRequest;
import org.fireflyframework.audit.report.AuditReport;
import org.fireflyframework.audit.rules.RuleSet;
import org.fireflyframework.audit.rules.RuleSetParser;
import org.fireflyframework.audit.table.Table;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller that audits a table posted in the request body.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * POST /api/v1/data/audit
 * </pre>
 *
 * @see DataAuditEngine
 * @see AuditReport
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/data/audit")
@Tag(name = "Data Audit", description = "Data quality auditing of tabular data")
public class DataAuditController {

    private final DataAuditEngine engine;
    private final RuleSetParser ruleSetParser;

    public DataAuditController(DataAuditEngine engine, RuleSetParser ruleSetParser) {
        this.engine = engine;
        this.ruleSetParser = ruleSetParser;
    }

    /**
     * Audits the posted table.
     *
     * @param request the table and optional rules
     * @return the audit report
     */
    @PostMapping
    @Operation(
        summary = "Audit a table",
        description = "Runs structural, value-quality, outlier and business-rule checks on the posted " +
                     "table and returns a severity-ranked report with recommendations."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Audit completed"),
        @ApiResponse(responseCode = "400", description = "Malformed table or invalid business rules"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<AuditReport> audit(@RequestBody AuditRequest request) {
        return Mono.fromCallable(() -> Table.fromRows(request.getName(), orEmpty(request.getHeaders()),
                        orEmpty(request.getRows())))
                .doOnNext(table -> log.debug("Auditing '{}': {} rows x {} columns",
                        request.getName(), table.getRowCount(), table.getColumnCount()))
                .flatMap(table -> {
                    RuleSet rules = request.getRules() != null
                            ? ruleSetParser.parse(request.getRules())
                            : engine.getDefaultRules();
                    AuditStrategy strategy = request.getStrategy() != null
                            ? request.getStrategy()
                            : engine.getDefaultStrategy();
                    return engine.audit(table, rules, strategy);
                });
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
