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

package org.fireflyframework.audit;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.check.DuplicateKeysCheck;
import org.fireflyframework.audit.check.DuplicateRowsCheck;
import org.fireflyframework.audit.check.MissingValuesCheck;
import org.fireflyframework.audit.check.StringConsistencyCheck;
import org.fireflyframework.audit.check.StructuralValidator;
import org.fireflyframework.audit.check.TableCheck;
import org.fireflyframework.audit.check.TypeConsistencyCheck;
import org.fireflyframework.audit.event.DataAuditEvent;
import org.fireflyframework.audit.finding.Finding;
import org.fireflyframework.audit.finding.FindingKind;
import org.fireflyframework.audit.finding.Severity;
import org.fireflyframework.audit.outlier.OutlierDetector;
import org.fireflyframework.audit.report.AuditReport;
import org.fireflyframework.audit.report.FindingAggregator;
import org.fireflyframework.audit.rules.BusinessRuleEngine;
import org.fireflyframework.audit.rules.RuleSet;
import org.fireflyframework.audit.table.Table;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Engine that audits a {@link Table} and produces an {@link AuditReport}.
 *
 * <p>The {@link StructuralValidator} always runs first. If it finds the table empty the
 * report contains only that finding. Otherwise every {@link TableCheck} and the business
 * rules run independently, each returning its own findings; the findings are merged in
 * check order once all of them have completed and handed to the {@link FindingAggregator}.</p>
 *
 * <p>Checks run one after another or concurrently depending on the {@link AuditStrategy};
 * the merged order, and therefore the report, is the same for both. A check that throws
 * is reported as a {@link FindingKind#CHECK_EVALUATION_ERROR} finding and does not stop
 * the audit.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a {@link DataAuditEvent}
 * is published after each audit.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * DataAuditEngine engine = new DataAuditEngine();
 * RuleSet rules = new RuleSetParser().parse(Map.of(
 *         "age_range", Map.of("column", "age", "type", "range", "min", 0, "max", 120)));
 *
 * engine.audit(table, rules).subscribe(report -> log.info("{}", report.getAssessment()));
 * }</pre>
 */
@Slf4j
public class DataAuditEngine {

    static final String BUSINESS_RULES_STEP = "business-rules";

    private final StructuralValidator structuralValidator = new StructuralValidator();
    private final BusinessRuleEngine ruleEngine = new BusinessRuleEngine();
    private final FindingAggregator aggregator = new FindingAggregator();

    private final List<TableCheck> checks;
    private final RuleSet defaultRules;
    private final AuditStrategy defaultStrategy;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an engine with the standard checks, no default rules, parallel scheduling
     * and no event publishing.
     */
    public DataAuditEngine() {
        this(defaultChecks(), RuleSet.empty(), AuditStrategy.PARALLEL, null);
    }

    /**
     * Creates an engine.
     *
     * @param checks          the checks to run after the structural validation
     * @param defaultRules    the rules applied by {@link #audit(Table)}
     * @param defaultStrategy the strategy applied when none is given
     * @param eventPublisher  the event publisher, or {@code null} to disable event publishing
     */
    public DataAuditEngine(List<TableCheck> checks, RuleSet defaultRules, AuditStrategy defaultStrategy,
                           ApplicationEventPublisher eventPublisher) {
        this.checks = List.copyOf(checks);
        this.defaultRules = defaultRules != null ? defaultRules : RuleSet.empty();
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : AuditStrategy.PARALLEL;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Returns the standard checks in their reporting order.
     *
     * @return new instances of the standard checks
     */
    public static List<TableCheck> defaultChecks() {
        return List.of(
                new MissingValuesCheck(),
                new TypeConsistencyCheck(),
                new DuplicateRowsCheck(),
                new DuplicateKeysCheck(),
                new OutlierDetector(),
                new StringConsistencyCheck());
    }

    /**
     * Audits the table with the default rules and strategy.
     *
     * @param table the table to audit
     * @return a {@link Mono} emitting the {@link AuditReport}
     */
    public Mono<AuditReport> audit(Table table) {
        return audit(table, defaultRules, defaultStrategy);
    }

    /**
     * Audits the table with the given rules and the default strategy.
     *
     * @param table the table to audit
     * @param rules the business rules to apply
     * @return a {@link Mono} emitting the {@link AuditReport}
     */
    public Mono<AuditReport> audit(Table table, RuleSet rules) {
        return audit(table, rules, defaultStrategy);
    }

    /**
     * Audits the table.
     *
     * @param table    the table to audit
     * @param rules    the business rules to apply, {@code null} for none
     * @param strategy how to schedule the checks
     * @return a {@link Mono} emitting the {@link AuditReport}
     */
    public Mono<AuditReport> audit(Table table, RuleSet rules, AuditStrategy strategy) {
        RuleSet activeRules = rules != null ? rules : RuleSet.empty();

        return Mono.fromCallable(() -> structuralValidator.check(table))
                .flatMap(structural -> {
                    if (structuralValidator.isFatal(structural)) {
                        log.info("Table '{}' is empty, skipping remaining checks", table.getStatistics().getSourcePath());
                        return Mono.just(structural);
                    }
                    return runChecks(table, activeRules, strategy)
                            .map(found -> concat(structural, found));
                })
                .map(findings -> aggregator.aggregate(table.getStatistics(), findings))
                .doOnNext(report -> log.debug("Audit completed: {} findings, assessment {}",
                        report.getSummary().getTotal(), report.getAssessment()))
                .doOnNext(this::publishEvent);
    }

    public List<TableCheck> getChecks() {
        return checks;
    }

    public RuleSet getDefaultRules() {
        return defaultRules;
    }

    public AuditStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    private Mono<List<Finding>> runChecks(Table table, RuleSet rules, AuditStrategy strategy) {
        List<AuditStep> steps = new ArrayList<>();
        for (TableCheck check : checks) {
            steps.add(new AuditStep(check.getCheckName(), check::check));
        }
        steps.add(new AuditStep(BUSINESS_RULES_STEP, t -> ruleEngine.evaluate(t, rules)));

        if (strategy == AuditStrategy.PARALLEL) {
            return Flux.fromIterable(steps)
                    .flatMapSequential(step -> Mono.fromCallable(() -> run(step, table))
                            .subscribeOn(Schedulers.parallel()))
                    .collectList()
                    .map(this::flatten);
        }

        return Mono.fromCallable(() -> flatten(steps.stream()
                .map(step -> run(step, table))
                .toList()));
    }

    private List<Finding> run(AuditStep step, Table table) {
        try {
            List<Finding> findings = step.check().apply(table);
            log.debug("Check '{}' reported {} findings", step.name(), findings.size());
            return findings;
        } catch (RuntimeException e) {
            log.warn("Check '{}' failed, continuing audit: {}", step.name(), e.getMessage(), e);
            return List.of(Finding.builder()
                    .kind(FindingKind.CHECK_EVALUATION_ERROR)
                    .severity(Severity.ERROR)
                    .message("Check '" + step.name() + "' could not be evaluated: " + e.getMessage())
                    .build());
        }
    }

    private List<Finding> flatten(List<List<Finding>> findingLists) {
        return findingLists.stream()
                .flatMap(List::stream)
                .toList();
    }

    private List<Finding> concat(List<Finding> first, List<Finding> second) {
        List<Finding> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private void publishEvent(AuditReport report) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new DataAuditEvent(report));
        }
    }

    private record AuditStep(String name, Function<Table, List<Finding>> check) {}
}
