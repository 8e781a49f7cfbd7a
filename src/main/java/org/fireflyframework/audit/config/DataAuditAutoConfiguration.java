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

package org.fireflyframework.audit.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.DataAuditEngine;
import org.fireflyframework.audit.check.TableCheck;
import org.fireflyframework.audit.controller.DataAuditController;
import org.fireflyframework.audit.controller.advice.DataAuditExceptionHandler;
import org.fireflyframework.audit.rules.RuleSet;
import org.fireflyframework.audit.rules.RuleSetParser;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the data audit engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>The default {@link RuleSet}, parsed once at startup from {@code firefly.data.audit.rules}</li>
 *   <li>{@link DataAuditEngine} with the standard checks plus every {@link TableCheck} bean</li>
 *   <li>Event publishing for audit reports (when an {@link ApplicationEventPublisher} is available)</li>
 *   <li>The audit REST endpoint, in reactive web applications</li>
 * </ul>
 *
 * <p>The configuration is activated when the property {@code firefly.data.audit.enabled}
 * is true or not set. Invalid rule configuration fails application startup.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DataAuditProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.audit",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DataAuditAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RuleSetParser ruleSetParser() {
        return new RuleSetParser();
    }

    /**
     * Parses the configured business rules.
     *
     * @param properties the audit properties
     * @param parser     the rule parser
     * @return the default rule set, empty when no rules are configured
     */
    @Bean
    @ConditionalOnMissingBean
    public RuleSet defaultAuditRules(DataAuditProperties properties, RuleSetParser parser) {
        RuleSet rules = parser.parse(properties.getRules());
        log.info("Loaded {} configured business rules", rules.size());
        return rules;
    }

    /**
     * Creates the data audit engine bean.
     *
     * <p>Additional {@link TableCheck} beans run after the standard checks, in bean order.</p>
     *
     * @param properties       the audit properties
     * @param defaultRules     the default rule set
     * @param additionalChecks application-defined checks
     * @param eventPublisher   the event publisher, if available
     * @return the configured engine
     */
    @Bean
    @ConditionalOnMissingBean
    public DataAuditEngine dataAuditEngine(DataAuditProperties properties,
                                           RuleSet defaultRules,
                                           ObjectProvider<TableCheck> additionalChecks,
                                           ObjectProvider<ApplicationEventPublisher> eventPublisher) {
        List<TableCheck> checks = new ArrayList<>(DataAuditEngine.defaultChecks());
        additionalChecks.orderedStream().forEach(checks::add);

        log.info("Configuring Data Audit Engine with {} checks, {} rules, strategy {}",
                checks.size(), defaultRules.size(), properties.getStrategy());
        return new DataAuditEngine(checks, defaultRules, properties.getStrategy(), eventPublisher.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public DataAuditController dataAuditController(DataAuditEngine engine, RuleSetParser parser) {
        return new DataAuditController(engine, parser);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public DataAuditExceptionHandler dataAuditExceptionHandler() {
        return new DataAuditExceptionHandler();
    }
}
