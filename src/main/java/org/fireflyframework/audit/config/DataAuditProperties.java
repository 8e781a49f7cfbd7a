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

import lombok.Data;
import org.fireflyframework.audit.AuditStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the data audit engine.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   data:
 *     audit:
 *       enabled: true
 *       strategy: PARALLEL
 *       rules:
 *         age_range:
 *           column: age
 *           type: range
 *           min: 0
 *           max: 120
 *         status_set:
 *           column: status
 *           type: allowed_values
 *           values: [active, closed]
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.audit")
public class DataAuditProperties {

    /**
     * Whether the audit engine is configured.
     */
    private boolean enabled = true;

    /**
     * Default scheduling of checks.
     */
    private AuditStrategy strategy = AuditStrategy.PARALLEL;

    /**
     * Business rules applied when an audit does not supply its own, by rule name.
     */
    private Map<String, Map<String, Object>> rules = new LinkedHashMap<>();
}
