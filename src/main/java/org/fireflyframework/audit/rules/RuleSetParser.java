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

package org.fireflyframework.audit.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns structured rule configuration into a {@link RuleSet}.
 *
 * <p>The configuration maps a rule name to its specification:</p>
 * <pre>{@code
 * {
 *   "age_range":    {"column": "age",     "type": "range",          "min": 0, "max": 120},
 *   "email_format": {"column": "email",   "type": "pattern",        "pattern": "[^@]+@[^@]+"},
 *   "status_set":   {"column": "status",  "type": "allowed_values", "values": ["active", "closed"]}
 * }
 * }</pre>
 *
 * <p>Every rule is validated before anything is returned; all problems are reported
 * together in a single {@link RuleConfigurationException}. Unknown rule types are
 * rejected here, never at evaluation time.</p>
 */
@Slf4j
public class RuleSetParser {

    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RuleSetParser() {
        this(new ObjectMapper());
    }

    public RuleSetParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses rule configuration held in a JSON tree.
     *
     * @param config a JSON object mapping rule names to rule specifications
     * @return the parsed rules, in declaration order
     * @throws RuleConfigurationException if the configuration is invalid
     */
    public RuleSet parse(JsonNode config) {
        if (config == null || config.isNull()) {
            return RuleSet.empty();
        }
        if (!config.isObject()) {
            throw new RuleConfigurationException("Business rules must be a JSON object",
                    List.of("Expected an object of rules but got " + config.getNodeType()));
        }
        return parse(objectMapper.convertValue(config, CONFIG_TYPE));
    }

    /**
     * Parses already-structured rule configuration.
     *
     * @param config rule names mapped to rule specifications
     * @return the parsed rules, in iteration order of {@code config}
     * @throws RuleConfigurationException if the configuration is invalid
     */
    public RuleSet parse(Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return RuleSet.empty();
        }

        List<String> errors = new ArrayList<>();
        List<BusinessRule> rules = new ArrayList<>();

        config.forEach((name, spec) -> {
            if (spec instanceof Map<?, ?> map) {
                parseRule(name, map, errors).ifPresent(rules::add);
            } else {
                errors.add("Rule '" + name + "' must be an object");
            }
        });

        if (!errors.isEmpty()) {
            throw new RuleConfigurationException(
                    "Invalid business rule configuration: " + String.join("; ", errors), errors);
        }

        log.debug("Parsed {} business rules", rules.size());
        return RuleSet.of(rules);
    }

    private Optional<BusinessRule> parseRule(String name, Map<?, ?> spec, List<String> errors) {
        int errorsBefore = errors.size();

        String columnName = spec.get("column") instanceof String text && !text.isBlank() ? text : null;
        if (columnName == null) {
            errors.add("Rule '" + name + "': 'column' is required");
        }

        Object typeTag = spec.get("type");
        Optional<RuleType> type = typeTag instanceof String tag ? RuleType.fromKey(tag) : Optional.empty();
        if (type.isEmpty()) {
            errors.add("Rule '" + name + "': unknown rule type '" + typeTag + "'");
            return Optional.empty();
        }

        BusinessRule rule = switch (type.get()) {
            case RANGE -> parseRange(name, columnName, spec, errors);
            case PATTERN -> parsePattern(name, columnName, spec, errors);
            case ALLOWED_VALUES -> parseAllowedValues(name, columnName, spec, errors);
        };

        return errors.size() == errorsBefore ? Optional.ofNullable(rule) : Optional.empty();
    }

    private BusinessRule parseRange(String name, String column, Map<?, ?> spec, List<String> errors) {
        BigDecimal min = toDecimal(name, "min", spec.get("min"), errors);
        BigDecimal max = toDecimal(name, "max", spec.get("max"), errors);
        if (spec.get("min") == null && spec.get("max") == null) {
            errors.add("Rule '" + name + "': range needs 'min' or 'max'");
            return null;
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            errors.add("Rule '" + name + "': 'min' " + min + " is greater than 'max' " + max);
            return null;
        }
        return column == null || (min == null && max == null) ? null : new RangeRule(name, column, min, max);
    }

    private BusinessRule parsePattern(String name, String column, Map<?, ?> spec, List<String> errors) {
        if (!(spec.get("pattern") instanceof String pattern)) {
            errors.add("Rule '" + name + "': 'pattern' must be a string");
            return null;
        }
        return column == null ? null : new PatternRule(name, column, pattern);
    }

    private BusinessRule parseAllowedValues(String name, String column, Map<?, ?> spec, List<String> errors) {
        List<Object> values = toList(spec.get("values"));
        if (values == null) {
            errors.add("Rule '" + name + "': 'values' must be a list");
            return null;
        }
        if (values.contains(null)) {
            errors.add("Rule '" + name + "': 'values' must not contain null");
            return null;
        }
        return column == null ? null : new AllowedValuesRule(name, column, values);
    }

    private BigDecimal toDecimal(String name, String key, Object value, List<String> errors) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            if (value instanceof String text) {
                return new BigDecimal(text.strip());
            }
        } catch (NumberFormatException e) {
            log.debug("Rule '{}': '{}' is not a number: {}", name, key, value);
        }
        errors.add("Rule '" + name + "': '" + key + "' must be a number but was '" + value + "'");
        return null;
    }

    /**
     * Accepts a collection, or an index-keyed map as produced when lists are bound from
     * flattened property sources ({@code values[0]=a}, {@code values[1]=b}).
     */
    private List<Object> toList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            TreeMap<Integer, Object> indexed = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                try {
                    indexed.put(Integer.parseInt(String.valueOf(entry.getKey())), entry.getValue());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return new ArrayList<>(indexed.values());
        }
        return null;
    }
}
