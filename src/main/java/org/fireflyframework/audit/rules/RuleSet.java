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

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable collection of {@link BusinessRule}s.
 */
@ToString
@EqualsAndHashCode
public final class RuleSet implements Iterable<BusinessRule> {

    private static final RuleSet EMPTY = new RuleSet(List.of());

    private final List<BusinessRule> rules;

    private RuleSet(List<BusinessRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleSet of(List<? extends BusinessRule> rules) {
        return rules.isEmpty() ? EMPTY : new RuleSet(List.copyOf(rules));
    }

    public static RuleSet of(BusinessRule... rules) {
        return of(List.of(rules));
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public List<BusinessRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<BusinessRule> iterator() {
        return rules.iterator();
    }
}
