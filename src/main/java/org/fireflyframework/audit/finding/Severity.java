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

package org.fireflyframework.audit.finding;

/**
 * Severity of a {@link Finding}, declared from most to least severe.
 *
 * <ul>
 *   <li>{@link #CRITICAL} - the table is unusable as delivered</li>
 *   <li>{@link #ERROR} - a data-integrity violation to fix before the data is trusted</li>
 *   <li>{@link #WARNING} - a quality concern that needs attention</li>
 *   <li>{@link #INFO} - an observation, no action required</li>
 * </ul>
 */
public enum Severity {

    CRITICAL,
    ERROR,
    WARNING,
    INFO;

    /**
     * Returns whether this severity is at least as severe as the given one.
     *
     * @param other the severity to compare against
     * @return {@code true} if this is equal to or more severe than {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}
