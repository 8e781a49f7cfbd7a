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

package org.fireflyframework.audit.outlier;

/**
 * Quantile estimation over sorted samples.
 */
public final class Quantiles {

    private Quantiles() {}

    /**
     * Estimates the {@code q}-quantile with linear interpolation between the two closest
     * ranks, placing the quantile at position {@code (n - 1) * q} of the sorted sample.
     *
     * @param sorted the sample in ascending order, not empty
     * @param q      the quantile, between 0 and 1
     * @return the estimated quantile
     */
    public static double linear(double[] sorted, double q) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot estimate a quantile of an empty sample");
        }
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("Quantile must be between 0 and 1: " + q);
        }
        double position = (sorted.length - 1) * q;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
