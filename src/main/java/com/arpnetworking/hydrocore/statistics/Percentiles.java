/*
 * Copyright 2024 Inscope Metrics
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
package com.arpnetworking.hydrocore.statistics;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Percentiles by linear interpolation between closest ranks (R-7).
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Percentiles {

    /**
     * Evaluate a percentile.
     *
     * @param values the sample; not modified
     * @param percentile the percentile in [0, 100]
     * @return the percentile value, or NaN for an empty sample
     */
    public static double evaluate(final double[] values, final double percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException(String.format("Percentile out of range; percentile=%s", percentile));
        }
        if (values.length == 0) {
            return Double.NaN;
        }
        if (percentile == 0) {
            return Arrays.stream(values).min().getAsDouble();
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percentile);
    }

    private Percentiles() {}
}
