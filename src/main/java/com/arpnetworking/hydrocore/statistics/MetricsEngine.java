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

import com.arpnetworking.hydrocore.model.AlignedPair;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.function.DoublePredicate;

/**
 * Computes agreement metrics between observed (ground) and predicted
 * (gridded) values. Only jointly-valid pairs are used and nothing is
 * imputed. A degenerate statistic is NaN without affecting the others.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MetricsEngine {

    /**
     * Compute every metric over the jointly-valid pairs of an aligned pair.
     *
     * @param pair the aligned pair
     * @return the metrics
     */
    public MetricSet compute(final AlignedPair pair) {
        return compute(pair.getValidGround(), pair.getValidGridded());
    }

    /**
     * Compute every metric over pairs whose ground value is at or above a
     * percentile of the jointly-valid ground values.
     *
     * @param pair the aligned pair
     * @param percentile the percentile in [0, 100]
     * @return the metrics over the upper extreme subset
     */
    public MetricSet computeUpperExtreme(final AlignedPair pair, final double percentile) {
        final double[] observed = pair.getValidGround();
        final double threshold = Percentiles.evaluate(observed, percentile);
        return computeWhere(observed, pair.getValidGridded(), value -> value >= threshold);
    }

    /**
     * Compute every metric over pairs whose ground value is at or below a
     * percentile of the jointly-valid ground values.
     *
     * @param pair the aligned pair
     * @param percentile the percentile in [0, 100]
     * @return the metrics over the lower extreme subset
     */
    public MetricSet computeLowerExtreme(final AlignedPair pair, final double percentile) {
        final double[] observed = pair.getValidGround();
        final double threshold = Percentiles.evaluate(observed, percentile);
        return computeWhere(observed, pair.getValidGridded(), value -> value <= threshold);
    }

    /**
     * Compute every metric over two equal-length arrays of valid values.
     *
     * @param observed the observed values
     * @param predicted the predicted values
     * @return the metrics
     */
    public MetricSet compute(final double[] observed, final double[] predicted) {
        if (observed.length != predicted.length) {
            throw new IllegalArgumentException(String.format(
                    "Length mismatch; observed=%d, predicted=%d",
                    observed.length,
                    predicted.length));
        }
        final int n = observed.length;
        if (n == 0) {
            final ImmutableMap.Builder<Metric, Double> empty = ImmutableMap.builder();
            for (final Metric metric : Metric.values()) {
                empty.put(metric, Double.NaN);
            }
            return new MetricSet(0, empty.build());
        }

        double sumObserved = 0;
        double sumPredicted = 0;
        for (int i = 0; i < n; ++i) {
            sumObserved += observed[i];
            sumPredicted += predicted[i];
        }
        final double meanObserved = sumObserved / n;
        final double meanPredicted = sumPredicted / n;

        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        double squaredError = 0;
        double absoluteError = 0;
        double difference = 0;
        for (int i = 0; i < n; ++i) {
            final double dx = observed[i] - meanObserved;
            final double dy = predicted[i] - meanPredicted;
            final double error = predicted[i] - observed[i];
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
            squaredError += error * error;
            absoluteError += Math.abs(error);
            difference += error;
        }

        final double rmse = Math.sqrt(squaredError / n);
        final double bias = difference / n;
        final double corr = n < 2 || sxx == 0 || syy == 0 ? Double.NaN : sxy / Math.sqrt(sxx * syy);

        // Insertion order follows Metric declaration order
        return new MetricSet(n, ImmutableMap.<Metric, Double>builder()
                .put(Metric.R2, corr * corr)
                .put(Metric.RMSE, rmse)
                .put(Metric.MAE, absoluteError / n)
                .put(Metric.BIAS, bias)
                .put(Metric.PBIAS, sumObserved == 0 ? Double.NaN : 100.0 * difference / sumObserved)
                .put(Metric.NSE, sxx == 0 ? Double.NaN : 1.0 - squaredError / sxx)
                .put(Metric.CORR, corr)
                .put(Metric.OBS_MEAN, meanObserved)
                .put(Metric.PRED_MEAN, meanPredicted)
                .put(Metric.REL_BIAS, meanObserved == 0 ? Double.NaN : bias / meanObserved)
                .put(Metric.REL_RMSE, meanObserved == 0 ? Double.NaN : rmse / meanObserved)
                .build());
    }

    private MetricSet computeWhere(
            final double[] observed,
            final double[] predicted,
            final DoublePredicate selector) {
        final double[] selectedObserved = new double[observed.length];
        final double[] selectedPredicted = new double[observed.length];
        int count = 0;
        for (int i = 0; i < observed.length; ++i) {
            if (selector.test(observed[i])) {
                selectedObserved[count] = observed[i];
                selectedPredicted[count] = predicted[i];
                ++count;
            }
        }
        return compute(Arrays.copyOf(selectedObserved, count), Arrays.copyOf(selectedPredicted, count));
    }
}
