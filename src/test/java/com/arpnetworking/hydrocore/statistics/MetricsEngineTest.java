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
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.SampleSubset;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Tests for {@link MetricsEngine}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class MetricsEngineTest {

    @Test
    public void testSkipsDaysMissingOnEitherSide() {
        final AlignedPair pair = TestBeanFactory.createDailyPair(
                LocalDate.of(2020, 6, 1),
                new double[]{1.0, 0.0, 3.0, Double.NaN, 5.0},
                new double[]{1.5, 0.2, 2.5, 1.0, 4.0});

        final MetricSet metrics = ENGINE.compute(pair);

        Assert.assertEquals(4, metrics.getSampleSize());
        Assert.assertEquals(-0.2, metrics.get(Metric.BIAS), EPSILON);
        Assert.assertEquals(Math.sqrt(0.385), metrics.get(Metric.RMSE), EPSILON);
        Assert.assertEquals(0.6205, metrics.get(Metric.RMSE), 1e-4);
        Assert.assertEquals(0.55, metrics.get(Metric.MAE), EPSILON);
        Assert.assertEquals(100.0 * -0.8 / 9.0, metrics.get(Metric.PBIAS), EPSILON);
        Assert.assertEquals(1.0 - 1.54 / 14.75, metrics.get(Metric.NSE), EPSILON);
        Assert.assertEquals(2.25, metrics.get(Metric.OBS_MEAN), EPSILON);
        Assert.assertEquals(2.05, metrics.get(Metric.PRED_MEAN), EPSILON);
        Assert.assertEquals(-0.2 / 2.25, metrics.get(Metric.REL_BIAS), EPSILON);
        Assert.assertEquals(Math.sqrt(0.385) / 2.25, metrics.get(Metric.REL_RMSE), EPSILON);
        final double corr = metrics.get(Metric.CORR);
        Assert.assertEquals(corr * corr, metrics.get(Metric.R2), EPSILON);
        Assert.assertTrue(corr > 0.9 && corr <= 1.0);
    }

    @Test
    public void testIdenticalSeries() {
        final double[] values = {0.0, 2.0, 7.5, 1.25, 3.0};
        final MetricSet metrics = ENGINE.compute(values, values.clone());

        Assert.assertEquals(0.0, metrics.get(Metric.RMSE), EPSILON);
        Assert.assertEquals(0.0, metrics.get(Metric.BIAS), EPSILON);
        Assert.assertEquals(0.0, metrics.get(Metric.PBIAS), EPSILON);
        Assert.assertEquals(1.0, metrics.get(Metric.NSE), EPSILON);
        Assert.assertEquals(1.0, metrics.get(Metric.CORR), EPSILON);
        Assert.assertEquals(1.0, metrics.get(Metric.R2), EPSILON);
    }

    @Test
    public void testEqualTotalsHaveNoPercentBias() {
        final MetricSet metrics = ENGINE.compute(new double[]{1.0, 3.0}, new double[]{3.0, 1.0});
        Assert.assertEquals(0.0, metrics.get(Metric.PBIAS), EPSILON);
        Assert.assertEquals(-1.0, metrics.get(Metric.CORR), EPSILON);
        Assert.assertEquals(1.0, metrics.get(Metric.R2), EPSILON);
    }

    @Test
    public void testEmptySampleIsAllNaN() {
        final MetricSet metrics = ENGINE.compute(new double[0], new double[0]);
        Assert.assertEquals(0, metrics.getSampleSize());
        Assert.assertEquals(Metric.values().length, metrics.getValues().size());
        for (final Metric metric : Metric.values()) {
            Assert.assertTrue(metric.getKey(), Double.isNaN(metrics.get(metric)));
        }
    }

    @Test
    public void testConstantGroundLeavesOtherMetricsDefined() {
        final MetricSet metrics = ENGINE.compute(new double[]{2.0, 2.0, 2.0}, new double[]{1.0, 2.0, 3.0});
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.CORR)));
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.R2)));
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.NSE)));
        Assert.assertEquals(0.0, metrics.get(Metric.BIAS), EPSILON);
        Assert.assertEquals(Math.sqrt(2.0 / 3.0), metrics.get(Metric.RMSE), EPSILON);
    }

    @Test
    public void testDryGroundHasNoRelativeMetrics() {
        final MetricSet metrics = ENGINE.compute(new double[]{0.0, 0.0}, new double[]{0.5, 0.0});
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.PBIAS)));
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.REL_BIAS)));
        Assert.assertTrue(Double.isNaN(metrics.get(Metric.REL_RMSE)));
        Assert.assertEquals(0.25, metrics.get(Metric.BIAS), EPSILON);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatch() {
        ENGINE.compute(new double[]{1.0}, new double[]{1.0, 2.0});
    }

    @Test
    public void testExtremeSubsets() {
        final double[] ground = new double[10];
        final double[] gridded = new double[10];
        for (int i = 0; i < 10; ++i) {
            ground[i] = i + 1;
            gridded[i] = i + 2;
        }
        final AlignedPair pair = TestBeanFactory.createDailyPair(LocalDate.of(2020, 6, 1), ground, gridded);

        final MetricSet upper = ENGINE.computeUpperExtreme(pair, 80.0);
        Assert.assertEquals(2, upper.getSampleSize());
        Assert.assertEquals(9.5, upper.get(Metric.OBS_MEAN), EPSILON);
        Assert.assertEquals(1.0, upper.get(Metric.BIAS), EPSILON);

        final MetricSet lower = ENGINE.computeLowerExtreme(pair, 20.0);
        Assert.assertEquals(2, lower.getSampleSize());
        Assert.assertEquals(1.5, lower.get(Metric.OBS_MEAN), EPSILON);

        // Minimum threshold keeps every pair at or above it
        Assert.assertEquals(10, ENGINE.computeUpperExtreme(pair, 0.0).getSampleSize());
    }

    @Test
    public void testToResults() {
        final MetricSet metrics = ENGINE.compute(new double[]{1.0, 2.0}, new double[]{1.0, 3.0});

        final ImmutableList<MetricResult> results = metrics.toResults(
                "S1",
                "PRISM",
                TemporalScale.SEASONAL,
                Optional.of(Season.SUMMER),
                SampleSubset.ALL);

        Assert.assertEquals(Metric.values().length, results.size());
        Assert.assertEquals(Metric.R2, results.get(0).getMetric());
        for (final MetricResult result : results) {
            Assert.assertEquals("S1", result.getStationId());
            Assert.assertEquals(Optional.of(Season.SUMMER), result.getSeason());
            Assert.assertEquals(2, result.getSampleSize());
        }
    }

    private static final MetricsEngine ENGINE = new MetricsEngine();
    private static final double EPSILON = 1e-9;
}
