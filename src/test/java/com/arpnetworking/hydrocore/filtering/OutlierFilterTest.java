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
package com.arpnetworking.hydrocore.filtering;

import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.MetricSummary;
import com.arpnetworking.hydrocore.model.SampleSubset;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.hydrocore.statistics.Metric;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

/**
 * Tests for {@link OutlierFilter}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class OutlierFilterTest {

    @Test
    public void testHigherIsBetterLosesOnlyLowTail() {
        final List<Double> values = Lists.newArrayList(ONE_TO_TEN);
        values.add(Double.NaN);

        final TrimResult result = FILTER.trim(Metric.NSE, values);

        Assert.assertEquals(1.9, result.getThreshold(), EPSILON);
        Assert.assertEquals(ONE_TO_TEN.subList(1, 10), result.getRetained());
        // The low value and the NaN
        Assert.assertEquals(2, result.getDropped());
    }

    @Test
    public void testLowerIsBetterLosesOnlyHighTail() {
        final TrimResult result = FILTER.trim(Metric.RMSE, ONE_TO_TEN);

        Assert.assertEquals(9.1, result.getThreshold(), EPSILON);
        Assert.assertEquals(ONE_TO_TEN.subList(0, 9), result.getRetained());
        Assert.assertEquals(1, result.getDropped());
    }

    @Test
    public void testSignedMetricTrimmedByMagnitude() {
        final ImmutableList<Double> bias = ImmutableList.of(-10.0, -1.0, 0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0);

        final TrimResult result = FILTER.trim(Metric.BIAS, bias);

        Assert.assertEquals(7.3, result.getThreshold(), EPSILON);
        Assert.assertEquals(bias.subList(1, 10), result.getRetained());
    }

    @Test
    public void testNeutralMetricsKept() {
        final TrimResult result = FILTER.trim(Metric.OBS_MEAN, ImmutableList.of(1.0, 1000.0, Double.NaN));

        Assert.assertEquals(ImmutableList.of(1.0, 1000.0), result.getRetained());
        Assert.assertEquals(1, result.getDropped());
        Assert.assertTrue(Double.isNaN(result.getThreshold()));
    }

    @Test
    public void testOpenBoundsKeepEverything() {
        final OutlierFilter filter = new OutlierFilter(new FilterConfiguration.Builder()
                .setLowerPercentile(0.0)
                .setUpperPercentile(100.0)
                .build());

        Assert.assertEquals(0, filter.trim(Metric.CORR, ONE_TO_TEN).getDropped());
        Assert.assertEquals(0, filter.trim(Metric.MAE, ONE_TO_TEN).getDropped());
    }

    @Test
    public void testSummarizeDistribution() {
        final MetricSummary summary = FILTER.summarize(
                "PRISM",
                TemporalScale.MONTHLY,
                Optional.empty(),
                SampleSubset.ALL,
                Metric.RMSE,
                ONE_TO_TEN);

        Assert.assertEquals(10, summary.getCountBefore());
        Assert.assertEquals(9, summary.getCountAfter());
        Assert.assertEquals(5.0, summary.getMean(), EPSILON);
        Assert.assertEquals(5.0, summary.getMedian(), EPSILON);
        Assert.assertEquals(Math.sqrt(7.5), summary.getStandardDeviation(), EPSILON);
    }

    @Test
    public void testSummarizeSingleValue() {
        final MetricSummary summary = FILTER.summarize(
                "PRISM",
                TemporalScale.MONTHLY,
                Optional.empty(),
                SampleSubset.ALL,
                Metric.OBS_MEAN,
                ImmutableList.of(4.0));

        Assert.assertEquals(4.0, summary.getMean(), EPSILON);
        Assert.assertEquals(4.0, summary.getMedian(), EPSILON);
        Assert.assertTrue(Double.isNaN(summary.getStandardDeviation()));
    }

    @Test
    public void testSummarizeEmptyAfterNaN() {
        final MetricSummary summary = FILTER.summarize(
                "PRISM",
                TemporalScale.MONTHLY,
                Optional.empty(),
                SampleSubset.ALL,
                Metric.CORR,
                ImmutableList.of(Double.NaN));

        Assert.assertEquals(1, summary.getCountBefore());
        Assert.assertEquals(0, summary.getCountAfter());
        Assert.assertTrue(Double.isNaN(summary.getMean()));
        Assert.assertTrue(Double.isNaN(summary.getMedian()));
    }

    @Test
    public void testSummarizeGroupsAndOrders() {
        final List<MetricResult> results = Lists.newArrayList();
        results.add(TestBeanFactory.createMetricResultBuilder()
                .setDatasetName("PRISM")
                .setSeason(Season.SUMMER)
                .build());
        results.add(TestBeanFactory.createMetricResultBuilder()
                .setDatasetName("PRISM")
                .build());
        results.add(TestBeanFactory.createMetricResultBuilder()
                .setDatasetName("PRISM")
                .build());
        results.add(TestBeanFactory.createMetricResultBuilder()
                .setDatasetName("DAYMET")
                .setMetric(Metric.NSE)
                .build());
        results.add(TestBeanFactory.createMetricResultBuilder()
                .setDatasetName("DAYMET")
                .build());

        final ImmutableList<MetricSummary> summaries = FILTER.summarize(results);

        Assert.assertEquals(4, summaries.size());
        Assert.assertEquals("DAYMET", summaries.get(0).getDatasetName());
        Assert.assertEquals(Metric.RMSE, summaries.get(0).getMetric());
        Assert.assertEquals(Metric.NSE, summaries.get(1).getMetric());
        Assert.assertEquals("PRISM", summaries.get(2).getDatasetName());
        Assert.assertFalse(summaries.get(2).getSeason().isPresent());
        Assert.assertEquals(2, summaries.get(2).getCountBefore());
        Assert.assertEquals(Optional.of(Season.SUMMER), summaries.get(3).getSeason());
    }

    private static final double EPSILON = 1e-9;
    private static final ImmutableList<Double> ONE_TO_TEN =
            ImmutableList.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0);
    private static final OutlierFilter FILTER = new OutlierFilter(new FilterConfiguration.Builder()
            .setLowerPercentile(10.0)
            .setUpperPercentile(90.0)
            .build());
}
