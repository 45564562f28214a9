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
import com.arpnetworking.hydrocore.statistics.Percentiles;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.primitives.Doubles;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Direction-aware trimming of cross-station metric distributions.
 *
 * <p>Higher-is-better metrics lose only their low tail: values below the
 * lower percentile. Lower-magnitude-is-better metrics lose only their large
 * magnitudes: values whose absolute value exceeds the upper percentile of
 * the absolute values. A good performer is therefore never trimmed. Neutral
 * metrics are never trimmed. NaN values never enter a distribution.</p>
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class OutlierFilter {

    /**
     * Public constructor.
     *
     * @param configuration the percentile bounds
     */
    public OutlierFilter(final FilterConfiguration configuration) {
        _configuration = configuration;
    }

    /**
     * Trim one distribution.
     *
     * @param metric the metric the values belong to
     * @param values per-station values; NaN values are dropped
     * @return the retained values and the dropped count
     */
    public TrimResult trim(final Metric metric, final List<Double> values) {
        final List<Double> finite = Lists.newArrayListWithExpectedSize(values.size());
        for (final Double value : values) {
            if (!value.isNaN()) {
                finite.add(value);
            }
        }

        final ImmutableList<Double> retained;
        final double threshold;
        switch (metric.getPolarity()) {
            case HIGHER_IS_BETTER: {
                threshold = _configuration.getLowerPercentile() == 0
                        ? Double.NEGATIVE_INFINITY
                        : Percentiles.evaluate(Doubles.toArray(finite), _configuration.getLowerPercentile());
                retained = finite.stream()
                        .filter(value -> value >= threshold)
                        .collect(ImmutableList.toImmutableList());
                break;
            }
            case LOWER_MAGNITUDE_IS_BETTER: {
                final double[] magnitudes = finite.stream().mapToDouble(Math::abs).toArray();
                threshold = _configuration.getUpperPercentile() == 100
                        ? Double.POSITIVE_INFINITY
                        : Percentiles.evaluate(magnitudes, _configuration.getUpperPercentile());
                retained = finite.stream()
                        .filter(value -> Math.abs(value) <= threshold)
                        .collect(ImmutableList.toImmutableList());
                break;
            }
            default:
                threshold = Double.NaN;
                retained = ImmutableList.copyOf(finite);
                break;
        }
        return new TrimResult(retained, values.size() - retained.size(), threshold);
    }

    /**
     * Trim and describe one distribution.
     *
     * @param datasetName the dataset
     * @param scale the scale
     * @param season the season restriction, if any
     * @param subset the subset
     * @param metric the metric
     * @param values per-station values
     * @return the summary of the retained values
     */
    public MetricSummary summarize(
            final String datasetName,
            final TemporalScale scale,
            final Optional<Season> season,
            final SampleSubset subset,
            final Metric metric,
            final List<Double> values) {
        final TrimResult trimmed = trim(metric, values);
        final DescriptiveStatistics statistics = new DescriptiveStatistics(Doubles.toArray(trimmed.getRetained()));
        final long count = statistics.getN();
        if (trimmed.getDropped() > 0) {
            LOGGER.debug()
                    .setMessage("Trimmed metric distribution")
                    .addData("dataset", datasetName)
                    .addData("scale", scale)
                    .addData("metric", metric)
                    .addData("result", trimmed)
                    .log();
        }
        return new MetricSummary.Builder()
                .setDatasetName(datasetName)
                .setScale(scale)
                .setSeason(season.orElse(null))
                .setSubset(subset)
                .setMetric(metric)
                .setCountBefore(values.size())
                .setCountAfter((int) count)
                .setMean(count == 0 ? Double.NaN : statistics.getMean())
                .setMedian(Percentiles.evaluate(statistics.getValues(), 50))
                .setStandardDeviation(count < 2 ? Double.NaN : statistics.getStandardDeviation())
                .build();
    }

    /**
     * Group result rows by (dataset, scale, season, subset, metric) and
     * summarize each group.
     *
     * @param results the per-station result rows
     * @return summaries ordered by dataset, scale, season, subset then metric
     */
    public ImmutableList<MetricSummary> summarize(final Collection<MetricResult> results) {
        final Map<GroupKey, List<Double>> groups = Maps.newHashMap();
        for (final MetricResult result : results) {
            groups.computeIfAbsent(new GroupKey(result), ignored -> Lists.newArrayList()).add(result.getValue());
        }
        return groups.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(GROUP_ORDER))
                .map(entry -> summarize(
                        entry.getKey()._datasetName,
                        entry.getKey()._scale,
                        entry.getKey()._season,
                        entry.getKey()._subset,
                        entry.getKey()._metric,
                        entry.getValue()))
                .collect(ImmutableList.toImmutableList());
    }

    public FilterConfiguration getConfiguration() {
        return _configuration;
    }

    private final FilterConfiguration _configuration;

    private static final Logger LOGGER = LoggerFactory.getLogger(OutlierFilter.class);
    private static final Comparator<GroupKey> GROUP_ORDER = Comparator
            .comparing((GroupKey key) -> key._datasetName)
            .thenComparing(key -> key._scale)
            .thenComparingInt(key -> key._season.map(Season::ordinal).orElse(-1))
            .thenComparing(key -> key._subset)
            .thenComparing(key -> key._metric);

    private static final class GroupKey {
        GroupKey(final MetricResult result) {
            _datasetName = result.getDatasetName();
            _scale = result.getScale();
            _season = result.getSeason();
            _subset = result.getSubset();
            _metric = result.getMetric();
        }

        @Override
        public boolean equals(final Object object) {
            if (this == object) {
                return true;
            }
            if (object == null || getClass() != object.getClass()) {
                return false;
            }
            final GroupKey other = (GroupKey) object;
            return Objects.equal(_datasetName, other._datasetName)
                    && _scale == other._scale
                    && Objects.equal(_season, other._season)
                    && _subset == other._subset
                    && _metric == other._metric;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(_datasetName, _scale, _season, _subset, _metric);
        }

        private final String _datasetName;
        private final TemporalScale _scale;
        private final Optional<Season> _season;
        private final SampleSubset _subset;
        private final Metric _metric;
    }
}
