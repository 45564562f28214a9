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

import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.SampleSubset;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * Every metric computed over one sample of jointly-valid pairs.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MetricSet {

    /**
     * Public constructor.
     *
     * @param sampleSize number of jointly-valid pairs used
     * @param values metric values in {@link Metric} order
     */
    public MetricSet(final int sampleSize, final ImmutableMap<Metric, Double> values) {
        _sampleSize = sampleSize;
        _values = values;
    }

    public int getSampleSize() {
        return _sampleSize;
    }

    public ImmutableMap<Metric, Double> getValues() {
        return _values;
    }

    /**
     * Value of one metric.
     *
     * @param metric the metric
     * @return the value, NaN if degenerate
     */
    public double get(final Metric metric) {
        return _values.getOrDefault(metric, Double.NaN);
    }

    /**
     * Flatten into result rows.
     *
     * @param stationId the station
     * @param datasetName the dataset
     * @param scale the scale
     * @param season the season restriction, if any
     * @param subset the subset
     * @return one row per metric
     */
    public ImmutableList<MetricResult> toResults(
            final String stationId,
            final String datasetName,
            final TemporalScale scale,
            final Optional<Season> season,
            final SampleSubset subset) {
        final ImmutableList.Builder<MetricResult> results = ImmutableList.builderWithExpectedSize(_values.size());
        for (final Map.Entry<Metric, Double> entry : _values.entrySet()) {
            results.add(new MetricResult.Builder()
                    .setStationId(stationId)
                    .setDatasetName(datasetName)
                    .setScale(scale)
                    .setSeason(season.orElse(null))
                    .setSubset(subset)
                    .setMetric(entry.getKey())
                    .setValue(entry.getValue())
                    .setSampleSize(_sampleSize)
                    .build());
        }
        return results.build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("SampleSize", _sampleSize)
                .add("Values", _values)
                .toString();
    }

    private final int _sampleSize;
    private final ImmutableMap<Metric, Double> _values;
}
