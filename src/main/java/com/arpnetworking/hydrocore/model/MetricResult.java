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
package com.arpnetworking.hydrocore.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.hydrocore.statistics.Metric;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * One metric value for a (station, dataset, scale, season, subset) tuple.
 * A NaN value records a degenerate statistic.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class MetricResult {

    public String getStationId() {
        return _stationId;
    }

    public String getDatasetName() {
        return _datasetName;
    }

    public TemporalScale getScale() {
        return _scale;
    }

    /**
     * The season the metric was restricted to.
     *
     * @return the season, or empty for results over every season
     */
    public Optional<Season> getSeason() {
        return _season;
    }

    public SampleSubset getSubset() {
        return _subset;
    }

    public Metric getMetric() {
        return _metric;
    }

    public double getValue() {
        return _value;
    }

    public int getSampleSize() {
        return _sampleSize;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MetricResult other = (MetricResult) object;

        return Objects.equal(_stationId, other._stationId)
                && Objects.equal(_datasetName, other._datasetName)
                && _scale == other._scale
                && Objects.equal(_season, other._season)
                && _subset == other._subset
                && _metric == other._metric
                && Double.compare(_value, other._value) == 0
                && _sampleSize == other._sampleSize;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_stationId, _datasetName, _scale, _season, _subset, _metric, _value, _sampleSize);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("StationId", _stationId)
                .add("DatasetName", _datasetName)
                .add("Scale", _scale)
                .add("Season", _season)
                .add("Subset", _subset)
                .add("Metric", _metric)
                .add("Value", _value)
                .add("SampleSize", _sampleSize)
                .toString();
    }

    private MetricResult(final Builder builder) {
        _stationId = builder._stationId;
        _datasetName = builder._datasetName;
        _scale = builder._scale;
        _season = Optional.ofNullable(builder._season);
        _subset = builder._subset;
        _metric = builder._metric;
        _value = builder._value;
        _sampleSize = builder._sampleSize;
    }

    private final String _stationId;
    private final String _datasetName;
    private final TemporalScale _scale;
    private final Optional<Season> _season;
    private final SampleSubset _subset;
    private final Metric _metric;
    private final double _value;
    private final int _sampleSize;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetricResult}.
     */
    public static final class Builder extends OvalBuilder<MetricResult> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetricResult::new);
        }

        /**
         * Set the station identifier. Required. Cannot be null or empty.
         *
         * @param value The station identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setStationId(final String value) {
            _stationId = value;
            return this;
        }

        /**
         * Set the dataset name. Required. Cannot be null or empty.
         *
         * @param value The dataset name.
         * @return This {@link Builder} instance.
         */
        public Builder setDatasetName(final String value) {
            _datasetName = value;
            return this;
        }

        /**
         * Set the scale. Required. Cannot be null.
         *
         * @param value The scale.
         * @return This {@link Builder} instance.
         */
        public Builder setScale(final TemporalScale value) {
            _scale = value;
            return this;
        }

        /**
         * Set the season. Optional.
         *
         * @param value The season.
         * @return This {@link Builder} instance.
         */
        public Builder setSeason(@Nullable final Season value) {
            _season = value;
            return this;
        }

        /**
         * Set the sample subset. Optional. Cannot be null. Defaults to {@link SampleSubset#ALL}.
         *
         * @param value The subset.
         * @return This {@link Builder} instance.
         */
        public Builder setSubset(final SampleSubset value) {
            _subset = value;
            return this;
        }

        /**
         * Set the metric. Required. Cannot be null.
         *
         * @param value The metric.
         * @return This {@link Builder} instance.
         */
        public Builder setMetric(final Metric value) {
            _metric = value;
            return this;
        }

        /**
         * Set the value. Required. Cannot be null. May be NaN.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final Double value) {
            _value = value;
            return this;
        }

        /**
         * Set the number of jointly-valid pairs. Required. Cannot be null.
         *
         * @param value The sample size.
         * @return This {@link Builder} instance.
         */
        public Builder setSampleSize(final Integer value) {
            _sampleSize = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _stationId;
        @NotNull
        @NotEmpty
        private String _datasetName;
        @NotNull
        private TemporalScale _scale;
        private Season _season;
        @NotNull
        private SampleSubset _subset = SampleSubset.ALL;
        @NotNull
        private Metric _metric;
        @NotNull
        private Double _value;
        @NotNull
        @Min(0)
        private Integer _sampleSize;
    }
}
