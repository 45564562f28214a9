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
 * Cross-station distribution of one metric after outlier trimming.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MetricSummary {

    public String getDatasetName() {
        return _datasetName;
    }

    public TemporalScale getScale() {
        return _scale;
    }

    public Optional<Season> getSeason() {
        return _season;
    }

    public SampleSubset getSubset() {
        return _subset;
    }

    public Metric getMetric() {
        return _metric;
    }

    /**
     * Number of station values in the group, NaN values included.
     *
     * @return the count before trimming
     */
    public int getCountBefore() {
        return _countBefore;
    }

    /**
     * Number of station values retained by the filter.
     *
     * @return the count after trimming
     */
    public int getCountAfter() {
        return _countAfter;
    }

    public double getMean() {
        return _mean;
    }

    public double getMedian() {
        return _median;
    }

    public double getStandardDeviation() {
        return _standardDeviation;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MetricSummary other = (MetricSummary) object;

        return Objects.equal(_datasetName, other._datasetName)
                && _scale == other._scale
                && Objects.equal(_season, other._season)
                && _subset == other._subset
                && _metric == other._metric
                && _countBefore == other._countBefore
                && _countAfter == other._countAfter
                && Double.compare(_mean, other._mean) == 0
                && Double.compare(_median, other._median) == 0
                && Double.compare(_standardDeviation, other._standardDeviation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _datasetName,
                _scale,
                _season,
                _subset,
                _metric,
                _countBefore,
                _countAfter,
                _mean,
                _median,
                _standardDeviation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("DatasetName", _datasetName)
                .add("Scale", _scale)
                .add("Season", _season)
                .add("Subset", _subset)
                .add("Metric", _metric)
                .add("CountBefore", _countBefore)
                .add("CountAfter", _countAfter)
                .add("Mean", _mean)
                .add("Median", _median)
                .add("StandardDeviation", _standardDeviation)
                .toString();
    }

    private MetricSummary(final Builder builder) {
        _datasetName = builder._datasetName;
        _scale = builder._scale;
        _season = Optional.ofNullable(builder._season);
        _subset = builder._subset;
        _metric = builder._metric;
        _countBefore = builder._countBefore;
        _countAfter = builder._countAfter;
        _mean = builder._mean;
        _median = builder._median;
        _standardDeviation = builder._standardDeviation;
    }

    private final String _datasetName;
    private final TemporalScale _scale;
    private final Optional<Season> _season;
    private final SampleSubset _subset;
    private final Metric _metric;
    private final int _countBefore;
    private final int _countAfter;
    private final double _mean;
    private final double _median;
    private final double _standardDeviation;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetricSummary}.
     */
    public static final class Builder extends OvalBuilder<MetricSummary> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetricSummary::new);
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
         * Set the subset. Optional. Cannot be null. Defaults to {@link SampleSubset#ALL}.
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
         * Set the count before trimming. Required. Cannot be null.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setCountBefore(final Integer value) {
            _countBefore = value;
            return this;
        }

        /**
         * Set the count after trimming. Required. Cannot be null.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setCountAfter(final Integer value) {
            _countAfter = value;
            return this;
        }

        /**
         * Set the mean of the retained values. Required. Cannot be null. May be NaN.
         *
         * @param value The mean.
         * @return This {@link Builder} instance.
         */
        public Builder setMean(final Double value) {
            _mean = value;
            return this;
        }

        /**
         * Set the median of the retained values. Required. Cannot be null. May be NaN.
         *
         * @param value The median.
         * @return This {@link Builder} instance.
         */
        public Builder setMedian(final Double value) {
            _median = value;
            return this;
        }

        /**
         * Set the sample standard deviation of the retained values. Required. Cannot be null. May be NaN.
         *
         * @param value The standard deviation.
         * @return This {@link Builder} instance.
         */
        public Builder setStandardDeviation(final Double value) {
            _standardDeviation = value;
            return this;
        }

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
        @Min(0)
        private Integer _countBefore;
        @NotNull
        @Min(0)
        private Integer _countAfter;
        @NotNull
        private Double _mean;
        @NotNull
        private Double _median;
        @NotNull
        private Double _standardDeviation;
    }
}
