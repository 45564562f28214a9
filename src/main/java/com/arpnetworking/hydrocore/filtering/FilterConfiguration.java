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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Percentile bounds for outlier trimming. Bounds satisfy
 * 0 &lt;= lower &lt; upper &lt;= 100.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class FilterConfiguration {

    /**
     * Configuration with the default bounds: 1st and 99th percentiles.
     *
     * @return a new {@link FilterConfiguration}
     */
    public static FilterConfiguration defaults() {
        return new Builder().build();
    }

    /**
     * Percentile below which higher-is-better values are trimmed.
     *
     * @return the lower percentile
     */
    public double getLowerPercentile() {
        return _lowerPercentile;
    }

    /**
     * Percentile of magnitudes above which lower-magnitude-is-better values are trimmed.
     *
     * @return the upper percentile
     */
    public double getUpperPercentile() {
        return _upperPercentile;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final FilterConfiguration other = (FilterConfiguration) object;

        return Double.compare(_lowerPercentile, other._lowerPercentile) == 0
                && Double.compare(_upperPercentile, other._upperPercentile) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_lowerPercentile, _upperPercentile);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("LowerPercentile", _lowerPercentile)
                .add("UpperPercentile", _upperPercentile)
                .toString();
    }

    private FilterConfiguration(final Builder builder) {
        _lowerPercentile = builder._lowerPercentile;
        _upperPercentile = builder._upperPercentile;
    }

    private final double _lowerPercentile;
    private final double _upperPercentile;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link FilterConfiguration}.
     */
    public static final class Builder extends OvalBuilder<FilterConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(FilterConfiguration::new);
        }

        /**
         * Set the lower percentile. Optional. Cannot be null. Must be in [0, 100)
         * and below the upper percentile. Defaults to 1.
         *
         * @param value The lower percentile.
         * @return This {@link Builder} instance.
         */
        public Builder setLowerPercentile(final Double value) {
            _lowerPercentile = value;
            return this;
        }

        /**
         * Set the upper percentile. Optional. Cannot be null. Must be in (0, 100].
         * Defaults to 99.
         *
         * @param value The upper percentile.
         * @return This {@link Builder} instance.
         */
        public Builder setUpperPercentile(final Double value) {
            _upperPercentile = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateLowerPercentile(final Double value) {
            return _upperPercentile == null || value < _upperPercentile;
        }

        @NotNull
        @Range(min = 0, max = 100)
        @ValidateWithMethod(methodName = "validateLowerPercentile", parameterType = Double.class)
        private Double _lowerPercentile = 1.0;
        @NotNull
        @Range(min = 0, max = 100)
        private Double _upperPercentile = 99.0;
    }
}
