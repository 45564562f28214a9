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
package com.arpnetworking.precipcompare.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.hydrocore.aggregation.CompletenessRule;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Tunables of a comparison run: completeness rules per scale, the minimum
 * sample size and the optional extreme-value and seasonal breakdowns.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class AnalysisOptions {

    /**
     * Options with every default applied.
     *
     * @return a new {@link AnalysisOptions}
     */
    public static AnalysisOptions defaults() {
        return new Builder().build();
    }

    public CompletenessRule getMonthlyCompleteness() {
        return _monthlyCompleteness;
    }

    public CompletenessRule getSeasonalCompleteness() {
        return _seasonalCompleteness;
    }

    public CompletenessRule getYearlyCompleteness() {
        return _yearlyCompleteness;
    }

    /**
     * The completeness rule used when aggregating to a scale.
     *
     * @param scale a monthly, seasonal or yearly scale
     * @return the rule
     */
    public CompletenessRule completenessFor(final TemporalScale scale) {
        switch (scale) {
            case MONTHLY:
                return _monthlyCompleteness;
            case SEASONAL:
                return _seasonalCompleteness;
            case YEARLY:
                return _yearlyCompleteness;
            default:
                throw new IllegalArgumentException(String.format("No completeness rule for scale %s", scale));
        }
    }

    public int getMinimumSampleSize() {
        return _minimumSampleSize;
    }

    public boolean isIncludeExtremes() {
        return _includeExtremes;
    }

    public double getUpperExtremePercentile() {
        return _upperExtremePercentile;
    }

    public double getLowerExtremePercentile() {
        return _lowerExtremePercentile;
    }

    public boolean isIncludeSeasonalBreakdown() {
        return _includeSeasonalBreakdown;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("MonthlyCompleteness", _monthlyCompleteness)
                .add("SeasonalCompleteness", _seasonalCompleteness)
                .add("YearlyCompleteness", _yearlyCompleteness)
                .add("MinimumSampleSize", _minimumSampleSize)
                .add("IncludeExtremes", _includeExtremes)
                .add("UpperExtremePercentile", _upperExtremePercentile)
                .add("LowerExtremePercentile", _lowerExtremePercentile)
                .add("IncludeSeasonalBreakdown", _includeSeasonalBreakdown)
                .toString();
    }

    private AnalysisOptions(final Builder builder) {
        _monthlyCompleteness = builder._monthlyCompleteness;
        _seasonalCompleteness = builder._seasonalCompleteness;
        _yearlyCompleteness = builder._yearlyCompleteness;
        _minimumSampleSize = builder._minimumSampleSize;
        _includeExtremes = builder._includeExtremes;
        _upperExtremePercentile = builder._upperExtremePercentile;
        _lowerExtremePercentile = builder._lowerExtremePercentile;
        _includeSeasonalBreakdown = builder._includeSeasonalBreakdown;
    }

    private final CompletenessRule _monthlyCompleteness;
    private final CompletenessRule _seasonalCompleteness;
    private final CompletenessRule _yearlyCompleteness;
    private final int _minimumSampleSize;
    private final boolean _includeExtremes;
    private final double _upperExtremePercentile;
    private final double _lowerExtremePercentile;
    private final boolean _includeSeasonalBreakdown;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AnalysisOptions}.
     */
    public static final class Builder extends OvalBuilder<AnalysisOptions> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnalysisOptions::new);
        }

        /**
         * Set the monthly completeness rule. Optional. Cannot be null.
         * Defaults to a 0.8 fraction of the days in the month.
         *
         * @param value The rule.
         * @return This {@link Builder} instance.
         */
        public Builder setMonthlyCompleteness(final CompletenessRule value) {
            _monthlyCompleteness = value;
            return this;
        }

        /**
         * Set the seasonal completeness rule. Optional. Cannot be null.
         * Defaults to a 0.8 fraction of the days in the season.
         *
         * @param value The rule.
         * @return This {@link Builder} instance.
         */
        public Builder setSeasonalCompleteness(final CompletenessRule value) {
            _seasonalCompleteness = value;
            return this;
        }

        /**
         * Set the yearly completeness rule. Optional. Cannot be null.
         * Defaults to a 0.75 fraction of the days in the year.
         *
         * @param value The rule.
         * @return This {@link Builder} instance.
         */
        public Builder setYearlyCompleteness(final CompletenessRule value) {
            _yearlyCompleteness = value;
            return this;
        }

        /**
         * Set the minimum number of jointly-valid pairs needed to report
         * metrics. Optional. Cannot be null. Defaults to 10.
         *
         * @param value The minimum sample size.
         * @return This {@link Builder} instance.
         */
        public Builder setMinimumSampleSize(final Integer value) {
            _minimumSampleSize = value;
            return this;
        }

        /**
         * Set whether daily results include the extreme subsets. Optional.
         * Cannot be null. Defaults to true.
         *
         * @param value The flag.
         * @return This {@link Builder} instance.
         */
        public Builder setIncludeExtremes(final Boolean value) {
            _includeExtremes = value;
            return this;
        }

        /**
         * Set the ground percentile at or above which pairs form the upper
         * extreme subset. Optional. Cannot be null. Defaults to 90.
         *
         * @param value The percentile.
         * @return This {@link Builder} instance.
         */
        public Builder setUpperExtremePercentile(final Double value) {
            _upperExtremePercentile = value;
            return this;
        }

        /**
         * Set the ground percentile at or below which pairs form the lower
         * extreme subset. Optional. Cannot be null. Must be below the upper
         * extreme percentile. Defaults to 10.
         *
         * @param value The percentile.
         * @return This {@link Builder} instance.
         */
        public Builder setLowerExtremePercentile(final Double value) {
            _lowerExtremePercentile = value;
            return this;
        }

        /**
         * Set whether daily and seasonal results include per-season rows.
         * Optional. Cannot be null. Defaults to true.
         *
         * @param value The flag.
         * @return This {@link Builder} instance.
         */
        public Builder setIncludeSeasonalBreakdown(final Boolean value) {
            _includeSeasonalBreakdown = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateLowerExtremePercentile(final Double value) {
            return _upperExtremePercentile == null || value < _upperExtremePercentile;
        }

        @NotNull
        private CompletenessRule _monthlyCompleteness = CompletenessRule.fraction(0.8);
        @NotNull
        private CompletenessRule _seasonalCompleteness = CompletenessRule.fraction(0.8);
        @NotNull
        private CompletenessRule _yearlyCompleteness = CompletenessRule.fraction(0.75);
        @NotNull
        @Min(1)
        private Integer _minimumSampleSize = 10;
        @NotNull
        private Boolean _includeExtremes = Boolean.TRUE;
        @NotNull
        @Range(min = 0, max = 100)
        private Double _upperExtremePercentile = 90.0;
        @NotNull
        @Range(min = 0, max = 100)
        @ValidateWithMethod(methodName = "validateLowerExtremePercentile", parameterType = Double.class)
        private Double _lowerExtremePercentile = 10.0;
        @NotNull
        private Boolean _includeSeasonalBreakdown = Boolean.TRUE;
    }
}
