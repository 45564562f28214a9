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
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Whether a station's ground record is long enough to support each scale.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class DataSufficiency {

    public String getStationId() {
        return _stationId;
    }

    public int getValidDays() {
        return _validDays;
    }

    public int getYearsWithData() {
        return _yearsWithData;
    }

    public boolean isDailySufficient() {
        return _dailySufficient;
    }

    public boolean isMonthlySufficient() {
        return _monthlySufficient;
    }

    public boolean isYearlySufficient() {
        return _yearlySufficient;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DataSufficiency other = (DataSufficiency) object;

        return Objects.equal(_stationId, other._stationId)
                && _validDays == other._validDays
                && _yearsWithData == other._yearsWithData
                && _dailySufficient == other._dailySufficient
                && _monthlySufficient == other._monthlySufficient
                && _yearlySufficient == other._yearlySufficient;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _stationId,
                _validDays,
                _yearsWithData,
                _dailySufficient,
                _monthlySufficient,
                _yearlySufficient);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("StationId", _stationId)
                .add("ValidDays", _validDays)
                .add("YearsWithData", _yearsWithData)
                .add("DailySufficient", _dailySufficient)
                .add("MonthlySufficient", _monthlySufficient)
                .add("YearlySufficient", _yearlySufficient)
                .toString();
    }

    private DataSufficiency(final Builder builder) {
        _stationId = builder._stationId;
        _validDays = builder._validDays;
        _yearsWithData = builder._yearsWithData;
        _dailySufficient = builder._dailySufficient;
        _monthlySufficient = builder._monthlySufficient;
        _yearlySufficient = builder._yearlySufficient;
    }

    private final String _stationId;
    private final int _validDays;
    private final int _yearsWithData;
    private final boolean _dailySufficient;
    private final boolean _monthlySufficient;
    private final boolean _yearlySufficient;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DataSufficiency}.
     */
    public static final class Builder extends OvalBuilder<DataSufficiency> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DataSufficiency::new);
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
         * Set the number of days carrying a value. Required. Cannot be null.
         *
         * @param value The valid day count.
         * @return This {@link Builder} instance.
         */
        public Builder setValidDays(final Integer value) {
            _validDays = value;
            return this;
        }

        /**
         * Set the number of calendar years with at least one value. Required. Cannot be null.
         *
         * @param value The year count.
         * @return This {@link Builder} instance.
         */
        public Builder setYearsWithData(final Integer value) {
            _yearsWithData = value;
            return this;
        }

        /**
         * Set whether the record supports daily comparison. Required. Cannot be null.
         *
         * @param value The flag.
         * @return This {@link Builder} instance.
         */
        public Builder setDailySufficient(final Boolean value) {
            _dailySufficient = value;
            return this;
        }

        /**
         * Set whether the record supports monthly comparison. Required. Cannot be null.
         *
         * @param value The flag.
         * @return This {@link Builder} instance.
         */
        public Builder setMonthlySufficient(final Boolean value) {
            _monthlySufficient = value;
            return this;
        }

        /**
         * Set whether the record supports yearly comparison. Required. Cannot be null.
         *
         * @param value The flag.
         * @return This {@link Builder} instance.
         */
        public Builder setYearlySufficient(final Boolean value) {
            _yearlySufficient = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _stationId;
        @NotNull
        @Min(0)
        private Integer _validDays;
        @NotNull
        @Min(0)
        private Integer _yearsWithData;
        @NotNull
        private Boolean _dailySufficient;
        @NotNull
        private Boolean _monthlySufficient;
        @NotNull
        private Boolean _yearlySufficient;
    }
}
