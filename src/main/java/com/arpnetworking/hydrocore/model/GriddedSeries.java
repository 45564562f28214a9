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
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Values of one gridded product sampled at a station location, in the
 * product's native units and resolution. Monthly products carry one value
 * per month stamped at the first day of the month.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class GriddedSeries {

    public String getDatasetName() {
        return _datasetName;
    }

    public String getStationId() {
        return _stationId;
    }

    public NativeResolution getNativeResolution() {
        return _nativeResolution;
    }

    public ImmutableList<Observation> getObservations() {
        return _observations;
    }

    /**
     * The span from the first to the last observation. Missing markers count,
     * so a record whose ends are missing still covers those days.
     *
     * @return the span, or empty when the series holds no observations
     */
    public Optional<DateRange> getSpan() {
        return Observations.span(_observations);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final GriddedSeries other = (GriddedSeries) object;

        return Objects.equal(_datasetName, other._datasetName)
                && Objects.equal(_stationId, other._stationId)
                && _nativeResolution == other._nativeResolution
                && Objects.equal(_observations, other._observations);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_datasetName, _stationId, _nativeResolution, _observations);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("DatasetName", _datasetName)
                .add("StationId", _stationId)
                .add("NativeResolution", _nativeResolution)
                .add("Observations", _observations.size())
                .toString();
    }

    private GriddedSeries(final Builder builder) {
        _datasetName = builder._datasetName;
        _stationId = builder._stationId;
        _nativeResolution = builder._nativeResolution;
        _observations = builder._observations;
    }

    private final String _datasetName;
    private final String _stationId;
    private final NativeResolution _nativeResolution;
    private final ImmutableList<Observation> _observations;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link GriddedSeries}.
     */
    public static final class Builder extends OvalBuilder<GriddedSeries> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(GriddedSeries::new);
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
         * Set the station the product was sampled at. Required. Cannot be null or empty.
         *
         * @param value The station identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setStationId(final String value) {
            _stationId = value;
            return this;
        }

        /**
         * Set the native resolution. Required. Cannot be null.
         *
         * @param value The native resolution.
         * @return This {@link Builder} instance.
         */
        public Builder setNativeResolution(final NativeResolution value) {
            _nativeResolution = value;
            return this;
        }

        /**
         * Set the observations. Optional. Cannot be null. Defaults to an
         * empty {@link ImmutableList}. Timestamps must be strictly increasing.
         *
         * @param value The observations.
         * @return This {@link Builder} instance.
         */
        public Builder setObservations(final ImmutableList<Observation> value) {
            _observations = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateObservations(final ImmutableList<Observation> observations) {
            LocalDateTime previous = null;
            for (final Observation observation : observations) {
                if (previous != null && !observation.getTimestamp().isAfter(previous)) {
                    return false;
                }
                previous = observation.getTimestamp();
            }
            return true;
        }

        @NotNull
        @NotEmpty
        private String _datasetName;
        @NotNull
        @NotEmpty
        private String _stationId;
        @NotNull
        private NativeResolution _nativeResolution;
        @NotNull
        @ValidateWithMethod(methodName = "validateObservations", parameterType = ImmutableList.class)
        private ImmutableList<Observation> _observations = ImmutableList.of();
    }
}
