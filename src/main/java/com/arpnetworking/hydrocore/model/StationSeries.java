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
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Daily precipitation totals recorded by one ground station, in millimeters.
 * Observations are in strictly increasing date order.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class StationSeries {

    public Station getStation() {
        return _station;
    }

    public String getStationId() {
        return _station.getId();
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

        final StationSeries other = (StationSeries) object;

        return Objects.equal(_station, other._station)
                && Objects.equal(_observations, other._observations);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_station, _observations);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Station", _station)
                .add("Observations", _observations.size())
                .toString();
    }

    private StationSeries(final Builder builder) {
        _station = builder._station;
        _observations = builder._observations;
    }

    private final Station _station;
    private final ImmutableList<Observation> _observations;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link StationSeries}.
     */
    public static final class Builder extends OvalBuilder<StationSeries> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(StationSeries::new);
        }

        /**
         * Set the station. Required. Cannot be null.
         *
         * @param value The station.
         * @return This {@link Builder} instance.
         */
        public Builder setStation(final Station value) {
            _station = value;
            return this;
        }

        /**
         * Set the daily observations. Optional. Cannot be null. Defaults to an
         * empty {@link ImmutableList}. Timestamps must fall at midnight and
         * be strictly increasing.
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
            LocalDate previous = null;
            for (final Observation observation : observations) {
                if (!LocalTime.MIDNIGHT.equals(observation.getTimestamp().toLocalTime())) {
                    return false;
                }
                if (previous != null && !observation.getDate().isAfter(previous)) {
                    return false;
                }
                previous = observation.getDate();
            }
            return true;
        }

        @NotNull
        private Station _station;
        @NotNull
        @ValidateWithMethod(methodName = "validateObservations", parameterType = ImmutableList.class)
        private ImmutableList<Observation> _observations = ImmutableList.of();
    }
}
