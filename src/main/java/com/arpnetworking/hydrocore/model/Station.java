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
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A ground gauge location.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class Station {

    public String getId() {
        return _id;
    }

    public double getLatitude() {
        return _latitude;
    }

    public double getLongitude() {
        return _longitude;
    }

    public Optional<Double> getElevation() {
        return _elevation;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Station other = (Station) object;

        return Objects.equal(_id, other._id)
                && _latitude == other._latitude
                && _longitude == other._longitude
                && Objects.equal(_elevation, other._elevation);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _latitude, _longitude, _elevation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Id", _id)
                .add("Latitude", _latitude)
                .add("Longitude", _longitude)
                .add("Elevation", _elevation)
                .toString();
    }

    private Station(final Builder builder) {
        _id = builder._id;
        _latitude = builder._latitude;
        _longitude = builder._longitude;
        _elevation = Optional.ofNullable(builder._elevation);
    }

    private final String _id;
    private final double _latitude;
    private final double _longitude;
    private final Optional<Double> _elevation;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Station}.
     */
    public static final class Builder extends OvalBuilder<Station> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Station::new);
        }

        /**
         * Set the station identifier. Required. Cannot be null or empty.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setId(final String value) {
            _id = value;
            return this;
        }

        /**
         * Set the latitude in decimal degrees. Required. Cannot be null.
         *
         * @param value The latitude.
         * @return This {@link Builder} instance.
         */
        public Builder setLatitude(final Double value) {
            _latitude = value;
            return this;
        }

        /**
         * Set the longitude in decimal degrees. Required. Cannot be null.
         *
         * @param value The longitude.
         * @return This {@link Builder} instance.
         */
        public Builder setLongitude(final Double value) {
            _longitude = value;
            return this;
        }

        /**
         * Set the elevation in meters. Optional.
         *
         * @param value The elevation.
         * @return This {@link Builder} instance.
         */
        public Builder setElevation(@Nullable final Double value) {
            _elevation = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _id;
        @NotNull
        @Range(min = -90, max = 90)
        private Double _latitude;
        @NotNull
        @Range(min = -180, max = 360)
        private Double _longitude;
        private Double _elevation;
    }
}
