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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A single timestamped precipitation value. A missing value is carried
 * explicitly and is never read as zero.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Observation {

    /**
     * Create an observation. A NaN value is recorded as missing.
     *
     * @param timestamp the start of the observation interval
     * @param value the precipitation amount
     * @return a new {@link Observation}
     */
    public static Observation of(final LocalDateTime timestamp, final double value) {
        return new Observation(timestamp, Double.isNaN(value) ? Optional.empty() : Optional.of(value));
    }

    /**
     * Create a daily observation. A NaN value is recorded as missing.
     *
     * @param date the day
     * @param value the precipitation amount
     * @return a new {@link Observation}
     */
    public static Observation of(final LocalDate date, final double value) {
        return of(date.atStartOfDay(), value);
    }

    /**
     * Create an observation with an explicit missing marker.
     *
     * @param timestamp the start of the observation interval
     * @return a new {@link Observation}
     */
    public static Observation missing(final LocalDateTime timestamp) {
        return new Observation(timestamp, Optional.empty());
    }

    /**
     * Create a daily observation with an explicit missing marker.
     *
     * @param date the day
     * @return a new {@link Observation}
     */
    public static Observation missing(final LocalDate date) {
        return missing(date.atStartOfDay());
    }

    public LocalDateTime getTimestamp() {
        return _timestamp;
    }

    public LocalDate getDate() {
        return _timestamp.toLocalDate();
    }

    public Optional<Double> getValue() {
        return _value;
    }

    public boolean isMissing() {
        return !_value.isPresent();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Observation other = (Observation) object;

        return Objects.equal(_timestamp, other._timestamp)
                && Objects.equal(_value, other._value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("Value", _value)
                .toString();
    }

    private Observation(final LocalDateTime timestamp, final Optional<Double> value) {
        _timestamp = timestamp;
        _value = value;
    }

    private final LocalDateTime _timestamp;
    private final Optional<Double> _value;
}
