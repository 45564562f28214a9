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
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * A closed range of calendar dates; both ends are inclusive.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class DateRange {

    /**
     * Create a range from its two inclusive ends.
     *
     * @param start the first day
     * @param end the last day
     * @return a new {@link DateRange}
     */
    public static DateRange of(final LocalDate start, final LocalDate end) {
        return new Builder().setStart(start).setEnd(end).build();
    }

    public LocalDate getStart() {
        return _start;
    }

    public LocalDate getEnd() {
        return _end;
    }

    /**
     * Number of days in the range, counting both ends.
     *
     * @return the day count
     */
    public long getDays() {
        return ChronoUnit.DAYS.between(_start, _end) + 1;
    }

    /**
     * Whether a date falls inside the range.
     *
     * @param date the date
     * @return true if start &lt;= date &lt;= end
     */
    public boolean contains(final LocalDate date) {
        return !date.isBefore(_start) && !date.isAfter(_end);
    }

    /**
     * Whether another range lies entirely inside this one.
     *
     * @param other the other range
     * @return true if both ends of the other range are contained
     */
    public boolean encloses(final DateRange other) {
        return contains(other._start) && contains(other._end);
    }

    /**
     * The overlap of two ranges.
     *
     * @param other the other range
     * @return the common dates, or empty when the ranges are disjoint
     */
    public Optional<DateRange> intersect(final DateRange other) {
        final LocalDate start = _start.isAfter(other._start) ? _start : other._start;
        final LocalDate end = _end.isBefore(other._end) ? _end : other._end;
        if (start.isAfter(end)) {
            return Optional.empty();
        }
        return Optional.of(of(start, end));
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DateRange other = (DateRange) object;

        return Objects.equal(_start, other._start)
                && Objects.equal(_end, other._end);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_start, _end);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Start", _start)
                .add("End", _end)
                .toString();
    }

    private DateRange(final Builder builder) {
        _start = builder._start;
        _end = builder._end;
    }

    private final LocalDate _start;
    private final LocalDate _end;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DateRange}.
     */
    public static final class Builder extends OvalBuilder<DateRange> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DateRange::new);
        }

        /**
         * Set the first day. Required. Cannot be null.
         *
         * @param value The first day.
         * @return This {@link Builder} instance.
         */
        public Builder setStart(final LocalDate value) {
            _start = value;
            return this;
        }

        /**
         * Set the last day. Required. Cannot be null. Cannot precede the first day.
         *
         * @param value The last day.
         * @return This {@link Builder} instance.
         */
        public Builder setEnd(final LocalDate value) {
            _end = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateEnd(final LocalDate end) {
            return _start == null || !end.isBefore(_start);
        }

        @NotNull
        private LocalDate _start;
        @NotNull
        @ValidateWithMethod(methodName = "validateEnd", parameterType = LocalDate.class)
        private LocalDate _end;
    }
}
