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

import java.time.Duration;

/**
 * The resolution at which a gridded product publishes values.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum NativeResolution {
    /**
     * One value per hour.
     */
    HOURLY(0, Duration.ofHours(1)),
    /**
     * One value per three hours.
     */
    THREE_HOURLY(1, Duration.ofHours(3)),
    /**
     * One value per calendar day.
     */
    DAILY(2, Duration.ofDays(1)),
    /**
     * One total per calendar month.
     */
    MONTHLY(3, Duration.ofDays(31));

    NativeResolution(final int rank, final Duration step) {
        _rank = rank;
        _step = step;
    }

    public int getRank() {
        return _rank;
    }

    public Duration getStep() {
        return _step;
    }

    /**
     * Whether values arrive more than once per day.
     *
     * @return true for hourly and three-hourly products
     */
    public boolean isSubDaily() {
        return _rank < DAILY._rank;
    }

    /**
     * Number of values a complete day holds. Only meaningful for daily and
     * sub-daily resolutions.
     *
     * @return values per day
     */
    public int getValuesPerDay() {
        if (_rank > DAILY._rank) {
            throw new IllegalStateException(String.format("Resolution %s is coarser than a day", this));
        }
        return (int) (Duration.ofDays(1).toMinutes() / _step.toMinutes());
    }

    /**
     * Whether values at this resolution can be compared at the given scale.
     * A product can never be compared at a scale finer than it publishes.
     *
     * @param scale the requested comparison scale
     * @return true if the scale is at least as coarse as this resolution
     */
    public boolean supports(final TemporalScale scale) {
        return scale.getRank() >= _rank;
    }

    private final int _rank;
    private final Duration _step;
}
