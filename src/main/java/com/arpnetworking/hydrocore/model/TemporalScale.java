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

/**
 * The temporal scales at which station and gridded series are compared.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum TemporalScale {
    /**
     * Calendar day totals.
     */
    DAILY(2),
    /**
     * Calendar month totals.
     */
    MONTHLY(3),
    /**
     * Meteorological season totals; December belongs to the following year's winter.
     */
    SEASONAL(4),
    /**
     * Calendar year totals.
     */
    YEARLY(5);

    TemporalScale(final int rank) {
        _rank = rank;
    }

    /**
     * Coarseness of the scale; larger is coarser. Shares its ordering with
     * {@link NativeResolution#getRank()}.
     *
     * @return the rank
     */
    public int getRank() {
        return _rank;
    }

    /**
     * Whether this scale is strictly coarser than another.
     *
     * @param other the other scale
     * @return true if this scale aggregates the other
     */
    public boolean isCoarserThan(final TemporalScale other) {
        return _rank > other._rank;
    }

    private final int _rank;
}
