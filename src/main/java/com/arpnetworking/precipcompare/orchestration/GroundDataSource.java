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
package com.arpnetworking.precipcompare.orchestration;

import com.arpnetworking.hydrocore.exceptions.FetchException;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.model.StationSeries;

/**
 * Supplies ground-station observations.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public interface GroundDataSource {

    /**
     * Fetch the daily ground series of a station.
     *
     * @param station the station
     * @param range the days of interest
     * @return the ground series; days outside the source's record may be absent
     * @throws FetchException if the series cannot be produced
     */
    StationSeries fetch(Station station, DateRange range) throws FetchException;
}
