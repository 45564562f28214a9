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
import com.arpnetworking.hydrocore.model.GriddedSeries;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.registry.DatasetSpec;

/**
 * Supplies gridded product values at a station's location.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public interface GriddedDataSource {

    /**
     * Fetch a gridded series in the product's native units and resolution.
     *
     * @param spec the product
     * @param station the point of interest
     * @param range the days of interest
     * @return the gridded series
     * @throws FetchException if the series cannot be produced
     */
    GriddedSeries fetch(DatasetSpec spec, Station station, DateRange range) throws FetchException;
}
