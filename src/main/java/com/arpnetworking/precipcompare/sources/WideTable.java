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
package com.arpnetworking.precipcompare.sources;

import com.arpnetworking.hydrocore.exceptions.FetchException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.LocalDateTime;

/**
 * A parsed wide-format table: one timestamp column followed by one value
 * column per station.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
final class WideTable {

    WideTable(final ImmutableList<LocalDateTime> timestamps, final ImmutableMap<String, double[]> columns) {
        _timestamps = timestamps;
        _columns = columns;
    }

    ImmutableList<LocalDateTime> getTimestamps() {
        return _timestamps;
    }

    double[] requireColumn(final String stationId, final String source) throws FetchException {
        final double[] values = _columns.get(stationId);
        if (values == null) {
            throw new FetchException(String.format("No column for station; station=%s, source=%s", stationId, source));
        }
        return values;
    }

    private final ImmutableList<LocalDateTime> _timestamps;
    private final ImmutableMap<String, double[]> _columns;
}
