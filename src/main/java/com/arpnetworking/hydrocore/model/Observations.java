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

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Helpers shared by the series types.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
final class Observations {

    static Optional<DateRange> span(final List<Observation> observations) {
        LocalDate first = null;
        LocalDate last = null;
        for (final Observation observation : observations) {
            final LocalDate date = observation.getDate();
            if (first == null || date.isBefore(first)) {
                first = date;
            }
            if (last == null || date.isAfter(last)) {
                last = date;
            }
        }
        if (first == null) {
            return Optional.empty();
        }
        return Optional.of(DateRange.of(first, last));
    }

    private Observations() {}
}
