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
package com.arpnetworking.hydrocore.statistics;

import com.arpnetworking.hydrocore.model.DataSufficiency;
import com.arpnetworking.hydrocore.model.Observation;
import com.arpnetworking.hydrocore.model.StationSeries;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * Decides whether a ground record is long enough for each comparison scale.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class DataSufficiencyCheck {

    /**
     * Create a check with the default minimums: 365 valid days for daily
     * comparison, 2 years with data for monthly and 5 for yearly.
     */
    public DataSufficiencyCheck() {
        this(DEFAULT_MINIMUM_DAYS, DEFAULT_MINIMUM_MONTHLY_YEARS, DEFAULT_MINIMUM_YEARLY_YEARS);
    }

    /**
     * Public constructor.
     *
     * @param minimumDays valid days needed for daily comparison
     * @param minimumMonthlyYears years with data needed for monthly comparison
     * @param minimumYearlyYears years with data needed for yearly comparison
     */
    public DataSufficiencyCheck(final int minimumDays, final int minimumMonthlyYears, final int minimumYearlyYears) {
        _minimumDays = minimumDays;
        _minimumMonthlyYears = minimumMonthlyYears;
        _minimumYearlyYears = minimumYearlyYears;
    }

    /**
     * Evaluate a ground series.
     *
     * @param series the ground series
     * @return the sufficiency flags
     */
    public DataSufficiency evaluate(final StationSeries series) {
        int validDays = 0;
        final Set<Integer> years = Sets.newHashSet();
        for (final Observation observation : series.getObservations()) {
            if (!observation.isMissing()) {
                ++validDays;
                years.add(observation.getDate().getYear());
            }
        }
        return new DataSufficiency.Builder()
                .setStationId(series.getStationId())
                .setValidDays(validDays)
                .setYearsWithData(years.size())
                .setDailySufficient(validDays >= _minimumDays)
                .setMonthlySufficient(years.size() >= _minimumMonthlyYears)
                .setYearlySufficient(years.size() >= _minimumYearlyYears)
                .build();
    }

    private final int _minimumDays;
    private final int _minimumMonthlyYears;
    private final int _minimumYearlyYears;

    private static final int DEFAULT_MINIMUM_DAYS = 365;
    private static final int DEFAULT_MINIMUM_MONTHLY_YEARS = 2;
    private static final int DEFAULT_MINIMUM_YEARLY_YEARS = 5;
}
