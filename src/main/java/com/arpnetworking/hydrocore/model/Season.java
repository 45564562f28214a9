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
import java.time.Month;

/**
 * Meteorological seasons. Winter spans December through February and is
 * attributed to the year of its January and February.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public enum Season {
    WINTER(Month.DECEMBER),
    SPRING(Month.MARCH),
    SUMMER(Month.JUNE),
    FALL(Month.SEPTEMBER);

    Season(final Month firstMonth) {
        _firstMonth = firstMonth;
    }

    public Month getFirstMonth() {
        return _firstMonth;
    }

    /**
     * Look up the season of a month.
     *
     * @param month the month
     * @return the season containing the month
     */
    public static Season of(final Month month) {
        switch (month) {
            case DECEMBER:
            case JANUARY:
            case FEBRUARY:
                return WINTER;
            case MARCH:
            case APRIL:
            case MAY:
                return SPRING;
            case JUNE:
            case JULY:
            case AUGUST:
                return SUMMER;
            default:
                return FALL;
        }
    }

    /**
     * Look up the season of a date.
     *
     * @param date the date
     * @return the season containing the date
     */
    public static Season of(final LocalDate date) {
        return of(date.getMonth());
    }

    /**
     * First day of the season occurrence containing the date. For a winter
     * date in January or February this is the first of December of the prior
     * calendar year.
     *
     * @param date the date
     * @return the first day of the containing season
     */
    public static LocalDate periodStart(final LocalDate date) {
        final Season season = of(date);
        final int year = season == WINTER && date.getMonth() != Month.DECEMBER ? date.getYear() - 1 : date.getYear();
        return LocalDate.of(year, season._firstMonth, 1);
    }

    private final Month _firstMonth;
}
