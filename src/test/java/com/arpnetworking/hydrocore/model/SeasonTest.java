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

import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;
import java.time.Month;

/**
 * Tests for {@link Season}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class SeasonTest {

    @Test
    public void testMonthMapping() {
        Assert.assertEquals(Season.WINTER, Season.of(Month.DECEMBER));
        Assert.assertEquals(Season.WINTER, Season.of(Month.FEBRUARY));
        Assert.assertEquals(Season.SPRING, Season.of(Month.MARCH));
        Assert.assertEquals(Season.SPRING, Season.of(Month.MAY));
        Assert.assertEquals(Season.SUMMER, Season.of(Month.JUNE));
        Assert.assertEquals(Season.SUMMER, Season.of(Month.AUGUST));
        Assert.assertEquals(Season.FALL, Season.of(Month.SEPTEMBER));
        Assert.assertEquals(Season.FALL, Season.of(Month.NOVEMBER));
    }

    @Test
    public void testDecemberStartsNextWinter() {
        final LocalDate december = Season.periodStart(LocalDate.of(2019, 12, 15));
        final LocalDate january = Season.periodStart(LocalDate.of(2020, 1, 15));
        final LocalDate february = Season.periodStart(LocalDate.of(2020, 2, 29));
        Assert.assertEquals(LocalDate.of(2019, 12, 1), december);
        Assert.assertEquals(december, january);
        Assert.assertEquals(december, february);
    }

    @Test
    public void testPeriodStartOtherSeasons() {
        Assert.assertEquals(LocalDate.of(2020, 3, 1), Season.periodStart(LocalDate.of(2020, 5, 31)));
        Assert.assertEquals(LocalDate.of(2020, 6, 1), Season.periodStart(LocalDate.of(2020, 7, 4)));
        Assert.assertEquals(LocalDate.of(2020, 9, 1), Season.periodStart(LocalDate.of(2020, 11, 30)));
    }
}
