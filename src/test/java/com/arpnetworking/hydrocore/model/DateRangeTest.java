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

import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Tests for {@link DateRange}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class DateRangeTest {

    @Test
    public void testDaysCountsBothEnds() {
        Assert.assertEquals(1L, DateRange.of(JAN_1, JAN_1).getDays());
        Assert.assertEquals(366L, DateRange.of(JAN_1, LocalDate.of(2020, 12, 31)).getDays());
    }

    @Test
    public void testContains() {
        final DateRange range = DateRange.of(JAN_1, LocalDate.of(2020, 1, 31));
        Assert.assertTrue(range.contains(JAN_1));
        Assert.assertTrue(range.contains(LocalDate.of(2020, 1, 31)));
        Assert.assertFalse(range.contains(LocalDate.of(2019, 12, 31)));
        Assert.assertFalse(range.contains(LocalDate.of(2020, 2, 1)));
    }

    @Test
    public void testIntersect() {
        final DateRange first = DateRange.of(JAN_1, LocalDate.of(2020, 6, 30));
        final DateRange second = DateRange.of(LocalDate.of(2020, 3, 1), LocalDate.of(2020, 12, 31));
        Assert.assertEquals(
                Optional.of(DateRange.of(LocalDate.of(2020, 3, 1), LocalDate.of(2020, 6, 30))),
                first.intersect(second));
        Assert.assertEquals(first.intersect(second), second.intersect(first));
    }

    @Test
    public void testIntersectDisjoint() {
        final DateRange first = DateRange.of(JAN_1, LocalDate.of(2020, 1, 31));
        final DateRange second = DateRange.of(LocalDate.of(2020, 2, 1), LocalDate.of(2020, 2, 29));
        Assert.assertFalse(first.intersect(second).isPresent());
    }

    @Test
    public void testEncloses() {
        final DateRange outer = DateRange.of(JAN_1, LocalDate.of(2020, 12, 31));
        Assert.assertTrue(outer.encloses(DateRange.of(LocalDate.of(2020, 5, 1), LocalDate.of(2020, 5, 31))));
        Assert.assertFalse(outer.encloses(DateRange.of(LocalDate.of(2020, 5, 1), LocalDate.of(2021, 1, 1))));
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testEndBeforeStart() {
        DateRange.of(LocalDate.of(2020, 2, 1), JAN_1);
    }

    private static final LocalDate JAN_1 = LocalDate.of(2020, 1, 1);
}
