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

import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Tests for {@link StationSeries} and {@link Observation}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class StationSeriesTest {

    @Test
    public void testNaNIsMissing() {
        final Observation observation = Observation.of(START, Double.NaN);
        Assert.assertTrue(observation.isMissing());
        Assert.assertFalse(observation.getValue().isPresent());
        Assert.assertEquals(Optional.of(0.0), Observation.of(START, 0.0).getValue());
    }

    @Test
    public void testSpanIncludesMissingEnds() {
        final StationSeries series = TestBeanFactory.createStationSeries(
                TestBeanFactory.createStation(),
                START,
                Double.NaN, 1.0, 2.0, Double.NaN, 3.0, Double.NaN);
        Assert.assertEquals(
                Optional.of(DateRange.of(START, START.plusDays(5))),
                series.getSpan());
    }

    @Test
    public void testSpanEmptyWithoutObservations() {
        final StationSeries series = TestBeanFactory.createStationSeries(TestBeanFactory.createStation(), START);
        Assert.assertFalse(series.getSpan().isPresent());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testRejectsSubDailyTimestamps() {
        new StationSeries.Builder()
                .setStation(TestBeanFactory.createStation())
                .setObservations(ImmutableList.of(Observation.of(START.atTime(6, 0), 1.0)))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testRejectsDuplicateDays() {
        new StationSeries.Builder()
                .setStation(TestBeanFactory.createStation())
                .setObservations(ImmutableList.of(Observation.of(START, 1.0), Observation.of(START, 2.0)))
                .build();
    }

    private static final LocalDate START = LocalDate.of(2020, 1, 1);
}
