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
package com.arpnetworking.hydrocore.alignment;

import com.arpnetworking.hydrocore.exceptions.AlignmentException;
import com.arpnetworking.hydrocore.exceptions.ScaleMismatchException;
import com.arpnetworking.hydrocore.model.AlignedPair;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.GriddedSeries;
import com.arpnetworking.hydrocore.model.NativeResolution;
import com.arpnetworking.hydrocore.model.Observation;
import com.arpnetworking.hydrocore.model.StationSeries;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.hydrocore.registry.DatasetSpec;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;
import java.util.Optional;

/**
 * Places a ground series and a gridded series on a shared period index.
 * Gridded values are converted to millimeters here and nowhere else. Values
 * are never interpolated; anything incomplete is missing.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TemporalAligner {

    /**
     * Align at the finest scale the product permits: daily for daily and
     * sub-daily products, monthly for monthly products.
     *
     * @param ground the ground series
     * @param gridded the gridded series
     * @param spec the gridded product's catalog entry
     * @param window the requested analysis window, if any
     * @return the aligned pair
     * @throws AlignmentException if the series share no comparable period
     * @throws ScaleMismatchException if the gridded series does not match the catalog resolution
     */
    public AlignedPair align(
            final StationSeries ground,
            final GriddedSeries gridded,
            final DatasetSpec spec,
            final Optional<DateRange> window)
            throws AlignmentException, ScaleMismatchException {
        if (spec.getNativeResolution() == NativeResolution.MONTHLY) {
            return alignMonthly(ground, gridded, spec, window);
        }
        return alignDaily(ground, gridded, spec, window);
    }

    /**
     * Align on a daily index. Sub-daily values are summed per calendar day;
     * a day with fewer values than the resolution implies, or with any
     * missing marker, is missing.
     *
     * @param ground the ground series
     * @param gridded the gridded series
     * @param spec the gridded product's catalog entry
     * @param window the requested analysis window, if any
     * @return the aligned pair at {@link TemporalScale#DAILY}
     * @throws AlignmentException if no day carries values on both sides
     * @throws ScaleMismatchException if the product is coarser than daily
     */
    public AlignedPair alignDaily(
            final StationSeries ground,
            final GriddedSeries gridded,
            final DatasetSpec spec,
            final Optional<DateRange> window)
            throws AlignmentException, ScaleMismatchException {
        checkResolution(gridded, spec);
        if (!spec.getNativeResolution().supports(TemporalScale.DAILY)) {
            throw new ScaleMismatchException(String.format(
                    "Daily alignment not possible; dataset=%s, resolution=%s",
                    spec.getName(),
                    spec.getNativeResolution()));
        }

        final DateRange range = commonRange(ground, ground.getSpan(), gridded.getSpan(), spec, window);
        final Map<LocalDate, Double> groundDaily = groundValues(ground, range);
        final Map<LocalDate, Double> griddedDaily = griddedDailyTotals(gridded, spec, range);

        final int days = (int) range.getDays();
        final ImmutableList.Builder<LocalDate> periods = ImmutableList.builderWithExpectedSize(days);
        final double[] groundValues = new double[days];
        final double[] griddedValues = new double[days];
        LocalDate date = range.getStart();
        for (int i = 0; i < days; ++i) {
            periods.add(date);
            groundValues[i] = groundDaily.getOrDefault(date, Double.NaN);
            griddedValues[i] = griddedDaily.getOrDefault(date, Double.NaN);
            date = date.plusDays(1);
        }

        return build(ground, spec, TemporalScale.DAILY, periods.build(), groundValues, griddedValues);
    }

    /**
     * Align a monthly product on a monthly index. Only calendar months lying
     * wholly inside the compared range are indexed. The ground total of a
     * month is populated only when every day of the month carries a value,
     * since the gridded side is always a full-month total.
     *
     * @param ground the ground series
     * @param gridded the gridded series
     * @param spec the gridded product's catalog entry
     * @param window the requested analysis window, if any
     * @return the aligned pair at {@link TemporalScale#MONTHLY}
     * @throws AlignmentException if no month carries values on both sides
     * @throws ScaleMismatchException if the product is not monthly
     */
    public AlignedPair alignMonthly(
            final StationSeries ground,
            final GriddedSeries gridded,
            final DatasetSpec spec,
            final Optional<DateRange> window)
            throws AlignmentException, ScaleMismatchException {
        checkResolution(gridded, spec);
        if (spec.getNativeResolution() != NativeResolution.MONTHLY) {
            throw new ScaleMismatchException(String.format(
                    "Monthly alignment requires a monthly product; dataset=%s, resolution=%s",
                    spec.getName(),
                    spec.getNativeResolution()));
        }

        // A monthly value stamped at the first of the month covers the whole month
        final Optional<DateRange> griddedSpan = gridded.getSpan().map(
                span -> DateRange.of(
                        YearMonth.from(span.getStart()).atDay(1),
                        YearMonth.from(span.getEnd()).atEndOfMonth()));
        final DateRange range = commonRange(ground, ground.getSpan(), griddedSpan, spec, window);

        final Map<YearMonth, Double> groundSums = Maps.newHashMap();
        final Map<YearMonth, Integer> groundCounts = Maps.newHashMap();
        for (final Map.Entry<LocalDate, Double> entry : groundValues(ground, range).entrySet()) {
            final YearMonth month = YearMonth.from(entry.getKey());
            groundSums.merge(month, entry.getValue(), Double::sum);
            groundCounts.merge(month, 1, Integer::sum);
        }
        final Map<YearMonth, Double> griddedMonthly = Maps.newHashMap();
        for (final Observation observation : gridded.getObservations()) {
            if (!observation.isMissing() && range.contains(observation.getDate())) {
                griddedMonthly.put(
                        YearMonth.from(observation.getDate()),
                        observation.getValue().get() * spec.getConversionFactor());
            }
        }

        final ImmutableList.Builder<LocalDate> periods = ImmutableList.builder();
        final ImmutableList.Builder<Double> groundValues = ImmutableList.builder();
        final ImmutableList.Builder<Double> griddedValues = ImmutableList.builder();
        for (YearMonth month = YearMonth.from(range.getStart());
                !month.isAfter(YearMonth.from(range.getEnd()));
                month = month.plusMonths(1)) {
            if (!range.contains(month.atDay(1)) || !range.contains(month.atEndOfMonth())) {
                continue;
            }
            periods.add(month.atDay(1));
            final boolean completeGround = groundCounts.getOrDefault(month, 0) == month.lengthOfMonth();
            groundValues.add(completeGround ? groundSums.get(month) : Double.NaN);
            griddedValues.add(griddedMonthly.getOrDefault(month, Double.NaN));
        }

        final ImmutableList<LocalDate> monthStarts = periods.build();
        if (monthStarts.isEmpty()) {
            throw new AlignmentException(String.format(
                    "No whole month in common range; station=%s, dataset=%s, range=%s",
                    ground.getStationId(),
                    spec.getName(),
                    range));
        }
        return build(
                ground,
                spec,
                TemporalScale.MONTHLY,
                monthStarts,
                toArray(groundValues.build()),
                toArray(griddedValues.build()));
    }

    private AlignedPair build(
            final StationSeries ground,
            final DatasetSpec spec,
            final TemporalScale scale,
            final ImmutableList<LocalDate> periods,
            final double[] groundValues,
            final double[] griddedValues)
            throws AlignmentException {
        final AlignedPair pair = new AlignedPair.Builder()
                .setStationId(ground.getStationId())
                .setDatasetName(spec.getName())
                .setScale(scale)
                .setPeriods(periods)
                .setGround(groundValues)
                .setGridded(griddedValues)
                .build();
        if (pair.getJointlyValidCount() == 0) {
            throw new AlignmentException(String.format(
                    "No jointly valid periods; station=%s, dataset=%s, scale=%s",
                    ground.getStationId(),
                    spec.getName(),
                    scale));
        }
        LOGGER.debug()
                .setMessage("Aligned series")
                .addData("pair", pair)
                .log();
        return pair;
    }

    private static void checkResolution(final GriddedSeries gridded, final DatasetSpec spec) throws ScaleMismatchException {
        if (gridded.getNativeResolution() != spec.getNativeResolution()) {
            throw new ScaleMismatchException(String.format(
                    "Series resolution differs from catalog; dataset=%s, series=%s, catalog=%s",
                    spec.getName(),
                    gridded.getNativeResolution(),
                    spec.getNativeResolution()));
        }
    }

    private static DateRange commonRange(
            final StationSeries ground,
            final Optional<DateRange> groundSpan,
            final Optional<DateRange> griddedSpan,
            final DatasetSpec spec,
            final Optional<DateRange> window)
            throws AlignmentException {
        Optional<DateRange> range = groundSpan
                .flatMap(span -> griddedSpan.flatMap(span::intersect))
                .flatMap(span -> span.intersect(spec.getValidRange()));
        if (window.isPresent()) {
            range = range.flatMap(span -> span.intersect(window.get()));
        }
        if (!range.isPresent()) {
            throw new AlignmentException(String.format(
                    "No date overlap; station=%s, dataset=%s, groundSpan=%s, griddedSpan=%s",
                    ground.getStationId(),
                    spec.getName(),
                    groundSpan,
                    griddedSpan));
        }
        return range.get();
    }

    private static Map<LocalDate, Double> groundValues(final StationSeries ground, final DateRange range) {
        final Map<LocalDate, Double> values = Maps.newHashMap();
        for (final Observation observation : ground.getObservations()) {
            if (!observation.isMissing() && range.contains(observation.getDate())) {
                values.put(observation.getDate(), observation.getValue().get());
            }
        }
        return values;
    }

    private static Map<LocalDate, Double> griddedDailyTotals(
            final GriddedSeries gridded,
            final DatasetSpec spec,
            final DateRange range) {
        final NativeResolution resolution = spec.getNativeResolution();
        final int expected = resolution.getValuesPerDay();
        final Map<LocalDate, DayTotal> totals = Maps.newHashMap();
        for (final Observation observation : gridded.getObservations()) {
            if (range.contains(observation.getDate())) {
                totals.computeIfAbsent(observation.getDate(), ignored -> new DayTotal()).add(observation);
            }
        }

        final Map<LocalDate, Double> daily = Maps.newHashMapWithExpectedSize(totals.size());
        for (final Map.Entry<LocalDate, DayTotal> entry : totals.entrySet()) {
            final DayTotal total = entry.getValue();
            if (!total._missing && total._count == expected) {
                daily.put(entry.getKey(), total._sum * spec.getConversionFactor());
            } else if (resolution.isSubDaily()) {
                LOGGER.trace()
                        .setMessage("Incomplete sub-daily record; day is missing")
                        .addData("dataset", spec.getName())
                        .addData("date", entry.getKey())
                        .addData("count", total._count)
                        .addData("expected", expected)
                        .log();
            }
        }
        return daily;
    }

    private static double[] toArray(final ImmutableList<Double> values) {
        final double[] result = new double[values.size()];
        for (int i = 0; i < result.length; ++i) {
            result[i] = values.get(i);
        }
        return result;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TemporalAligner.class);

    private static final class DayTotal {
        void add(final Observation observation) {
            ++_count;
            if (observation.isMissing()) {
                _missing = true;
            } else {
                _sum += observation.getValue().get();
            }
        }

        private int _count;
        private double _sum;
        private boolean _missing;
    }
}
