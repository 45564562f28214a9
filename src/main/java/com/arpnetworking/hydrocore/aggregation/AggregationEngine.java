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
package com.arpnetworking.hydrocore.aggregation;

import com.arpnetworking.hydrocore.model.AlignedPair;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Rolls an aligned daily or monthly pair up to a coarser scale.
 *
 * <p>An output period is populated only when its jointly-valid sub-periods
 * satisfy the completeness rule; otherwise it is missing on both sides.
 * Both sides are summed over the same jointly-valid sub-periods, so a
 * partial total on one side is never set against a full total on the other.
 * The expected number of sub-periods is the calendar length of the period
 * clipped to the index of the source pair. Missing days at the ends of a
 * record stay on that index as gaps, so they count against completeness.</p>
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class AggregationEngine {

    /**
     * Aggregate a pair to a coarser scale.
     *
     * @param source a daily or monthly pair
     * @param target the coarser scale
     * @param rule the completeness rule for the target scale
     * @return the aggregated pair
     */
    public AlignedPair aggregate(final AlignedPair source, final TemporalScale target, final CompletenessRule rule) {
        final TemporalScale sourceScale = source.getScale();
        if (sourceScale != TemporalScale.DAILY && sourceScale != TemporalScale.MONTHLY) {
            throw new IllegalArgumentException(String.format("Cannot aggregate from scale %s", sourceScale));
        }
        if (!target.isCoarserThan(sourceScale)) {
            throw new IllegalArgumentException(String.format(
                    "Target scale must be coarser than source; source=%s, target=%s",
                    sourceScale,
                    target));
        }

        final NavigableMap<LocalDate, PeriodTotal> totals = Maps.newTreeMap();
        for (int i = 0; i < source.size(); ++i) {
            final PeriodTotal total = totals.computeIfAbsent(periodStart(source.getPeriod(i), target), ignored -> new PeriodTotal());
            if (source.isJointlyValid(i)) {
                total.add(source.getGround(i), source.getGridded(i));
            }
        }

        final LocalDate spanStart = source.size() > 0 ? source.getPeriod(0) : LocalDate.MIN;
        final LocalDate spanEndExclusive = source.size() > 0
                ? subPeriodEnd(source.getPeriod(source.size() - 1), sourceScale)
                : LocalDate.MIN;

        final ImmutableList.Builder<LocalDate> periods = ImmutableList.builderWithExpectedSize(totals.size());
        final double[] ground = new double[totals.size()];
        final double[] gridded = new double[totals.size()];
        int index = 0;
        int populated = 0;
        for (final Map.Entry<LocalDate, PeriodTotal> entry : totals.entrySet()) {
            final LocalDate start = entry.getKey();
            final PeriodTotal total = entry.getValue();
            final int expected = expectedSubPeriods(start, target, sourceScale, spanStart, spanEndExclusive);
            periods.add(start);
            if (rule.isSatisfied(total._valid, expected)) {
                ground[index] = total._ground;
                gridded[index] = total._gridded;
                ++populated;
            } else {
                ground[index] = Double.NaN;
                gridded[index] = Double.NaN;
            }
            ++index;
        }

        LOGGER.debug()
                .setMessage("Aggregated pair")
                .addData("stationId", source.getStationId())
                .addData("dataset", source.getDatasetName())
                .addData("source", sourceScale)
                .addData("target", target)
                .addData("periods", totals.size())
                .addData("populated", populated)
                .log();

        return new AlignedPair.Builder()
                .setStationId(source.getStationId())
                .setDatasetName(source.getDatasetName())
                .setScale(target)
                .setPeriods(periods.build())
                .setGround(ground)
                .setGridded(gridded)
                .build();
    }

    /**
     * Restrict a daily, monthly or seasonal pair to the periods falling in one season.
     *
     * @param pair the pair
     * @param season the season
     * @return the restricted pair
     */
    public AlignedPair seasonSubset(final AlignedPair pair, final Season season) {
        if (pair.getScale() == TemporalScale.YEARLY) {
            throw new IllegalArgumentException("Yearly periods span every season");
        }
        return pair.filter(period -> Season.of(period) == season);
    }

    /**
     * First day of the period at a scale that contains a date.
     *
     * @param date the date
     * @param scale the scale
     * @return the first day of the containing period
     */
    static LocalDate periodStart(final LocalDate date, final TemporalScale scale) {
        switch (scale) {
            case DAILY:
                return date;
            case MONTHLY:
                return date.withDayOfMonth(1);
            case SEASONAL:
                return Season.periodStart(date);
            case YEARLY:
                return date.withDayOfYear(1);
            default:
                throw new IllegalArgumentException(String.format("Unsupported scale %s", scale));
        }
    }

    private static LocalDate subPeriodEnd(final LocalDate start, final TemporalScale scale) {
        switch (scale) {
            case DAILY:
                return start.plusDays(1);
            case MONTHLY:
                return start.plusMonths(1);
            case SEASONAL:
                return start.plusMonths(3);
            case YEARLY:
                return start.plusYears(1);
            default:
                throw new IllegalArgumentException(String.format("Unsupported scale %s", scale));
        }
    }

    private static int expectedSubPeriods(
            final LocalDate periodStart,
            final TemporalScale target,
            final TemporalScale sourceScale,
            final LocalDate spanStart,
            final LocalDate spanEndExclusive) {
        final LocalDate periodEnd = subPeriodEnd(periodStart, target);
        final LocalDate clippedStart = periodStart.isBefore(spanStart) ? spanStart : periodStart;
        final LocalDate clippedEnd = periodEnd.isAfter(spanEndExclusive) ? spanEndExclusive : periodEnd;
        if (!clippedStart.isBefore(clippedEnd)) {
            return 0;
        }
        final ChronoUnit unit = sourceScale == TemporalScale.DAILY ? ChronoUnit.DAYS : ChronoUnit.MONTHS;
        return (int) unit.between(clippedStart, clippedEnd);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationEngine.class);

    private static final class PeriodTotal {
        void add(final double ground, final double gridded) {
            ++_valid;
            _ground += ground;
            _gridded += gridded;
        }

        private int _valid;
        private double _ground;
        private double _gridded;
    }
}
