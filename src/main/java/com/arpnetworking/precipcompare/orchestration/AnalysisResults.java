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

import com.arpnetworking.hydrocore.model.DataSufficiency;
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.MetricSummary;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.SkippedRow;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Comparator;

/**
 * Everything a run produced. Rows are ordered by station, dataset and scale
 * regardless of the order the workers finished in.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AnalysisResults {

    /**
     * Public constructor.
     *
     * @param metrics the per-station metric rows
     * @param skipped the skipped tuples
     * @param sufficiency the per-station sufficiency rows
     * @param summaries the trimmed cross-station summaries
     * @param cancelled whether the run was cancelled before every unit ran
     */
    public AnalysisResults(
            final Collection<MetricResult> metrics,
            final Collection<SkippedRow> skipped,
            final Collection<DataSufficiency> sufficiency,
            final Collection<MetricSummary> summaries,
            final boolean cancelled) {
        _metrics = metrics.stream().sorted(METRIC_ORDER).collect(ImmutableList.toImmutableList());
        _skipped = skipped.stream().sorted(SKIPPED_ORDER).collect(ImmutableList.toImmutableList());
        _sufficiency = sufficiency.stream()
                .sorted(Comparator.comparing(DataSufficiency::getStationId))
                .collect(ImmutableList.toImmutableList());
        _summaries = ImmutableList.copyOf(summaries);
        _cancelled = cancelled;
    }

    public ImmutableList<MetricResult> getMetrics() {
        return _metrics;
    }

    public ImmutableList<SkippedRow> getSkipped() {
        return _skipped;
    }

    public ImmutableList<DataSufficiency> getSufficiency() {
        return _sufficiency;
    }

    public ImmutableList<MetricSummary> getSummaries() {
        return _summaries;
    }

    public boolean isCancelled() {
        return _cancelled;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Metrics", _metrics.size())
                .add("Skipped", _skipped.size())
                .add("Sufficiency", _sufficiency.size())
                .add("Summaries", _summaries.size())
                .add("Cancelled", _cancelled)
                .toString();
    }

    private final ImmutableList<MetricResult> _metrics;
    private final ImmutableList<SkippedRow> _skipped;
    private final ImmutableList<DataSufficiency> _sufficiency;
    private final ImmutableList<MetricSummary> _summaries;
    private final boolean _cancelled;

    private static final Comparator<MetricResult> METRIC_ORDER = Comparator
            .comparing(MetricResult::getStationId)
            .thenComparing(MetricResult::getDatasetName)
            .thenComparing(MetricResult::getScale)
            .thenComparingInt(result -> result.getSeason().map(Season::ordinal).orElse(-1))
            .thenComparing(MetricResult::getSubset)
            .thenComparing(MetricResult::getMetric);
    private static final Comparator<SkippedRow> SKIPPED_ORDER = Comparator
            .comparing(SkippedRow::getStationId)
            .thenComparing(SkippedRow::getDatasetName)
            .thenComparing(SkippedRow::getScale);
}
