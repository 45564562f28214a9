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

import com.arpnetworking.hydrocore.filtering.OutlierFilter;
import com.arpnetworking.hydrocore.model.DataSufficiency;
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.SkippedRow;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.List;

/**
 * Collects rows from concurrent workers.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
final class ResultsAccumulator {

    synchronized void addMetrics(final Collection<MetricResult> results) {
        _metrics.addAll(results);
    }

    synchronized void addSkipped(final SkippedRow row) {
        _skipped.add(row);
    }

    synchronized void addSufficiency(final DataSufficiency row) {
        _sufficiency.add(row);
    }

    synchronized AnalysisResults toResults(final OutlierFilter filter, final boolean cancelled) {
        return new AnalysisResults(_metrics, _skipped, _sufficiency, filter.summarize(_metrics), cancelled);
    }

    private final List<MetricResult> _metrics = Lists.newArrayList();
    private final List<SkippedRow> _skipped = Lists.newArrayList();
    private final List<DataSufficiency> _sufficiency = Lists.newArrayList();
}
