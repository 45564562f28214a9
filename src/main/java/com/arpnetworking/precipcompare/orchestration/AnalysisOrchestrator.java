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

import com.arpnetworking.hydrocore.aggregation.AggregationEngine;
import com.arpnetworking.hydrocore.alignment.TemporalAligner;
import com.arpnetworking.hydrocore.exceptions.AlignmentException;
import com.arpnetworking.hydrocore.exceptions.ConfigurationException;
import com.arpnetworking.hydrocore.exceptions.FetchException;
import com.arpnetworking.hydrocore.exceptions.ScaleMismatchException;
import com.arpnetworking.hydrocore.filtering.OutlierFilter;
import com.arpnetworking.hydrocore.model.AlignedPair;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.GriddedSeries;
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.SampleSubset;
import com.arpnetworking.hydrocore.model.Season;
import com.arpnetworking.hydrocore.model.SkipReason;
import com.arpnetworking.hydrocore.model.SkippedRow;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.model.StationSeries;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.hydrocore.registry.DatasetRegistry;
import com.arpnetworking.hydrocore.registry.DatasetSpec;
import com.arpnetworking.hydrocore.statistics.DataSufficiencyCheck;
import com.arpnetworking.hydrocore.statistics.MetricSet;
import com.arpnetworking.hydrocore.statistics.MetricsEngine;
import com.arpnetworking.precipcompare.configuration.AnalysisOptions;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Strings;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import com.google.inject.name.Named;
import org.apache.pekko.actor.ActorRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs every (station, dataset) unit of a request on a worker pool. Each unit
 * fetches its series, aligns them once and evaluates every requested scale
 * in turn. A failing scale becomes a skipped row; it never aborts the run.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AnalysisOrchestrator {

    /**
     * Public constructor.
     *
     * @param registry the dataset catalog
     * @param aligner the temporal aligner
     * @param aggregation the aggregation engine
     * @param metrics the metrics engine
     * @param sufficiencyCheck the ground record length check
     * @param groundSource the ground data collaborator
     * @param griddedSource the gridded data collaborator
     * @param workers the worker pool
     * @param progressRelay the actor progress is pushed to
     */
    @Inject
    public AnalysisOrchestrator(
            final DatasetRegistry registry,
            final TemporalAligner aligner,
            final AggregationEngine aggregation,
            final MetricsEngine metrics,
            final DataSufficiencyCheck sufficiencyCheck,
            final GroundDataSource groundSource,
            final GriddedDataSource griddedSource,
            @Named("analysis-workers") final ExecutorService workers,
            @Named("progress-relay") final ActorRef progressRelay) {
        this(registry, aligner, aggregation, metrics, sufficiencyCheck, groundSource, griddedSource, workers,
                Optional.of(progressRelay));
    }

    /**
     * Constructor without a progress relay; progress is only queued on the run.
     *
     * @param registry the dataset catalog
     * @param aligner the temporal aligner
     * @param aggregation the aggregation engine
     * @param metrics the metrics engine
     * @param sufficiencyCheck the ground record length check
     * @param groundSource the ground data collaborator
     * @param griddedSource the gridded data collaborator
     * @param workers the worker pool
     */
    public AnalysisOrchestrator(
            final DatasetRegistry registry,
            final TemporalAligner aligner,
            final AggregationEngine aggregation,
            final MetricsEngine metrics,
            final DataSufficiencyCheck sufficiencyCheck,
            final GroundDataSource groundSource,
            final GriddedDataSource griddedSource,
            final ExecutorService workers) {
        this(registry, aligner, aggregation, metrics, sufficiencyCheck, groundSource, griddedSource, workers,
                Optional.empty());
    }

    /**
     * Validate a request and start it.
     *
     * @param request the request
     * @return the run handle
     * @throws ConfigurationException if a dataset is unknown or disabled, a
     * scale is unsupported by a dataset, or the window misses a dataset's valid range
     */
    public AnalysisRun submit(final AnalysisRequest request) throws ConfigurationException {
        final Map<String, DatasetSpec> specs = Maps.newLinkedHashMap();
        final Map<String, DateRange> fetchRanges = Maps.newHashMap();
        for (final String dataset : request.getDatasets()) {
            for (final TemporalScale scale : request.getScales()) {
                fetchRanges.put(dataset, _registry.validate(dataset, scale, request.getWindow()));
            }
            specs.put(dataset, _registry.spec(dataset));
        }

        final AnalysisRun run = new AnalysisRun(request.getStations().size() * specs.size(), _progressRelay);
        final ResultsAccumulator accumulator = new ResultsAccumulator();
        final LoadingCache<Station, StationSeries> groundCache = CacheBuilder.newBuilder()
                .build(new CacheLoader<Station, StationSeries>() {
                    @Override
                    public StationSeries load(final Station station) throws FetchException {
                        final StationSeries series = _groundSource.fetch(station, request.getWindow());
                        accumulator.addSufficiency(_sufficiencyCheck.evaluate(series));
                        return series;
                    }
                });

        LOGGER.info()
                .setMessage("Starting analysis run")
                .addData("runId", run.getId())
                .addData("request", request)
                .addData("units", run.getTotal())
                .log();

        final List<CompletableFuture<Void>> units = Lists.newArrayListWithExpectedSize(run.getTotal());
        for (final Station station : request.getStations()) {
            for (final DatasetSpec spec : specs.values()) {
                units.add(CompletableFuture.runAsync(
                        () -> runUnit(
                                run,
                                request,
                                station,
                                spec,
                                fetchRanges.get(spec.getName()),
                                groundCache,
                                accumulator),
                        _workers));
            }
        }

        CompletableFuture.allOf(units.toArray(new CompletableFuture<?>[0])).whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                LOGGER.error()
                        .setMessage("Analysis run failed")
                        .addData("runId", run.getId())
                        .setThrowable(throwable)
                        .log();
                run.fail(throwable);
                return;
            }
            final AnalysisResults results = accumulator.toResults(
                    new OutlierFilter(request.getFilter()),
                    run.getAbandoned() > 0);
            LOGGER.info()
                    .setMessage("Analysis run finished")
                    .addData("runId", run.getId())
                    .addData("results", results)
                    .log();
            run.complete(results);
        });
        return run;
    }

    private void runUnit(
            final AnalysisRun run,
            final AnalysisRequest request,
            final Station station,
            final DatasetSpec spec,
            final DateRange fetchRange,
            final LoadingCache<Station, StationSeries> groundCache,
            final ResultsAccumulator accumulator) {
        if (run.isCancelled()) {
            run.unitAbandoned();
            return;
        }
        final String label = station.getId() + "/" + spec.getName();
        try {
            evaluateUnit(request, station, spec, fetchRange, groundCache, accumulator);
        } finally {
            run.unitCompleted(label);
        }
    }

    private void evaluateUnit(
            final AnalysisRequest request,
            final Station station,
            final DatasetSpec spec,
            final DateRange fetchRange,
            final LoadingCache<Station, StationSeries> groundCache,
            final ResultsAccumulator accumulator) {
        final UnitContext unit = new UnitContext(station.getId(), spec.getName(), request.getScales(), accumulator);
        final AlignedPair base;
        try {
            final StationSeries ground = fetchGround(groundCache, station);
            final GriddedSeries gridded = _griddedSource.fetch(spec, station, fetchRange);
            base = _aligner.align(ground, gridded, spec, Optional.of(request.getWindow()));
        } catch (final FetchException e) {
            LOGGER.warn()
                    .setMessage("Fetch failed")
                    .addData("stationId", station.getId())
                    .addData("dataset", spec.getName())
                    .setThrowable(e)
                    .log();
            unit.skipAll(SkipReason.FETCH_FAILED, Strings.nullToEmpty(e.getMessage()));
            return;
        } catch (final AlignmentException e) {
            unit.skipAll(SkipReason.NO_OVERLAP, Strings.nullToEmpty(e.getMessage()));
            return;
        } catch (final ScaleMismatchException e) {
            unit.skipAll(SkipReason.UNSUPPORTED_SCALE, Strings.nullToEmpty(e.getMessage()));
            return;
        // CHECKSTYLE.OFF: IllegalCatch - A failing unit must not abort the run
        } catch (final RuntimeException e) {
        // CHECKSTYLE.ON: IllegalCatch
            logInternalError(station, spec, Optional.empty(), e);
            unit.skipAll(SkipReason.INTERNAL_ERROR, Strings.nullToEmpty(e.getMessage()));
            return;
        }

        for (final TemporalScale scale : request.getScales()) {
            try {
                evaluateScale(request.getOptions(), base, scale, unit);
            // CHECKSTYLE.OFF: IllegalCatch - A failing scale must not abort the unit
            } catch (final RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
                logInternalError(station, spec, Optional.of(scale), e);
                unit.skip(scale, SkipReason.INTERNAL_ERROR, Strings.nullToEmpty(e.getMessage()));
            }
        }
    }

    private void evaluateScale(
            final AnalysisOptions options,
            final AlignedPair base,
            final TemporalScale scale,
            final UnitContext unit) {
        final AlignedPair pair;
        if (scale == base.getScale()) {
            pair = base;
        } else if (scale.isCoarserThan(base.getScale())) {
            pair = _aggregation.aggregate(base, scale, options.completenessFor(scale));
        } else {
            unit.skip(scale, SkipReason.UNSUPPORTED_SCALE, String.format(
                    "Aligned at %s; cannot evaluate %s",
                    base.getScale(),
                    scale));
            return;
        }

        final int sampleSize = pair.getJointlyValidCount();
        if (sampleSize < options.getMinimumSampleSize()) {
            unit.skip(scale, SkipReason.INSUFFICIENT_DATA, String.format(
                    "%d valid pairs; at least %d required",
                    sampleSize,
                    options.getMinimumSampleSize()));
            return;
        }

        final ImmutableList.Builder<MetricResult> rows = ImmutableList.builder();
        rows.addAll(_metrics.compute(pair).toResults(
                unit._stationId, unit._datasetName, scale, Optional.empty(), SampleSubset.ALL));

        if (scale == TemporalScale.DAILY && options.isIncludeExtremes()) {
            addIfSufficient(
                    rows,
                    _metrics.computeUpperExtreme(pair, options.getUpperExtremePercentile()),
                    options,
                    unit,
                    scale,
                    SampleSubset.UPPER_EXTREME);
            addIfSufficient(
                    rows,
                    _metrics.computeLowerExtreme(pair, options.getLowerExtremePercentile()),
                    options,
                    unit,
                    scale,
                    SampleSubset.LOWER_EXTREME);
        }

        if (options.isIncludeSeasonalBreakdown()
                && (scale == TemporalScale.DAILY || scale == TemporalScale.SEASONAL)) {
            for (final Season season : Season.values()) {
                final AlignedPair seasonal = _aggregation.seasonSubset(pair, season);
                if (seasonal.getJointlyValidCount() >= options.getMinimumSampleSize()) {
                    rows.addAll(_metrics.compute(seasonal).toResults(
                            unit._stationId, unit._datasetName, scale, Optional.of(season), SampleSubset.ALL));
                }
            }
        }

        unit._accumulator.addMetrics(rows.build());
    }

    private static void addIfSufficient(
            final ImmutableList.Builder<MetricResult> rows,
            final MetricSet metrics,
            final AnalysisOptions options,
            final UnitContext unit,
            final TemporalScale scale,
            final SampleSubset subset) {
        if (metrics.getSampleSize() < options.getMinimumSampleSize()) {
            LOGGER.debug()
                    .setMessage("Subset below minimum sample size; omitted")
                    .addData("stationId", unit._stationId)
                    .addData("dataset", unit._datasetName)
                    .addData("subset", subset)
                    .addData("sampleSize", metrics.getSampleSize())
                    .log();
            return;
        }
        rows.addAll(metrics.toResults(unit._stationId, unit._datasetName, scale, Optional.empty(), subset));
    }

    private static StationSeries fetchGround(final LoadingCache<Station, StationSeries> cache, final Station station)
            throws FetchException {
        try {
            return cache.get(station);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof FetchException) {
                throw (FetchException) e.getCause();
            }
            throw new FetchException(String.format("Ground fetch failed; station=%s", station.getId()), e.getCause());
        } catch (final UncheckedExecutionException e) {
            throw new FetchException(String.format("Ground fetch failed; station=%s", station.getId()), e.getCause());
        }
    }

    private static void logInternalError(
            final Station station,
            final DatasetSpec spec,
            final Optional<TemporalScale> scale,
            final RuntimeException e) {
        LOGGER.error()
                .setMessage("Unexpected failure evaluating unit")
                .addData("stationId", station.getId())
                .addData("dataset", spec.getName())
                .addData("scale", scale)
                .setThrowable(e)
                .log();
    }

    private AnalysisOrchestrator(
            final DatasetRegistry registry,
            final TemporalAligner aligner,
            final AggregationEngine aggregation,
            final MetricsEngine metrics,
            final DataSufficiencyCheck sufficiencyCheck,
            final GroundDataSource groundSource,
            final GriddedDataSource griddedSource,
            final ExecutorService workers,
            final Optional<ActorRef> progressRelay) {
        _registry = registry;
        _aligner = aligner;
        _aggregation = aggregation;
        _metrics = metrics;
        _sufficiencyCheck = sufficiencyCheck;
        _groundSource = groundSource;
        _griddedSource = griddedSource;
        _workers = workers;
        _progressRelay = progressRelay;
    }

    private final DatasetRegistry _registry;
    private final TemporalAligner _aligner;
    private final AggregationEngine _aggregation;
    private final MetricsEngine _metrics;
    private final DataSufficiencyCheck _sufficiencyCheck;
    private final GroundDataSource _groundSource;
    private final GriddedDataSource _griddedSource;
    private final ExecutorService _workers;
    private final Optional<ActorRef> _progressRelay;

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private static final class UnitContext {
        UnitContext(
                final String stationId,
                final String datasetName,
                final Iterable<TemporalScale> scales,
                final ResultsAccumulator accumulator) {
            _stationId = stationId;
            _datasetName = datasetName;
            _scales = scales;
            _accumulator = accumulator;
        }

        void skip(final TemporalScale scale, final SkipReason reason, final String detail) {
            LOGGER.debug()
                    .setMessage("Skipping tuple")
                    .addData("stationId", _stationId)
                    .addData("dataset", _datasetName)
                    .addData("scale", scale)
                    .addData("reason", reason)
                    .addData("detail", detail)
                    .log();
            _accumulator.addSkipped(new SkippedRow.Builder()
                    .setStationId(_stationId)
                    .setDatasetName(_datasetName)
                    .setScale(scale)
                    .setReason(reason)
                    .setDetail(detail)
                    .build());
        }

        void skipAll(final SkipReason reason, final String detail) {
            for (final TemporalScale scale : _scales) {
                skip(scale, reason, detail);
            }
        }

        private final String _stationId;
        private final String _datasetName;
        private final Iterable<TemporalScale> _scales;
        private final ResultsAccumulator _accumulator;
    }
}
