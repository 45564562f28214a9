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
import com.arpnetworking.hydrocore.exceptions.ConfigurationException;
import com.arpnetworking.hydrocore.exceptions.FetchException;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.GriddedSeries;
import com.arpnetworking.hydrocore.model.MetricResult;
import com.arpnetworking.hydrocore.model.NativeResolution;
import com.arpnetworking.hydrocore.model.Observation;
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
import com.arpnetworking.hydrocore.statistics.Metric;
import com.arpnetworking.hydrocore.statistics.MetricsEngine;
import com.arpnetworking.precipcompare.configuration.AnalysisOptions;
import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.utility.BaseActorTest;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.pekko.testkit.TestProbe;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.Mockito;
import scala.concurrent.duration.FiniteDuration;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Tests for {@link AnalysisOrchestrator}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class AnalysisOrchestratorTest extends BaseActorTest {

    @Before
    public void setUpOrchestrator() throws Exception {
        _workers = Executors.newFixedThreadPool(2);
        _orchestrator = createOrchestrator(_workers);
        Mockito.when(_groundSource.fetch(Mockito.any(), Mockito.any()))
                .thenAnswer(invocation -> groundSeries(invocation.getArgument(0)));
        Mockito.when(_griddedSource.fetch(Mockito.any(), Mockito.any(), Mockito.any()))
                .thenAnswer(invocation -> griddedSeries(invocation.getArgument(0), invocation.getArgument(1), START));
    }

    @After
    public void tearDownWorkers() {
        _workers.shutdownNow();
    }

    @Test
    public void testEvaluatesEveryScale() throws Exception {
        // Eight days reach the upper decile and nine the lower
        final AnalysisRun run = _orchestrator.submit(createRequestBuilder()
                .setOptions(new AnalysisOptions.Builder().setMinimumSampleSize(8).build())
                .build());
        final AnalysisResults results = run.awaitResults(AWAIT_TIMEOUT);

        Assert.assertFalse(results.isCancelled());
        // All, both extremes and winter at the daily scale
        Assert.assertEquals(4 * Metric.values().length, results.getMetrics().size());
        final List<MetricResult> bias = results.getMetrics().stream()
                .filter(row -> row.getMetric() == Metric.BIAS)
                .collect(Collectors.toList());
        Assert.assertEquals(4, bias.size());
        for (final MetricResult row : bias) {
            Assert.assertEquals(TemporalScale.DAILY, row.getScale());
            Assert.assertEquals(0.5, row.getValue(), 1e-9);
        }
        Assert.assertEquals(SampleSubset.ALL, bias.get(0).getSubset());
        Assert.assertFalse(bias.get(0).getSeason().isPresent());
        Assert.assertEquals(DAYS, bias.get(0).getSampleSize());
        Assert.assertEquals(ImmutableSet.of(Season.WINTER), bias.stream()
                .filter(row -> row.getSeason().isPresent())
                .map(row -> row.getSeason().get())
                .collect(ImmutableSet.toImmutableSet()));

        Assert.assertEquals(1, results.getSkipped().size());
        final SkippedRow skipped = results.getSkipped().get(0);
        Assert.assertEquals(TemporalScale.MONTHLY, skipped.getScale());
        Assert.assertEquals(SkipReason.INSUFFICIENT_DATA, skipped.getReason());
        Assert.assertEquals("2 valid pairs; at least 8 required", skipped.getDetail());

        Assert.assertEquals(1, results.getSufficiency().size());
        Assert.assertEquals(STATION_A.getId(), results.getSufficiency().get(0).getStationId());
        Assert.assertEquals(DAYS, results.getSufficiency().get(0).getValidDays());
        Assert.assertFalse(results.getSummaries().isEmpty());

        Assert.assertTrue(run.isDone());
        Assert.assertEquals(1, run.getCompleted());
        final ImmutableList<ProgressUpdate> progress = run.drainProgress();
        Assert.assertEquals(1, progress.size());
        Assert.assertEquals(STATION_A.getId() + "/DAILYSET", progress.get(0).getLabel());
        Assert.assertFalse(run.pollProgress().isPresent());
    }

    @Test
    public void testExtremesBelowMinimumSampleSizeAreOmitted() throws Exception {
        final AnalysisResults results = _orchestrator.submit(createRequestBuilder().build()).awaitResults(AWAIT_TIMEOUT);

        Assert.assertEquals(ImmutableSet.of(SampleSubset.ALL), results.getMetrics().stream()
                .map(MetricResult::getSubset)
                .collect(ImmutableSet.toImmutableSet()));
        // All and winter only
        Assert.assertEquals(2 * Metric.values().length, results.getMetrics().size());
        Assert.assertEquals(1, results.getSkipped().size());
        Assert.assertEquals("2 valid pairs; at least 10 required", results.getSkipped().get(0).getDetail());
    }

    @Test
    public void testFetchFailureSkipsEveryScale() throws Exception {
        Mockito.doThrow(new FetchException("service unavailable"))
                .when(_griddedSource).fetch(Mockito.any(), Mockito.any(), Mockito.any());

        final AnalysisResults results = _orchestrator.submit(createRequestBuilder().build()).awaitResults(AWAIT_TIMEOUT);

        Assert.assertTrue(results.getMetrics().isEmpty());
        Assert.assertEquals(2, results.getSkipped().size());
        for (final SkippedRow row : results.getSkipped()) {
            Assert.assertEquals(SkipReason.FETCH_FAILED, row.getReason());
            Assert.assertEquals("service unavailable", row.getDetail());
        }
        Assert.assertEquals(TemporalScale.DAILY, results.getSkipped().get(0).getScale());
        Assert.assertEquals(TemporalScale.MONTHLY, results.getSkipped().get(1).getScale());
        // Ground was still evaluated
        Assert.assertEquals(1, results.getSufficiency().size());
    }

    @Test
    public void testNoOverlapSkipsEveryScale() throws Exception {
        Mockito.doAnswer(invocation -> griddedSeries(
                        invocation.getArgument(0),
                        invocation.getArgument(1),
                        START.minusYears(1)))
                .when(_griddedSource).fetch(Mockito.any(), Mockito.any(), Mockito.any());

        final AnalysisResults results = _orchestrator.submit(createRequestBuilder().build()).awaitResults(AWAIT_TIMEOUT);

        Assert.assertTrue(results.getMetrics().isEmpty());
        Assert.assertEquals(2, results.getSkipped().size());
        for (final SkippedRow row : results.getSkipped()) {
            Assert.assertEquals(SkipReason.NO_OVERLAP, row.getReason());
        }
    }

    @Test
    public void testGroundFetchedOncePerStation() throws Exception {
        final AnalysisResults results = _orchestrator.submit(createRequestBuilder()
                .setStations(ImmutableList.of(STATION_A, STATION_B))
                .setDatasets(ImmutableList.of("DAILYSET", "OTHERSET"))
                .build())
                .awaitResults(AWAIT_TIMEOUT);

        Mockito.verify(_groundSource, Mockito.times(1)).fetch(Mockito.eq(STATION_A), Mockito.any());
        Mockito.verify(_groundSource, Mockito.times(1)).fetch(Mockito.eq(STATION_B), Mockito.any());
        Mockito.verify(_griddedSource, Mockito.times(4)).fetch(Mockito.any(), Mockito.any(), Mockito.any());
        Assert.assertEquals(2, results.getSufficiency().size());
        Assert.assertEquals(STATION_A.getId(), results.getSufficiency().get(0).getStationId());
        Assert.assertEquals(4, results.getSkipped().size());
        Assert.assertEquals(4 * 4 * Metric.values().length, results.getMetrics().size());
    }

    @Test
    public void testUnsupportedScaleRejectedBeforeFetching() throws Exception {
        try {
            _orchestrator.submit(createRequestBuilder()
                    .setDatasets(ImmutableList.of("MONTHSET"))
                    .build());
            Assert.fail("Expected exception");
        } catch (final ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("MONTHSET"));
        }
        Mockito.verifyNoInteractions(_groundSource, _griddedSource);
    }

    @Test
    public void testUnknownDatasetRejected() {
        try {
            _orchestrator.submit(createRequestBuilder()
                    .setDatasets(ImmutableList.of("NOPE"))
                    .build());
            Assert.fail("Expected exception");
        } catch (final ConfigurationException e) {
            Mockito.verifyNoInteractions(_groundSource, _griddedSource);
        }
    }

    @Test
    public void testCancellationStopsPendingUnits() throws Exception {
        final ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final CountDownLatch release = new CountDownLatch(1);
            Mockito.doAnswer(invocation -> {
                started.countDown();
                release.await();
                return groundSeries(STATION_A);
            }).when(_groundSource).fetch(Mockito.eq(STATION_A), Mockito.any());

            final AnalysisRun run = createOrchestrator(single).submit(createRequestBuilder()
                    .setStations(ImmutableList.of(STATION_A, STATION_B, STATION_C))
                    .build());
            Assert.assertTrue(started.await(10, TimeUnit.SECONDS));
            run.cancel();
            release.countDown();
            final AnalysisResults results = run.awaitResults(AWAIT_TIMEOUT);

            Assert.assertTrue(run.isCancelled());
            Assert.assertTrue(results.isCancelled());
            Assert.assertEquals(2, run.getAbandoned());
            Assert.assertEquals(3, run.getTotal());
            Assert.assertEquals(1, run.getCompleted());
            Assert.assertEquals(1, results.getSufficiency().size());
            Mockito.verify(_groundSource, Mockito.never()).fetch(Mockito.eq(STATION_B), Mockito.any());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    public void testCancelAfterLastUnitStartedKeepsRunComplete() throws Exception {
        final AtomicReference<AnalysisRun> handle = new AtomicReference<>();
        final CountDownLatch submitted = new CountDownLatch(1);
        Mockito.doAnswer(invocation -> {
            submitted.await();
            handle.get().cancel();
            return griddedSeries(invocation.getArgument(0), invocation.getArgument(1), START);
        }).when(_griddedSource).fetch(Mockito.any(), Mockito.any(), Mockito.any());

        handle.set(_orchestrator.submit(createRequestBuilder().build()));
        submitted.countDown();
        final AnalysisResults results = handle.get().awaitResults(AWAIT_TIMEOUT);

        Assert.assertTrue(handle.get().isCancelled());
        Assert.assertEquals(0, handle.get().getAbandoned());
        Assert.assertFalse(results.isCancelled());
        Assert.assertFalse(results.getMetrics().isEmpty());
    }

    @Test
    public void testProgressPublishedToRelay() throws Exception {
        final TestProbe probe = TestProbe.apply(getSystem());
        final AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                _registry,
                new TemporalAligner(),
                new AggregationEngine(),
                new MetricsEngine(),
                new DataSufficiencyCheck(),
                _groundSource,
                _griddedSource,
                _workers,
                probe.ref());

        final AnalysisRun run = orchestrator.submit(createRequestBuilder()
                .setStations(ImmutableList.of(STATION_A, STATION_B))
                .build());

        final ProgressUpdate first = probe.expectMsgClass(PROBE_TIMEOUT, ProgressUpdate.class);
        final ProgressUpdate second = probe.expectMsgClass(PROBE_TIMEOUT, ProgressUpdate.class);
        final RunCompleted completed = probe.expectMsgClass(PROBE_TIMEOUT, RunCompleted.class);
        Assert.assertEquals(run.getId(), first.getRunId());
        Assert.assertEquals(2, first.getTotal());
        Assert.assertEquals(ImmutableSet.of(1, 2), ImmutableSet.of(first.getCompleted(), second.getCompleted()));
        Assert.assertEquals(run.getId(), completed.getRunId());
        Assert.assertFalse(completed.isCancelled());
    }

    private AnalysisOrchestrator createOrchestrator(final ExecutorService workers) {
        return new AnalysisOrchestrator(
                _registry,
                new TemporalAligner(),
                new AggregationEngine(),
                new MetricsEngine(),
                new DataSufficiencyCheck(),
                _groundSource,
                _griddedSource,
                workers);
    }

    private static AnalysisRequest.Builder createRequestBuilder() {
        return new AnalysisRequest.Builder()
                .setStations(ImmutableList.of(STATION_A))
                .setDatasets(ImmutableList.of("DAILYSET"))
                .setScales(ImmutableSet.of(TemporalScale.DAILY, TemporalScale.MONTHLY))
                .setWindow(DateRange.of(START, START.plusDays(DAYS - 1)));
    }

    private static StationSeries groundSeries(final Station station) {
        final double[] values = new double[DAYS];
        for (int i = 0; i < DAYS; ++i) {
            values[i] = i % 7;
        }
        return TestBeanFactory.createStationSeries(station, START, values);
    }

    private static GriddedSeries griddedSeries(final DatasetSpec spec, final Station station, final LocalDate start) {
        final ImmutableList.Builder<Observation> observations = ImmutableList.builder();
        for (int i = 0; i < DAYS; ++i) {
            observations.add(Observation.of(start.plusDays(i), i % 7 + 0.5));
        }
        return new GriddedSeries.Builder()
                .setDatasetName(spec.getName())
                .setStationId(station.getId())
                .setNativeResolution(spec.getNativeResolution())
                .setObservations(observations.build())
                .build();
    }

    @Mock
    private GroundDataSource _groundSource;
    @Mock
    private GriddedDataSource _griddedSource;
    private ExecutorService _workers;
    private AnalysisOrchestrator _orchestrator;

    private final DatasetRegistry _registry = new DatasetRegistry(ImmutableList.of(
            TestBeanFactory.createDatasetSpecBuilder().setName("DAILYSET").build(),
            TestBeanFactory.createDatasetSpecBuilder().setName("OTHERSET").build(),
            TestBeanFactory.createDatasetSpecBuilder()
                    .setName("MONTHSET")
                    .setNativeResolution(NativeResolution.MONTHLY)
                    .setSupportedScales(ImmutableSet.of(TemporalScale.MONTHLY, TemporalScale.SEASONAL, TemporalScale.YEARLY))
                    .build()));

    private static final LocalDate START = LocalDate.of(2020, 1, 1);
    private static final int DAYS = 60;
    private static final Station STATION_A = TestBeanFactory.createStationBuilder().setId("A").build();
    private static final Station STATION_B = TestBeanFactory.createStationBuilder().setId("B").build();
    private static final Station STATION_C = TestBeanFactory.createStationBuilder().setId("C").build();
    private static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(10);
    private static final FiniteDuration PROBE_TIMEOUT = FiniteDuration.apply(10, TimeUnit.SECONDS);
}
