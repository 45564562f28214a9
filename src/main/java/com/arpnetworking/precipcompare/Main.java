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
package com.arpnetworking.precipcompare;

import ch.qos.logback.classic.LoggerContext;
import com.arpnetworking.hydrocore.exceptions.AnalysisException;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.registry.DatasetRegistry;
import com.arpnetworking.hydrocore.registry.DatasetSpec;
import com.arpnetworking.precipcompare.configuration.ComparatorConfiguration;
import com.arpnetworking.precipcompare.export.CsvResultWriter;
import com.arpnetworking.precipcompare.orchestration.AnalysisOrchestrator;
import com.arpnetworking.precipcompare.orchestration.AnalysisRequest;
import com.arpnetworking.precipcompare.orchestration.AnalysisResults;
import com.arpnetworking.precipcompare.orchestration.AnalysisRun;
import com.arpnetworking.precipcompare.orchestration.ProgressUpdate;
import com.arpnetworking.precipcompare.sources.CsvSeriesSource;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.utility.Launchable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import org.apache.pekko.actor.ActorSystem;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command line entry point: runs one comparison described by a configuration
 * file and writes the result tables.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Main implements Launchable {
    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .setThrowable(throwable)
                            .log();
                });

        LOGGER.info()
                .setMessage("Launching precipitation-comparator")
                .log();

        Runtime.getRuntime().addShutdownHook(SHUTDOWN_THREAD);

        if (args.length != 1) {
            throw new RuntimeException("No configuration file specified");
        }

        LOGGER.debug()
                .setMessage("Loading configuration from file")
                .addData("file", args[0])
                .log();

        Optional<Main> main = Optional.empty();
        try {
            main = Optional.of(new Main(loadConfiguration(new File(args[0]))));
            main.get().launch();
            main.get().run();
        } catch (final IOException | AnalysisException e) {
            throw new RuntimeException(e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } finally {
            if (main.isPresent()) {
                main.get().shutdown();
            } else {
                LOGGER.warn()
                        .setMessage("No comparator present to shut down")
                        .log();
            }
            // Notify the shutdown that we're done
            SHUTDOWN_SEMAPHORE.release();
        }
    }

    /**
     * Public constructor.
     *
     * @param configuration The configuration object.
     */
    public Main(final ComparatorConfiguration configuration) {
        _configuration = configuration;
    }

    /**
     * Launch the component.
     */
    @Override
    public synchronized void launch() {
        LOGGER.info()
                .setMessage("Launching comparator")
                .addData("configuration", _configuration)
                .log();
        _injector = Guice.createInjector(new GuiceModule(_configuration));
        launchPekko(_injector);
    }

    /**
     * Shutdown the component.
     */
    @Override
    public synchronized void shutdown() {
        shutdownWorkers();
        shutdownPekko();
    }

    /**
     * Submit the configured comparison, wait for it and write the result tables.
     *
     * @throws AnalysisException if the configuration names unknown stations or datasets
     * @throws IOException if the result tables cannot be written
     * @throws InterruptedException if interrupted while waiting for the run
     */
    public void run() throws AnalysisException, IOException, InterruptedException {
        final DatasetRegistry registry = _injector.getInstance(DatasetRegistry.class);
        final AnalysisRequest request = new AnalysisRequest.Builder()
                .setStations(selectStations())
                .setDatasets(selectDatasets(registry))
                .setScales(_configuration.getScales())
                .setWindow(_configuration.getWindow())
                .setFilter(_configuration.getFilter())
                .setOptions(_configuration.getOptions())
                .build();

        final AnalysisRun run = _injector.getInstance(AnalysisOrchestrator.class).submit(request);
        ACTIVE_RUN.set(run);
        final AnalysisResults results;
        try {
            results = awaitResults(run);
        } finally {
            ACTIVE_RUN.set(null);
        }
        if (results.isCancelled()) {
            LOGGER.warn()
                    .setMessage("Run was cancelled; writing partial results")
                    .addData("results", results)
                    .log();
        }
        new CsvResultWriter(_configuration.getOutputDirectory()).write(results);
    }

    private AnalysisResults awaitResults(final AnalysisRun run) throws InterruptedException {
        while (true) {
            try {
                final AnalysisResults results = run.awaitResults(_configuration.getProgressLogInterval());
                logProgress(run);
                return results;
            } catch (final TimeoutException e) {
                logProgress(run);
            }
        }
    }

    private static void logProgress(final AnalysisRun run) {
        final ImmutableList<ProgressUpdate> updates = run.drainProgress();
        if (!updates.isEmpty()) {
            final ProgressUpdate latest = updates.get(updates.size() - 1);
            LOGGER.info()
                    .setMessage("Analysis progress")
                    .addData("runId", latest.getRunId())
                    .addData("completed", latest.getCompleted())
                    .addData("total", latest.getTotal())
                    .addData("label", latest.getLabel())
                    .log();
        }
    }

    private ImmutableList<Station> selectStations() throws AnalysisException {
        final ImmutableList<Station> stations = CsvSeriesSource.loadStations(_configuration.getStationMetadataFile());
        if (_configuration.getStations().isEmpty()) {
            return stations;
        }
        final Set<String> wanted = ImmutableSet.copyOf(_configuration.getStations());
        final ImmutableList<Station> selected = stations.stream()
                .filter(station -> wanted.contains(station.getId()))
                .collect(ImmutableList.toImmutableList());
        if (selected.size() < wanted.size()) {
            LOGGER.warn()
                    .setMessage("Configured stations missing from metadata")
                    .addData("configured", wanted)
                    .addData("found", selected.size())
                    .log();
        }
        return selected;
    }

    private ImmutableList<String> selectDatasets(final DatasetRegistry registry) {
        if (!_configuration.getDatasets().isEmpty()) {
            return _configuration.getDatasets();
        }
        return registry.enabledSpecs().stream()
                .map(DatasetSpec::getName)
                .collect(ImmutableList.toImmutableList());
    }

    private void launchPekko(final Injector injector) {
        LOGGER.info()
                .setMessage("Launching Pekko")
                .log();
        _system = injector.getInstance(ActorSystem.class);
    }

    private void shutdownWorkers() {
        if (_injector == null) {
            return;
        }
        LOGGER.info()
                .setMessage("Stopping analysis workers")
                .log();
        final ExecutorService workers =
                _injector.getInstance(Key.get(ExecutorService.class, Names.named("analysis-workers")));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.warn()
                        .setMessage("Analysis workers did not stop in a timely manner")
                        .log();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn()
                    .setMessage("Interrupted stopping analysis workers")
                    .setThrowable(e)
                    .log();
        }
    }

    private void shutdownPekko() {
        LOGGER.info()
                .setMessage("Stopping Pekko")
                .log();

        try {
            if (_system != null) {
                _system.terminate();
                _system.getWhenTerminated().toCompletableFuture().get(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
            }
        } catch (final InterruptedException | TimeoutException | ExecutionException e) {
            LOGGER.warn()
                    .setMessage("Interrupted at shutdown")
                    .setThrowable(e)
                    .log();
        }
    }

    private static ComparatorConfiguration loadConfiguration(final File file) throws IOException {
        final ObjectMapper objectMapper = ComparatorConfiguration.createObjectMapper();
        if (file.getName().toLowerCase(Locale.getDefault()).endsWith(HOCON_FILE_EXTENSION)) {
            final String json = ConfigFactory.parseFile(file)
                    .resolve()
                    .root()
                    .render(ConfigRenderOptions.concise());
            return objectMapper.readValue(json, ComparatorConfiguration.class);
        }
        return objectMapper.readValue(file, ComparatorConfiguration.class);
    }

    private final ComparatorConfiguration _configuration;

    private volatile Injector _injector;
    private volatile ActorSystem _system;

    private static final Logger LOGGER = com.arpnetworking.steno.LoggerFactory.getLogger(Main.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(3);
    private static final AtomicReference<AnalysisRun> ACTIVE_RUN = new AtomicReference<>();
    private static final Semaphore SHUTDOWN_SEMAPHORE = new Semaphore(0, true);
    private static final Thread SHUTDOWN_THREAD = new ShutdownThread();
    private static final String HOCON_FILE_EXTENSION = ".conf";

    private static final class ShutdownThread extends Thread {
        private ShutdownThread() {
            super("PrecipitationComparatorShutdownHook");
        }

        @Override
        public void run() {
            LOGGER.info()
                    .setMessage("Stopping precipitation-comparator")
                    .log();

            final AnalysisRun run = ACTIVE_RUN.get();
            if (run != null) {
                LOGGER.info()
                        .setMessage("Cancelling active run")
                        .addData("run", run)
                        .log();
                run.cancel();
            }

            try {
                // wait for the main thread to signal that it has completed shutdown
                if (!SHUTDOWN_SEMAPHORE.tryAcquire(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                    LOGGER.warn()
                            .setMessage("Shutdown did not complete in a timely manner")
                            .log();
                }
            } catch (final InterruptedException e) {
                throw new RuntimeException(e);
            } finally {
                LOGGER.info()
                        .setMessage("Shutdown complete")
                        .log();
                final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
                context.stop();
            }
        }
    }
}
