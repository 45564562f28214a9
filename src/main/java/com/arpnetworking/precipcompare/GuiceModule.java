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

import com.arpnetworking.hydrocore.exceptions.ConfigurationException;
import com.arpnetworking.hydrocore.registry.DatasetRegistry;
import com.arpnetworking.precipcompare.configuration.ComparatorConfiguration;
import com.arpnetworking.precipcompare.orchestration.GriddedDataSource;
import com.arpnetworking.precipcompare.orchestration.GroundDataSource;
import com.arpnetworking.precipcompare.orchestration.ProgressRelay;
import com.arpnetworking.precipcompare.sources.CsvSeriesSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.pekko.actor.ActorRef;
import org.apache.pekko.actor.ActorSystem;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The primary Guice module used to bootstrap the precipitation comparator.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class GuiceModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public GuiceModule(final ComparatorConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(ComparatorConfiguration.class).toInstance(_configuration);
        bind(GroundDataSource.class).to(CsvSeriesSource.class);
        bind(GriddedDataSource.class).to(CsvSeriesSource.class);
    }

    @Provides
    @Singleton
    @Named("pekko-config")
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private Config providePekkoConfig() {
        // This is necessary because the keys contain periods which when
        // transforming from a map are considered compound path elements. By
        // rendering to JSON and then parsing it this forces the keys to be
        // quoted and thus considered single path elements even with periods.
        try {
            final String pekkoJsonConfig = OBJECT_MAPPER.writeValueAsString(_configuration.getPekkoConfiguration());
            return ConfigFactory.parseString(
                    pekkoJsonConfig,
                    ConfigParseOptions.defaults()
                            .setSyntax(ConfigSyntax.JSON));
        } catch (final IOException e) {
            throw new RuntimeException(e);
        }
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ActorSystem provideActorSystem(@Named("pekko-config") final Config pekkoConfig) {
        return ActorSystem.create("PrecipitationComparator", pekkoConfig);
    }

    @Provides
    @Singleton
    @Named("progress-relay")
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ActorRef provideProgressRelay(final ActorSystem system) {
        return system.actorOf(ProgressRelay.props(), "progress-relay");
    }

    @Provides
    @Singleton
    @Named("analysis-workers")
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ExecutorService provideAnalysisWorkers() {
        return Executors.newFixedThreadPool(
                _configuration.getWorkerCount(),
                new ThreadFactoryBuilder()
                        .setNameFormat("analysis-worker-%d")
                        .setDaemon(true)
                        .build());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private DatasetRegistry provideDatasetRegistry() throws ConfigurationException {
        if (_configuration.getDatasetCatalog().isPresent()) {
            return DatasetRegistry.fromFile(_configuration.getDatasetCatalog().get());
        }
        return DatasetRegistry.fromDefaultCatalog();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private CsvSeriesSource provideCsvSeriesSource() {
        return new CsvSeriesSource(_configuration.getGroundDataFile(), _configuration.getGriddedDataDirectory());
    }

    private final ComparatorConfiguration _configuration;

    private static final ObjectMapper OBJECT_MAPPER = ComparatorConfiguration.createObjectMapper();
}
