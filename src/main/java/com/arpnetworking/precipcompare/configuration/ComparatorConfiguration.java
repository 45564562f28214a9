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
package com.arpnetworking.precipcompare.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.hydrocore.filtering.FilterConfiguration;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

import java.io.File;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Representation of a comparison run's configuration.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ComparatorConfiguration {
    /**
     * Create an {@link ObjectMapper} for comparator configuration.
     *
     * @return An {@link ObjectMapper} for comparator configuration.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    public int getWorkerCount() {
        return _workerCount;
    }

    public Optional<File> getDatasetCatalog() {
        return _datasetCatalog;
    }

    public File getGroundDataFile() {
        return _groundDataFile;
    }

    public File getStationMetadataFile() {
        return _stationMetadataFile;
    }

    public File getGriddedDataDirectory() {
        return _griddedDataDirectory;
    }

    public File getOutputDirectory() {
        return _outputDirectory;
    }

    /**
     * Dataset names to compare; empty selects every enabled catalog entry.
     *
     * @return the dataset names
     */
    public ImmutableList<String> getDatasets() {
        return _datasets;
    }

    /**
     * Station identifiers to compare; empty selects every station in the
     * metadata file.
     *
     * @return the station identifiers
     */
    public ImmutableList<String> getStations() {
        return _stations;
    }

    public ImmutableSet<TemporalScale> getScales() {
        return _scales;
    }

    public LocalDate getStartDate() {
        return _startDate;
    }

    public LocalDate getEndDate() {
        return _endDate;
    }

    /**
     * The analysis window as a {@link DateRange}.
     *
     * @return the window
     */
    public DateRange getWindow() {
        return DateRange.of(_startDate, _endDate);
    }

    public FilterConfiguration getFilter() {
        return _filter;
    }

    public AnalysisOptions getOptions() {
        return _options;
    }

    public Map<String, ?> getPekkoConfiguration() {
        return Collections.unmodifiableMap(_pekkoConfiguration);
    }

    public Duration getProgressLogInterval() {
        return _progressLogInterval;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("WorkerCount", _workerCount)
                .add("DatasetCatalog", _datasetCatalog)
                .add("GroundDataFile", _groundDataFile)
                .add("StationMetadataFile", _stationMetadataFile)
                .add("GriddedDataDirectory", _griddedDataDirectory)
                .add("OutputDirectory", _outputDirectory)
                .add("Datasets", _datasets)
                .add("Stations", _stations)
                .add("Scales", _scales)
                .add("StartDate", _startDate)
                .add("EndDate", _endDate)
                .add("Filter", _filter)
                .add("Options", _options)
                .add("PekkoConfiguration", _pekkoConfiguration)
                .add("ProgressLogInterval", _progressLogInterval)
                .toString();
    }

    private ComparatorConfiguration(final Builder builder) {
        _workerCount = builder._workerCount;
        _datasetCatalog = Optional.ofNullable(builder._datasetCatalog);
        _groundDataFile = builder._groundDataFile;
        _stationMetadataFile = builder._stationMetadataFile;
        _griddedDataDirectory = builder._griddedDataDirectory;
        _outputDirectory = builder._outputDirectory;
        _datasets = builder._datasets;
        _stations = builder._stations;
        _scales = builder._scales;
        _startDate = builder._startDate;
        _endDate = builder._endDate;
        _filter = builder._filter;
        _options = builder._options;
        _pekkoConfiguration = Maps.newHashMap(builder._pekkoConfiguration);
        _progressLogInterval = builder._progressLogInterval;
    }

    private final int _workerCount;
    private final Optional<File> _datasetCatalog;
    private final File _groundDataFile;
    private final File _stationMetadataFile;
    private final File _griddedDataDirectory;
    private final File _outputDirectory;
    private final ImmutableList<String> _datasets;
    private final ImmutableList<String> _stations;
    private final ImmutableSet<TemporalScale> _scales;
    private final LocalDate _startDate;
    private final LocalDate _endDate;
    private final FilterConfiguration _filter;
    private final AnalysisOptions _options;
    private final Map<String, ?> _pekkoConfiguration;
    private final Duration _progressLogInterval;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ComparatorConfiguration}.
     */
    public static final class Builder extends OvalBuilder<ComparatorConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ComparatorConfiguration::new);
        }

        /**
         * The number of worker threads evaluating (station, dataset) units.
         * Optional. Cannot be null. Must be between 1 and 256. Defaults to 4.
         *
         * @param value The worker count.
         * @return This instance of {@link Builder}.
         */
        public Builder setWorkerCount(final Integer value) {
            _workerCount = value;
            return this;
        }

        /**
         * A dataset catalog file replacing the bundled catalog. Optional.
         *
         * @param value The catalog file.
         * @return This instance of {@link Builder}.
         */
        public Builder setDatasetCatalog(@Nullable final File value) {
            _datasetCatalog = value;
            return this;
        }

        /**
         * The ground observation file. Required. Cannot be null.
         *
         * @param value The ground observation file.
         * @return This instance of {@link Builder}.
         */
        public Builder setGroundDataFile(final File value) {
            _groundDataFile = value;
            return this;
        }

        /**
         * The station metadata file. Required. Cannot be null.
         *
         * @param value The station metadata file.
         * @return This instance of {@link Builder}.
         */
        public Builder setStationMetadataFile(final File value) {
            _stationMetadataFile = value;
            return this;
        }

        /**
         * The directory holding one file per gridded dataset. Required.
         * Cannot be null.
         *
         * @param value The gridded data directory.
         * @return This instance of {@link Builder}.
         */
        public Builder setGriddedDataDirectory(final File value) {
            _griddedDataDirectory = value;
            return this;
        }

        /**
         * The directory exported tables are written to. Required. Cannot be null.
         *
         * @param value The output directory.
         * @return This instance of {@link Builder}.
         */
        public Builder setOutputDirectory(final File value) {
            _outputDirectory = value;
            return this;
        }

        /**
         * The dataset names to compare. Optional. Cannot be null. Defaults
         * to empty, meaning every enabled dataset.
         *
         * @param value The dataset names.
         * @return This instance of {@link Builder}.
         */
        public Builder setDatasets(final ImmutableList<String> value) {
            _datasets = value;
            return this;
        }

        /**
         * The station identifiers to compare. Optional. Cannot be null.
         * Defaults to empty, meaning every station.
         *
         * @param value The station identifiers.
         * @return This instance of {@link Builder}.
         */
        public Builder setStations(final ImmutableList<String> value) {
            _stations = value;
            return this;
        }

        /**
         * The scales to compare at. Optional. Cannot be null or empty.
         * Defaults to every scale.
         *
         * @param value The scales.
         * @return This instance of {@link Builder}.
         */
        public Builder setScales(final ImmutableSet<TemporalScale> value) {
            _scales = value;
            return this;
        }

        /**
         * The first day of the analysis window. Required. Cannot be null.
         *
         * @param value The start date.
         * @return This instance of {@link Builder}.
         */
        public Builder setStartDate(final LocalDate value) {
            _startDate = value;
            return this;
        }

        /**
         * The last day of the analysis window. Required. Cannot be null.
         * Cannot be before the start date.
         *
         * @param value The end date.
         * @return This instance of {@link Builder}.
         */
        public Builder setEndDate(final LocalDate value) {
            _endDate = value;
            return this;
        }

        /**
         * The outlier trimming bounds. Optional. Cannot be null. Defaults
         * to {@link FilterConfiguration#defaults()}.
         *
         * @param value The filter configuration.
         * @return This instance of {@link Builder}.
         */
        public Builder setFilter(final FilterConfiguration value) {
            _filter = value;
            return this;
        }

        /**
         * The analysis options. Optional. Cannot be null. Defaults to
         * {@link AnalysisOptions#defaults()}.
         *
         * @param value The analysis options.
         * @return This instance of {@link Builder}.
         */
        public Builder setOptions(final AnalysisOptions value) {
            _options = value;
            return this;
        }

        /**
         * Pekko configuration. Optional. Cannot be null. By convention Pekko
         * configuration begins with a map containing a single key "pekko" and
         * a value of a nested map.
         *
         * NOTE: No validation is performed on the Pekko configuration itself.
         *
         * @param value The Pekko configuration.
         * @return This instance of {@link Builder}.
         */
        public Builder setPekkoConfiguration(final Map<String, ?> value) {
            _pekkoConfiguration = value;
            return this;
        }

        /**
         * How often the launcher logs run progress. Optional. Cannot be null.
         * Defaults to five seconds.
         *
         * @param value The interval.
         * @return This instance of {@link Builder}.
         */
        public Builder setProgressLogInterval(final Duration value) {
            _progressLogInterval = value;
            return this;
        }

        /**
         * Validate that the end date is not before the start date.
         *
         * @param endDate the configured end date
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateEndDate(final LocalDate endDate) {
            return _startDate == null || !endDate.isBefore(_startDate);
        }

        @NotNull
        @Range(min = 1, max = 256)
        private Integer _workerCount = 4;
        private File _datasetCatalog;
        @NotNull
        private File _groundDataFile;
        @NotNull
        private File _stationMetadataFile;
        @NotNull
        private File _griddedDataDirectory;
        @NotNull
        private File _outputDirectory;
        @NotNull
        private ImmutableList<String> _datasets = ImmutableList.of();
        @NotNull
        private ImmutableList<String> _stations = ImmutableList.of();
        @NotNull
        @NotEmpty
        private ImmutableSet<TemporalScale> _scales = ImmutableSet.copyOf(TemporalScale.values());
        @NotNull
        private LocalDate _startDate;
        @NotNull
        @ValidateWithMethod(methodName = "validateEndDate", parameterType = LocalDate.class)
        private LocalDate _endDate;
        @NotNull
        private FilterConfiguration _filter = FilterConfiguration.defaults();
        @NotNull
        private AnalysisOptions _options = AnalysisOptions.defaults();
        @NotNull
        private Map<String, ?> _pekkoConfiguration = Maps.newHashMap();
        @NotNull
        private Duration _progressLogInterval = Duration.ofSeconds(5);
    }
}
