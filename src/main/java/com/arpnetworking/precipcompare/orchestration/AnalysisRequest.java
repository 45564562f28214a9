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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.hydrocore.filtering.FilterConfiguration;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.Station;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.precipcompare.configuration.AnalysisOptions;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * What to compare: the stations, the datasets, the scales and the window,
 * together with the trimming bounds and the analysis options.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AnalysisRequest {

    public ImmutableList<Station> getStations() {
        return _stations;
    }

    public ImmutableList<String> getDatasets() {
        return _datasets;
    }

    public ImmutableSet<TemporalScale> getScales() {
        return _scales;
    }

    public DateRange getWindow() {
        return _window;
    }

    public FilterConfiguration getFilter() {
        return _filter;
    }

    public AnalysisOptions getOptions() {
        return _options;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Stations", _stations.size())
                .add("Datasets", _datasets)
                .add("Scales", _scales)
                .add("Window", _window)
                .add("Filter", _filter)
                .add("Options", _options)
                .toString();
    }

    private AnalysisRequest(final Builder builder) {
        _stations = builder._stations;
        _datasets = builder._datasets;
        _scales = builder._scales;
        _window = builder._window;
        _filter = builder._filter;
        _options = builder._options;
    }

    private final ImmutableList<Station> _stations;
    private final ImmutableList<String> _datasets;
    private final ImmutableSet<TemporalScale> _scales;
    private final DateRange _window;
    private final FilterConfiguration _filter;
    private final AnalysisOptions _options;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AnalysisRequest}.
     */
    public static final class Builder extends OvalBuilder<AnalysisRequest> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnalysisRequest::new);
        }

        /**
         * Set the stations. Required. Cannot be null or empty.
         *
         * @param value The stations.
         * @return This {@link Builder} instance.
         */
        public Builder setStations(final ImmutableList<Station> value) {
            _stations = value;
            return this;
        }

        /**
         * Set the dataset names. Required. Cannot be null or empty.
         *
         * @param value The dataset names.
         * @return This {@link Builder} instance.
         */
        public Builder setDatasets(final ImmutableList<String> value) {
            _datasets = value;
            return this;
        }

        /**
         * Set the scales. Required. Cannot be null or empty.
         *
         * @param value The scales.
         * @return This {@link Builder} instance.
         */
        public Builder setScales(final ImmutableSet<TemporalScale> value) {
            _scales = value;
            return this;
        }

        /**
         * Set the analysis window. Required. Cannot be null.
         *
         * @param value The window.
         * @return This {@link Builder} instance.
         */
        public Builder setWindow(final DateRange value) {
            _window = value;
            return this;
        }

        /**
         * Set the trimming bounds. Optional. Cannot be null. Defaults to
         * {@link FilterConfiguration#defaults()}.
         *
         * @param value The filter configuration.
         * @return This {@link Builder} instance.
         */
        public Builder setFilter(final FilterConfiguration value) {
            _filter = value;
            return this;
        }

        /**
         * Set the analysis options. Optional. Cannot be null. Defaults to
         * {@link AnalysisOptions#defaults()}.
         *
         * @param value The options.
         * @return This {@link Builder} instance.
         */
        public Builder setOptions(final AnalysisOptions value) {
            _options = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private ImmutableList<Station> _stations;
        @NotNull
        @NotEmpty
        private ImmutableList<String> _datasets;
        @NotNull
        @NotEmpty
        private ImmutableSet<TemporalScale> _scales;
        @NotNull
        private DateRange _window;
        @NotNull
        private FilterConfiguration _filter = FilterConfiguration.defaults();
        @NotNull
        private AnalysisOptions _options = AnalysisOptions.defaults();
    }
}
