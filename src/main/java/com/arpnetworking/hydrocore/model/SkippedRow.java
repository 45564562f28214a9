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
package com.arpnetworking.hydrocore.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * A (station, dataset, scale) tuple that produced no metrics, with the reason.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class SkippedRow {

    public String getStationId() {
        return _stationId;
    }

    public String getDatasetName() {
        return _datasetName;
    }

    public TemporalScale getScale() {
        return _scale;
    }

    public SkipReason getReason() {
        return _reason;
    }

    public String getDetail() {
        return _detail;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final SkippedRow other = (SkippedRow) object;

        return Objects.equal(_stationId, other._stationId)
                && Objects.equal(_datasetName, other._datasetName)
                && _scale == other._scale
                && _reason == other._reason
                && Objects.equal(_detail, other._detail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_stationId, _datasetName, _scale, _reason, _detail);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("StationId", _stationId)
                .add("DatasetName", _datasetName)
                .add("Scale", _scale)
                .add("Reason", _reason)
                .add("Detail", _detail)
                .toString();
    }

    private SkippedRow(final Builder builder) {
        _stationId = builder._stationId;
        _datasetName = builder._datasetName;
        _scale = builder._scale;
        _reason = builder._reason;
        _detail = builder._detail;
    }

    private final String _stationId;
    private final String _datasetName;
    private final TemporalScale _scale;
    private final SkipReason _reason;
    private final String _detail;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SkippedRow}.
     */
    public static final class Builder extends OvalBuilder<SkippedRow> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SkippedRow::new);
        }

        /**
         * Set the station identifier. Required. Cannot be null or empty.
         *
         * @param value The station identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setStationId(final String value) {
            _stationId = value;
            return this;
        }

        /**
         * Set the dataset name. Required. Cannot be null or empty.
         *
         * @param value The dataset name.
         * @return This {@link Builder} instance.
         */
        public Builder setDatasetName(final String value) {
            _datasetName = value;
            return this;
        }

        /**
         * Set the scale. Required. Cannot be null.
         *
         * @param value The scale.
         * @return This {@link Builder} instance.
         */
        public Builder setScale(final TemporalScale value) {
            _scale = value;
            return this;
        }

        /**
         * Set the reason. Required. Cannot be null.
         *
         * @param value The reason.
         * @return This {@link Builder} instance.
         */
        public Builder setReason(final SkipReason value) {
            _reason = value;
            return this;
        }

        /**
         * Set a human readable detail. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The detail.
         * @return This {@link Builder} instance.
         */
        public Builder setDetail(final String value) {
            _detail = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _stationId;
        @NotNull
        @NotEmpty
        private String _datasetName;
        @NotNull
        private TemporalScale _scale;
        @NotNull
        private SkipReason _reason;
        @NotNull
        private String _detail = "";
    }
}
