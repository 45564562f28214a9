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
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.BitSet;
import java.util.function.Predicate;

/**
 * Ground and gridded values on a shared period index, both in millimeters.
 * Each period is identified by its first day. A missing value on either
 * side is NaN and marks the period as a gap.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AlignedPair {

    public String getStationId() {
        return _stationId;
    }

    public String getDatasetName() {
        return _datasetName;
    }

    public TemporalScale getScale() {
        return _scale;
    }

    public ImmutableList<LocalDate> getPeriods() {
        return _periods;
    }

    /**
     * Number of periods on the shared index, gaps included.
     *
     * @return the number of periods
     */
    public int size() {
        return _periods.size();
    }

    public LocalDate getPeriod(final int index) {
        return _periods.get(index);
    }

    public double getGround(final int index) {
        return _ground[index];
    }

    public double getGridded(final int index) {
        return _gridded[index];
    }

    /**
     * Whether both sides carry a value for a period.
     *
     * @param index the period index
     * @return true if neither side is missing
     */
    public boolean isJointlyValid(final int index) {
        return !_gaps.get(index);
    }

    /**
     * Periods where at least one side is missing.
     *
     * @return a copy of the gap mask; a set bit marks a gap
     */
    public BitSet getGapMask() {
        return (BitSet) _gaps.clone();
    }

    public int getJointlyValidCount() {
        return _periods.size() - _gaps.cardinality();
    }

    /**
     * Ground values of the jointly-valid periods in index order.
     *
     * @return a new array of ground values
     */
    public double[] getValidGround() {
        return compact(_ground);
    }

    /**
     * Gridded values of the jointly-valid periods in index order.
     *
     * @return a new array of gridded values
     */
    public double[] getValidGridded() {
        return compact(_gridded);
    }

    /**
     * Restrict the pair to the periods accepted by a predicate, keeping the
     * index order.
     *
     * @param periodFilter predicate over the first day of each period
     * @return a new {@link AlignedPair}
     */
    public AlignedPair filter(final Predicate<LocalDate> periodFilter) {
        final ImmutableList.Builder<LocalDate> periods = ImmutableList.builder();
        final double[] ground = new double[_periods.size()];
        final double[] gridded = new double[_periods.size()];
        int count = 0;
        for (int i = 0; i < _periods.size(); ++i) {
            if (periodFilter.test(_periods.get(i))) {
                periods.add(_periods.get(i));
                ground[count] = _ground[i];
                gridded[count] = _gridded[i];
                ++count;
            }
        }
        return new Builder()
                .setStationId(_stationId)
                .setDatasetName(_datasetName)
                .setScale(_scale)
                .setPeriods(periods.build())
                .setGround(Arrays.copyOf(ground, count))
                .setGridded(Arrays.copyOf(gridded, count))
                .build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final AlignedPair other = (AlignedPair) object;

        return Objects.equal(_stationId, other._stationId)
                && Objects.equal(_datasetName, other._datasetName)
                && _scale == other._scale
                && Objects.equal(_periods, other._periods)
                && Arrays.equals(_ground, other._ground)
                && Arrays.equals(_gridded, other._gridded);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _stationId,
                _datasetName,
                _scale,
                _periods,
                Arrays.hashCode(_ground),
                Arrays.hashCode(_gridded));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("StationId", _stationId)
                .add("DatasetName", _datasetName)
                .add("Scale", _scale)
                .add("Periods", _periods.size())
                .add("JointlyValid", getJointlyValidCount())
                .toString();
    }

    private double[] compact(final double[] values) {
        final double[] result = new double[getJointlyValidCount()];
        int count = 0;
        for (int i = 0; i < values.length; ++i) {
            if (!_gaps.get(i)) {
                result[count++] = values[i];
            }
        }
        return result;
    }

    private AlignedPair(final Builder builder) {
        _stationId = builder._stationId;
        _datasetName = builder._datasetName;
        _scale = builder._scale;
        _periods = builder._periods;
        _ground = builder._ground.clone();
        _gridded = builder._gridded.clone();
        _gaps = new BitSet(_periods.size());
        for (int i = 0; i < _periods.size(); ++i) {
            if (Double.isNaN(_ground[i]) || Double.isNaN(_gridded[i])) {
                _gaps.set(i);
            }
        }
    }

    private final String _stationId;
    private final String _datasetName;
    private final TemporalScale _scale;
    private final ImmutableList<LocalDate> _periods;
    private final double[] _ground;
    private final double[] _gridded;
    private final BitSet _gaps;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AlignedPair}.
     */
    public static final class Builder extends OvalBuilder<AlignedPair> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AlignedPair::new);
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
         * Set the scale of the shared index. Required. Cannot be null.
         *
         * @param value The scale.
         * @return This {@link Builder} instance.
         */
        public Builder setScale(final TemporalScale value) {
            _scale = value;
            return this;
        }

        /**
         * Set the first day of each period. Required. Cannot be null.
         * Must be strictly increasing.
         *
         * @param value The periods.
         * @return This {@link Builder} instance.
         */
        public Builder setPeriods(final ImmutableList<LocalDate> value) {
            _periods = value;
            return this;
        }

        /**
         * Set the ground values, NaN where missing. Required. Cannot be null.
         * Must have one entry per period.
         *
         * @param value The ground values.
         * @return This {@link Builder} instance.
         */
        public Builder setGround(final double[] value) {
            _ground = value.clone();
            return this;
        }

        /**
         * Set the gridded values, NaN where missing. Required. Cannot be null.
         * Must have one entry per period.
         *
         * @param value The gridded values.
         * @return This {@link Builder} instance.
         */
        public Builder setGridded(final double[] value) {
            _gridded = value.clone();
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validatePeriods(final ImmutableList<LocalDate> periods) {
            for (int i = 1; i < periods.size(); ++i) {
                if (!periods.get(i).isAfter(periods.get(i - 1))) {
                    return false;
                }
            }
            return true;
        }

        @SuppressWarnings("unused")
        private boolean validateLength(final double[] values) {
            return _periods == null || values.length == _periods.size();
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
        @ValidateWithMethod(methodName = "validatePeriods", parameterType = ImmutableList.class)
        private ImmutableList<LocalDate> _periods;
        @NotNull
        @ValidateWithMethod(methodName = "validateLength", parameterType = double[].class)
        private double[] _ground;
        @NotNull
        @ValidateWithMethod(methodName = "validateLength", parameterType = double[].class)
        private double[] _gridded;
    }
}
