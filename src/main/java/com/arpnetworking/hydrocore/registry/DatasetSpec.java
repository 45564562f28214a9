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
package com.arpnetworking.hydrocore.registry;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.hydrocore.model.DateRange;
import com.arpnetworking.hydrocore.model.NativeResolution;
import com.arpnetworking.hydrocore.model.TemporalScale;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Catalog entry describing one gridded precipitation product. Behavioral
 * differences between products are expressed entirely as data here.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class DatasetSpec {

    public String getName() {
        return _name;
    }

    public Optional<String> getCollection() {
        return _collection;
    }

    public Optional<String> getVariable() {
        return _variable;
    }

    public NativeResolution getNativeResolution() {
        return _nativeResolution;
    }

    /**
     * Multiplier converting native units to millimeters.
     *
     * @return the conversion factor
     */
    public double getConversionFactor() {
        return _conversionFactor;
    }

    public DateRange getValidRange() {
        return _validRange;
    }

    public boolean isEnabled() {
        return _enabled;
    }

    public ImmutableSet<TemporalScale> getSupportedScales() {
        return _supportedScales;
    }

    /**
     * Whether the product can be compared at a scale. The scale must be
     * declared as supported and must not be finer than the native resolution.
     *
     * @param scale the requested scale
     * @return true if results can be produced at the scale
     */
    public boolean supports(final TemporalScale scale) {
        return _supportedScales.contains(scale) && _nativeResolution.supports(scale);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DatasetSpec other = (DatasetSpec) object;

        return Objects.equal(_name, other._name)
                && Objects.equal(_collection, other._collection)
                && Objects.equal(_variable, other._variable)
                && _nativeResolution == other._nativeResolution
                && Double.compare(_conversionFactor, other._conversionFactor) == 0
                && Objects.equal(_validRange, other._validRange)
                && _enabled == other._enabled
                && Objects.equal(_supportedScales, other._supportedScales);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _name,
                _collection,
                _variable,
                _nativeResolution,
                _conversionFactor,
                _validRange,
                _enabled,
                _supportedScales);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Name", _name)
                .add("Collection", _collection)
                .add("Variable", _variable)
                .add("NativeResolution", _nativeResolution)
                .add("ConversionFactor", _conversionFactor)
                .add("ValidRange", _validRange)
                .add("Enabled", _enabled)
                .add("SupportedScales", _supportedScales)
                .toString();
    }

    private DatasetSpec(final Builder builder) {
        _name = builder._name;
        _collection = Optional.ofNullable(builder._collection);
        _variable = Optional.ofNullable(builder._variable);
        _nativeResolution = builder._nativeResolution;
        _conversionFactor = builder._conversionFactor;
        _validRange = builder._validRange;
        _enabled = builder._enabled;
        _supportedScales = builder._supportedScales;
    }

    private final String _name;
    private final Optional<String> _collection;
    private final Optional<String> _variable;
    private final NativeResolution _nativeResolution;
    private final double _conversionFactor;
    private final DateRange _validRange;
    private final boolean _enabled;
    private final ImmutableSet<TemporalScale> _supportedScales;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DatasetSpec}.
     */
    public static final class Builder extends OvalBuilder<DatasetSpec> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DatasetSpec::new);
        }

        /**
         * Set the dataset name. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the source collection identifier. Optional.
         *
         * @param value The collection.
         * @return This {@link Builder} instance.
         */
        public Builder setCollection(@Nullable final String value) {
            _collection = value;
            return this;
        }

        /**
         * Set the source variable name. Optional.
         *
         * @param value The variable.
         * @return This {@link Builder} instance.
         */
        public Builder setVariable(@Nullable final String value) {
            _variable = value;
            return this;
        }

        /**
         * Set the native resolution. Required. Cannot be null.
         *
         * @param value The native resolution.
         * @return This {@link Builder} instance.
         */
        public Builder setNativeResolution(final NativeResolution value) {
            _nativeResolution = value;
            return this;
        }

        /**
         * Set the conversion factor to millimeters. Optional. Cannot be null.
         * Must be positive. Defaults to 1.
         *
         * @param value The conversion factor.
         * @return This {@link Builder} instance.
         */
        public Builder setConversionFactor(final Double value) {
            _conversionFactor = value;
            return this;
        }

        /**
         * Set the valid date range. Required. Cannot be null.
         *
         * @param value The valid range.
         * @return This {@link Builder} instance.
         */
        public Builder setValidRange(final DateRange value) {
            _validRange = value;
            return this;
        }

        /**
         * Set whether the dataset is enabled. Optional. Cannot be null. Defaults to true.
         *
         * @param value The enabled flag.
         * @return This {@link Builder} instance.
         */
        public Builder setEnabled(final Boolean value) {
            _enabled = value;
            return this;
        }

        /**
         * Set the supported scales. Required. Cannot be null or empty.
         *
         * @param value The supported scales.
         * @return This {@link Builder} instance.
         */
        public Builder setSupportedScales(final ImmutableSet<TemporalScale> value) {
            _supportedScales = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateConversionFactor(final Double value) {
            return value > 0 && !value.isInfinite();
        }

        @SuppressWarnings("unused")
        private boolean validateSupportedScales(final ImmutableSet<TemporalScale> value) {
            return !value.isEmpty();
        }

        @NotNull
        @NotEmpty
        private String _name;
        private String _collection;
        private String _variable;
        @NotNull
        private NativeResolution _nativeResolution;
        @NotNull
        @ValidateWithMethod(methodName = "validateConversionFactor", parameterType = Double.class)
        private Double _conversionFactor = 1.0;
        @NotNull
        private DateRange _validRange;
        @NotNull
        private Boolean _enabled = Boolean.TRUE;
        @NotNull
        @ValidateWithMethod(methodName = "validateSupportedScales", parameterType = ImmutableSet.class)
        private ImmutableSet<TemporalScale> _supportedScales;
    }
}
