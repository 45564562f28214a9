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
package com.arpnetworking.hydrocore.aggregation;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Minimum coverage of jointly-valid sub-periods required before a coarser
 * period is populated.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class CompletenessRule {

    /**
     * Create a rule requiring a fraction of the expected sub-periods.
     *
     * @param threshold fraction in (0, 1]
     * @return a new {@link CompletenessRule}
     */
    public static CompletenessRule fraction(final double threshold) {
        return new Builder().setMode(Mode.FRACTION).setThreshold(threshold).build();
    }

    /**
     * Create a rule requiring an absolute number of sub-periods.
     *
     * @param threshold minimum count, at least 1
     * @return a new {@link CompletenessRule}
     */
    public static CompletenessRule count(final int threshold) {
        return new Builder().setMode(Mode.COUNT).setThreshold((double) threshold).build();
    }

    public Mode getMode() {
        return _mode;
    }

    public double getThreshold() {
        return _threshold;
    }

    /**
     * Whether a period meets the rule.
     *
     * @param valid number of jointly-valid sub-periods
     * @param expected number of sub-periods the period spans
     * @return true if the period may be populated
     */
    public boolean isSatisfied(final int valid, final int expected) {
        if (expected <= 0 || valid <= 0) {
            return false;
        }
        if (_mode == Mode.COUNT) {
            return valid >= _threshold;
        }
        return (double) valid / expected >= _threshold;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final CompletenessRule other = (CompletenessRule) object;

        return _mode == other._mode
                && Double.compare(_threshold, other._threshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_mode, _threshold);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Mode", _mode)
                .add("Threshold", _threshold)
                .toString();
    }

    private CompletenessRule(final Builder builder) {
        _mode = builder._mode;
        _threshold = builder._threshold;
    }

    private final Mode _mode;
    private final double _threshold;

    /**
     * How the threshold is interpreted.
     */
    public enum Mode {
        /**
         * Threshold is the minimum fraction of expected sub-periods.
         */
        FRACTION,
        /**
         * Threshold is the minimum number of sub-periods.
         */
        COUNT
    }

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CompletenessRule}.
     */
    public static final class Builder extends OvalBuilder<CompletenessRule> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CompletenessRule::new);
        }

        /**
         * Set the mode. Optional. Cannot be null. Defaults to {@link Mode#FRACTION}.
         *
         * @param value The mode.
         * @return This {@link Builder} instance.
         */
        public Builder setMode(final Mode value) {
            _mode = value;
            return this;
        }

        /**
         * Set the threshold. Required. Cannot be null. A fraction must lie in
         * (0, 1]; a count must be a whole number of at least 1.
         *
         * @param value The threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setThreshold(final Double value) {
            _threshold = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateThreshold(final Double value) {
            if (_mode == Mode.COUNT) {
                return value >= 1 && value == Math.rint(value);
            }
            return value > 0 && value <= 1;
        }

        @NotNull
        private Mode _mode = Mode.FRACTION;
        @NotNull
        @ValidateWithMethod(methodName = "validateThreshold", parameterType = Double.class)
        private Double _threshold;
    }
}
