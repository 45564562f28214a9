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
package com.arpnetworking.hydrocore.filtering;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of trimming one metric distribution.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class TrimResult {

    TrimResult(final ImmutableList<Double> retained, final int dropped, final double threshold) {
        _retained = retained;
        _dropped = dropped;
        _threshold = threshold;
    }

    /**
     * Values kept, in input order, with their original sign.
     *
     * @return the retained values
     */
    public ImmutableList<Double> getRetained() {
        return _retained;
    }

    /**
     * Values removed, NaN values included.
     *
     * @return the dropped count
     */
    public int getDropped() {
        return _dropped;
    }

    /**
     * The cut applied; NaN when nothing was trimmed by rule.
     *
     * @return the threshold
     */
    public double getThreshold() {
        return _threshold;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Retained", _retained.size())
                .add("Dropped", _dropped)
                .add("Threshold", _threshold)
                .toString();
    }

    private final ImmutableList<Double> _retained;
    private final int _dropped;
    private final double _threshold;
}
