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
package com.arpnetworking.hydrocore.statistics;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Agreement metrics between a ground series (observed) and a gridded
 * series (predicted).
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum Metric {
    R2("r2", Polarity.HIGHER_IS_BETTER),
    RMSE("rmse", Polarity.LOWER_MAGNITUDE_IS_BETTER),
    MAE("mae", Polarity.LOWER_MAGNITUDE_IS_BETTER),
    BIAS("bias", Polarity.LOWER_MAGNITUDE_IS_BETTER),
    PBIAS("pbias", Polarity.LOWER_MAGNITUDE_IS_BETTER),
    NSE("nse", Polarity.HIGHER_IS_BETTER),
    CORR("corr", Polarity.HIGHER_IS_BETTER),
    OBS_MEAN("obs_mean", Polarity.NEUTRAL),
    PRED_MEAN("pred_mean", Polarity.NEUTRAL),
    REL_BIAS("rel_bias", Polarity.NEUTRAL),
    REL_RMSE("rel_rmse", Polarity.NEUTRAL);

    Metric(final String key, final Polarity polarity) {
        _key = key;
        _polarity = polarity;
    }

    /**
     * The column name used in exported tables.
     *
     * @return the key
     */
    public String getKey() {
        return _key;
    }

    public Polarity getPolarity() {
        return _polarity;
    }

    /**
     * Look up a metric by its key.
     *
     * @param key the key
     * @return the metric, or empty if the key is unknown
     */
    public static Optional<Metric> fromKey(final String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    private final String _key;
    private final Polarity _polarity;

    private static final ImmutableMap<String, Metric> BY_KEY;

    static {
        final ImmutableMap.Builder<String, Metric> builder = ImmutableMap.builder();
        for (final Metric metric : values()) {
            builder.put(metric._key, metric);
        }
        BY_KEY = builder.build();
    }
}
