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

import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

/**
 * Tests for {@link Metric}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class MetricTest {

    @Test
    public void testFromKey() {
        for (final Metric metric : Metric.values()) {
            Assert.assertEquals(Optional.of(metric), Metric.fromKey(metric.getKey()));
        }
        Assert.assertFalse(Metric.fromKey("kge").isPresent());
    }

    @Test
    public void testPolarity() {
        Assert.assertEquals(Polarity.HIGHER_IS_BETTER, Metric.NSE.getPolarity());
        Assert.assertEquals(Polarity.LOWER_MAGNITUDE_IS_BETTER, Metric.PBIAS.getPolarity());
        Assert.assertEquals(Polarity.NEUTRAL, Metric.OBS_MEAN.getPolarity());
    }
}
