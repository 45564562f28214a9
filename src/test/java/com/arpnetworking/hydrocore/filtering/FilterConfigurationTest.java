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

import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for {@link FilterConfiguration}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class FilterConfigurationTest {

    @Test
    public void testDefaults() {
        final FilterConfiguration configuration = FilterConfiguration.defaults();
        Assert.assertEquals(1.0, configuration.getLowerPercentile(), 0.0);
        Assert.assertEquals(99.0, configuration.getUpperPercentile(), 0.0);
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testLowerNotBelowUpper() {
        new FilterConfiguration.Builder()
                .setLowerPercentile(50.0)
                .setUpperPercentile(50.0)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testUpperAboveHundred() {
        new FilterConfiguration.Builder()
                .setUpperPercentile(100.5)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testNegativeLower() {
        new FilterConfiguration.Builder()
                .setLowerPercentile(-1.0)
                .build();
    }
}
