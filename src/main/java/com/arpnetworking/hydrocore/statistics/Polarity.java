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

/**
 * The direction in which a metric improves. Determines which tail of the
 * cross-station distribution is trimmed.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum Polarity {
    /**
     * Larger values are better; only the low tail is trimmed.
     */
    HIGHER_IS_BETTER,
    /**
     * Values closer to zero are better; only large magnitudes are trimmed.
     */
    LOWER_MAGNITUDE_IS_BETTER,
    /**
     * Descriptive values with no preferred direction; never trimmed.
     */
    NEUTRAL
}
