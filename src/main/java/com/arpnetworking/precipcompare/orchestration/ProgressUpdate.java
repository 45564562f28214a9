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

import com.google.common.base.MoreObjects;

import java.util.UUID;

/**
 * Message published each time a (station, dataset) unit finishes.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class ProgressUpdate {

    /**
     * Public constructor.
     *
     * @param runId the run the unit belongs to
     * @param completed units finished so far, this one included
     * @param total units in the run
     * @param label the finished unit
     */
    public ProgressUpdate(final UUID runId, final int completed, final int total, final String label) {
        _runId = runId;
        _completed = completed;
        _total = total;
        _label = label;
    }

    public UUID getRunId() {
        return _runId;
    }

    public int getCompleted() {
        return _completed;
    }

    public int getTotal() {
        return _total;
    }

    public String getLabel() {
        return _label;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("RunId", _runId)
                .add("Completed", _completed)
                .add("Total", _total)
                .add("Label", _label)
                .toString();
    }

    private final UUID _runId;
    private final int _completed;
    private final int _total;
    private final String _label;
}
