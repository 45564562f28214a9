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
 * Message published once a run has finished or has drained after cancellation.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class RunCompleted {

    /**
     * Public constructor.
     *
     * @param runId the run
     * @param cancelled whether the run was cancelled
     */
    public RunCompleted(final UUID runId, final boolean cancelled) {
        _runId = runId;
        _cancelled = cancelled;
    }

    public UUID getRunId() {
        return _runId;
    }

    public boolean isCancelled() {
        return _cancelled;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("RunId", _runId)
                .add("Cancelled", _cancelled)
                .toString();
    }

    private final UUID _runId;
    private final boolean _cancelled;
}
