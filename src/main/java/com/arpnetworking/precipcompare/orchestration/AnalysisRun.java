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
import com.google.common.collect.ImmutableList;
import org.apache.pekko.actor.ActorRef;

import java.time.Duration;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on a submitted analysis. Progress is queued for polling and, when a
 * relay is attached, pushed to it; neither path blocks the workers.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AnalysisRun {

    AnalysisRun(final int total, final Optional<ActorRef> relay) {
        _total = total;
        _relay = relay;
    }

    public UUID getId() {
        return _id;
    }

    public int getTotal() {
        return _total;
    }

    public int getCompleted() {
        return _completed.get();
    }

    /**
     * Take the oldest queued progress update.
     *
     * @return the update, or empty if none is queued
     */
    public Optional<ProgressUpdate> pollProgress() {
        return Optional.ofNullable(_progress.poll());
    }

    /**
     * Take every queued progress update.
     *
     * @return the updates in publication order
     */
    public ImmutableList<ProgressUpdate> drainProgress() {
        final ImmutableList.Builder<ProgressUpdate> updates = ImmutableList.builder();
        ProgressUpdate update = _progress.poll();
        while (update != null) {
            updates.add(update);
            update = _progress.poll();
        }
        return updates.build();
    }

    /**
     * Request cancellation. Units already running finish; units not yet
     * started are never run. Rows produced so far are kept.
     */
    public void cancel() {
        _cancelled.set(true);
    }

    public boolean isCancelled() {
        return _cancelled.get();
    }

    /**
     * Number of units skipped because cancellation arrived before they started.
     *
     * @return the abandoned unit count
     */
    public int getAbandoned() {
        return _abandoned.get();
    }

    public boolean isDone() {
        return _results.isDone();
    }

    /**
     * Block until every unit has finished or been abandoned.
     *
     * @return the results
     */
    public AnalysisResults awaitResults() {
        return _results.join();
    }

    /**
     * Block until every unit has finished or been abandoned, or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @return the results
     * @throws InterruptedException if the calling thread is interrupted
     * @throws TimeoutException if the run is still going when the timeout elapses
     */
    public AnalysisResults awaitResults(final Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return _results.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            throw new IllegalStateException("Analysis run failed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id)
                .add("Completed", _completed.get())
                .add("Total", _total)
                .add("Cancelled", _cancelled.get())
                .add("Abandoned", _abandoned.get())
                .add("Done", _results.isDone())
                .toString();
    }

    void unitCompleted(final String label) {
        final ProgressUpdate update = new ProgressUpdate(_id, _completed.incrementAndGet(), _total, label);
        _progress.offer(update);
        _relay.ifPresent(relay -> relay.tell(update, ActorRef.noSender()));
    }

    void unitAbandoned() {
        _abandoned.incrementAndGet();
    }

    void complete(final AnalysisResults results) {
        _results.complete(results);
        _relay.ifPresent(relay -> relay.tell(new RunCompleted(_id, results.isCancelled()), ActorRef.noSender()));
    }

    void fail(final Throwable cause) {
        _results.completeExceptionally(cause);
        _relay.ifPresent(relay -> relay.tell(new RunCompleted(_id, _abandoned.get() > 0), ActorRef.noSender()));
    }

    private final UUID _id = UUID.randomUUID();
    private final int _total;
    private final Optional<ActorRef> _relay;
    private final AtomicInteger _completed = new AtomicInteger();
    private final AtomicBoolean _cancelled = new AtomicBoolean();
    private final AtomicInteger _abandoned = new AtomicInteger();
    private final Queue<ProgressUpdate> _progress = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<AnalysisResults> _results = new CompletableFuture<>();
}
