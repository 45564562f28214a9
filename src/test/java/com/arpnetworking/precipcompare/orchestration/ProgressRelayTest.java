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

import com.arpnetworking.utility.BaseActorTest;
import org.apache.pekko.actor.ActorRef;
import org.apache.pekko.testkit.TestProbe;
import org.junit.Assert;
import org.junit.Test;
import scala.concurrent.duration.FiniteDuration;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link ProgressRelay}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class ProgressRelayTest extends BaseActorTest {

    @Test
    public void testRelaysToSubscribers() {
        final ActorRef relay = getSystem().actorOf(ProgressRelay.props());
        final TestProbe first = TestProbe.apply(getSystem());
        final TestProbe second = TestProbe.apply(getSystem());
        relay.tell(new ProgressRelay.Subscribe(first.ref()), ActorRef.noSender());
        relay.tell(new ProgressRelay.Subscribe(second.ref()), ActorRef.noSender());

        final UUID runId = UUID.randomUUID();
        relay.tell(new ProgressUpdate(runId, 1, 2, "S1/PRISM"), ActorRef.noSender());
        relay.tell(new RunCompleted(runId, false), ActorRef.noSender());

        for (final TestProbe probe : new TestProbe[]{first, second}) {
            final ProgressUpdate update = probe.expectMsgClass(PROBE_TIMEOUT, ProgressUpdate.class);
            Assert.assertEquals(runId, update.getRunId());
            Assert.assertEquals(1, update.getCompleted());
            Assert.assertEquals(2, update.getTotal());
            Assert.assertEquals("S1/PRISM", update.getLabel());
            Assert.assertEquals(relay, probe.sender());
            final RunCompleted completed = probe.expectMsgClass(PROBE_TIMEOUT, RunCompleted.class);
            Assert.assertFalse(completed.isCancelled());
        }
    }

    @Test
    public void testUnsubscribe() {
        final ActorRef relay = getSystem().actorOf(ProgressRelay.props());
        final TestProbe probe = TestProbe.apply(getSystem());
        relay.tell(new ProgressRelay.Subscribe(probe.ref()), ActorRef.noSender());
        relay.tell(new ProgressRelay.Unsubscribe(probe.ref()), ActorRef.noSender());

        relay.tell(new RunCompleted(UUID.randomUUID(), true), ActorRef.noSender());

        probe.expectNoMessage(QUIET_PERIOD);
    }

    @Test
    public void testTerminatedSubscriberDropped() {
        final ActorRef relay = getSystem().actorOf(ProgressRelay.props());
        final TestProbe stopped = TestProbe.apply(getSystem());
        final TestProbe remaining = TestProbe.apply(getSystem());
        relay.tell(new ProgressRelay.Subscribe(stopped.ref()), ActorRef.noSender());
        relay.tell(new ProgressRelay.Subscribe(remaining.ref()), ActorRef.noSender());
        getSystem().stop(stopped.ref());

        relay.tell(new RunCompleted(UUID.randomUUID(), false), ActorRef.noSender());

        remaining.expectMsgClass(PROBE_TIMEOUT, RunCompleted.class);
    }

    private static final FiniteDuration PROBE_TIMEOUT = FiniteDuration.apply(10, TimeUnit.SECONDS);
    private static final FiniteDuration QUIET_PERIOD = FiniteDuration.apply(200, TimeUnit.MILLISECONDS);
}
