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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.Sets;
import org.apache.pekko.actor.AbstractActor;
import org.apache.pekko.actor.ActorRef;
import org.apache.pekko.actor.Props;
import org.apache.pekko.actor.Terminated;

import java.util.Set;

/**
 * Fans run progress out to subscribed actors.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class ProgressRelay extends AbstractActor {
    /**
     * Creates a {@link Props} for construction in Pekko.
     *
     * @return A new {@link Props}.
     */
    public static Props props() {
        return Props.create(ProgressRelay.class, ProgressRelay::new);
    }

    /**
     * Public constructor.
     */
    public ProgressRelay() {
        LOGGER.debug()
                .setMessage("Progress relay starting up")
                .log();
    }

    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(Subscribe.class, subscribe -> {
                    if (_subscribers.add(subscribe.getSubscriber())) {
                        context().watch(subscribe.getSubscriber());
                    }
                })
                .match(Unsubscribe.class, unsubscribe -> {
                    if (_subscribers.remove(unsubscribe.getSubscriber())) {
                        context().unwatch(unsubscribe.getSubscriber());
                    }
                })
                .match(Terminated.class, terminated -> _subscribers.remove(terminated.actor()))
                .match(ProgressUpdate.class, this::relay)
                .match(RunCompleted.class, this::relay)
                .build();
    }

    private void relay(final Object message) {
        LOGGER.trace()
                .setMessage("Relaying progress")
                .addData("message", message)
                .addData("subscribers", _subscribers.size())
                .log();
        for (final ActorRef subscriber : _subscribers) {
            subscriber.tell(message, self());
        }
    }

    private final Set<ActorRef> _subscribers = Sets.newLinkedHashSet();
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressRelay.class);

    /**
     * Message to start receiving progress.
     */
    public static final class Subscribe {
        /**
         * Public constructor.
         *
         * @param subscriber the actor to receive progress
         */
        public Subscribe(final ActorRef subscriber) {
            _subscriber = subscriber;
        }

        public ActorRef getSubscriber() {
            return _subscriber;
        }

        private final ActorRef _subscriber;
    }

    /**
     * Message to stop receiving progress.
     */
    public static final class Unsubscribe {
        /**
         * Public constructor.
         *
         * @param subscriber the actor to remove
         */
        public Unsubscribe(final ActorRef subscriber) {
            _subscriber = subscriber;
        }

        public ActorRef getSubscriber() {
            return _subscriber;
        }

        private final ActorRef _subscriber;
    }
}
