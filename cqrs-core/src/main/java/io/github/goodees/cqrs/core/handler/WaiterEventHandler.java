package io.github.goodees.cqrs.core.handler;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.bus.EventMatcher;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event handler letting callers wait for events. Register it with a matcher of all events, then
 * {@link #listen(EventMatcher)} before issuing the command whose events should be waited for.
 */
public class WaiterEventHandler implements EventHandler {
    private final String handlerType = "waiter_" + UUID.randomUUID();
    private final Map<UUID, Listener> listeners = new ConcurrentHashMap<>();

    @Override
    public String handlerType() {
        return handlerType;
    }

    @Override
    public void handleEvent(Context ctx, Event event) {
        for (Listener listener : listeners.values()) {
            if (listener.matcher.match(event)) {
                listener.events.add(event);
            }
        }
    }

    public Listener listen(EventMatcher matcher) {
        Listener listener = new Listener(matcher);
        listeners.put(listener.id, listener);
        return listener;
    }

    /**
     * Events matched since the listener was created, until it is closed.
     */
    public class Listener implements AutoCloseable {
        private final UUID id = UUID.randomUUID();
        private final EventMatcher matcher;
        private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();

        Listener(EventMatcher matcher) {
            this.matcher = matcher;
        }

        /**
         * Wait for next matched event.
         * @param timeout maximal time to wait
         * @param unit unit of timeout
         * @return the event
         * @throws TimeoutException when no event matched in time
         * @throws InterruptedException when interrupted
         */
        public Event await(long timeout, TimeUnit unit) throws TimeoutException, InterruptedException {
            Event event = events.poll(timeout, unit);
            if (event == null) {
                throw new TimeoutException("No matching event within " + timeout + " " + unit);
            }
            return event;
        }

        @Override
        public void close() {
            listeners.remove(id);
        }
    }
}
