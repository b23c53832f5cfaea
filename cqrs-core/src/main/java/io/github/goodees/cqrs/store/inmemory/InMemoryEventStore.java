package io.github.goodees.cqrs.store.inmemory;

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
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.store.EventStoreException;
import io.github.goodees.cqrs.core.store.MaintenanceEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event store keeping streams in memory. Each namespace has its own lock for the compare and append of a save.
 * <p>Optionally, stored events are passed to an event handler, typically an event bus, after they are stored.</p>
 */
public class InMemoryEventStore implements MaintenanceEventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, Namespace> namespaces = new ConcurrentHashMap<>();
    private final EventHandler eventHandler;

    public InMemoryEventStore() {
        this(null);
    }

    /**
     * Create store publishing stored events.
     * @param eventHandler handler to pass stored events to, or null
     */
    public InMemoryEventStore(EventHandler eventHandler) {
        this.eventHandler = eventHandler;
    }

    @Override
    public void save(Context ctx, List<Event> events, int originalVersion) throws EventStoreException {
        String ns = ctx.namespace();
        if (events == null || events.isEmpty()) {
            throw EventStoreException.noEvents(ns);
        }
        ID id = events.get(0).aggregateId();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            if (!event.aggregateId().equals(id)) {
                throw EventStoreException.multipleAggregates(ns, id, event);
            }
            if (event.version() != originalVersion + i + 1) {
                throw EventStoreException.nonMonotonic(ns, id, originalVersion + i + 1, event);
            }
        }
        List<Event> batch = new ArrayList<>(events);
        Namespace namespace = namespace(ns);
        namespace.lock.lock();
        try {
            List<Event> stream = namespace.streams.get(id);
            int currentVersion = stream == null || stream.isEmpty() ? 0 : stream.get(stream.size() - 1).version();
            if (currentVersion != originalVersion) {
                throw EventStoreException.optimisticLock(ns, id, originalVersion, currentVersion);
            }
            namespace.streams.computeIfAbsent(id, k -> new ArrayList<>()).addAll(batch);
        } finally {
            namespace.lock.unlock();
        }
        logger.debug("Stored {} events of {} in namespace {}", batch.size(), id, ns);
        publish(ctx, batch);
    }

    private void publish(Context ctx, List<Event> events) throws EventStoreException {
        if (eventHandler == null) {
            return;
        }
        for (Event event : events) {
            try {
                eventHandler.handleEvent(ctx, event);
            } catch (Exception e) {
                throw EventStoreException.handlerFailed(ctx.namespace(), event, e);
            }
        }
    }

    @Override
    public List<Event> load(Context ctx, ID id) {
        Namespace namespace = namespace(ctx.namespace());
        namespace.lock.lock();
        try {
            List<Event> stream = namespace.streams.get(id);
            return stream == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(stream));
        } finally {
            namespace.lock.unlock();
        }
    }

    @Override
    public void replace(Context ctx, Event event) throws EventStoreException {
        String ns = ctx.namespace();
        Namespace namespace = namespace(ns);
        namespace.lock.lock();
        try {
            List<Event> stream = namespace.streams.get(event.aggregateId());
            if (stream == null) {
                throw EventStoreException.aggregateNotFound(ns, event.aggregateId());
            }
            for (int i = 0; i < stream.size(); i++) {
                if (stream.get(i).version() == event.version()) {
                    stream.set(i, event);
                    return;
                }
            }
            throw EventStoreException.eventNotFound(ns, event);
        } finally {
            namespace.lock.unlock();
        }
    }

    @Override
    public void renameEvent(Context ctx, String from, String to) {
        Namespace namespace = namespace(ctx.namespace());
        int renamed = 0;
        namespace.lock.lock();
        try {
            for (List<Event> stream : namespace.streams.values()) {
                for (int i = 0; i < stream.size(); i++) {
                    Event event = stream.get(i);
                    if (event.eventType().equals(from)) {
                        stream.set(i, Events.withEventType(event, to));
                        renamed++;
                    }
                }
            }
        } finally {
            namespace.lock.unlock();
        }
        logger.info("Renamed {} events from {} to {} in namespace {}", renamed, from, to, ctx.namespace());
    }

    private Namespace namespace(String ns) {
        return namespaces.computeIfAbsent(ns, k -> new Namespace());
    }

    private static class Namespace {
        final ReentrantLock lock = new ReentrantLock();
        final Map<ID, List<Event>> streams = new HashMap<>();
    }
}
