package io.github.goodees.cqrs.core.aggregate;

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
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.registry.AggregateRegistry;
import io.github.goodees.cqrs.core.registry.TypeNotRegisteredException;
import io.github.goodees.cqrs.core.store.EventStore;
import io.github.goodees.cqrs.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate store rebuilding {@link EventSourcedAggregate}s from their events.
 */
public class EventSourcingAggregateStore implements AggregateStore {
    private static final Logger logger = LoggerFactory.getLogger(EventSourcingAggregateStore.class);

    private final EventStore eventStore;
    private final AggregateRegistry registry;

    public EventSourcingAggregateStore(EventStore eventStore) {
        this(eventStore, AggregateRegistry.defaultRegistry());
    }

    public EventSourcingAggregateStore(EventStore eventStore, AggregateRegistry registry) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.registry = Objects.requireNonNull(registry, "Aggregate registry must be specified");
    }

    @Override
    public Aggregate load(Context ctx, String aggregateType, ID id)
            throws AggregateStoreException, EventStoreException {
        Aggregate aggregate;
        try {
            aggregate = registry.create(aggregateType, id);
        } catch (TypeNotRegisteredException e) {
            throw AggregateStoreException.notRegistered(aggregateType, id, e);
        }
        EventSourcedAggregate esa = eventSourced(aggregate);
        List<Event> events = eventStore.load(ctx, id);
        applyEvents(ctx, esa, events);
        logger.debug("Loaded {} {} at version {}", aggregateType, id, esa.aggregateVersion());
        return esa;
    }

    @Override
    public void save(Context ctx, Aggregate aggregate) throws AggregateStoreException, EventStoreException {
        EventSourcedAggregate esa = eventSourced(aggregate);
        AggregateBase base = esa.base();
        List<Event> events = base.uncommittedEvents();
        if (events.isEmpty()) {
            return;
        }
        eventStore.save(ctx, events, base.aggregateVersion());
        base.clearUncommittedEvents();
        applyEvents(ctx, esa, events);
    }

    private EventSourcedAggregate eventSourced(Aggregate aggregate) throws AggregateStoreException {
        if (!(aggregate instanceof EventSourcedAggregate)) {
            throw AggregateStoreException.notEventSourced(aggregate);
        }
        return (EventSourcedAggregate) aggregate;
    }

    private void applyEvents(Context ctx, EventSourcedAggregate aggregate, List<Event> events)
            throws AggregateStoreException {
        for (Event event : events) {
            if (!event.aggregateType().equals(aggregate.aggregateType())) {
                throw AggregateStoreException.mismatchedType(aggregate, event);
            }
            if (event.version() != aggregate.aggregateVersion() + 1) {
                throw AggregateStoreException.incorrectVersion(aggregate, event);
            }
            try {
                aggregate.applyEvent(ctx, event);
            } catch (Exception e) {
                throw AggregateStoreException.applyFailed(aggregate, event, e);
            }
            aggregate.base().setAggregateVersion(event.version());
        }
    }
}
