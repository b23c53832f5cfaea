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

import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.id.ID;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Identity, version and buffer of uncommitted events of an event sourced aggregate. Not thread safe, an aggregate
 * instance is owned by the task handling it.
 */
public final class AggregateBase {
    private final String aggregateType;
    private final ID id;
    private int version;
    private final List<Event> uncommitted = new ArrayList<>();

    public AggregateBase(String aggregateType, ID id) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.id = Objects.requireNonNull(id, "Aggregate id must be specified");
    }

    public String aggregateType() {
        return aggregateType;
    }

    public ID entityId() {
        return id;
    }

    public int aggregateVersion() {
        return version;
    }

    public void setAggregateVersion(int version) {
        this.version = version;
    }

    /**
     * Append new event to the uncommitted ones. The event gets next free version, counting events already buffered.
     * @param eventType type of the event
     * @param data payload
     * @param timestamp time of the event
     * @return the appended event
     */
    public Event appendEvent(String eventType, Object data, Instant timestamp) {
        return appendEvent(eventType, data, timestamp, Collections.emptyMap());
    }

    public Event appendEvent(String eventType, Object data, Instant timestamp, Map<String, ?> metadata) {
        Event event = Events.newEventForAggregate(eventType, data, timestamp, aggregateType, id,
                version + uncommitted.size() + 1, metadata);
        uncommitted.add(event);
        return event;
    }

    public List<Event> uncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommitted));
    }

    public int uncommittedCount() {
        return uncommitted.size();
    }

    public void clearUncommittedEvents() {
        uncommitted.clear();
    }

    /**
     * Drop uncommitted events appended after first {@code count} ones.
     * @param count number of events to keep
     */
    public void discardUncommittedEventsFrom(int count) {
        if (count < uncommitted.size()) {
            uncommitted.subList(count, uncommitted.size()).clear();
        }
    }

    @Override
    public String toString() {
        return aggregateType + "[" + id + "@" + version + ", uncommitted=" + uncommitted + "]";
    }
}
