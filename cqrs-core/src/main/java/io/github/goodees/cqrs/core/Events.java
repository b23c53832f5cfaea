package io.github.goodees.cqrs.core;

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

import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factories of {@link Event} values.
 */
public final class Events {
    private Events() {
    }

    /**
     * Create event not bound to any aggregate, e.g. scheduled or external notification.
     * @param eventType type of event
     * @param data payload, may be null
     * @param timestamp when the event happened
     * @return new event with empty aggregate id and version 0
     */
    public static Event newEvent(String eventType, Object data, Instant timestamp) {
        return new EventValue(eventType, data, timestamp, "", Ids.emptyId(), 0, Collections.emptyMap());
    }

    public static Event newEventForAggregate(String eventType, Object data, Instant timestamp,
                                             String aggregateType, ID aggregateId, int version) {
        return newEventForAggregate(eventType, data, timestamp, aggregateType, aggregateId, version,
                Collections.emptyMap());
    }

    public static Event newEventForAggregate(String eventType, Object data, Instant timestamp,
                                             String aggregateType, ID aggregateId, int version,
                                             Map<String, ?> metadata) {
        return new EventValue(eventType, data, timestamp, aggregateType, aggregateId, version, copy(metadata));
    }

    /**
     * Copy of the event with additional metadata. Existing keys are overwritten.
     * @param event the original event
     * @param metadata metadata to add
     * @return new event
     */
    public static Event withMetadata(Event event, Map<String, ?> metadata) {
        Map<String, Object> merged = new LinkedHashMap<>(event.metadata());
        merged.putAll(metadata);
        return new EventValue(event.eventType(), event.data(), event.timestamp(), event.aggregateType(),
                event.aggregateId(), event.version(), Collections.unmodifiableMap(merged));
    }

    /**
     * Copy of the event under different type.
     * @param event the original event
     * @param eventType new type
     * @return new event
     */
    public static Event withEventType(Event event, String eventType) {
        return new EventValue(eventType, event.data(), event.timestamp(), event.aggregateType(),
                event.aggregateId(), event.version(), event.metadata());
    }

    private static Map<String, Object> copy(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static final class EventValue implements Event {
        private final String eventType;
        private final Object data;
        private final Instant timestamp;
        private final String aggregateType;
        private final ID aggregateId;
        private final int version;
        private final Map<String, Object> metadata;

        EventValue(String eventType, Object data, Instant timestamp, String aggregateType, ID aggregateId,
                   int version, Map<String, Object> metadata) {
            this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
            this.data = data;
            this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
            this.aggregateType = aggregateType == null ? "" : aggregateType;
            this.aggregateId = aggregateId == null ? Ids.emptyId() : aggregateId;
            this.version = version;
            this.metadata = metadata;
        }

        @Override
        public String eventType() {
            return eventType;
        }

        @Override
        public Object data() {
            return data;
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String aggregateType() {
            return aggregateType;
        }

        @Override
        public ID aggregateId() {
            return aggregateId;
        }

        @Override
        public int version() {
            return version;
        }

        @Override
        public Map<String, Object> metadata() {
            return metadata;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof EventValue)) {
                return false;
            }
            EventValue that = (EventValue) o;
            return version == that.version
                    && eventType.equals(that.eventType)
                    && Objects.equals(data, that.data)
                    && timestamp.equals(that.timestamp)
                    && aggregateType.equals(that.aggregateType)
                    && aggregateId.equals(that.aggregateId)
                    && metadata.equals(that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(eventType, data, timestamp, aggregateType, aggregateId, version, metadata);
        }

        @Override
        public String toString() {
            return eventType + "@" + version;
        }
    }
}
