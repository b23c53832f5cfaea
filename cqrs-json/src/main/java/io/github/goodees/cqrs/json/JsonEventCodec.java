package io.github.goodees.cqrs.json;

/*-
 * #%L
 * cqrs-json
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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.id.Ids;
import io.github.goodees.cqrs.core.registry.EventDataRegistry;
import io.github.goodees.cqrs.core.registry.TypeNotRegisteredException;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON codec of events and the context they are published with. Payloads are recreated as the class created by
 * the {@link EventDataRegistry} for the event type.
 */
public class JsonEventCodec {
    private final ObjectMapper mapper;
    private final EventDataRegistry registry;

    public JsonEventCodec() {
        this(JsonMappers.createMapper(), EventDataRegistry.defaultRegistry());
    }

    public JsonEventCodec(ObjectMapper mapper, EventDataRegistry registry) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.registry = Objects.requireNonNull(registry, "Event data registry must be specified");
    }

    public byte[] marshalEvent(Context ctx, Event event) throws IOException {
        EventEnvelope envelope = new EventEnvelope();
        envelope.eventType = event.eventType();
        envelope.data = event.data() == null ? null : mapper.valueToTree(event.data());
        envelope.timestamp = event.timestamp();
        envelope.aggregateType = event.aggregateType();
        envelope.aggregateId = event.aggregateId();
        envelope.version = event.version();
        envelope.metadata = event.metadata().isEmpty() ? null : event.metadata();
        envelope.context = ContextCodec.marshal(ctx);
        return mapper.writeValueAsBytes(envelope);
    }

    /**
     * Decode event.
     * @param bytes the JSON
     * @return event with its context
     * @throws IOException when the JSON is malformed
     * @throws TypeNotRegisteredException when the event carries payload of unregistered type
     */
    public Decoded<Event> unmarshalEvent(byte[] bytes) throws IOException, TypeNotRegisteredException {
        EventEnvelope envelope = mapper.readValue(bytes, EventEnvelope.class);
        if (envelope.eventType == null || envelope.eventType.isEmpty()) {
            throw new IOException("Event without event_type");
        }
        if (envelope.timestamp == null) {
            throw new IOException("Event " + envelope.eventType + " without timestamp");
        }
        Object data = null;
        if (envelope.data != null && !envelope.data.isNull()) {
            data = readData(envelope.eventType, envelope.data);
        }
        Event event = Events.newEventForAggregate(envelope.eventType, data, envelope.timestamp,
                envelope.aggregateType, envelope.aggregateId == null ? Ids.emptyId() : envelope.aggregateId,
                envelope.version, envelope.metadata);
        return new Decoded<>(ContextCodec.unmarshal(envelope.context), event);
    }

    private Object readData(String eventType, JsonNode node) throws IOException, TypeNotRegisteredException {
        Object prototype = registry.create(eventType);
        return mapper.treeToValue(node, prototype.getClass());
    }
}
