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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.cqrs.core.id.ID;

import java.time.Instant;
import java.util.Map;

/**
 * Wire form of an event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
class EventEnvelope {
    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("data")
    JsonNode data;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("aggregate_type")
    String aggregateType;

    @JsonProperty("_id")
    ID aggregateId;

    @JsonProperty("version")
    int version;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("context")
    Map<String, Object> context;
}
