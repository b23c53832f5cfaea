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

import java.time.Instant;
import java.util.Map;

/**
 * Immutable fact about a change of state of an aggregate.
 * <p>Within one aggregate's stream the versions start at 1 and increase by one without gaps. Events are value
 * objects, two events with equal attributes are equal.</p>
 *
 * @see Events
 */
public interface Event {
    String eventType();

    /**
     * Typed payload of the event.
     * @return the payload, or null if the event carries none
     */
    Object data();

    Instant timestamp();

    String aggregateType();

    ID aggregateId();

    int version();

    /**
     * Additional data attached to the event, like the issuer of causing command.
     * @return unmodifiable map, never null
     */
    Map<String, Object> metadata();
}
