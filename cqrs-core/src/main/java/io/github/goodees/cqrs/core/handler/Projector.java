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

/**
 * Projection of events of an aggregate into a read model entity.
 * @param <T> type of entity
 * @see ProjectorEventHandler
 */
public interface Projector<T> {

    String projectorType();

    /**
     * Apply an event to the entity.
     * @param ctx context of the event
     * @param event the event
     * @param entity current state of entity, new one for the first event of the aggregate
     * @return the entity in version of the event, or null to remove the entity
     * @throws Exception when the event cannot be projected
     */
    T project(Context ctx, Event event, T entity) throws Exception;
}
