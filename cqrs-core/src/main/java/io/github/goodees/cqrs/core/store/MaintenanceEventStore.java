package io.github.goodees.cqrs.core.store;

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
 * Event store offering operations for maintenance of stored history. Not to be used in regular command
 * processing.
 */
public interface MaintenanceEventStore extends EventStore {

    /**
     * Replace stored event having same aggregate id and version.
     * @param ctx context of the operation
     * @param event the replacement
     * @throws EventStoreException with fault {@code AGGREGATE_NOT_FOUND} or {@code EVENT_NOT_FOUND}
     */
    void replace(Context ctx, Event event) throws EventStoreException;

    /**
     * Rename all events of one type within the namespace of the context.
     * @param ctx context of the operation
     * @param from current event type
     * @param to new event type
     * @throws EventStoreException when the storage fails
     */
    void renameEvent(Context ctx, String from, String to) throws EventStoreException;
}
