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
import io.github.goodees.cqrs.core.id.ID;

import java.util.List;

/**
 * Append-only, version ordered storage of aggregate event streams. All operations are scoped by the namespace of
 * the context.
 */
public interface EventStore {

    /**
     * Append events of single aggregate.
     * <p>The batch is stored as a whole or not at all. It must not be empty, all events must belong to same
     * aggregate and their versions must follow {@code originalVersion} without gaps. The batch is accepted only when
     * the last stored version of the stream equals {@code originalVersion}.</p>
     * @param ctx context of the operation
     * @param events events to store
     * @param originalVersion version of the aggregate the events were created from
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} when stream version differs, other faults
     *                             for invalid batches and storage failures
     */
    void save(Context ctx, List<Event> events, int originalVersion) throws EventStoreException;

    /**
     * Load all events of an aggregate.
     * @param ctx context of the operation
     * @param id aggregate id
     * @return events ordered by version, empty for unknown aggregate
     * @throws EventStoreException when the storage fails
     */
    List<Event> load(Context ctx, ID id) throws EventStoreException;
}
