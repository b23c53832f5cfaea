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
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.store.EventStoreException;

/**
 * Loading and saving of aggregates.
 */
public interface AggregateStore {

    /**
     * Load aggregate. Aggregate without any history is returned as new, with version 0.
     * @param ctx context of the operation
     * @param aggregateType type of aggregate
     * @param id aggregate id
     * @return the aggregate
     * @throws AggregateStoreException when the type is not registered or history cannot be applied
     * @throws EventStoreException when loading of history fails
     */
    Aggregate load(Context ctx, String aggregateType, ID id) throws AggregateStoreException, EventStoreException;

    /**
     * Persist uncommitted changes of the aggregate.
     * @param ctx context of the operation
     * @param aggregate the aggregate
     * @throws AggregateStoreException when stored events cannot be applied
     * @throws EventStoreException as thrown by event store, e.g. on concurrent modification
     */
    void save(Context ctx, Aggregate aggregate) throws AggregateStoreException, EventStoreException;
}
