package io.github.goodees.cqrs.core.repo;

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
import io.github.goodees.cqrs.core.Entity;
import io.github.goodees.cqrs.core.id.ID;

import java.util.List;

/**
 * Read access to read models. Scoped by the namespace of the context.
 * @param <T> type of entity
 */
public interface ReadRepo<T extends Entity> {

    /**
     * Find entity by id.
     * @param ctx context of the operation
     * @param id entity id
     * @return the entity
     * @throws RepoException with fault {@code ENTITY_NOT_FOUND} when there is no such entity
     */
    T find(Context ctx, ID id) throws RepoException;

    /**
     * All entities, in insertion order where the storage allows it.
     * @param ctx context of the operation
     * @return list of entities
     * @throws RepoException when the storage fails
     */
    List<T> findAll(Context ctx) throws RepoException;
}
