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

/**
 * Write access to read models. Scoped by the namespace of the context.
 * @param <T> type of entity
 */
public interface WriteRepo<T extends Entity> {

    /**
     * Save an entity, overwriting existing one with same id.
     * @param ctx context of the operation
     * @param entity the entity
     * @throws RepoException with fault {@code MISSING_ENTITY_ID} for entity with empty id
     */
    void save(Context ctx, T entity) throws RepoException;

    /**
     * Remove an entity.
     * @param ctx context of the operation
     * @param id id of the entity
     * @throws RepoException with fault {@code ENTITY_NOT_FOUND} when there is no such entity
     */
    void remove(Context ctx, ID id) throws RepoException;
}
