package io.github.goodees.cqrs.repo.inmemory;

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
import io.github.goodees.cqrs.core.repo.ReadWriteRepo;
import io.github.goodees.cqrs.core.repo.RepoException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Repository keeping entities in memory, one insertion ordered map per namespace. Entities are stored by
 * reference.
 * @param <T> type of entity
 */
public class InMemoryRepo<T extends Entity> implements ReadWriteRepo<T> {
    private final ConcurrentMap<String, Map<ID, T>> namespaces = new ConcurrentHashMap<>();

    @Override
    public T find(Context ctx, ID id) throws RepoException {
        Map<ID, T> entities = entities(ctx);
        synchronized (entities) {
            T entity = entities.get(id);
            if (entity == null) {
                throw RepoException.notFound(ctx.namespace(), id);
            }
            return entity;
        }
    }

    @Override
    public List<T> findAll(Context ctx) {
        Map<ID, T> entities = entities(ctx);
        synchronized (entities) {
            return new ArrayList<>(entities.values());
        }
    }

    @Override
    public void save(Context ctx, T entity) throws RepoException {
        ID id = entity.entityId();
        if (id == null || id.isEmpty()) {
            throw RepoException.missingId(ctx.namespace());
        }
        Map<ID, T> entities = entities(ctx);
        synchronized (entities) {
            entities.put(id, entity);
        }
    }

    @Override
    public void remove(Context ctx, ID id) throws RepoException {
        Map<ID, T> entities = entities(ctx);
        synchronized (entities) {
            if (entities.remove(id) == null) {
                throw RepoException.notFound(ctx.namespace(), id);
            }
        }
    }

    private Map<ID, T> entities(Context ctx) {
        return namespaces.computeIfAbsent(ctx.namespace(), ns -> new LinkedHashMap<>());
    }
}
