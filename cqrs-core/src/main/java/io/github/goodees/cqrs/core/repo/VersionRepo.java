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
import io.github.goodees.cqrs.core.Versionable;
import io.github.goodees.cqrs.core.id.ID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Repository of versioned entities, able to wait until an entity catches up with a version. Useful for reading
 * projections of events that might not have been projected yet.
 * @param <T> type of entity
 */
public class VersionRepo<T extends Entity & Versionable> implements ReadWriteRepo<T> {
    private static final Logger logger = LoggerFactory.getLogger(VersionRepo.class);
    private static final long INITIAL_DELAY_MILLIS = 5;
    private static final long MAX_DELAY_MILLIS = 500;

    private final ReadWriteRepo<T> delegate;

    public VersionRepo(ReadWriteRepo<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate repository must be specified");
    }

    @Override
    public T find(Context ctx, ID id) throws RepoException {
        return delegate.find(ctx, id);
    }

    /**
     * Find entity with at least given version, retrying with growing delay until the timeout elapses or the
     * context is cancelled.
     * @param ctx context of the operation
     * @param id entity id
     * @param minVersion minimal version
     * @param timeout how long to wait
     * @param unit unit of the timeout
     * @return entity with version at least {@code minVersion}
     * @throws RepoException with fault {@code ENTITY_NOT_FOUND} or {@code INCORRECT_ENTITY_VERSION} when the
     *                       entity does not reach the version in time
     * @throws InterruptedException when interrupted while waiting
     */
    public T findMinVersion(Context ctx, ID id, int minVersion, long timeout, TimeUnit unit)
            throws RepoException, InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        long delay = INITIAL_DELAY_MILLIS;
        while (true) {
            RepoException failure;
            try {
                T entity = delegate.find(ctx, id);
                if (entity.aggregateVersion() >= minVersion) {
                    return entity;
                }
                failure = RepoException.incorrectVersion(ctx.namespace(), id, minVersion, entity.aggregateVersion());
            } catch (RepoException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                failure = e;
            }
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0 || ctx.isCancelled()) {
                throw failure;
            }
            logger.debug("Entity {} not at version {} yet, retrying in {} ms", id, minVersion, delay);
            Thread.sleep(Math.min(delay, remaining));
            delay = Math.min(delay * 2, MAX_DELAY_MILLIS);
        }
    }

    @Override
    public List<T> findAll(Context ctx) throws RepoException {
        return delegate.findAll(ctx);
    }

    @Override
    public void save(Context ctx, T entity) throws RepoException {
        delegate.save(ctx, entity);
    }

    @Override
    public void remove(Context ctx, ID id) throws RepoException {
        delegate.remove(ctx, id);
    }
}
