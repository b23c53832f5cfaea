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
import io.github.goodees.cqrs.core.Entity;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.Versionable;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.repo.ReadWriteRepo;
import io.github.goodees.cqrs.core.repo.RepoException;
import io.github.goodees.cqrs.core.repo.VersionRepo;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Event handler maintaining read models through a {@link Projector}.
 * <p>Events must be projected in order of their versions: an event is accepted only when the entity is in the
 * preceding version. Install sequencing middleware when the bus may reorder events. When created with a
 * {@link VersionRepo} and positive wait, the handler waits for the preceding version to become visible.</p>
 *
 * @param <T> type of entity
 */
public class ProjectorEventHandler<T extends Entity & Versionable> implements EventHandler {
    private final Projector<T> projector;
    private final ReadWriteRepo<T> repo;
    private final VersionRepo<T> versionRepo;
    private final Function<ID, T> entityFactory;
    private final long waitMillis;

    public ProjectorEventHandler(Projector<T> projector, ReadWriteRepo<T> repo, Function<ID, T> entityFactory) {
        this(projector, repo, null, entityFactory, 0);
    }

    /**
     * Create handler, that waits up to {@code waitMillis} for the preceding version of the read model to appear.
     * @param projector the projector
     * @param repo repository of read models
     * @param entityFactory creates the read model for the first event of an aggregate
     * @param waitMillis maximum wait for the preceding version
     */
    public ProjectorEventHandler(Projector<T> projector, VersionRepo<T> repo, Function<ID, T> entityFactory,
                                 long waitMillis) {
        this(projector, repo, repo, entityFactory, waitMillis);
    }

    private ProjectorEventHandler(Projector<T> projector, ReadWriteRepo<T> repo, VersionRepo<T> versionRepo,
                                  Function<ID, T> entityFactory, long waitMillis) {
        this.projector = Objects.requireNonNull(projector, "Projector must be specified");
        this.repo = Objects.requireNonNull(repo, "Repository must be specified");
        this.versionRepo = versionRepo;
        this.entityFactory = Objects.requireNonNull(entityFactory, "Entity factory must be specified");
        this.waitMillis = waitMillis;
    }

    @Override
    public String handlerType() {
        return projector.projectorType();
    }

    @Override
    public void handleEvent(Context ctx, Event event) throws ProjectorException, InterruptedException {
        T entity = load(ctx, event);
        if (entity.aggregateVersion() + 1 != event.version()) {
            throw ProjectorException.incorrectEntityVersion(event, ctx.namespace(), entity.aggregateVersion());
        }
        T projected;
        try {
            projected = projector.project(ctx, event, entity);
        } catch (Exception e) {
            throw ProjectorException.projectFailed(event, ctx.namespace(), e);
        }
        try {
            if (projected == null) {
                repo.remove(ctx, event.aggregateId());
            } else {
                if (projected.aggregateVersion() != event.version()) {
                    throw ProjectorException.incorrectProjectedVersion(event, ctx.namespace(),
                            projected.aggregateVersion());
                }
                repo.save(ctx, projected);
            }
        } catch (RepoException e) {
            throw ProjectorException.saveFailed(event, ctx.namespace(), e);
        }
    }

    private T load(Context ctx, Event event) throws ProjectorException, InterruptedException {
        try {
            if (versionRepo != null && waitMillis > 0 && event.version() > 1) {
                return versionRepo.findMinVersion(ctx, event.aggregateId(), event.version() - 1, waitMillis,
                        TimeUnit.MILLISECONDS);
            }
            return repo.find(ctx, event.aggregateId());
        } catch (RepoException e) {
            if (e.isNotFound()) {
                return entityFactory.apply(event.aggregateId());
            }
            throw ProjectorException.loadFailed(event, ctx.namespace(), e);
        }
    }
}
