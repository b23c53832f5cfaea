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
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.VersionedModel;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;
import io.github.goodees.cqrs.core.repo.RepoException;
import io.github.goodees.cqrs.core.repo.VersionRepo;
import io.github.goodees.cqrs.repo.inmemory.InMemoryRepo;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.*;

public class ProjectorEventHandlerTest {
    private final Context ctx = Context.background();
    private final VersionRepo<VersionedModel> repo = new VersionRepo<>(new InMemoryRepo<>());

    /**
     * Appends event payloads to content, removes the model on "Deleted".
     */
    static class ContentProjector implements Projector<VersionedModel> {
        @Override
        public String projectorType() {
            return "content";
        }

        @Override
        public VersionedModel project(Context ctx, Event event, VersionedModel entity) {
            if ("Deleted".equals(event.eventType())) {
                return null;
            }
            if ("Broken".equals(event.eventType())) {
                return new VersionedModel(entity.entityId(), event.version() + 1, "broken");
            }
            return new VersionedModel(entity.entityId(), event.version(), entity.getContent() + event.data());
        }
    }

    private final ProjectorEventHandler<VersionedModel> handler =
            new ProjectorEventHandler<>(new ContentProjector(), repo, VersionedModel::new);

    private static Event event(String type, ID id, int version, String data) {
        return Events.newEventForAggregate(type, data, Instant.now(), "Doc", id, version);
    }

    @Test
    public void events_are_projected_in_sequence() throws Exception {
        ID id = Ids.newId();
        handler.handleEvent(ctx, event("Written", id, 1, "a"));
        handler.handleEvent(ctx, event("Written", id, 2, "b"));
        VersionedModel model = repo.find(ctx, id);
        assertEquals("ab", model.getContent());
        assertEquals(2, model.aggregateVersion());
        assertEquals("content", handler.handlerType());
    }

    @Test
    public void event_out_of_sequence_is_refused() throws Exception {
        ID id = Ids.newId();
        handler.handleEvent(ctx, event("Written", id, 1, "a"));
        try {
            handler.handleEvent(ctx, event("Written", id, 3, "c"));
            fail("Version 2 is missing");
        } catch (ProjectorException e) {
            assertEquals(ProjectorException.Fault.INCORRECT_ENTITY_VERSION, e.getFault());
        }
        assertEquals(1, repo.find(ctx, id).aggregateVersion());
    }

    @Test
    public void null_projection_removes_model() throws Exception {
        ID id = Ids.newId();
        handler.handleEvent(ctx, event("Written", id, 1, "a"));
        handler.handleEvent(ctx, event("Deleted", id, 2, null));
        try {
            repo.find(ctx, id);
            fail("Model is removed");
        } catch (RepoException e) {
            assertTrue(e.isNotFound());
        }
    }

    @Test
    public void projected_version_must_match_event() throws Exception {
        ID id = Ids.newId();
        try {
            handler.handleEvent(ctx, event("Broken", id, 1, null));
            fail("Projector returned wrong version");
        } catch (ProjectorException e) {
            assertEquals(ProjectorException.Fault.INCORRECT_PROJECTED_VERSION, e.getFault());
        }
    }

    @Test
    public void projector_failure_is_wrapped() throws Exception {
        ProjectorEventHandler<VersionedModel> failing = new ProjectorEventHandler<>(new ContentProjector() {
            @Override
            public VersionedModel project(Context ctx, Event event, VersionedModel entity) {
                throw new IllegalStateException("cannot project");
            }
        }, repo, VersionedModel::new);
        try {
            failing.handleEvent(ctx, event("Written", Ids.newId(), 1, "a"));
            fail("Projector fails");
        } catch (ProjectorException e) {
            assertEquals(ProjectorException.Fault.PROJECT_FAILED, e.getFault());
            assertEquals("cannot project", e.getCause().getMessage());
        }
    }

    @Test
    public void waits_for_preceding_version() throws Exception {
        ProjectorEventHandler<VersionedModel> waiting =
                new ProjectorEventHandler<>(new ContentProjector(), repo, VersionedModel::new, 2000);
        ID id = Ids.newId();
        Thread late = new Thread(() -> {
            try {
                Thread.sleep(100);
                repo.save(ctx, new VersionedModel(id, 1, "a"));
            } catch (InterruptedException | RepoException e) {
                throw new IllegalStateException(e);
            }
        });
        late.start();
        waiting.handleEvent(ctx, event("Written", id, 2, "b"));
        late.join();
        assertEquals("ab", repo.find(ctx, id).getContent());
    }

    @Test(timeout = 1000)
    public void does_not_wait_for_preceding_version_unless_asked() throws Exception {
        ProjectorEventHandler<VersionedModel> plain =
                new ProjectorEventHandler<>(new ContentProjector(), new InMemoryRepo<>(), VersionedModel::new);
        try {
            plain.handleEvent(ctx, event("Written", Ids.newId(), 2, "b"));
            fail("Version 1 was never projected");
        } catch (ProjectorException e) {
            assertEquals(ProjectorException.Fault.INCORRECT_ENTITY_VERSION, e.getFault());
        }
    }
}
