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
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Versionable;
import io.github.goodees.cqrs.core.id.ID;

import java.util.List;

/**
 * Aggregate whose state is built by applying its events.
 * <p>Implementations compose an {@link AggregateBase}, which keeps identity, version and uncommitted events.
 * {@link #applyEvent(Context, Event)} is the only place the state of the aggregate changes, both when replaying
 * history and for events just created by command handling.</p>
 */
public interface EventSourcedAggregate extends Aggregate, Versionable {

    AggregateBase base();

    void applyEvent(Context ctx, Event event) throws Exception;

    @Override
    default ID entityId() {
        return base().entityId();
    }

    @Override
    default String aggregateType() {
        return base().aggregateType();
    }

    @Override
    default int aggregateVersion() {
        return base().aggregateVersion();
    }

    default List<Event> uncommittedEvents() {
        return base().uncommittedEvents();
    }
}
