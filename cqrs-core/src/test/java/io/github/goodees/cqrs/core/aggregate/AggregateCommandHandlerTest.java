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

import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.MockCommand;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;
import io.github.goodees.cqrs.core.registry.AggregateRegistry;
import io.github.goodees.cqrs.store.inmemory.InMemoryEventStore;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class AggregateCommandHandlerTest {
    private final Context ctx = Context.background();
    private InMemoryEventStore eventStore;
    private AggregateCommandHandler handler;

    @Before
    public void setUp() throws Exception {
        eventStore = new InMemoryEventStore();
        AggregateRegistry registry = new AggregateRegistry();
        registry.register(CounterAggregate::new);
        handler = new AggregateCommandHandler(CounterAggregate.TYPE, new EventSourcingAggregateStore(eventStore, registry));
    }

    @Test
    public void command_events_are_stored() throws Exception {
        ID id = Ids.newId();
        handler.handleCommand(ctx, new CounterAggregate.Increment(id, 2));
        handler.handleCommand(ctx, new CounterAggregate.Increment(id, 3));
        assertEquals(2, eventStore.load(ctx, id).size());
        assertEquals(2, eventStore.load(ctx, id).get(1).version());
    }

    @Test
    public void command_for_other_aggregate_type_is_refused() throws Exception {
        try {
            handler.handleCommand(ctx, new MockCommand(Ids.newId(), "x"));
            fail("Handler serves counters only");
        } catch (CommandException e) {
            assertEquals(CommandException.Fault.INVALID_AGGREGATE_TYPE, e.getFault());
        }
    }

    @Test
    public void command_without_id_is_refused() throws Exception {
        try {
            handler.handleCommand(ctx, new CounterAggregate.Increment(Ids.emptyId(), 2));
            fail("Missing id");
        } catch (CommandException e) {
            assertEquals(CommandException.Fault.MISSING_FIELD, e.getFault());
        }
    }

    @Test
    public void rejected_command_leaves_no_events() throws Exception {
        CounterAggregate counter = new CounterAggregate(Ids.newId());
        try {
            AggregateCommandHandler.handle(ctx, counter, new CounterAggregate.Increment(counter.entityId(), -1, 3));
            fail("Negative increment is rejected");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.REJECTED, e.getFault());
        }
        assertEquals(0, counter.uncommittedEvents().size());
    }

    @Test
    public void unknown_command_leaves_no_events() throws Exception {
        CounterAggregate counter = new CounterAggregate(Ids.newId());
        try {
            AggregateCommandHandler.handle(ctx, counter, new MockCommand(counter.entityId(), "x"));
            fail("Counter does not handle mock commands");
        } catch (AggregateException e) {
            assertEquals(AggregateException.Fault.UNKNOWN_COMMAND, e.getFault());
            assertEquals("unknown command type: MockCommand", e.getMessage());
        }
        assertEquals(0, counter.uncommittedEvents().size());
        assertEquals(0, counter.aggregateVersion());
    }
}
