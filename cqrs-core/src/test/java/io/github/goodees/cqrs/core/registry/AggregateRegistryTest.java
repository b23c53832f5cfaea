package io.github.goodees.cqrs.core.registry;

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

import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.aggregate.Aggregate;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;
import org.junit.Test;

import static org.junit.Assert.*;

public class AggregateRegistryTest {
    private final AggregateRegistry registry = new AggregateRegistry();

    @Test
    public void created_aggregate_has_requested_id() throws Exception {
        registry.register(PlainAggregate::new);
        ID id = Ids.newId();
        Aggregate aggregate = registry.create("Plain", id);
        assertEquals(id, aggregate.entityId());
        assertEquals("Plain", aggregate.aggregateType());
    }

    @Test
    public void null_aggregate_is_rejected() {
        try {
            registry.register(id -> null);
            fail("Null aggregate should be rejected");
        } catch (RegistrationException e) {
            assertEquals("created aggregate is null", e.getMessage());
        }
    }

    @Test
    public void unknown_type() {
        try {
            registry.create("Unknown", Ids.newId());
            fail("Unknown type");
        } catch (TypeNotRegisteredException e) {
            assertEquals("aggregate", e.getKind());
            assertEquals("Unknown", e.getType());
        }
    }

    static class PlainAggregate implements Aggregate {
        private final ID id;

        PlainAggregate(ID id) {
            this.id = id;
        }

        @Override
        public String aggregateType() {
            return "Plain";
        }

        @Override
        public void handleCommand(Context ctx, Command command) {
        }

        @Override
        public ID entityId() {
            return id;
        }
    }
}
