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

import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.Commands;
import io.github.goodees.cqrs.core.Context;

import java.util.Objects;

/**
 * Command handler running the load, handle and save cycle for aggregates of one type.
 * <p>A command rejected by the aggregate leaves no uncommitted events behind. Concurrency conflicts of the save
 * are propagated as {@link io.github.goodees.cqrs.core.store.EventStoreException}, the caller may retry the
 * command.</p>
 */
public class AggregateCommandHandler implements CommandHandler {
    private final String aggregateType;
    private final AggregateStore store;

    public AggregateCommandHandler(String aggregateType, AggregateStore store) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.store = Objects.requireNonNull(store, "Aggregate store must be specified");
    }

    @Override
    public void handleCommand(Context ctx, Command command) throws Exception {
        Commands.checkCommand(command);
        if (!aggregateType.equals(command.aggregateType())) {
            throw CommandException.invalidAggregateType(command, aggregateType);
        }
        Aggregate aggregate = store.load(ctx, aggregateType, command.aggregateId());
        handle(ctx, aggregate, command);
        store.save(ctx, aggregate);
    }

    static void handle(Context ctx, Aggregate aggregate, Command command) throws Exception {
        if (aggregate instanceof EventSourcedAggregate) {
            AggregateBase base = ((EventSourcedAggregate) aggregate).base();
            int buffered = base.uncommittedCount();
            try {
                aggregate.handleCommand(ctx, command);
            } catch (Exception e) {
                base.discardUncommittedEventsFrom(buffered);
                throw e;
            }
        } else {
            aggregate.handleCommand(ctx, command);
        }
    }
}
