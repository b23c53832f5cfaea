package io.github.goodees.cqrs.core;

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

import io.github.goodees.cqrs.core.id.Ids;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class MiddlewaresTest {

    @Test
    public void first_command_middleware_is_outermost() throws Exception {
        List<String> trace = new ArrayList<>();
        CommandHandler handler = Middlewares.useCommandHandlerMiddleware((ctx, cmd) -> trace.add("handler"),
                tracing(trace, "m1"), tracing(trace, "m2"));
        handler.handleCommand(Context.background(), new MockCommand(Ids.newId(), "x"));
        assertThat(trace, contains("m1", "m2", "handler"));
    }

    @Test
    public void first_event_middleware_is_outermost() throws Exception {
        List<String> trace = new ArrayList<>();
        EventHandler handler = Middlewares.useEventHandlerMiddleware(
                EventHandler.of("inner", (ctx, event) -> trace.add("handler")),
                tracingEvents(trace, "m1"), tracingEvents(trace, "m2"));
        handler.handleEvent(Context.background(), Events.newEvent("Tick", null, Instant.now()));
        assertThat(trace, contains("m1", "m2", "handler"));
    }

    private static CommandHandlerMiddleware tracing(List<String> trace, String name) {
        return h -> (ctx, cmd) -> {
            trace.add(name);
            h.handleCommand(ctx, cmd);
        };
    }

    private static EventHandlerMiddleware tracingEvents(List<String> trace, String name) {
        return h -> EventHandler.of(h.handlerType(), (ctx, event) -> {
            trace.add(name);
            h.handleEvent(ctx, event);
        });
    }
}
