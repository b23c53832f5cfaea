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
import io.github.goodees.cqrs.core.bus.EventMatchers;
import org.junit.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.*;

public class WaiterEventHandlerTest {
    private final WaiterEventHandler waiter = new WaiterEventHandler();

    @Test
    public void every_waiter_has_own_type() {
        assertTrue(waiter.handlerType().startsWith("waiter_"));
        assertNotEquals(waiter.handlerType(), new WaiterEventHandler().handlerType());
    }

    @Test
    public void listener_receives_matching_events() throws Exception {
        try (WaiterEventHandler.Listener listener = waiter.listen(EventMatchers.matchEvents("Done"))) {
            Event done = Events.newEvent("Done", null, Instant.now());
            new Thread(() -> {
                waiter.handleEvent(Context.background(), Events.newEvent("Other", null, Instant.now()));
                waiter.handleEvent(Context.background(), done);
            }).start();
            assertEquals(done, listener.await(5, TimeUnit.SECONDS));
        }
    }

    @Test(expected = TimeoutException.class)
    public void await_times_out() throws Exception {
        try (WaiterEventHandler.Listener listener = waiter.listen(EventMatchers.matchAll())) {
            listener.await(20, TimeUnit.MILLISECONDS);
        }
    }

    @Test(expected = TimeoutException.class)
    public void closed_listener_receives_nothing() throws Exception {
        WaiterEventHandler.Listener listener = waiter.listen(EventMatchers.matchAll());
        listener.close();
        waiter.handleEvent(Context.background(), Events.newEvent("Done", null, Instant.now()));
        listener.await(20, TimeUnit.MILLISECONDS);
    }
}
