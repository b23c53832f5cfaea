package io.github.goodees.cqrs.core.middleware.event;

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
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.RecordingEventHandler;
import io.github.goodees.cqrs.core.bus.EventBusGroup;
import io.github.goodees.cqrs.core.bus.EventMatchers;
import io.github.goodees.cqrs.core.bus.LocalEventBus;
import io.github.goodees.cqrs.core.bus.SimpleEventBusConfiguration;
import org.junit.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ObserverMiddlewareTest {

    @Test
    public void random_group_gives_unique_types() {
        ObserverMiddleware observer = ObserverMiddleware.randomGroup();
        EventHandler first = observer.apply(new RecordingEventHandler("notifier"));
        EventHandler second = observer.apply(new RecordingEventHandler("notifier"));
        assertTrue(first.handlerType().startsWith("notifier_"));
        assertNotEquals(first.handlerType(), second.handlerType());
    }

    @Test
    public void named_group_gives_shared_type() {
        EventHandler handler = ObserverMiddleware.namedGroup("node1").apply(new RecordingEventHandler("notifier"));
        assertEquals("notifier_node1", handler.handlerType());
    }

    @Test
    public void observers_on_grouped_buses_all_receive_events() throws Exception {
        EventBusGroup group = new EventBusGroup("observers");
        RecordingEventHandler first = new RecordingEventHandler("notifier");
        RecordingEventHandler second = new RecordingEventHandler("notifier");
        try (LocalEventBus one = new LocalEventBus(new SimpleEventBusConfiguration("one", group));
             LocalEventBus two = new LocalEventBus(new SimpleEventBusConfiguration("two", group))) {
            one.addHandler(Context.background(), EventMatchers.matchAll(),
                    ObserverMiddleware.randomGroup().apply(first));
            two.addHandler(Context.background(), EventMatchers.matchAll(),
                    ObserverMiddleware.randomGroup().apply(second));
            for (int i = 0; i < 5; i++) {
                one.handleEvent(Context.background(), Events.newEvent("Tick", i, Instant.now()));
            }
            assertTrue(first.awaitEvents(5, 5, TimeUnit.SECONDS));
            assertTrue(second.awaitEvents(5, 5, TimeUnit.SECONDS));
        }
    }
}
