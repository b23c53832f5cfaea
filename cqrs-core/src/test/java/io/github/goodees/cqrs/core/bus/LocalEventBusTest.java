package io.github.goodees.cqrs.core.bus;

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

import io.github.goodees.cqrs.core.CancellableContext;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.Events;
import io.github.goodees.cqrs.core.RecordingEventHandler;
import io.github.goodees.cqrs.core.id.Ids;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.*;

public class LocalEventBusTest {
    private final List<LocalEventBus> buses = new ArrayList<>();
    private EventBusGroup group;

    @Before
    public void setUp() {
        group = new EventBusGroup("test");
    }

    @After
    public void tearDown() throws InterruptedException {
        for (LocalEventBus bus : buses) {
            bus.close();
        }
    }

    private LocalEventBus newBus(String name) {
        LocalEventBus bus = new LocalEventBus(new SimpleEventBusConfiguration(name, group));
        buses.add(bus);
        return bus;
    }

    private static Event event(String type, int version) {
        return Events.newEventForAggregate(type, version, Instant.now(), "Agg", Ids.newId(), version);
    }

    @Test
    public void missing_matcher_and_handler_are_reported_in_order() {
        LocalEventBus bus = newBus("bus");
        try {
            bus.addHandler(Context.background(), null, null);
            fail("Matcher is missing");
        } catch (EventBusException e) {
            assertEquals(EventBusException.Fault.MISSING_MATCHER, e.getFault());
            assertEquals("missing matcher", e.getMessage());
        }
        try {
            bus.addHandler(Context.background(), EventMatchers.matchAll(), null);
            fail("Handler is missing");
        } catch (EventBusException e) {
            assertEquals(EventBusException.Fault.MISSING_HANDLER, e.getFault());
        }
    }

    @Test
    public void handler_type_can_be_added_once_per_bus() throws Exception {
        LocalEventBus bus = newBus("bus");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), new RecordingEventHandler("h"));
        try {
            bus.addHandler(Context.background(), EventMatchers.matchAll(), new RecordingEventHandler("h"));
            fail("Duplicate handler type");
        } catch (EventBusException e) {
            assertEquals(EventBusException.Fault.HANDLER_ALREADY_ADDED, e.getFault());
        }
    }

    @Test
    public void matching_events_are_delivered_in_order() throws Exception {
        LocalEventBus bus = newBus("bus");
        RecordingEventHandler handler = new RecordingEventHandler("h");
        bus.addHandler(Context.background(), EventMatchers.matchEvents("Wanted"), handler);

        Event first = event("Wanted", 1);
        Event other = event("Other", 1);
        Event second = event("Wanted", 2);
        bus.handleEvent(Context.background(), first);
        bus.handleEvent(Context.background(), other);
        bus.handleEvent(Context.background(), second);

        assertTrue(handler.awaitEvents(2, 5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertThat(handler.events(), contains(first, second));
    }

    @Test
    public void competing_handlers_share_the_events() throws Exception {
        RecordingEventHandler first = new RecordingEventHandler("worker");
        RecordingEventHandler second = new RecordingEventHandler("worker");
        newBus("one").addHandler(Context.background(), EventMatchers.matchAll(), first);
        newBus("two").addHandler(Context.background(), EventMatchers.matchAll(), second);
        LocalEventBus publisher = newBus("publisher");

        for (int i = 1; i <= 100; i++) {
            publisher.handleEvent(Context.background(), event("Counted", i));
        }

        long deadline = System.currentTimeMillis() + 5000;
        while (first.events().size() + second.events().size() < 100 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(100);
        assertEquals(100, first.events().size() + second.events().size());
        Set<Event> overlap = new HashSet<>(first.events());
        overlap.retainAll(second.events());
        assertTrue("No event may be handled twice", overlap.isEmpty());
    }

    @Test
    public void distinct_handler_types_each_get_all_events() throws Exception {
        RecordingEventHandler first = new RecordingEventHandler("projector");
        RecordingEventHandler second = new RecordingEventHandler("notifier");
        newBus("one").addHandler(Context.background(), EventMatchers.matchAll(), first);
        LocalEventBus bus = newBus("two");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), second);

        for (int i = 1; i <= 10; i++) {
            bus.handleEvent(Context.background(), event("Counted", i));
        }
        assertTrue(first.awaitEvents(10, 5, TimeUnit.SECONDS));
        assertTrue(second.awaitEvents(10, 5, TimeUnit.SECONDS));
    }

    @Test
    public void handler_receives_publisher_context() throws Exception {
        Context.Key<String> user = Context.Key.of("user", String.class);
        LocalEventBus bus = newBus("bus");
        RecordingEventHandler handler = new RecordingEventHandler("h");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), handler);

        bus.handleEvent(Context.background().withNamespace("tenant").withValue(user, "alice"), event("E", 1));

        assertTrue(handler.awaitEvents(1, 5, TimeUnit.SECONDS));
        Context received = handler.contexts().get(0);
        assertEquals("tenant", received.namespace());
        assertEquals("alice", received.value(user));
    }

    @Test
    public void handler_failures_go_to_error_queue() throws Exception {
        LocalEventBus bus = newBus("bus");
        bus.addHandler(Context.background(), EventMatchers.matchAll(),
                new RecordingEventHandler("failing").failingWith(new IllegalStateException("boom")));
        Event event = event("E", 1);
        bus.handleEvent(Context.background(), event);

        EventBusException error = bus.errors().poll(5, TimeUnit.SECONDS);
        assertNotNull(error);
        assertEquals(EventBusException.Fault.HANDLER_FAILED, error.getFault());
        assertEquals("failing", error.getHandlerType());
        assertEquals(event, error.getEvent());
        assertEquals("could not handle event (failing): boom: (E@1)", error.getMessage());
    }

    @Test
    public void handler_errors_go_to_error_queue_and_handler_keeps_receiving() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        LocalEventBus bus = newBus("bus");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), EventHandler.of("asserting", (ctx, event) -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("first event rejected");
            }
        }));
        bus.handleEvent(Context.background(), event("E", 1));

        EventBusException error = bus.errors().poll(5, TimeUnit.SECONDS);
        assertNotNull(error);
        assertTrue(error.getCause() instanceof AssertionError);
        assertEquals("could not handle event (asserting): first event rejected: (E@1)", error.getMessage());

        bus.handleEvent(Context.background(), event("E", 2));
        long deadline = System.currentTimeMillis() + 5000;
        while (calls.get() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, calls.get());
        assertEquals(1, group.members("asserting"));
    }

    @Test(timeout = 10000)
    public void slow_handler_blocks_neither_publisher_nor_other_types_and_close_waits_for_it() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        LocalEventBus bus = newBus("bus");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), EventHandler.of("slow", (ctx, event) -> {
            entered.countDown();
            release.await();
            finished.set(true);
        }));
        RecordingEventHandler fast = new RecordingEventHandler("fast");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), fast);

        long publishStart = System.nanoTime();
        bus.handleEvent(Context.background(), event("E", 1));
        assertTrue("Publishing does not wait for handlers",
                System.nanoTime() - publishStart < TimeUnit.SECONDS.toNanos(1));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(fast.awaitEvents(1, 5, TimeUnit.SECONDS));
        assertFalse(finished.get());

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();
        long closeStart = System.nanoTime();
        bus.close();
        assertTrue("Close returns after the in-flight handler", finished.get());
        assertTrue(System.nanoTime() - closeStart >= TimeUnit.MILLISECONDS.toNanos(250));
        releaser.join();
    }

    @Test
    public void cancelled_registration_stops_delivery() throws Exception {
        LocalEventBus bus = newBus("bus");
        CancellableContext registration = Context.background().withCancel();
        RecordingEventHandler handler = new RecordingEventHandler("h");
        bus.addHandler(registration, EventMatchers.matchAll(), handler);
        bus.handleEvent(Context.background(), event("E", 1));
        assertTrue(handler.awaitEvents(1, 5, TimeUnit.SECONDS));

        registration.cancel();
        long deadline = System.currentTimeMillis() + 5000;
        while (group.members("h") > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        bus.handleEvent(Context.background(), event("E", 2));
        Thread.sleep(200);
        assertEquals(1, handler.events().size());

        bus.addHandler(Context.background(), EventMatchers.matchAll(), new RecordingEventHandler("h"));
    }

    @Test
    public void closed_bus_refuses_events_and_handlers() throws Exception {
        LocalEventBus bus = newBus("bus");
        EventHandler handler = new RecordingEventHandler("h");
        bus.addHandler(Context.background(), EventMatchers.matchAll(), handler);
        bus.close();
        assertTrue(bus.isClosed());
        assertEquals(0, group.members("h"));
        try {
            bus.handleEvent(Context.background(), event("E", 1));
            fail("Bus is closed");
        } catch (EventBusException e) {
            assertEquals(EventBusException.Fault.CLOSED, e.getFault());
        }
        try {
            bus.addHandler(Context.background(), EventMatchers.matchAll(), new RecordingEventHandler("other"));
            fail("Bus is closed");
        } catch (EventBusException e) {
            assertEquals(EventBusException.Fault.CLOSED, e.getFault());
        }
    }

    @Test
    public void matchers_combine() {
        Event event = Events.newEventForAggregate("Created", null, Instant.now(), "Order", Ids.newId(), 1);
        assertTrue(EventMatchers.matchAll().match(event));
        assertTrue(EventMatchers.matchEvents("Deleted", "Created").match(event));
        assertFalse(EventMatchers.matchEvents("Deleted").match(event));
        assertTrue(EventMatchers.matchAggregates("Order").match(event));
        assertFalse(EventMatchers.matchAggregates("Invoice").match(event));
        assertTrue(EventMatchers.matchAny(EventMatchers.matchEvents("Deleted"),
                EventMatchers.matchAggregates("Order")).match(event));
        assertFalse(EventMatchers.matchAny().match(event));
    }
}
