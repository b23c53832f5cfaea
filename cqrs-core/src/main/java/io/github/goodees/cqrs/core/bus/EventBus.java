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

import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.ErrorQueue;
import io.github.goodees.cqrs.core.EventHandler;

/**
 * Distributes events to registered handlers.
 * <p>Publishing an event via {@link #handleEvent(Context, io.github.goodees.cqrs.core.Event)} only hands it over for
 * delivery. Handlers run on their own tasks, their failures never reach the publisher but are published to
 * {@link #errors()}. Delivery order of events of different aggregates is not guaranteed, and neither is order of
 * events of the same aggregate; install sequencing middleware on handlers that need it.</p>
 */
public interface EventBus extends EventHandler, AutoCloseable {

    /**
     * Register a handler.
     * @param ctx registration context, cancelling it stops the delivery to the handler
     * @param matcher events to deliver
     * @param handler the handler
     * @throws EventBusException when matcher or handler is missing, or handler of same type is already registered
     */
    void addHandler(Context ctx, EventMatcher matcher, EventHandler handler) throws EventBusException;

    /**
     * Errors of asynchronous handling. Bounded, the oldest errors are dropped when nobody takes them.
     * @return error queue of the bus
     */
    ErrorQueue<EventBusException> errors();

    /**
     * Stop delivering events and wait for handlers to finish the events they are handling.
     * @throws InterruptedException when interrupted while waiting
     */
    @Override
    void close() throws InterruptedException;
}
