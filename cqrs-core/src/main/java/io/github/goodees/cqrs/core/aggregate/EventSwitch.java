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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch table of event application methods, matched by event type. Handlers may receive the typed payload.
 * Unmatched events fail with {@link AggregateException#unknownEvent(Event)}.
 */
public final class EventSwitch {
    private final Map<String, Handler> handlers;

    private EventSwitch(Builder b) {
        this.handlers = new HashMap<>(b.handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void dispatch(Context ctx, Event event) throws Exception {
        Handler handler = handlers.get(event.eventType());
        if (handler == null) {
            throw AggregateException.unknownEvent(event);
        }
        handler.handle(ctx, event);
    }

    @FunctionalInterface
    public interface Handler {
        void handle(Context ctx, Event event) throws Exception;
    }

    @FunctionalInterface
    public interface DataHandler<D> {
        void handle(Context ctx, Event event, D data) throws Exception;
    }

    public static class Builder {
        private final Map<String, Handler> handlers = new HashMap<>();

        public Builder on(String eventType, Handler handler) {
            Objects.requireNonNull(handler, "Handler cannot be null");
            if (handlers.putIfAbsent(eventType, handler) != null) {
                throw new IllegalArgumentException("Duplicate handler for event type " + eventType);
            }
            return this;
        }

        /**
         * Handle event type, casting its payload.
         * @param eventType type of the event
         * @param dataClass expected class of the payload
         * @param handler handler of the event
         * @param <D> payload type
         * @return this builder
         */
        public <D> Builder on(String eventType, Class<D> dataClass, DataHandler<? super D> handler) {
            Objects.requireNonNull(dataClass, "Data class cannot be null");
            return on(eventType, (ctx, event) -> {
                if (!dataClass.isInstance(event.data())) {
                    throw new AggregateException("invalid event data type for " + event + ": expected "
                            + dataClass.getName());
                }
                handler.handle(ctx, event, dataClass.cast(event.data()));
            });
        }

        public EventSwitch build() {
            return new EventSwitch(this);
        }
    }
}
