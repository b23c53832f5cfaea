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

import java.util.Objects;

/**
 * Handler of events.
 * <p>The handler type identifies the handler on an event bus. Handlers sharing the type within one bus group are
 * competing consumers, every event is delivered to just one of them.</p>
 */
public interface EventHandler {

    String handlerType();

    void handleEvent(Context ctx, Event event) throws Exception;

    /**
     * Create handler of given type delegating to a function.
     * @param handlerType type of the handler
     * @param function the handling function
     * @return new event handler
     */
    static EventHandler of(String handlerType, HandlerFunction function) {
        Objects.requireNonNull(handlerType, "Handler type must be specified");
        Objects.requireNonNull(function, "Handling function must be specified");
        return new EventHandler() {
            @Override
            public String handlerType() {
                return handlerType;
            }

            @Override
            public void handleEvent(Context ctx, Event event) throws Exception {
                function.handleEvent(ctx, event);
            }

            @Override
            public String toString() {
                return "EventHandler[" + handlerType + "]";
            }
        };
    }

    @FunctionalInterface
    interface HandlerFunction {
        void handleEvent(Context ctx, Event event) throws Exception;
    }
}
