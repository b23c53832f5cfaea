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
import io.github.goodees.cqrs.core.EventHandler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event handler passing events to several handlers in order. Stops at first failing handler.
 */
public class MultiEventHandler implements EventHandler {
    private final List<EventHandler> handlers;
    private final String handlerType;

    public MultiEventHandler(EventHandler... handlers) {
        if (handlers.length == 0) {
            throw new IllegalArgumentException("At least one handler is required");
        }
        this.handlers = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(handlers)));
        this.handlerType = this.handlers.stream().map(EventHandler::handlerType).collect(Collectors.joining("_"));
    }

    @Override
    public String handlerType() {
        return handlerType;
    }

    @Override
    public void handleEvent(Context ctx, Event event) throws Exception {
        for (EventHandler handler : handlers) {
            handler.handleEvent(ctx, event);
        }
    }
}
