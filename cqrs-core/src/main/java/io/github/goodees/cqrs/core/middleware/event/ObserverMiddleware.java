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
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.EventHandlerMiddleware;

import java.util.Objects;
import java.util.UUID;

/**
 * Turns competing handlers into observers by giving each wrapped handler its own handler type. Observers
 * registered on buses of one group all receive every event.
 */
public class ObserverMiddleware implements EventHandlerMiddleware {
    private final String group;

    private ObserverMiddleware(String group) {
        this.group = group;
    }

    /**
     * Observers in a group of their own, every wrapped handler receives all events.
     * @return new middleware
     */
    public static ObserverMiddleware randomGroup() {
        return new ObserverMiddleware(null);
    }

    /**
     * Observers in named group. Handlers wrapped with same group name compete for events again.
     * @param group name of the group
     * @return new middleware
     */
    public static ObserverMiddleware namedGroup(String group) {
        return new ObserverMiddleware(Objects.requireNonNull(group, "Group must be specified"));
    }

    @Override
    public EventHandler apply(EventHandler handler) {
        String suffix = group == null ? UUID.randomUUID().toString() : group;
        String handlerType = handler.handlerType() + "_" + suffix;
        return new EventHandler() {
            @Override
            public String handlerType() {
                return handlerType;
            }

            @Override
            public void handleEvent(Context ctx, Event event) throws Exception {
                handler.handleEvent(ctx, event);
            }
        };
    }
}
