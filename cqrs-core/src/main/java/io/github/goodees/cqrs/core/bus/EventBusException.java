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
import io.github.goodees.cqrs.core.Event;

/**
 * Event bus failure, either of registration, or of asynchronous handling of an event.
 */
public class EventBusException extends Exception {
    private final Fault fault;
    private final String handlerType;
    private final transient Event event;
    private final transient Context context;

    public enum Fault {
        MISSING_MATCHER, MISSING_HANDLER, HANDLER_ALREADY_ADDED, HANDLER_FAILED, CLOSED
    }

    protected EventBusException(Fault fault, String handlerType, Event event, Context context, String message,
                                Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.handlerType = handlerType;
        this.event = event;
        this.context = context;
    }

    public Fault getFault() {
        return fault;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public Event getEvent() {
        return event;
    }

    public Context getContext() {
        return context;
    }

    public static EventBusException missingMatcher() {
        return new EventBusException(Fault.MISSING_MATCHER, null, null, null, "missing matcher", null);
    }

    public static EventBusException missingHandler() {
        return new EventBusException(Fault.MISSING_HANDLER, null, null, null, "missing handler", null);
    }

    public static EventBusException alreadyAdded(String handlerType) {
        return new EventBusException(Fault.HANDLER_ALREADY_ADDED, handlerType, null, null,
                "handler already added: " + handlerType, null);
    }

    public static EventBusException handlerFailed(String handlerType, Event event, Context context,
                                                  Throwable cause) {
        return new EventBusException(Fault.HANDLER_FAILED, handlerType, event, context,
                "could not handle event (" + handlerType + "): " + cause.getMessage() + ": (" + event + ")", cause);
    }

    public static EventBusException closed(String busName) {
        return new EventBusException(Fault.CLOSED, null, null, null, "event bus " + busName + " is closed", null);
    }
}
