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

import io.github.goodees.cqrs.core.Event;

import java.time.Instant;

/**
 * Failure of a scheduled run: either the event could not be created, or a handler failed to handle it.
 */
public class SchedulerException extends Exception {
    private final String handlerType;
    private final transient Event event;
    private final Instant plannedTime;

    private SchedulerException(String message, String handlerType, Event event, Instant plannedTime,
                               Throwable cause) {
        super(message, cause);
        this.handlerType = handlerType;
        this.event = event;
        this.plannedTime = plannedTime;
    }

    static SchedulerException handlerFailed(String handlerType, Event event, Instant plannedTime, Throwable cause) {
        return new SchedulerException("could not handle scheduled event (" + handlerType + "): " + cause.getMessage()
                + ": (" + event + ")", handlerType, event, plannedTime, cause);
    }

    static SchedulerException eventCreationFailed(Instant plannedTime, Throwable cause) {
        return new SchedulerException("could not create scheduled event for " + plannedTime + ": "
                + cause.getMessage(), null, null, plannedTime, cause);
    }

    /**
     * @return type of the failed handler, null when the event could not be created
     */
    public String getHandlerType() {
        return handlerType;
    }

    /**
     * @return the scheduled event, null when it could not be created
     */
    public Event getEvent() {
        return event;
    }

    public Instant getPlannedTime() {
        return plannedTime;
    }
}
