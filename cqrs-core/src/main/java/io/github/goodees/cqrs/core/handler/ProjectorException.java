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

import io.github.goodees.cqrs.core.Event;

/**
 * Failure of projecting an event.
 */
public class ProjectorException extends Exception {
    private final Fault fault;
    private final transient Event event;
    private final String namespace;

    public enum Fault {
        LOAD_FAILED, INCORRECT_ENTITY_VERSION, PROJECT_FAILED, INCORRECT_PROJECTED_VERSION, SAVE_FAILED
    }

    protected ProjectorException(Fault fault, Event event, String namespace, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.event = event;
        this.namespace = namespace;
    }

    public Fault getFault() {
        return fault;
    }

    public Event getEvent() {
        return event;
    }

    public String getNamespace() {
        return namespace;
    }

    public static ProjectorException loadFailed(Event event, String namespace, Throwable cause) {
        return new ProjectorException(Fault.LOAD_FAILED, event, namespace,
                "could not load entity for " + event + ": " + cause.getMessage(), cause);
    }

    public static ProjectorException incorrectEntityVersion(Event event, String namespace, int entityVersion) {
        return new ProjectorException(Fault.INCORRECT_ENTITY_VERSION, event, namespace,
                "incorrect entity version " + entityVersion + " for " + event, null);
    }

    public static ProjectorException projectFailed(Event event, String namespace, Throwable cause) {
        return new ProjectorException(Fault.PROJECT_FAILED, event, namespace,
                "could not project " + event + ": " + cause.getMessage(), cause);
    }

    public static ProjectorException incorrectProjectedVersion(Event event, String namespace, int entityVersion) {
        return new ProjectorException(Fault.INCORRECT_PROJECTED_VERSION, event, namespace,
                "incorrect projected entity version " + entityVersion + " for " + event, null);
    }

    public static ProjectorException saveFailed(Event event, String namespace, Throwable cause) {
        return new ProjectorException(Fault.SAVE_FAILED, event, namespace,
                "could not save projection of " + event + ": " + cause.getMessage(), cause);
    }
}
