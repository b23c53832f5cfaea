package io.github.goodees.cqrs.core.store;

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
import io.github.goodees.cqrs.core.id.ID;

/**
 * Exception generated when storing or loading of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;
    private final String namespace;

    public enum Fault {
        NO_EVENTS, INVALID_EVENT, INCORRECT_VERSION, OPTIMISTIC_LOCK, EVENT_HANDLER_FAILED, TX_ERROR,
        AGGREGATE_NOT_FOUND, EVENT_NOT_FOUND
    }

    protected EventStoreException(Fault type, String namespace, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
        this.namespace = namespace;
    }

    public Fault getFault() {
        return fault;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Whether the save was rejected because another writer advanced the stream. Such saves can be retried after
     * reloading the aggregate.
     * @return true for optimistic lock failures
     */
    public boolean isConcurrencyConflict() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException noEvents(String namespace) {
        return new EventStoreException(Fault.NO_EVENTS, namespace, "no events to append", null);
    }

    public static EventStoreException multipleAggregates(String namespace, ID expected, Event violating) {
        return new EventStoreException(Fault.INVALID_EVENT, namespace, "Stored events span multiple aggregates: "
                + expected + " and " + violating.aggregateId(), null);
    }

    public static EventStoreException nonMonotonic(String namespace, ID id, int expectedVersion, Event violating) {
        return new EventStoreException(Fault.INCORRECT_VERSION, namespace, "Event for aggregate " + id
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + violating.version(), null);
    }

    public static EventStoreException optimisticLock(String namespace, ID id, int originalVersion,
                                                     int currentVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, namespace, "Aggregate " + id
                + " storing events after version " + originalVersion + " attempted while last stored version is "
                + currentVersion, null);
    }

    public static EventStoreException handlerFailed(String namespace, Event event, Throwable cause) {
        return new EventStoreException(Fault.EVENT_HANDLER_FAILED, namespace,
                "Event handler failed for stored event " + event + ": " + cause.getMessage(), cause);
    }

    public static EventStoreException storeFailed(String namespace, ID id, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, namespace,
                "Store of aggregate " + id + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException aggregateNotFound(String namespace, ID id) {
        return new EventStoreException(Fault.AGGREGATE_NOT_FOUND, namespace, "Aggregate " + id + " not found", null);
    }

    public static EventStoreException eventNotFound(String namespace, Event event) {
        return new EventStoreException(Fault.EVENT_NOT_FOUND, namespace,
                "Event " + event + " of aggregate " + event.aggregateId() + " not found", null);
    }

    @Override
    public String toString() {
        return super.toString() + " (namespace " + namespace + ")";
    }
}
