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

import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.id.ID;

/**
 * Failure to load or apply aggregate state.
 */
public class AggregateStoreException extends Exception {
    private final Fault fault;
    private final String aggregateType;
    private final ID aggregateId;

    public enum Fault {
        AGGREGATE_NOT_REGISTERED, NOT_EVENT_SOURCED, MISMATCHED_EVENT_TYPE, INCORRECT_EVENT_VERSION,
        APPLY_EVENT_FAILED
    }

    protected AggregateStoreException(Fault fault, String aggregateType, ID aggregateId, String message,
                                      Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public Fault getFault() {
        return fault;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public ID getAggregateId() {
        return aggregateId;
    }

    public static AggregateStoreException notRegistered(String aggregateType, ID id, Throwable cause) {
        return new AggregateStoreException(Fault.AGGREGATE_NOT_REGISTERED, aggregateType, id,
                "aggregate type not registered: " + aggregateType, cause);
    }

    public static AggregateStoreException notEventSourced(Aggregate aggregate) {
        return new AggregateStoreException(Fault.NOT_EVENT_SOURCED, aggregate.aggregateType(), aggregate.entityId(),
                "aggregate " + aggregate.aggregateType() + " is not event sourced", null);
    }

    public static AggregateStoreException mismatchedType(EventSourcedAggregate aggregate, Event event) {
        return new AggregateStoreException(Fault.MISMATCHED_EVENT_TYPE, aggregate.aggregateType(),
                aggregate.entityId(), "event " + event + " belongs to aggregate type " + event.aggregateType(), null);
    }

    public static AggregateStoreException incorrectVersion(EventSourcedAggregate aggregate, Event event) {
        return new AggregateStoreException(Fault.INCORRECT_EVENT_VERSION, aggregate.aggregateType(),
                aggregate.entityId(), "event " + event + " does not follow aggregate version "
                + aggregate.aggregateVersion(), null);
    }

    public static AggregateStoreException applyFailed(EventSourcedAggregate aggregate, Event event,
                                                      Throwable cause) {
        return new AggregateStoreException(Fault.APPLY_EVENT_FAILED, aggregate.aggregateType(),
                aggregate.entityId(), "could not apply event " + event + ": " + cause.getMessage(), cause);
    }
}
