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

import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.Event;

/**
 * Rejection of a command or event by an aggregate.
 */
public class AggregateException extends Exception {
    private final Fault fault;

    public enum Fault {
        UNKNOWN_COMMAND, UNKNOWN_EVENT, REJECTED
    }

    protected AggregateException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public AggregateException(String message) {
        this(Fault.REJECTED, message);
    }

    public Fault getFault() {
        return fault;
    }

    public static AggregateException unknownCommand(Command command) {
        return new AggregateException(Fault.UNKNOWN_COMMAND, "unknown command type: " + command.commandType());
    }

    public static AggregateException unknownEvent(Event event) {
        return new AggregateException(Fault.UNKNOWN_EVENT, "unknown event type: " + event.eventType());
    }
}
