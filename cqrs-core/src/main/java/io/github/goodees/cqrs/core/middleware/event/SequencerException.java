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

/**
 * Failure within sequenced delivery of events.
 */
public class SequencerException extends Exception {
    private final Fault fault;
    private final transient Event event;

    public enum Fault {
        HANDLER_FAILED, GAP_TIMEOUT
    }

    protected SequencerException(Fault fault, Event event, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.event = event;
    }

    public Fault getFault() {
        return fault;
    }

    public Event getEvent() {
        return event;
    }

    public static SequencerException handlerFailed(String handlerType, Event event, Throwable cause) {
        return new SequencerException(Fault.HANDLER_FAILED, event, "could not handle sequenced event ("
                + handlerType + "): " + cause.getMessage() + ": (" + event + ")", cause);
    }

    public static SequencerException gapTimeout(String key, int expectedVersion, Event next) {
        return new SequencerException(Fault.GAP_TIMEOUT, next, "gap in events of " + key + ": version "
                + expectedVersion + " did not arrive, skipping to " + next.version(), null);
    }
}
