package io.github.goodees.cqrs.core.registry;

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

/**
 * Programming error in registration of type factories. The composition root is expected to abort startup
 * when it gets one.
 */
public class RegistrationException extends Exception {
    private final Fault fault;
    private final String type;

    public enum Fault {
        EMPTY_TYPE, NULL_VALUE, DUPLICATE_TYPE, NOT_REGISTERED
    }

    protected RegistrationException(Fault fault, String type, String message) {
        super(message);
        this.fault = fault;
        this.type = type;
    }

    public Fault getFault() {
        return fault;
    }

    public String getType() {
        return type;
    }

    public static RegistrationException emptyType(String kind) {
        return new RegistrationException(Fault.EMPTY_TYPE, "", "attempt to register empty " + kind + " type");
    }

    public static RegistrationException nullValue(String kind) {
        return new RegistrationException(Fault.NULL_VALUE, null, "created " + kind + " is null");
    }

    public static RegistrationException duplicate(String type) {
        return new RegistrationException(Fault.DUPLICATE_TYPE, type,
                "registering duplicate types for \"" + type + "\"");
    }

    public static RegistrationException emptyUnregister(String kind) {
        return new RegistrationException(Fault.EMPTY_TYPE, "", "attempt to unregister empty " + kind + " type");
    }

    public static RegistrationException notRegistered(String type) {
        return new RegistrationException(Fault.NOT_REGISTERED, type,
                "unregister of non-registered type \"" + type + "\"");
    }
}
