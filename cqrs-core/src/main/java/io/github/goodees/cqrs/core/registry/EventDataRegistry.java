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

import io.github.goodees.cqrs.core.TypeNames;

import java.util.function.Supplier;

/**
 * Factories of event payloads, keyed by event type. Used by codecs to recreate typed payloads of persisted or
 * transmitted events.
 */
public class EventDataRegistry extends FactoryRegistry<Supplier<?>> {
    private static final EventDataRegistry DEFAULT = new EventDataRegistry();

    public EventDataRegistry() {
        super("event data");
    }

    public static EventDataRegistry defaultRegistry() {
        return DEFAULT;
    }

    public void register(String eventType, Supplier<?> factory) throws RegistrationException {
        if (eventType == null || eventType.isEmpty()) {
            throw RegistrationException.emptyType(kind());
        }
        if (factory.get() == null) {
            throw RegistrationException.nullValue(kind());
        }
        doRegister(eventType, factory);
    }

    /**
     * Register a payload factory under the default type name of created payload's class.
     * @param factory the factory
     * @return the event type the factory was registered with
     * @throws RegistrationException if the factory yields null or type is already registered
     * @see TypeNames#defaultTypeName(Class)
     */
    public String register(Supplier<?> factory) throws RegistrationException {
        Object data = factory.get();
        if (data == null) {
            throw RegistrationException.nullValue(kind());
        }
        String eventType = TypeNames.defaultTypeName(data.getClass());
        register(eventType, factory);
        return eventType;
    }

    public Object create(String eventType) throws TypeNotRegisteredException {
        return factory(eventType).get();
    }
}
