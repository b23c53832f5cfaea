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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mapping from type name to a factory, guarded by single lock. Registries are meant to be filled at startup,
 * registration during dispatch is safe, but discouraged.
 *
 * @param <F> type of factory
 */
public abstract class FactoryRegistry<F> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String kind;
    private final Map<String, F> factories = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    protected FactoryRegistry(String kind) {
        this.kind = kind;
    }

    protected void doRegister(String type, F factory) throws RegistrationException {
        if (type == null || type.isEmpty()) {
            throw RegistrationException.emptyType(kind);
        }
        lock.writeLock().lock();
        try {
            if (factories.containsKey(type)) {
                throw RegistrationException.duplicate(type);
            }
            factories.put(type, factory);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Registered {} type {}", kind, type);
    }

    public void unregister(String type) throws RegistrationException {
        if (type == null || type.isEmpty()) {
            throw RegistrationException.emptyUnregister(kind);
        }
        lock.writeLock().lock();
        try {
            if (factories.remove(type) == null) {
                throw RegistrationException.notRegistered(type);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected F factory(String type) throws TypeNotRegisteredException {
        lock.readLock().lock();
        try {
            F factory = factories.get(type);
            if (factory == null) {
                throw new TypeNotRegisteredException(kind, type);
            }
            return factory;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String type) {
        lock.readLock().lock();
        try {
            return factories.containsKey(type);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> registeredTypes() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    protected String kind() {
        return kind;
    }
}
