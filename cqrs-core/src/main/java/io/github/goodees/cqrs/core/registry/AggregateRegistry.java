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

import io.github.goodees.cqrs.core.aggregate.Aggregate;
import io.github.goodees.cqrs.core.id.ID;
import io.github.goodees.cqrs.core.id.Ids;

import java.util.function.Function;

/**
 * Factories of aggregates, keyed by aggregate type.
 */
public class AggregateRegistry extends FactoryRegistry<Function<ID, ? extends Aggregate>> {
    private static final AggregateRegistry DEFAULT = new AggregateRegistry();

    public AggregateRegistry() {
        super("aggregate");
    }

    public static AggregateRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Register an aggregate factory. The type is taken from an aggregate created for the empty id.
     * @param factory the factory creating new aggregates
     * @throws RegistrationException if the factory yields null, the type is empty or already registered
     */
    public void register(Function<ID, ? extends Aggregate> factory) throws RegistrationException {
        Aggregate aggregate = factory.apply(Ids.emptyId());
        if (aggregate == null) {
            throw RegistrationException.nullValue(kind());
        }
        doRegister(aggregate.aggregateType(), factory);
    }

    public Aggregate create(String aggregateType, ID id) throws TypeNotRegisteredException {
        return factory(aggregateType).apply(id);
    }
}
