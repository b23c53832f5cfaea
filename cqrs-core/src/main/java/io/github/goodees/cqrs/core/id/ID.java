package io.github.goodees.cqrs.core.id;

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
 * Opaque identifier of aggregates and entities.
 * <p>Identifiers are compared and ordered by their string form. Every {@link IdProvider} has a distinguished
 * empty identifier, that is never generated.</p>
 */
public interface ID extends Comparable<ID> {

    boolean isEmpty();

    @Override
    String toString();

    @Override
    default int compareTo(ID other) {
        return toString().compareTo(other.toString());
    }
}
