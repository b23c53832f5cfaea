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
 * Strategy for generating and parsing identifiers.
 */
public interface IdProvider {

    ID newId();

    ID emptyId();

    /**
     * Parse string form of an identifier. Empty string yields the empty identifier.
     * @param value string form
     * @return the identifier
     * @throws IllegalArgumentException when value is not valid identifier
     */
    ID parse(String value);
}
