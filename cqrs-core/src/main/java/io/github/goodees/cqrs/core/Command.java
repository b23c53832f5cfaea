package io.github.goodees.cqrs.core;

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

import io.github.goodees.cqrs.core.id.ID;

/**
 * Request to change state of single aggregate. Besides addressing the aggregate, a command carries arbitrary
 * payload in its fields.
 *
 * @see Commands#checkCommand(Command)
 */
public interface Command {
    ID aggregateId();

    String aggregateType();

    /**
     * Type of the command, non-empty and globally unique. Key into {@link io.github.goodees.cqrs.core.registry.CommandRegistry}.
     * @return command type
     */
    String commandType();
}
