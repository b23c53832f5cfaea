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
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Entity;

/**
 * Unit of consistency for command handling, identified by its type and id.
 */
public interface Aggregate extends Entity {

    String aggregateType();

    /**
     * Handle a command. An event sourced aggregate must not change its state here, it only appends events that
     * are later applied.
     * @param ctx the context
     * @param command the command
     * @throws Exception when the command is not accepted
     */
    void handleCommand(Context ctx, Command command) throws Exception;
}
