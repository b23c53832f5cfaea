package io.github.goodees.cqrs.core.handler;

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

import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Event;

/**
 * Process reacting to events by issuing commands, possibly to other aggregates.
 * @see SagaEventHandler
 */
public interface Saga {

    String sagaType();

    void runSaga(Context ctx, Event event, CommandHandler commandHandler) throws Exception;
}
