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
import io.github.goodees.cqrs.core.EventHandler;

import java.util.Objects;

/**
 * Event handler running a {@link Saga} with a command handler to issue commands to.
 */
public class SagaEventHandler implements EventHandler {
    private final Saga saga;
    private final CommandHandler commandHandler;

    public SagaEventHandler(Saga saga, CommandHandler commandHandler) {
        this.saga = Objects.requireNonNull(saga, "Saga must be specified");
        this.commandHandler = Objects.requireNonNull(commandHandler, "Command handler must be specified");
    }

    @Override
    public String handlerType() {
        return saga.sagaType();
    }

    @Override
    public void handleEvent(Context ctx, Event event) throws Exception {
        saga.runSaga(ctx, event, commandHandler);
    }
}
