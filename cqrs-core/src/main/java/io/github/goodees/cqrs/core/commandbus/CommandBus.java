package io.github.goodees.cqrs.core.commandbus;

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
import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.Context;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Command handler routing commands to handlers by command type.
 */
public class CommandBus implements CommandHandler {
    private final ConcurrentMap<String, CommandHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void handleCommand(Context ctx, Command command) throws Exception {
        CommandHandler handler = handlers.get(command.commandType());
        if (handler == null) {
            throw CommandException.handlerNotFound(command);
        }
        handler.handleCommand(ctx, command);
    }

    /**
     * Route commands of given types to a handler.
     * @param handler the handler
     * @param commandTypes types of commands
     * @throws CommandException if any of the types already has a handler; no type is routed then
     */
    public synchronized void setHandler(CommandHandler handler, String... commandTypes) throws CommandException {
        Objects.requireNonNull(handler, "Handler must be specified");
        for (String commandType : commandTypes) {
            if (handlers.containsKey(commandType)) {
                throw CommandException.handlerAlreadySet(commandType);
            }
        }
        for (String commandType : commandTypes) {
            handlers.put(commandType, handler);
        }
    }

    public boolean hasHandler(String commandType) {
        return handlers.containsKey(commandType);
    }
}
