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

import io.github.goodees.cqrs.core.Command;

import java.util.function.Supplier;

/**
 * Factories of commands, keyed by command type.
 */
public class CommandRegistry extends FactoryRegistry<Supplier<? extends Command>> {
    private static final CommandRegistry DEFAULT = new CommandRegistry();

    public CommandRegistry() {
        super("command");
    }

    public static CommandRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Register a command factory. The type is taken from the command the factory creates.
     * @param factory the factory creating empty commands
     * @throws RegistrationException if the factory yields null, the type is empty or already registered
     */
    public void register(Supplier<? extends Command> factory) throws RegistrationException {
        Command command = factory.get();
        if (command == null) {
            throw RegistrationException.nullValue(kind());
        }
        doRegister(command.commandType(), factory);
    }

    public Command create(String commandType) throws TypeNotRegisteredException {
        return factory(commandType).get();
    }
}
