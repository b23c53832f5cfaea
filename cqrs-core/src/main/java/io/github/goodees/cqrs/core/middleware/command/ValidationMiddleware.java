package io.github.goodees.cqrs.core.middleware.command;

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
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.CommandHandlerMiddleware;
import io.github.goodees.cqrs.core.id.ID;

import java.util.Objects;

/**
 * Validates {@link ValidatableCommand}s before passing them on. A failing validation is propagated as thrown
 * by the validator, and the command does not reach the wrapped handler.
 */
public class ValidationMiddleware implements CommandHandlerMiddleware {

    @Override
    public CommandHandler apply(CommandHandler handler) {
        return (ctx, command) -> {
            if (command instanceof ValidatableCommand) {
                ((ValidatableCommand) command).validate();
            }
            if (command instanceof CommandWithValidation) {
                command = ((CommandWithValidation) command).command();
            }
            handler.handleCommand(ctx, command);
        };
    }

    /**
     * Attach validation to a command. The wrapped handler receives the original command.
     * @param command the command
     * @param validator the validation
     * @return validatable command
     */
    public static ValidatableCommand commandWithValidation(Command command, Validator validator) {
        return new CommandWithValidation(command, validator);
    }

    @FunctionalInterface
    public interface Validator {
        void validate() throws Exception;
    }

    static final class CommandWithValidation implements ValidatableCommand {
        private final Command command;
        private final Validator validator;

        CommandWithValidation(Command command, Validator validator) {
            this.command = Objects.requireNonNull(command, "Command must be specified");
            this.validator = Objects.requireNonNull(validator, "Validator must be specified");
        }

        Command command() {
            return command;
        }

        @Override
        public void validate() throws Exception {
            validator.validate();
        }

        @Override
        public ID aggregateId() {
            return command.aggregateId();
        }

        @Override
        public String aggregateType() {
            return command.aggregateType();
        }

        @Override
        public String commandType() {
            return command.commandType();
        }
    }
}
