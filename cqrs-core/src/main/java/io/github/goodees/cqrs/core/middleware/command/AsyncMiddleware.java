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

import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.CommandHandlerMiddleware;
import io.github.goodees.cqrs.core.ErrorQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Handles commands on an executor, returning to the issuer immediately. Failures are published to
 * {@link #errors()}.
 */
public class AsyncMiddleware implements CommandHandlerMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(AsyncMiddleware.class);

    private final Executor executor;
    private final ErrorQueue<CommandException> errors = new ErrorQueue<>();

    public AsyncMiddleware(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
    }

    @Override
    public CommandHandler apply(CommandHandler handler) {
        return (ctx, command) -> executor.execute(() -> {
            try {
                handler.handleCommand(ctx, command);
            } catch (Throwable e) {
                logger.error("Async command {} failed", command.commandType(), e);
                errors.publish(CommandException.asyncFailed(command, e));
            }
        });
    }

    public ErrorQueue<CommandException> errors() {
        return errors;
    }
}
