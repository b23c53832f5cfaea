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

import java.util.Objects;

/**
 * Rejects commands for aggregates that are handling another command. Failing fast instead of waiting makes
 * concurrent writers visible to the issuer.
 */
public class LockMiddleware implements CommandHandlerMiddleware {
    private final Lock lock;

    public LockMiddleware(Lock lock) {
        this.lock = Objects.requireNonNull(lock, "Lock must be specified");
    }

    @Override
    public CommandHandler apply(CommandHandler handler) {
        return (ctx, command) -> {
            String key = command.aggregateId().toString();
            if (!lock.tryLock(key)) {
                throw CommandException.locked(command);
            }
            try {
                handler.handleCommand(ctx, command);
            } finally {
                lock.unlock(key);
            }
        };
    }
}
