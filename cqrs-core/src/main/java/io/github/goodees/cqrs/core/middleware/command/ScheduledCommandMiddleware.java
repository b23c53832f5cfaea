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
import io.github.goodees.cqrs.core.CommandException;
import io.github.goodees.cqrs.core.CommandHandler;
import io.github.goodees.cqrs.core.CommandHandlerMiddleware;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.ErrorQueue;
import io.github.goodees.cqrs.core.id.ID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delays commands created with {@link #commandWithExecuteTime(Command, Instant)} until their execution time.
 * Other commands, and commands whose time has passed, are handled immediately.
 * <p>Delayed commands run on the scheduler, their failures are published to {@link #errors()}. Cancelling the
 * context of the middleware drops all pending commands.</p>
 */
public class ScheduledCommandMiddleware implements CommandHandlerMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledCommandMiddleware.class);

    private final Context ctx;
    private final ScheduledExecutorService scheduler;
    private final ErrorQueue<CommandException> errors = new ErrorQueue<>();
    private final Set<PendingCommand> pending = ConcurrentHashMap.newKeySet();

    public ScheduledCommandMiddleware(Context ctx, ScheduledExecutorService scheduler) {
        this.ctx = Objects.requireNonNull(ctx, "Context must be specified");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must be specified");
        ctx.onCancel(this::cancelPending);
    }

    @Override
    public CommandHandler apply(CommandHandler handler) {
        return (commandCtx, command) -> {
            if (!(command instanceof ScheduledCommand)) {
                handler.handleCommand(commandCtx, command);
                return;
            }
            ScheduledCommand scheduled = (ScheduledCommand) command;
            long delay = Duration.between(Instant.now(), scheduled.executeAt).toMillis();
            if (delay <= 0) {
                handler.handleCommand(commandCtx, scheduled.command);
                return;
            }
            if (ctx.isCancelled()) {
                throw new CancellationException("Command scheduler is cancelled");
            }
            schedule(handler, commandCtx, scheduled, delay);
        };
    }

    private void schedule(CommandHandler handler, Context commandCtx, ScheduledCommand scheduled, long delay) {
        PendingCommand pendingCommand = new PendingCommand(handler, commandCtx, scheduled);
        pending.add(pendingCommand);
        // cancelPending might have iterated before the add
        if (ctx.isCancelled() && pending.remove(pendingCommand)) {
            throw new CancellationException("Command scheduler is cancelled");
        }
        pendingCommand.future = scheduler.schedule(pendingCommand, delay, TimeUnit.MILLISECONDS);
        logger.debug("Command {} scheduled at {}", scheduled.commandType(), scheduled.executeAt);
    }

    private void cancelPending() {
        int cancelled = 0;
        for (PendingCommand pendingCommand : pending) {
            if (pending.remove(pendingCommand)) {
                pendingCommand.cancel();
                cancelled++;
            }
        }
        logger.info("Cancelled {} scheduled commands", cancelled);
    }

    public ErrorQueue<CommandException> errors() {
        return errors;
    }

    /**
     * Number of commands waiting for their execution time.
     * @return count of pending commands
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Mark a command for execution at given time.
     * @param command the command
     * @param executeAt time of execution
     * @return the command wrapped with execution time
     */
    public static Command commandWithExecuteTime(Command command, Instant executeAt) {
        return new ScheduledCommand(command, executeAt);
    }

    class PendingCommand implements Runnable {
        private final CommandHandler handler;
        private final Context commandCtx;
        private final ScheduledCommand scheduled;
        private volatile ScheduledFuture<?> future;

        PendingCommand(CommandHandler handler, Context commandCtx, ScheduledCommand scheduled) {
            this.handler = handler;
            this.commandCtx = commandCtx;
            this.scheduled = scheduled;
        }

        @Override
        public void run() {
            if (!pending.remove(this)) {
                return;
            }
            try {
                handler.handleCommand(commandCtx, scheduled.command);
            } catch (Throwable e) {
                logger.error("Scheduled command {} failed", scheduled.commandType(), e);
                errors.publish(CommandException.scheduledFailed(scheduled.command, e));
            }
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }

    static final class ScheduledCommand implements Command {
        private final Command command;
        private final Instant executeAt;

        ScheduledCommand(Command command, Instant executeAt) {
            this.command = Objects.requireNonNull(command, "Command must be specified");
            this.executeAt = Objects.requireNonNull(executeAt, "Execution time must be specified");
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
