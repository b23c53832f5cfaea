package io.github.goodees.cqrs.core.middleware.event;

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

import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.ErrorQueue;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import io.github.goodees.cqrs.core.EventHandlerMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Producer of recurring synthetic events.
 * <p>As a middleware it does not change the handlers it is applied to, it only remembers them as receivers of
 * scheduled events. Every scheduled entry has its own timer loop; cancelling the context of an entry stops just
 * that entry, cancelling the context of the scheduler stops all of them.</p>
 */
public class EventScheduler implements EventHandlerMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(EventScheduler.class);

    private final Context ctx;
    private final ScheduledExecutorService scheduler;
    private final List<EventHandler> handlers = new CopyOnWriteArrayList<>();
    private final ErrorQueue<SchedulerException> errors = new ErrorQueue<>();

    public EventScheduler(Context ctx, ScheduledExecutorService scheduler) {
        this.ctx = Objects.requireNonNull(ctx, "Context must be specified");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must be specified");
    }

    @Override
    public EventHandler apply(EventHandler handler) {
        handlers.add(handler);
        return handler;
    }

    /**
     * Schedule recurring event.
     * @param entryCtx context of the entry, passed to handlers; cancel it to stop the entry
     * @param schedule when to create events
     * @param eventFactory creates event for planned time of the run
     * @throws CancellationException when the scheduler is cancelled
     */
    public void scheduleEvent(Context entryCtx, Schedule schedule, Function<Instant, Event> eventFactory) {
        if (ctx.isCancelled()) {
            throw new CancellationException("Event scheduler is cancelled");
        }
        Entry entry = new Entry(entryCtx, schedule, eventFactory);
        entryCtx.onCancel(entry.cancelCallback);
        ctx.onCancel(entry.cancelCallback);
        entry.scheduleNext();
    }

    public ErrorQueue<SchedulerException> errors() {
        return errors;
    }

    class Entry implements Runnable {
        private final Context entryCtx;
        private final Schedule schedule;
        private final Function<Instant, Event> eventFactory;
        final Runnable cancelCallback = this::cancel;
        private Instant planned = Instant.now();
        private ScheduledFuture<?> future;
        private boolean cancelled;

        Entry(Context entryCtx, Schedule schedule, Function<Instant, Event> eventFactory) {
            this.entryCtx = entryCtx;
            this.schedule = schedule;
            this.eventFactory = eventFactory;
        }

        synchronized void scheduleNext() {
            if (cancelled) {
                return;
            }
            if (entryCtx.isCancelled() || ctx.isCancelled()) {
                cancel();
                return;
            }
            Instant next = schedule.next(planned);
            if (next == null) {
                logger.info("Schedule finished, no more runs after {}", planned);
                cancelled = true;
                release();
                return;
            }
            planned = next;
            long delay = Math.max(0, Duration.between(Instant.now(), next).toMillis());
            future = scheduler.schedule(this, delay, TimeUnit.MILLISECONDS);
        }

        @Override
        public void run() {
            Instant runTime;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                runTime = planned;
            }
            try {
                Event event;
                try {
                    event = eventFactory.apply(runTime);
                } catch (Throwable e) {
                    logger.error("Could not create scheduled event for {}", runTime, e);
                    errors.publish(SchedulerException.eventCreationFailed(runTime, e));
                    return;
                }
                for (EventHandler handler : handlers) {
                    try {
                        handler.handleEvent(entryCtx, event);
                    } catch (Throwable e) {
                        logger.error("Scheduled event {} failed in handler {}", event, handler.handlerType(), e);
                        errors.publish(SchedulerException.handlerFailed(handler.handlerType(), event, runTime, e));
                    }
                }
            } finally {
                scheduleNext();
            }
        }

        synchronized void cancel() {
            if (!cancelled) {
                cancelled = true;
                if (future != null) {
                    future.cancel(false);
                }
                release();
                logger.debug("Schedule entry cancelled");
            }
        }

        private void release() {
            entryCtx.removeOnCancel(cancelCallback);
            ctx.removeOnCancel(cancelCallback);
        }
    }
}
