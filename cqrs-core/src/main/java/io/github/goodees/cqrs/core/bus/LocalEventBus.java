package io.github.goodees.cqrs.core.bus;

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

import io.github.goodees.cqrs.core.CancellableContext;
import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.ErrorQueue;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * In-process event bus. Every registered handler gets a task on the configured executor, consuming the delivery
 * queue of its handler type in the bus group.
 * <p>Delivery is best effort: events published while no handler of a type is registered are not delivered to
 * handlers registered later, and events still queued when the bus is closed are dropped.</p>
 */
public class LocalEventBus implements EventBus {
    public static final String HANDLER_TYPE = "eventbus";

    private final EventBusConfiguration conf;
    private final Logger logger;
    private final CancellableContext busContext;
    private final ErrorQueue<EventBusException> errors;
    private final ConcurrentMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private final List<Future<?>> workers = new CopyOnWriteArrayList<>();

    public LocalEventBus(EventBusConfiguration conf) {
        this(Context.background(), conf);
    }

    /**
     * Create event bus, that closes when given context is cancelled. Such close does not wait for the handlers,
     * use {@link #close()} for that.
     * @param ctx parent context of the bus
     * @param conf the configuration
     */
    public LocalEventBus(Context ctx, EventBusConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.busName());
        this.busContext = ctx.withCancel();
        this.errors = new ErrorQueue<>(conf.errorQueueCapacity());
    }

    @Override
    public String handlerType() {
        return HANDLER_TYPE;
    }

    /**
     * Publish an event to all handlers of the bus group. Returns as soon as the event is queued for delivery.
     * @param ctx context of the publisher, passed to handlers
     * @param event the event
     * @throws EventBusException when the bus is closed
     */
    @Override
    public void handleEvent(Context ctx, Event event) throws EventBusException {
        if (busContext.isCancelled()) {
            throw EventBusException.closed(conf.busName());
        }
        conf.group().publish(ctx, event);
    }

    @Override
    public void addHandler(Context ctx, EventMatcher matcher, EventHandler handler) throws EventBusException {
        if (matcher == null) {
            throw EventBusException.missingMatcher();
        }
        if (handler == null) {
            throw EventBusException.missingHandler();
        }
        if (busContext.isCancelled()) {
            throw EventBusException.closed(conf.busName());
        }
        Registration registration = new Registration(ctx, matcher, handler);
        if (registrations.putIfAbsent(registration.handlerType, registration) != null) {
            throw EventBusException.alreadyAdded(registration.handlerType);
        }
        registration.queue = conf.group().join(registration.handlerType);
        workers.add(conf.executorService().submit(registration));
        logger.debug("Added handler {}", registration.handlerType);
    }

    @Override
    public ErrorQueue<EventBusException> errors() {
        return errors;
    }

    @Override
    public void close() throws InterruptedException {
        busContext.cancel();
        for (Future<?> worker : workers) {
            try {
                worker.get();
            } catch (ExecutionException e) {
                logger.error("Handler task failed", e.getCause());
            }
        }
        workers.clear();
        if (conf.shutdownExecutorOnClose()) {
            conf.executorService().shutdown();
            conf.executorService().awaitTermination(conf.pollIntervalMillis() * 2, TimeUnit.MILLISECONDS);
        }
        logger.info("Event bus {} closed", conf.busName());
    }

    public boolean isClosed() {
        return busContext.isCancelled();
    }

    class Registration implements Runnable {
        private final Context ctx;
        private final EventMatcher matcher;
        private final EventHandler handler;
        private final String handlerType;
        private volatile BlockingQueue<EventBusGroup.Delivery> queue;

        Registration(Context ctx, EventMatcher matcher, EventHandler handler) {
            this.ctx = ctx;
            this.matcher = matcher;
            this.handler = handler;
            this.handlerType = handler.handlerType();
        }

        @Override
        public void run() {
            try {
                while (!stopped()) {
                    EventBusGroup.Delivery delivery = queue.poll(conf.pollIntervalMillis(), TimeUnit.MILLISECONDS);
                    if (delivery != null) {
                        deliver(delivery);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Handler {} interrupted", handlerType);
            } finally {
                conf.group().leave(handlerType);
                registrations.remove(handlerType, this);
                logger.debug("Handler {} stopped", handlerType);
            }
        }

        private boolean stopped() {
            return busContext.isCancelled() || ctx.isCancelled();
        }

        private void deliver(EventBusGroup.Delivery delivery) {
            try {
                if (matcher.match(delivery.event)) {
                    handler.handleEvent(delivery.ctx, delivery.event);
                }
            } catch (Throwable e) {
                EventBusException error = EventBusException.handlerFailed(handlerType, delivery.event,
                        delivery.ctx, e);
                logger.error(error.getMessage(), e);
                errors.publish(error);
            }
        }
    }
}
