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
import io.github.goodees.cqrs.core.dispatch.KeyedDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Delivers events of each aggregate in order of their versions, starting at version 1.
 * <p>Every wrapped handler gets an intake queue, drained by a dedicated sorting task. Events are ordered per
 * namespace and aggregate: an event arriving ahead of its predecessors waits until the gap closes, events of other
 * aggregates are not held up. Ready events are handed to the wrapped handler one at a time per aggregate, different
 * aggregates concurrently. Events of versions already delivered are dropped as duplicates. Events without aggregate
 * bypass ordering.</p>
 * <p>With a gap timeout, a gap left open for longer than the timeout is reported to {@link #errors()} and skipped.
 * Without it, the aggregate waits for the missing version indefinitely.</p>
 * <p>The intake queue is unbounded. The executor must be able to run one sorting task per wrapped handler besides
 * the delivery tasks. Cancelling the context stops the sorting.</p>
 */
public class SequencerMiddleware implements EventHandlerMiddleware {
    public static final String HANDLER_TYPE_SUFFIX = "-sequencer";
    private static final long POLL_INTERVAL_MILLIS = 50;

    private final Context ctx;
    private final ExecutorService executor;
    private final Duration gapTimeout;
    private final ErrorQueue<SequencerException> errors = new ErrorQueue<>();

    public SequencerMiddleware(Context ctx, ExecutorService executor) {
        this(ctx, executor, null);
    }

    /**
     * Create sequencer with gap timeout.
     * @param ctx context of the sequencer, cancel it to stop sorting
     * @param executor the executor for sorting and delivery
     * @param gapTimeout how long to wait for missing version, null to wait forever
     */
    public SequencerMiddleware(Context ctx, ExecutorService executor, Duration gapTimeout) {
        this.ctx = Objects.requireNonNull(ctx, "Context must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        this.gapTimeout = gapTimeout;
    }

    @Override
    public EventHandler apply(EventHandler handler) {
        SequencedHandler sequenced = new SequencedHandler(handler);
        executor.execute(sequenced::sort);
        return sequenced;
    }

    public ErrorQueue<SequencerException> errors() {
        return errors;
    }

    class SequencedHandler implements EventHandler {
        private final EventHandler handler;
        private final String handlerType;
        private final Logger logger;
        private final BlockingQueue<Arrival> intake = new LinkedBlockingQueue<>();
        private final KeyedDispatcher<String> dispatcher;
        // owned by the sorting task
        private final Map<String, AggregateQueue> queues = new HashMap<>();

        SequencedHandler(EventHandler handler) {
            this.handler = handler;
            this.handlerType = handler.handlerType() + HANDLER_TYPE_SUFFIX;
            this.logger = LoggerFactory.getLogger(SequencerMiddleware.class.getName() + "." + handlerType);
            this.dispatcher = new KeyedDispatcher<>(handlerType, executor);
        }

        @Override
        public String handlerType() {
            return handlerType;
        }

        @Override
        public void handleEvent(Context eventCtx, Event event) {
            intake.add(new Arrival(eventCtx, event));
        }

        void sort() {
            try {
                while (!ctx.isCancelled()) {
                    Arrival arrival = intake.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                    if (arrival != null) {
                        accept(arrival);
                    }
                    if (gapTimeout != null) {
                        skipExpiredGaps();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            logger.info("Sequencer stopped, {} events not sorted", intake.size());
        }

        private void accept(Arrival arrival) {
            Event event = arrival.event;
            if (event.aggregateId().isEmpty() || event.version() <= 0) {
                executor.execute(() -> deliver(arrival));
                return;
            }
            String key = arrival.ctx.namespace() + "/" + event.aggregateId();
            AggregateQueue queue = queues.computeIfAbsent(key, AggregateQueue::new);
            if (event.version() < queue.nextVersion || queue.isBuffered(event.version())) {
                logger.debug("Dropping duplicate event {} of {}", event, key);
                return;
            }
            queue.buffer.add(arrival);
            queue.release();
        }

        private void skipExpiredGaps() {
            long now = System.nanoTime();
            for (AggregateQueue queue : queues.values()) {
                if (queue.gapSince != 0 && now - queue.gapSince > gapTimeout.toNanos()) {
                    Arrival next = queue.buffer.peek();
                    SequencerException error = SequencerException.gapTimeout(queue.key, queue.nextVersion,
                            next.event);
                    logger.warn(error.getMessage());
                    errors.publish(error);
                    queue.nextVersion = next.event.version();
                    queue.gapSince = 0;
                    queue.release();
                }
            }
        }

        private void deliver(Arrival arrival) {
            try {
                handler.handleEvent(arrival.ctx, arrival.event);
            } catch (Throwable e) {
                SequencerException error = SequencerException.handlerFailed(handler.handlerType(), arrival.event, e);
                logger.error(error.getMessage(), e);
                errors.publish(error);
            }
        }

        class AggregateQueue {
            private final String key;
            private final PriorityQueue<Arrival> buffer = new PriorityQueue<>(
                    Comparator.comparingInt(a -> a.event.version()));
            private int nextVersion = 1;
            private long gapSince;

            AggregateQueue(String key) {
                this.key = key;
            }

            boolean isBuffered(int version) {
                for (Arrival arrival : buffer) {
                    if (arrival.event.version() == version) {
                        return true;
                    }
                }
                return false;
            }

            void release() {
                while (!buffer.isEmpty() && buffer.peek().event.version() == nextVersion) {
                    Arrival arrival = buffer.poll();
                    nextVersion++;
                    dispatcher.dispatch(key, () -> deliver(arrival));
                }
                if (buffer.isEmpty()) {
                    gapSince = 0;
                } else if (gapSince == 0) {
                    gapSince = System.nanoTime();
                    logger.debug("Events of {} wait for version {}", key, nextVersion);
                }
            }
        }
    }

    static final class Arrival {
        final Context ctx;
        final Event event;

        Arrival(Context ctx, Event event) {
            this.ctx = ctx;
            this.event = event;
        }
    }
}
