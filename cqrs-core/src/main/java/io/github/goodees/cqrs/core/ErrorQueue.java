package io.github.goodees.cqrs.core;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue of errors raised by asynchronous processing. Publishing never blocks: when the queue is full,
 * the oldest error is dropped to make room for the new one.
 *
 * @param <E> type of errors
 */
public class ErrorQueue<E extends Exception> {
    public static final int DEFAULT_CAPACITY = 100;

    private static final Logger logger = LoggerFactory.getLogger(ErrorQueue.class);

    private final BlockingDeque<E> queue;
    private final AtomicLong dropped = new AtomicLong();

    public ErrorQueue() {
        this(DEFAULT_CAPACITY);
    }

    public ErrorQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, was " + capacity);
        }
        this.queue = new LinkedBlockingDeque<>(capacity);
    }

    /**
     * Publish an error, dropping the oldest one when full.
     * @param error the error
     */
    public void publish(E error) {
        while (!queue.offerLast(error)) {
            E oldest = queue.pollFirst();
            if (oldest != null) {
                dropped.incrementAndGet();
                logger.warn("Error queue is full, dropping {}", oldest.toString());
            }
        }
    }

    /**
     * Take the oldest error.
     * @return the error or null when there is none
     */
    public E poll() {
        return queue.pollFirst();
    }

    public E poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.pollFirst(timeout, unit);
    }

    public List<E> drain() {
        List<E> result = new ArrayList<>();
        queue.drainTo(result);
        return result;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Number of errors dropped since creation of the queue.
     * @return count of dropped errors
     */
    public long droppedCount() {
        return dropped.get();
    }
}
