package io.github.goodees.cqrs.core.dispatch;

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

import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous task dispatcher. Guarantees to run at most one task at time per key, in order of submission.
 * Tasks of different keys run concurrently. Internally, the dispatcher maintains a queue of tasks for every key.
 * Whenever a new task is submitted, the dispatcher checks if it is not running a task of that key already.
 *
 * @param <K> type of key
 */
public class KeyedDispatcher<K> {

    private final String name;
    private final Executor executor;
    private final ConcurrentMap<K, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public KeyedDispatcher(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + name);
    }

    /**
     * Schedule a task. The task is added to key's mailbox, and that mailbox is scheduled for dequeue.
     * Exceptions thrown by the task are logged and do not prevent execution of subsequent tasks.
     * @param key the key
     * @param task the task
     */
    public void dispatch(K key, Runnable task) {
        mailboxes.computeIfAbsent(key, Mailbox::new).enqueue(task);
    }

    /**
     * Number of tasks waiting for execution for given key, not counting the running one.
     * @param key the key
     * @return number of queued tasks
     */
    public int queued(K key) {
        Mailbox mailbox = mailboxes.get(key);
        return mailbox == null ? 0 : mailbox.queue.size();
    }

    public String name() {
        return name;
    }

    /**
     * Queue of tasks for single key. At this level we're handling the concurrency between adding new task,
     * and executing only single task.
     */
    class Mailbox implements Runnable {
        private final K key;
        private final Deque<Runnable> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();

        Mailbox(K key) {
            this.key = key;
        }

        void enqueue(Runnable task) {
            queue.add(task);
            if (canStartProcessing()) {
                executor.execute(this);
            }
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", key);
                return true;
            } else {
                logger.debug("Will not start processing the queue for {}, {} tasks enqueued during current execution",
                        key, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Run single task, then resubmit itself. This way even tasks that arrive during processing will be
         * processed, without holding the thread for the whole queue.
         */
        @Override
        public void run() {
            Runnable task = nextTask();
            if (task != null) {
                try {
                    task.run();
                } catch (Throwable e) {
                    // the mailbox must be resubmitted whatever the task threw, or the key stays blocked
                    logger.error("Task for {} failed", key, e);
                }
                executor.execute(this);
            }
        }

        private Runnable nextTask() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Runnable task = queue.poll();
                if (task == null) {
                    // A task might have been queued between previous line, and this decision point.
                    // Therefore we check, if canStartProcessing was called in between, and try polling the
                    // queue again, or we guarantee, that canStartProcessing will return true past the next statement.
                    if (canStopProcessing(enqueues)) {
                        logger.debug("Stopping processing of task queue for {}", key);
                        return null;
                    }
                } else {
                    return task;
                }
            }
        }
    }
}
