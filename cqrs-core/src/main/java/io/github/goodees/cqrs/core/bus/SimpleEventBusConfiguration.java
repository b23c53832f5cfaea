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

import io.github.goodees.cqrs.core.ErrorQueue;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class SimpleEventBusConfiguration implements EventBusConfiguration {
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 50;

    private final String name;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final EventBusGroup group;
    private final int errorQueueCapacity;
    private final long pollIntervalMillis;

    /**
     * Create event bus configuration.
     * @param name the name of the bus
     * @param executorService executor service to run handlers on
     * @param group group of buses sharing delivery queues
     * @param errorQueueCapacity capacity of error queue
     * @param pollIntervalMillis interval for handler tasks to check for cancellation
     */
    public SimpleEventBusConfiguration(String name, ExecutorService executorService, EventBusGroup group,
                                       int errorQueueCapacity, long pollIntervalMillis) {
        this(name, executorService, false, group, errorQueueCapacity, pollIntervalMillis);
    }

    /**
     * Create configuration of a bus in a group, running handlers on its own cached thread pool.
     * @param name the name of the bus
     * @param group group of buses sharing delivery queues
     */
    public SimpleEventBusConfiguration(String name, EventBusGroup group) {
        this(name, Executors.newCachedThreadPool(), true, group, ErrorQueue.DEFAULT_CAPACITY,
                DEFAULT_POLL_INTERVAL_MILLIS);
    }

    /**
     * Create configuration of standalone bus, running handlers on its own cached thread pool.
     * @param name the name of the bus
     */
    public SimpleEventBusConfiguration(String name) {
        this(name, new EventBusGroup(name));
    }

    private SimpleEventBusConfiguration(String name, ExecutorService executorService, boolean ownsExecutor,
                                        EventBusGroup group, int errorQueueCapacity, long pollIntervalMillis) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.ownsExecutor = ownsExecutor;
        this.group = Objects.requireNonNull(group, "Event bus group must be specified");
        if (errorQueueCapacity < 1) {
            throw new IllegalArgumentException("Error queue capacity must be positive");
        }
        if (pollIntervalMillis < 1) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.errorQueueCapacity = errorQueueCapacity;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    @Override
    public String busName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public boolean shutdownExecutorOnClose() {
        return ownsExecutor;
    }

    @Override
    public EventBusGroup group() {
        return group;
    }

    @Override
    public int errorQueueCapacity() {
        return errorQueueCapacity;
    }

    @Override
    public long pollIntervalMillis() {
        return pollIntervalMillis;
    }
}
