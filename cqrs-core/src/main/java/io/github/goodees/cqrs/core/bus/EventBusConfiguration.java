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

import java.util.concurrent.ExecutorService;

public interface EventBusConfiguration {
    String busName();

    /**
     * The thread pool handlers run on. Every registered handler occupies one thread of the pool while the bus is
     * open, so the pool must not be smaller than number of handlers.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Whether the bus should shut the executor service down when it is closed.
     * @return true if the executor is owned by the bus
     */
    boolean shutdownExecutorOnClose();

    /**
     * The group of buses sharing delivery queues. Handlers of same type within the group compete for events.
     * @return the group
     */
    EventBusGroup group();

    int errorQueueCapacity();

    /**
     * How often handler tasks check for cancellation when there are no events.
     * @return interval in milliseconds
     */
    long pollIntervalMillis();
}
