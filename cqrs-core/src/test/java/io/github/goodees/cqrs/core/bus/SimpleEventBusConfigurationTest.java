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
import org.junit.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.Assert.*;

public class SimpleEventBusConfigurationTest {
    ExecutorService executorService = Executors.newSingleThreadExecutor();

    @Test
    public void standalone_bus_owns_its_executor_and_group() {
        SimpleEventBusConfiguration conf = new SimpleEventBusConfiguration("test");
        assertEquals("test", conf.busName());
        assertEquals("test", conf.group().name());
        assertTrue(conf.shutdownExecutorOnClose());
        assertEquals(ErrorQueue.DEFAULT_CAPACITY, conf.errorQueueCapacity());
        assertEquals(SimpleEventBusConfiguration.DEFAULT_POLL_INTERVAL_MILLIS, conf.pollIntervalMillis());
        conf.executorService().shutdown();
    }

    @Test
    public void provided_executor_is_not_shut_down() {
        EventBusGroup group = new EventBusGroup("shared");
        SimpleEventBusConfiguration conf = new SimpleEventBusConfiguration("test", executorService, group, 5, 10);
        assertFalse(conf.shutdownExecutorOnClose());
        assertSame(group, conf.group());
        assertEquals(5, conf.errorQueueCapacity());
        assertEquals(10, conf.pollIntervalMillis());
    }

    @Test(expected = IllegalArgumentException.class)
    public void error_queue_capacity_must_be_positive() {
        new SimpleEventBusConfiguration("test", executorService, new EventBusGroup("g"), 0, 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void poll_interval_must_be_positive() {
        new SimpleEventBusConfiguration("test", executorService, new EventBusGroup("g"), 10, 0);
    }

    @Test(expected = NullPointerException.class)
    public void name_is_required() {
        new SimpleEventBusConfiguration(null, executorService, new EventBusGroup("g"), 10, 10);
    }
}
